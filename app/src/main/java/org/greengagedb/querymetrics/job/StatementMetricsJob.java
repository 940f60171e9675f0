/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *     http://www.apache.org/licenses/LICENSE-2.0
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.greengagedb.querymetrics.job;

import lombok.extern.slf4j.Slf4j;
import org.greengagedb.querymetrics.connection.DbConnectionProvider;
import org.greengagedb.querymetrics.events.EventSink;
import org.greengagedb.querymetrics.events.FullQueryTextEvent;
import org.greengagedb.querymetrics.events.PayloadAssembler;
import org.greengagedb.querymetrics.events.QueryMetricsPayload;
import org.greengagedb.querymetrics.metrics.CollectorMetrics;
import org.greengagedb.querymetrics.model.DatabaseVersion;
import org.greengagedb.querymetrics.statements.FullTextSampler;
import org.greengagedb.querymetrics.statements.NormalizedRow;
import org.greengagedb.querymetrics.statements.QueryNormalizer;
import org.greengagedb.querymetrics.statements.StatementColumn;
import org.greengagedb.querymetrics.statements.StatementDeltaEngine;
import org.greengagedb.querymetrics.statements.StatementRow;
import org.greengagedb.querymetrics.statements.StatementSnapshotFetcher;
import org.greengagedb.querymetrics.statements.StatementsUsageReporter;

import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

/**
 * One collection cycle of statement metrics for a single database.
 *
 * <p>Owns the state carried between cycles (discovered columns, previous counters and
 * the full text rate limit), so cycles of one job must not overlap. Nothing is emitted
 * unless every stage before {@link CycleStage#EMIT} succeeds; a cycle that fails or is
 * interrupted leaves no partial output.
 */
@Slf4j
public class StatementMetricsJob {

    private final String databaseName;
    private final DbConnectionProvider connectionProvider;
    private final StatementSnapshotFetcher fetcher;
    private final StatementsUsageReporter usageReporter;
    private final QueryNormalizer normalizer;
    private final StatementDeltaEngine deltaEngine;
    private final FullTextSampler sampler;
    private final PayloadAssembler assembler;
    private final EventSink eventSink;
    private final CollectorMetrics metrics;
    private final BooleanSupplier shutdownRequested;

    private volatile CycleStage stage = CycleStage.IDLE;

    public StatementMetricsJob(String databaseName,
                               DbConnectionProvider connectionProvider,
                               StatementSnapshotFetcher fetcher,
                               StatementsUsageReporter usageReporter,
                               QueryNormalizer normalizer,
                               StatementDeltaEngine deltaEngine,
                               FullTextSampler sampler,
                               PayloadAssembler assembler,
                               EventSink eventSink,
                               CollectorMetrics metrics,
                               BooleanSupplier shutdownRequested) {
        this.databaseName = databaseName;
        this.connectionProvider = connectionProvider;
        this.fetcher = fetcher;
        this.usageReporter = usageReporter;
        this.normalizer = normalizer;
        this.deltaEngine = deltaEngine;
        this.sampler = sampler;
        this.assembler = assembler;
        this.eventSink = eventSink;
        this.metrics = metrics;
        this.shutdownRequested = shutdownRequested;
    }

    /**
     * Run one cycle. Never throws; failures are logged and reported in the result.
     *
     * @param version server version, used for the payload and the count query; null when unknown
     */
    public CycleResult runCycle(DatabaseVersion version) {
        Instant start = Instant.now();
        metrics.incrementTotalCycles();
        try (Connection connection = connectionProvider.getConnection(databaseName)) {
            return collect(connection, version, start);
        } catch (Exception e) {
            log.error("Unable to collect statement metrics due to an error in stage {}: {}", stage, e.getMessage(), e);
            metrics.incrementTotalError();
            return CycleResult.failed(start, e);
        } finally {
            stage = CycleStage.IDLE;
            Duration duration = Duration.between(start, Instant.now());
            metrics.recordCycleDuration(duration);
            log.debug("Statement metrics cycle completed in {} ms", duration.toMillis());
        }
    }

    private CycleResult collect(Connection connection, DatabaseVersion version, Instant start) {
        if (!enter(CycleStage.DISCOVER_COLUMNS)) {
            return CycleResult.interrupted(start);
        }
        Optional<List<String>> columns = fetcher.selectableColumns(connection);
        if (columns.isEmpty()) {
            return CycleResult.noData(start);
        }

        if (!enter(CycleStage.FETCH)) {
            return CycleResult.interrupted(start);
        }
        List<StatementRow> rows = fetcher.fetch(connection, columns.get());
        if (rows.isEmpty()) {
            return CycleResult.noData(start);
        }
        usageReporter.report(connection, version);

        if (!enter(CycleStage.NORMALIZE)) {
            return CycleResult.interrupted(start);
        }
        List<NormalizedRow> normalized = normalizer.normalize(rows);
        if (normalized.isEmpty()) {
            return CycleResult.noData(start);
        }

        if (!enter(CycleStage.COMPUTE_DELTA)) {
            return CycleResult.interrupted(start);
        }
        List<NormalizedRow> deltas = deltaEngine.computeDeltas(
                normalized, metricColumns(normalized.get(0).row()), NormalizedRow::identity);
        metrics.setQueryRowsRaw(deltas.size());
        if (deltas.isEmpty()) {
            return CycleResult.noData(start);
        }

        if (!enter(CycleStage.SAMPLE_FULLTEXT)) {
            return CycleResult.interrupted(start);
        }
        List<FullQueryTextEvent> samples;
        try (Stream<FullQueryTextEvent> stream = sampler.sample(deltas, assembler::fullQueryTextEvent)) {
            samples = stream.toList();
        }

        if (!enter(CycleStage.ASSEMBLE)) {
            return CycleResult.interrupted(start);
        }
        QueryMetricsPayload payload = assembler.metricsPayload(deltas, version);

        if (!enter(CycleStage.EMIT)) {
            return CycleResult.interrupted(start);
        }
        samples.forEach(eventSink::submitQuerySample);
        eventSink.submitQueryMetrics(payload);
        metrics.incrementFullTextEvents(samples.size());
        log.debug("Emitted {} statement rows and {} full text samples", deltas.size(), samples.size());
        return CycleResult.emitted(start, deltas.size(), samples.size());
    }

    private boolean enter(CycleStage next) {
        if (shutdownRequested.getAsBoolean()) {
            log.debug("Shutdown requested, abandoning cycle before stage {}", next);
            return false;
        }
        stage = next;
        return true;
    }

    // metric columns actually selected this cycle
    private static Set<StatementColumn> metricColumns(StatementRow sample) {
        Set<StatementColumn> columns = EnumSet.noneOf(StatementColumn.class);
        for (StatementColumn column : StatementColumn.metrics()) {
            if (sample.has(column)) {
                columns.add(column);
            }
        }
        return columns;
    }

    public CycleStage getStage() {
        return stage;
    }

    public String getDatabaseName() {
        return databaseName;
    }
}
