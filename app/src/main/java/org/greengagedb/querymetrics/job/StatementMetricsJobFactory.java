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

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.greengagedb.querymetrics.common.Constants;
import org.greengagedb.querymetrics.common.MetricNameBuilder;
import org.greengagedb.querymetrics.config.StatementMetricsConfig;
import org.greengagedb.querymetrics.connection.DbConnectionProvider;
import org.greengagedb.querymetrics.events.EventSink;
import org.greengagedb.querymetrics.events.PayloadAssembler;
import org.greengagedb.querymetrics.metrics.CollectorMetrics;
import org.greengagedb.querymetrics.obfuscation.ObfuscatorOptions;
import org.greengagedb.querymetrics.obfuscation.SqlObfuscator;
import org.greengagedb.querymetrics.statements.FullTextSampler;
import org.greengagedb.querymetrics.statements.QueryNormalizer;
import org.greengagedb.querymetrics.statements.StatColumnDiscovery;
import org.greengagedb.querymetrics.statements.StatementDeltaEngine;
import org.greengagedb.querymetrics.statements.StatementQueries;
import org.greengagedb.querymetrics.statements.StatementQueryExecutor;
import org.greengagedb.querymetrics.statements.StatementSnapshotFetcher;
import org.greengagedb.querymetrics.statements.StatementsUsageReporter;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Wires a {@link StatementMetricsJob} from configuration.
 */
@Slf4j
@ApplicationScoped
public class StatementMetricsJobFactory {

    private final StatementMetricsConfig config;
    private final DbConnectionProvider connectionProvider;
    private final StatementQueryExecutor executor;
    private final SqlObfuscator obfuscator;
    private final EventSink eventSink;
    private final CollectorMetrics metrics;
    private final String agentVersion;

    @Inject
    public StatementMetricsJobFactory(StatementMetricsConfig config,
                                      DbConnectionProvider connectionProvider,
                                      StatementQueryExecutor executor,
                                      SqlObfuscator obfuscator,
                                      EventSink eventSink,
                                      CollectorMetrics metrics,
                                      @ConfigProperty(name = "quarkus.application.version", defaultValue = "unknown")
                                      String agentVersion) {
        this.config = config;
        this.connectionProvider = connectionProvider;
        this.executor = executor;
        this.obfuscator = obfuscator;
        this.eventSink = eventSink;
        this.metrics = metrics;
        this.agentVersion = agentVersion;
    }

    /**
     * @param shutdownRequested checked by the job before each stage
     * @throws IllegalArgumentException if the configured view name or limits are invalid
     */
    public StatementMetricsJob create(BooleanSupplier shutdownRequested) {
        String databaseName = config.dbname();
        StatementQueries queries = new StatementQueries(config.view(), config.maxRows());
        StatColumnDiscovery columnDiscovery = new StatColumnDiscovery(executor, queries);
        PayloadAssembler assembler = new PayloadAssembler(
                resolveHost(),
                agentVersion,
                globalTags(databaseName),
                config.effectiveCollectionInterval(),
                Clock.systemUTC());

        return new StatementMetricsJob(
                databaseName,
                connectionProvider,
                new StatementSnapshotFetcher(columnDiscovery, executor, queries, metrics, databaseName, config.dbStrict()),
                new StatementsUsageReporter(executor, queries, metrics),
                new QueryNormalizer(obfuscator, ObfuscatorOptions.from(config.obfuscator())),
                new StatementDeltaEngine(),
                new FullTextSampler(config.fullStatementTextCacheMaxSize(),
                        config.fullStatementTextSamplesPerHourPerQuery()),
                assembler,
                eventSink,
                metrics,
                shutdownRequested);
    }

    List<String> globalTags(String databaseName) {
        List<String> tags = new ArrayList<>(config.tags().orElse(List.of()));
        tags.add(MetricNameBuilder.tag(Constants.TAG_DB, databaseName));
        return tags;
    }

    String resolveHost() {
        return config.host().filter(host -> !host.isBlank()).orElseGet(() -> {
            try {
                return InetAddress.getLocalHost().getHostName();
            } catch (UnknownHostException e) {
                log.warn("Could not resolve local host name, reporting as 'localhost': {}", e.getMessage());
                return "localhost";
            }
        });
    }
}
