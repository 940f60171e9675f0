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
package org.greengagedb.querymetrics.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.greengagedb.querymetrics.common.Constants;
import org.greengagedb.querymetrics.common.MetricNameBuilder;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Self-monitoring metrics of the collector
 */
@Slf4j
@ApplicationScoped
public class CollectorMetrics {

    static final String NAME_STATEMENT_ERROR = MetricNameBuilder.build(Constants.SUBSYSTEM_STATEMENTS, "error");
    static final String NAME_QUERY_ROWS_RAW = MetricNameBuilder.build(Constants.SUBSYSTEM_STATEMENTS, "query_rows_raw");
    static final String NAME_STATEMENTS_COUNT = MetricNameBuilder.build(Constants.SUBSYSTEM_STATEMENTS, "pg_stat_statements_count");
    static final String NAME_STATEMENTS_MAX = MetricNameBuilder.build(Constants.SUBSYSTEM_STATEMENTS, "pg_stat_statements_max");
    static final String NAME_FULL_TEXT_EVENTS = MetricNameBuilder.build(Constants.SUBSYSTEM_STATEMENTS, "full_text_events");
    static final String NAME_TOTAL_CYCLES = MetricNameBuilder.build(Constants.SUBSYSTEM_STATEMENTS, "cycles");
    static final String NAME_TOTAL_ERROR = MetricNameBuilder.build(Constants.SUBSYSTEM_STATEMENTS, "cycle_errors");
    static final String NAME_CYCLE_DURATION = MetricNameBuilder.build(Constants.SUBSYSTEM_STATEMENTS, "cycle_duration_seconds");
    static final String NAME_UPTIME = MetricNameBuilder.build(Constants.SUBSYSTEM_COLLECTOR, "uptime_seconds");
    static final String NAME_UP = MetricNameBuilder.build("up");

    private final AtomicReference<Double> databaseUpGaugeValue = new AtomicReference<>(0.0);
    private final AtomicLong queryRowsRaw = new AtomicLong();
    private final AtomicLong statementsCount = new AtomicLong();
    private final AtomicLong statementsMax = new AtomicLong();
    private final Instant startTime = Instant.now();

    private final MeterRegistry registry;

    private Counter cycleCounter;
    private Counter cycleErrorCounter;
    private Counter fullTextEventCounter;
    private Timer cycleDurationTimer;

    @Inject
    public CollectorMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @PostConstruct
    public void init() {
        cycleCounter = Counter.builder(NAME_TOTAL_CYCLES)
                .description("Total number of collection cycles")
                .register(registry);
        cycleErrorCounter = Counter.builder(NAME_TOTAL_ERROR)
                .description("Total number of failed collection cycles")
                .register(registry);
        fullTextEventCounter = Counter.builder(NAME_FULL_TEXT_EVENTS)
                .description("Number of full query text events emitted")
                .register(registry);
        cycleDurationTimer = Timer.builder(NAME_CYCLE_DURATION)
                .description("Duration of the last collection cycle in seconds")
                .register(registry);
        Gauge.builder(NAME_QUERY_ROWS_RAW, queryRowsRaw::get)
                .description("Number of statement rows with a computed delta in the last cycle")
                .register(registry);
        Gauge.builder(NAME_STATEMENTS_COUNT, statementsCount::get)
                .description("Number of entries currently held by pg_stat_statements")
                .register(registry);
        Gauge.builder(NAME_STATEMENTS_MAX, statementsMax::get)
                .description("Value of the pg_stat_statements.max setting")
                .register(registry);
        Gauge.builder(NAME_UP, databaseUpGaugeValue::get)
                .description("Whether the database is reachable (1=up, 0=down)")
                .register(registry);
        Gauge.builder(NAME_UPTIME, () -> Duration.between(startTime, Instant.now()).toSeconds())
                .description("Duration in seconds since the collector started")
                .register(registry);
        log.info("Collector metrics initialized");
    }

    /**
     * Count a failed or skipped statistics collection.
     *
     * @param errorTag reason, e.g. {@code database-pg_stat_statements_not_loaded}
     */
    public void incrementStatementError(String errorTag) {
        Counter.builder(NAME_STATEMENT_ERROR)
                .tag(Constants.TAG_ERROR, errorTag)
                .description("Number of statement metrics collection errors per reason")
                .register(registry)
                .increment();
    }

    public void setQueryRowsRaw(long rows) {
        queryRowsRaw.set(rows);
    }

    public void setStatementsUsage(long count, long max) {
        statementsCount.set(count);
        statementsMax.set(max);
    }

    public void incrementFullTextEvents(int events) {
        fullTextEventCounter.increment(events);
    }

    public void incrementTotalCycles() {
        cycleCounter.increment();
    }

    public void incrementTotalError() {
        cycleErrorCounter.increment();
    }

    public void recordCycleDuration(Duration duration) {
        cycleDurationTimer.record(duration);
    }

    public void setDatabaseUp(boolean up) {
        databaseUpGaugeValue.set(up ? 1.0 : 0.0);
    }
}
