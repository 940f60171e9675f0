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
import org.greengagedb.querymetrics.config.RunnerConfig;
import org.greengagedb.querymetrics.config.StatementMetricsConfig;
import org.greengagedb.querymetrics.db.DatabaseService;
import org.greengagedb.querymetrics.metrics.CollectorMetrics;
import org.greengagedb.querymetrics.model.DatabaseVersion;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives the statement metrics job.
 *
 * <p>Each trigger verifies connectivity (with retries) and looks up the server version before
 * running a cycle. An unrecognized version does not stop collection. A trigger that arrives
 * while a cycle is running is skipped, so the job's state is only ever touched by one cycle
 * at a time.
 */
@Slf4j
@ApplicationScoped
public class StatementJobRunner {

    private final Lock cycleLock = new ReentrantLock();
    private final AtomicReference<CycleResult> lastResult = new AtomicReference<>();
    private final AtomicBoolean shutdownRequested = new AtomicBoolean(false);

    private final RunnerConfig config;
    private final StatementMetricsConfig statementsConfig;
    private final DatabaseService databaseService;
    private final CollectorMetrics collectorMetrics;
    private final StatementMetricsJobFactory jobFactory;

    private volatile StatementMetricsJob job;

    @Inject
    public StatementJobRunner(RunnerConfig config,
                              StatementMetricsConfig statementsConfig,
                              DatabaseService databaseService,
                              CollectorMetrics collectorMetrics,
                              StatementMetricsJobFactory jobFactory) {
        this.config = config;
        this.statementsConfig = statementsConfig;
        this.databaseService = databaseService;
        this.collectorMetrics = collectorMetrics;
        this.jobFactory = jobFactory;
    }

    /**
     * Create the job. Does nothing when statement metrics are disabled.
     */
    public void start() {
        if (!statementsConfig.enabled()) {
            log.info("Statement metrics collection is disabled");
            return;
        }
        job = jobFactory.create(shutdownRequested::get);
        log.info("Statement metrics job created for database '{}'", job.getDatabaseName());
    }

    /**
     * Ask a running cycle to stop before its next stage and refuse new ones.
     */
    public void shutdown() {
        if (shutdownRequested.compareAndSet(false, true)) {
            log.info("Statement metrics job shutting down");
        }
    }

    /**
     * Run one cycle unless another is in progress.
     */
    public void runCycle() {
        StatementMetricsJob current = job;
        if (current == null || shutdownRequested.get()) {
            return;
        }
        if (!cycleLock.tryLock()) {
            log.debug("Cycle already in progress, skipping trigger");
            return;
        }

        try {
            CycleResult result = runCycleInternal(current);
            lastResult.set(result);
            if (!result.successful()) {
                log.debug("Cycle failed", result.error());
            }
        } finally {
            cycleLock.unlock();
        }
    }

    private CycleResult runCycleInternal(StatementMetricsJob current) {
        Instant start = Instant.now();
        try {
            if (!awaitDatabase()) {
                return CycleResult.failed(start);
            }
            DatabaseVersion version = databaseService.serverVersion().orElse(null);
            collectorMetrics.setDatabaseUp(true);
            return current.runCycle(version);
        } catch (SQLException e) {
            log.error("Database error before statement metrics cycle: {}", e.getMessage(), e);
            collectorMetrics.setDatabaseUp(false);
            collectorMetrics.incrementTotalError();
            return CycleResult.failed(start, e);
        } catch (Exception e) {
            // fault tolerance rejections (open circuit, timeout) end up here
            log.error("Unexpected error before statement metrics cycle: {}", e.getMessage(), e);
            collectorMetrics.incrementTotalError();
            return CycleResult.failed(start, e);
        }
    }

    /**
     * Test connectivity, retrying with a growing delay.
     *
     * @return true once the database answered, false when every attempt failed
     */
    private boolean awaitDatabase() throws SQLException {
        int maxAttempts = config.connectionRetryAttempts();
        Duration retryDelay = config.connectionRetryDelay();

        int attempt = 1;
        for (; attempt <= maxAttempts; attempt++) {
            if (databaseService.testConnection()) {
                if (attempt > 1) {
                    log.info("Database connection restored after {} attempts", attempt);
                }
                return true;
            }
            if (attempt == maxAttempts || shutdownRequested.get()) {
                break;
            }
            Duration delay = retryDelay.multipliedBy(attempt);
            log.warn("Database connection test failed (attempt {}/{}), retrying in {}", attempt, maxAttempts, delay);
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SQLException("Connection retry interrupted", e);
            }
        }

        log.error("Database connection test failed after {} attempts", Math.min(attempt, maxAttempts));
        collectorMetrics.setDatabaseUp(false);
        collectorMetrics.incrementTotalError();
        return false;
    }

    public Optional<CycleResult> lastResult() {
        return Optional.ofNullable(lastResult.get());
    }

    public Duration resultMaxAge() {
        return config.resultCacheMaxAge();
    }

    public boolean isEnabled() {
        return job != null;
    }

    boolean isShutdownRequested() {
        return shutdownRequested.get();
    }
}
