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
package org.greengagedb.querymetrics.bootstrap;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;
import io.quarkus.scheduler.Scheduler;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.greengagedb.querymetrics.config.StatementMetricsConfig;
import org.greengagedb.querymetrics.db.DatabaseService;
import org.greengagedb.querymetrics.job.StatementJobRunner;
import org.greengagedb.querymetrics.model.DatabaseVersion;

import java.util.Optional;

/**
 * Application lifecycle bean that starts the statement metrics job
 * and schedules its cycles.
 *
 * <p><b>Lifecycle:</b>
 * <ol>
 *   <li>Startup: Print banner, log configuration, detect database version, create the job</li>
 *   <li>Runtime: Periodic cycles via the programmatic scheduler</li>
 *   <li>Shutdown: Signal the running cycle to stop between stages</li>
 * </ol>
 */
@Slf4j
@ApplicationScoped
public class QueryMetricsApp {
    static final String CYCLE_JOB_ID = "statement-metrics";

    private final DatabaseService databaseService;
    private final StatementJobRunner runner;
    private final StatementMetricsConfig statementsConfig;
    private final Banners banner;
    private final Scheduler scheduler;

    @Inject
    public QueryMetricsApp(DatabaseService databaseService,
                           StatementJobRunner runner,
                           StatementMetricsConfig statementsConfig,
                           Banners banner,
                           Scheduler scheduler) {
        this.databaseService = databaseService;
        this.runner = runner;
        this.statementsConfig = statementsConfig;
        this.banner = banner;
        this.scheduler = scheduler;
    }

    void onStartup(@Observes StartupEvent event) {
        banner.printHeader();
        logConfiguration();
        detectAndLogVersion();
        runner.start();
        if (runner.isEnabled()) {
            scheduleCycles();
        }
        banner.printFooter();
    }

    void onShutdown(@Observes ShutdownEvent event) {
        runner.shutdown();
    }

    private void logConfiguration() {
        log.info("Configuration:");
        log.info("  Enabled:                {}", statementsConfig.enabled());
        log.info("  Collection interval:    {}", statementsConfig.effectiveCollectionInterval());
        log.info("  Database:               {}", statementsConfig.dbname());
        log.info("  Restricted to database: {}", statementsConfig.dbStrict());
        log.info("  Statistics view:        {}", statementsConfig.view());
        log.info("  Row limit:              {}", statementsConfig.maxRows());
        log.info("  Database URL:           {}", maskSensitiveInfo(databaseService.getUrl()));
    }

    /**
     * Mask sensitive information in connection strings for logging.
     *
     * @param url Database connection URL
     * @return Masked URL with password hidden
     */
    static String maskSensitiveInfo(String url) {
        if (url == null) {
            return "not configured";
        }
        return url.replaceAll("password=[^&\\s]+", "password=***")
                .replaceAll(":[^:/@]+@", ":***@");
    }

    private void detectAndLogVersion() {
        try {
            Optional<DatabaseVersion> version = databaseService.serverVersion();
            log.info("Database connection successful:");
            log.info("  Server version:         {}",
                    version.map(DatabaseVersion::fullVersion).orElse("unknown"));
            version.filter(v -> !v.supportsStatementsWithoutText())
                    .ifPresent(v -> log.warn("Server version {} predates 9.4, pg_stat_statements count will read query texts",
                            v.fullVersion()));
        } catch (Exception e) {
            log.warn("Error detecting server version on startup: {}", e.getMessage());
            log.warn("Will retry on first cycle");
            log.debug("Version detection error details:", e);
        }
    }

    /**
     * Schedule periodic cycles at the effective collection interval.
     * Overlapping executions are skipped.
     */
    private void scheduleCycles() {
        scheduler.newJob(CYCLE_JOB_ID)
                .setInterval(statementsConfig.effectiveCollectionInterval().toString())
                .setConcurrentExecution(Scheduled.ConcurrentExecution.SKIP)
                .setTask(execution -> runCycle())
                .schedule();
    }

    void runCycle() {
        log.debug("Statement metrics cycle triggered");
        try {
            runner.runCycle();
        } catch (Exception e) {
            // keep the scheduler running
            log.error("Unexpected error in scheduled cycle: {}", e.getMessage(), e);
        }
    }
}
