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
package org.greengagedb.querymetrics.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Liveness;
import org.greengagedb.querymetrics.db.DatabaseService;
import org.greengagedb.querymetrics.job.CycleResult;
import org.greengagedb.querymetrics.job.StatementJobRunner;

import java.util.Optional;

/**
 * Health check for database connectivity and the last statement metrics cycle
 * Note: This is a liveness check, not readiness, so it won't kill the pod on DB failure
 */
@Liveness
@ApplicationScoped
public class StatementMetricsHealthCheck implements HealthCheck {

    private final DatabaseService databaseService;
    private final StatementJobRunner runner;

    @Inject
    public StatementMetricsHealthCheck(DatabaseService databaseService, StatementJobRunner runner) {
        this.databaseService = databaseService;
        this.runner = runner;
    }

    @Override
    public HealthCheckResponse call() {
        boolean connected = databaseService.testConnection();

        HealthCheckResponseBuilder builder = HealthCheckResponse.named("statement-metrics")
                .status(connected)
                .withData("accessible", connected)
                .withData("enabled", runner.isEnabled());

        Optional<CycleResult> last = runner.lastResult();
        last.ifPresent(result -> builder
                .withData("lastCycleOutcome", result.outcome().name())
                .withData("lastCycleAgeSeconds", result.getAge().toSeconds())
                .withData("lastCycleStale", result.isStale(runner.resultMaxAge())));
        return builder.build();
    }
}
