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

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.greengagedb.querymetrics.db.DatabaseService;
import org.greengagedb.querymetrics.job.CycleResult;
import org.greengagedb.querymetrics.job.StatementJobRunner;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StatementMetricsHealthCheckTest {

    @Mock
    private DatabaseService databaseService;

    @Mock
    private StatementJobRunner runner;

    @InjectMocks
    private StatementMetricsHealthCheck healthCheck;

    @Test
    void testCall_ConnectedWithRecentCycle_Up() {
        // Setup
        when(databaseService.testConnection()).thenReturn(true);
        when(runner.isEnabled()).thenReturn(true);
        when(runner.lastResult()).thenReturn(Optional.of(CycleResult.emitted(Instant.now(), 2, 1)));
        when(runner.resultMaxAge()).thenReturn(Duration.ofSeconds(30));

        // Execute
        HealthCheckResponse response = healthCheck.call();

        // Verify
        assertEquals(HealthCheckResponse.Status.UP, response.getStatus());
        Map<String, Object> data = response.getData().orElseThrow();
        assertEquals(true, data.get("accessible"));
        assertEquals("EMITTED", data.get("lastCycleOutcome"));
        assertEquals(false, data.get("lastCycleStale"));
    }

    @Test
    void testCall_DatabaseUnreachable_Down() {
        // Setup
        when(databaseService.testConnection()).thenReturn(false);
        when(runner.isEnabled()).thenReturn(true);
        when(runner.lastResult()).thenReturn(Optional.empty());

        // Execute
        HealthCheckResponse response = healthCheck.call();

        // Verify
        assertEquals(HealthCheckResponse.Status.DOWN, response.getStatus());
        assertFalse(response.getData().orElseThrow().containsKey("lastCycleOutcome"));
    }
}
