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
package org.greengagedb.querymetrics.statements;

import lombok.extern.slf4j.Slf4j;
import org.greengagedb.querymetrics.metrics.CollectorMetrics;
import org.greengagedb.querymetrics.model.DatabaseVersion;

import java.sql.Connection;

/**
 * Reports how full the statistics view is: current entry count against {@code pg_stat_statements.max}.
 */
@Slf4j
public class StatementsUsageReporter {

    private final StatementQueryExecutor executor;
    private final StatementQueries queries;
    private final CollectorMetrics metrics;

    public StatementsUsageReporter(StatementQueryExecutor executor, StatementQueries queries, CollectorMetrics metrics) {
        this.executor = executor;
        this.queries = queries;
        this.metrics = metrics;
    }

    public void report(Connection connection, DatabaseVersion version) {
        try {
            long count = executor.queryForValue(connection, queries.countQuery(version))
                    .map(StatementsUsageReporter::toLong)
                    .orElse(0L);
            long max = executor.queryForValue(connection, queries.maxSettingQuery())
                    .map(StatementsUsageReporter::toLong)
                    .orElse(0L);
            metrics.setStatementsUsage(count, max);
        } catch (StatementQueryException e) {
            log.warn("Failed to query for pg_stat_statements count: {}", e.getMessage());
        }
    }

    static long toLong(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric value '{}'", value);
            return 0L;
        }
    }
}
