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

import java.sql.Connection;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads one snapshot of the statistics view.
 *
 * <p>Failures never propagate: they are logged, counted under the
 * {@code greengage_statements_error} counter, and turned into an empty result.
 */
@Slf4j
public class StatementSnapshotFetcher {

    static final String MISSING_REQUIRED_COLUMNS_TAG = "database-missing_pg_stat_statements_required_columns";

    private final StatColumnDiscovery columnDiscovery;
    private final StatementQueryExecutor executor;
    private final StatementQueries queries;
    private final CollectorMetrics metrics;
    private final String databaseName;
    private final boolean dbStrict;

    public StatementSnapshotFetcher(StatColumnDiscovery columnDiscovery,
                                    StatementQueryExecutor executor,
                                    StatementQueries queries,
                                    CollectorMetrics metrics,
                                    String databaseName,
                                    boolean dbStrict) {
        this.columnDiscovery = columnDiscovery;
        this.executor = executor;
        this.queries = queries;
        this.metrics = metrics;
        this.databaseName = databaseName;
        this.dbStrict = dbStrict;
    }

    /**
     * Discover columns and read the view in one step.
     */
    public List<StatementRow> fetch(Connection connection) {
        return selectableColumns(connection)
                .map(columns -> fetch(connection, columns))
                .orElse(List.of());
    }

    /**
     * Intersect the known columns with the ones the view exposes.
     *
     * @return column names to select in alphabetical order, or empty if a required
     * column is missing or discovery failed
     */
    public Optional<List<String>> selectableColumns(Connection connection) {
        Set<String> available;
        try {
            available = columnDiscovery.columns(connection);
        } catch (StatementQueryException e) {
            handleQueryError(e);
            return Optional.empty();
        }

        Set<StatementColumn> missing = EnumSet.noneOf(StatementColumn.class);
        for (StatementColumn column : StatementColumn.required()) {
            if (!available.contains(column.getColumnName())) {
                missing.add(column);
            }
        }
        if (!missing.isEmpty()) {
            log.warn("Unable to collect statement metrics because required fields are unavailable: {}",
                    missing.stream().map(StatementColumn::getColumnName).sorted().collect(Collectors.joining(", ")));
            metrics.incrementStatementError(MISSING_REQUIRED_COLUMNS_TAG);
            return Optional.empty();
        }

        return Optional.of(EnumSet.allOf(StatementColumn.class).stream()
                .map(StatementColumn::getColumnName)
                .filter(available::contains)
                .sorted()
                .toList());
    }

    /**
     * Select the given columns from the view.
     *
     * @return rows, or an empty list if the query failed
     */
    public List<StatementRow> fetch(Connection connection, List<String> columns) {
        List<Object> params = dbStrict ? List.of(databaseName) : List.of();
        try {
            List<StatementRow> rows = executor.fetchRows(connection, queries.statementsQuery(columns, dbStrict), params);
            log.debug("Fetched {} rows from the statistics view", rows.size());
            return rows;
        } catch (StatementQueryException e) {
            handleQueryError(e);
            return List.of();
        }
    }

    private void handleQueryError(StatementQueryException e) {
        QueryErrorKind kind = e.getKind();
        if (kind.isInvalidatesColumnCache()) {
            columnDiscovery.invalidate();
        }
        String reason = switch (kind) {
            case NOT_LOADED -> "pg_stat_statements must be loaded via shared_preload_libraries";
            case NOT_CREATED -> "pg_stat_statements is not created in database '" + databaseName + "'";
            case CANCELED -> "the statistics query was canceled: " + e.getMessage();
            case MALFORMED, OTHER -> "of an error running queries: " + e.getMessage();
        };
        log.warn("Unable to collect statement metrics because {}", reason);
        metrics.incrementStatementError(kind.getErrorTag());
    }
}
