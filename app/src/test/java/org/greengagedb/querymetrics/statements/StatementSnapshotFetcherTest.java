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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.greengagedb.querymetrics.metrics.CollectorMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.greengagedb.querymetrics.statements.StatementRowFixtures.row;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StatementSnapshotFetcherTest {

    private static final String ERROR_COUNTER = "greengage_statements_error";
    private static final Set<String> ALL_COLUMNS = Set.of(
            "userid", "dbid", "queryid", "query", "calls", "total_exec_time", "rows",
            "shared_blks_hit", "datname", "rolname", "oid", "rolsuper");

    @Mock
    private StatementQueryExecutor executor;

    @Mock
    private Connection connection;

    private SimpleMeterRegistry registry;
    private StatColumnDiscovery discovery;
    private StatementQueries queries;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        queries = new StatementQueries("pg_stat_statements", 10000);
        discovery = new StatColumnDiscovery(executor, queries);
    }

    private StatementSnapshotFetcher fetcher(boolean dbStrict) {
        CollectorMetrics metrics = new CollectorMetrics(registry);
        metrics.init();
        return new StatementSnapshotFetcher(discovery, executor, queries, metrics, "orders", dbStrict);
    }

    private double errorCount(String tag) {
        Counter counter = registry.find(ERROR_COUNTER).tag("error", tag).counter();
        return counter == null ? 0 : counter.count();
    }

    @Test
    void testFetch_SelectsKnownColumnsSorted() throws Exception {
        // Setup
        when(executor.describeColumns(eq(connection), anyString())).thenReturn(ALL_COLUMNS);
        List<StatementRow> rows = List.of(row("SELECT ?", "orders", "app", 1, 1));
        when(executor.fetchRows(eq(connection), anyString(), any())).thenReturn(rows);

        // Execute
        List<StatementRow> result = fetcher(false).fetch(connection);

        // Verify
        assertEquals(rows, result);
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(executor).fetchRows(eq(connection), sql.capture(), eq(List.of()));
        assertTrue(sql.getValue().contains(
                "SELECT calls, datname, query, queryid, rolname, rows, shared_blks_hit, total_exec_time"));
        assertFalse(sql.getValue().contains("pg_database.datname = ?"));
        assertTrue(sql.getValue().contains("LIMIT 10000"));
    }

    @Test
    void testFetch_DbStrict_FiltersOnDatabase() throws Exception {
        when(executor.describeColumns(eq(connection), anyString())).thenReturn(ALL_COLUMNS);
        when(executor.fetchRows(eq(connection), anyString(), any())).thenReturn(List.of());

        fetcher(true).fetch(connection);

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(executor).fetchRows(eq(connection), sql.capture(), eq(List.of("orders")));
        assertTrue(sql.getValue().contains("AND pg_database.datname = ?"));
    }

    @Test
    void testFetch_MissingRequiredColumn_EmptyAndCountedOnce() throws Exception {
        // Setup - no "rows" column
        when(executor.describeColumns(eq(connection), anyString()))
                .thenReturn(Set.of("query", "calls", "total_exec_time", "datname", "rolname"));

        // Execute
        List<StatementRow> result = fetcher(false).fetch(connection);

        // Verify
        assertTrue(result.isEmpty());
        assertEquals(1.0, errorCount(StatementSnapshotFetcher.MISSING_REQUIRED_COLUMNS_TAG));
        verify(executor, never()).fetchRows(any(), anyString(), any());
    }

    @Test
    void testSelectableColumns_CachedBetweenCalls() throws Exception {
        when(executor.describeColumns(eq(connection), anyString())).thenReturn(ALL_COLUMNS);
        StatementSnapshotFetcher fetcher = fetcher(false);

        Optional<List<String>> first = fetcher.selectableColumns(connection);
        Optional<List<String>> second = fetcher.selectableColumns(connection);

        assertEquals(first, second);
        verify(executor, times(1)).describeColumns(eq(connection), anyString());
    }

    @Test
    void testFetch_NotCreated_InvalidatesColumnCache() throws Exception {
        // Setup
        when(executor.describeColumns(eq(connection), anyString())).thenReturn(ALL_COLUMNS);
        when(executor.fetchRows(eq(connection), anyString(), any()))
                .thenThrow(new StatementQueryException(QueryErrorKind.NOT_CREATED, "42P01",
                        "relation \"pg_stat_statements\" does not exist", null));
        StatementSnapshotFetcher fetcher = fetcher(false);

        // Execute
        List<StatementRow> result = fetcher.fetch(connection);

        // Verify
        assertTrue(result.isEmpty());
        assertFalse(discovery.isCached());
        assertEquals(1.0, errorCount("database-pg_stat_statements_not_created"));

        fetcher.fetch(connection);
        verify(executor, times(2)).describeColumns(eq(connection), anyString());
    }

    @Test
    void testFetch_NotLoaded_KeepsColumnCache() throws Exception {
        when(executor.describeColumns(eq(connection), anyString())).thenReturn(ALL_COLUMNS);
        when(executor.fetchRows(eq(connection), anyString(), any()))
                .thenThrow(new StatementQueryException(QueryErrorKind.NOT_LOADED, "55000",
                        "pg_stat_statements must be loaded via shared_preload_libraries", null));

        List<StatementRow> result = fetcher(false).fetch(connection);

        assertTrue(result.isEmpty());
        assertTrue(discovery.isCached());
        assertEquals(1.0, errorCount("database-pg_stat_statements_not_loaded"));
    }

    @Test
    void testFetch_Canceled_InvalidatesColumnCache() throws Exception {
        when(executor.describeColumns(eq(connection), anyString())).thenReturn(ALL_COLUMNS);
        when(executor.fetchRows(eq(connection), anyString(), any()))
                .thenThrow(new StatementQueryException(QueryErrorKind.CANCELED, "57014",
                        "canceling statement due to statement timeout", null));

        fetcher(false).fetch(connection);

        assertFalse(discovery.isCached());
        assertEquals(1.0, errorCount("database-query_canceled"));
    }

    @Test
    void testFetch_Malformed_InvalidatesColumnCache() throws Exception {
        // Setup - a cached column no longer exists after an upgrade
        when(executor.describeColumns(eq(connection), anyString())).thenReturn(ALL_COLUMNS);
        when(executor.fetchRows(eq(connection), anyString(), any()))
                .thenThrow(new StatementQueryException(QueryErrorKind.MALFORMED, "42703",
                        "column \"total_exec_time\" does not exist", null));
        StatementSnapshotFetcher fetcher = fetcher(false);

        // Execute
        List<StatementRow> result = fetcher.fetch(connection);

        // Verify
        assertTrue(result.isEmpty());
        assertFalse(discovery.isCached());
        assertEquals(1.0, errorCount("database-malformed_query"));
    }

    @Test
    void testFetch_OtherError_KeepsColumnCache() throws Exception {
        // Setup
        when(executor.describeColumns(eq(connection), anyString())).thenReturn(ALL_COLUMNS);
        when(executor.fetchRows(eq(connection), anyString(), any()))
                .thenThrow(new StatementQueryException(QueryErrorKind.OTHER, "53200", "out of memory", null));
        StatementSnapshotFetcher fetcher = fetcher(false);

        // Execute
        List<StatementRow> result = fetcher.fetch(connection);

        // Verify
        assertTrue(result.isEmpty());
        assertTrue(discovery.isCached());
        assertEquals(1.0, errorCount("database-query_error"));

        fetcher.fetch(connection);
        verify(executor, times(1)).describeColumns(eq(connection), anyString());
    }

    @Test
    void testFetch_DiscoveryFails_EmptyAndCounted() throws Exception {
        when(executor.describeColumns(eq(connection), anyString()))
                .thenThrow(new StatementQueryException(QueryErrorKind.OTHER, "08006", "connection lost", null));

        List<StatementRow> result = fetcher(false).fetch(connection);

        assertTrue(result.isEmpty());
        assertEquals(1.0, errorCount("database-query_error"));
        verify(executor, never()).fetchRows(any(), anyString(), any());
    }
}
