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

import org.greengagedb.querymetrics.model.DatabaseVersion;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatementQueriesTest {

    private final StatementQueries queries = new StatementQueries("pg_stat_statements", 500);

    @Test
    void testDiscoveryQuery_WildcardWithoutRows() {
        String sql = queries.discoveryQuery();

        assertTrue(sql.contains("SELECT *"));
        assertTrue(sql.contains("LIMIT 0"));
        assertFalse(sql.contains("?"));
    }

    @Test
    void testStatementsQuery_FiltersAndLimit() {
        String sql = queries.statementsQuery(List.of("calls", "query", "rows"), false);

        assertTrue(sql.contains("SELECT calls, query, rows"));
        assertTrue(sql.contains("FROM pg_stat_statements AS pg_stat_statements"));
        assertTrue(sql.contains("query != '<insufficient privilege>'"));
        assertTrue(sql.contains("query NOT LIKE 'EXPLAIN %'"));
        assertTrue(sql.contains("LEFT JOIN pg_roles"));
        assertTrue(sql.contains("LEFT JOIN pg_database"));
        assertTrue(sql.contains("LIMIT 500"));
    }

    @Test
    void testStatementsQuery_CustomView() {
        StatementQueries custom = new StatementQueries("monitoring.pg_stat_statements_all", 10);

        assertTrue(custom.statementsQuery(List.of("calls"), false)
                .contains("FROM monitoring.pg_stat_statements_all AS pg_stat_statements"));
    }

    @Test
    void testCountQuery_DependsOnVersion() {
        assertEquals(StatementQueries.COUNT_QUERY,
                queries.countQuery(new DatabaseVersion(9, 4, 26, "PostgreSQL 9.4.26")));
        assertEquals(StatementQueries.COUNT_QUERY_LT_9_4,
                queries.countQuery(new DatabaseVersion(9, 3, 5, "PostgreSQL 9.3.5")));
        assertEquals(StatementQueries.COUNT_QUERY, queries.countQuery(null));
    }

    @Test
    void testConstructor_RejectsInvalidView() {
        assertThrows(IllegalArgumentException.class, () -> new StatementQueries("pg_stat_statements; DROP TABLE x", 10));
        assertThrows(IllegalArgumentException.class, () -> new StatementQueries(null, 10));
        assertThrows(IllegalArgumentException.class, () -> new StatementQueries("pg_stat_statements", 0));
    }
}
