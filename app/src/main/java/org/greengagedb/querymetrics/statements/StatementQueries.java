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

import java.util.Collection;
import java.util.regex.Pattern;

/**
 * SQL text of the queries run against the statistics view.
 */
public final class StatementQueries {

    private static final String STATEMENTS_QUERY = """
            SELECT %s
              FROM %s AS pg_stat_statements
              LEFT JOIN pg_roles
                     ON pg_stat_statements.userid = pg_roles.oid
              LEFT JOIN pg_database
                     ON pg_stat_statements.dbid = pg_database.oid
             WHERE query != '<insufficient privilege>'
               AND query NOT LIKE 'EXPLAIN %%'
               %s
             LIMIT %d
            """;

    private static final String DB_STRICT_FILTER = "AND pg_database.datname = ?";

    // pg_stat_statements(false) skips reading query texts from disk
    static final String COUNT_QUERY = "SELECT COUNT(*) FROM pg_stat_statements(false)";
    static final String COUNT_QUERY_LT_9_4 = "SELECT COUNT(*) FROM pg_stat_statements";
    static final String MAX_SETTING_QUERY =
            "SELECT setting FROM pg_settings WHERE name = 'pg_stat_statements.max'";

    private static final Pattern VIEW_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_$]*(\\.[A-Za-z_][A-Za-z0-9_$]*)?");

    private final String view;
    private final int maxRows;

    /**
     * @param view    statistics view name, optionally schema qualified
     * @param maxRows upper bound on returned rows
     * @throws IllegalArgumentException if the view name is not a plain identifier
     */
    public StatementQueries(String view, int maxRows) {
        if (view == null || !VIEW_NAME.matcher(view).matches()) {
            throw new IllegalArgumentException("Invalid statistics view name: " + view);
        }
        if (maxRows <= 0) {
            throw new IllegalArgumentException("Row limit must be positive: " + maxRows);
        }
        this.view = view;
        this.maxRows = maxRows;
    }

    /**
     * Zero-row wildcard query; only its result descriptor is used.
     */
    public String discoveryQuery() {
        return STATEMENTS_QUERY.formatted("*", view, "", 0);
    }

    /**
     * @param columns  column names to select
     * @param dbStrict whether to filter on one database (binds one parameter: the database name)
     */
    public String statementsQuery(Collection<String> columns, boolean dbStrict) {
        return STATEMENTS_QUERY.formatted(String.join(", ", columns), view, dbStrict ? DB_STRICT_FILTER : "", maxRows);
    }

    public String countQuery(DatabaseVersion version) {
        if (version != null && !version.supportsStatementsWithoutText()) {
            return COUNT_QUERY_LT_9_4;
        }
        return COUNT_QUERY;
    }

    public String maxSettingQuery() {
        return MAX_SETTING_QUERY;
    }
}
