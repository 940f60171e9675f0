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

import lombok.Getter;

/**
 * Classification of a failed statistics query, derived from the SQLSTATE.
 */
@Getter
public enum QueryErrorKind {
    /**
     * The extension library is not in {@code shared_preload_libraries} (SQLSTATE 55000).
     */
    NOT_LOADED("database-pg_stat_statements_not_loaded", false),
    /**
     * The extension is not created in the connected database (SQLSTATE 42P01).
     */
    NOT_CREATED("database-pg_stat_statements_not_created", true),
    /**
     * The statement was canceled, usually by {@code statement_timeout} (SQLSTATE 57014).
     */
    CANCELED("database-query_canceled", true),
    /**
     * Syntax error or access rule violation (SQLSTATE class 42), e.g. a cached column
     * that no longer exists after an extension upgrade.
     */
    MALFORMED("database-malformed_query", true),
    OTHER("database-query_error", false),
    ;

    private final String errorTag;
    private final boolean invalidatesColumnCache;

    QueryErrorKind(String errorTag, boolean invalidatesColumnCache) {
        this.errorTag = errorTag;
        this.invalidatesColumnCache = invalidatesColumnCache;
    }

    public static QueryErrorKind fromSqlState(String sqlState) {
        if (sqlState == null) {
            return OTHER;
        }
        return switch (sqlState) {
            case "55000" -> NOT_LOADED;
            case "42P01" -> NOT_CREATED;
            case "57014" -> CANCELED;
            default -> sqlState.startsWith("42") ? MALFORMED : OTHER;
        };
    }
}
