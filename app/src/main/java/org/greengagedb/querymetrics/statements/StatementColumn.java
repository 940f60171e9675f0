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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Known columns of the statistics view.
 *
 * <p>The view's shape differs between PostgreSQL versions and extension versions
 * ({@code total_time} became {@code total_exec_time} in 13, for instance), so each cycle
 * selects the intersection of these columns with the ones actually present.
 */
@Getter
public enum StatementColumn {
    CALLS("calls", Kind.METRIC, true),
    ROWS("rows", Kind.METRIC, true),
    TOTAL_TIME("total_time", Kind.METRIC, false),
    TOTAL_EXEC_TIME("total_exec_time", Kind.METRIC, false),
    SHARED_BLKS_HIT("shared_blks_hit", Kind.METRIC, false),
    SHARED_BLKS_READ("shared_blks_read", Kind.METRIC, false),
    SHARED_BLKS_DIRTIED("shared_blks_dirtied", Kind.METRIC, false),
    SHARED_BLKS_WRITTEN("shared_blks_written", Kind.METRIC, false),
    LOCAL_BLKS_HIT("local_blks_hit", Kind.METRIC, false),
    LOCAL_BLKS_READ("local_blks_read", Kind.METRIC, false),
    LOCAL_BLKS_DIRTIED("local_blks_dirtied", Kind.METRIC, false),
    LOCAL_BLKS_WRITTEN("local_blks_written", Kind.METRIC, false),
    TEMP_BLKS_READ("temp_blks_read", Kind.METRIC, false),
    TEMP_BLKS_WRITTEN("temp_blks_written", Kind.METRIC, false),
    DATNAME("datname", Kind.TAG, false),
    ROLNAME("rolname", Kind.TAG, false),
    QUERY("query", Kind.TAG, true),
    QUERYID("queryid", Kind.OPTIONAL, false),
    ;

    private static final Map<String, StatementColumn> BY_NAME = Stream.of(values())
            .collect(Collectors.toUnmodifiableMap(StatementColumn::getColumnName, Function.identity()));

    private static final Set<StatementColumn> REQUIRED = Collections.unmodifiableSet(
            EnumSet.copyOf(Stream.of(values()).filter(StatementColumn::isRequired).toList()));

    private static final Set<StatementColumn> METRICS = Collections.unmodifiableSet(
            EnumSet.copyOf(Stream.of(values()).filter(StatementColumn::isMetric).toList()));

    private final String columnName;
    private final Kind kind;
    private final boolean required;

    StatementColumn(String columnName, Kind kind, boolean required) {
        this.columnName = columnName;
        this.kind = kind;
        this.required = required;
    }

    public boolean isMetric() {
        return kind == Kind.METRIC;
    }

    /**
     * Resolve a column name as reported by the driver.
     *
     * @param columnName column label (case-insensitive)
     * @return matching column, or empty for columns this collector does not use
     */
    public static Optional<StatementColumn> fromColumnName(String columnName) {
        if (columnName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_NAME.get(columnName.toLowerCase(Locale.ROOT)));
    }

    /**
     * Columns without which deltas cannot be computed.
     */
    public static Set<StatementColumn> required() {
        return REQUIRED;
    }

    /**
     * Cumulative counter columns.
     */
    public static Set<StatementColumn> metrics() {
        return METRICS;
    }

    public enum Kind {
        /**
         * Cumulative counter, diffed between cycles.
         */
        METRIC,
        /**
         * Identity or text column carried as-is.
         */
        TAG,
        /**
         * Selected when available, not needed for any computation.
         */
        OPTIONAL
    }
}
