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

import org.greengagedb.querymetrics.common.ValueUtils;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One record of the statistics view.
 *
 * <p>Only selected columns are present; a present column may still hold {@code null}
 * (e.g. {@code rolname} of a dropped role). Metric values are {@link Long} or {@link Double}.
 *
 * @param values column values keyed by column (unmodifiable)
 */
public record StatementRow(Map<StatementColumn, Object> values) {

    public StatementRow {
        EnumMap<StatementColumn, Object> copy = new EnumMap<>(StatementColumn.class);
        copy.putAll(values);
        values = Collections.unmodifiableMap(copy);
    }

    public boolean has(StatementColumn column) {
        return values.containsKey(column);
    }

    public Object get(StatementColumn column) {
        return values.get(column);
    }

    public Set<StatementColumn> columns() {
        return values.keySet();
    }

    public Number metric(StatementColumn column) {
        return ValueUtils.toMetricNumber(values.get(column));
    }

    public String getString(StatementColumn column) {
        Object value = values.get(column);
        return value != null ? value.toString() : null;
    }

    public String query() {
        return getString(StatementColumn.QUERY);
    }

    public String databaseName() {
        return getString(StatementColumn.DATNAME);
    }

    public String roleName() {
        return getString(StatementColumn.ROLNAME);
    }

    /**
     * @return copy of this row with one column replaced (or added)
     */
    public StatementRow with(StatementColumn column, Object value) {
        EnumMap<StatementColumn, Object> copy = new EnumMap<>(StatementColumn.class);
        copy.putAll(values);
        copy.put(column, value);
        return new StatementRow(copy);
    }

    /**
     * @return copy of this row with the given metric columns replaced
     */
    public StatementRow withMetrics(Map<StatementColumn, Number> metrics) {
        EnumMap<StatementColumn, Object> copy = new EnumMap<>(StatementColumn.class);
        copy.putAll(values);
        copy.putAll(metrics);
        return new StatementRow(copy);
    }

    /**
     * @return values keyed by column name, in column declaration order
     */
    public Map<String, Object> toColumnMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        values.forEach((column, value) -> map.put(column.getColumnName(), value));
        return map;
    }
}
