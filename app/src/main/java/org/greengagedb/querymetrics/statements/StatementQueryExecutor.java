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

import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;
import org.greengagedb.querymetrics.common.ValueUtils;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Executes queries against the statistics view.
 *
 * <p>Every {@link SQLException} is rethrown as a {@link StatementQueryException}
 * carrying a {@link QueryErrorKind} derived from its SQLSTATE.
 */
@Slf4j
@ApplicationScoped
public class StatementQueryExecutor {

    /**
     * Run a query and return the labels of its result columns, lower-cased.
     */
    public Set<String> describeColumns(Connection connection, String sql) throws StatementQueryException {
        log.debug("Running query [{}]", sql);
        try (PreparedStatement stmt = connection.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            ResultSetMetaData metaData = rs.getMetaData();
            Set<String> columns = new LinkedHashSet<>();
            for (int i = 1; i <= metaData.getColumnCount(); i++) {
                columns.add(metaData.getColumnLabel(i).toLowerCase(Locale.ROOT));
            }
            return columns;
        } catch (SQLException e) {
            throw StatementQueryException.classify(e);
        }
    }

    /**
     * Run a query and map each record to a {@link StatementRow}. Columns unknown to
     * {@link StatementColumn} are ignored; metric values are normalized to Long or Double.
     */
    public List<StatementRow> fetchRows(Connection connection, String sql, List<Object> params)
            throws StatementQueryException {
        log.debug("Running query [{}] {}", sql, params);
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            bind(stmt, params);
            try (ResultSet rs = stmt.executeQuery()) {
                Map<Integer, StatementColumn> mapping = mapColumns(rs.getMetaData());
                List<StatementRow> rows = new ArrayList<>();
                while (rs.next()) {
                    Map<StatementColumn, Object> values = new EnumMap<>(StatementColumn.class);
                    for (Map.Entry<Integer, StatementColumn> entry : mapping.entrySet()) {
                        StatementColumn column = entry.getValue();
                        Object value = rs.getObject(entry.getKey());
                        values.put(column, column.isMetric() ? ValueUtils.toMetricNumber(value) : value);
                    }
                    rows.add(new StatementRow(values));
                }
                return rows;
            }
        } catch (SQLException e) {
            throw StatementQueryException.classify(e);
        }
    }

    /**
     * Run a query returning a single value.
     *
     * @return first column of the first row, empty if there is no row or the value is null
     */
    public Optional<Object> queryForValue(Connection connection, String sql) throws StatementQueryException {
        log.debug("Running query [{}]", sql);
        try (PreparedStatement stmt = connection.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            if (!rs.next()) {
                return Optional.empty();
            }
            return Optional.ofNullable(rs.getObject(1));
        } catch (SQLException e) {
            throw StatementQueryException.classify(e);
        }
    }

    private static void bind(PreparedStatement stmt, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            stmt.setObject(i + 1, params.get(i));
        }
    }

    private static Map<Integer, StatementColumn> mapColumns(ResultSetMetaData metaData) throws SQLException {
        Map<Integer, StatementColumn> mapping = new LinkedHashMap<>();
        for (int i = 1; i <= metaData.getColumnCount(); i++) {
            int index = i;
            StatementColumn.fromColumnName(metaData.getColumnLabel(i))
                    .ifPresent(column -> mapping.put(index, column));
        }
        return mapping;
    }
}
