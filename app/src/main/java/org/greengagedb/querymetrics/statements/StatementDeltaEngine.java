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
import org.greengagedb.querymetrics.common.ValueUtils;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Turns cumulative counters into per-interval deltas.
 *
 * <p>State holds the previous cycle's counters per identity. On each call:
 * <ul>
 *     <li>rows sharing an identity within one snapshot are merged by summing their counters;</li>
 *     <li>an identity seen for the first time is stored as a baseline and emits nothing;</li>
 *     <li>so is an identity whose set of populated counters changed (e.g. a column appeared
 *     after the view was upgraded), since its new counters have no previous value;</li>
 *     <li>if every counter is at least its previous value, the difference is emitted;</li>
 *     <li>if any counter went backwards (statistics were reset), the new absolute values are emitted;</li>
 *     <li>the state is replaced by the current cycle, so identities absent from it are forgotten.</li>
 * </ul>
 *
 * <p>Not thread-safe; owned by a single job.
 */
@Slf4j
public class StatementDeltaEngine {

    private Map<RowIdentity, StatementRow> previous = new HashMap<>();

    public List<NormalizedRow> computeDeltas(List<NormalizedRow> rows,
                                             Set<StatementColumn> metricColumns,
                                             Function<NormalizedRow, RowIdentity> keyFunction) {
        Map<RowIdentity, NormalizedRow> merged = mergeDuplicates(rows, metricColumns, keyFunction);
        Map<RowIdentity, StatementRow> current = new HashMap<>(merged.size() * 2);
        List<NormalizedRow> deltas = new ArrayList<>();
        int resets = 0;
        int rebaselined = 0;

        for (Map.Entry<RowIdentity, NormalizedRow> entry : merged.entrySet()) {
            NormalizedRow row = entry.getValue();
            current.put(entry.getKey(), row.row());

            StatementRow before = previous.get(entry.getKey());
            if (before == null) {
                continue;
            }
            Set<StatementColumn> columns = populatedColumns(row.row(), metricColumns);
            if (!columns.equals(populatedColumns(before, metricColumns))) {
                rebaselined++;
                continue;
            }
            boolean reset = columns.stream()
                    .anyMatch(column -> ValueUtils.isLessThan(row.row().metric(column), before.metric(column)));
            if (reset) {
                resets++;
            }

            Map<StatementColumn, Number> values = new EnumMap<>(StatementColumn.class);
            for (StatementColumn column : columns) {
                Number now = row.row().metric(column);
                values.put(column, reset ? now : ValueUtils.subtract(now, before.metric(column)));
            }
            deltas.add(row.withMetrics(values));
        }

        if (rebaselined > 0) {
            log.debug("Counter columns changed for {} statements, storing them as new baselines", rebaselined);
        }
        if (resets > 0) {
            log.debug("Counters went backwards for {} statements, emitting absolute values", resets);
        }
        log.debug("Computed {} deltas from {} rows, {} identities tracked", deltas.size(), rows.size(), current.size());
        previous = current;
        return deltas;
    }

    public int trackedIdentities() {
        return previous.size();
    }

    public void clear() {
        previous = new HashMap<>();
    }

    private static Map<RowIdentity, NormalizedRow> mergeDuplicates(List<NormalizedRow> rows,
                                                                   Set<StatementColumn> metricColumns,
                                                                   Function<NormalizedRow, RowIdentity> keyFunction) {
        Map<RowIdentity, NormalizedRow> merged = new LinkedHashMap<>();
        for (NormalizedRow row : rows) {
            merged.merge(keyFunction.apply(row), row, (existing, duplicate) -> {
                Map<StatementColumn, Number> sums = new EnumMap<>(StatementColumn.class);
                for (StatementColumn column : metricColumns) {
                    if (existing.row().has(column) || duplicate.row().has(column)) {
                        sums.put(column, ValueUtils.add(existing.row().metric(column), duplicate.row().metric(column)));
                    }
                }
                return existing.withMetrics(sums);
            });
        }
        return merged;
    }

    // metric columns holding a value
    private static Set<StatementColumn> populatedColumns(StatementRow row, Set<StatementColumn> metricColumns) {
        Set<StatementColumn> columns = EnumSet.noneOf(StatementColumn.class);
        for (StatementColumn column : metricColumns) {
            if (row.metric(column) != null) {
                columns.add(column);
            }
        }
        return columns;
    }
}
