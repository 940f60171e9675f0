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
package org.greengagedb.querymetrics.events;

import org.greengagedb.querymetrics.common.Constants;
import org.greengagedb.querymetrics.common.MetricNameBuilder;
import org.greengagedb.querymetrics.common.ValueUtils;
import org.greengagedb.querymetrics.model.DatabaseVersion;
import org.greengagedb.querymetrics.statements.NormalizedRow;
import org.greengagedb.querymetrics.statements.StatementRow;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the outbound structures of a cycle: full query text events and the metrics payload.
 */
public class PayloadAssembler {

    private static final String DB_TAG_PREFIX = Constants.TAG_DB + ":";

    private final String host;
    private final String agentVersion;
    private final List<String> tagsWithoutDb;
    private final double collectionIntervalSeconds;
    private final Clock clock;

    /**
     * @param host               reporting host
     * @param agentVersion       collector version
     * @param globalTags         tags attached to everything this job sends, {@code db:} tags included
     * @param collectionInterval effective collection interval
     * @param clock              source of payload timestamps
     */
    public PayloadAssembler(String host,
                            String agentVersion,
                            List<String> globalTags,
                            Duration collectionInterval,
                            Clock clock) {
        this.host = host;
        this.agentVersion = agentVersion;
        this.tagsWithoutDb = globalTags.stream()
                .filter(tag -> !tag.startsWith(DB_TAG_PREFIX))
                .toList();
        this.collectionIntervalSeconds = collectionInterval.toMillis() / 1000d;
        this.clock = clock;
    }

    public FullQueryTextEvent fullQueryTextEvent(NormalizedRow row) {
        StatementRow statement = row.row();
        List<String> tags = new ArrayList<>(tagsWithoutDb);
        tags.add(MetricNameBuilder.tag(Constants.TAG_DB, statement.databaseName()));
        tags.add(MetricNameBuilder.tag(Constants.TAG_ROLNAME, statement.roleName()));

        return new FullQueryTextEvent(
                clock.millis(),
                host,
                agentVersion,
                Constants.SOURCE_POSTGRES,
                String.join(",", tags),
                Constants.EVENT_TYPE_FULL_QUERY_TEXT,
                new FullQueryTextEvent.Db(statement.databaseName(), row.querySignature(), statement.query()),
                new FullQueryTextEvent.Postgres(statement.databaseName(), statement.roleName()));
    }

    public QueryMetricsPayload metricsPayload(List<NormalizedRow> rows, DatabaseVersion version) {
        List<Map<String, Object>> payloadRows = rows.stream()
                .map(PayloadAssembler::toPayloadRow)
                .toList();
        return new QueryMetricsPayload(
                host,
                clock.millis(),
                collectionIntervalSeconds,
                tagsWithoutDb,
                payloadRows,
                DatabaseVersion.payloadVersion(version),
                agentVersion);
    }

    static Map<String, Object> toPayloadRow(NormalizedRow row) {
        Map<String, Object> values = row.row().toColumnMap();
        values.put(Constants.ROW_KEY_QUERY_SIGNATURE, row.querySignature());
        values.put("query", ValueUtils.truncate(row.row().query(), Constants.MAX_DISPLAY_QUERY_LENGTH));
        values.put(Constants.ROW_KEY_TABLES, row.metadata().tables());
        values.put(Constants.ROW_KEY_COMMANDS, row.metadata().commands());
        return values;
    }
}
