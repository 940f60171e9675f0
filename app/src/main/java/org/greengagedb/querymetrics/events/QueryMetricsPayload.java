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

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Per-interval statement metrics of one cycle.
 *
 * @param host                  reporting host
 * @param timestamp             epoch milliseconds
 * @param minCollectionInterval collection interval in seconds
 * @param tags                  global tags without {@code db:}
 * @param postgresRows          one map per statement, keyed by column name
 * @param postgresVersion       {@code v<major>.<minor>.<patch>}, empty when unknown
 * @param agentVersion          collector version
 */
public record QueryMetricsPayload(
        String host,
        long timestamp,
        @JsonProperty("min_collection_interval") double minCollectionInterval,
        List<String> tags,
        @JsonProperty("postgres_rows") List<Map<String, Object>> postgresRows,
        @JsonProperty("postgres_version") String postgresVersion,
        @JsonProperty("agent_version") String agentVersion) {
}
