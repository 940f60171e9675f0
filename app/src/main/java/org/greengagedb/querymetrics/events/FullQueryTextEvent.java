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

/**
 * Full query text sample of one statement.
 *
 * @param timestamp    epoch milliseconds
 * @param host         reporting host
 * @param agentVersion collector version
 * @param source       always {@code postgres}
 * @param tags         comma separated {@code key:value} tags
 * @param type         always {@code fqt}
 * @param db           statement section
 * @param postgres     database and role
 */
public record FullQueryTextEvent(
        long timestamp,
        String host,
        @JsonProperty("agent_version") String agentVersion,
        String source,
        String tags,
        String type,
        Db db,
        Postgres postgres) {

    /**
     * @param instance       database name
     * @param querySignature signature of the statement
     * @param statement      obfuscated text, not truncated
     */
    public record Db(String instance,
                     @JsonProperty("query_signature") String querySignature,
                     String statement) {
    }

    public record Postgres(String datname, String rolname) {
    }
}
