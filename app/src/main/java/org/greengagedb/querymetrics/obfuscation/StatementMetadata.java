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
package org.greengagedb.querymetrics.obfuscation;

import java.util.Arrays;
import java.util.List;

/**
 * Metadata parsed from a statement by the obfuscator.
 *
 * @param tablesCsv comma separated table names (may be empty)
 * @param commands  SQL commands in order of appearance
 * @param comments  comments stripped from the text
 */
public record StatementMetadata(String tablesCsv, List<String> commands, List<String> comments) {

    public static final StatementMetadata EMPTY = new StatementMetadata("", List.of(), List.of());

    public StatementMetadata {
        tablesCsv = tablesCsv != null ? tablesCsv : "";
        commands = commands != null ? List.copyOf(commands) : List.of();
        comments = comments != null ? List.copyOf(comments) : List.of();
    }

    /**
     * @return table names split out of {@link #tablesCsv()}, blanks removed
     */
    public List<String> tables() {
        if (tablesCsv.isBlank()) {
            return List.of();
        }
        return Arrays.stream(tablesCsv.split(","))
                .map(String::trim)
                .filter(table -> !table.isEmpty())
                .toList();
    }
}
