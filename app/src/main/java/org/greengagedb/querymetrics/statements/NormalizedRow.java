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

import org.greengagedb.querymetrics.obfuscation.StatementMetadata;

import java.util.Map;
import java.util.Objects;

/**
 * A statement row whose query text has been obfuscated.
 *
 * @param row            row with {@code query} replaced by the obfuscated text
 * @param querySignature signature of the obfuscated text
 * @param metadata       tables and commands parsed from the text
 */
public record NormalizedRow(StatementRow row, String querySignature, StatementMetadata metadata) {

    public NormalizedRow {
        Objects.requireNonNull(row, "row");
        Objects.requireNonNull(querySignature, "querySignature");
        metadata = metadata != null ? metadata : StatementMetadata.EMPTY;
    }

    public RowIdentity identity() {
        return new RowIdentity(querySignature, row.databaseName(), row.roleName());
    }

    public NormalizedRow withMetrics(Map<StatementColumn, Number> metrics) {
        return new NormalizedRow(row.withMetrics(metrics), querySignature, metadata);
    }
}
