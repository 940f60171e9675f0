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
import org.greengagedb.querymetrics.obfuscation.ObfuscatedStatement;
import org.greengagedb.querymetrics.obfuscation.ObfuscationException;
import org.greengagedb.querymetrics.obfuscation.ObfuscatorOptions;
import org.greengagedb.querymetrics.obfuscation.QuerySignatures;
import org.greengagedb.querymetrics.obfuscation.SqlObfuscator;

import java.util.ArrayList;
import java.util.List;

/**
 * Replaces raw query text with its obfuscated form and attaches the signature.
 * Rows whose text cannot be obfuscated are dropped.
 */
@Slf4j
public class QueryNormalizer {

    private final SqlObfuscator obfuscator;
    private final ObfuscatorOptions options;

    public QueryNormalizer(SqlObfuscator obfuscator, ObfuscatorOptions options) {
        this.obfuscator = obfuscator;
        this.options = options;
    }

    public List<NormalizedRow> normalize(List<StatementRow> rows) {
        List<NormalizedRow> normalized = new ArrayList<>(rows.size());
        for (StatementRow row : rows) {
            String rawQuery = row.query();
            ObfuscatedStatement statement;
            try {
                statement = obfuscator.obfuscate(rawQuery, options);
            } catch (ObfuscationException | RuntimeException e) {
                log.debug("Failed to obfuscate query '{}': {}", rawQuery, e.getMessage());
                continue;
            }
            String obfuscated = statement.query();
            normalized.add(new NormalizedRow(
                    row.with(StatementColumn.QUERY, obfuscated),
                    QuerySignatures.compute(obfuscated),
                    statement.metadata()));
        }
        if (normalized.size() < rows.size()) {
            log.debug("Dropped {} rows with unparseable query text", rows.size() - normalized.size());
        }
        return normalized;
    }
}
