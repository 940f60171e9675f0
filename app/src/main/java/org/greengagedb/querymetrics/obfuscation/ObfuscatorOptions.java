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

import org.greengagedb.querymetrics.config.StatementMetricsConfig;

/**
 * Options passed to the {@link SqlObfuscator} on every call.
 *
 * @param replaceDigits   replace digits inside identifiers (e.g. partition suffixes) with {@code ?}
 * @param collectTables   collect referenced table names
 * @param collectCommands collect SQL commands
 * @param collectComments collect comments stripped from the text
 */
public record ObfuscatorOptions(
        boolean replaceDigits,
        boolean collectTables,
        boolean collectCommands,
        boolean collectComments
) {
    public static final ObfuscatorOptions DEFAULT = new ObfuscatorOptions(false, true, true, true);

    public static ObfuscatorOptions from(StatementMetricsConfig.Obfuscator config) {
        return new ObfuscatorOptions(
                config.replaceDigits(),
                config.collectTables(),
                config.collectCommands(),
                config.collectComments()
        );
    }
}
