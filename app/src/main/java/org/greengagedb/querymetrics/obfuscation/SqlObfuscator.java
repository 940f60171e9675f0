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

/**
 * Obfuscates SQL text: strips literal values and extracts metadata.
 *
 * <p>Implementations must be deterministic: the same input and options always yield the
 * same obfuscated text, since the query signature is derived from it.
 */
public interface SqlObfuscator {

    /**
     * @param sql     raw SQL text as reported by the statistics view
     * @param options obfuscation options
     * @return obfuscated text with parsed metadata
     * @throws ObfuscationException if the text cannot be obfuscated (malformed or truncated SQL)
     */
    ObfuscatedStatement obfuscate(String sql, ObfuscatorOptions options) throws ObfuscationException;
}
