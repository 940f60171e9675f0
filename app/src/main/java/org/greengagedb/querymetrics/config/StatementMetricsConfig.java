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
package org.greengagedb.querymetrics.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Configuration of the statement metrics job
 */
@ConfigMapping(prefix = "app.statements")
public interface StatementMetricsConfig {

    Duration DEFAULT_COLLECTION_INTERVAL = Duration.ofSeconds(10);

    @WithDefault("true")
    boolean enabled();

    /**
     * Period of the collection job. Non-positive values fall back to
     * {@link #DEFAULT_COLLECTION_INTERVAL}.
     */
    @WithDefault("10s")
    Duration collectionInterval();

    /**
     * Database the job connects to; statistics are read from all databases unless
     * {@link #dbStrict()} is set.
     */
    @WithDefault("postgres")
    String dbname();

    @WithDefault("false")
    boolean dbStrict();

    @WithDefault("pg_stat_statements")
    String view();

    @WithDefault("10000")
    int maxRows();

    @WithDefault("10000")
    int fullStatementTextCacheMaxSize();

    @WithDefault("1")
    double fullStatementTextSamplesPerHourPerQuery();

    Optional<String> host();

    Optional<List<String>> tags();

    Obfuscator obfuscator();

    default Duration effectiveCollectionInterval() {
        Duration interval = collectionInterval();
        if (interval == null || interval.isZero() || interval.isNegative()) {
            return DEFAULT_COLLECTION_INTERVAL;
        }
        return interval;
    }

    interface Obfuscator {
        @WithDefault("false")
        boolean replaceDigits();

        @WithDefault("true")
        boolean collectTables();

        @WithDefault("true")
        boolean collectCommands();

        @WithDefault("true")
        boolean collectComments();
    }
}
