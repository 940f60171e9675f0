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

/**
 * Configuration of the job runner: connectivity retries and cycle result caching.
 */
@ConfigMapping(prefix = "app.runner")
public interface RunnerConfig {

    /**
     * Number of attempts of the connectivity test before a cycle is abandoned.
     *
     * @return Number of retry attempts (default: 3)
     */
    @WithDefault("3")
    int connectionRetryAttempts();

    /**
     * Base delay between connectivity attempts; the actual delay is delay * attempt_number.
     *
     * @return Base retry delay (default: 1 second)
     */
    @WithDefault("1s")
    Duration connectionRetryDelay();

    /**
     * Maximum age of the last successful cycle before the health check reports it as stale.
     *
     * @return Maximum result age (default: 30 seconds)
     */
    @WithDefault("30s")
    Duration resultCacheMaxAge();
}
