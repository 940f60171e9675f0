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

import java.sql.Connection;
import java.util.Set;

/**
 * Discovers the columns currently exposed by the statistics view.
 *
 * <p>The version number is not a reliable way to tell the view's shape: the extension can
 * be upgraded independently of the server. A zero-row wildcard query is issued instead and
 * the result descriptor recorded. The result is cached until {@link #invalidate()}.
 *
 * <p>Not thread-safe; owned by a single job.
 */
@Slf4j
public class StatColumnDiscovery {

    private final StatementQueryExecutor executor;
    private final StatementQueries queries;
    private Set<String> cachedColumns = Set.of();

    public StatColumnDiscovery(StatementQueryExecutor executor, StatementQueries queries) {
        this.executor = executor;
        this.queries = queries;
    }

    /**
     * @return available column names (lower-case)
     * @throws StatementQueryException if the probe query fails; the cache stays empty
     */
    public Set<String> columns(Connection connection) throws StatementQueryException {
        if (!cachedColumns.isEmpty()) {
            return cachedColumns;
        }
        Set<String> discovered = Set.copyOf(executor.describeColumns(connection, queries.discoveryQuery()));
        log.debug("Discovered {} columns in the statistics view", discovered.size());
        cachedColumns = discovered;
        return cachedColumns;
    }

    public void invalidate() {
        if (!cachedColumns.isEmpty()) {
            log.debug("Invalidating statistics view column cache");
        }
        cachedColumns = Set.of();
    }

    public boolean isCached() {
        return !cachedColumns.isEmpty();
    }
}
