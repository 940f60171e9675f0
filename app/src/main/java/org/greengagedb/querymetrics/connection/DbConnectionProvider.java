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
package org.greengagedb.querymetrics.connection;

import io.agroal.api.AgroalDataSource;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.greengagedb.querymetrics.db.DatabaseService;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out connections to a named database.
 *
 * <p>The database of the default datasource is served from its pool; any other database
 * gets a small DataSource created on first use and kept until shutdown.
 */
@Slf4j
@ApplicationScoped
public class DbConnectionProvider {

    private final Map<String, AgroalDataSource> dataSourceCache = new ConcurrentHashMap<>();

    private final DatabaseService databaseService;
    private final DbDatasourceFactory datasourceFactory;

    @Inject
    public DbConnectionProvider(DatabaseService databaseService, DbDatasourceFactory datasourceFactory) {
        this.databaseService = databaseService;
        this.datasourceFactory = datasourceFactory;
    }

    /**
     * @param databaseName target database, or null for the default datasource
     * @return open connection; the caller closes it
     * @throws SQLException if no connection could be obtained
     */
    public Connection getConnection(String databaseName) throws SQLException {
        if (databaseName == null || databaseName.equals(datasourceFactory.defaultDatabaseName())) {
            return databaseService.getPooledConnection();
        }
        AgroalDataSource dataSource = dataSourceCache.get(databaseName);
        if (dataSource == null) {
            log.debug("Creating DataSource for database: {}", databaseName);
            AgroalDataSource created = datasourceFactory.create(databaseName);
            dataSource = dataSourceCache.putIfAbsent(databaseName, created);
            if (dataSource == null) {
                dataSource = created;
            } else {
                created.close();
            }
        }
        return dataSource.getConnection();
    }

    int cachedDataSourceCount() {
        return dataSourceCache.size();
    }

    @PreDestroy
    public void close() {
        if (!dataSourceCache.isEmpty()) {
            log.debug("Closing {} DataSources", dataSourceCache.size());
            dataSourceCache.values().forEach(AgroalDataSource::close);
            dataSourceCache.clear();
        }
    }
}
