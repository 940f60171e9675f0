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
import io.agroal.api.configuration.supplier.AgroalPropertiesReader;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.sql.SQLException;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Creates DataSources for databases other than the one the default datasource points at.
 *
 * <p>Each DataSource holds a single connection with a short lifetime, since the
 * statement metrics job uses it once per cycle.
 */
@Slf4j
@ApplicationScoped
public class DbDatasourceFactory {

    private static final int CONNECTION_POOL_SIZE = 1;
    private static final int CONNECTION_MAX_LIFETIME_SECONDS = 120;

    // jdbc:postgresql://host:port/<database>[?params]
    private static final Pattern DATABASE_IN_URL = Pattern.compile("/([^/?]*)(\\?.*)?$");

    @ConfigProperty(name = "quarkus.datasource.jdbc.url")
    String jdbcUrl;

    @ConfigProperty(name = "quarkus.datasource.username")
    String username;

    @ConfigProperty(name = "quarkus.datasource.password")
    String password;

    /**
     * Create a new DataSource for the specified database.
     *
     * @param databaseName Name of the target database
     * @return Configured AgroalDataSource for the database
     * @throws SQLException             If DataSource creation fails
     * @throws IllegalArgumentException If database name is invalid
     */
    public AgroalDataSource create(String databaseName) throws SQLException {
        validateDatabaseName(databaseName);

        Map<String, String> props = new HashMap<>();
        props.put(AgroalPropertiesReader.JDBC_URL, createJdbcUrlForDatabase(databaseName));
        props.put(AgroalPropertiesReader.PRINCIPAL, username);
        props.put(AgroalPropertiesReader.CREDENTIAL, password);
        props.put(AgroalPropertiesReader.MAX_SIZE, String.valueOf(CONNECTION_POOL_SIZE));
        props.put(AgroalPropertiesReader.MIN_SIZE, "0");
        props.put(AgroalPropertiesReader.INITIAL_SIZE, "0");
        props.put(AgroalPropertiesReader.MAX_LIFETIME_S, String.valueOf(CONNECTION_MAX_LIFETIME_SECONDS));

        try {
            AgroalDataSource dataSource = AgroalDataSource.from(
                    new AgroalPropertiesReader().readProperties(props).get()
            );
            log.debug("Created DataSource for database '{}'", databaseName);
            return dataSource;
        } catch (SQLException e) {
            log.error("Failed to create DataSource for database '{}': {}", databaseName, e.getMessage());
            throw e;
        }
    }

    /**
     * Point the configured JDBC URL at another database, keeping its parameters.
     *
     * @param databaseName Name of the target database
     * @return Modified JDBC URL
     */
    public String createJdbcUrlForDatabase(String databaseName) {
        Matcher matcher = DATABASE_IN_URL.matcher(jdbcUrl);
        String modifiedUrl = matcher.replaceFirst(Matcher.quoteReplacement("/" + databaseName) + "$2");
        log.trace("Created JDBC URL for database '{}': {}", databaseName, modifiedUrl);
        return modifiedUrl;
    }

    /**
     * @return database named in the configured JDBC URL, empty if none
     */
    public String defaultDatabaseName() {
        Matcher matcher = DATABASE_IN_URL.matcher(jdbcUrl);
        return matcher.find() ? matcher.group(1) : "";
    }

    private void validateDatabaseName(String databaseName) {
        if (databaseName == null || databaseName.trim().isEmpty()) {
            throw new IllegalArgumentException("Database name cannot be null or empty");
        }

        if (databaseName.contains(";") || databaseName.contains("'") || databaseName.contains("/")
                || databaseName.contains("?") || databaseName.contains("\"") || databaseName.contains("--")) {
            throw new IllegalArgumentException("Database name contains invalid characters: " + databaseName);
        }
    }
}
