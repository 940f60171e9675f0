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
package org.greengagedb.querymetrics.db;

import io.agroal.api.AgroalDataSource;
import io.smallrye.faulttolerance.api.CircuitBreakerName;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.faulttolerance.CircuitBreaker;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.eclipse.microprofile.faulttolerance.Timeout;
import org.greengagedb.querymetrics.model.DatabaseVersion;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The monitored server as seen through the default datasource: connectivity and version.
 *
 * <p>The version is optional. A server whose {@code version()} output cannot be parsed is
 * still collected from; only version-dependent choices fall back to their defaults.
 */
@Slf4j
@ApplicationScoped
public class DatabaseService {
    static final String VERSION_QUERY = "SELECT version()";
    static final String PING_QUERY = "SELECT 1";

    private final AgroalDataSource dataSource;
    private final AtomicReference<ServerVersion> serverVersion = new AtomicReference<>();

    /**
     * What {@code version()} reported, parsed when the format is recognized.
     */
    private record ServerVersion(String raw, DatabaseVersion parsed) {
    }

    @Inject
    public DatabaseService(AgroalDataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    /**
     * @return JDBC URL of the default datasource, or "unavailable"
     */
    public String getUrl() {
        try {
            return dataSource.getConfiguration().connectionPoolConfiguration()
                    .connectionFactoryConfiguration().jdbcUrl();
        } catch (Exception e) {
            log.debug("Could not retrieve JDBC URL", e);
            return "unavailable";
        }
    }

    public Connection getPooledConnection() throws SQLException {
        return dataSource.getConnection();
    }

    /**
     * Look up the server version once and remember it.
     *
     * @return parsed version, or empty when the server reports a format that is not recognized
     * @throws SQLException if the server could not be asked
     */
    @Retry(delay = 1, delayUnit = ChronoUnit.SECONDS)
    @Timeout(value = 5, unit = ChronoUnit.SECONDS)
    @CircuitBreaker(requestVolumeThreshold = 10, delay = 30, delayUnit = ChronoUnit.SECONDS)
    @CircuitBreakerName("version-detection")
    public Optional<DatabaseVersion> serverVersion() throws SQLException {
        ServerVersion known = serverVersion.get();
        if (known == null) {
            known = lookupVersion();
            if (serverVersion.compareAndSet(null, known) && known.parsed() == null) {
                log.warn("Unrecognized server version '{}', collecting without version-specific behavior",
                        known.raw());
            }
        }
        return Optional.ofNullable(known.parsed());
    }

    /**
     * @return raw {@code version()} output, empty until the version was looked up
     */
    public Optional<String> rawServerVersion() {
        return Optional.ofNullable(serverVersion.get()).map(ServerVersion::raw);
    }

    /**
     * Cheap round trip through the pool.
     */
    @Timeout(value = 5, unit = ChronoUnit.SECONDS)
    public boolean testConnection() {
        try (Connection conn = getPooledConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(PING_QUERY)) {
            return rs.next() && rs.getInt(1) == 1;
        } catch (SQLException e) {
            log.debug("Connection test failed", e);
            return false;
        } catch (Exception e) {
            log.warn("Unexpected error during connection test", e);
            return false;
        }
    }

    private ServerVersion lookupVersion() throws SQLException {
        try (Connection conn = getPooledConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(VERSION_QUERY)) {
            if (!rs.next()) {
                throw new SQLException("version() returned no rows");
            }
            String raw = rs.getString(1);
            log.debug("Server reports version: {}", raw);
            return new ServerVersion(raw, DatabaseVersion.parse(raw));
        }
    }
}
