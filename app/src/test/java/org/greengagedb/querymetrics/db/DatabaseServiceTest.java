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
import io.agroal.api.configuration.AgroalConnectionFactoryConfiguration;
import io.agroal.api.configuration.AgroalConnectionPoolConfiguration;
import io.agroal.api.configuration.AgroalDataSourceConfiguration;
import org.greengagedb.querymetrics.model.DatabaseVersion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DatabaseServiceTest {

    private static final String GG6_VERSION =
            "PostgreSQL 9.4.26 (Greengage Database 6.26.35 build 2625.gitac00af7.el7) on x86_64-unknown-linux-gnu";

    private DatabaseService databaseService;

    @Mock
    private AgroalDataSource dataSource;

    @Mock
    private AgroalDataSourceConfiguration dataSourceConfig;

    @Mock
    private AgroalConnectionPoolConfiguration poolConfig;

    @Mock
    private AgroalConnectionFactoryConfiguration factoryConfig;

    @Mock
    private Connection mockConnection;

    @Mock
    private Statement mockStatement;

    @Mock
    private ResultSet mockResultSet;

    @BeforeEach
    void setUp() {
        databaseService = new DatabaseService(dataSource);
    }

    private void stubQuery(String sql) throws SQLException {
        when(dataSource.getConnection()).thenReturn(mockConnection);
        when(mockConnection.createStatement()).thenReturn(mockStatement);
        when(mockStatement.executeQuery(sql)).thenReturn(mockResultSet);
    }

    @Test
    void testConstructor_NullDataSource_ThrowsException() {
        assertThrows(NullPointerException.class, () -> new DatabaseService(null));
    }

    @Test
    void testGetUrl_Exception_ReturnsUnavailable() {
        // Setup
        when(dataSource.getConfiguration()).thenThrow(new RuntimeException("Config error"));

        // Execute
        String url = databaseService.getUrl();

        // Verify
        assertEquals("unavailable", url);
    }

    @Test
    void testGetUrl_Success() {
        // Setup
        when(dataSource.getConfiguration()).thenReturn(dataSourceConfig);
        when(dataSourceConfig.connectionPoolConfiguration()).thenReturn(poolConfig);
        when(poolConfig.connectionFactoryConfiguration()).thenReturn(factoryConfig);
        when(factoryConfig.jdbcUrl()).thenReturn("jdbc:postgresql://localhost:5432/postgres");

        // Execute
        String url = databaseService.getUrl();

        // Verify
        assertEquals("jdbc:postgresql://localhost:5432/postgres", url);
    }

    @Test
    void testGetPooledConnection_ThrowsSQLException() throws SQLException {
        // Setup
        when(dataSource.getConnection()).thenThrow(new SQLException("Connection pool exhausted"));

        // Execute & Verify
        assertThrows(SQLException.class, () -> databaseService.getPooledConnection());
    }

    @Test
    void testTestConnection_Success() throws SQLException {
        // Setup
        stubQuery(DatabaseService.PING_QUERY);
        when(mockResultSet.next()).thenReturn(true);
        when(mockResultSet.getInt(1)).thenReturn(1);

        // Execute
        boolean result = databaseService.testConnection();

        // Verify
        assertTrue(result);
        verify(mockResultSet).close();
        verify(mockStatement).close();
        verify(mockConnection).close();
    }

    @Test
    void testTestConnection_QueryFails_ReturnsFalse() throws SQLException {
        // Setup
        when(dataSource.getConnection()).thenThrow(new SQLException("Connection failed"));

        // Execute & Verify
        assertFalse(databaseService.testConnection());
    }

    @Test
    void testTestConnection_UnexpectedException_ReturnsFalse() throws SQLException {
        // Setup
        when(dataSource.getConnection()).thenReturn(mockConnection);
        when(mockConnection.createStatement()).thenThrow(new RuntimeException("Unexpected error"));

        // Execute & Verify
        assertFalse(databaseService.testConnection());
    }

    @Test
    void testServerVersion_Success() throws Exception {
        // Setup
        stubQuery(DatabaseService.VERSION_QUERY);
        when(mockResultSet.next()).thenReturn(true);
        when(mockResultSet.getString(1)).thenReturn(GG6_VERSION);

        // Execute
        Optional<DatabaseVersion> version = databaseService.serverVersion();

        // Verify
        assertEquals("9.4.26", version.orElseThrow().fullVersion());
        assertEquals(Optional.of(GG6_VERSION), databaseService.rawServerVersion());
        verify(mockConnection).close();
    }

    @Test
    void testServerVersion_Caching_SecondCallReturnsCached() throws Exception {
        // Setup
        stubQuery(DatabaseService.VERSION_QUERY);
        when(mockResultSet.next()).thenReturn(true);
        when(mockResultSet.getString(1)).thenReturn(GG6_VERSION);

        // Execute
        DatabaseVersion version1 = databaseService.serverVersion().orElseThrow();
        DatabaseVersion version2 = databaseService.serverVersion().orElseThrow();

        // Verify - database queried only once
        assertSame(version1, version2);
        verify(mockConnection, times(1)).createStatement();
    }

    @Test
    void testServerVersion_UnrecognizedFormat_EmptyAndCached() throws Exception {
        // Setup
        stubQuery(DatabaseService.VERSION_QUERY);
        when(mockResultSet.next()).thenReturn(true);
        when(mockResultSet.getString(1)).thenReturn("Greengage Database 6.26.35");

        // Execute
        Optional<DatabaseVersion> first = databaseService.serverVersion();
        Optional<DatabaseVersion> second = databaseService.serverVersion();

        // Verify - unknown version is not an error and is not looked up again
        assertTrue(first.isEmpty());
        assertTrue(second.isEmpty());
        assertEquals(Optional.of("Greengage Database 6.26.35"), databaseService.rawServerVersion());
        verify(mockConnection, times(1)).createStatement();
    }

    @Test
    void testServerVersion_NoRows_ThrowsSQLException() throws SQLException {
        // Setup
        stubQuery(DatabaseService.VERSION_QUERY);
        when(mockResultSet.next()).thenReturn(false);

        // Execute & Verify
        assertThrows(SQLException.class, () -> databaseService.serverVersion());
        assertTrue(databaseService.rawServerVersion().isEmpty());
    }

    @Test
    void testServerVersion_ConnectionFailure_ThrowsSQLException() throws SQLException {
        // Setup
        when(dataSource.getConnection()).thenThrow(new SQLException("Connection failed"));

        // Execute & Verify
        assertThrows(SQLException.class, () -> databaseService.serverVersion());
    }
}
