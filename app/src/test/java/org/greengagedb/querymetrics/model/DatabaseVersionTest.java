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
package org.greengagedb.querymetrics.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseVersionTest {

    @Test
    void testParseVersion() {
        String versionString = "PostgreSQL 9.4.26 (Greengage Database 6.26.35_arenadata53 build 2625.gitac00af7.el7) on x86_64-unknown-linux-gnu";
        DatabaseVersion version = DatabaseVersion.parse(versionString);

        assertNotNull(version);
        assertEquals(9, version.major());
        assertEquals(4, version.minor());
        assertEquals(26, version.patch());
        assertEquals("9.4.26", version.fullVersion());
    }

    @Test
    void testParseVersion_TwoComponents() {
        String versionString = "PostgreSQL 12.22 (Greengage Database 7.3.0+dev.840.g53480a5ef6 build 240+git53480a5) " +
                "on x86_64-pc-linux-gnu, compiled by gcc (Ubuntu 11.4.0-1ubuntu1~22.04.2) 11.4.0, 64-bit";
        DatabaseVersion version = DatabaseVersion.parse(versionString);

        assertNotNull(version);
        assertEquals("12.22.0", version.fullVersion());
        assertTrue(version.supportsStatementsWithoutText());
    }

    @Test
    void testParseInvalidVersion() {
        assertNull(DatabaseVersion.parse("Greengage Database 6.26.35"));
        assertNull(DatabaseVersion.parse("   "));
    }

    @Test
    void testParseNullVersion() {
        assertNull(DatabaseVersion.parse(null));
    }

    @Test
    void testSupportsStatementsWithoutText() {
        assertTrue(DatabaseVersion.parse("PostgreSQL 9.4.26").supportsStatementsWithoutText());
        assertFalse(DatabaseVersion.parse("PostgreSQL 9.3.25").supportsStatementsWithoutText());
        assertFalse(DatabaseVersion.parse("PostgreSQL 8.3.23 (Greenplum Database 5.28.0)").supportsStatementsWithoutText());
        assertTrue(DatabaseVersion.parse("PostgreSQL 10.0").supportsStatementsWithoutText());
    }

    @Test
    void testPayloadVersion() {
        assertEquals("v9.4.26", DatabaseVersion.payloadVersion(DatabaseVersion.parse("PostgreSQL 9.4.26")));
        assertEquals("", DatabaseVersion.payloadVersion(null));
    }
}
