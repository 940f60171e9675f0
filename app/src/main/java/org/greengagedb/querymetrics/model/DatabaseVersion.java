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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * PostgreSQL server version reported by {@code SELECT version()}.
 *
 * <p>Greengage reports the PostgreSQL version it is based on first, followed by
 * its own version in parentheses; the statistics view follows the PostgreSQL one.
 */
public record DatabaseVersion(int major, int minor, int patch, String rawVersion) {
    private static final Pattern PG_VERSION_REGEX = Pattern.compile(
            "PostgreSQL\\s+(\\d+)(?:\\.(\\d+))?(?:\\.(\\d+))?"
    );

    private static final int MAJOR_GROUP = 1;
    private static final int MINOR_GROUP = 2;
    private static final int PATCH_GROUP = 3;

    /**
     * Parse version from PostgreSQL/Greengage version() output
     *
     * @param versionString The version string from SELECT version()
     * @return Parsed version or null if parsing fails
     */
    public static DatabaseVersion parse(String versionString) {
        if (versionString == null || versionString.isBlank()) {
            return null;
        }
        final String input = versionString.trim();
        final Matcher matcher = PG_VERSION_REGEX.matcher(input);
        if (!matcher.find()) {
            return null;
        }
        final int major = Integer.parseInt(matcher.group(MAJOR_GROUP));
        final int minor = parseOptional(matcher.group(MINOR_GROUP));
        final int patch = parseOptional(matcher.group(PATCH_GROUP));
        return new DatabaseVersion(major, minor, patch, input);
    }

    private static int parseOptional(String group) {
        return group == null ? 0 : Integer.parseInt(group);
    }

    public boolean isAtLeast(int otherMajor, int otherMinor) {
        if (major != otherMajor) {
            return major > otherMajor;
        }
        return minor >= otherMinor;
    }

    /**
     * {@code pg_stat_statements(showtext)} is available from 9.4 on.
     */
    public boolean supportsStatementsWithoutText() {
        return isAtLeast(9, 4);
    }

    public String fullVersion() {
        return major + "." + minor + "." + patch;
    }

    /**
     * Version string as reported in the metrics payload.
     *
     * @param version resolved version (may be null)
     * @return {@code v<major>.<minor>.<patch>} or an empty string if unknown
     */
    public static String payloadVersion(DatabaseVersion version) {
        if (version == null) {
            return "";
        }
        return "v" + version.fullVersion();
    }
}
