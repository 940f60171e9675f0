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
package org.greengagedb.querymetrics.common;

import lombok.experimental.UtilityClass;

/**
 * Global constants for the query metrics collector
 */
@UtilityClass
public final class Constants {
    public static final String NAMESPACE = "greengage";
    public static final String SUBSYSTEM_STATEMENTS = "statements";
    public static final String SUBSYSTEM_COLLECTOR = "collector";

    public static final String SOURCE_POSTGRES = "postgres";
    public static final String EVENT_TYPE_FULL_QUERY_TEXT = "fqt";

    public static final String TAG_DB = "db";
    public static final String TAG_ROLNAME = "rolname";
    public static final String TAG_ERROR = "error";

    /**
     * Maximum length of query text carried in the metrics payload.
     */
    public static final int MAX_DISPLAY_QUERY_LENGTH = 200;

    public static final String ROW_KEY_QUERY_SIGNATURE = "query_signature";
    public static final String ROW_KEY_TABLES = "gg_tables";
    public static final String ROW_KEY_COMMANDS = "gg_commands";
}
