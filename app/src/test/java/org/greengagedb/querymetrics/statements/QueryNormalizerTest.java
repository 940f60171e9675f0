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

import org.greengagedb.querymetrics.obfuscation.ObfuscatedStatement;
import org.greengagedb.querymetrics.obfuscation.ObfuscationException;
import org.greengagedb.querymetrics.obfuscation.ObfuscatorOptions;
import org.greengagedb.querymetrics.obfuscation.QuerySignatures;
import org.greengagedb.querymetrics.obfuscation.SqlObfuscator;
import org.greengagedb.querymetrics.obfuscation.StatementMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.greengagedb.querymetrics.statements.StatementRowFixtures.row;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QueryNormalizerTest {

    @Mock
    private SqlObfuscator obfuscator;

    private QueryNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new QueryNormalizer(obfuscator, ObfuscatorOptions.DEFAULT);
    }

    @Test
    void testNormalize_ReplacesQueryAndAttachesSignature() throws Exception {
        // Setup
        StatementMetadata metadata = new StatementMetadata("users", List.of("SELECT"), List.of());
        when(obfuscator.obfuscate(eq("SELECT * FROM users WHERE id = 7"), any()))
                .thenReturn(new ObfuscatedStatement("SELECT * FROM users WHERE id = ?", metadata));

        // Execute
        List<NormalizedRow> result = normalizer.normalize(
                List.of(row("SELECT * FROM users WHERE id = 7", "orders", "app", 1, 1)));

        // Verify
        assertEquals(1, result.size());
        NormalizedRow normalized = result.get(0);
        assertEquals("SELECT * FROM users WHERE id = ?", normalized.row().query());
        assertEquals(QuerySignatures.compute("SELECT * FROM users WHERE id = ?"), normalized.querySignature());
        assertEquals(List.of("users"), normalized.metadata().tables());
        assertEquals(1L, normalized.row().metric(StatementColumn.CALLS));
    }

    @Test
    void testNormalize_ObfuscationFailure_RowDropped() throws Exception {
        // Setup
        when(obfuscator.obfuscate(eq("SELECT 1"), any()))
                .thenReturn(new ObfuscatedStatement("SELECT ?", StatementMetadata.EMPTY));
        when(obfuscator.obfuscate(eq("SELECT 'unterminated"), any()))
                .thenThrow(new ObfuscationException("Unterminated string literal"));
        when(obfuscator.obfuscate(eq("SELECT 2"), any()))
                .thenReturn(new ObfuscatedStatement("SELECT ?", StatementMetadata.EMPTY));

        // Execute
        List<NormalizedRow> result = normalizer.normalize(List.of(
                row("SELECT 1", "orders", "app", 1, 1),
                row("SELECT 'unterminated", "orders", "app", 1, 1),
                row("SELECT 2", "orders", "report", 1, 1)));

        // Verify
        assertEquals(2, result.size());
        assertEquals("app", result.get(0).row().roleName());
        assertEquals("report", result.get(1).row().roleName());
    }

    @Test
    void testNormalize_UnexpectedObfuscatorError_RowDropped() throws Exception {
        when(obfuscator.obfuscate(any(), any())).thenThrow(new IllegalStateException("boom"));

        assertTrue(normalizer.normalize(List.of(row("SELECT 1", "orders", "app", 1, 1))).isEmpty());
    }

    @Test
    void testNormalize_DifferentLiterals_ShareSignature() throws Exception {
        when(obfuscator.obfuscate(any(), any()))
                .thenReturn(new ObfuscatedStatement("SELECT ?", StatementMetadata.EMPTY));

        List<NormalizedRow> result = normalizer.normalize(List.of(
                row("SELECT 1", "orders", "app", 1, 1),
                row("SELECT 2", "orders", "app", 1, 1)));

        assertEquals(result.get(0).identity(), result.get(1).identity());
    }
}
