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

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class ValueUtilsTest {

    @Test
    void testGetOrUnknown_WithNull() {
        assertEquals("unknown", ValueUtils.getOrUnknown(null), "Null value should return 'unknown'");
    }

    @Test
    void testGetOrUnknown_WithEmptyString() {
        assertEquals("", ValueUtils.getOrUnknown(""), "Empty string should be returned as-is");
    }

    @Test
    void testToMetricNumber_IntegralTypesBecomeLong() {
        assertEquals(5L, ValueUtils.toMetricNumber(5));
        assertEquals(5L, ValueUtils.toMetricNumber((short) 5));
        assertEquals(5L, ValueUtils.toMetricNumber(BigInteger.valueOf(5)));
        assertEquals(5L, ValueUtils.toMetricNumber(new BigDecimal("5.000")));
    }

    @Test
    void testToMetricNumber_FractionalTypesBecomeDouble() {
        assertEquals(1.5, ValueUtils.toMetricNumber(1.5f));
        assertEquals(2.25, ValueUtils.toMetricNumber(new BigDecimal("2.25")));
    }

    @Test
    void testToMetricNumber_NullOrNonNumeric() {
        assertNull(ValueUtils.toMetricNumber(null));
        assertNull(ValueUtils.toMetricNumber("12"));
    }

    @Test
    void testSubtract_KeepsLongPrecision() {
        long big = Long.MAX_VALUE - 1;
        assertEquals(1L, ValueUtils.subtract(big, big - 1));
        assertEquals(0.5, ValueUtils.subtract(2L, 1.5));
    }

    @Test
    void testAdd_NullOperands() {
        assertEquals(3L, ValueUtils.add(null, 3L));
        assertEquals(3L, ValueUtils.add(3L, null));
        assertEquals(7L, ValueUtils.add(3L, 4L));
        assertEquals(3.5, ValueUtils.add(3L, 0.5));
    }

    @Test
    void testIsLessThan() {
        assertTrue(ValueUtils.isLessThan(4L, 5L));
        assertFalse(ValueUtils.isLessThan(5L, 5L));
        assertTrue(ValueUtils.isLessThan(1.0, 1.5));
    }

    @Test
    void testTruncate() {
        assertEquals("abc", ValueUtils.truncate("abcdef", 3));
        assertEquals("ab", ValueUtils.truncate("ab", 3));
        assertNull(ValueUtils.truncate(null, 3));
    }

    @Test
    void testTruncate_CountsCodePoints() {
        // each emoji is one code point but two chars
        String text = "ab\uD83D\uDE00\uD83D\uDE01";

        assertEquals("ab\uD83D\uDE00", ValueUtils.truncate(text, 3));
        assertEquals(text, ValueUtils.truncate(text, 4));
    }
}
