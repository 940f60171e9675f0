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

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Helpers for handling nullable column values and cumulative counter arithmetic.
 *
 * <p>Counter columns arrive either as integral JDBC types (bigint) or as
 * floating point (double precision timings). Integral values stay {@code long}
 * through subtraction so large counters never lose precision.
 */
@UtilityClass
public final class ValueUtils {

    private static final String UNKNOWN = "unknown";

    public static String getOrUnknown(String value) {
        return value == null ? UNKNOWN : value;
    }

    /**
     * Normalize a raw JDBC value of a metric column to {@link Long} or {@link Double}.
     *
     * @param value raw value (may be null)
     * @return normalized number, or null if the value is null or not numeric
     */
    public static Number toMetricNumber(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Long || value instanceof Double) {
            return (Number) value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        if (value instanceof BigInteger bigInteger) {
            return bigInteger.longValue();
        }
        if (value instanceof BigDecimal decimal) {
            BigDecimal stripped = decimal.stripTrailingZeros();
            return stripped.scale() <= 0 ? (Number) decimal.longValue() : (Number) decimal.doubleValue();
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return null;
    }

    public static boolean isIntegral(Number value) {
        return value instanceof Long || value instanceof Integer
                || value instanceof Short || value instanceof Byte;
    }

    /**
     * @return {@code current - previous}, integral when both operands are integral
     */
    public static Number subtract(Number current, Number previous) {
        if (isIntegral(current) && isIntegral(previous)) {
            return current.longValue() - previous.longValue();
        }
        return current.doubleValue() - previous.doubleValue();
    }

    public static Number add(Number left, Number right) {
        if (left == null) {
            return right;
        }
        if (right == null) {
            return left;
        }
        if (isIntegral(left) && isIntegral(right)) {
            return left.longValue() + right.longValue();
        }
        return left.doubleValue() + right.doubleValue();
    }

    public static boolean isLessThan(Number current, Number previous) {
        if (isIntegral(current) && isIntegral(previous)) {
            return current.longValue() < previous.longValue();
        }
        return Double.compare(current.doubleValue(), previous.doubleValue()) < 0;
    }

    /**
     * Truncate text to at most {@code maxLength} code points, never splitting a surrogate pair.
     */
    public static String truncate(String text, int maxLength) {
        if (text == null || text.codePointCount(0, text.length()) <= maxLength) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, maxLength));
    }
}
