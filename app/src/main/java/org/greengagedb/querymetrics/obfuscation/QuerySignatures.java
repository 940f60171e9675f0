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
package org.greengagedb.querymetrics.obfuscation;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import lombok.experimental.UtilityClass;

import java.nio.charset.StandardCharsets;

/**
 * Computes query signatures: stable fingerprints of obfuscated SQL text used as grouping keys.
 */
@UtilityClass
public final class QuerySignatures {

    private static final HashFunction MURMUR3 = Hashing.murmur3_128();

    /**
     * First 64 bits of MurmurHash3 x64/128 (seed 0) of the UTF-8 text, as unsigned hex.
     *
     * @param obfuscatedQuery obfuscated SQL text
     * @return lower-case hexadecimal signature
     */
    public static String compute(String obfuscatedQuery) {
        long hash = MURMUR3.hashString(obfuscatedQuery, StandardCharsets.UTF_8).asLong();
        return Long.toHexString(hash);
    }
}
