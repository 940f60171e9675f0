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

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Rate limits full query text events to a configured number per hour per identity.
 *
 * <p>An identity is let through when it is absent from a bounded cache whose entries
 * expire {@code 3600 / samplesPerHour} seconds after insertion; letting it through inserts it.
 * When the cache is full the least valuable entry is evicted, which can let an identity
 * through early.
 */
public class FullTextSampler {

    private final Cache<RowIdentity, Boolean> seen;

    public FullTextSampler(int maxSize, double samplesPerHourPerQuery) {
        this(maxSize, samplesPerHourPerQuery, Ticker.systemTicker());
    }

    public FullTextSampler(int maxSize, double samplesPerHourPerQuery, Ticker ticker) {
        this.seen = Caffeine.newBuilder()
                .executor(Runnable::run)
                .ticker(ticker)
                .maximumSize(maxSize)
                .expireAfterWrite(ttl(samplesPerHourPerQuery))
                .build();
    }

    static Duration ttl(double samplesPerHourPerQuery) {
        if (!(samplesPerHourPerQuery > 0)) {
            throw new IllegalArgumentException(
                    "Samples per hour per query must be positive: " + samplesPerHourPerQuery);
        }
        return Duration.ofMillis(Math.max(1L, Math.round(3_600_000d / samplesPerHourPerQuery)));
    }

    /**
     * Lazily build events for the rows let through by the rate limit. Identities are
     * marked as sampled while the stream is consumed, so it must be consumed once.
     */
    public <E> Stream<E> sample(List<NormalizedRow> rows, Function<NormalizedRow, E> eventFactory) {
        return rows.stream()
                .filter(row -> seen.asMap().putIfAbsent(row.identity(), Boolean.TRUE) == null)
                .map(eventFactory);
    }

    long estimatedSize() {
        seen.cleanUp();
        return seen.estimatedSize();
    }
}
