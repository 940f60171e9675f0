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
package org.greengagedb.querymetrics.job;

import java.time.Duration;
import java.time.Instant;

/**
 * Result of a collection cycle, including timing and status information.
 *
 * @param timestamp      When the cycle started
 * @param outcome        How the cycle ended
 * @param emittedRows    Number of rows in the emitted metrics payload
 * @param fullTextEvents Number of full query text events emitted
 * @param error          Optional error if the cycle failed
 */
public record CycleResult(Instant timestamp, Outcome outcome, int emittedRows, int fullTextEvents, Throwable error) {

    public enum Outcome {
        /**
         * A metrics payload was emitted.
         */
        EMITTED,
        /**
         * Nothing to emit: no rows, a soft failure, or only first sightings.
         */
        NO_DATA,
        /**
         * Shutdown was requested between stages.
         */
        INTERRUPTED,
        FAILED
    }

    public static CycleResult emitted(Instant start, int emittedRows, int fullTextEvents) {
        return new CycleResult(start, Outcome.EMITTED, emittedRows, fullTextEvents, null);
    }

    public static CycleResult noData(Instant start) {
        return new CycleResult(start, Outcome.NO_DATA, 0, 0, null);
    }

    public static CycleResult interrupted(Instant start) {
        return new CycleResult(start, Outcome.INTERRUPTED, 0, 0, null);
    }

    /**
     * Create a failed cycle result without error details.
     *
     * @param start When the cycle started
     * @return Failed cycle result
     */
    public static CycleResult failed(Instant start) {
        return new CycleResult(start, Outcome.FAILED, 0, 0, null);
    }

    public static CycleResult failed(Instant start, Throwable error) {
        return new CycleResult(start, Outcome.FAILED, 0, 0, error);
    }

    public boolean successful() {
        return outcome != Outcome.FAILED;
    }

    /**
     * Check if this result is too old to describe the current state.
     *
     * @param maxAge Maximum age before result is considered stale
     * @return true if the result is older than maxAge
     */
    public boolean isStale(Duration maxAge) {
        return getAge().compareTo(maxAge) > 0;
    }

    public Duration getAge() {
        return Duration.between(timestamp, Instant.now());
    }
}
