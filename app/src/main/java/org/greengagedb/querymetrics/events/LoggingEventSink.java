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
package org.greengagedb.querymetrics.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes events as JSON lines to the {@code org.greengagedb.querymetrics.events} logger.
 */
@ApplicationScoped
public class LoggingEventSink implements EventSink {

    private static final Logger events = LoggerFactory.getLogger("org.greengagedb.querymetrics.events");

    private final ObjectMapper objectMapper;

    @Inject
    public LoggingEventSink(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void submitQuerySample(FullQueryTextEvent event) {
        write("query_sample", event);
    }

    @Override
    public void submitQueryMetrics(QueryMetricsPayload payload) {
        write("query_metrics", payload);
    }

    private void write(String kind, Object event) {
        try {
            events.info("{} {}", kind, objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + kind + " event", e);
        }
    }
}
