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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LoggingEventSinkTest {

    @Mock
    private ObjectMapper objectMapper;

    private final QueryMetricsPayload payload =
            new QueryMetricsPayload("host", 1L, 10.0, List.of(), List.of(), "v12.22.0", "1.0.0");

    @Test
    void testSubmitQueryMetrics_Serializes() throws Exception {
        when(objectMapper.writeValueAsString(payload)).thenReturn("{}");

        new LoggingEventSink(objectMapper).submitQueryMetrics(payload);

        verify(objectMapper).writeValueAsString(payload);
    }

    @Test
    void testSubmit_SerializationFailure_Propagates() throws Exception {
        when(objectMapper.writeValueAsString(any())).thenThrow(JsonProcessingException.class);

        LoggingEventSink sink = new LoggingEventSink(objectMapper);

        assertThrows(IllegalStateException.class, () -> sink.submitQueryMetrics(payload));
    }
}
