/*
 * Copyright 2026 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.toolscope.common.util;

import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Test;

import org.toolscope.common.model.ErrorDetails;
import org.toolscope.common.model.ImmutableLogEntry;
import org.toolscope.common.model.LogEntry;
import org.toolscope.common.model.LogLevel;
import org.toolscope.common.model.MetricType;

import static org.assertj.core.api.Assertions.assertThat;

public class ObjectMappersTest {

    @Test
    public void shouldWriteEnumsInLowerCase() throws Exception {
        // given
        ObjectMapper mapper = ObjectMappers.create();
        // when
        String json = mapper.writeValueAsString(MetricType.HISTOGRAM);
        // then
        assertThat(json).isEqualTo("\"histogram\"");
        assertThat(mapper.readValue("\"critical\"", LogLevel.class)).isEqualTo(LogLevel.CRITICAL);
    }

    @Test
    public void shouldLeaveOutNulls() {
        // given
        ObjectMapper mapper = ObjectMappers.create();
        // when
        Map<String, Object> map = mapper.convertValue(newLogEntry(), ObjectMappers.MAP_TYPE);
        // then
        assertThat(map).containsEntry("level", "warning");
        assertThat(map).containsEntry("toolName", "search");
        assertThat(map).doesNotContainKeys("userId", "requestId", "durationMillis");
    }

    @Test
    public void shouldIncludeNulls() {
        // given
        ObjectMapper mapper = ObjectMappers.createIncludingNulls();
        // when
        Map<String, Object> map = mapper.convertValue(newLogEntry(), ObjectMappers.MAP_TYPE);
        // then
        assertThat(map).containsKeys("userId", "requestId", "durationMillis", "errorDetails");
        assertThat(map.get("userId")).isNull();
    }

    @Test
    public void shouldReadLogEntry() throws Exception {
        // given
        ObjectMapper mapper = ObjectMappers.create();
        LogEntry entry = ImmutableLogEntry.builder()
                .from(newLogEntry())
                .errorDetails(ErrorDetails.of("IOException", "disk full"))
                .build();
        // when
        LogEntry read = mapper.readValue(mapper.writeValueAsString(entry), LogEntry.class);
        // then
        assertThat(read).isEqualTo(entry);
    }

    private static LogEntry newLogEntry() {
        return ImmutableLogEntry.builder()
                .timestamp(1000)
                .level(LogLevel.WARNING)
                .message("slow response")
                .serverName("files")
                .serverType("filesystem")
                .sessionId("session_1")
                .toolName("search")
                .build();
    }
}
