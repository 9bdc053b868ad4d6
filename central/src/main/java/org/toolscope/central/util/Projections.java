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
package org.toolscope.central.util;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import org.toolscope.common.util.ObjectMappers;

// query results are plain key-value maps, records are projected through the same json mapping
// used for export so the two never disagree on field names
public class Projections {

    private static final ObjectMapper mapper = ObjectMappers.create();

    private static final String ERROR_KEY = "error";
    private static final String MESSAGE_KEY = "message";

    private Projections() {}

    public static Map<String, Object> toMap(Object value) {
        return mapper.convertValue(value, ObjectMappers.MAP_TYPE);
    }

    public static List<Map<String, Object>> toMaps(List<?> values) {
        List<Map<String, Object>> maps = Lists.newArrayList();
        for (Object value : values) {
            maps.add(toMap(value));
        }
        return maps;
    }

    public static Map<String, Object> error(String message) {
        return ImmutableMap.<String, Object>of(ERROR_KEY, message);
    }

    public static Map<String, Object> message(String message) {
        return ImmutableMap.<String, Object>of(MESSAGE_KEY, message);
    }
}
