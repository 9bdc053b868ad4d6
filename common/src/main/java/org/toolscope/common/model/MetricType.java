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
package org.toolscope.common.model;

import java.util.Locale;

import org.toolscope.common.util.InvalidArgumentException;

public enum MetricType {

    // running total per metric name
    COUNTER,
    // last value per metric name
    GAUGE,
    HISTOGRAM,
    TIMER;

    public static MetricType parse(String value) {
        String normalized = value.trim().toUpperCase(Locale.ENGLISH);
        for (MetricType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        throw new InvalidArgumentException("Unknown metric type: " + value);
    }
}
