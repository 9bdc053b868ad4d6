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
package org.toolscope.common.config;

public final class ConfigDefaults {

    public static final int MAX_LOG_ENTRIES = 1000;
    public static final int MAX_METRICS = 5000;
    public static final int MAX_TRACES = 1000;
    public static final int MAX_CENTRAL_LOG_ENTRIES = 10000;

    public static final int RECENT_METRICS_LIMIT = 20;
    public static final int TOOL_RECENT_METRICS_LIMIT = 10;
    public static final int SLOWEST_SPANS_LIMIT = 5;

    public static final int SLOW_TOOL_THRESHOLD_MILLIS = 1000;
    public static final int HIGH_ERROR_COUNT_THRESHOLD = 100;
    public static final int HIGH_MEMORY_THRESHOLD_MB = 500;

    private ConfigDefaults() {}
}
