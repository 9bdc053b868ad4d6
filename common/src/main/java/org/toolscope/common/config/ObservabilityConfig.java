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

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableObservabilityConfig.class)
@JsonDeserialize(as = ImmutableObservabilityConfig.class)
public abstract class ObservabilityConfig {

    private static final ObservabilityConfig DEFAULT =
            ImmutableObservabilityConfig.builder().build();

    // used to limit memory requirement
    @Value.Default
    public int maxLogEntries() {
        return ConfigDefaults.MAX_LOG_ENTRIES;
    }

    // used to limit memory requirement
    @Value.Default
    public int maxMetrics() {
        return ConfigDefaults.MAX_METRICS;
    }

    // used to limit memory requirement, active traces count against this limit too
    @Value.Default
    public int maxTraces() {
        return ConfigDefaults.MAX_TRACES;
    }

    // size of the cross-server log buffer kept by the central logging service
    @Value.Default
    public int maxCentralLogEntries() {
        return ConfigDefaults.MAX_CENTRAL_LOG_ENTRIES;
    }

    @Value.Default
    public int recentMetricsLimit() {
        return ConfigDefaults.RECENT_METRICS_LIMIT;
    }

    @Value.Default
    public int toolRecentMetricsLimit() {
        return ConfigDefaults.TOOL_RECENT_METRICS_LIMIT;
    }

    @Value.Default
    public int slowestSpansLimit() {
        return ConfigDefaults.SLOWEST_SPANS_LIMIT;
    }

    @Value.Default
    public int slowToolThresholdMillis() {
        return ConfigDefaults.SLOW_TOOL_THRESHOLD_MILLIS;
    }

    @Value.Default
    public int highErrorCountThreshold() {
        return ConfigDefaults.HIGH_ERROR_COUNT_THRESHOLD;
    }

    @Value.Default
    public int highMemoryThresholdMb() {
        return ConfigDefaults.HIGH_MEMORY_THRESHOLD_MB;
    }

    @Value.Check
    protected void validate() {
        checkPositive("maxLogEntries", maxLogEntries());
        checkPositive("maxMetrics", maxMetrics());
        checkPositive("maxTraces", maxTraces());
        checkPositive("maxCentralLogEntries", maxCentralLogEntries());
        checkPositive("recentMetricsLimit", recentMetricsLimit());
        checkPositive("toolRecentMetricsLimit", toolRecentMetricsLimit());
        checkPositive("slowestSpansLimit", slowestSpansLimit());
    }

    public static ObservabilityConfig defaults() {
        return DEFAULT;
    }

    private static void checkPositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalStateException(name + " must be positive, was " + value);
        }
    }
}
