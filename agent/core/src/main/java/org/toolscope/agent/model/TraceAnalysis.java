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
package org.toolscope.agent.model;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.immutables.value.Value;

/**
 * Result of analyzing one trace. Only an {@link Outcome#ANALYZED} result carries statistics, the
 * other outcomes describe why there was nothing to analyze.
 */
@Value.Immutable
@JsonSerialize
public abstract class TraceAnalysis {

    public enum Outcome {
        ANALYZED, TRACE_NOT_FOUND, NO_SPANS, NO_ROOT_SPAN
    }

    public abstract String traceId();

    public abstract Outcome outcome();

    public abstract @Nullable String serverName();

    public abstract @Nullable String rootSpanId();

    @Value.Default
    public int spanCount() {
        return 0;
    }

    public abstract @Nullable Double totalDurationMillis();

    // span duration statistics only consider spans that have ended
    @Value.Default
    public double avgSpanDurationMillis() {
        return 0;
    }

    @Value.Default
    public double minSpanDurationMillis() {
        return 0;
    }

    @Value.Default
    public double maxSpanDurationMillis() {
        return 0;
    }

    // longest first, ties keep span creation order
    public abstract List<SlowSpan> slowestSpans();

    // keyed by tool name, in order of first appearance
    public abstract Map<String, ToolBreakdown> toolBreakdown();

    @JsonIgnore
    public boolean isAnalyzed() {
        return outcome() == Outcome.ANALYZED;
    }

    public static TraceAnalysis notAnalyzed(String traceId, Outcome outcome) {
        return ImmutableTraceAnalysis.builder()
                .traceId(traceId)
                .outcome(outcome)
                .build();
    }
}
