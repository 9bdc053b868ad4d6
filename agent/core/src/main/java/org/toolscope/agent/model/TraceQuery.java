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

import org.checkerframework.checker.nullness.qual.Nullable;
import org.immutables.value.Value;

import org.toolscope.common.model.TraceStatus;

// all criteria are optional, an empty query matches every retained trace
@Value.Immutable
public abstract class TraceQuery {

    public abstract @Nullable String toolName();

    public abstract @Nullable TraceStatus status();

    public abstract @Nullable Double minDurationMillis();

    public abstract @Nullable Double maxDurationMillis();

    // duration bounds are only applied to traces that have ended
    public boolean matches(Trace trace) {
        String toolName = toolName();
        if (toolName != null && !trace.hasSpanForTool(toolName)) {
            return false;
        }
        TraceStatus status = status();
        if (status != null && trace.getStatus() != status) {
            return false;
        }
        Double totalDurationMillis = trace.getTotalDurationMillis();
        if (totalDurationMillis == null) {
            return true;
        }
        Double minDurationMillis = minDurationMillis();
        if (minDurationMillis != null && totalDurationMillis < minDurationMillis) {
            return false;
        }
        Double maxDurationMillis = maxDurationMillis();
        return maxDurationMillis == null || totalDurationMillis <= maxDurationMillis;
    }

    public static ImmutableTraceQuery.Builder builder() {
        return ImmutableTraceQuery.builder();
    }
}
