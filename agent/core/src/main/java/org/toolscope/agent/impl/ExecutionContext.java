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
package org.toolscope.agent.impl;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.immutables.value.Value;

import org.toolscope.common.util.Styles;

/**
 * Identifies where in a trace the current unit of work runs. A context is never shared mutably
 * between calls, each instrumented call derives a new context for the code it invokes.
 */
@Value.Immutable
@Styles.AllParameters
public abstract class ExecutionContext {

    public abstract String traceId();

    // null until a span has been opened in the trace
    public abstract @Nullable String spanId();

    public static ExecutionContext forTrace(String traceId) {
        return ImmutableExecutionContext.of(traceId, null);
    }

    public static ExecutionContext of(String traceId, @Nullable String spanId) {
        return ImmutableExecutionContext.of(traceId, spanId);
    }
}
