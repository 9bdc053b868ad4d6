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

import java.util.Map;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.immutables.value.Value;

import org.toolscope.common.model.ErrorDetails;

// optional attributes of a log call, everything that is not the level or the message
@Value.Immutable
public abstract class LogRequest {

    private static final LogRequest EMPTY = ImmutableLogRequest.builder().build();

    public abstract @Nullable String toolName();

    public abstract @Nullable String userId();

    public abstract @Nullable String requestId();

    public abstract @Nullable Double durationMillis();

    public abstract @Nullable ErrorDetails errorDetails();

    public abstract Map<String, Object> metadata();

    public static LogRequest empty() {
        return EMPTY;
    }

    public static LogRequest forTool(@Nullable String toolName) {
        return builder().toolName(toolName).build();
    }

    public static ImmutableLogRequest.Builder builder() {
        return ImmutableLogRequest.builder();
    }
}
