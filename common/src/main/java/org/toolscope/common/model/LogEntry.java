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

import java.util.Map;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.immutables.value.Value;

/**
 * One structured log record. The attribute set is also the record layout of a log export.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableLogEntry.class)
@JsonDeserialize(as = ImmutableLogEntry.class)
public abstract class LogEntry {

    // epoch millis
    public abstract long timestamp();

    public abstract LogLevel level();

    public abstract String message();

    public abstract String serverName();

    public abstract String serverType();

    public abstract String sessionId();

    public abstract @Nullable String toolName();

    public abstract @Nullable String userId();

    // request or trace correlation id
    public abstract @Nullable String requestId();

    public abstract @Nullable Double durationMillis();

    public abstract @Nullable ErrorDetails errorDetails();

    public abstract Map<String, Object> metadata();
}
