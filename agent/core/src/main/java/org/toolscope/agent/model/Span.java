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

import javax.annotation.concurrent.GuardedBy;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import org.checkerframework.checker.nullness.qual.Nullable;

import org.toolscope.common.model.ErrorDetails;
import org.toolscope.common.model.TraceStatus;

import static com.google.common.base.Preconditions.checkArgument;

// a single timed unit of work inside a trace
//
// identity and start time are fixed at construction, the end time, status and error details are
// set exactly once by end(), multiple threads can read a span while it is being ended
@JsonPropertyOrder({"spanId", "traceId", "parentSpanId", "name", "serverName", "toolName",
        "startTime", "endTime", "durationMillis", "status", "tags", "logs", "errorDetails"})
public class Span {

    private final String spanId;
    private final String traceId;
    private final @Nullable String parentSpanId;
    private final String name;
    private final String serverName;
    private final String toolName;
    private final long startTime;
    private final ImmutableMap<String, String> tags;

    private final Object lock = new Object();

    @GuardedBy("lock")
    private final List<SpanLog> logs = Lists.newArrayList();

    private volatile @Nullable Long endTime;
    private volatile TraceStatus status = TraceStatus.STARTED;
    private volatile @Nullable ErrorDetails errorDetails;

    public Span(String spanId, String traceId, @Nullable String parentSpanId, String name,
            String serverName, String toolName, long startTime, Map<String, String> tags) {
        this.spanId = spanId;
        this.traceId = traceId;
        this.parentSpanId = parentSpanId;
        this.name = name;
        this.serverName = serverName;
        this.toolName = toolName;
        this.startTime = startTime;
        this.tags = ImmutableMap.copyOf(tags);
    }

    public String getSpanId() {
        return spanId;
    }

    public String getTraceId() {
        return traceId;
    }

    // null for a root span
    public @Nullable String getParentSpanId() {
        return parentSpanId;
    }

    public String getName() {
        return name;
    }

    public String getServerName() {
        return serverName;
    }

    public String getToolName() {
        return toolName;
    }

    public long getStartTime() {
        return startTime;
    }

    public @Nullable Long getEndTime() {
        return endTime;
    }

    // only defined once the span has ended
    public @Nullable Double getDurationMillis() {
        Long endTime = this.endTime;
        if (endTime == null) {
            return null;
        }
        return (double) (endTime - startTime);
    }

    public TraceStatus getStatus() {
        return status;
    }

    public ImmutableMap<String, String> getTags() {
        return tags;
    }

    public ImmutableList<SpanLog> getLogs() {
        synchronized (lock) {
            return ImmutableList.copyOf(logs);
        }
    }

    public @Nullable ErrorDetails getErrorDetails() {
        return errorDetails;
    }

    @JsonIgnore
    public boolean isEnded() {
        return endTime != null;
    }

    @JsonIgnore
    public boolean isRoot() {
        return parentSpanId == null;
    }

    public void addLog(SpanLog log) {
        synchronized (lock) {
            logs.add(log);
        }
    }

    // returns false if the span had already ended, in which case nothing is changed
    public boolean end(long endTime, TraceStatus status, @Nullable ErrorDetails errorDetails) {
        checkArgument(status.isTerminal(), "span cannot be ended with status %s", status);
        synchronized (lock) {
            if (this.endTime != null) {
                return false;
            }
            this.status = status;
            this.errorDetails = errorDetails;
            // wall clock may step backwards, duration is never negative
            this.endTime = Math.max(endTime, startTime);
            return true;
        }
    }
}
