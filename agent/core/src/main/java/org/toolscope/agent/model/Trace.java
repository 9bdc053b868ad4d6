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

import org.toolscope.common.model.TraceStatus;

import static com.google.common.base.Preconditions.checkArgument;

// tree of spans for one end-to-end instrumented call
//
// the span list is append-only, the status is not derived from the spans and only changes when
// the trace is explicitly ended
@JsonPropertyOrder({"traceId", "name", "rootSpanId", "serverName", "startTime", "endTime",
        "totalDurationMillis", "status", "tags", "spans"})
public class Trace {

    private final String traceId;
    private final String name;
    // generated up front, a span with this id is not necessarily ever created
    private final String rootSpanId;
    private final String serverName;
    private final long startTime;
    private final ImmutableMap<String, String> tags;

    private final Object lock = new Object();

    @GuardedBy("lock")
    private final List<Span> spans = Lists.newArrayList();

    private volatile @Nullable Long endTime;
    private volatile TraceStatus status = TraceStatus.STARTED;

    public Trace(String traceId, String name, String rootSpanId, String serverName,
            long startTime, Map<String, String> tags) {
        this.traceId = traceId;
        this.name = name;
        this.rootSpanId = rootSpanId;
        this.serverName = serverName;
        this.startTime = startTime;
        this.tags = ImmutableMap.copyOf(tags);
    }

    public String getTraceId() {
        return traceId;
    }

    public String getName() {
        return name;
    }

    public String getRootSpanId() {
        return rootSpanId;
    }

    public String getServerName() {
        return serverName;
    }

    public long getStartTime() {
        return startTime;
    }

    public @Nullable Long getEndTime() {
        return endTime;
    }

    public @Nullable Double getTotalDurationMillis() {
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

    public ImmutableList<Span> getSpans() {
        synchronized (lock) {
            return ImmutableList.copyOf(spans);
        }
    }

    @JsonIgnore
    public int getSpanCount() {
        synchronized (lock) {
            return spans.size();
        }
    }

    @JsonIgnore
    public boolean isActive() {
        return endTime == null;
    }

    public boolean hasSpanForTool(String toolName) {
        synchronized (lock) {
            for (Span span : spans) {
                if (span.getToolName().equals(toolName)) {
                    return true;
                }
            }
            return false;
        }
    }

    public void addSpan(Span span) {
        checkArgument(span.getTraceId().equals(traceId), "span %s belongs to trace %s",
                span.getSpanId(), span.getTraceId());
        synchronized (lock) {
            spans.add(span);
        }
    }

    // returns false if the trace had already ended, in which case nothing is changed
    public boolean end(long endTime, TraceStatus status) {
        checkArgument(status.isTerminal(), "trace cannot be ended with status %s", status);
        synchronized (lock) {
            if (this.endTime != null) {
                return false;
            }
            this.status = status;
            this.endTime = Math.max(endTime, startTime);
            return true;
        }
    }
}
