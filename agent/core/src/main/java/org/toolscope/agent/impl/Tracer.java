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

import java.util.Iterator;
import java.util.List;
import java.util.Map;

import javax.annotation.concurrent.GuardedBy;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Ordering;
import com.google.common.primitives.Doubles;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.toolscope.agent.model.ImmutableSlowSpan;
import org.toolscope.agent.model.ImmutableSpanLog;
import org.toolscope.agent.model.ImmutableToolBreakdown;
import org.toolscope.agent.model.ImmutableTraceAnalysis;
import org.toolscope.agent.model.SlowSpan;
import org.toolscope.agent.model.Span;
import org.toolscope.agent.model.ToolBreakdown;
import org.toolscope.agent.model.Trace;
import org.toolscope.agent.model.TraceAnalysis;
import org.toolscope.agent.model.TraceAnalysis.Outcome;
import org.toolscope.agent.model.TraceQuery;
import org.toolscope.agent.util.RateLimitedLogger;
import org.toolscope.common.config.ObservabilityConfig;
import org.toolscope.common.model.ErrorDetails;
import org.toolscope.common.model.TraceStatus;
import org.toolscope.common.util.Clock;
import org.toolscope.common.util.IdGenerator;

/**
 * Keeps the traces of one server.
 * <p>
 * At most {@code maxTraces} traces are retained. When a new trace pushes the count above that, the
 * oldest traces are evicted whether or not they have ended, together with the index entries of
 * their spans.
 */
public class Tracer {

    private static final Logger logger = LoggerFactory.getLogger(Tracer.class);

    private static final RateLimitedLogger rateLimitedLogger =
            new RateLimitedLogger(Tracer.class);

    // used with sortedCopy(), which is stable, so ties keep span creation order
    private static final Ordering<Span> SLOWEST_FIRST = new Ordering<Span>() {
        @Override
        public int compare(Span left, Span right) {
            return Doubles.compare(durationOrZero(right), durationOrZero(left));
        }
    };

    private final String serverName;
    private final int maxTraces;
    private final int slowestSpansLimit;
    private final Clock clock;
    private final IdGenerator idGenerator;

    private final Object lock = new Object();

    // insertion ordered, first entry is the oldest
    @GuardedBy("lock")
    private final Map<String, Trace> traces = Maps.newLinkedHashMap();
    @GuardedBy("lock")
    private final Map<String, Trace> activeTraces = Maps.newLinkedHashMap();
    @GuardedBy("lock")
    private final Map<String, Span> spans = Maps.newHashMap();

    public Tracer(String serverName, ObservabilityConfig config, Clock clock,
            IdGenerator idGenerator) {
        this.serverName = serverName;
        this.maxTraces = config.maxTraces();
        this.slowestSpansLimit = config.slowestSpansLimit();
        this.clock = clock;
        this.idGenerator = idGenerator;
    }

    public static Tracer create(String serverName) {
        return new Tracer(serverName, ObservabilityConfig.defaults(), Clock.systemClock(),
                IdGenerator.randomIdGenerator());
    }

    public String startTrace(String name) {
        return startTrace(name, null, ImmutableMap.<String, String>of());
    }

    // an existing trace with the same id is replaced
    public String startTrace(String name, @Nullable String traceId, Map<String, String> tags) {
        String id = traceId == null ? idGenerator.newTraceId() : traceId;
        Trace trace = new Trace(id, name, idGenerator.newSpanId(), serverName,
                clock.currentTimeMillis(), tags);
        synchronized (lock) {
            addTrace(trace);
        }
        logger.debug("started trace {} ({}) on {}", id, name, serverName);
        return id;
    }

    public Span startSpan(String traceId, String name, String toolName) {
        return startSpan(traceId, name, toolName, null, ImmutableMap.<String, String>of());
    }

    // a span for an unknown trace id starts a trace named auto_<name> under that id
    public Span startSpan(String traceId, String name, String toolName,
            @Nullable String parentSpanId, Map<String, String> tags) {
        long startTime = clock.currentTimeMillis();
        Span span = new Span(idGenerator.newSpanId(), traceId, parentSpanId, name, serverName,
                toolName, startTime, tags);
        synchronized (lock) {
            Trace trace = traces.get(traceId);
            if (trace == null) {
                trace = new Trace(traceId, "auto_" + name, idGenerator.newSpanId(), serverName,
                        startTime, ImmutableMap.<String, String>of());
                addTrace(trace);
                logger.debug("span {} started trace {} implicitly", name, traceId);
            }
            trace.addSpan(span);
            spans.put(span.getSpanId(), span);
        }
        return span;
    }

    public @Nullable Span endSpan(String spanId) {
        return endSpan(spanId, TraceStatus.SUCCESS, null);
    }

    // returns null for an unknown (or evicted) span id, ending an ended span changes nothing
    public @Nullable Span endSpan(String spanId, TraceStatus status,
            @Nullable ErrorDetails errorDetails) {
        Span span;
        synchronized (lock) {
            span = spans.get(spanId);
        }
        if (span == null) {
            logger.debug("end of unknown span {} ignored", spanId);
            return null;
        }
        span.end(clock.currentTimeMillis(), status, errorDetails);
        return span;
    }

    public @Nullable Trace endTrace(String traceId) {
        return endTrace(traceId, TraceStatus.SUCCESS);
    }

    public @Nullable Trace endTrace(String traceId, TraceStatus status) {
        Trace trace;
        synchronized (lock) {
            trace = traces.get(traceId);
            activeTraces.remove(traceId);
        }
        if (trace == null) {
            logger.debug("end of unknown trace {} ignored", traceId);
            return null;
        }
        trace.end(clock.currentTimeMillis(), status);
        return trace;
    }

    /**
     * Runs the callback inside a new span. The span is ended {@link TraceStatus#SUCCESS} when the
     * callback returns and {@link TraceStatus#ERROR} when it throws, in which case the exception is
     * rethrown as is.
     */
    public <T, E extends Exception> T inSpan(String traceId, String name, String toolName,
            @Nullable String parentSpanId, Map<String, String> tags,
            SpanCallback<T, E> callback) throws E {
        Span span = startSpan(traceId, name, toolName, parentSpanId, tags);
        T result;
        try {
            result = callback.call(span);
        } catch (Throwable t) {
            // ended directly, the span may already have been evicted from the index
            span.end(clock.currentTimeMillis(), TraceStatus.ERROR, ErrorDetails.from(t));
            throw t;
        }
        span.end(clock.currentTimeMillis(), TraceStatus.SUCCESS, null);
        return result;
    }

    public <T, E extends Exception> T inSpan(String traceId, String name, String toolName,
            SpanCallback<T, E> callback) throws E {
        return inSpan(traceId, name, toolName, null, ImmutableMap.<String, String>of(),
                callback);
    }

    public void addSpanLog(Span span, String message, Map<String, String> fields) {
        span.addLog(ImmutableSpanLog.of(clock.currentTimeMillis(), message, fields));
    }

    // in trace start order
    public List<Trace> searchTraces(TraceQuery query) {
        List<Trace> matches = Lists.newArrayList();
        for (Trace trace : getTraces()) {
            if (query.matches(trace)) {
                matches.add(trace);
            }
        }
        return matches;
    }

    public TraceAnalysis analyzeTracePerformance(String traceId) {
        Trace trace = getTrace(traceId);
        if (trace == null) {
            return TraceAnalysis.notAnalyzed(traceId, Outcome.TRACE_NOT_FOUND);
        }
        List<Span> traceSpans = trace.getSpans();
        if (traceSpans.isEmpty()) {
            return TraceAnalysis.notAnalyzed(traceId, Outcome.NO_SPANS);
        }
        Span rootSpan = null;
        for (Span span : traceSpans) {
            if (span.isRoot()) {
                rootSpan = span;
                break;
            }
        }
        if (rootSpan == null) {
            return TraceAnalysis.notAnalyzed(traceId, Outcome.NO_ROOT_SPAN);
        }
        ImmutableTraceAnalysis.Builder builder = ImmutableTraceAnalysis.builder()
                .traceId(traceId)
                .outcome(Outcome.ANALYZED)
                .serverName(trace.getServerName())
                .rootSpanId(rootSpan.getSpanId())
                .spanCount(traceSpans.size())
                .totalDurationMillis(trace.getTotalDurationMillis());

        int endedCount = 0;
        double sum = 0;
        double min = Double.MAX_VALUE;
        double max = 0;
        Map<String, int[]> toolCounts = Maps.newLinkedHashMap();
        Map<String, double[]> toolTimes = Maps.newLinkedHashMap();
        for (Span span : traceSpans) {
            Double durationMillis = span.getDurationMillis();
            if (durationMillis != null) {
                endedCount++;
                sum += durationMillis;
                min = Math.min(min, durationMillis);
                max = Math.max(max, durationMillis);
            }
            int[] count = toolCounts.get(span.getToolName());
            if (count == null) {
                count = new int[1];
                toolCounts.put(span.getToolName(), count);
                toolTimes.put(span.getToolName(), new double[1]);
            }
            count[0]++;
            toolTimes.get(span.getToolName())[0] += durationOrZero(span);
        }
        if (endedCount > 0) {
            builder.avgSpanDurationMillis(sum / endedCount)
                    .minSpanDurationMillis(min)
                    .maxSpanDurationMillis(max);
        }
        for (Span span : Iterables.limit(SLOWEST_FIRST.sortedCopy(traceSpans),
                slowestSpansLimit)) {
            builder.addSlowestSpans(toSlowSpan(span));
        }
        for (Map.Entry<String, int[]> entry : toolCounts.entrySet()) {
            ToolBreakdown breakdown = ImmutableToolBreakdown.of(entry.getValue()[0],
                    toolTimes.get(entry.getKey())[0]);
            builder.putToolBreakdown(entry.getKey(), breakdown);
        }
        return builder.build();
    }

    public @Nullable Trace getTrace(String traceId) {
        synchronized (lock) {
            return traces.get(traceId);
        }
    }

    public @Nullable Span getSpan(String spanId) {
        synchronized (lock) {
            return spans.get(spanId);
        }
    }

    public ImmutableList<Trace> getTraces() {
        synchronized (lock) {
            return ImmutableList.copyOf(traces.values());
        }
    }

    public ImmutableList<Trace> getActiveTraces() {
        synchronized (lock) {
            return ImmutableList.copyOf(activeTraces.values());
        }
    }

    public int getTraceCount() {
        synchronized (lock) {
            return traces.size();
        }
    }

    public int getActiveTraceCount() {
        synchronized (lock) {
            return activeTraces.size();
        }
    }

    public String getServerName() {
        return serverName;
    }

    @GuardedBy("lock")
    private void addTrace(Trace trace) {
        Trace replaced = traces.remove(trace.getTraceId());
        if (replaced != null) {
            removeSpans(replaced);
        }
        traces.put(trace.getTraceId(), trace);
        activeTraces.put(trace.getTraceId(), trace);
        Iterator<Trace> i = traces.values().iterator();
        while (traces.size() > maxTraces) {
            Trace evicted = i.next();
            i.remove();
            removeSpans(evicted);
            if (activeTraces.remove(evicted.getTraceId()) != null) {
                rateLimitedLogger.warn("evicted active trace {} on {}, more than {} traces are"
                        + " being retained", evicted.getTraceId(), serverName, maxTraces);
            }
        }
    }

    @GuardedBy("lock")
    private void removeSpans(Trace trace) {
        for (Span span : trace.getSpans()) {
            spans.remove(span.getSpanId());
        }
    }

    private static SlowSpan toSlowSpan(Span span) {
        return ImmutableSlowSpan.of(span.getSpanId(), span.getName(), span.getToolName(),
                durationOrZero(span));
    }

    private static double durationOrZero(Span span) {
        Double durationMillis = span.getDurationMillis();
        return durationMillis == null ? 0 : durationMillis;
    }
}
