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
package org.toolscope.central;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentMap;

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

import org.toolscope.agent.impl.Tracer;
import org.toolscope.agent.model.Trace;
import org.toolscope.agent.model.TraceAnalysis;
import org.toolscope.agent.model.TraceQuery;
import org.toolscope.central.util.Projections;
import org.toolscope.common.config.ObservabilityConfig;
import org.toolscope.common.util.Clock;
import org.toolscope.common.util.IdGenerator;

/**
 * Registry of tracers. Traces are looked up in a single server's tracer, or across all registered
 * tracers in registration order when no server is given.
 */
public class TracingService {

    private static final Logger logger = LoggerFactory.getLogger(TracingService.class);

    public static final double DEFAULT_SLOW_TRACE_THRESHOLD_MILLIS = 1000;
    public static final int DEFAULT_SLOW_TRACE_LIMIT = 10;

    private static final Ordering<Trace> SLOWEST_FIRST = new Ordering<Trace>() {
        @Override
        public int compare(Trace left, Trace right) {
            return Doubles.compare(durationOrZero(right), durationOrZero(left));
        }
    };

    private final ObservabilityConfig config;
    private final Clock clock;
    private final IdGenerator idGenerator;

    // registration ordered, for searching across servers
    private final Map<String, Tracer> tracers = Maps.newLinkedHashMap();
    private final Object lock = new Object();

    public TracingService(ObservabilityConfig config, Clock clock, IdGenerator idGenerator) {
        this.config = config;
        this.clock = clock;
        this.idGenerator = idGenerator;
    }

    public static TracingService create() {
        return new TracingService(ObservabilityConfig.defaults(), Clock.systemClock(),
                IdGenerator.randomIdGenerator());
    }

    public Map<String, Object> registerTracer(String serverName) {
        register(new Tracer(serverName, config, clock, idGenerator));
        return ImmutableMap.<String, Object>of(
                "success", true,
                "server", serverName,
                "message", "Tracer registered for " + serverName);
    }

    public void register(Tracer tracer) {
        synchronized (lock) {
            if (tracers.put(tracer.getServerName(), tracer) != null) {
                logger.debug("replaced tracer registered for {}", tracer.getServerName());
            }
        }
    }

    public @Nullable Tracer getTracer(String serverName) {
        synchronized (lock) {
            return tracers.get(serverName);
        }
    }

    public Map<String, Object> startServerTrace(String serverName, String traceName,
            @Nullable String traceId) {
        Tracer tracer = getTracer(serverName);
        if (tracer == null) {
            return Projections.error("Server '" + serverName + "' not registered for tracing");
        }
        String id = tracer.startTrace(traceName, traceId, ImmutableMap.<String, String>of());
        return ImmutableMap.<String, Object>of(
                "success", true,
                "traceId", id,
                "server", serverName,
                "traceName", traceName);
    }

    public Map<String, Object> getTrace(String traceId, @Nullable String serverName) {
        List<Tracer> candidates;
        if (serverName == null) {
            candidates = getTracers();
        } else {
            Tracer tracer = getTracer(serverName);
            candidates = tracer == null ? ImmutableList.<Tracer>of() : ImmutableList.of(tracer);
        }
        for (Tracer tracer : candidates) {
            Trace trace = tracer.getTrace(traceId);
            if (trace != null) {
                return ImmutableMap.<String, Object>of(
                        "trace", Projections.toMap(trace),
                        "foundIn", tracer.getServerName());
            }
        }
        return traceNotFound(traceId);
    }

    public Map<String, Object> analyzeTracePerformance(String serverName, String traceId) {
        Tracer tracer = getTracer(serverName);
        if (tracer == null) {
            return serverNotFound(serverName);
        }
        TraceAnalysis analysis = tracer.analyzeTracePerformance(traceId);
        switch (analysis.outcome()) {
            case ANALYZED:
                return Projections.toMap(analysis);
            case TRACE_NOT_FOUND:
                return traceNotFound(traceId);
            case NO_SPANS:
                return Projections.message("No spans in trace");
            case NO_ROOT_SPAN:
                return Projections.error("No root span found");
            default:
                throw new IllegalStateException("Unexpected outcome: " + analysis.outcome());
        }
    }

    public Map<String, Object> findSlowTraces(String serverName) {
        return findSlowTraces(serverName, DEFAULT_SLOW_TRACE_THRESHOLD_MILLIS,
                DEFAULT_SLOW_TRACE_LIMIT);
    }

    // ended traces at or above the threshold, slowest first
    public Map<String, Object> findSlowTraces(String serverName, double thresholdMillis,
            int limit) {
        Tracer tracer = getTracer(serverName);
        if (tracer == null) {
            return serverNotFound(serverName);
        }
        List<Trace> slowTraces = Lists.newArrayList();
        for (Trace trace : tracer.searchTraces(TraceQuery.builder()
                .minDurationMillis(thresholdMillis)
                .build())) {
            // the query lets active traces through since they have no duration yet
            if (!trace.isActive()) {
                slowTraces.add(trace);
            }
        }
        List<Trace> shown = ImmutableList.of();
        if (limit > 0) {
            shown = ImmutableList.copyOf(
                    Iterables.limit(SLOWEST_FIRST.sortedCopy(slowTraces), limit));
        }
        return ImmutableMap.<String, Object>of(
                "server", serverName,
                "thresholdMillis", thresholdMillis,
                "traces", Projections.toMaps(shown),
                "count", shown.size(),
                "totalMatched", slowTraces.size());
    }

    public Map<String, Object> getActiveTraces(String serverName) {
        Tracer tracer = getTracer(serverName);
        if (tracer == null) {
            return serverNotFound(serverName);
        }
        List<Map<String, Object>> traces = Lists.newArrayList();
        for (Trace trace : tracer.getActiveTraces()) {
            Map<String, Object> summary = Maps.newLinkedHashMap();
            summary.put("traceId", trace.getTraceId());
            summary.put("name", trace.getName());
            summary.put("startTime", trace.getStartTime());
            summary.put("spanCount", trace.getSpanCount());
            traces.add(summary);
        }
        return ImmutableMap.<String, Object>of(
                "server", serverName,
                "traces", traces,
                "count", traces.size());
    }

    private List<Tracer> getTracers() {
        synchronized (lock) {
            return ImmutableList.copyOf(tracers.values());
        }
    }

    private static Map<String, Object> serverNotFound(String serverName) {
        return Projections.error("Server '" + serverName + "' not found");
    }

    private static Map<String, Object> traceNotFound(String traceId) {
        return Projections.error("Trace '" + traceId + "' not found");
    }

    private static double durationOrZero(Trace trace) {
        Double totalDurationMillis = trace.getTotalDurationMillis();
        return totalDurationMillis == null ? 0 : totalDurationMillis;
    }
}
