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
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentMap;

import javax.annotation.concurrent.GuardedBy;

import com.google.common.collect.EvictingQueue;
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

import org.toolscope.agent.impl.LogListener;
import org.toolscope.agent.impl.ServerLogger;
import org.toolscope.agent.util.MoreLists;
import org.toolscope.central.util.Projections;
import org.toolscope.common.config.ObservabilityConfig;
import org.toolscope.common.model.ImmutableServerIdentity;
import org.toolscope.common.model.LogEntry;
import org.toolscope.common.model.LogLevel;
import org.toolscope.common.util.Clock;
import org.toolscope.common.util.InvalidArgumentException;
import org.toolscope.common.util.TimeRange;

/**
 * Registry of server loggers plus a cross-server log buffer.
 * <p>
 * Every entry appended to a registered logger is also appended to the global buffer (bounded,
 * oldest evicted first), which is what {@link #searchLogs} and {@link #analyzeToolPerformance}
 * look at.
 */
public class LoggingService {

    private static final Logger logger = LoggerFactory.getLogger(LoggingService.class);

    private static final int SAMPLE_LOGS_LIMIT = 5;
    private static final int SLOWEST_TOOLS_LIMIT = 10;

    private static final Ordering<Map<String, Object>> BY_AVG_TIME_DESC =
            new Ordering<Map<String, Object>>() {
                @Override
                public int compare(Map<String, Object> left, Map<String, Object> right) {
                    return Doubles.compare((Double) right.get("avgTime"),
                            (Double) left.get("avgTime"));
                }
            };

    private final ObservabilityConfig config;
    private final Clock clock;

    private final ConcurrentMap<String, ServerLogger> serverLoggers = Maps.newConcurrentMap();

    private final Object lock = new Object();

    @GuardedBy("lock")
    private final EvictingQueue<LogEntry> globalBuffer;

    private final LogListener globalBufferListener = new LogListener() {
        @Override
        public void onLog(LogEntry entry) {
            synchronized (lock) {
                globalBuffer.add(entry);
            }
        }
    };

    public LoggingService(ObservabilityConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        globalBuffer = EvictingQueue.create(config.maxCentralLogEntries());
    }

    public static LoggingService create() {
        return new LoggingService(ObservabilityConfig.defaults(), Clock.systemClock());
    }

    public Map<String, Object> registerServerLogger(String serverName, String serverType) {
        ServerLogger serverLogger = ServerLogger.create(
                ImmutableServerIdentity.of(serverName, serverType), config, clock);
        register(serverLogger);
        return ImmutableMap.<String, Object>of(
                "success", true,
                "server", serverName,
                "sessionId", serverLogger.getSessionId(),
                "message", "Logger registered for " + serverName);
    }

    // replaces (and detaches from) any logger previously registered under the same server name
    public void register(ServerLogger serverLogger) {
        ServerLogger previous = serverLoggers.put(serverLogger.getServerName(), serverLogger);
        if (previous != null && previous != serverLogger) {
            previous.removeListener(globalBufferListener);
            logger.debug("replaced logger registered for {}", serverLogger.getServerName());
        }
        if (previous != serverLogger) {
            serverLogger.addListener(globalBufferListener);
        }
    }

    public @Nullable ServerLogger getServerLogger(String serverName) {
        return serverLoggers.get(serverName);
    }

    // every filter is optional, query is a case insensitive substring of the message
    public Map<String, Object> searchLogs(@Nullable String query, @Nullable String serverName,
            @Nullable String level, @Nullable String toolName, @Nullable String timeRange,
            int limit) {
        LogLevel logLevel;
        try {
            logLevel = level == null ? null : LogLevel.parse(level);
        } catch (InvalidArgumentException e) {
            return Projections.error(e.getMessage());
        }
        TimeRange range = TimeRange.parseOrDefault(timeRange);
        long cutoff = range.cutoffMillis(clock.currentTimeMillis());
        String lowerQuery = query == null ? null : query.toLowerCase(Locale.ENGLISH);
        List<LogEntry> matches = Lists.newArrayList();
        for (LogEntry entry : getGlobalLogs()) {
            if (entry.timestamp() < cutoff) {
                continue;
            }
            if (serverName != null && !entry.serverName().equals(serverName)) {
                continue;
            }
            if (logLevel != null && entry.level() != logLevel) {
                continue;
            }
            if (toolName != null && !toolName.equals(entry.toolName())) {
                continue;
            }
            if (lowerQuery != null
                    && !entry.message().toLowerCase(Locale.ENGLISH).contains(lowerQuery)) {
                continue;
            }
            matches.add(entry);
        }
        List<LogEntry> shown = MoreLists.last(matches, limit);
        Map<String, Object> filters = Maps.newLinkedHashMap();
        filters.put("serverName", serverName);
        filters.put("level", logLevel == null ? null : logLevel.name());
        filters.put("toolName", toolName);
        filters.put("timeRange", range.label());
        Map<String, Object> result = Maps.newLinkedHashMap();
        result.put("logs", Projections.toMaps(shown));
        result.put("totalMatched", matches.size());
        result.put("showing", shown.size());
        result.put("query", query);
        result.put("filters", filters);
        return result;
    }

    public Map<String, Object> getServerLogs(String serverName, @Nullable String level,
            int limit) {
        ServerLogger serverLogger = serverLoggers.get(serverName);
        if (serverLogger == null) {
            return Projections.error("Server '" + serverName + "' not registered for logging");
        }
        LogLevel logLevel;
        try {
            logLevel = level == null ? null : LogLevel.parse(level);
        } catch (InvalidArgumentException e) {
            return Projections.error(e.getMessage());
        }
        List<LogEntry> logs = serverLogger.getLogs(logLevel, null, limit);
        return ImmutableMap.<String, Object>of(
                "server", serverName,
                "logs", Projections.toMaps(logs),
                "count", logs.size(),
                "bufferSize", serverLogger.getBufferSize());
    }

    // statistics over the durations carried by buffered log entries
    public Map<String, Object> analyzeToolPerformance(@Nullable String serverName,
            @Nullable String toolName) {
        List<LogEntry> relevant = Lists.newArrayList();
        for (LogEntry entry : getGlobalLogs()) {
            if (entry.durationMillis() == null) {
                continue;
            }
            if (serverName != null && !entry.serverName().equals(serverName)) {
                continue;
            }
            if (toolName != null && !toolName.equals(entry.toolName())) {
                continue;
            }
            relevant.add(entry);
        }
        if (relevant.isEmpty()) {
            return Projections.message("No performance data available");
        }
        double sum = 0;
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        Map<String, List<Double>> durationsByTool = Maps.newLinkedHashMap();
        for (LogEntry entry : relevant) {
            double durationMillis = checkNotNullDuration(entry);
            sum += durationMillis;
            min = Math.min(min, durationMillis);
            max = Math.max(max, durationMillis);
            String entryToolName = entry.toolName();
            if (entryToolName != null) {
                List<Double> durations = durationsByTool.get(entryToolName);
                if (durations == null) {
                    durations = Lists.newArrayList();
                    durationsByTool.put(entryToolName, durations);
                }
                durations.add(durationMillis);
            }
        }
        List<Map<String, Object>> tools = Lists.newArrayList();
        for (Map.Entry<String, List<Double>> entry : durationsByTool.entrySet()) {
            double toolSum = 0;
            for (double durationMillis : entry.getValue()) {
                toolSum += durationMillis;
            }
            Map<String, Object> tool = Maps.newLinkedHashMap();
            tool.put("tool", entry.getKey());
            tool.put("avgTime", toolSum / entry.getValue().size());
            tool.put("callCount", entry.getValue().size());
            tools.add(tool);
        }
        Map<String, Object> result = Maps.newLinkedHashMap();
        result.put("count", relevant.size());
        result.put("avgMillis", sum / relevant.size());
        result.put("minMillis", min);
        result.put("maxMillis", max);
        result.put("totalCalls", relevant.size());
        result.put("sampleLogs", Projections.toMaps(MoreLists.last(relevant, SAMPLE_LOGS_LIMIT)));
        result.put("slowestTools", ImmutableList.copyOf(
                Iterables.limit(BY_AVG_TIME_DESC.sortedCopy(tools), SLOWEST_TOOLS_LIMIT)));
        return result;
    }

    public ImmutableList<LogEntry> getGlobalLogs() {
        synchronized (lock) {
            return ImmutableList.copyOf(globalBuffer);
        }
    }

    private static double checkNotNullDuration(LogEntry entry) {
        Double durationMillis = entry.durationMillis();
        if (durationMillis == null) {
            throw new IllegalStateException("Entry without duration: " + entry);
        }
        return durationMillis;
    }
}
