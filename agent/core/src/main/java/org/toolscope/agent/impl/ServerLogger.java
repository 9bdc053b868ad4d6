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

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import javax.annotation.concurrent.GuardedBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.EvictingQueue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

import org.toolscope.agent.util.MoreLists;
import org.toolscope.common.config.ObservabilityConfig;
import org.toolscope.common.model.ImmutableLogEntry;
import org.toolscope.common.model.ImmutableServerIdentity;
import org.toolscope.common.model.LogEntry;
import org.toolscope.common.model.LogLevel;
import org.toolscope.common.model.ServerIdentity;
import org.toolscope.common.util.Clock;
import org.toolscope.common.util.ObjectMappers;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Structured logger for one server. Every call appends exactly one {@link LogEntry} to a bounded
 * in-memory buffer (oldest entries are evicted first) and forwards a one line rendition of it to
 * SLF4J under the logger name {@code toolscope.<serverName>}.
 */
public class ServerLogger {

    private static final Logger logger = LoggerFactory.getLogger(ServerLogger.class);

    private static final Marker CRITICAL = MarkerFactory.getMarker("CRITICAL");

    private static final ObjectMapper exportMapper = ObjectMappers.createIncludingNulls();

    private final ServerIdentity serverIdentity;
    private final String sessionId;
    private final int maxEntries;
    private final Clock clock;
    private final Logger forwardLogger;

    private final Object lock = new Object();

    @GuardedBy("lock")
    private final EvictingQueue<LogEntry> buffer;

    private final List<LogListener> listeners = new CopyOnWriteArrayList<LogListener>();

    public ServerLogger(ServerIdentity serverIdentity, int maxEntries, Clock clock) {
        checkArgument(maxEntries > 0, "maxEntries must be positive");
        this.serverIdentity = serverIdentity;
        this.maxEntries = maxEntries;
        this.clock = clock;
        sessionId = "session_" + clock.currentTimeMillis() / 1000;
        forwardLogger = LoggerFactory.getLogger("toolscope." + serverIdentity.name());
        buffer = EvictingQueue.create(maxEntries);
    }

    public static ServerLogger create(String serverName, String serverType) {
        return create(ImmutableServerIdentity.of(serverName, serverType),
                ObservabilityConfig.defaults(), Clock.systemClock());
    }

    public static ServerLogger create(ServerIdentity serverIdentity, ObservabilityConfig config,
            Clock clock) {
        return new ServerLogger(serverIdentity, config.maxLogEntries(), clock);
    }

    public LogEntry log(LogLevel level, String message) {
        return log(level, message, LogRequest.empty());
    }

    public LogEntry log(LogLevel level, String message, LogRequest request) {
        LogEntry entry = ImmutableLogEntry.builder()
                .timestamp(clock.currentTimeMillis())
                .level(level)
                .message(message)
                .serverName(serverIdentity.name())
                .serverType(serverIdentity.type())
                .sessionId(sessionId)
                .toolName(request.toolName())
                .userId(request.userId())
                .requestId(request.requestId())
                .durationMillis(request.durationMillis())
                .errorDetails(request.errorDetails())
                .putAllMetadata(request.metadata())
                .build();
        synchronized (lock) {
            buffer.add(entry);
            for (LogListener listener : listeners) {
                listener.onLog(entry);
            }
        }
        forward(entry);
        return entry;
    }

    public LogEntry debug(String message) {
        return log(LogLevel.DEBUG, message);
    }

    public LogEntry debug(String message, LogRequest request) {
        return log(LogLevel.DEBUG, message, request);
    }

    public LogEntry info(String message) {
        return log(LogLevel.INFO, message);
    }

    public LogEntry info(String message, LogRequest request) {
        return log(LogLevel.INFO, message, request);
    }

    public LogEntry warning(String message) {
        return log(LogLevel.WARNING, message);
    }

    public LogEntry warning(String message, LogRequest request) {
        return log(LogLevel.WARNING, message, request);
    }

    public LogEntry error(String message) {
        return log(LogLevel.ERROR, message);
    }

    public LogEntry error(String message, LogRequest request) {
        return log(LogLevel.ERROR, message, request);
    }

    public LogEntry critical(String message) {
        return log(LogLevel.CRITICAL, message);
    }

    public LogEntry critical(String message, LogRequest request) {
        return log(LogLevel.CRITICAL, message, request);
    }

    // most recent matches last, level and toolName are optional filters
    public List<LogEntry> getLogs(@Nullable LogLevel level, @Nullable String toolName,
            int limit) {
        List<LogEntry> matches = Lists.newArrayList();
        for (LogEntry entry : getLogs()) {
            if (level != null && entry.level() != level) {
                continue;
            }
            if (toolName != null && !toolName.equals(entry.toolName())) {
                continue;
            }
            matches.add(entry);
        }
        return MoreLists.last(matches, limit);
    }

    public ImmutableList<LogEntry> getLogs() {
        synchronized (lock) {
            return ImmutableList.copyOf(buffer);
        }
    }

    // last n levels, oldest first
    public List<LogLevel> getRecentLevels(int limit) {
        List<LogLevel> levels = Lists.newArrayList();
        for (LogEntry entry : MoreLists.last(getLogs(), limit)) {
            levels.add(entry.level());
        }
        return levels;
    }

    public void export(File file) throws IOException {
        List<LogEntry> entries = getLogs();
        exportMapper.writer(ObjectMappers.getPrettyPrinter()).writeValue(file, entries);
        logger.debug("exported {} log entries for {} to {}", entries.size(),
                serverIdentity.name(), file);
    }

    public void addListener(LogListener listener) {
        listeners.add(listener);
    }

    public void removeListener(LogListener listener) {
        listeners.remove(listener);
    }

    public int getBufferSize() {
        synchronized (lock) {
            return buffer.size();
        }
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public String getSessionId() {
        return sessionId;
    }

    public ServerIdentity getServerIdentity() {
        return serverIdentity;
    }

    public String getServerName() {
        return serverIdentity.name();
    }

    private void forward(LogEntry entry) {
        switch (entry.level()) {
            case DEBUG:
                if (forwardLogger.isDebugEnabled()) {
                    forwardLogger.debug("{}", formatForward(entry));
                }
                break;
            case INFO:
                if (forwardLogger.isInfoEnabled()) {
                    forwardLogger.info("{}", formatForward(entry));
                }
                break;
            case WARNING:
                forwardLogger.warn("{}", formatForward(entry));
                break;
            case ERROR:
                forwardLogger.error("{}", formatForward(entry));
                break;
            case CRITICAL:
                forwardLogger.error(CRITICAL, "{}", formatForward(entry));
                break;
            default:
                throw new IllegalStateException("Unexpected log level: " + entry.level());
        }
    }

    static String formatForward(LogEntry entry) {
        StringBuilder sb = new StringBuilder();
        String toolName = entry.toolName();
        if (toolName != null) {
            sb.append('[');
            sb.append(toolName);
            sb.append("] ");
        }
        sb.append(entry.message());
        Double durationMillis = entry.durationMillis();
        if (durationMillis != null) {
            sb.append(" (took ");
            sb.append(durationMillis);
            sb.append("ms)");
        }
        return sb.toString();
    }
}
