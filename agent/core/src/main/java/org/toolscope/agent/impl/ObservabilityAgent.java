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

import java.io.Closeable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import com.google.common.base.Ticker;
import com.google.common.util.concurrent.SimpleTimeLimiter;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.toolscope.agent.model.ImmutableObservabilitySummary;
import org.toolscope.agent.model.ObservabilitySummary;
import org.toolscope.common.config.ObservabilityConfig;
import org.toolscope.common.model.ImmutableServerIdentity;
import org.toolscope.common.model.ServerIdentity;
import org.toolscope.common.util.Clock;
import org.toolscope.common.util.IdGenerator;

// the logger, metrics collector, tracer and tool instrumentation of one server
public class ObservabilityAgent implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(ObservabilityAgent.class);

    private static final int RECENT_LOG_LEVELS_LIMIT = 10;

    private final ServerIdentity serverIdentity;
    private final ServerLogger serverLogger;
    private final MetricsCollector metricsCollector;
    private final Tracer tracer;
    private final ToolInstrumentation toolInstrumentation;

    // runs tool calls that have a deadline
    private final ExecutorService deadlineExecutor;

    private ObservabilityAgent(ServerIdentity serverIdentity, ObservabilityConfig config,
            Clock clock, Ticker ticker, IdGenerator idGenerator) {
        this.serverIdentity = serverIdentity;
        serverLogger = ServerLogger.create(serverIdentity, config, clock);
        metricsCollector = new MetricsCollector(serverIdentity.name(), config, clock);
        tracer = new Tracer(serverIdentity.name(), config, clock, idGenerator);
        deadlineExecutor = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                .setDaemon(true)
                .setNameFormat("toolscope-deadline-" + serverIdentity.name() + "-%d")
                .build());
        toolInstrumentation = new ToolInstrumentation(serverLogger, metricsCollector, tracer,
                ticker, SimpleTimeLimiter.create(deadlineExecutor));
    }

    public static ObservabilityAgent create(String serverName, String serverType) {
        return create(ImmutableServerIdentity.of(serverName, serverType),
                ObservabilityConfig.defaults(), Clock.systemClock(), Ticker.systemTicker(),
                IdGenerator.randomIdGenerator());
    }

    public static ObservabilityAgent create(ServerIdentity serverIdentity,
            ObservabilityConfig config, Clock clock, Ticker ticker, IdGenerator idGenerator) {
        ObservabilityAgent agent =
                new ObservabilityAgent(serverIdentity, config, clock, ticker, idGenerator);
        logger.debug("observability agent created for {} ({})", serverIdentity.name(),
                serverIdentity.type());
        return agent;
    }

    public ObservabilitySummary getObservabilitySummary() {
        return ImmutableObservabilitySummary.builder()
                .serverName(serverIdentity.name())
                .serverType(serverIdentity.type())
                .logBufferSize(serverLogger.getBufferSize())
                .recentLogLevels(serverLogger.getRecentLevels(RECENT_LOG_LEVELS_LIMIT))
                .metrics(metricsCollector.getMetricsSummary())
                .totalTraces(tracer.getTraceCount())
                .activeTraces(tracer.getActiveTraceCount())
                .build();
    }

    public ServerIdentity getServerIdentity() {
        return serverIdentity;
    }

    public ServerLogger getServerLogger() {
        return serverLogger;
    }

    public MetricsCollector getMetricsCollector() {
        return metricsCollector;
    }

    public Tracer getTracer() {
        return tracer;
    }

    public ToolInstrumentation getToolInstrumentation() {
        return toolInstrumentation;
    }

    // calls still running against a deadline are interrupted
    @Override
    public void close() {
        deadlineExecutor.shutdownNow();
    }
}
