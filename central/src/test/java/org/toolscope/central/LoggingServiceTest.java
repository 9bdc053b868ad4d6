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
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.google.common.collect.Lists;
import org.junit.Before;
import org.junit.Test;

import org.toolscope.agent.impl.LogRequest;
import org.toolscope.agent.impl.ServerLogger;
import org.toolscope.common.config.ImmutableObservabilityConfig;
import org.toolscope.common.config.ObservabilityConfig;
import org.toolscope.common.model.ImmutableServerIdentity;
import org.toolscope.common.util.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class LoggingServiceTest {

    private static final long NOW = 100000000L;

    private Clock clock;
    private LoggingService loggingService;

    @Before
    public void beforeEachTest() {
        clock = mock(Clock.class);
        when(clock.currentTimeMillis()).thenReturn(NOW);
        loggingService = new LoggingService(ObservabilityConfig.defaults(), clock);
    }

    @Test
    public void shouldRegisterServerLogger() {
        // when
        Map<String, Object> result = loggingService.registerServerLogger("files", "filesystem");
        // then
        assertThat(result).containsEntry("success", true);
        assertThat(result).containsEntry("server", "files");
        ServerLogger serverLogger = loggingService.getServerLogger("files");
        assertThat(serverLogger).isNotNull();
        assertThat(serverLogger.getServerIdentity().type()).isEqualTo("filesystem");
    }

    @Test
    public void shouldSearchAcrossServers() {
        // given
        loggingService.registerServerLogger("files", "filesystem");
        loggingService.registerServerLogger("web", "http");
        ServerLogger files = loggingService.getServerLogger("files");
        ServerLogger web = loggingService.getServerLogger("web");
        files.info("Opened README", LogRequest.forTool("read"));
        web.error("Fetch FAILED", LogRequest.forTool("fetch"));
        files.error("read failed", LogRequest.forTool("read"));
        web.info("fetched page", LogRequest.forTool("fetch"));
        // when
        Map<String, Object> byQuery =
                loggingService.searchLogs("failed", null, null, null, "last_1h", 100);
        Map<String, Object> byServerAndLevel =
                loggingService.searchLogs(null, "files", "error", null, "last_1h", 100);
        Map<String, Object> byTool =
                loggingService.searchLogs(null, null, null, "fetch", null, 1);
        // then
        assertThat(messages(byQuery)).containsExactly("Fetch FAILED", "read failed");
        assertThat(messages(byServerAndLevel)).containsExactly("read failed");
        assertThat(messages(byTool)).containsExactly("fetched page");
        assertThat(byTool).containsEntry("totalMatched", 2);
        assertThat(byTool).containsEntry("showing", 1);
    }

    @Test
    public void shouldApplyTimeRange() {
        // given
        loggingService.registerServerLogger("files", "filesystem");
        ServerLogger serverLogger = loggingService.getServerLogger("files");
        when(clock.currentTimeMillis()).thenReturn(NOW - 2 * 3600000L);
        serverLogger.info("two hours ago");
        when(clock.currentTimeMillis()).thenReturn(NOW);
        serverLogger.info("just now");
        // when
        Map<String, Object> lastHour =
                loggingService.searchLogs(null, null, null, null, "last_1h", 100);
        Map<String, Object> lastDay =
                loggingService.searchLogs(null, null, null, null, "last_24h", 100);
        Map<String, Object> unrecognized =
                loggingService.searchLogs(null, null, null, null, "last_week", 100);
        // then
        assertThat(messages(lastHour)).containsExactly("just now");
        assertThat(messages(lastDay)).containsExactly("two hours ago", "just now");
        assertThat(messages(unrecognized)).containsExactly("just now");
        @SuppressWarnings("unchecked")
        Map<String, Object> filters = (Map<String, Object>) unrecognized.get("filters");
        assertThat(filters).containsEntry("timeRange", "last_1h");
    }

    @Test
    public void shouldReportUnknownLevel() {
        Map<String, Object> result =
                loggingService.searchLogs(null, null, "loud", null, "last_1h", 100);
        assertThat(result).containsEntry("error", "Unknown log level: loud");
    }

    @Test
    public void shouldGetServerLogs() {
        // given
        loggingService.registerServerLogger("files", "filesystem");
        ServerLogger serverLogger = loggingService.getServerLogger("files");
        serverLogger.info("one");
        serverLogger.warning("two");
        serverLogger.warning("three");
        // when
        Map<String, Object> result = loggingService.getServerLogs("files", "warning", 1);
        // then
        assertThat(messages(result)).containsExactly("three");
        assertThat(result).containsEntry("count", 1);
        assertThat(result).containsEntry("bufferSize", 3);
    }

    @Test
    public void shouldReportUnregisteredServer() {
        Map<String, Object> result = loggingService.getServerLogs("nope", null, 10);
        assertThat(result).containsEntry("error", "Server 'nope' not registered for logging");
    }

    @Test
    public void shouldCollectFromRegisteredLogger() {
        // given
        ServerLogger serverLogger = new ServerLogger(
                ImmutableServerIdentity.of("files", "filesystem"), 10, clock);
        loggingService.register(serverLogger);
        loggingService.register(serverLogger);
        // when
        serverLogger.info("hello");
        // then
        assertThat(loggingService.getGlobalLogs()).hasSize(1);
    }

    @Test
    public void shouldDetachReplacedLogger() {
        // given
        loggingService.registerServerLogger("files", "filesystem");
        ServerLogger replaced = loggingService.getServerLogger("files");
        loggingService.registerServerLogger("files", "filesystem");
        // when
        replaced.info("not collected");
        loggingService.getServerLogger("files").info("collected");
        // then
        assertThat(loggingService.getGlobalLogs()).hasSize(1);
        assertThat(loggingService.getGlobalLogs().get(0).message()).isEqualTo("collected");
    }

    @Test
    public void shouldBoundGlobalBuffer() {
        // given
        ObservabilityConfig config = ImmutableObservabilityConfig.builder()
                .maxCentralLogEntries(3)
                .build();
        LoggingService loggingService = new LoggingService(config, clock);
        loggingService.registerServerLogger("files", "filesystem");
        ServerLogger serverLogger = loggingService.getServerLogger("files");
        // when
        for (int i = 0; i < 5; i++) {
            serverLogger.info("message " + i);
        }
        // then
        assertThat(loggingService.getGlobalLogs()).hasSize(3);
        assertThat(loggingService.getGlobalLogs().get(0).message()).isEqualTo("message 2");
    }

    @Test
    public void shouldAnalyzeToolPerformance() {
        // given
        loggingService.registerServerLogger("files", "filesystem");
        ServerLogger serverLogger = loggingService.getServerLogger("files");
        serverLogger.info("search done", duration("search", 10));
        serverLogger.info("search done", duration("search", 30));
        serverLogger.info("read done", duration("read", 100));
        serverLogger.info("no duration", LogRequest.forTool("read"));
        // when
        Map<String, Object> result = loggingService.analyzeToolPerformance(null, null);
        // then
        assertThat(result).containsEntry("count", 3);
        assertThat(result).containsEntry("minMillis", 10.0);
        assertThat(result).containsEntry("maxMillis", 100.0);
        assertThat((Double) result.get("avgMillis")).isEqualTo(140 / 3.0);
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> slowestTools =
                (List<Map<String, Object>>) result.get("slowestTools");
        assertThat(slowestTools).hasSize(2);
        assertThat(slowestTools.get(0)).containsEntry("tool", "read");
        assertThat(slowestTools.get(1)).containsEntry("tool", "search");
        assertThat(slowestTools.get(1)).containsEntry("avgTime", 20.0);
        assertThat(slowestTools.get(1)).containsEntry("callCount", 2);
    }

    @Test
    public void shouldReportMissingPerformanceData() {
        Map<String, Object> result = loggingService.analyzeToolPerformance("files", "search");
        assertThat(result).containsEntry("message", "No performance data available");
    }

    private static LogRequest duration(String toolName, double durationMillis) {
        return LogRequest.builder()
                .toolName(toolName)
                .durationMillis(durationMillis)
                .build();
    }

    @SuppressWarnings("unchecked")
    private static List<Object> messages(Map<String, Object> result) {
        List<Object> messages = Lists.newArrayList();
        for (Map<String, Object> log : (List<Map<String, Object>>) result.get("logs")) {
            messages.add(log.get("message"));
        }
        return messages;
    }

    @Test
    public void shouldMirrorServerBufferOrderUnderConcurrentProducers() throws Exception {
        // given
        ObservabilityConfig config = ImmutableObservabilityConfig.builder()
                .maxLogEntries(500)
                .maxCentralLogEntries(500)
                .build();
        LoggingService service = new LoggingService(config, clock);
        service.registerServerLogger("files", "filesystem");
        final ServerLogger serverLogger = service.getServerLogger("files");
        final int producers = 8;
        final int entriesPerProducer = 120;
        final CountDownLatch startLatch = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(producers);
        List<Future<?>> futures = Lists.newArrayList();
        // when
        try {
            for (int i = 0; i < producers; i++) {
                final int producer = i;
                futures.add(executor.submit(new Callable<Void>() {
                    @Override
                    public Void call() throws Exception {
                        startLatch.await();
                        for (int j = 0; j < entriesPerProducer; j++) {
                            serverLogger.info(producer + ":" + j);
                        }
                        return null;
                    }
                }));
            }
            startLatch.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
        // then
        assertThat(serverLogger.getLogs()).hasSize(500);
        assertThat(service.getGlobalLogs()).containsExactlyElementsOf(serverLogger.getLogs());
    }
}
