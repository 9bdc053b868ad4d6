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
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.Lists;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import org.toolscope.common.model.ErrorDetails;
import org.toolscope.common.model.ImmutableServerIdentity;
import org.toolscope.common.model.LogEntry;
import org.toolscope.common.model.LogLevel;
import org.toolscope.common.util.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class ServerLoggerTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    private Clock clock;

    @Before
    public void beforeEachTest() {
        clock = mock(Clock.class);
        when(clock.currentTimeMillis()).thenReturn(1700000000123L);
    }

    @Test
    public void shouldKeepMostRecentEntriesInOrder() {
        // given
        ServerLogger serverLogger = newServerLogger(3);
        // when
        for (int i = 0; i < 5; i++) {
            serverLogger.info("message " + i);
        }
        // then
        List<LogEntry> entries = serverLogger.getLogs();
        assertThat(entries).hasSize(3);
        assertThat(entries.get(0).message()).isEqualTo("message 2");
        assertThat(entries.get(1).message()).isEqualTo("message 3");
        assertThat(entries.get(2).message()).isEqualTo("message 4");
        assertThat(serverLogger.getBufferSize()).isEqualTo(3);
    }

    @Test
    public void shouldStoreEveryEntryBelowCapacity() {
        // given
        ServerLogger serverLogger = newServerLogger(10);
        // when
        serverLogger.debug("one");
        serverLogger.critical("two");
        // then
        assertThat(serverLogger.getLogs()).hasSize(2);
    }

    @Test
    public void shouldPopulateEntry() {
        // given
        ServerLogger serverLogger = newServerLogger(10);
        // when
        LogEntry entry = serverLogger.warning("slow", LogRequest.builder()
                .toolName("search")
                .userId("u1")
                .requestId("trace_1")
                .durationMillis(12.5)
                .putMetadata("attempt", 2)
                .build());
        // then
        assertThat(entry.timestamp()).isEqualTo(1700000000123L);
        assertThat(entry.level()).isEqualTo(LogLevel.WARNING);
        assertThat(entry.serverName()).isEqualTo("files");
        assertThat(entry.serverType()).isEqualTo("filesystem");
        assertThat(entry.sessionId()).isEqualTo("session_1700000000");
        assertThat(entry.toolName()).isEqualTo("search");
        assertThat(entry.userId()).isEqualTo("u1");
        assertThat(entry.requestId()).isEqualTo("trace_1");
        assertThat(entry.durationMillis()).isEqualTo(12.5);
        assertThat(entry.metadata()).containsEntry("attempt", 2);
    }

    @Test
    public void shouldFilterByLevelAndTool() {
        // given
        ServerLogger serverLogger = newServerLogger(100);
        serverLogger.info("a", LogRequest.forTool("search"));
        serverLogger.error("b", LogRequest.forTool("search"));
        serverLogger.error("c", LogRequest.forTool("read"));
        serverLogger.error("d", LogRequest.forTool("search"));
        serverLogger.error("e");
        // when
        List<LogEntry> errors = serverLogger.getLogs(LogLevel.ERROR, null, 100);
        List<LogEntry> searchErrors = serverLogger.getLogs(LogLevel.ERROR, "search", 100);
        List<LogEntry> lastSearch = serverLogger.getLogs(null, "search", 1);
        // then
        assertThat(messages(errors)).containsExactly("b", "c", "d", "e");
        assertThat(messages(searchErrors)).containsExactly("b", "d");
        assertThat(messages(lastSearch)).containsExactly("d");
        assertThat(serverLogger.getLogs(null, null, 0)).isEmpty();
        assertThat(serverLogger.getBufferSize()).isEqualTo(5);
    }

    @Test
    public void shouldRecordErrorDetailsFromThrowable() {
        // given
        ServerLogger serverLogger = newServerLogger(10);
        // when
        LogEntry entry = serverLogger.error("failed", new IllegalStateException("x"), "search");
        // then
        assertThat(entry.errorDetails()).isEqualTo(ErrorDetails.of("IllegalStateException", "x"));
    }

    @Test
    public void shouldNotifyListeners() {
        // given
        ServerLogger serverLogger = newServerLogger(10);
        final List<LogEntry> received = Lists.newArrayList();
        LogListener listener = new LogListener() {
            @Override
            public void onLog(LogEntry entry) {
                received.add(entry);
            }
        };
        serverLogger.addListener(listener);
        // when
        serverLogger.info("one");
        serverLogger.removeListener(listener);
        serverLogger.info("two");
        // then
        assertThat(messages(received)).containsExactly("one");
    }

    @Test
    public void shouldExportEveryFieldIncludingNulls() throws Exception {
        // given
        ServerLogger serverLogger = newServerLogger(10);
        serverLogger.info("one", LogRequest.forTool("search"));
        serverLogger.error("two");
        File file = temporaryFolder.newFile("logs.json");
        // when
        serverLogger.export(file);
        // then
        JsonNode rootNode = new ObjectMapper().readTree(file);
        assertThat(rootNode.isArray()).isTrue();
        assertThat(rootNode.size()).isEqualTo(2);
        JsonNode first = rootNode.get(0);
        assertThat(first.get("message").asText()).isEqualTo("one");
        assertThat(first.get("level").asText()).isEqualTo("info");
        assertThat(first.get("toolName").asText()).isEqualTo("search");
        assertThat(first.has("userId")).isTrue();
        assertThat(first.get("userId").isNull()).isTrue();
        assertThat(first.has("errorDetails")).isTrue();
        assertThat(rootNode.get(1).get("toolName").isNull()).isTrue();
    }

    @Test
    public void shouldFormatForwardedMessage() {
        // given
        ServerLogger serverLogger = newServerLogger(10);
        // when
        LogEntry plain = serverLogger.info("ready");
        LogEntry withTool = serverLogger.info("done", LogRequest.builder()
                .toolName("search")
                .durationMillis(12.5)
                .build());
        // then
        assertThat(ServerLogger.formatForward(plain)).isEqualTo("ready");
        assertThat(ServerLogger.formatForward(withTool)).isEqualTo("[search] done (took 12.5ms)");
    }

    @Test
    public void shouldBufferConcurrentProducersWithoutLoss() throws Exception {
        // given
        final ServerLogger serverLogger = newServerLogger(500);
        final int producers = 8;
        final int entriesPerProducer = 100;
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
        List<String> messages = messages(serverLogger.getLogs());
        assertThat(messages).hasSize(500);
        assertThat(messages).doesNotHaveDuplicates();
        int[] lastIndexByProducer = new int[producers];
        Arrays.fill(lastIndexByProducer, -1);
        for (String message : messages) {
            int producer = Integer.parseInt(message.substring(0, message.indexOf(':')));
            int index = Integer.parseInt(message.substring(message.indexOf(':') + 1));
            assertThat(index).isGreaterThan(lastIndexByProducer[producer]);
            lastIndexByProducer[producer] = index;
        }
    }

    private ServerLogger newServerLogger(int maxEntries) {
        return new ServerLogger(ImmutableServerIdentity.of("files", "filesystem"), maxEntries,
                clock);
    }

    private static List<String> messages(List<LogEntry> entries) {
        List<String> messages = Lists.newArrayList();
        for (LogEntry entry : entries) {
            messages.add(entry.message());
        }
        return messages;
    }
}
