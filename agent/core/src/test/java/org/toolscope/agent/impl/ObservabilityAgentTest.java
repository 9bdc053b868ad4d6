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

import java.util.concurrent.Callable;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import org.toolscope.agent.model.ObservabilitySummary;
import org.toolscope.common.model.LogLevel;

import static org.assertj.core.api.Assertions.assertThat;

public class ObservabilityAgentTest {

    private ObservabilityAgent agent;

    @Before
    public void beforeEachTest() {
        agent = ObservabilityAgent.create("files", "filesystem");
    }

    @After
    public void afterEachTest() {
        agent.close();
    }

    @Test
    public void shouldSummarize() throws Exception {
        // given
        agent.getToolInstrumentation().execute("search", new Callable<String>() {
            @Override
            public String call() {
                return "found";
            }
        });
        agent.getTracer().startTrace("pending");
        agent.getMetricsCollector().setGauge("memory_usage_mb", 128);
        // when
        ObservabilitySummary summary = agent.getObservabilitySummary();
        // then
        assertThat(summary.serverName()).isEqualTo("files");
        assertThat(summary.serverType()).isEqualTo("filesystem");
        assertThat(summary.logBufferSize()).isEqualTo(2);
        assertThat(summary.recentLogLevels()).containsExactly(LogLevel.INFO, LogLevel.INFO);
        assertThat(summary.metrics().counters()).containsEntry("tool_search_calls", 1.0);
        assertThat(summary.metrics().gauges()).containsEntry("memory_usage_mb", 128.0);
        assertThat(summary.totalTraces()).isEqualTo(2);
        assertThat(summary.activeTraces()).isEqualTo(1);
    }

    @Test
    public void shouldLimitRecentLogLevels() {
        // given
        for (int i = 0; i < 12; i++) {
            agent.getServerLogger().debug("tick " + i);
        }
        agent.getServerLogger().critical("down");
        // when
        ObservabilitySummary summary = agent.getObservabilitySummary();
        // then
        assertThat(summary.logBufferSize()).isEqualTo(13);
        assertThat(summary.recentLogLevels()).hasSize(10);
        assertThat(summary.recentLogLevels().get(9)).isEqualTo(LogLevel.CRITICAL);
    }
}
