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

import java.util.List;
import java.util.Map;

import javax.annotation.concurrent.GuardedBy;

import com.google.common.collect.EvictingQueue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.MultimapBuilder;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.toolscope.agent.model.ImmutableMetricsSummary;
import org.toolscope.agent.model.ImmutableToolMetrics;
import org.toolscope.agent.model.MetricStatistics;
import org.toolscope.agent.model.MetricsSummary;
import org.toolscope.agent.model.ToolMetrics;
import org.toolscope.agent.util.MoreLists;
import org.toolscope.common.config.ObservabilityConfig;
import org.toolscope.common.model.ImmutableMetric;
import org.toolscope.common.model.Metric;
import org.toolscope.common.model.MetricType;
import org.toolscope.common.util.Clock;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Collects metric samples for one server.
 * <p>
 * Every sample is appended to a bounded buffer (oldest evicted first). Counters additionally
 * accumulate a running total per name that survives eviction, gauges keep only their latest value.
 * Histogram and timer samples only live in the buffer.
 */
public class MetricsCollector {

    private static final Logger logger = LoggerFactory.getLogger(MetricsCollector.class);

    private static final double DEFAULT_INCREMENT = 1.0;

    static final String NO_TOOL_METRICS_MESSAGE = "No metrics found";

    private final String serverName;
    private final int maxMetrics;
    private final int recentMetricsLimit;
    private final int toolRecentMetricsLimit;
    private final Clock clock;

    private final Object lock = new Object();

    @GuardedBy("lock")
    private final EvictingQueue<Metric> buffer;
    // insertion ordered so that summaries list counters and gauges in first-seen order
    @GuardedBy("lock")
    private final Map<String, Double> counters = Maps.newLinkedHashMap();
    @GuardedBy("lock")
    private final Map<String, Double> gauges = Maps.newLinkedHashMap();

    public MetricsCollector(String serverName, ObservabilityConfig config, Clock clock) {
        this.serverName = serverName;
        this.maxMetrics = config.maxMetrics();
        this.recentMetricsLimit = config.recentMetricsLimit();
        this.toolRecentMetricsLimit = config.toolRecentMetricsLimit();
        this.clock = clock;
        buffer = EvictingQueue.create(maxMetrics);
    }

    public static MetricsCollector create(String serverName) {
        return new MetricsCollector(serverName, ObservabilityConfig.defaults(),
                Clock.systemClock());
    }

    public Metric record(MetricType type, String name, double value, @Nullable String toolName,
            Map<String, String> tags, Map<String, Object> metadata) {
        checkArgument(!name.isEmpty(), "metric name must not be empty");
        Metric metric = ImmutableMetric.builder()
                .name(name)
                .type(type)
                .value(value)
                .timestamp(clock.currentTimeMillis())
                .serverName(serverName)
                .toolName(toolName)
                .putAllTags(tags)
                .putAllMetadata(metadata)
                .build();
        synchronized (lock) {
            buffer.add(metric);
            if (type == MetricType.COUNTER) {
                Double total = counters.get(name);
                counters.put(name, total == null ? value : total + value);
            } else if (type == MetricType.GAUGE) {
                gauges.put(name, value);
            }
        }
        return metric;
    }

    public Metric record(MetricType type, String name, double value, @Nullable String toolName) {
        return record(type, name, value, toolName, ImmutableMap.<String, String>of(),
                ImmutableMap.<String, Object>of());
    }

    // throws InvalidArgumentException for an unknown kind, before anything is recorded
    public Metric record(String kind, String name, double value, @Nullable String toolName,
            Map<String, String> tags) {
        MetricType type = MetricType.parse(kind);
        return record(type, name, value, toolName, tags, ImmutableMap.<String, Object>of());
    }

    public Metric incrementCounter(String name) {
        return incrementCounter(name, DEFAULT_INCREMENT, null);
    }

    public Metric incrementCounter(String name, @Nullable String toolName) {
        return incrementCounter(name, DEFAULT_INCREMENT, toolName);
    }

    public Metric incrementCounter(String name, double value, @Nullable String toolName) {
        return record(MetricType.COUNTER, name, value, toolName);
    }

    public Metric setGauge(String name, double value) {
        return setGauge(name, value, null);
    }

    public Metric setGauge(String name, double value, @Nullable String toolName) {
        return record(MetricType.GAUGE, name, value, toolName);
    }

    public Metric recordTimer(String name, double durationMillis, @Nullable String toolName) {
        return record(MetricType.TIMER, name, durationMillis, toolName);
    }

    public Metric recordHistogram(String name, double value, @Nullable String toolName) {
        return record(MetricType.HISTOGRAM, name, value, toolName);
    }

    public MetricsSummary getMetricsSummary() {
        List<Metric> metrics;
        Map<String, Double> counters;
        Map<String, Double> gauges;
        synchronized (lock) {
            metrics = ImmutableList.copyOf(buffer);
            counters = ImmutableMap.copyOf(this.counters);
            gauges = ImmutableMap.copyOf(this.gauges);
        }
        return ImmutableMetricsSummary.builder()
                .serverName(serverName)
                .totalMetrics(metrics.size())
                .counters(counters)
                .gauges(gauges)
                .counterRates(calculateCounterRates(metrics, counters))
                .recentMetrics(MoreLists.last(metrics, recentMetricsLimit))
                .build();
    }

    public ToolMetrics getToolMetrics(String toolName) {
        List<Metric> toolMetrics = Lists.newArrayList();
        for (Metric metric : getMetrics()) {
            if (toolName.equals(metric.toolName())) {
                toolMetrics.add(metric);
            }
        }
        if (toolMetrics.isEmpty()) {
            return ImmutableToolMetrics.builder()
                    .toolName(toolName)
                    .totalCalls(0)
                    .message(NO_TOOL_METRICS_MESSAGE)
                    .build();
        }
        ListMultimap<MetricType, Double> valuesByType =
                MultimapBuilder.enumKeys(MetricType.class).arrayListValues().build();
        int totalCalls = 0;
        for (Metric metric : toolMetrics) {
            valuesByType.put(metric.type(), metric.value());
            if (metric.type() == MetricType.COUNTER) {
                totalCalls++;
            }
        }
        ImmutableToolMetrics.Builder builder = ImmutableToolMetrics.builder()
                .toolName(toolName)
                .totalCalls(totalCalls)
                .recentMetrics(MoreLists.last(toolMetrics, toolRecentMetricsLimit));
        for (MetricType type : valuesByType.keySet()) {
            builder.putStatistics(type, MetricStatistics.of(valuesByType.get(type)));
        }
        return builder.build();
    }

    public ImmutableList<Metric> getMetrics() {
        synchronized (lock) {
            return ImmutableList.copyOf(buffer);
        }
    }

    public @Nullable Double getCounter(String name) {
        synchronized (lock) {
            return counters.get(name);
        }
    }

    public @Nullable Double getGauge(String name) {
        synchronized (lock) {
            return gauges.get(name);
        }
    }

    public String getServerName() {
        return serverName;
    }

    // rate is the running total divided by the time between the first and last buffered sample of
    // the counter, so it is only as accurate as the buffer window is representative
    private static Map<String, Double> calculateCounterRates(List<Metric> metrics,
            Map<String, Double> counters) {
        Map<String, SampleWindow> windows = Maps.newLinkedHashMap();
        for (Metric metric : metrics) {
            if (metric.type() != MetricType.COUNTER) {
                continue;
            }
            SampleWindow window = windows.get(metric.name());
            if (window == null) {
                windows.put(metric.name(), new SampleWindow(metric.timestamp()));
            } else {
                window.add(metric.timestamp());
            }
        }
        ImmutableMap.Builder<String, Double> rates = ImmutableMap.builder();
        for (Map.Entry<String, SampleWindow> entry : windows.entrySet()) {
            SampleWindow window = entry.getValue();
            Double total = counters.get(entry.getKey());
            if (total == null) {
                // counters and buffer are copied under the same lock
                logger.warn("buffered counter sample without running total: {}", entry.getKey());
                continue;
            }
            long elapsedMillis = window.lastTimestamp - window.firstTimestamp;
            if (window.count >= 2 && elapsedMillis > 0) {
                rates.put(entry.getKey(), total / (elapsedMillis / 1000.0));
            }
        }
        return rates.build();
    }

    private static class SampleWindow {

        private final long firstTimestamp;
        private long lastTimestamp;
        private int count;

        private SampleWindow(long timestamp) {
            firstTimestamp = timestamp;
            lastTimestamp = timestamp;
            count = 1;
        }

        private void add(long timestamp) {
            lastTimestamp = timestamp;
            count++;
        }
    }
}
