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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.MultimapBuilder;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.toolscope.agent.impl.MetricsCollector;
import org.toolscope.agent.model.MetricStatistics;
import org.toolscope.agent.model.MetricsSummary;
import org.toolscope.agent.util.MoreLists;
import org.toolscope.central.util.Projections;
import org.toolscope.common.config.ObservabilityConfig;
import org.toolscope.common.model.Metric;
import org.toolscope.common.model.MetricType;
import org.toolscope.common.util.Clock;
import org.toolscope.common.util.TimeRange;

// registry of metrics collectors, queries read the collectors' own bounded buffers
public class MetricsService {

    private static final Logger logger = LoggerFactory.getLogger(MetricsService.class);

    static final String MEMORY_USAGE_GAUGE = "memory_usage_mb";

    private final ObservabilityConfig config;
    private final Clock clock;

    private final ConcurrentMap<String, MetricsCollector> collectors = Maps.newConcurrentMap();

    public MetricsService(ObservabilityConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public static MetricsService create() {
        return new MetricsService(ObservabilityConfig.defaults(), Clock.systemClock());
    }

    public Map<String, Object> registerMetricsCollector(String serverName) {
        register(new MetricsCollector(serverName, config, clock));
        return ImmutableMap.<String, Object>of(
                "success", true,
                "server", serverName,
                "message", "Metrics collector registered for " + serverName);
    }

    public void register(MetricsCollector collector) {
        if (collectors.put(collector.getServerName(), collector) != null) {
            logger.debug("replaced metrics collector registered for {}",
                    collector.getServerName());
        }
    }

    public @Nullable MetricsCollector getMetricsCollector(String serverName) {
        return collectors.get(serverName);
    }

    // an unknown kind throws InvalidArgumentException, an unknown server is reported in the result
    public Map<String, Object> recordServerMetric(String serverName, String kind,
            String metricName, double value, @Nullable String toolName,
            Map<String, String> tags) {
        MetricsCollector collector = collectors.get(serverName);
        if (collector == null) {
            return notRegistered(serverName);
        }
        Metric metric = collector.record(kind, metricName, value, toolName, tags);
        return ImmutableMap.<String, Object>of(
                "success", true,
                "metric", Projections.toMap(metric),
                "server", serverName);
    }

    public Map<String, Object> getServerMetrics(String serverName, @Nullable String metricName,
            @Nullable String timeRange, int limit) {
        MetricsCollector collector = collectors.get(serverName);
        if (collector == null) {
            return Projections.error("No metrics found for server '" + serverName + "'");
        }
        TimeRange range = TimeRange.parseOrDefault(timeRange);
        long cutoff = range.cutoffMillis(clock.currentTimeMillis());
        List<Metric> matches = Lists.newArrayList();
        for (Metric metric : collector.getMetrics()) {
            if (metric.timestamp() >= cutoff
                    && (metricName == null || metric.name().equals(metricName))) {
                matches.add(metric);
            }
        }
        List<Metric> shown = MoreLists.last(matches, limit);
        return ImmutableMap.<String, Object>of(
                "server", serverName,
                "metrics", Projections.toMaps(shown),
                "count", shown.size(),
                "timeRange", range.label());
    }

    public Map<String, Object> analyzeServerPerformance(String serverName) {
        MetricsCollector collector = collectors.get(serverName);
        if (collector == null) {
            return Projections.error("Server '" + serverName + "' not found");
        }
        MetricsSummary summary = collector.getMetricsSummary();
        ListMultimap<String, Metric> metricsByTool =
                MultimapBuilder.linkedHashKeys().arrayListValues().build();
        for (Metric metric : collector.getMetrics()) {
            String toolName = metric.toolName();
            if (toolName != null) {
                metricsByTool.put(toolName, metric);
            }
        }
        Map<String, Map<String, Object>> toolPerformance = Maps.newLinkedHashMap();
        for (String toolName : metricsByTool.keySet()) {
            List<Double> timerValues = Lists.newArrayList();
            int callCount = 0;
            for (Metric metric : metricsByTool.get(toolName)) {
                if (metric.type() == MetricType.TIMER) {
                    timerValues.add(metric.value());
                } else if (metric.type() == MetricType.COUNTER) {
                    callCount++;
                }
            }
            if (timerValues.isEmpty()) {
                continue;
            }
            MetricStatistics statistics = MetricStatistics.of(timerValues);
            Map<String, Object> performance = Maps.newLinkedHashMap();
            performance.put("callCount", callCount);
            performance.put("avgResponseTime", statistics.avg());
            performance.put("minResponseTime", statistics.min());
            performance.put("maxResponseTime", statistics.max());
            toolPerformance.put(toolName, performance);
        }
        Map<String, Object> result = Maps.newLinkedHashMap();
        result.put("server", serverName);
        result.put("summary", Projections.toMap(summary));
        result.put("toolPerformance", toolPerformance);
        result.put("recommendations", generateRecommendations(summary, toolPerformance));
        return result;
    }

    // servers that are not registered, or have no samples of the metric, are left out
    public Map<String, Object> compareServers(List<String> serverNames, String metricName) {
        Map<String, Object> comparison = Maps.newLinkedHashMap();
        for (String serverName : serverNames) {
            MetricsCollector collector = collectors.get(serverName);
            if (collector == null) {
                continue;
            }
            List<Double> values = Lists.newArrayList();
            for (Metric metric : collector.getMetrics()) {
                if (metric.name().equals(metricName)) {
                    values.add(metric.value());
                }
            }
            if (values.isEmpty()) {
                continue;
            }
            MetricStatistics statistics = MetricStatistics.of(values);
            Map<String, Object> serverComparison = Maps.newLinkedHashMap();
            serverComparison.put("count", statistics.count());
            serverComparison.put("avg", statistics.avg());
            serverComparison.put("min", statistics.min());
            serverComparison.put("max", statistics.max());
            serverComparison.put("recentValue", values.get(values.size() - 1));
            comparison.put(serverName, serverComparison);
        }
        return ImmutableMap.<String, Object>of(
                "metric", metricName,
                "comparison", comparison,
                "serversCompared", comparison.size());
    }

    private List<String> generateRecommendations(MetricsSummary summary,
            Map<String, Map<String, Object>> toolPerformance) {
        List<String> recommendations = Lists.newArrayList();
        for (Map.Entry<String, Double> entry : summary.counters().entrySet()) {
            if (isErrorCounter(entry.getKey())
                    && entry.getValue() > config.highErrorCountThreshold()) {
                recommendations.add(String.format(Locale.ENGLISH,
                        "High error count (%.0f) for %s. Check server logs for issues.",
                        entry.getValue(), entry.getKey()));
            }
        }
        for (Map.Entry<String, Map<String, Object>> entry : toolPerformance.entrySet()) {
            double avgResponseTime = (Double) entry.getValue().get("avgResponseTime");
            if (avgResponseTime > config.slowToolThresholdMillis()) {
                recommendations.add(String.format(Locale.ENGLISH,
                        "Tool '%s' is slow (avg %.1fms). Consider optimization.", entry.getKey(),
                        avgResponseTime));
            }
        }
        Double memoryUsage = summary.gauges().get(MEMORY_USAGE_GAUGE);
        if (memoryUsage != null && memoryUsage > config.highMemoryThresholdMb()) {
            recommendations.add(String.format(Locale.ENGLISH,
                    "High memory usage (%.1fMB). Check for memory leaks.", memoryUsage));
        }
        return recommendations;
    }

    // "errors" itself, or a per tool counter such as tool_search_errors
    private static boolean isErrorCounter(String name) {
        return name.equals("errors") || name.endsWith("_errors");
    }

    private static Map<String, Object> notRegistered(String serverName) {
        return Projections.error("Server '" + serverName + "' not registered for metrics");
    }
}
