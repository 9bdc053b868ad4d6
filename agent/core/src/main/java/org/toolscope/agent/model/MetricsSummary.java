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
package org.toolscope.agent.model;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

import org.toolscope.common.model.Metric;

@Value.Immutable
@JsonSerialize
public interface MetricsSummary {

    String serverName();

    // number of metrics currently buffered
    int totalMetrics();

    Map<String, Double> counters();

    Map<String, Double> gauges();

    // per second, only present for counters with at least two buffered samples spread over time
    Map<String, Double> counterRates();

    List<Metric> recentMetrics();
}
