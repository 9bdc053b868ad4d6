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

import java.util.Collection;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

import static com.google.common.base.Preconditions.checkArgument;

@Value.Immutable
@JsonSerialize
public abstract class MetricStatistics {

    public abstract int count();

    public abstract double sum();

    public abstract double avg();

    public abstract double min();

    public abstract double max();

    public static MetricStatistics of(Collection<Double> values) {
        checkArgument(!values.isEmpty(), "values must not be empty");
        double sum = 0;
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (double value : values) {
            sum += value;
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        return ImmutableMetricStatistics.builder()
                .count(values.size())
                .sum(sum)
                .avg(sum / values.size())
                .min(min)
                .max(max)
                .build();
    }
}
