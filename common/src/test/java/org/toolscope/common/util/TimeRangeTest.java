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
package org.toolscope.common.util;

import java.util.concurrent.TimeUnit;

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class TimeRangeTest {

    @Test
    public void shouldParseKnownLabels() {
        assertThat(TimeRange.parse("last_15m")).isEqualTo(TimeRange.LAST_15_MINUTES);
        assertThat(TimeRange.parse("last_1h")).isEqualTo(TimeRange.LAST_HOUR);
        assertThat(TimeRange.parse("last_24h")).isEqualTo(TimeRange.LAST_24_HOURS);
        assertThat(TimeRange.parse("last_7d")).isEqualTo(TimeRange.LAST_7_DAYS);
    }

    @Test
    public void shouldParseOtherAmounts() {
        // when
        TimeRange timeRange = TimeRange.parse("LAST_30M");
        // then
        assertThat(timeRange).isNotNull();
        assertThat(timeRange.amount()).isEqualTo(30);
        assertThat(timeRange.unit()).isEqualTo(TimeUnit.MINUTES);
        assertThat(timeRange.label()).isEqualTo("last_30m");
    }

    @Test
    public void shouldNotParseUnknownLabels() {
        assertThat(TimeRange.parse(null)).isNull();
        assertThat(TimeRange.parse("")).isNull();
        assertThat(TimeRange.parse("last_0h")).isNull();
        assertThat(TimeRange.parse("last_1w")).isNull();
        assertThat(TimeRange.parse("yesterday")).isNull();
    }

    @Test
    public void shouldFallBackToOneHour() {
        assertThat(TimeRange.parseOrDefault("whenever")).isEqualTo(TimeRange.LAST_HOUR);
        assertThat(TimeRange.parseOrDefault(null)).isEqualTo(TimeRange.LAST_HOUR);
        assertThat(TimeRange.parseOrDefault("last_7d")).isEqualTo(TimeRange.LAST_7_DAYS);
    }

    @Test
    public void shouldCalculateCutoff() {
        assertThat(TimeRange.LAST_15_MINUTES.toMillis()).isEqualTo(900000);
        assertThat(TimeRange.LAST_HOUR.cutoffMillis(10000000)).isEqualTo(6400000);
        assertThat(TimeRange.LAST_7_DAYS.toMillis()).isEqualTo(7 * 24 * 3600000L);
    }
}
