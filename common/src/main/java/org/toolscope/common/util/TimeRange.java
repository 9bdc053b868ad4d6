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

import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.immutables.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A look-back window ending now, written as {@code last_<amount><unit>} where unit is {@code m}
 * (minutes), {@code h} (hours) or {@code d} (days), e.g. {@code last_15m}, {@code last_1h},
 * {@code last_24h}, {@code last_7d}.
 */
@Value.Immutable
@Styles.AllParameters
public abstract class TimeRange {

    private static final Logger logger = LoggerFactory.getLogger(TimeRange.class);

    public static final TimeRange LAST_15_MINUTES = minutes(15);
    public static final TimeRange LAST_HOUR = hours(1);
    public static final TimeRange LAST_24_HOURS = hours(24);
    public static final TimeRange LAST_7_DAYS = days(7);

    public static final TimeRange DEFAULT = LAST_HOUR;

    private static final Pattern LABEL_PATTERN = Pattern.compile("last_([1-9][0-9]{0,5})([mhd])");

    public abstract long amount();

    public abstract TimeUnit unit();

    @Value.Check
    protected void check() {
        if (amount() <= 0) {
            throw new IllegalStateException("Time range amount must be positive: " + amount());
        }
        if (unit() != TimeUnit.MINUTES && unit() != TimeUnit.HOURS && unit() != TimeUnit.DAYS) {
            throw new IllegalStateException("Unsupported time range unit: " + unit());
        }
    }

    public long toMillis() {
        return unit().toMillis(amount());
    }

    public long cutoffMillis(long currentTimeMillis) {
        return currentTimeMillis - toMillis();
    }

    public String label() {
        String suffix;
        if (unit() == TimeUnit.MINUTES) {
            suffix = "m";
        } else if (unit() == TimeUnit.HOURS) {
            suffix = "h";
        } else {
            suffix = "d";
        }
        return "last_" + amount() + suffix;
    }

    public static TimeRange minutes(long amount) {
        return ImmutableTimeRange.of(amount, TimeUnit.MINUTES);
    }

    public static TimeRange hours(long amount) {
        return ImmutableTimeRange.of(amount, TimeUnit.HOURS);
    }

    public static TimeRange days(long amount) {
        return ImmutableTimeRange.of(amount, TimeUnit.DAYS);
    }

    // returns null when the label is not recognized
    public static @Nullable TimeRange parse(@Nullable String label) {
        if (label == null) {
            return null;
        }
        Matcher matcher = LABEL_PATTERN.matcher(label.trim().toLowerCase(Locale.ENGLISH));
        if (!matcher.matches()) {
            return null;
        }
        long amount = Long.parseLong(matcher.group(1));
        String unit = matcher.group(2);
        if (unit.equals("m")) {
            return minutes(amount);
        } else if (unit.equals("h")) {
            return hours(amount);
        } else {
            return days(amount);
        }
    }

    public static TimeRange parseOrDefault(@Nullable String label) {
        TimeRange timeRange = parse(label);
        if (timeRange == null) {
            logger.debug("unrecognized time range '{}', using {}", label, DEFAULT.label());
            return DEFAULT;
        }
        return timeRange;
    }
}
