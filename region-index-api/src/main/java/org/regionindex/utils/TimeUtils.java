/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.regionindex.utils;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

import static org.regionindex.utils.Preconditions.checkNotNull;

/**
 * 时长字符串解析与格式化。
 *
 * <p>支持的格式为 "数字 + 可选单位",例如 {@code 200ms}、{@code 2 s}、{@code 1min}。
 * 没有单位时按毫秒处理。
 */
public final class TimeUtils {

    public static Duration parseDuration(String text) {
        checkNotNull(text);

        final String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            throw new NumberFormatException("argument is an empty- or whitespace-only string");
        }

        final int len = trimmed.length();
        int pos = 0;

        char current;
        while (pos < len && (current = trimmed.charAt(pos)) >= '0' && current <= '9') {
            pos++;
        }

        final String number = trimmed.substring(0, pos);
        final String unitLabel = trimmed.substring(pos).trim().toLowerCase(Locale.ROOT);

        if (number.isEmpty()) {
            throw new NumberFormatException("text does not start with a number");
        }

        final long value;
        try {
            value = Long.parseLong(number);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "The value '"
                            + number
                            + "' cannot be represented as a 64bit number (numeric overflow).");
        }

        if (unitLabel.isEmpty()) {
            return Duration.of(value, ChronoUnit.MILLIS);
        }

        for (TimeUnit unit : TimeUnit.values()) {
            for (String label : unit.labels) {
                if (label.equals(unitLabel)) {
                    return Duration.of(value, unit.unit);
                }
            }
        }

        throw new IllegalArgumentException(
                "Time interval unit label '"
                        + unitLabel
                        + "' does not match any of the recognized units: "
                        + TimeUnit.allLabels());
    }

    /** 以能整除的最大单位格式化时长。 */
    public static String formatWithHighestUnit(Duration duration) {
        long nanos = duration.toNanos();
        TimeUnit highest = TimeUnit.NANOSECONDS;
        for (TimeUnit unit : TimeUnit.values()) {
            long unitNanos = unit.unit.getDuration().toNanos();
            if (nanos % unitNanos == 0 && unitNanos > highest.unit.getDuration().toNanos()) {
                highest = unit;
            }
        }
        return nanos / highest.unit.getDuration().toNanos() + " " + highest.labels[0];
    }

    private enum TimeUnit {
        DAYS(ChronoUnit.DAYS, "d", "day", "days"),
        HOURS(ChronoUnit.HOURS, "h", "hour", "hours"),
        MINUTES(ChronoUnit.MINUTES, "min", "m", "minute", "minutes"),
        SECONDS(ChronoUnit.SECONDS, "s", "sec", "secs", "second", "seconds"),
        MILLISECONDS(ChronoUnit.MILLIS, "ms", "milli", "millis", "millisecond", "milliseconds"),
        MICROSECONDS(ChronoUnit.MICROS, "us", "micro", "micros"),
        NANOSECONDS(ChronoUnit.NANOS, "ns", "nano", "nanos");

        private final ChronoUnit unit;
        private final String[] labels;

        TimeUnit(ChronoUnit unit, String... labels) {
            this.unit = unit;
            this.labels = labels;
        }

        private static String allLabels() {
            StringBuilder builder = new StringBuilder();
            for (TimeUnit unit : values()) {
                builder.append(String.join(" | ", unit.labels)).append(" | ");
            }
            return builder.substring(0, builder.length() - 3);
        }
    }

    private TimeUtils() {}
}
