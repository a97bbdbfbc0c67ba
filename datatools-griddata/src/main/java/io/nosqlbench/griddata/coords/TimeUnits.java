package io.nosqlbench.griddata.coords;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.nosqlbench.griddata.errors.ConfigException;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// CF style time units, such as `days since 1950-01-01` or
/// `hours since 2000-01-01 12:00:00`.
///
/// @param seconds length of one unit, in seconds
/// @param epoch the reference date
/// @param text the units as written
public record TimeUnits(long seconds, LocalDateTime epoch, String text) {
    /// The textual form of time units
    public static final Pattern PATTERN = Pattern.compile(
        """
            \\s*(?<unit>seconds?|secs?|s|minutes?|mins?|hours?|hrs?|h|days?|d)
            \\s+since\\s+
            (?<year>-?\\d{1,4})-(?<month>\\d{1,2})-(?<day>\\d{1,2})
            ([T\\s]+(?<hour>\\d{1,2}):(?<minute>\\d{1,2})(:(?<second>\\d{1,2})(\\.\\d*)?)?)?
            \\s*(Z|UTC|[+-]00(:?00)?)?\\s*
            """, Pattern.COMMENTS | Pattern.CASE_INSENSITIVE
    );

    /// @param text units such as `days since 1950-01-01`
    /// @return the parsed units
    /// @throws ConfigException if the text is not CF time units
    public static TimeUnits parse(String text) {
        Matcher m = PATTERN.matcher(text);
        if (!m.matches()) {
            throw new ConfigException("invalid time units '" + text + "', expected '<seconds|minutes|hours|days> since"
                + " yyyy-mm-dd[ hh:mm:ss]'");
        }
        String unit = m.group("unit").toLowerCase(Locale.ROOT);
        long seconds;
        if (unit.startsWith("d")) {
            seconds = 86400;
        } else if (unit.startsWith("h")) {
            seconds = 3600;
        } else if (unit.startsWith("m")) {
            seconds = 60;
        } else {
            seconds = 1;
        }
        LocalDate date = LocalDate.of(Integer.parseInt(m.group("year")), Integer.parseInt(m.group("month")),
            Integer.parseInt(m.group("day")));
        LocalTime time = LocalTime.MIDNIGHT;
        if (m.group("hour") != null) {
            time = LocalTime.of(Integer.parseInt(m.group("hour")), Integer.parseInt(m.group("minute")),
                m.group("second") == null ? 0 : Integer.parseInt(m.group("second")));
        }
        return new TimeUnits(seconds, LocalDateTime.of(date, time), text.trim());
    }

    /// @param text some units
    /// @return true if the text is CF time units
    public static boolean isTimeUnits(String text) {
        return text != null && PATTERN.matcher(text).matches();
    }

    /// @param value a time value in these units
    /// @return the date it designates
    public LocalDateTime dateOf(double value) {
        long nanos = Math.round(value * seconds * 1e9);
        return epoch.plus(Duration.ofNanos(nanos));
    }

    /// @param date a date
    /// @return its value in these units
    public double valueOf(LocalDateTime date) {
        Duration d = Duration.between(epoch, date);
        return (d.getSeconds() + d.getNano() / 1e9) / seconds;
    }

    /// @param values values in these units
    /// @param target other units
    /// @return the same instants in the target units
    public double[] convert(double[] values, TimeUnits target) {
        double shift = target.valueOf(epoch);
        double scale = (double) seconds / target.seconds;
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i] * scale + shift;
        }
        return out;
    }

    @Override
    public String toString() {
        return text;
    }
}
