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

import io.nosqlbench.griddata.keys.Key;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/// A numeric coordinate whose values count CF time units since an epoch.
public class TimeCoordinate extends NumericCoordinate {
    private static final DateTimeFormatter DISPLAY = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final TimeUnits timeUnits;

    /// @param name dimension name
    /// @param units CF time units
    /// @param alternateNames other names of the dimension
    /// @param tolerance equality tolerance, in time units
    /// @param values the values
    public TimeCoordinate(String name, String units, List<String> alternateNames, double tolerance, double[] values) {
        super(name, units, alternateNames, tolerance, values);
        this.timeUnits = TimeUnits.parse(units);
    }

    /// @param name dimension name
    /// @param units CF time units
    /// @return an empty time coordinate
    public static TimeCoordinate empty(String name, String units) {
        return new TimeCoordinate(name, units, List.of(), DEFAULT_TOLERANCE, new double[0]);
    }

    /// @return the parsed units
    public TimeUnits timeUnits() {
        return timeUnits;
    }

    /// @param date a date
    /// @return its value in this coordinate's units
    public double valueOf(LocalDateTime date) {
        return timeUnits.valueOf(date);
    }

    /// @param i a position
    /// @return the date at this position
    public LocalDateTime dateOf(int i) {
        return timeUnits.dateOf(valueAt(i));
    }

    /// @param from earliest date, included
    /// @param to latest date, included
    /// @return the slice key selecting these dates
    public Key subsetDates(LocalDateTime from, LocalDateTime to) {
        return subset(valueOf(from), valueOf(to));
    }

    @Override
    public String format(Object value) {
        return timeUnits.dateOf(((Number) value).doubleValue()).format(DISPLAY);
    }

    @Override
    public double[] convertUnits(double[] values, String from, String to) {
        return TimeUnits.parse(from).convert(values, TimeUnits.parse(to));
    }

    @Override
    public TimeCoordinate withValues(List<?> newValues) {
        return new TimeCoordinate(name(), units(), alternateNames(), tolerance(), toDoubles(newValues));
    }
}
