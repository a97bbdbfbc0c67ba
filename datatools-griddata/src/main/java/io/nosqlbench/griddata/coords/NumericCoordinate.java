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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// A coordinate holding monotonic floating point values, such as latitude or depth.
public class NumericCoordinate implements Coordinate {
    /// Default tolerance for comparing values
    public static final double DEFAULT_TOLERANCE = 1e-5;

    private final String name;
    private final String units;
    private final List<String> alternateNames;
    private final double tolerance;
    private final double[] values;

    /// @param name dimension name
    /// @param units reference units, possibly empty
    /// @param alternateNames other names of the dimension
    /// @param tolerance equality tolerance
    /// @param values the values, monotonic
    public NumericCoordinate(String name, String units, List<String> alternateNames, double tolerance, double[] values) {
        this.name = name;
        this.units = units == null ? "" : units;
        this.alternateNames = alternateNames == null ? List.of() : List.copyOf(alternateNames);
        this.tolerance = tolerance;
        this.values = values == null ? new double[0] : values.clone();
    }

    /// @param name dimension name
    /// @param units reference units
    /// @return an empty coordinate with the default tolerance
    public static NumericCoordinate empty(String name, String units) {
        return new NumericCoordinate(name, units, List.of(), DEFAULT_TOLERANCE, new double[0]);
    }

    /// @param name dimension name
    /// @param values the values
    /// @return a unitless coordinate with the default tolerance
    public static NumericCoordinate of(String name, double... values) {
        return new NumericCoordinate(name, "", List.of(), DEFAULT_TOLERANCE, values);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String units() {
        return units;
    }

    @Override
    public List<String> alternateNames() {
        return alternateNames;
    }

    @Override
    public double tolerance() {
        return tolerance;
    }

    @Override
    public int size() {
        return values.length;
    }

    @Override
    public Object value(int i) {
        return values[i];
    }

    /// @param i a position
    /// @return the value at this position
    public double valueAt(int i) {
        return values[i];
    }

    /// @return a copy of the values
    public double[] doubleValues() {
        return values.clone();
    }

    @Override
    public List<Object> values() {
        List<Object> out = new ArrayList<>(values.length);
        for (double v : values) {
            out.add(v);
        }
        return out;
    }

    @Override
    public boolean isString() {
        return false;
    }

    @Override
    public int indexOfExact(Object value) {
        if (!(value instanceof Number n)) {
            return -1;
        }
        int i = indexOf(n.doubleValue(), Locate.CLOSEST);
        return i >= 0 && Math.abs(values[i] - n.doubleValue()) <= tolerance ? i : -1;
    }

    @Override
    public int indexOf(double value, Locate locate) {
        if (values.length == 0) {
            return -1;
        }
        boolean desc = isDescending();
        int best = -1;
        for (int i = 0; i < values.length; i++) {
            double v = values[i];
            boolean ok = switch (locate) {
                case CLOSEST -> true;
                case BELOW -> v <= value + tolerance;
                case ABOVE -> v >= value - tolerance;
            };
            if (!ok) {
                continue;
            }
            if (best < 0 || Math.abs(v - value) < Math.abs(values[best] - value)) {
                best = i;
            }
        }
        if (best < 0) {
            // out of range, clamp to the smallest or largest value
            int smallest = desc ? values.length - 1 : 0;
            int largest = desc ? 0 : values.length - 1;
            best = locate == Locate.BELOW ? smallest : largest;
        }
        return best;
    }

    @Override
    public Key subset(double min, double max) {
        int start = indexOf(min, Locate.ABOVE);
        int stop = indexOf(max, Locate.BELOW);
        if (!isDescending()) {
            return Key.slice(start, stop + 1, 1).withParentSize(values.length);
        }
        return Key.slice(start, stop == 0 ? null : stop - 1, -1).withParentSize(values.length);
    }

    @Override
    public boolean isDescending() {
        return values.length > 1 && values[values.length - 1] < values[0];
    }

    @Override
    public boolean isRegular() {
        if (values.length < 3) {
            return true;
        }
        double step = values[1] - values[0];
        for (int i = 2; i < values.length; i++) {
            if (Math.abs(values[i] - values[i - 1] - step) > tolerance) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String format(Object value) {
        return String.format("%.2f", ((Number) value).doubleValue());
    }

    @Override
    public NumericCoordinate withValues(List<?> newValues) {
        return new NumericCoordinate(name, units, alternateNames, tolerance, toDoubles(newValues));
    }

    /// @param values numbers
    /// @return their double values
    protected static double[] toDoubles(List<?> values) {
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = ((Number) values.get(i)).doubleValue();
        }
        return out;
    }

    @Override
    public String toString() {
        return name + "(" + units + ") " + Arrays.toString(values.length <= 6 ? values : Arrays.copyOf(values, 6));
    }
}
