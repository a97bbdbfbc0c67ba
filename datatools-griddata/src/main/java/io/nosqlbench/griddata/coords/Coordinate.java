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

import java.util.List;

/// What the scanning and loading machinery needs to know about one dimension.
///
/// Coordinates are immutable: [#withValues(List)] returns a new instance. Values are
/// `Double`s, except for string valued coordinates such as [VariableCoordinate].
public interface Coordinate {

    /// Which neighbour to choose when looking up a value that is not present
    enum Locate {
        /// The nearest value
        CLOSEST,
        /// The nearest value at or below
        BELOW,
        /// The nearest value at or above
        ABOVE
    }

    /// @return the dimension name
    String name();

    /// @return the reference units of the values, possibly empty
    String units();

    /// @return other names under which this dimension appears in files
    List<String> alternateNames();

    /// @return the tolerance under which two values are considered equal
    double tolerance();

    /// @return number of values
    int size();

    /// @param i a position
    /// @return the value at this position
    Object value(int i);

    /// @return the values, in order
    List<Object> values();

    /// @return true for string valued coordinates, which are never sorted
    boolean isString();

    /// @param value a value
    /// @return its position, equal within the tolerance, or -1
    int indexOfExact(Object value);

    /// @param value a value
    /// @param locate which neighbour to choose
    /// @return the position of the chosen neighbour
    int indexOf(double value, Locate locate);

    /// Select the values between two bounds, both included.
    ///
    /// @param min lower bound
    /// @param max upper bound
    /// @return a slice key, descending if the coordinate is
    Key subset(double min, double max);

    /// @return true if values decrease
    boolean isDescending();

    /// @return true if values are evenly spaced within the tolerance
    boolean isRegular();

    /// @return the first and last values, formatted
    default String extentString() {
        if (size() == 0) {
            return "empty";
        }
        return format(value(0)) + " - " + format(value(size() - 1));
    }

    /// @param value a value of this coordinate
    /// @return its display form
    String format(Object value);

    /// Convert values from one set of units into another.
    ///
    /// @param values the values
    /// @param from units of the values
    /// @param to target units
    /// @return converted values
    /// @throws UnsupportedOperationException if this coordinate knows no conversion
    default double[] convertUnits(double[] values, String from, String to) {
        throw new UnsupportedOperationException("Coordinate '" + name() + "' cannot convert units from '"
            + from + "' to '" + to + "'");
    }

    /// @param values new values, in the coordinate's units
    /// @return a coordinate with the same name, units and tolerance holding these values
    Coordinate withValues(List<?> values);
}
