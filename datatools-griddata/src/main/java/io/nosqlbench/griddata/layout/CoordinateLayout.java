package io.nosqlbench.griddata.layout;

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

import io.nosqlbench.griddata.coords.Coordinate;
import io.nosqlbench.griddata.coords.NumericCoordinate;
import io.nosqlbench.griddata.coords.TimeCoordinate;
import io.nosqlbench.griddata.coords.VariableCoordinate;
import io.nosqlbench.griddata.errors.ConfigException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/// One dimension of a layout.
///
/// ```yaml
/// - name: time
///   kind: time
///   units: days since 1970-01-01
///   tolerance: 1.0e-5
///   altNames: [t, date]
/// ```
///
/// @param name dimension name
/// @param kind numeric, time or variable
/// @param units reference units
/// @param tolerance equality tolerance
/// @param altNames other names in files
/// @param values declared values, used when no filegroup scans any
public record CoordinateLayout(String name, Kind kind, String units, double tolerance, List<String> altNames,
                               List<Object> values) {

    /// Kinds of coordinates
    public enum Kind {
        /// plain numbers
        numeric,
        /// CF time values
        time,
        /// variable names
        variable
    }

    /// @param o the parsed YAML map
    /// @return the layout
    public static CoordinateLayout fromObject(Object o) {
        if (!(o instanceof Map<?, ?> m)) {
            throw new ConfigException("A coordinate must be a map, not " + o);
        }
        Object name = m.get("name");
        if (name == null) {
            throw new ConfigException("A coordinate needs a name: " + m);
        }
        Kind kind;
        try {
            kind = Kind.valueOf(String.valueOf(m.containsKey("kind") ? m.get("kind") : "numeric").toLowerCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Unknown kind of coordinate " + name + ": " + m.get("kind"), e);
        }
        String units = m.get("units") == null ? "" : m.get("units").toString();
        double tolerance = m.get("tolerance") instanceof Number n ? n.doubleValue() : NumericCoordinate.DEFAULT_TOLERANCE;
        return new CoordinateLayout(name.toString(), kind, units, tolerance,
            LayoutObjects.strings(m.get("altNames")), LayoutObjects.list(m.get("values")));
    }

    /// @return the coordinate
    public Coordinate toCoordinate() {
        return switch (kind) {
            case variable -> new VariableCoordinate(name, values.stream().map(Object::toString).toList());
            case time -> new TimeCoordinate(name, units, altNames, tolerance, LayoutObjects.doubles(values));
            case numeric -> new NumericCoordinate(name, units, altNames, tolerance, LayoutObjects.doubles(values));
        };
    }

    /// @return the YAML data
    public Map<String, Object> toData() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("kind", kind.name());
        if (!units.isEmpty()) {
            map.put("units", units);
        }
        if (tolerance != NumericCoordinate.DEFAULT_TOLERANCE) {
            map.put("tolerance", tolerance);
        }
        if (!altNames.isEmpty()) {
            map.put("altNames", altNames);
        }
        if (!values.isEmpty()) {
            map.put("values", values);
        }
        return map;
    }
}
