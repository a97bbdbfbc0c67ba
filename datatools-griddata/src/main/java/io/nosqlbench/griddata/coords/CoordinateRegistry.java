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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// The coordinates of a dataset, in dimension order, looked up by name or by
/// alternate name.
public class CoordinateRegistry {
    private final LinkedHashMap<String, Coordinate> coordinates = new LinkedHashMap<>();
    private final Map<String, String> aliases = new LinkedHashMap<>();

    /// Register a coordinate, appending its dimension.
    ///
    /// @param coordinate the coordinate
    /// @return this registry
    /// @throws ConfigException if the name or an alternate name is already taken
    public CoordinateRegistry register(Coordinate coordinate) {
        String name = coordinate.name();
        if (coordinates.containsKey(name) || aliases.containsKey(name)) {
            throw new ConfigException("Coordinate '" + name + "' is already registered");
        }
        coordinates.put(name, coordinate);
        for (String alt : coordinate.alternateNames()) {
            if (coordinates.containsKey(alt) || aliases.containsKey(alt)) {
                throw new ConfigException("Alternate name '" + alt + "' of coordinate '" + name + "' is already taken");
            }
            aliases.put(alt, name);
        }
        return this;
    }

    /// @param name a name or an alternate name
    /// @return the coordinate, if any
    public Optional<Coordinate> find(String name) {
        Coordinate c = coordinates.get(name);
        if (c == null && aliases.containsKey(name)) {
            c = coordinates.get(aliases.get(name));
        }
        return Optional.ofNullable(c);
    }

    /// @param name a name or an alternate name
    /// @return the coordinate
    /// @throws ConfigException if unknown
    public Coordinate get(String name) {
        return find(name).orElseThrow(() -> new ConfigException("Unknown coordinate '" + name + "', known: " + dims()));
    }

    /// @param name a name or an alternate name
    /// @return true if known
    public boolean contains(String name) {
        return find(name).isPresent();
    }

    /// @return dimension names, in order
    public List<String> dims() {
        return new ArrayList<>(coordinates.keySet());
    }

    /// @return the coordinates, in order
    public List<Coordinate> all() {
        return new ArrayList<>(coordinates.values());
    }
}
