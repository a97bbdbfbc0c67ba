package io.nosqlbench.griddata.reconcile;

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
import io.nosqlbench.griddata.errors.ConfigException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// The values a dataset can load, per dimension, and where each filegroup holds
/// them.
public final class AvailableSpace {
    private final Map<String, Coordinate> coordinates;
    private final Map<String, Double> tolerances;
    private final Map<String, Map<String, int[]>> contains;

    /// @param coordinates available coordinates, in dataset order
    /// @param tolerances tolerance used for each dimension
    /// @param contains per filegroup and dimension, the scanned index of each available value or -1
    public AvailableSpace(Map<String, Coordinate> coordinates, Map<String, Double> tolerances,
                          Map<String, Map<String, int[]>> contains) {
        this.coordinates = Collections.unmodifiableMap(new LinkedHashMap<>(coordinates));
        this.tolerances = Map.copyOf(tolerances);
        Map<String, Map<String, int[]>> copy = new LinkedHashMap<>();
        contains.forEach((fg, m) -> copy.put(fg, Collections.unmodifiableMap(new LinkedHashMap<>(m))));
        this.contains = Collections.unmodifiableMap(copy);
    }

    /// @return dimensions, in dataset order
    public List<String> dims() {
        return new ArrayList<>(coordinates.keySet());
    }

    /// @param dim a dimension
    /// @return its available coordinate
    public Coordinate coordinate(String dim) {
        Coordinate c = coordinates.get(dim);
        if (c == null) {
            throw new ConfigException("No dimension '" + dim + "' in " + coordinates.keySet());
        }
        return c;
    }

    /// @return every available coordinate, in dataset order
    public Map<String, Coordinate> coordinates() {
        return coordinates;
    }

    /// @param dim a dimension
    /// @return number of available values
    public int size(String dim) {
        return coordinate(dim).size();
    }

    /// @return number of available values of each dimension
    public Map<String, Integer> sizes() {
        Map<String, Integer> out = new LinkedHashMap<>();
        coordinates.forEach((d, c) -> out.put(d, c.size()));
        return out;
    }

    /// @param dim a dimension
    /// @return the tolerance used when reconciling it
    public double tolerance(String dim) {
        return tolerances.getOrDefault(dim, coordinate(dim).tolerance());
    }

    /// @return names of the filegroups, in dataset order
    public List<String> filegroups() {
        return new ArrayList<>(contains.keySet());
    }

    /// @param filegroup a filegroup
    /// @param dim one of its dimensions
    /// @return for each available value, the index of the filegroup's scanned value, or -1
    public int[] contains(String filegroup, String dim) {
        Map<String, int[]> m = contains.get(filegroup);
        if (m == null || !m.containsKey(dim)) {
            throw new ConfigException("Filegroup '" + filegroup + "' has no dimension '" + dim + "'");
        }
        return m.get(dim).clone();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        coordinates.forEach((d, c) -> sb.append(d).append(": ").append(c.size()).append(" [")
            .append(c.extentString()).append("]\n"));
        return sb.toString();
    }
}
