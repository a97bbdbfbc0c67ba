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
import java.util.List;

/// The string valued dimension listing the variables of a dataset.
///
/// Names keep the order in which they were declared or discovered.
public class VariableCoordinate implements Coordinate {
    /// Conventional name of the variable dimension
    public static final String DIM = "var";

    private final String name;
    private final List<String> names;

    /// @param name dimension name
    /// @param names the variable names
    public VariableCoordinate(String name, List<String> names) {
        this.name = name;
        this.names = List.copyOf(names);
    }

    /// @param names the variable names
    /// @return a variable coordinate named `var`
    public static VariableCoordinate of(String... names) {
        return new VariableCoordinate(DIM, List.of(names));
    }

    /// @return the names, in order
    public List<String> names() {
        return names;
    }

    /// @param variable a variable name
    /// @return its position
    /// @throws IllegalArgumentException if the variable is unknown
    public int indexOfName(String variable) {
        int i = names.indexOf(variable);
        if (i < 0) {
            throw new IllegalArgumentException("'" + variable + "' not in variables " + names);
        }
        return i;
    }

    /// @param i a position, negative counting from the end
    /// @return the name at this position
    public String nameOf(int i) {
        return names.get(i < 0 ? i + names.size() : i);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String units() {
        return "";
    }

    @Override
    public List<String> alternateNames() {
        return List.of();
    }

    @Override
    public double tolerance() {
        return 0;
    }

    @Override
    public int size() {
        return names.size();
    }

    @Override
    public Object value(int i) {
        return names.get(i);
    }

    @Override
    public List<Object> values() {
        return new ArrayList<>(names);
    }

    @Override
    public boolean isString() {
        return true;
    }

    @Override
    public int indexOfExact(Object value) {
        return names.indexOf(String.valueOf(value));
    }

    @Override
    public int indexOf(double value, Locate locate) {
        throw new UnsupportedOperationException("Variables are not located by numeric value");
    }

    @Override
    public Key subset(double min, double max) {
        throw new UnsupportedOperationException("Variables cannot be subset by value");
    }

    @Override
    public boolean isDescending() {
        return false;
    }

    @Override
    public boolean isRegular() {
        return false;
    }

    @Override
    public String format(Object value) {
        return String.valueOf(value);
    }

    @Override
    public VariableCoordinate withValues(List<?> values) {
        return new VariableCoordinate(name, values.stream().map(String::valueOf).toList());
    }

    @Override
    public String toString() {
        return name + names;
    }
}
