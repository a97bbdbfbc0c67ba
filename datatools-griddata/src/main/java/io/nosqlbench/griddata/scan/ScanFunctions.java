package io.nosqlbench.griddata.scan;

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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/// Scanning functions by name, as referenced from layout files.
public final class ScanFunctions {
    private final Map<String, ScanFunction> functions = new LinkedHashMap<>();

    /// @return a registry holding the file name functions of [ScanLibrary]
    public static ScanFunctions defaults() {
        return new ScanFunctions()
            .register("date_from_filename", ScanLibrary.dateFromFilename())
            .register("value_from_filename", ScanLibrary.valueFromFilename())
            .register("index_from_filename", ScanLibrary.indexFromFilename())
            .register("string_from_filename", ScanLibrary.stringFromFilename());
    }

    /// @param name function name
    /// @param function the function
    /// @return this registry
    public ScanFunctions register(String name, ScanFunction function) {
        functions.put(name, function);
        return this;
    }

    /// @param name function name
    /// @return the function
    /// @throws ConfigException if no function has this name
    public ScanFunction get(String name) {
        ScanFunction f = functions.get(name);
        if (f == null) {
            throw new ConfigException("Unknown scanning function '" + name + "', known: " + functions.keySet());
        }
        return f;
    }

    /// @return registered names
    public Set<String> names() {
        return functions.keySet();
    }
}
