package io.nosqlbench.griddata.format.hdf5;

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

import io.nosqlbench.griddata.errors.ScanException;
import io.nosqlbench.griddata.format.FileAxis;
import io.nosqlbench.griddata.format.FileHandle;
import io.nosqlbench.griddata.scan.CoordScan;
import io.nosqlbench.griddata.scan.InFileIndex;
import io.nosqlbench.griddata.scan.InFileScanner;
import io.nosqlbench.griddata.scan.ScanFunctions;
import io.nosqlbench.griddata.scan.ScanResult;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.IntStream;

/// Scanning functions that read HDF5 file content.
public final class Hdf5Scanners {

    private Hdf5Scanners() {
    }

    /// Add `values_in_file`, `variables_in_file` and `units_in_file` to a registry.
    ///
    /// @param functions the registry
    /// @param adapter the adapter reading the files
    /// @return the registry
    public static ScanFunctions register(ScanFunctions functions, Hdf5FormatAdapter adapter) {
        return functions
            .register("values_in_file", valuesInFile(adapter))
            .register("variables_in_file", variablesInFile(adapter))
            .register("units_in_file", unitsInFile(adapter));
    }

    /// Read the values of the coordinate dataset, named after the dimension or one
    /// of its alternate names. In-file indices are positions; units are read too.
    ///
    /// @param adapter the adapter reading the files
    /// @return the scanning function
    public static InFileScanner valuesInFile(Hdf5FormatAdapter adapter) {
        return (scan, file, prior) -> {
            String name = coordinateDataset(adapter, scan, file);
            double[] values = adapter.values(file, name);
            List<Object> boxed = Arrays.stream(values).boxed().map(v -> (Object) v).toList();
            List<InFileIndex> indices = IntStream.range(0, values.length).mapToObj(InFileIndex::of).toList();
            String units = adapter.attribute(file, name, Hdf5FormatAdapter.UNITS_ATTRIBUTE).orElse(null);
            return new ScanResult(boxed, indices, units, null);
        };
    }

    /// List the variables of the file, with their in-file names and axes.
    ///
    /// @param adapter the adapter reading the files
    /// @return the scanning function
    public static InFileScanner variablesInFile(Hdf5FormatAdapter adapter) {
        return (scan, file, prior) -> {
            List<Object> names = new ArrayList<>();
            List<InFileIndex> indices = new ArrayList<>();
            Map<String, List<String>> dimensions = new LinkedHashMap<>();
            for (String variable : adapter.variables(file)) {
                names.add(variable);
                indices.add(InFileIndex.named(variable));
                adapter.axisOrder(file, variable).ifPresent(axes ->
                    dimensions.put(variable, axes.stream().map(FileAxis::name).toList()));
            }
            return new ScanResult(names, indices, null, null).withDimensions(dimensions);
        };
    }

    /// Read the units of the coordinate dataset, leaving values alone.
    ///
    /// @param adapter the adapter reading the files
    /// @return the scanning function
    public static InFileScanner unitsInFile(Hdf5FormatAdapter adapter) {
        return (scan, file, prior) -> {
            String name = coordinateDataset(adapter, scan, file);
            Optional<String> units = adapter.attribute(file, name, Hdf5FormatAdapter.UNITS_ATTRIBUTE);
            return units.map(ScanResult::units).orElse(ScanResult.none());
        };
    }

    private static String coordinateDataset(Hdf5FormatAdapter adapter, CoordScan scan, FileHandle file)
        throws IOException {
        List<String> candidates = new ArrayList<>();
        candidates.add(scan.name());
        candidates.addAll(scan.coordinate().alternateNames());
        for (String c : candidates) {
            if (adapter.hasDataset(file, c)) {
                return c;
            }
        }
        throw new ScanException(scan.filegroup(), scan.name(), "None of " + candidates + " is a dataset of "
            + file.path());
    }
}
