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

import io.nosqlbench.griddata.GridDataset;
import io.nosqlbench.griddata.coords.CoordinateRegistry;
import io.nosqlbench.griddata.errors.ConfigException;
import io.nosqlbench.griddata.events.EventSink;
import io.nosqlbench.griddata.format.FormatAdapter;
import io.nosqlbench.griddata.format.hdf5.Hdf5FormatAdapter;
import io.nosqlbench.griddata.format.hdf5.Hdf5Scanners;
import io.nosqlbench.griddata.pregex.PreRegexCompiler;
import io.nosqlbench.griddata.reconcile.DuplicatePolicy;
import io.nosqlbench.griddata.reconcile.ReconcileOptions;
import io.nosqlbench.griddata.reconcile.ReconciliationMode;
import io.nosqlbench.griddata.scan.ScanFunctions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/// A dataset described in YAML: its coordinates, and how each filegroup names
/// and arranges its files.
///
/// ```yaml
/// root: /data/ocean
/// mode: default
/// duplicates: reject
/// coordinates:
///   - {name: var, kind: variable}
///   - {name: time, kind: time, units: days since 1970-01-01}
///   - {name: lat, units: degrees_north}
/// filegroups:
///   - name: sst
///     root: sst
///     pregex: 'SST_%(time:x)\.h5'
///     coordinates: {var: in, time: shared, lat: in}
///     scanners: {time: [date_from_filename], lat: [values_in_file], var: [variables_in_file]}
/// ```
///
/// @param root directory filegroup roots are relative to; relative to the layout file
/// @param mode reconciliation mode
/// @param duplicates duplicate policy
/// @param coordinates the dimensions, in dataset order
/// @param filegroups the filegroups
public record GridLayout(String root, ReconciliationMode mode, DuplicatePolicy duplicates,
                         List<CoordinateLayout> coordinates, List<FilegroupLayout> filegroups) {

    /// @param yaml layout text
    /// @return the layout
    /// @throws ConfigException if the text is not a valid layout
    public static GridLayout fromYaml(String yaml) {
        Object configObject = LayoutYaml.yamlLoader.loadFromString(yaml);
        if (!(configObject instanceof Map<?, ?> m)) {
            throw new ConfigException("invalid grid layout format:\n" + yaml);
        }
        Object coords = m.get("coordinates");
        Object groups = m.get("filegroups");
        if (!(coords instanceof List<?> cl) || !(groups instanceof List<?> gl)) {
            throw new ConfigException("a grid layout needs a list of coordinates and a list of filegroups");
        }
        ReconciliationMode mode;
        DuplicatePolicy duplicates;
        try {
            mode = ReconciliationMode.valueOf(LayoutObjects.string(m, "mode", "default").toUpperCase(Locale.ROOT));
            duplicates = DuplicatePolicy.valueOf(LayoutObjects.string(m, "duplicates", "reject").toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigException("invalid mode or duplicates setting in grid layout", e);
        }
        return new GridLayout(LayoutObjects.string(m, "root", "."), mode, duplicates,
            cl.stream().map(CoordinateLayout::fromObject).toList(),
            gl.stream().map(FilegroupLayout::fromObject).toList());
    }

    /// @param layoutFile a YAML layout file
    /// @return the layout
    /// @throws ConfigException if the file cannot be read or is not a valid layout
    public static GridLayout load(Path layoutFile) {
        String configdata;
        try {
            configdata = Files.readString(layoutFile);
        } catch (IOException e) {
            throw new ConfigException("Cannot read layout " + layoutFile, e);
        }
        return fromYaml(configdata);
    }

    /// @return the layout as YAML
    public String toYaml() {
        return LayoutYaml.yamlDumper.dumpToString(toData());
    }

    private Map<String, Object> toData() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("root", root);
        map.put("mode", mode.name().toLowerCase(Locale.ROOT));
        map.put("duplicates", duplicates.name().toLowerCase(Locale.ROOT));
        map.put("coordinates", coordinates.stream().map(CoordinateLayout::toData).toList());
        map.put("filegroups", filegroups.stream().map(FilegroupLayout::toData).toList());
        return map;
    }

    /// Build the dataset with the HDF5 format and the default scanning functions.
    ///
    /// @param base directory a relative root is resolved against
    /// @param sink where events are sent
    /// @return the dataset, not scanned yet
    public GridDataset toDataset(Path base, EventSink sink) {
        Hdf5FormatAdapter hdf5 = new Hdf5FormatAdapter();
        ScanFunctions functions = Hdf5Scanners.register(ScanFunctions.defaults(), hdf5);
        return toDataset(base, sink, Map.of(hdf5.name(), hdf5), functions);
    }

    /// @param base directory a relative root is resolved against
    /// @param sink where events are sent
    /// @param formats adapters by format name
    /// @param functions scanning functions by name
    /// @return the dataset, not scanned yet
    public GridDataset toDataset(Path base, EventSink sink, Map<String, FormatAdapter> formats,
                                 ScanFunctions functions) {
        Path rootDir = base.resolve(root);
        CoordinateRegistry registry = new CoordinateRegistry();
        GridDataset.Builder b = GridDataset.builder()
            .options(new ReconcileOptions(mode, duplicates))
            .sink(sink);
        for (CoordinateLayout c : coordinates) {
            registry.register(c.toCoordinate());
            b.coordinate(registry.get(c.name()));
        }
        PreRegexCompiler compiler = new PreRegexCompiler();
        for (FilegroupLayout fl : filegroups) {
            FormatAdapter adapter = formats.get(fl.format());
            if (adapter == null) {
                throw new ConfigException("Unknown format '" + fl.format() + "' of filegroup " + fl.name()
                    + ", known: " + formats.keySet());
            }
            b.filegroup(fl.toFilegroup(registry, rootDir, adapter, functions, compiler, sink));
        }
        return b.build();
    }
}
