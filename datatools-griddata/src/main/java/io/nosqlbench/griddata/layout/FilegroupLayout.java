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

import io.nosqlbench.griddata.coords.CoordinateRegistry;
import io.nosqlbench.griddata.errors.ConfigException;
import io.nosqlbench.griddata.events.EventSink;
import io.nosqlbench.griddata.format.FormatAdapter;
import io.nosqlbench.griddata.keys.KeySpecs;
import io.nosqlbench.griddata.pregex.PreRegexCompiler;
import io.nosqlbench.griddata.scan.CoordScan;
import io.nosqlbench.griddata.scan.Filegroup;
import io.nosqlbench.griddata.scan.InFileIndex;
import io.nosqlbench.griddata.scan.ScanFunctions;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// One filegroup of a layout.
///
/// ```yaml
/// - name: sst
///   root: sst
///   format: hdf5
///   pregex: '%(prefix)_%(time:x)\.h5'
///   replacements: {prefix: SST}
///   coordinates: {var: in, time: shared, lat: in}
///   scanners:
///     time: [date_from_filename]
///     lat: [values_in_file]
///     var: [variables_in_file]
///   manual: {depth: [0.0]}
///   constants: {depth: 0}
///   descending: [lat]
///   select: {lat: "0:10"}
/// ```
///
/// `select` takes a key (`"0:10"`, `"3"`, `"1,4"`) or a pair of bounds
/// (`[-10.0, 10.0]`).
///
/// @param name filegroup name
/// @param root directory, relative to the layout root
/// @param file a single file to use instead of listing the root, or null
/// @param format format name
/// @param pregex pre-regex of file names
/// @param replacements constants of the pre-regex
/// @param coordinates `in` or `shared`, per dimension
/// @param scanners scanning function names, per dimension
/// @param manual values given by hand, per dimension
/// @param constants constant in-file index, per dimension
/// @param descending dimensions whose in-file indices are forced descending
/// @param select selection applied after scanning, per dimension
public record FilegroupLayout(String name, String root, String file, String format, String pregex,
                              Map<String, String> replacements, Map<String, String> coordinates,
                              Map<String, List<String>> scanners, Map<String, List<Object>> manual,
                              Map<String, Object> constants, List<String> descending, Map<String, Object> select) {

    /// @param o the parsed YAML map
    /// @return the layout
    public static FilegroupLayout fromObject(Object o) {
        if (!(o instanceof Map<?, ?> m)) {
            throw new ConfigException("A filegroup must be a map, not " + o);
        }
        String name = LayoutObjects.string(m, "name", null);
        if (name == null || m.get("pregex") == null) {
            throw new ConfigException("A filegroup needs a name and a pregex: " + m);
        }
        Map<String, String> replacements = new LinkedHashMap<>();
        LayoutObjects.map(m.get("replacements"), "replacements").forEach((k, v) -> replacements.put(k, String.valueOf(v)));
        Map<String, String> coordinates = new LinkedHashMap<>();
        LayoutObjects.map(m.get("coordinates"), "coordinates").forEach((k, v) -> coordinates.put(k, String.valueOf(v)));
        Map<String, List<String>> scanners = new LinkedHashMap<>();
        LayoutObjects.map(m.get("scanners"), "scanners").forEach((k, v) -> scanners.put(k, LayoutObjects.strings(v)));
        Map<String, List<Object>> manual = new LinkedHashMap<>();
        LayoutObjects.map(m.get("manual"), "manual").forEach((k, v) -> manual.put(k, LayoutObjects.list(v)));
        return new FilegroupLayout(name,
            LayoutObjects.string(m, "root", "."),
            LayoutObjects.string(m, "file", null),
            LayoutObjects.string(m, "format", "hdf5"),
            m.get("pregex").toString(),
            replacements, coordinates, scanners, manual,
            LayoutObjects.map(m.get("constants"), "constants"),
            LayoutObjects.strings(m.get("descending")),
            LayoutObjects.map(m.get("select"), "select"));
    }

    /// Build the filegroup, its dimensions taken from the registry.
    ///
    /// @param registry the dataset coordinates
    /// @param base directory the root is relative to
    /// @param adapter the format adapter
    /// @param functions the scanning functions
    /// @param compiler the pre-regex compiler
    /// @param sink where events are sent
    /// @return the filegroup
    public Filegroup toFilegroup(CoordinateRegistry registry, Path base, FormatAdapter adapter,
                                 ScanFunctions functions, PreRegexCompiler compiler, EventSink sink) {
        Filegroup.Builder b = Filegroup.builder(name)
            .root(base.resolve(root))
            .format(adapter)
            .pregex(pregex)
            .replacements(replacements)
            .compiler(compiler)
            .sink(sink);
        if (file != null) {
            b.singleFile(Path.of(file));
        }
        for (Map.Entry<String, String> e : coordinates.entrySet()) {
            switch (e.getValue()) {
                case "in" -> b.in(registry.get(e.getKey()));
                case "shared" -> b.shared(registry.get(e.getKey()));
                default -> throw new ConfigException("Dimension " + e.getKey() + " of filegroup " + name
                    + " must be 'in' or 'shared', not '" + e.getValue() + "'");
            }
        }
        Filegroup fg = b.build();
        scanners.forEach((dim, names) -> names.forEach(n -> fg.scan(dim).addScanner(functions.get(n))));
        manual.forEach((dim, values) -> fg.scan(dim).setManual(values.stream()
            .map(v -> v instanceof Number n ? (Object) n.doubleValue() : v).toList(), null));
        constants.forEach((dim, v) -> fg.scan(dim).setConstantIndex(v instanceof Number n
            ? InFileIndex.of(n.intValue()) : InFileIndex.named(String.valueOf(v))));
        descending.forEach(dim -> fg.scan(dim).setForceIndexDescending(true));
        select.forEach((dim, v) -> applySelect(fg.scan(dim), v));
        return fg;
    }

    private static void applySelect(CoordScan cs, Object v) {
        if (v instanceof List<?> l && l.size() == 2 && l.get(0) instanceof Number lo && l.get(1) instanceof Number hi) {
            cs.selectValues(lo.doubleValue(), hi.doubleValue());
        } else {
            cs.select(KeySpecs.fromObject(v));
        }
    }

    /// @return the YAML data
    public Map<String, Object> toData() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("root", root);
        if (file != null) {
            map.put("file", file);
        }
        map.put("format", format);
        map.put("pregex", pregex);
        if (!replacements.isEmpty()) {
            map.put("replacements", replacements);
        }
        map.put("coordinates", coordinates);
        putIfNotEmpty(map, "scanners", scanners);
        putIfNotEmpty(map, "manual", manual);
        putIfNotEmpty(map, "constants", constants);
        if (!descending.isEmpty()) {
            map.put("descending", new ArrayList<>(descending));
        }
        putIfNotEmpty(map, "select", select);
        return map;
    }

    private static void putIfNotEmpty(Map<String, Object> map, String key, Map<String, ?> value) {
        if (!value.isEmpty()) {
            map.put(key, value);
        }
    }
}
