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
import io.nosqlbench.griddata.coords.CoordinateRegistry;
import io.nosqlbench.griddata.errors.ReconciliationException;
import io.nosqlbench.griddata.events.EventSink;
import io.nosqlbench.griddata.events.GridEvent;
import io.nosqlbench.griddata.scan.CoordScan;
import io.nosqlbench.griddata.scan.Filegroup;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Merges the scanned values of several filegroups into the [AvailableSpace] of a
/// dataset.
///
/// For each dimension, filegroups that scanned nothing inherit the values of the
/// others. Numeric values are compared within the largest tolerance among the
/// filegroups. In [ReconciliationMode#DEFAULT] mode only common values are kept,
/// in [ReconciliationMode#ADVANCED] mode every value is. The variable dimension
/// is always the union of the variables of every filegroup, in order of
/// discovery.
public class Reconciler {
    private static final Logger logger = LogManager.getLogger(Reconciler.class);

    private final ReconcileOptions options;
    private final EventSink sink;

    /// @param options reconciliation options
    /// @param sink where events are sent
    public Reconciler(ReconcileOptions options, EventSink sink) {
        this.options = options;
        this.sink = sink;
    }

    /// @param registry the dataset coordinates
    /// @param filegroups scanned filegroups
    /// @return the available space
    /// @throws ReconciliationException if a dimension ends up empty, or filegroups
    /// hold the same points and duplicates are rejected
    public AvailableSpace reconcile(CoordinateRegistry registry, List<Filegroup> filegroups) {
        Map<String, Coordinate> available = new LinkedHashMap<>();
        Map<String, Double> tolerances = new LinkedHashMap<>();
        Map<String, Map<String, int[]>> contains = new LinkedHashMap<>();
        filegroups.forEach(fg -> contains.put(fg.name(), new LinkedHashMap<>()));

        for (Coordinate coordinate : registry.all()) {
            String dim = coordinate.name();
            List<CoordScan> scans = filegroups.stream().filter(fg -> fg.hasDim(dim)).map(fg -> fg.scan(dim)).toList();
            List<CoordScan> contributing = scans.stream().filter(cs -> cs.size() > 0).toList();
            double tolerance = contributing.stream().mapToDouble(CoordScan::tolerance)
                .max().orElse(coordinate.tolerance());
            tolerances.put(dim, tolerance);

            List<Object> values;
            if (contributing.isEmpty()) {
                values = coordinate.values();
            } else if (coordinate.isString()) {
                values = union(contributing);
            } else {
                sink.log(GridEvent.TOLERANCE_USED, "coord", dim, "tolerance", tolerance);
                values = options.mode() == ReconciliationMode.ADVANCED
                    ? numericUnion(contributing, tolerance)
                    : intersection(contributing, tolerance);
            }
            if (values.isEmpty()) {
                throw new ReconciliationException(dim, contributing.isEmpty()
                    ? "No values were scanned or declared"
                    : "Filegroups have no value in common");
            }
            Coordinate reconciled = coordinate.withValues(values);
            available.put(dim, reconciled);
            sink.log(GridEvent.COMMON_VALUES, "coord", dim, "size", reconciled.size(),
                "extent", reconciled.extentString());

            for (CoordScan cs : scans) {
                cs.findContained(values, tolerance);
                contains.get(cs.filegroup()).put(dim, cs.contains());
            }
        }
        checkDuplicates(filegroups, contains);
        AvailableSpace space = new AvailableSpace(available, tolerances, contains);
        logger.debug("Available space:\n{}", space);
        return space;
    }

    private static List<Object> union(List<CoordScan> scans) {
        List<Object> out = new ArrayList<>();
        for (CoordScan cs : scans) {
            for (Object v : cs.values()) {
                if (!out.contains(v)) {
                    out.add(v);
                }
            }
        }
        return out;
    }

    private List<Object> intersection(List<CoordScan> scans, double tolerance) {
        List<Object> common = new ArrayList<>(scans.get(0).values());
        for (CoordScan cs : scans.subList(1, scans.size())) {
            common.removeIf(v -> indexWithin(cs.values(), (Number) v, tolerance) < 0);
        }
        for (CoordScan cs : scans) {
            if (cs.size() > common.size()) {
                sink.log(GridEvent.COORD_TRIMMED, "filegroup", cs.filegroup(), "coord", cs.name(),
                    "before", cs.size(), "after", common.size());
            }
        }
        return common;
    }

    private static List<Object> numericUnion(List<CoordScan> scans, double tolerance) {
        List<Number> all = new ArrayList<>();
        scans.forEach(cs -> cs.values().forEach(v -> all.add((Number) v)));
        all.sort(Comparator.comparingDouble(Number::doubleValue));
        List<Object> out = new ArrayList<>();
        double last = Double.NaN;
        for (Number n : all) {
            if (out.isEmpty() || Math.abs(n.doubleValue() - last) > tolerance) {
                out.add(n.doubleValue());
                last = n.doubleValue();
            }
        }
        return out;
    }

    private static int indexWithin(List<Object> values, Number value, double tolerance) {
        for (int i = 0; i < values.size(); i++) {
            if (Math.abs(((Number) values.get(i)).doubleValue() - value.doubleValue()) <= tolerance) {
                return i;
            }
        }
        return -1;
    }

    private void checkDuplicates(List<Filegroup> filegroups, Map<String, Map<String, int[]>> contains) {
        for (int i = 0; i < filegroups.size(); i++) {
            for (int j = i + 1; j < filegroups.size(); j++) {
                Filegroup a = filegroups.get(i);
                Filegroup b = filegroups.get(j);
                if (overlap(contains.get(a.name()), contains.get(b.name()))) {
                    if (options.duplicates() == DuplicatePolicy.REJECT) {
                        throw new ReconciliationException(null, "Filegroups '" + a.name() + "' and '" + b.name()
                            + "' hold data for the same points");
                    }
                    sink.log(GridEvent.DUPLICATE_TOLERATED, "first", a.name(), "second", b.name());
                }
            }
        }
    }

    private static boolean overlap(Map<String, int[]> a, Map<String, int[]> b) {
        for (Map.Entry<String, int[]> e : a.entrySet()) {
            int[] other = b.get(e.getKey());
            if (other == null) {
                continue;
            }
            boolean any = false;
            int[] mine = e.getValue();
            for (int k = 0; k < mine.length && !any; k++) {
                any = mine[k] >= 0 && other[k] >= 0;
            }
            if (!any) {
                return false;
            }
        }
        return true;
    }
}
