package io.nosqlbench.griddata;

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

import io.nosqlbench.griddata.array.ArrayAccessor;
import io.nosqlbench.griddata.array.GridArray;
import io.nosqlbench.griddata.coords.Coordinate;
import io.nosqlbench.griddata.coords.CoordinateRegistry;
import io.nosqlbench.griddata.coords.VariableCoordinate;
import io.nosqlbench.griddata.errors.ConfigException;
import io.nosqlbench.griddata.errors.LoadException;
import io.nosqlbench.griddata.events.EventSink;
import io.nosqlbench.griddata.events.GridEvent;
import io.nosqlbench.griddata.events.Log4jEventSink;
import io.nosqlbench.griddata.keys.Key;
import io.nosqlbench.griddata.keys.Keyring;
import io.nosqlbench.griddata.load.LoadCommand;
import io.nosqlbench.griddata.load.LoadExecutor;
import io.nosqlbench.griddata.load.LoadPlanner;
import io.nosqlbench.griddata.load.LoadReport;
import io.nosqlbench.griddata.reconcile.AvailableSpace;
import io.nosqlbench.griddata.reconcile.ReconcileOptions;
import io.nosqlbench.griddata.reconcile.Reconciler;
import io.nosqlbench.griddata.scan.Filegroup;
import io.nosqlbench.griddata.scan.FilegroupScanner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// A gridded dataset spread over the files of one or more filegroups.
///
/// Usage follows three steps:
/// 1. [#scanAll()] scans every filegroup and reconciles their values into the
///    [AvailableSpace]
/// 2. a request is expressed as a [Keyring] of indices into the available values,
///    possibly built with [#keyringByValue(String, double, double)]
/// 3. [#load(Keyring)] plans and runs the reads, returning an array shaped like
///    the request
///
/// Every filegroup must declare every dimension of the dataset. At most one
/// dimension is string valued; it holds the variables.
public class GridDataset {
    private static final Logger logger = LogManager.getLogger(GridDataset.class);

    private final CoordinateRegistry coordinates;
    private final List<Filegroup> filegroups;
    private final ReconcileOptions options;
    private final EventSink sink;
    private final String variableDim;
    private AvailableSpace space;

    private GridDataset(Builder b, String variableDim) {
        this.coordinates = b.coordinates;
        this.filegroups = List.copyOf(b.filegroups);
        this.options = b.options;
        this.sink = b.sink;
        this.variableDim = variableDim;
    }

    /// @return a builder
    public static Builder builder() {
        return new Builder();
    }

    /// Scan every filegroup, then reconcile. Scanning again starts from scratch.
    ///
    /// @return the available space
    public AvailableSpace scanAll() {
        FilegroupScanner scanner = new FilegroupScanner();
        for (Filegroup fg : filegroups) {
            logger.info("Scanning filegroup {}", fg.name());
            scanner.scan(fg);
        }
        space = new Reconciler(options, sink).reconcile(coordinates, filegroups);
        return space;
    }

    /// @return the available space
    /// @throws IllegalStateException before [#scanAll()]
    public AvailableSpace availableSpace() {
        if (space == null) {
            throw new IllegalStateException("Dataset has not been scanned");
        }
        return space;
    }

    /// @return dimensions, in dataset order
    public List<String> dims() {
        return coordinates.dims();
    }

    /// @return the declared coordinates
    public CoordinateRegistry coordinates() {
        return coordinates;
    }

    /// @return the filegroups, in declaration order
    public List<Filegroup> filegroups() {
        return filegroups;
    }

    /// @param name a filegroup name
    /// @return the filegroup
    public Filegroup filegroup(String name) {
        return filegroups.stream().filter(fg -> fg.name().equals(name)).findFirst()
            .orElseThrow(() -> new ConfigException("No filegroup '" + name + "'"));
    }

    /// @return the variable dimension, or null
    public String variableDim() {
        return variableDim;
    }

    /// Complete a request: missing dimensions are taken whole, variable names become
    /// indices, negative indices count from the end, and keys are put in dataset order.
    ///
    /// @param request a keyring over available values
    /// @return the normalised keyring
    /// @throws LoadException if an index falls outside the available values
    public Keyring normalize(Keyring request) {
        AvailableSpace avail = availableSpace();
        request.checkUnwanted(dims());
        Keyring k = request.makeFull(dims()).makeTotal();
        if (variableDim != null && avail.coordinate(variableDim) instanceof VariableCoordinate vars) {
            k = k.toIndices(variableDim, vars);
        }
        LinkedHashMap<String, Key> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, Key> e : k) {
            int size = avail.size(e.getKey());
            try {
                resolved.put(e.getKey(), e.getValue().resolve(size));
            } catch (IndexOutOfBoundsException ex) {
                throw new LoadException("Cannot select " + e.getValue().print() + " in dimension '" + e.getKey()
                    + "' of " + size + " available values", ex);
            }
        }
        return Keyring.of(resolved).sortBy(dims());
    }

    /// @param dim a dimension
    /// @param min lower bound
    /// @param max upper bound
    /// @return a keyring selecting the available values between two bounds
    public Keyring keyringByValue(String dim, double min, double max) {
        return Keyring.of(dim, availableSpace().coordinate(dim).subset(min, max));
    }

    /// @param bounds lower and upper bound per dimension
    /// @return a keyring selecting the available values between each pair of bounds
    public Keyring keyringByValue(Map<String, double[]> bounds) {
        LinkedHashMap<String, Key> keys = new LinkedHashMap<>();
        bounds.forEach((dim, b) -> keys.put(dim, availableSpace().coordinate(dim).subset(b[0], b[1])));
        return Keyring.of(keys);
    }

    /// Plan the reads of a request, without reading.
    ///
    /// @param request a keyring over available values
    /// @return the commands of every filegroup, in filegroup order
    public List<LoadCommand> plan(Keyring request) {
        List<LoadCommand> out = new ArrayList<>();
        planByFilegroup(normalize(request)).values().forEach(out::addAll);
        return out;
    }

    private Map<Filegroup, List<LoadCommand>> planByFilegroup(Keyring normalized) {
        Map<Filegroup, List<LoadCommand>> out = new LinkedHashMap<>();
        for (Filegroup fg : filegroups) {
            LoadPlanner planner = new LoadPlanner(space, variableDim, fg.format().readsAllVariablesAtOnce());
            List<LoadCommand> commands = planner.plan(fg, normalized);
            logger.debug("Filegroup {}: {} commands", fg.name(), commands.size());
            out.put(fg, commands);
        }
        return out;
    }

    /// Shape of the destination of a request, with one axis per dataset dimension.
    ///
    /// @param request a keyring over available values
    /// @return the shape, before squeezing integer keys
    public int[] destinationShape(Keyring request) {
        return normalize(request).makeIntList().keys().stream().mapToInt(Key::shape).toArray();
    }

    /// Load a request into a new array. Values no file provides are NaN.
    ///
    /// @param request a keyring over available values
    /// @return an array shaped like the request, integer keys squeezed
    public GridArray load(Keyring request) {
        Keyring k = normalize(request);
        GridArray destination = GridArray.filled(Double.NaN, destinationShape(k));
        load(k, destination);
        LinkedHashMap<String, Key> squeeze = new LinkedHashMap<>();
        boolean any = false;
        for (Map.Entry<String, Key> e : k) {
            boolean scalar = !e.getValue().isString() && e.getValue().kind() == Key.Kind.INT;
            squeeze.put(e.getKey(), scalar ? Key.of(0) : Key.all());
            any |= scalar;
        }
        return any ? ArrayAccessor.take(destination, Keyring.of(squeeze)).copy() : destination;
    }

    /// Plan a request and load it into an existing array.
    ///
    /// @param request a keyring over available values
    /// @param destination an array of [#destinationShape(Keyring)]
    /// @return what was read
    /// @throws io.nosqlbench.griddata.errors.LoadException if some values could not be read from any file
    public LoadReport load(Keyring request, GridArray destination) {
        Keyring k = normalize(request);
        int[] shape = destinationShape(k);
        if (!Arrays.equals(shape, destination.shape())) {
            throw new IllegalArgumentException("Destination of shape " + Arrays.toString(destination.shape())
                + " cannot hold " + k.print() + " of shape " + Arrays.toString(shape));
        }
        LoadReport report = new LoadReport(shape);
        Map<Filegroup, List<LoadCommand>> plans = planByFilegroup(k);
        if (plans.values().stream().allMatch(List::isEmpty)) {
            sink.log(GridEvent.NOTHING_LOADED, "keyring", k.print());
            return report;
        }
        LoadExecutor executor = new LoadExecutor(space.coordinates(), variableDim, sink);
        plans.forEach((fg, commands) -> executor.execute(fg.format(), commands, destination, report));
        logger.info("Loaded {}: {}", k.print(), report);
        report.throwIfUnsatisfied();
        return report;
    }

    /// @param filegroup a filegroup name
    /// @param dim one of its dimensions
    /// @return true if in-file indices of this dimension run opposite to its values
    public boolean isIndexDescending(String filegroup, String dim) {
        return filegroup(filegroup).scan(dim).isIndexDescending();
    }

    /// Builds a [GridDataset]
    public static class Builder {
        private final CoordinateRegistry coordinates = new CoordinateRegistry();
        private final List<Filegroup> filegroups = new ArrayList<>();
        private ReconcileOptions options = ReconcileOptions.defaults();
        private EventSink sink = new Log4jEventSink();

        private Builder() {
        }

        /// @param coordinate a dataset dimension, in dataset order
        /// @return this
        public Builder coordinate(Coordinate coordinate) {
            coordinates.register(coordinate);
            return this;
        }

        /// @param filegroup a filegroup
        /// @return this
        public Builder filegroup(Filegroup filegroup) {
            filegroups.add(filegroup);
            return this;
        }

        /// @param options reconciliation options
        /// @return this
        public Builder options(ReconcileOptions options) {
            this.options = options;
            return this;
        }

        /// @param sink where events are sent
        /// @return this
        public Builder sink(EventSink sink) {
            this.sink = sink;
            return this;
        }

        /// @return the dataset
        /// @throws ConfigException if a filegroup does not declare exactly the dataset
        /// dimensions, or several dimensions are string valued
        public GridDataset build() {
            if (filegroups.isEmpty()) {
                throw new ConfigException("A dataset needs at least one filegroup");
            }
            Set<String> dims = new HashSet<>(coordinates.dims());
            Set<String> names = new HashSet<>();
            for (Filegroup fg : filegroups) {
                if (!names.add(fg.name())) {
                    throw new ConfigException("Filegroup '" + fg.name() + "' declared twice");
                }
                if (!new HashSet<>(fg.dims()).equals(dims)) {
                    throw new ConfigException("Filegroup '" + fg.name() + "' declares " + fg.dims()
                        + " instead of the dataset dimensions " + coordinates.dims());
                }
            }
            List<String> strings = coordinates.all().stream().filter(Coordinate::isString).map(Coordinate::name)
                .toList();
            if (strings.size() > 1) {
                throw new ConfigException("Only one dimension can hold variables, found " + strings);
            }
            return new GridDataset(this, strings.isEmpty() ? null : strings.get(0));
        }
    }
}
