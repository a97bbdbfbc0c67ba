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

import io.jhdf.HdfFile;
import io.jhdf.api.Attribute;
import io.jhdf.api.Dataset;
import io.jhdf.api.Node;
import io.jhdf.exceptions.HdfException;
import io.nosqlbench.griddata.array.ArrayAccessor;
import io.nosqlbench.griddata.array.GridArray;
import io.nosqlbench.griddata.format.FileAxis;
import io.nosqlbench.griddata.format.FileHandle;
import io.nosqlbench.griddata.format.FormatAdapter;
import io.nosqlbench.griddata.keys.Key;
import io.nosqlbench.griddata.keys.Keyring;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

/// Reads HDF5 files with jhdf.
///
/// Variables are datasets of the root group. The names of their axes are listed,
/// comma separated, in a [#DIMENSIONS_ATTRIBUTE] string attribute. Coordinate
/// values are one dimensional datasets named after their dimension, with units
/// in a [#UNITS_ATTRIBUTE] string attribute.
///
/// A read fetches the smallest block holding every requested index, then picks
/// the requested indices out of it.
public class Hdf5FormatAdapter implements FormatAdapter {
    private static final Logger logger = LogManager.getLogger(Hdf5FormatAdapter.class);

    /// Name of the format in layouts
    public static final String NAME = "hdf5";
    /// Attribute naming the axes of a variable
    public static final String DIMENSIONS_ATTRIBUTE = "dimensions";
    /// Attribute holding the units of a coordinate
    public static final String UNITS_ATTRIBUTE = "units";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public FileHandle open(Path path) throws IOException {
        try {
            return new Hdf5FileHandle(path, new HdfFile(path));
        } catch (HdfException e) {
            throw new IOException("Cannot open HDF5 file " + path, e);
        }
    }

    @Override
    public void close(FileHandle handle) throws IOException {
        try {
            hdf(handle).close();
        } catch (HdfException e) {
            throw new IOException("Cannot close HDF5 file " + handle.path(), e);
        }
    }

    @Override
    public Optional<List<FileAxis>> axisOrder(FileHandle handle, String variable) throws IOException {
        Dataset ds = dataset(handle, variable);
        Optional<List<String>> names;
        int[] dims;
        try {
            names = axisNames(ds);
            if (names.isEmpty()) {
                return Optional.empty();
            }
            dims = ds.getDimensions();
        } catch (HdfException e) {
            throw new IOException("Cannot read the axes of " + variable + " in " + handle.path(), e);
        }
        if (names.get().size() != dims.length) {
            throw new IOException("Variable " + variable + " of " + handle.path() + " has " + dims.length
                + " axes but names " + names.get());
        }
        List<FileAxis> axes = new ArrayList<>();
        for (int i = 0; i < dims.length; i++) {
            axes.add(new FileAxis(names.get().get(i), dims[i]));
        }
        return Optional.of(axes);
    }

    @Override
    public GridArray read(FileHandle handle, String variable, Keyring keyring) throws IOException {
        Dataset ds = dataset(handle, variable);
        int[] dims;
        try {
            dims = ds.getDimensions();
        } catch (HdfException e) {
            throw new IOException("Cannot read the shape of " + variable + " in " + handle.path(), e);
        }
        List<Key> keys = keyring.keys();
        if (keys.size() != dims.length) {
            throw new IOException("Variable " + variable + " of " + handle.path() + " has " + dims.length
                + " axes, cannot read it with " + keyring.print());
        }
        long[] offset = new long[dims.length];
        int[] count = new int[dims.length];
        LinkedHashMap<String, Key> relative = new LinkedHashMap<>();
        for (int axis = 0; axis < dims.length; axis++) {
            Key key = keys.get(axis).withParentSize(dims[axis]);
            int[] idx = key.isNone() ? new int[]{0} : key.intToList().asArray();
            for (int i = 0; i < idx.length; i++) {
                idx[i] = idx[i] < 0 ? idx[i] + dims[axis] : idx[i];
                if (idx[i] < 0 || idx[i] >= dims[axis]) {
                    throw new IOException("Index " + idx[i] + " out of axis " + axis + " of size " + dims[axis]
                        + " in " + variable + " of " + handle.path());
                }
            }
            int min = Arrays.stream(idx).min().orElse(0);
            int max = Arrays.stream(idx).max().orElse(0);
            offset[axis] = min;
            count[axis] = idx.length == 0 ? 0 : max - min + 1;
            int[] rel = Arrays.stream(idx).map(i -> i - min).toArray();
            String name = keyring.dims().get(axis);
            relative.put(name, key.kind() == Key.Kind.INT || key.isNone() ? Key.of(rel[0]) : Key.of(rel));
        }
        logger.trace("Reading {} of {} at {} count {}", variable, handle.path(), offset, count);
        GridArray block;
        try {
            block = GridArray.fromNested(ds.getData(offset, count));
        } catch (HdfException e) {
            throw new IOException("Cannot read " + variable + " of " + handle.path(), e);
        }
        if (block.rank() != count.length) {
            block = GridArray.of(block.toArray(), count);
        }
        return ArrayAccessor.take(block, Keyring.of(relative)).copy();
    }

    /// @param handle an open file
    /// @return names of the variables, in file order: root datasets with named axes
    /// @throws IOException if the file structure cannot be read
    public List<String> variables(FileHandle handle) throws IOException {
        List<String> out = new ArrayList<>();
        try {
            for (Node node : hdf(handle).getChildren().values()) {
                if (node instanceof Dataset ds && axisNames(ds).isPresent()) {
                    out.add(node.getName());
                }
            }
        } catch (HdfException e) {
            throw new IOException("Cannot list the variables of " + handle.path(), e);
        }
        return out;
    }

    /// @param handle an open file
    /// @param name a root dataset
    /// @return true if it exists
    /// @throws IOException if the file structure cannot be read
    public boolean hasDataset(FileHandle handle, String name) throws IOException {
        try {
            return hdf(handle).getChildren().get(name) instanceof Dataset;
        } catch (HdfException e) {
            throw new IOException("Cannot list the datasets of " + handle.path(), e);
        }
    }

    /// @param handle an open file
    /// @param name a one dimensional dataset
    /// @return its values
    /// @throws IOException if it does not exist or cannot be read
    public double[] values(FileHandle handle, String name) throws IOException {
        try {
            return GridArray.fromNested(dataset(handle, name).getData()).toArray();
        } catch (HdfException e) {
            throw new IOException("Cannot read " + name + " of " + handle.path(), e);
        }
    }

    /// @param handle an open file
    /// @param name a dataset
    /// @param attribute an attribute name
    /// @return the attribute as a string, if present
    /// @throws IOException if the dataset does not exist
    public Optional<String> attribute(FileHandle handle, String name, String attribute) throws IOException {
        Dataset ds = dataset(handle, name);
        try {
            return stringAttribute(ds, attribute);
        } catch (HdfException e) {
            throw new IOException("Cannot read attribute " + attribute + " of " + name + " in " + handle.path(), e);
        }
    }

    static Optional<List<String>> axisNames(Dataset ds) {
        return stringAttribute(ds, DIMENSIONS_ATTRIBUTE)
            .map(s -> Arrays.stream(s.split(",")).map(String::trim).filter(p -> !p.isEmpty()).toList());
    }

    private static Optional<String> stringAttribute(Dataset ds, String name) {
        Attribute attr = ds.getAttribute(name);
        if (attr == null) {
            return Optional.empty();
        }
        Object data = attr.getData();
        if (data instanceof String[] arr) {
            return Optional.of(String.join(",", arr));
        }
        return Optional.ofNullable(data).map(Object::toString);
    }

    private static Dataset dataset(FileHandle handle, String name) throws IOException {
        if (name == null) {
            throw new IOException("No variable name given to read " + handle.path());
        }
        try {
            return hdf(handle).getDatasetByPath(name);
        } catch (HdfException e) {
            throw new IOException("No dataset " + name + " in " + handle.path(), e);
        }
    }

    private static HdfFile hdf(FileHandle handle) {
        if (!(handle instanceof Hdf5FileHandle h)) {
            throw new IllegalArgumentException("Not an HDF5 handle: " + handle);
        }
        return h.hdf();
    }
}
