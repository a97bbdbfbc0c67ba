package io.nosqlbench.griddata.load;

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
import io.nosqlbench.griddata.errors.LoadException;
import io.nosqlbench.griddata.events.EventSink;
import io.nosqlbench.griddata.events.GridEvent;
import io.nosqlbench.griddata.format.FileAxis;
import io.nosqlbench.griddata.format.FileHandle;
import io.nosqlbench.griddata.format.FormatAdapter;
import io.nosqlbench.griddata.keys.Key;
import io.nosqlbench.griddata.keys.Keyring;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Runs [LoadCommand]s against their files and places each chunk in the
/// destination array.
///
/// Each file is opened once for all its reads and always closed. A file that
/// fails, with an I/O error or an unchecked error of its format library, is
/// recorded in the [LoadReport] and the load goes on with the next one.
/// File axes are matched to dimensions by name or alternate name; axes of no
/// requested dimension are read at their first index.
public class LoadExecutor {
    private static final Logger logger = LogManager.getLogger(LoadExecutor.class);

    private final Map<String, Coordinate> coordinates;
    private final String variableDim;
    private final EventSink sink;

    /// @param coordinates the dataset coordinates, in destination order
    /// @param variableDim the variable dimension, or null
    /// @param sink where events are sent
    public LoadExecutor(Map<String, Coordinate> coordinates, String variableDim, EventSink sink) {
        this.coordinates = coordinates;
        this.variableDim = variableDim;
        this.sink = sink;
    }

    /// @param format the format of the files
    /// @param commands the commands of one filegroup
    /// @param destination the destination array, one axis per dataset dimension
    /// @param report where reads and failures are recorded
    public void execute(FormatAdapter format, List<LoadCommand> commands, GridArray destination, LoadReport report) {
        for (LoadCommand command : commands) {
            sink.log(GridEvent.LOAD_FILE, "filegroup", command.filegroup(), "file", command.file(),
                "commands", command.keys().size());
            FileHandle handle;
            try {
                handle = format.open(command.path());
                report.opened();
            } catch (IOException | RuntimeException e) {
                fail(command, command.keys(), e, report);
                continue;
            }
            try {
                for (CommandKey key : command.keys()) {
                    try {
                        read(format, handle, command, key, destination);
                        report.succeeded(key.memory());
                    } catch (IOException | RuntimeException e) {
                        fail(command, List.of(key), e, report);
                    }
                }
            } finally {
                try {
                    format.close(handle);
                } catch (IOException e) {
                    logger.warn("Cannot close " + command.path(), e);
                    sink.log(GridEvent.LOAD_FILE_FAILED, "file", command.path().toString(),
                        "text", "close failed: " + e.getMessage());
                }
            }
        }
    }

    private void fail(LoadCommand command, List<CommandKey> keys, Exception e, LoadReport report) {
        logger.debug("Read of " + command.path() + " failed", e);
        sink.log(GridEvent.LOAD_FILE_FAILED, "file", command.path().toString(), "text", String.valueOf(e.getMessage()));
        keys.forEach(k -> report.failed(command.path(), k.memory(), e));
    }

    private void read(FormatAdapter format, FileHandle handle, LoadCommand command, CommandKey key,
                      GridArray destination) throws IOException {
        Keyring inFile = key.inFile();
        boolean allAtOnce = false;
        String variable = null;
        if (variableDim != null && inFile.contains(variableDim)) {
            Key v = inFile.get(variableDim);
            if (v.isString() && v.kind() == Key.Kind.INT) {
                variable = v.names().get(0);
            } else {
                allAtOnce = true;
            }
            inFile = inFile.without(variableDim);
        }

        LinkedHashMap<String, Key> adapterKeys = new LinkedHashMap<>();
        List<String> chunkDims = new ArrayList<>();
        if (allAtOnce) {
            adapterKeys.put(variableDim, key.inFile().get(variableDim));
            chunkDims.add(variableDim);
        }
        Optional<List<FileAxis>> axes = allAtOnce ? Optional.empty() : format.axisOrder(handle, variable);
        if (axes.isPresent()) {
            Set<String> used = new HashSet<>();
            for (FileAxis axis : axes.get()) {
                String dim = dimOf(axis.name(), inFile);
                if (dim != null && !inFile.get(dim).isNone()) {
                    adapterKeys.put(axis.name(), inFile.get(dim));
                    chunkDims.add(dim);
                    used.add(dim);
                } else {
                    adapterKeys.put(axis.name(), Key.of(0));
                    if (axis.size() > 1) {
                        sink.log(GridEvent.EXTRA_AXIS, "file", command.file(), "axis", axis.name(), "size",
                            axis.size());
                    }
                }
            }
            for (String dim : inFile.dims()) {
                if (!inFile.get(dim).isNone() && !used.contains(dim)) {
                    throw new LoadException("Dimension '" + dim + "' not found in " + command.file()
                        + " for variable " + variable);
                }
            }
        } else {
            for (String dim : inFile.dims()) {
                if (!inFile.get(dim).isNone()) {
                    adapterKeys.put(dim, inFile.get(dim));
                    chunkDims.add(dim);
                }
            }
        }

        GridArray chunk = format.read(handle, variable, Keyring.of(adapterKeys));
        GridArray ordered = ChunkReorderer.reorder(chunk, chunkDims, key.memory().dims());
        ArrayAccessor.place(destination, key.memory(), ordered);
        logger.trace("Placed {} from {} at {}", key.inFile().print(), command.file(), key.memory().print());
    }

    private String dimOf(String axis, Keyring inFile) {
        for (String dim : inFile.dims()) {
            Coordinate c = coordinates.get(dim);
            if (dim.equals(axis) || (c != null && c.alternateNames().contains(axis))) {
                return dim;
            }
        }
        return null;
    }
}
