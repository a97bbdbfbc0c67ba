package io.nosqlbench.griddata.format;

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
import io.nosqlbench.griddata.keys.Keyring;
import io.nosqlbench.griddata.scan.InFileIndex;
import io.nosqlbench.griddata.scan.InFileScanner;
import io.nosqlbench.griddata.scan.ScanResult;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// A format whose file contents live in memory, keyed by file name. Files must
/// still exist on disk to be found by a filegroup.
public class MemoryFormatAdapter implements FormatAdapter {

    /// One variable of a file
    ///
    /// @param axes the axes, in file order
    /// @param data the values
    public record Variable(List<FileAxis> axes, GridArray data) {
    }

    /// The content of one file
    public static class Content {
        private final Map<String, Variable> variables = new LinkedHashMap<>();
        private final Map<String, double[]> coordinates = new LinkedHashMap<>();
        private RuntimeException failure;

        /// @param name variable name
        /// @param data values, one axis per name
        /// @param axes axis names
        /// @return this
        public Content variable(String name, GridArray data, String... axes) {
            List<FileAxis> list = new ArrayList<>();
            for (int i = 0; i < axes.length; i++) {
                list.add(new FileAxis(axes[i], data.shape(i)));
            }
            variables.put(name, new Variable(list, data));
            return this;
        }

        /// @param name coordinate name
        /// @param values its values
        /// @return this
        public Content coordinate(String name, double... values) {
            coordinates.put(name, values);
            return this;
        }

        /// Make every variable access of this file throw, as a broken format library would.
        ///
        /// @param error the unchecked error to throw
        /// @return this
        public Content fail(RuntimeException error) {
            this.failure = error;
            return this;
        }
    }

    /// @param path the open file
    /// @param content its content
    public record Handle(Path path, Content content) implements FileHandle {
    }

    private final Map<String, Content> files = new LinkedHashMap<>();
    private int opened;
    private int closed;
    private final List<String> reads = new ArrayList<>();

    /// @param file file name
    /// @return the new content of this file
    public Content file(String file) {
        Content c = new Content();
        files.put(file, c);
        return c;
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public FileHandle open(Path path) throws IOException {
        Content c = files.get(path.getFileName().toString());
        if (c == null) {
            throw new IOException("unreadable " + path.getFileName());
        }
        opened++;
        return new Handle(path, c);
    }

    @Override
    public void close(FileHandle handle) {
        closed++;
    }

    @Override
    public Optional<List<FileAxis>> axisOrder(FileHandle handle, String variable) throws IOException {
        return Optional.of(variable(handle, variable).axes());
    }

    @Override
    public GridArray read(FileHandle handle, String variable, Keyring keyring) throws IOException {
        reads.add(handle.path().getFileName() + ":" + variable + keyring.print());
        return ArrayAccessor.take(variable(handle, variable).data(), keyring).copy();
    }

    private static Variable variable(FileHandle handle, String variable) throws IOException {
        Content c = ((Handle) handle).content();
        if (c.failure != null) {
            throw c.failure;
        }
        if (variable == null && c.variables.size() == 1) {
            return c.variables.values().iterator().next();
        }
        Variable v = c.variables.get(variable);
        if (v == null) {
            throw new IOException("no variable " + variable + " in " + handle.path());
        }
        return v;
    }

    /// @return number of files opened
    public int opened() {
        return opened;
    }

    /// @return number of files closed
    public int closed() {
        return closed;
    }

    /// @return every read, as `file:variable[keys]`
    public List<String> reads() {
        return reads;
    }

    /// @return a scanner reading the coordinate named after the scanned dimension
    public static InFileScanner coordinateValues() {
        return (scan, file, prior) -> {
            double[] values = ((Handle) file).content().coordinates.get(scan.name());
            if (values == null) {
                throw new IOException("no coordinate " + scan.name() + " in " + file.path());
            }
            return ScanResult.values(Arrays.stream(values).boxed().toList());
        };
    }

    /// @return a scanner listing the variables of a file under their own names
    public static InFileScanner variableNames() {
        return (scan, file, prior) -> {
            List<String> names = new ArrayList<>(((Handle) file).content().variables.keySet());
            return ScanResult.of(names, names.stream().map(InFileIndex::named).toList());
        };
    }
}
