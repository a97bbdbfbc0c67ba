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

import io.nosqlbench.griddata.array.GridArray;
import io.nosqlbench.griddata.keys.Keyring;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/// Reads one file format on behalf of the scanning and loading machinery.
///
/// Files are opened and closed through the adapter; callers guarantee that every
/// handle they open is closed, on every exit path.
public interface FormatAdapter {

    /// @return the name layouts use to select this format
    String name();

    /// @param path the file
    /// @return an open handle
    /// @throws IOException if the file cannot be opened
    FileHandle open(Path path) throws IOException;

    /// @param handle a handle opened by this adapter
    /// @throws IOException if closing fails
    void close(FileHandle handle) throws IOException;

    /// Read part of a variable.
    ///
    /// The keyring holds one key per axis of the variable, in file order, named
    /// after the file axes. Integer keys remove their axis from the chunk; list and
    /// slice keys select along it. When [#readsAllVariablesAtOnce()] is true,
    /// `variable` is null and the keyring starts with a string key for the
    /// variable dimension; the chunk then has the variable axis first.
    ///
    /// @param handle the open file
    /// @param variable name of the variable in the file
    /// @param keyring one key per file axis
    /// @return the selected values, axes in file order
    /// @throws IOException if reading fails
    GridArray read(FileHandle handle, String variable, Keyring keyring) throws IOException;

    /// The axes of a variable, in file order.
    ///
    /// @param handle the open file
    /// @param variable name of the variable in the file
    /// @return the axes, or empty if the format does not record them
    /// @throws IOException if the file cannot be inspected
    default Optional<List<FileAxis>> axisOrder(FileHandle handle, String variable) throws IOException {
        return Optional.empty();
    }

    /// @return true if one read can address several variables
    default boolean readsAllVariablesAtOnce() {
        return false;
    }
}
