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
import io.nosqlbench.griddata.format.FileHandle;

import java.nio.file.Path;

/// An open HDF5 file.
///
/// @param path the file
/// @param hdf the jhdf file
public record Hdf5FileHandle(Path path, HdfFile hdf) implements FileHandle {
}
