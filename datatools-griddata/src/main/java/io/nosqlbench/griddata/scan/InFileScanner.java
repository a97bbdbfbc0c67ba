package io.nosqlbench.griddata.scan;

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

import io.nosqlbench.griddata.format.FileHandle;

import java.io.IOException;
import java.util.List;

/// Finds coordinate values inside an open file.
@FunctionalInterface
public interface InFileScanner extends ScanFunction {

    /// @param scan the coordinate being scanned
    /// @param file the open file
    /// @param prior values found by earlier functions for this file, possibly empty
    /// @return what was found
    /// @throws IOException if the file cannot be read
    ScanResult scan(CoordScan scan, FileHandle file, List<Object> prior) throws IOException;
}
