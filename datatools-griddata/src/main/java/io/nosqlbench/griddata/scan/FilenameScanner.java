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

import io.nosqlbench.griddata.pregex.FileMatch;

import java.util.List;

/// Finds coordinate values in the captures of a file name.
@FunctionalInterface
public interface FilenameScanner extends ScanFunction {

    /// @param scan the coordinate being scanned
    /// @param match the captures of the file name
    /// @param prior values found by earlier functions for this file, possibly empty
    /// @return what was found
    ScanResult scan(CoordScan scan, FileMatch match, List<Object> prior);
}
