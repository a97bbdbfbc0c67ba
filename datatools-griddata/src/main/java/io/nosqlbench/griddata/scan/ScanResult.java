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

import java.util.List;
import java.util.Map;

/// What one scanning function found in one file. Any part may be null, meaning
/// the function does not supply it.
///
/// @param values the coordinate values found
/// @param inIndices where each value sits inside the file
/// @param units the units the values are expressed in
/// @param dimensions for variables, the in-file dimensions of each variable
public record ScanResult(List<Object> values, List<InFileIndex> inIndices, String units,
                         Map<String, List<String>> dimensions) {

    /// @param values values found
    /// @return a result carrying only values
    public static ScanResult values(List<?> values) {
        return new ScanResult(List.copyOf(values), null, null, null);
    }

    /// @param values values found
    /// @param inIndices their in-file indices
    /// @return a result with values and in-file indices
    public static ScanResult of(List<?> values, List<InFileIndex> inIndices) {
        return new ScanResult(List.copyOf(values), List.copyOf(inIndices), null, null);
    }

    /// @param units units found
    /// @return a result carrying only units
    public static ScanResult units(String units) {
        return new ScanResult(null, null, units, null);
    }

    /// @return a result supplying nothing
    public static ScanResult none() {
        return new ScanResult(null, null, null, null);
    }

    /// @param dimensions in-file dimensions per variable
    /// @return a copy with variable dimensions attached
    public ScanResult withDimensions(Map<String, List<String>> dimensions) {
        return new ScanResult(values, inIndices, units, Map.copyOf(dimensions));
    }
}
