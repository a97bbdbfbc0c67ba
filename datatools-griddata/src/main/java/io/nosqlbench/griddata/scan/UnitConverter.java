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

/// Converts scanned values into the units of their coordinate. Used in place of
/// the coordinate's own conversion when one is registered on a [CoordScan].
@FunctionalInterface
public interface UnitConverter {

    /// @param values values in the scanned units
    /// @param from the scanned units
    /// @param to the coordinate units
    /// @return converted values
    /// @throws UnsupportedOperationException if the conversion is not known
    double[] convert(double[] values, String from, String to);
}
