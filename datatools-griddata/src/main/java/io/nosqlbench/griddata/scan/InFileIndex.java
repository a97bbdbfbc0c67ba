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

/// Where a coordinate value sits inside its file.
///
/// A value is located either by position along the file axis, or by name for
/// string valued dimensions. [#NONE] marks a dimension that does not exist in the
/// file: its value is implied by the file itself.
///
/// @param position the position along the file axis, or null
/// @param name the in-file name, or null
public record InFileIndex(Integer position, String name) {

    /// The dimension is not present in the file
    public static final InFileIndex NONE = new InFileIndex(null, null);

    /// @param position a position along the file axis
    /// @return an index by position
    public static InFileIndex of(int position) {
        return new InFileIndex(position, null);
    }

    /// @param name an in-file name
    /// @return an index by name
    public static InFileIndex named(String name) {
        return new InFileIndex(null, name);
    }

    /// @return true when the dimension does not exist in the file
    public boolean isNone() {
        return position == null && name == null;
    }

    /// @return true when the index is an in-file name
    public boolean isNamed() {
        return name != null;
    }

    @Override
    public String toString() {
        if (isNone()) {
            return "None";
        }
        return isNamed() ? name : String.valueOf(position);
    }
}
