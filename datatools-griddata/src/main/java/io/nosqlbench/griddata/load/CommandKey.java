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

import io.nosqlbench.griddata.keys.Keyring;

import java.util.List;

/// One read from a file, and where its result goes.
///
/// @param inFile what to take from the file, per dimension
/// @param memory where to place it in the destination, per dimension
public record CommandKey(Keyring inFile, Keyring memory) {

    /// @return a copy where index lists with a constant stride are slices,
    /// in-file and destination sides simplified separately
    public CommandKey simplify() {
        return new CommandKey(inFile.simplify(), memory.simplify());
    }

    /// @param order dimension order
    /// @return a copy with both keyrings in this order
    public CommandKey sortBy(List<String> order) {
        return new CommandKey(inFile.sortBy(order), memory.sortBy(order));
    }

    @Override
    public String toString() {
        return "in-file " + inFile.print() + " -> memory " + memory.print();
    }
}
