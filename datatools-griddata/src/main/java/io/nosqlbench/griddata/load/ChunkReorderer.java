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

import io.nosqlbench.griddata.array.GridArray;

import java.util.ArrayList;
import java.util.List;

/// Puts the axes of a chunk read from a file in destination order.
public final class ChunkReorderer {

    private ChunkReorderer() {
    }

    /// Add length one axes for destination dimensions the chunk lacks, then
    /// transpose to the destination order.
    ///
    /// @param chunk the chunk as read
    /// @param chunkDims the dimension of each chunk axis
    /// @param destinationDims the destination dimensions, in order
    /// @return a view of the chunk with one axis per destination dimension
    /// @throws IllegalArgumentException if the chunk has an axis the destination lacks
    public static GridArray reorder(GridArray chunk, List<String> chunkDims, List<String> destinationDims) {
        if (chunk.rank() != chunkDims.size()) {
            throw new IllegalArgumentException("Chunk of rank " + chunk.rank() + " read for dimensions " + chunkDims);
        }
        List<String> axes = new ArrayList<>(chunkDims);
        GridArray out = chunk;
        for (String dim : destinationDims) {
            if (!axes.contains(dim)) {
                out = out.expandDims(0);
                axes.add(0, dim);
            }
        }
        if (axes.size() != destinationDims.size()) {
            throw new IllegalArgumentException("Chunk dimensions " + chunkDims + " are not all in " + destinationDims);
        }
        int[] perm = new int[destinationDims.size()];
        for (int i = 0; i < perm.length; i++) {
            perm[i] = axes.indexOf(destinationDims.get(i));
        }
        return out.transpose(perm);
    }
}
