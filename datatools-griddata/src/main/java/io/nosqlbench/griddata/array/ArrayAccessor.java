package io.nosqlbench.griddata.array;

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

import io.nosqlbench.griddata.keys.AccessStrategy;
import io.nosqlbench.griddata.keys.Key;
import io.nosqlbench.griddata.keys.Keyring;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// Applies keyrings to [GridArray]s, for reading and for writing.
///
/// The keyring holds one key per array axis, in axis order. Lists of indices
/// are rewritten as slices first when they have a constant stride, so that the
/// cheaper direct strategy applies more often.
public final class ArrayAccessor {

    private ArrayAccessor() {
    }

    /// Select part of an array. Integer keys remove their axis.
    ///
    /// With the direct strategy and no list key the result is a view of the array;
    /// otherwise it is a copy.
    ///
    /// @param array the array
    /// @param keyring one key per axis
    /// @return the selection
    public static GridArray take(GridArray array, Keyring keyring) {
        checkKeys(array, keyring);
        Keyring simplified = keyring.simplify();
        List<Key> keys = simplified.keys();
        if (simplified.accessStrategy() == AccessStrategy.DIRECT) {
            return takeDirect(array, keys);
        }
        return takeCompound(array, keys);
    }

    /// Write a chunk into part of an array.
    ///
    /// The chunk shape must equal the shape the keyring selects.
    ///
    /// @param array the destination
    /// @param keyring one key per axis
    /// @param chunk the values to write
    public static void place(GridArray array, Keyring keyring, GridArray chunk) {
        checkKeys(array, keyring);
        Keyring simplified = keyring.simplify();
        List<Key> keys = simplified.keys();
        if (simplified.accessStrategy() == AccessStrategy.DIRECT) {
            placeDirect(array, keys, chunk);
        } else {
            placeCompound(array, keys, chunk);
        }
    }

    private static void checkKeys(GridArray array, Keyring keyring) {
        if (keyring.size() != array.rank()) {
            throw new IllegalArgumentException("Keyring " + keyring.print() + " does not match array of rank " + array.rank());
        }
        for (Key k : keyring.keys()) {
            if (k.isString()) {
                throw new IllegalArgumentException("Keyring " + keyring.print() + " must be turned into indices first");
            }
        }
    }

    /// Views for integer and slice keys, applied from the last axis so earlier
    /// axis numbers stay valid.
    private static GridArray viewOf(GridArray array, List<Key> keys) {
        GridArray view = array;
        for (int axis = keys.size() - 1; axis >= 0; axis--) {
            Key k = keys.get(axis);
            switch (k.kind()) {
                case INT -> view = view.index(axis, k.index());
                case SLICE -> view = view.slice(axis, k.slice());
                default -> {
                }
            }
        }
        return view;
    }

    /// Axis of a key in the view left once integer keys are removed.
    private static int viewAxis(List<Key> keys, int axis) {
        int n = 0;
        for (int i = 0; i < axis; i++) {
            if (keys.get(i).kind() != Key.Kind.INT) {
                n++;
            }
        }
        return n;
    }

    private static GridArray takeDirect(GridArray array, List<Key> keys) {
        GridArray view = viewOf(array, keys);
        for (int axis = 0; axis < keys.size(); axis++) {
            if (keys.get(axis).kind() == Key.Kind.LIST) {
                return view.take(viewAxis(keys, axis), keys.get(axis).indices());
            }
        }
        return view;
    }

    private static GridArray takeCompound(GridArray array, List<Key> keys) {
        GridArray out = array;
        for (int axis = keys.size() - 1; axis >= 0; axis--) {
            Key k = keys.get(axis);
            out = switch (k.kind()) {
                case INT -> out.index(axis, k.index());
                case SLICE -> out.slice(axis, k.slice());
                case LIST -> out.take(axis, k.indices());
                case NONE -> out;
            };
        }
        return out.copy();
    }

    private static void placeDirect(GridArray array, List<Key> keys, GridArray chunk) {
        GridArray view = viewOf(array, keys);
        int listAxis = -1;
        for (int axis = 0; axis < keys.size(); axis++) {
            if (keys.get(axis).kind() == Key.Kind.LIST) {
                listAxis = axis;
            }
        }
        if (listAxis < 0) {
            view.assign(chunk);
            return;
        }
        checkShape(view, keys, chunk);
        int[] indices = keys.get(listAxis).indices();
        int axis = viewAxis(keys, listAxis);
        int[] dst = new int[view.rank()];
        int[] src = new int[chunk.rank()];
        if (chunk.size() == 0) {
            return;
        }
        do {
            System.arraycopy(src, 0, dst, 0, src.length);
            dst[axis] = indices[src[axis]];
            view.set(chunk.get(src), dst);
        } while (GridArray.increment(src, chunk.shape()));
    }

    private static void placeCompound(GridArray array, List<Key> keys, GridArray chunk) {
        int listAxis = -1;
        for (int axis = 0; axis < keys.size(); axis++) {
            if (keys.get(axis).kind() == Key.Kind.LIST) {
                listAxis = axis;
                break;
            }
        }
        if (listAxis < 0) {
            viewOf(array, keys).assign(chunk);
            return;
        }
        int[] indices = keys.get(listAxis).indices();
        int chunkAxis = viewAxis(keys, listAxis);
        if (chunk.shape(chunkAxis) != indices.length) {
            throw new IllegalArgumentException("Chunk of shape " + Arrays.toString(chunk.shape())
                + " does not match list key of length " + indices.length);
        }
        for (int j = 0; j < indices.length; j++) {
            List<Key> fixed = new ArrayList<>(keys);
            fixed.set(listAxis, Key.of(indices[j]));
            placeCompound(array, fixed, chunk.index(chunkAxis, j));
        }
    }

    private static void checkShape(GridArray view, List<Key> keys, GridArray chunk) {
        int[] expected = view.shape();
        for (int axis = 0; axis < keys.size(); axis++) {
            if (keys.get(axis).kind() == Key.Kind.LIST) {
                expected[viewAxis(keys, axis)] = keys.get(axis).indices().length;
            }
        }
        if (!Arrays.equals(expected, chunk.shape())) {
            throw new IllegalArgumentException("Chunk of shape " + Arrays.toString(chunk.shape())
                + " does not fit selection of shape " + Arrays.toString(expected));
        }
    }
}
