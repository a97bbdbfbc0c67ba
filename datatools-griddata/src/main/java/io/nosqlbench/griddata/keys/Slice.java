package io.nosqlbench.griddata.keys;

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

import java.util.Arrays;
import java.util.Optional;

/// A start/stop/step selection along one axis.
///
/// `start` and `stop` may be null, meaning "from the beginning" and "to the end"
/// in the direction of `step`. Negative bounds count from the end of the axis.
/// The stop bound is exclusive.
///
/// @param start first index, or null
/// @param stop exclusive end index, or null
/// @param step stride, never zero
public record Slice(Integer start, Integer stop, int step) {

    /// Rejects a zero step
    public Slice {
        if (step == 0) {
            throw new IllegalArgumentException("slice step cannot be zero");
        }
    }

    /// @return a slice selecting every element
    public static Slice all() {
        return new Slice(null, null, 1);
    }

    /// @param start first index, or null
    /// @param stop exclusive end index, or null
    /// @return a slice with a step of one
    public static Slice of(Integer start, Integer stop) {
        return new Slice(start, stop, 1);
    }

    /// @return true if this slice selects every element in natural order
    public boolean isTotal() {
        return (start == null || start == 0) && stop == null && step == 1;
    }

    /// Resolve the bounds against an axis of the given size.
    ///
    /// @param size size of the axis
    /// @return `{start, stop, step}` with bounds clamped inside the axis
    public int[] indices(int size) {
        int lower = step < 0 ? -1 : 0;
        int upper = step < 0 ? size - 1 : size;
        int first = bound(start, size, lower, upper, step < 0 ? upper : lower);
        int last = bound(stop, size, lower, upper, step < 0 ? lower : upper);
        return new int[]{first, last, step};
    }

    private static int bound(Integer value, int size, int lower, int upper, int dflt) {
        if (value == null) {
            return dflt;
        }
        int v = value;
        if (v < 0) {
            v += size;
            return Math.max(v, lower);
        }
        return Math.min(v, upper);
    }

    /// @param size size of the axis
    /// @return number of elements selected on an axis of that size
    public int length(int size) {
        int[] idx = indices(size);
        return rangeLength(idx[0], idx[1], idx[2]);
    }

    /// @param size size of the axis
    /// @return the selected indices, in selection order
    public int[] toIndices(int size) {
        int[] idx = indices(size);
        return range(idx[0], idx[1], idx[2]);
    }

    /// Estimate the number of selected elements without knowing the axis size.
    ///
    /// Possible when both bounds are given with the same sign, or when the only
    /// bound given lets the selection run towards index zero.
    ///
    /// @return the number of elements, or null when it cannot be guessed
    public Integer guessLength() {
        int[] r = guessRange();
        return r == null ? null : rangeLength(r[0], r[1], r[2]);
    }

    /// @return the selected indices, guessed without knowing the axis size
    /// @throws IllegalStateException if they cannot be guessed
    public int[] guessIndices() {
        int[] r = guessRange();
        if (r == null) {
            throw new IllegalStateException("Slice " + print() + " cannot be turned into a list by guessing");
        }
        return range(r[0], r[1], r[2]);
    }

    private int[] guessRange() {
        if (start != null && stop != null) {
            if ((start >= 0) == (stop >= 0) || (stop == 0 && step > 0)) {
                return new int[]{start, stop, step};
            }
            return null;
        }
        if (step > 0) {
            if (start == null && stop != null && stop >= 0) {
                return new int[]{0, stop, step};
            }
            if (stop == null && start != null && start < 0) {
                return new int[]{start, 0, step};
            }
        } else {
            if (stop == null && start != null && start >= 0) {
                return new int[]{start, -1, step};
            }
            if (start == null && stop != null && stop < 0) {
                return new int[]{-1, stop, step};
            }
        }
        return null;
    }

    /// The same indices taken in reverse order.
    ///
    /// @param size size of the axis, or null to guess the indices
    /// @return the reversed slice
    public Slice reverseOrder(Integer size) {
        int[] idx = size != null ? toIndices(size) : guessIndices();
        if (idx.length == 0) {
            return this;
        }
        if (idx.length == 1) {
            int i = idx[0];
            return new Slice(i, i == -1 ? null : i + 1, 1);
        }
        int[] rev = new int[idx.length];
        for (int i = 0; i < idx.length; i++) {
            rev[i] = idx[idx.length - 1 - i];
        }
        return fromList(rev).orElseThrow();
    }

    /// Rewrite a list of indices as a slice.
    ///
    /// The list must hold at least two indices, all of the same sign, separated by
    /// a constant non zero stride. The stop is one past the last index, so that
    /// `[0, 2, 4]` gives `0:5:2`.
    ///
    /// @param list the indices
    /// @return the equivalent slice, or empty
    public static Optional<Slice> fromList(int[] list) {
        if (list.length < 2) {
            return Optional.empty();
        }
        boolean anyNeg = Arrays.stream(list).anyMatch(i -> i < 0);
        boolean anyPos = Arrays.stream(list).anyMatch(i -> i >= 0);
        if (anyNeg && anyPos) {
            return Optional.empty();
        }
        int step = list[1] - list[0];
        if (step == 0) {
            return Optional.empty();
        }
        for (int i = 2; i < list.length; i++) {
            if (list[i] - list[i - 1] != step) {
                return Optional.empty();
            }
        }
        int shift = step > 0 ? 1 : -1;
        Integer stop = list[list.length - 1] + shift;
        if ((step > 0 && stop == 0) || (step < 0 && stop == -1)) {
            stop = null;
        }
        return Optional.of(new Slice(list[0], stop, step));
    }

    /// @return compact `start:stop:step` rendering, omitting defaults
    public String print() {
        String s = (start == null ? "" : start.toString()) + ":" + (stop == null ? "" : stop.toString());
        return step == 1 ? s : s + ":" + step;
    }

    @Override
    public String toString() {
        return print();
    }

    static int rangeLength(int first, int last, int step) {
        if (step > 0) {
            return first < last ? (last - first - 1) / step + 1 : 0;
        }
        return first > last ? (first - last - 1) / (-step) + 1 : 0;
    }

    static int[] range(int first, int last, int step) {
        int[] out = new int[rangeLength(first, last, step)];
        for (int i = 0; i < out.length; i++) {
            out[i] = first + i * step;
        }
        return out;
    }
}
