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

import io.nosqlbench.griddata.keys.Slice;

import java.lang.reflect.Array;
import java.util.Arrays;

/// A dense n-dimensional array of doubles.
///
/// Values live in a flat buffer and are addressed through an offset plus one
/// stride per axis, both counted in elements. Views produced by [#transpose],
/// [#expandDims], [#slice] and [#index] share the buffer of their source, so
/// writing into a view writes into the source.
public final class GridArray {
    private final double[] data;
    private final int[] shape;
    private final int[] strides;
    private final int offset;

    private GridArray(double[] data, int[] shape, int[] strides, int offset) {
        this.data = data;
        this.shape = shape;
        this.strides = strides;
        this.offset = offset;
    }

    /// @param shape the shape
    /// @return a new array of zeros
    public static GridArray zeros(int... shape) {
        return new GridArray(new double[count(shape)], shape.clone(), contiguousStrides(shape), 0);
    }

    /// @param value fill value
    /// @param shape the shape
    /// @return a new array where every element is `value`
    public static GridArray filled(double value, int... shape) {
        GridArray out = zeros(shape);
        Arrays.fill(out.data, value);
        return out;
    }

    /// Wrap row-major values.
    ///
    /// @param values values in row-major order, not copied
    /// @param shape the shape
    /// @return the array
    public static GridArray of(double[] values, int... shape) {
        if (values.length != count(shape)) {
            throw new IllegalArgumentException("Cannot give shape " + Arrays.toString(shape) + " to "
                + values.length + " values");
        }
        return new GridArray(values, shape.clone(), contiguousStrides(shape), 0);
    }

    /// Copy a nested Java array such as `float[][]` or `double[][][]`.
    ///
    /// @param nested a rectangular array of any primitive numeric type, or a boxed number
    /// @return the array
    public static GridArray fromNested(Object nested) {
        if (nested instanceof Number n) {
            return of(new double[]{n.doubleValue()});
        }
        int rank = 0;
        Class<?> c = nested.getClass();
        while (c.isArray()) {
            rank++;
            c = c.getComponentType();
        }
        int[] shape = new int[rank];
        Object level = nested;
        for (int i = 0; i < rank; i++) {
            shape[i] = Array.getLength(level);
            if (shape[i] == 0) {
                break;
            }
            level = Array.get(level, 0);
        }
        double[] values = new double[count(shape)];
        flatten(nested, values, new int[]{0});
        return of(values, shape);
    }

    private static void flatten(Object nested, double[] out, int[] cursor) {
        if (nested instanceof double[] d) {
            System.arraycopy(d, 0, out, cursor[0], d.length);
            cursor[0] += d.length;
        } else if (nested.getClass().isArray() && nested.getClass().getComponentType().isPrimitive()) {
            int n = Array.getLength(nested);
            for (int i = 0; i < n; i++) {
                out[cursor[0]++] = ((Number) Array.get(nested, i)).doubleValue();
            }
        } else {
            int n = Array.getLength(nested);
            for (int i = 0; i < n; i++) {
                flatten(Array.get(nested, i), out, cursor);
            }
        }
    }

    private static int count(int[] shape) {
        int n = 1;
        for (int s : shape) {
            if (s < 0) {
                throw new IllegalArgumentException("negative dimension in shape " + Arrays.toString(shape));
            }
            n *= s;
        }
        return n;
    }

    private static int[] contiguousStrides(int[] shape) {
        int[] strides = new int[shape.length];
        int s = 1;
        for (int i = shape.length - 1; i >= 0; i--) {
            strides[i] = s;
            s *= shape[i];
        }
        return strides;
    }

    /// @return number of axes
    public int rank() {
        return shape.length;
    }

    /// @return a copy of the shape
    public int[] shape() {
        return shape.clone();
    }

    /// @param axis an axis
    /// @return its size
    public int shape(int axis) {
        return shape[axis];
    }

    /// @return number of elements
    public int size() {
        return count(shape);
    }

    private int position(int[] index) {
        if (index.length != shape.length) {
            throw new IllegalArgumentException("Expected " + shape.length + " indices, got " + index.length);
        }
        int p = offset;
        for (int i = 0; i < index.length; i++) {
            int idx = index[i] < 0 ? index[i] + shape[i] : index[i];
            if (idx < 0 || idx >= shape[i]) {
                throw new IndexOutOfBoundsException("Index " + index[i] + " out of bounds for axis " + i
                    + " with size " + shape[i]);
            }
            p += idx * strides[i];
        }
        return p;
    }

    /// @param index one index per axis
    /// @return the element
    public double get(int... index) {
        return data[position(index)];
    }

    /// @param value the new value
    /// @param index one index per axis
    public void set(double value, int... index) {
        data[position(index)] = value;
    }

    /// @return a contiguous copy
    public GridArray copy() {
        return of(toArray(), shape);
    }

    /// @return the values in row-major order
    public double[] toArray() {
        double[] out = new double[size()];
        int[] index = new int[shape.length];
        for (int n = 0; n < out.length; n++) {
            out[n] = data[position(index)];
            increment(index, shape);
        }
        return out;
    }

    static boolean increment(int[] index, int[] shape) {
        for (int i = index.length - 1; i >= 0; i--) {
            if (++index[i] < shape[i]) {
                return true;
            }
            index[i] = 0;
        }
        return false;
    }

    /// Permute the axes.
    ///
    /// @param perm for each new axis, the old axis it comes from
    /// @return a view
    public GridArray transpose(int... perm) {
        if (perm.length != shape.length) {
            throw new IllegalArgumentException("Permutation " + Arrays.toString(perm) + " does not match rank " + shape.length);
        }
        int[] newShape = new int[perm.length];
        int[] newStrides = new int[perm.length];
        boolean[] seen = new boolean[perm.length];
        for (int i = 0; i < perm.length; i++) {
            if (seen[perm[i]]) {
                throw new IllegalArgumentException("Axis " + perm[i] + " repeated in " + Arrays.toString(perm));
            }
            seen[perm[i]] = true;
            newShape[i] = shape[perm[i]];
            newStrides[i] = strides[perm[i]];
        }
        return new GridArray(data, newShape, newStrides, offset);
    }

    /// Insert an axis of size one.
    ///
    /// @param axis position of the new axis
    /// @return a view
    public GridArray expandDims(int axis) {
        int[] newShape = new int[shape.length + 1];
        int[] newStrides = new int[shape.length + 1];
        for (int i = 0, j = 0; i < newShape.length; i++) {
            if (i == axis) {
                newShape[i] = 1;
                newStrides[i] = 0;
            } else {
                newShape[i] = shape[j];
                newStrides[i] = strides[j];
                j++;
            }
        }
        return new GridArray(data, newShape, newStrides, offset);
    }

    /// Select a slice along one axis.
    ///
    /// @param axis the axis
    /// @param slice the slice
    /// @return a view
    public GridArray slice(int axis, Slice slice) {
        int[] idx = slice.indices(shape[axis]);
        int length = slice.length(shape[axis]);
        int[] newShape = shape.clone();
        int[] newStrides = strides.clone();
        newShape[axis] = length;
        newStrides[axis] = strides[axis] * idx[2];
        int newOffset = length == 0 ? offset : offset + idx[0] * strides[axis];
        return new GridArray(data, newShape, newStrides, newOffset);
    }

    /// Select one index along one axis, removing the axis.
    ///
    /// @param axis the axis
    /// @param index the index, negative counting from the end
    /// @return a view
    public GridArray index(int axis, int index) {
        int idx = index < 0 ? index + shape[axis] : index;
        if (idx < 0 || idx >= shape[axis]) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for axis " + axis
                + " with size " + shape[axis]);
        }
        int[] newShape = new int[shape.length - 1];
        int[] newStrides = new int[shape.length - 1];
        for (int i = 0, j = 0; i < shape.length; i++) {
            if (i != axis) {
                newShape[j] = shape[i];
                newStrides[j] = strides[i];
                j++;
            }
        }
        return new GridArray(data, newShape, newStrides, offset + idx * strides[axis]);
    }

    /// Gather a list of indices along one axis.
    ///
    /// @param axis the axis
    /// @param indices indices, possibly repeated or unordered
    /// @return a new array
    public GridArray take(int axis, int[] indices) {
        int[] newShape = shape.clone();
        newShape[axis] = indices.length;
        GridArray out = zeros(newShape);
        for (int j = 0; j < indices.length; j++) {
            out.index(axis, j).assign(index(axis, indices[j]));
        }
        return out;
    }

    /// Copy values of another array of the same shape into this one.
    ///
    /// @param source the values to copy
    public void assign(GridArray source) {
        if (!Arrays.equals(shape, source.shape)) {
            throw new IllegalArgumentException("Cannot assign array of shape " + Arrays.toString(source.shape)
                + " into array of shape " + Arrays.toString(shape));
        }
        if (size() == 0) {
            return;
        }
        int[] index = new int[shape.length];
        do {
            data[position(index)] = source.data[source.position(index)];
        } while (increment(index, shape));
    }

    /// @param value the value to write in every element
    public void fill(double value) {
        if (size() == 0) {
            return;
        }
        int[] index = new int[shape.length];
        do {
            data[position(index)] = value;
        } while (increment(index, shape));
    }

    @Override
    public String toString() {
        double[] values = toArray();
        String shown = values.length <= 10 ? Arrays.toString(values)
            : Arrays.toString(Arrays.copyOf(values, 10)).replace("]", ", ...]");
        return "GridArray" + Arrays.toString(shape) + shown;
    }
}
