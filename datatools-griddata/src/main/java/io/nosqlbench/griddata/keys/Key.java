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

import io.nosqlbench.griddata.coords.VariableCoordinate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Collectors;

/// The selection requested along one dimension.
///
/// A key is one of
/// - [Kind#NONE]: nothing requested, or no index inside a file
/// - [Kind#INT]: a single index, which squeezes the dimension away
/// - [Kind#LIST]: a list of indices
/// - [Kind#SLICE]: a [Slice]
///
/// The variable dimension also accepts string keys: a name, a list of names, or an
/// inclusive range of names. String keys are turned into indices with
/// [#toIndices(VariableCoordinate)].
///
/// Keys are immutable. A key may know the size of the axis it applies to
/// (its parent size), which makes slice shapes exact instead of guessed.
public final class Key {
    private static final Logger logger = LogManager.getLogger(Key.class);

    /// The kind of selection held by a key
    public enum Kind {
        /// No selection
        NONE,
        /// A single index or name
        INT,
        /// A list of indices or names
        LIST,
        /// A slice of indices, or an inclusive range of names
        SLICE
    }

    private static final Key NONE_KEY = new Key(Kind.NONE, 0, null, null, null, null, null);

    private final Kind kind;
    private final int index;
    private final int[] indices;
    private final Slice slice;
    private final List<String> names;
    private final String[] nameRange;
    private final Integer parentSize;

    private Key(Kind kind, int index, int[] indices, Slice slice, List<String> names,
                String[] nameRange, Integer parentSize) {
        this.kind = kind;
        this.index = index;
        this.indices = indices;
        this.slice = slice;
        this.names = names;
        this.nameRange = nameRange;
        this.parentSize = parentSize;
    }

    /// @return the empty key
    public static Key none() {
        return NONE_KEY;
    }

    /// @return a key selecting a whole dimension
    public static Key all() {
        return of(Slice.all());
    }

    /// @param index a single index
    /// @return an integer key
    public static Key of(int index) {
        return new Key(Kind.INT, index, null, null, null, null, null);
    }

    /// @param indices a list of indices
    /// @return a list key
    public static Key of(int... indices) {
        return new Key(Kind.LIST, 0, indices.clone(), null, null, null, null);
    }

    /// @param indices a list of indices
    /// @return a list key
    public static Key ofList(List<Integer> indices) {
        return new Key(Kind.LIST, 0, indices.stream().mapToInt(Integer::intValue).toArray(),
            null, null, null, null);
    }

    /// @param slice a slice
    /// @return a slice key
    public static Key of(Slice slice) {
        return new Key(Kind.SLICE, 0, null, Objects.requireNonNull(slice), null, null, null);
    }

    /// @param start first index, or null
    /// @param stop exclusive end, or null
    /// @param step stride
    /// @return a slice key
    public static Key slice(Integer start, Integer stop, int step) {
        return of(new Slice(start, stop, step));
    }

    /// @param name a variable name
    /// @return a string key selecting a single name
    public static Key name(String name) {
        return new Key(Kind.INT, 0, null, null, List.of(name), null, null);
    }

    /// @param names variable names
    /// @return a string key selecting a list of names
    public static Key names(List<String> names) {
        return new Key(Kind.LIST, 0, null, null, List.copyOf(names), null, null);
    }

    /// @param first first name, or null for the first available name
    /// @param last last name included, or null for the last available name
    /// @return a string key selecting every name between two names
    public static Key nameRange(String first, String last) {
        return new Key(Kind.SLICE, 0, null, null, null, new String[]{first, last}, null);
    }

    /// @return the kind of selection
    public Kind kind() {
        return kind;
    }

    /// @return true if this key holds names instead of indices
    public boolean isString() {
        return names != null || nameRange != null;
    }

    /// @return true for the empty key
    public boolean isNone() {
        return kind == Kind.NONE;
    }

    /// @return the index of an integer key
    public int index() {
        requireIndex(Kind.INT);
        return index;
    }

    /// @return a copy of the indices of a list key
    public int[] indices() {
        requireIndex(Kind.LIST);
        return indices.clone();
    }

    /// @return the slice of a slice key
    public Slice slice() {
        requireIndex(Kind.SLICE);
        return slice;
    }

    /// @return the names of a string integer or list key
    public List<String> names() {
        if (names == null) {
            throw new IllegalStateException("Key " + this + " does not hold a list of names");
        }
        return names;
    }

    /// @return the size of the axis this key applies to, or null if unknown
    public Integer parentSize() {
        return parentSize;
    }

    private void requireIndex(Kind expected) {
        if (kind != expected || isString()) {
            throw new IllegalStateException("Key " + this + " is not an integer " + expected.name().toLowerCase() + " key");
        }
    }

    /// @param size the size of the axis this key applies to
    /// @return a copy of this key knowing its parent size
    public Key withParentSize(Integer size) {
        return new Key(kind, index, indices, slice, names, nameRange, size);
    }

    /// Resolve negative integer and list indices against the axis size, counting
    /// from the end as slices do.
    ///
    /// @param size the size of the axis this key applies to
    /// @return a copy of this key with non-negative indices, knowing its parent size
    /// @throws IndexOutOfBoundsException if an index falls outside the axis
    public Key resolve(int size) {
        if (isString() || (kind != Kind.INT && kind != Kind.LIST)) {
            return withParentSize(size);
        }
        if (kind == Kind.INT) {
            return new Key(kind, resolveIndex(index, size), null, null, null, null, size);
        }
        int[] resolved = new int[indices.length];
        for (int i = 0; i < indices.length; i++) {
            resolved[i] = resolveIndex(indices[i], size);
        }
        return new Key(kind, 0, resolved, null, null, null, size);
    }

    private static int resolveIndex(int i, int size) {
        int r = normalize(i, size);
        if (r < 0 || r >= size) {
            throw new IndexOutOfBoundsException("Index " + i + " out of range for size " + size);
        }
        return r;
    }

    /// Number of elements this key selects.
    ///
    /// Zero for integer and empty keys, which produce a scalar. For a slice of
    /// unknown parent size the shape is guessed, and null when it cannot be.
    ///
    /// @return the shape, possibly null
    public Integer shape() {
        switch (kind) {
            case NONE:
            case INT:
                return 0;
            case LIST:
                return isString() ? names.size() : indices.length;
            default:
                if (isString()) {
                    return null;
                }
                if (parentSize != null) {
                    return slice.length(parentSize);
                }
                Integer guess = slice.guessLength();
                logger.debug("Guessed size {} for slice {} without parent size", guess, slice.print());
                return guess;
        }
    }

    /// The selected indices as a list.
    ///
    /// Slices use their parent size when known, or a guess otherwise.
    ///
    /// @return the selected indices
    public List<Integer> asList() {
        return Arrays.stream(asArray()).boxed().toList();
    }

    /// @return the selected indices as an array
    public int[] asArray() {
        if (isString()) {
            throw new IllegalStateException("String key " + this + " must be turned into indices first");
        }
        return switch (kind) {
            case INT -> new int[]{index};
            case LIST -> indices.clone();
            case SLICE -> parentSize != null ? slice.toIndices(parentSize) : slice.guessIndices();
            case NONE -> throw new IllegalStateException("An empty key selects no index");
        };
    }

    /// Apply this key to a sequence.
    ///
    /// @param sequence the sequence to select from
    /// @param <T> element type
    /// @return the selected elements, one element for an integer key
    public <T> List<T> apply(List<T> sequence) {
        if (isString()) {
            List<T> out = new ArrayList<>();
            for (T item : sequence) {
                if (item instanceof String s && names != null && names.contains(s)) {
                    out.add(item);
                }
            }
            return out;
        }
        int[] idx = kind == Kind.SLICE ? slice.toIndices(sequence.size()) : asArray();
        List<T> out = new ArrayList<>(idx.length);
        for (int i : idx) {
            out.add(sequence.get(i < 0 ? i + sequence.size() : i));
        }
        return out;
    }

    /// Restrict this key by another one expressed in the space it selects.
    ///
    /// If `B = A[this]` and `C = B[other]` then `C = A[this.compose(other)]`.
    /// The kind of the result is the strongest of the two kinds, integer over list
    /// over slice.
    ///
    /// @param other the restricting key
    /// @return the composed key
    public Key compose(Key other) {
        if (kind == Kind.SLICE && !isString() && slice.isTotal()) {
            return parentSize != null && other.parentSize == null ? other.withParentSize(parentSize) : other;
        }
        if (other.kind == Kind.SLICE && !other.isString() && other.slice.isTotal()) {
            return this;
        }
        if (other.isString() && !isString()) {
            throw new IllegalArgumentException("Cannot compose an index key with a string key");
        }
        Key result;
        if (isString()) {
            List<String> mine = names();
            List<String> wanted = other.isString() ? other.names() : other.intToList().apply(mine);
            List<String> out = mine.stream().filter(wanted::contains).toList();
            if (kind == Kind.INT || other.kind == Kind.INT) {
                result = name(out.get(0));
            } else {
                result = names(out);
            }
        } else {
            List<Integer> mine = asList();
            List<Integer> out = other.withParentSize(mine.size()).intToList().apply(mine);
            if (kind == Kind.INT || other.kind == Kind.INT) {
                result = of(out.get(0));
            } else if (kind == Kind.LIST || other.kind == Kind.LIST) {
                result = ofList(out);
            } else {
                result = sliceOf(out);
            }
        }
        return result.withParentSize(parentSize);
    }

    private static Key sliceOf(List<Integer> indices) {
        if (indices.isEmpty()) {
            return of(new Slice(0, 0, 1));
        }
        if (indices.size() == 1) {
            return of(new Slice(indices.get(0), indices.get(0) + 1, 1));
        }
        return ofList(indices).simplify();
    }

    /// Expand this key by another one.
    ///
    /// If `B = A[this]` and `C = A[other]` then `concat(B, C) = A[this.concat(other)]`.
    /// The result is a list, rewritten as a slice if either key was a slice.
    ///
    /// @param other the key to append
    /// @return the concatenated key
    public Key concat(Key other) {
        if (isString() || other.isString()) {
            List<String> out = new ArrayList<>(names());
            out.addAll(other.names());
            return names(out);
        }
        List<Integer> out = new ArrayList<>(asList());
        out.addAll(other.asList());
        Key result = ofList(out).withParentSize(parentSize);
        if (kind == Kind.SLICE || other.kind == Kind.SLICE) {
            result = result.simplify();
        }
        return result;
    }

    /// Rewrite a list of indices as a slice when it has a constant stride.
    ///
    /// @return the simplified key, or this key
    public Key simplify() {
        if (kind != Kind.LIST || isString()) {
            return this;
        }
        Optional<Slice> s = Slice.fromList(indices);
        return s.map(value -> of(value).withParentSize(parentSize)).orElse(this);
    }

    /// @return a key taking the same indices in reverse order
    public Key reverseOrder() {
        if (isString() && kind == Kind.LIST) {
            List<String> rev = new ArrayList<>(names);
            Collections.reverse(rev);
            return names(rev);
        }
        if (isString()) {
            return this;
        }
        return switch (kind) {
            case LIST -> {
                int[] rev = new int[indices.length];
                for (int i = 0; i < rev.length; i++) {
                    rev[i] = indices[indices.length - 1 - i];
                }
                yield of(rev).withParentSize(parentSize);
            }
            case SLICE -> of(slice.reverseOrder(parentSize)).withParentSize(parentSize);
            default -> this;
        };
    }

    /// Mirror indices along an axis, mapping `i` to `size - 1 - i`.
    ///
    /// @param size the size of the axis
    /// @return the mirrored key
    public Key mirror(int size) {
        if (isString()) {
            throw new IllegalStateException("Cannot mirror string key " + this);
        }
        return switch (kind) {
            case NONE -> this;
            case INT -> of(size - 1 - normalize(index, size)).withParentSize(size);
            case LIST -> of(Arrays.stream(indices).map(i -> size - 1 - normalize(i, size)).toArray())
                .withParentSize(size);
            case SLICE -> {
                int[] idx = Arrays.stream(slice.toIndices(size)).map(i -> size - 1 - i).toArray();
                Key k = of(idx).withParentSize(size).simplify();
                yield idx.length == 1 ? of(new Slice(idx[0], idx[0] + 1, 1)).withParentSize(size) : k;
            }
        };
    }

    private static int normalize(int i, int size) {
        return i < 0 ? i + size : i;
    }

    /// Sort indices and drop repeated ones. Descending slices are reversed.
    ///
    /// @return the sorted key
    public Key sortedUnique() {
        if (isString()) {
            return this;
        }
        if (kind == Kind.LIST) {
            return ofList(new ArrayList<>(new TreeSet<>(asList()))).withParentSize(parentSize);
        }
        if (kind == Kind.SLICE && slice.step() < 0) {
            return reverseOrder();
        }
        return this;
    }

    /// @return a single element list in place of an integer key
    public Key intToList() {
        if (kind != Kind.INT) {
            return this;
        }
        return isString() ? names(names) : of(new int[]{index}).withParentSize(parentSize);
    }

    /// @return an integer key in place of a single element list key
    public Key listToInt() {
        if (kind != Kind.LIST) {
            return this;
        }
        if (isString()) {
            return names.size() == 1 ? name(names.get(0)) : this;
        }
        return indices.length == 1 ? of(indices[0]).withParentSize(parentSize) : this;
    }

    /// Turn names into positions along a variable coordinate.
    ///
    /// @param variables the ordered variable names
    /// @return an index key, knowing its parent size
    public Key toIndices(VariableCoordinate variables) {
        if (!isString()) {
            return withParentSize(variables.size());
        }
        Key out = switch (kind) {
            case INT -> of(variables.indexOfName(names.get(0)));
            case LIST -> ofList(names.stream().map(variables::indexOfName).toList());
            case SLICE -> {
                int first = nameRange[0] == null ? 0 : variables.indexOfName(nameRange[0]);
                int last = nameRange[1] == null ? variables.size() - 1 : variables.indexOfName(nameRange[1]);
                yield first <= last ? slice(first, last + 1, 1) : slice(first, last == 0 ? null : last - 1, -1);
            }
            case NONE -> this;
        };
        return out.withParentSize(variables.size());
    }

    /// Turn positions along a variable coordinate into names.
    ///
    /// @param variables the ordered variable names
    /// @return a string key
    public Key toNames(VariableCoordinate variables) {
        if (isString()) {
            return kind == Kind.SLICE ? toIndices(variables).toNames(variables) : this;
        }
        Key sized = withParentSize(variables.size());
        return switch (kind) {
            case NONE -> this;
            case INT -> name(variables.nameOf(index));
            default -> names(Arrays.stream(sized.asArray()).mapToObj(variables::nameOf).toList());
        };
    }

    /// @return the raw selection: an Integer, a List, a Slice, a String, or null
    public Object value() {
        if (isString()) {
            return switch (kind) {
                case INT -> names.get(0);
                case LIST -> names;
                default -> nameRange[0] + ":" + nameRange[1];
            };
        }
        return switch (kind) {
            case NONE -> null;
            case INT -> index;
            case LIST -> asList();
            case SLICE -> slice;
        };
    }

    /// Compact rendering, with long lists shortened.
    ///
    /// @return the rendering
    public String print() {
        if (isString()) {
            return switch (kind) {
                case INT -> names.get(0);
                case LIST -> names.toString();
                default -> (nameRange[0] == null ? "" : nameRange[0]) + ":" + (nameRange[1] == null ? "" : nameRange[1]);
            };
        }
        return switch (kind) {
            case NONE -> "None";
            case INT -> Integer.toString(index);
            case SLICE -> slice.print();
            case LIST -> {
                if (indices.length <= 5) {
                    yield Arrays.stream(indices).mapToObj(Integer::toString)
                        .collect(Collectors.joining(", ", "[", "]"));
                }
                int n = indices.length;
                yield "[" + indices[0] + ", " + indices[1] + ", ..., " + indices[n - 2] + ", " + indices[n - 1] + "]";
            }
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Key other)) {
            return false;
        }
        return kind == other.kind && index == other.index
            && Arrays.equals(indices, other.indices)
            && Objects.equals(slice, other.slice)
            && Objects.equals(names, other.names)
            && Arrays.equals(nameRange, other.nameRange);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, index, Arrays.hashCode(indices), slice, names, Arrays.hashCode(nameRange));
    }

    @Override
    public String toString() {
        return print();
    }
}
