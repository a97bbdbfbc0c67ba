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
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/// An ordered mapping from dimension name to [Key].
///
/// Keyrings are values: every operation returns a new keyring and never aliases
/// the map of another keyring.
public final class Keyring implements Iterable<Map.Entry<String, Key>> {
    private static final Logger logger = LogManager.getLogger(Keyring.class);

    private final LinkedHashMap<String, Key> keys;

    private Keyring(LinkedHashMap<String, Key> keys) {
        this.keys = keys;
    }

    /// @return an empty keyring
    public static Keyring empty() {
        return new Keyring(new LinkedHashMap<>());
    }

    /// @param keys dimension to key mapping, in dimension order
    /// @return a keyring holding a copy of the mapping
    public static Keyring of(Map<String, Key> keys) {
        return new Keyring(new LinkedHashMap<>(keys));
    }

    /// @param dim a dimension
    /// @param key its key
    /// @return a keyring with one dimension
    public static Keyring of(String dim, Key key) {
        return empty().with(dim, key);
    }

    /// @param dim1 first dimension
    /// @param key1 its key
    /// @param dim2 second dimension
    /// @param key2 its key
    /// @return a keyring with two dimensions
    public static Keyring of(String dim1, Key key1, String dim2, Key key2) {
        return empty().with(dim1, key1).with(dim2, key2);
    }

    /// @param dim a dimension, appended if absent
    /// @param key its key
    /// @return a copy with this key set
    public Keyring with(String dim, Key key) {
        LinkedHashMap<String, Key> copy = new LinkedHashMap<>(keys);
        copy.put(dim, Objects.requireNonNull(key));
        return new Keyring(copy);
    }

    /// @param dim a dimension
    /// @return a copy without this dimension
    public Keyring without(String dim) {
        LinkedHashMap<String, Key> copy = new LinkedHashMap<>(keys);
        copy.remove(dim);
        return new Keyring(copy);
    }

    /// @return a copy of this keyring
    public Keyring copy() {
        return new Keyring(new LinkedHashMap<>(keys));
    }

    /// @param dim a dimension
    /// @return its key, or null if absent
    public Key get(String dim) {
        return keys.get(dim);
    }

    /// @param dim a dimension
    /// @return true if the dimension has a key
    public boolean contains(String dim) {
        return keys.containsKey(dim);
    }

    /// @return the dimensions, in order
    public List<String> dims() {
        return List.copyOf(keys.keySet());
    }

    /// @return the keys, in dimension order
    public List<Key> keys() {
        return List.copyOf(keys.values());
    }

    /// @return number of dimensions
    public int size() {
        return keys.size();
    }

    /// @return true if no dimension has a key
    public boolean isEmpty() {
        return keys.isEmpty();
    }

    @Override
    public Iterator<Map.Entry<String, Key>> iterator() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(keys)).entrySet().iterator();
    }

    /// @param dims the dimensions to keep
    /// @return a keyring restricted to these dimensions, in this keyring's order
    public Keyring subset(Collection<String> dims) {
        LinkedHashMap<String, Key> out = new LinkedHashMap<>();
        keys.forEach((d, k) -> {
            if (dims.contains(d)) {
                out.put(d, k);
            }
        });
        return new Keyring(out);
    }

    private Keyring mapKeys(Collection<String> dims, UnaryOperator<Key> op) {
        LinkedHashMap<String, Key> out = new LinkedHashMap<>();
        keys.forEach((d, k) -> out.put(d, dims == null || dims.isEmpty() || dims.contains(d) ? op.apply(k) : k));
        return new Keyring(out);
    }

    /// Shape of the selection, omitting squeezed dimensions.
    ///
    /// @return the shape, with null for sizes that cannot be determined
    public List<Integer> shape() {
        List<Integer> out = new ArrayList<>();
        for (Key k : keys.values()) {
            Integer s = k.shape();
            if (s == null || s > 0) {
                out.add(s);
            }
        }
        return out;
    }

    /// @param sizes dimension to axis size
    /// @return a copy where each key knows the size of its axis
    public Keyring withParentSizes(Map<String, Integer> sizes) {
        LinkedHashMap<String, Key> out = new LinkedHashMap<>();
        keys.forEach((d, k) -> out.put(d, sizes.containsKey(d) ? k.withParentSize(sizes.get(d)) : k));
        return new Keyring(out);
    }

    /// @return dimensions that are not squeezed
    public List<String> nonZeroDims() {
        return keys.entrySet().stream()
            .filter(e -> e.getValue().shape() == null || e.getValue().shape() > 0)
            .map(Map.Entry::getKey)
            .toList();
    }

    /// Reorder the keys.
    ///
    /// @param order dimension order; must name every dimension of this keyring
    /// @return the reordered keyring, ignoring ordered dimensions it does not hold
    public Keyring sortBy(List<String> order) {
        for (String d : keys.keySet()) {
            if (!order.contains(d)) {
                throw new IllegalArgumentException("Order " + order + " does not include dimension '" + d + "'");
            }
        }
        LinkedHashMap<String, Key> out = new LinkedHashMap<>();
        for (String d : order) {
            if (keys.containsKey(d)) {
                out.put(d, keys.get(d));
            }
        }
        return new Keyring(out);
    }

    /// @param dims the allowed dimensions
    /// @throws IllegalArgumentException if this keyring holds any other dimension
    public void checkUnwanted(Collection<String> dims) {
        for (String d : keys.keySet()) {
            if (!dims.contains(d)) {
                throw new IllegalArgumentException("'" + d + "' dimension is unwanted in keyring");
            }
        }
    }

    /// Add empty keys for missing dimensions.
    ///
    /// @param dims the dimensions that must be present
    /// @return the filled keyring
    public Keyring makeFull(List<String> dims) {
        for (String d : keys.keySet()) {
            if (!dims.contains(d)) {
                logger.warn("'{}' dimension in keyring is not in the full list of dimensions {}, and might be unwanted",
                    d, dims);
            }
        }
        LinkedHashMap<String, Key> out = new LinkedHashMap<>(keys);
        for (String d : dims) {
            out.putIfAbsent(d, Key.none());
        }
        return new Keyring(out);
    }

    /// Replace empty keys by whole slices.
    ///
    /// @param dims dimensions to fill; all if none given
    /// @return the filled keyring
    public Keyring makeTotal(String... dims) {
        return mapKeys(Arrays.asList(dims), k -> k.isNone() ? Key.all().withParentSize(k.parentSize()) : k);
    }

    /// Replace empty keys by an index.
    ///
    /// @param idx the index to set
    /// @param dims dimensions to fill; all if none given
    /// @return the filled keyring
    public Keyring makeSingle(int idx, String... dims) {
        return mapKeys(Arrays.asList(dims), k -> k.isNone() ? Key.of(idx).withParentSize(k.parentSize()) : k);
    }

    /// @param dims dimensions to change; all if none given
    /// @return a keyring where integer keys become single element lists
    public Keyring makeIntList(String... dims) {
        return mapKeys(Arrays.asList(dims), Key::intToList);
    }

    /// @param dims dimensions to change; all if none given
    /// @return a keyring where single element lists become integer keys
    public Keyring makeListInt(String... dims) {
        return mapKeys(Arrays.asList(dims), Key::listToInt);
    }

    /// @return a keyring where lists with a constant stride become slices
    public Keyring simplify() {
        return mapKeys(null, Key::simplify);
    }

    /// @return a keyring where every key is sorted and free of repeated indices
    public Keyring sortKeys() {
        return mapKeys(null, Key::sortedUnique);
    }

    /// Restrict this keyring by another one expressed in the space it selects.
    ///
    /// Dimensions missing from `other` are kept whole.
    ///
    /// @param other the restricting keyring
    /// @return the composed keyring
    public Keyring compose(Keyring other) {
        Keyring full = other.makeFull(dims()).makeTotal();
        LinkedHashMap<String, Key> out = new LinkedHashMap<>();
        keys.forEach((d, k) -> out.put(d, k.compose(full.get(d))));
        return new Keyring(out);
    }

    /// Expand this keyring with another one, dimension by dimension.
    ///
    /// @param other the keyring to append
    /// @return the concatenated keyring
    public Keyring concat(Keyring other) {
        LinkedHashMap<String, Key> out = new LinkedHashMap<>(keys);
        other.keys.forEach((d, k) -> out.put(d, keys.containsKey(d) ? keys.get(d).concat(k) : k));
        return new Keyring(out);
    }

    /// Compare shapes, treating unknown sizes as matching anything.
    ///
    /// @param other another keyring
    /// @return true if the shapes can be equal
    public boolean isShapeEquivalent(Keyring other) {
        List<Integer> mine = shape();
        List<Integer> theirs = other.shape();
        if (mine.size() != theirs.size()) {
            return false;
        }
        for (int i = 0; i < mine.size(); i++) {
            Integer a = mine.get(i);
            Integer b = theirs.get(i);
            if (a != null && b != null && !a.equals(b)) {
                return false;
            }
        }
        return true;
    }

    /// @return dimension to raw selection, for keyword style calls
    public Map<String, Object> kwargs() {
        LinkedHashMap<String, Object> out = new LinkedHashMap<>();
        keys.forEach((d, k) -> out.put(d, k.value()));
        return out;
    }

    /// @param dim the variable dimension
    /// @param variables the variable coordinate
    /// @return a copy with names along `dim` turned into indices
    public Keyring toIndices(String dim, VariableCoordinate variables) {
        return keys.containsKey(dim) ? with(dim, keys.get(dim).toIndices(variables)) : this;
    }

    /// @param dim the variable dimension
    /// @param variables the variable coordinate
    /// @return a copy with indices along `dim` turned into names
    public Keyring toNames(String dim, VariableCoordinate variables) {
        return keys.containsKey(dim) ? with(dim, keys.get(dim).toNames(variables)) : this;
    }

    /// @return the strategy needed to apply this keyring to an array
    public AccessStrategy accessStrategy() {
        return AccessStrategy.of(this);
    }

    /// @return compact rendering such as `[0, 1:5, ::2]`
    public String print() {
        return keys.values().stream().map(Key::print).collect(Collectors.joining(", ", "[", "]"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Keyring other)) {
            return false;
        }
        return new ArrayList<>(keys.entrySet()).equals(new ArrayList<>(other.keys.entrySet()));
    }

    @Override
    public int hashCode() {
        return keys.hashCode();
    }

    @Override
    public String toString() {
        return keys.entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue().print())
            .collect(Collectors.joining(", ", "{", "}"));
    }
}
