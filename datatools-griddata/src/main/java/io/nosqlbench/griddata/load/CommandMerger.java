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

import io.nosqlbench.griddata.errors.LoadException;
import io.nosqlbench.griddata.keys.Key;
import io.nosqlbench.griddata.keys.Keyring;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Merges the reads of one file into as few reads as possible.
///
/// Reads that differ along a single dimension are merged into one read holding a
/// list of indices along it, one dimension after the other. Lists with a constant
/// stride then become slices, separately in the file and in the destination. The
/// result does not depend on the order reads are given in.
public final class CommandMerger {

    private CommandMerger() {
    }

    /// @param keys the reads of one file; every keyring holds the same dimensions
    /// @return the merged reads
    /// @throws LoadException if two reads absent from the file would be merged
    public static List<CommandKey> merge(List<CommandKey> keys) {
        if (keys.isEmpty()) {
            return List.of();
        }
        List<String> dims = keys.get(0).inFile().dims();
        List<CommandKey> current = new ArrayList<>(keys);
        current.sort(memoryOrder(keys.get(0).memory().dims()));
        for (String dim : dims) {
            current = mergeAlong(current, dim);
        }
        return current.stream().map(CommandKey::simplify).toList();
    }

    private static List<CommandKey> mergeAlong(List<CommandKey> keys, String dim) {
        Map<List<Keyring>, List<CommandKey>> groups = new LinkedHashMap<>();
        List<CommandKey> out = new ArrayList<>();
        for (CommandKey ck : keys) {
            if (!mergeable(ck.inFile().get(dim)) || !mergeable(ck.memory().get(dim))) {
                out.add(ck);
                continue;
            }
            List<Keyring> rest = List.of(ck.inFile().without(dim), ck.memory().without(dim));
            groups.computeIfAbsent(rest, k -> new ArrayList<>()).add(ck);
        }
        for (List<CommandKey> group : groups.values()) {
            out.add(group.size() == 1 ? group.get(0) : concat(group, dim));
        }
        return out;
    }

    private static boolean mergeable(Key key) {
        if (key == null || key.isString()) {
            return false;
        }
        return key.kind() == Key.Kind.INT || key.kind() == Key.Kind.LIST || key.kind() == Key.Kind.NONE;
    }

    private static CommandKey concat(List<CommandKey> group, String dim) {
        List<Integer> inFile = new ArrayList<>();
        List<Integer> memory = new ArrayList<>();
        int none = 0;
        for (CommandKey ck : group) {
            Key in = ck.inFile().get(dim);
            Key mem = ck.memory().get(dim);
            if (in.isNone()) {
                none++;
                memory.addAll(mem.intToList().asList());
                continue;
            }
            inFile.addAll(in.intToList().asList());
            memory.addAll(mem.intToList().asList());
        }
        if (none > 0 && (none > 1 || !inFile.isEmpty())) {
            throw new LoadException("Several values of '" + dim + "' map to the same file, which has no '"
                + dim + "' dimension: " + group);
        }
        CommandKey first = group.get(0);
        Key inKey = inFile.isEmpty() ? Key.none() : Key.ofList(inFile);
        return new CommandKey(first.inFile().with(dim, inKey), first.memory().with(dim, Key.ofList(memory)));
    }

    private static Comparator<CommandKey> memoryOrder(List<String> dims) {
        Comparator<CommandKey> c = Comparator.comparingInt(ck -> 0);
        for (String dim : dims) {
            c = c.thenComparingInt(ck -> firstIndex(ck.memory().get(dim)));
        }
        return c;
    }

    private static int firstIndex(Key key) {
        if (key == null || key.isNone() || key.isString()) {
            return 0;
        }
        int[] idx = key.asArray();
        return idx.length == 0 ? 0 : idx[0];
    }
}
