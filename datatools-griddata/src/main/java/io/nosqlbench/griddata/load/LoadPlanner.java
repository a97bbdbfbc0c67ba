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
import io.nosqlbench.griddata.reconcile.AvailableSpace;
import io.nosqlbench.griddata.scan.CoordScan;
import io.nosqlbench.griddata.scan.Filegroup;
import io.nosqlbench.griddata.scan.InFileIndex;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Turns a request over the available space into the reads to do in the files of
/// one filegroup.
///
/// The request must be normalised: one list key per dataset dimension, in dataset
/// order, holding indices of available values. Each requested value is located in
/// the filegroup through its scanned index. Every combination of shared values
/// names one file; the reads of a file are then merged with [CommandMerger], and
/// the in dimensions added to each of them. Values the filegroup does not hold
/// are left out.
public class LoadPlanner {
    private static final Logger logger = LogManager.getLogger(LoadPlanner.class);

    private final AvailableSpace space;
    private final String variableDim;
    private final boolean allVariablesAtOnce;

    /// @param space the available space
    /// @param variableDim the variable dimension, or null
    /// @param allVariablesAtOnce true if one read can take several variables
    public LoadPlanner(AvailableSpace space, String variableDim, boolean allVariablesAtOnce) {
        this.space = space;
        this.variableDim = variableDim;
        this.allVariablesAtOnce = allVariablesAtOnce;
    }

    /// @param fg a scanned filegroup
    /// @param request the normalised request
    /// @return the reads, one command per file; empty if the filegroup holds none of the request
    public List<LoadCommand> plan(Filegroup fg, Keyring request) {
        List<String> order = request.dims();
        Map<String, List<int[]>> pairs = new LinkedHashMap<>();
        for (String dim : order) {
            if (!fg.hasDim(dim)) {
                continue;
            }
            int[] wanted = request.get(dim).withParentSize(space.size(dim)).intToList().asArray();
            int[] contains = space.contains(fg.name(), dim);
            List<int[]> p = new ArrayList<>();
            for (int m = 0; m < wanted.length; m++) {
                int c = contains[wanted[m]];
                if (c >= 0) {
                    p.add(new int[]{m, c});
                }
            }
            if (p.isEmpty()) {
                logger.debug("Filegroup {} holds none of the requested values of {}", fg.name(), dim);
                return List.of();
            }
            pairs.put(dim, p);
        }

        List<String> shared = fg.sharedDims().stream().filter(pairs::containsKey).toList();
        Map<String, List<CommandKey>> byFile = new LinkedHashMap<>();
        collect(fg, shared, pairs, 0, new LinkedHashMap<>(), Keyring.empty(), Keyring.empty(), byFile);

        List<String> inDims = fg.inDims().stream().filter(pairs::containsKey).toList();
        List<LoadCommand> commands = new ArrayList<>();
        for (Map.Entry<String, List<CommandKey>> e : byFile.entrySet()) {
            List<CommandKey> keys = new ArrayList<>();
            for (CommandKey ck : CommandMerger.merge(e.getValue())) {
                keys.addAll(addInDims(fg, reverseDescending(fg, ck), inDims, pairs));
            }
            List<CommandKey> ordered = keys.stream().map(ck -> finish(ck).sortBy(order)).toList();
            commands.add(new LoadCommand(fg.name(), e.getKey(), fg.resolve(e.getKey()), ordered));
        }
        return commands;
    }

    private void collect(Filegroup fg, List<String> shared, Map<String, List<int[]>> pairs, int depth,
                         Map<String, Integer> indices, Keyring inFile, Keyring memory,
                         Map<String, List<CommandKey>> byFile) {
        if (depth == shared.size()) {
            String file = fg.rebuildFilename(indices);
            byFile.computeIfAbsent(file, f -> new ArrayList<>()).add(new CommandKey(inFile, memory));
            return;
        }
        String dim = shared.get(depth);
        CoordScan cs = fg.scan(dim);
        for (int[] p : pairs.get(dim)) {
            indices.put(dim, p[1]);
            Key in = inFileKey(dim, cs, cs.inIndices().get(p[1]), p[1]);
            collect(fg, shared, pairs, depth + 1, indices, inFile.with(dim, in), memory.with(dim, Key.of(p[0])),
                byFile);
        }
        indices.remove(dim);
    }

    private Key inFileKey(String dim, CoordScan cs, InFileIndex index, int scanned) {
        if (index.isNamed()) {
            return Key.name(index.name());
        }
        if (index.isNone()) {
            return dim.equals(variableDim) ? Key.name((String) cs.values().get(scanned)) : Key.none();
        }
        return Key.of(index.position());
    }

    private List<CommandKey> addInDims(Filegroup fg, CommandKey ck, List<String> inDims,
                                       Map<String, List<int[]>> pairs) {
        List<CommandKey> out = List.of(ck);
        for (String dim : inDims) {
            CoordScan cs = fg.scan(dim);
            List<int[]> p = pairs.get(dim);
            int[] memory = p.stream().mapToInt(a -> a[0]).toArray();
            int[] scanned = p.stream().mapToInt(a -> a[1]).toArray();
            List<InFileIndex> indices = cs.inFileIndices(Key.of(scanned), space.size(dim));
            List<CommandKey> next = new ArrayList<>();
            if (dim.equals(variableDim)) {
                List<Key> names = new ArrayList<>();
                for (int k = 0; k < indices.size(); k++) {
                    names.add(inFileKey(dim, cs, indices.get(k), scanned[k]));
                }
                for (CommandKey base : out) {
                    next.addAll(variableKeys(base, dim, names, memory));
                }
            } else {
                CommandKey added = positionalKeys(dim, indices, memory, cs.isIndexDescending());
                for (CommandKey base : out) {
                    next.add(new CommandKey(base.inFile().with(dim, added.inFile().get(dim)),
                        base.memory().with(dim, added.memory().get(dim))));
                }
            }
            out = next;
        }
        return out;
    }

    private List<CommandKey> variableKeys(CommandKey base, String dim, List<Key> names, int[] memory) {
        if (allVariablesAtOnce && names.stream().allMatch(Key::isString)) {
            List<String> all = names.stream().map(k -> k.names().get(0)).toList();
            return List.of(new CommandKey(base.inFile().with(dim, Key.names(all)),
                base.memory().with(dim, Key.of(memory).simplify())));
        }
        List<CommandKey> out = new ArrayList<>();
        for (int k = 0; k < names.size(); k++) {
            out.add(new CommandKey(base.inFile().with(dim, names.get(k)),
                base.memory().with(dim, Key.of(new int[]{memory[k]}))));
        }
        return out;
    }

    private static CommandKey positionalKeys(String dim, List<InFileIndex> indices, int[] memory,
                                             boolean descending) {
        long none = indices.stream().filter(InFileIndex::isNone).count();
        Key in;
        if (none == indices.size()) {
            if (indices.size() > 1) {
                throw new LoadException("Several values of '" + dim + "' map to a file without '" + dim
                    + "' dimension");
            }
            in = Key.none();
        } else if (none > 0) {
            throw new LoadException("Some values of '" + dim + "' have no in-file index");
        } else {
            in = Key.ofList(indices.stream().map(InFileIndex::position).toList()).simplify();
        }
        Key mem = Key.of(memory).simplify();
        CommandKey ck = new CommandKey(Keyring.of(dim, in), Keyring.of(dim, mem));
        return descending ? reverse(ck, dim) : ck;
    }

    private CommandKey reverseDescending(Filegroup fg, CommandKey ck) {
        CommandKey out = ck;
        for (String dim : ck.inFile().dims()) {
            if (fg.scan(dim).isIndexDescending()) {
                out = reverse(out, dim);
            }
        }
        return out;
    }

    /// Reverse a descending in-file slice so files are read in increasing order,
    /// reversing the destination side with it.
    private static CommandKey reverse(CommandKey ck, String dim) {
        Key in = ck.inFile().get(dim);
        if (in.kind() != Key.Kind.SLICE || in.slice().step() > 0) {
            return ck;
        }
        return new CommandKey(ck.inFile().with(dim, in.reverseOrder()),
            ck.memory().with(dim, ck.memory().get(dim).reverseOrder()));
    }

    private CommandKey finish(CommandKey ck) {
        Keyring inFile = ck.inFile();
        for (String dim : inFile.dims()) {
            Key k = inFile.get(dim);
            if (!k.isString() && k.kind() == Key.Kind.INT) {
                inFile = inFile.with(dim, k.intToList());
            }
        }
        return new CommandKey(inFile, ck.memory().makeIntList());
    }
}
