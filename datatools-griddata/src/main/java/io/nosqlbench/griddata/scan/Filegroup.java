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

import io.nosqlbench.griddata.coords.Coordinate;
import io.nosqlbench.griddata.errors.ConfigException;
import io.nosqlbench.griddata.errors.ScanException;
import io.nosqlbench.griddata.events.EventSink;
import io.nosqlbench.griddata.events.GridEvent;
import io.nosqlbench.griddata.events.NoOpEventSink;
import io.nosqlbench.griddata.format.FormatAdapter;
import io.nosqlbench.griddata.pregex.FileMatch;
import io.nosqlbench.griddata.pregex.Matcher;
import io.nosqlbench.griddata.pregex.PreRegex;
import io.nosqlbench.griddata.pregex.PreRegexCompiler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/// A set of files sharing one format, one file naming scheme and one arrangement
/// of dimensions.
///
/// Each dimension of the filegroup is either *in* (entirely inside every file) or
/// *shared* (spread over files, and distinguished by file name captures). Build
/// one with [#builder(String)]; the pre-regex is compiled and checked against the
/// dimensions before any file is opened.
public class Filegroup {
    /// Deepest directory level searched below the root
    public static final int MAX_DEPTH = 3;

    private final String name;
    private final Path root;
    private final Path singleFile;
    private final FormatAdapter format;
    private final PreRegex pregex;
    private final Map<String, CoordScan> scans;
    private final EventSink sink;
    private List<String> segments;

    private Filegroup(Builder b, PreRegex pregex) {
        this.name = b.name;
        this.root = b.root;
        this.singleFile = b.singleFile;
        this.format = b.format;
        this.pregex = pregex;
        this.sink = b.sink;
        this.scans = Collections.unmodifiableMap(new LinkedHashMap<>(b.scans));
    }

    /// @param name the filegroup name
    /// @return a builder
    public static Builder builder(String name) {
        return new Builder(name);
    }

    /// @return the filegroup name
    public String name() {
        return name;
    }

    /// @return the directory holding the files
    public Path root() {
        return root;
    }

    /// @return the format of the files
    public FormatAdapter format() {
        return format;
    }

    /// @return the compiled pre-regex
    public PreRegex pregex() {
        return pregex;
    }

    /// @return where events are sent
    public EventSink sink() {
        return sink;
    }

    /// @param dim a dimension
    /// @return its scan in this filegroup
    /// @throws ConfigException if the filegroup does not have this dimension
    public CoordScan scan(String dim) {
        CoordScan cs = scans.get(dim);
        if (cs == null) {
            throw new ConfigException("Filegroup '" + name + "' has no dimension '" + dim + "'");
        }
        return cs;
    }

    /// @return every scan, in declaration order
    public Collection<CoordScan> scans() {
        return scans.values();
    }

    /// @param dim a dimension
    /// @return true if the filegroup has this dimension
    public boolean hasDim(String dim) {
        return scans.containsKey(dim);
    }

    /// @return dimensions, in declaration order
    public List<String> dims() {
        return List.copyOf(scans.keySet());
    }

    /// @return shared dimensions, in declaration order
    public List<String> sharedDims() {
        return scans.values().stream().filter(CoordScan::isShared).map(CoordScan::name).toList();
    }

    /// @return in dimensions, in declaration order
    public List<String> inDims() {
        return scans.values().stream().filter(cs -> !cs.isShared()).map(CoordScan::name).toList();
    }

    /// List the candidate files: every regular file under the root, down to
    /// [#MAX_DEPTH] levels, or the single file when one was given.
    ///
    /// @return paths relative to the root, with `/` separators, sorted
    /// @throws ScanException if the root cannot be listed
    public List<String> findFiles() {
        if (singleFile != null) {
            Path file = singleFile.isAbsolute() ? root.relativize(singleFile) : singleFile;
            return List.of(toName(file));
        }
        try (Stream<Path> walk = Files.walk(root, MAX_DEPTH)) {
            return walk.filter(Files::isRegularFile)
                .map(p -> toName(root.relativize(p)))
                .sorted()
                .toList();
        } catch (IOException e) {
            throw new ScanException(name, null, "Cannot list files under " + root, e);
        }
    }

    private static String toName(Path relative) {
        List<String> parts = new ArrayList<>();
        relative.forEach(p -> parts.add(p.toString()));
        return String.join("/", parts);
    }

    /// @param file a file name relative to the root
    /// @return its path
    public Path resolve(String file) {
        return root.resolve(file);
    }

    /// Keep the text around the captures of the first matched file, used to rebuild
    /// file names.
    ///
    /// @param match a matched file
    public void rememberSegments(FileMatch match) {
        if (segments == null) {
            segments = match.segments();
        }
    }

    /// Forget scanning results of every dimension.
    public void reset() {
        segments = null;
        scans.values().forEach(CoordScan::reset);
    }

    /// Rebuild the name of the file holding a combination of shared values.
    ///
    /// @param indices for each shared dimension, the position of a scanned value
    /// @return the file name, relative to the root
    public String rebuildFilename(Map<String, Integer> indices) {
        if (segments == null) {
            throw new ScanException(name, null, "Cannot rebuild file names before scanning");
        }
        Map<String, Integer> used = new HashMap<>();
        List<String> captures = new ArrayList<>();
        for (Matcher m : pregex.matchers()) {
            Integer idx = indices.get(m.coord());
            if (idx == null) {
                throw new IllegalArgumentException("No value given for shared dimension " + m.coord());
            }
            int k = used.merge(m.coord(), 1, Integer::sum) - 1;
            captures.add(scan(m.coord()).matchOf(idx).get(k));
        }
        return pregex.rebuild(segments, captures);
    }

    @Override
    public String toString() {
        return "Filegroup " + name + " " + pregex + " " + scans.values();
    }

    /// Builds and validates a [Filegroup]
    public static class Builder {
        private final String name;
        private Path root;
        private Path singleFile;
        private FormatAdapter format;
        private String pregex;
        private final Map<String, String> replacements = new LinkedHashMap<>();
        private final Map<String, CoordScan> scans = new LinkedHashMap<>();
        private PreRegexCompiler compiler = new PreRegexCompiler();
        private EventSink sink = new NoOpEventSink();

        private Builder(String name) {
            this.name = name;
        }

        /// @param root directory holding the files
        /// @return this
        public Builder root(Path root) {
            this.root = root;
            return this;
        }

        /// @param file a single file to use instead of listing the root
        /// @return this
        public Builder singleFile(Path file) {
            this.singleFile = file;
            return this;
        }

        /// @param format format of the files
        /// @return this
        public Builder format(FormatAdapter format) {
            this.format = format;
            return this;
        }

        /// @param pregex pre-regex of file names relative to the root
        /// @return this
        public Builder pregex(String pregex) {
            this.pregex = pregex;
            return this;
        }

        /// @param constant a constant name used as `%(name)` in the pre-regex
        /// @param value its replacement
        /// @return this
        public Builder replacement(String constant, String value) {
            replacements.put(constant, value);
            return this;
        }

        /// @param replacements constants used in the pre-regex
        /// @return this
        public Builder replacements(Map<String, String> replacements) {
            this.replacements.putAll(replacements);
            return this;
        }

        /// @param coordinate a dimension found entirely inside each file
        /// @return this
        public Builder in(Coordinate coordinate) {
            return add(coordinate, false);
        }

        /// @param coordinate a dimension spread over files
        /// @return this
        public Builder shared(Coordinate coordinate) {
            return add(coordinate, true);
        }

        private Builder add(Coordinate coordinate, boolean shared) {
            if (scans.containsKey(coordinate.name())) {
                throw new ConfigException("Dimension '" + coordinate.name() + "' declared twice in filegroup '"
                    + name + "'");
            }
            scans.put(coordinate.name(), new CoordScan(name, coordinate, shared));
            return this;
        }

        /// @param compiler compiler holding the matcher elements
        /// @return this
        public Builder compiler(PreRegexCompiler compiler) {
            this.compiler = compiler;
            return this;
        }

        /// @param sink where events are sent
        /// @return this
        public Builder sink(EventSink sink) {
            this.sink = sink;
            return this;
        }

        /// Compile the pre-regex and check it against the dimensions.
        ///
        /// @return the filegroup
        /// @throws ConfigException if a matcher names an unknown or in dimension,
        /// or a shared dimension has no matcher
        public Filegroup build() {
            if (root == null || format == null || pregex == null) {
                throw new ConfigException("Filegroup '" + name + "' needs a root, a format and a pre-regex");
            }
            PreRegex compiled = compiler.compile(pregex, replacements);
            for (Matcher m : compiled.matchers()) {
                CoordScan cs = scans.get(m.coord());
                if (cs == null) {
                    throw new ConfigException("Matcher " + m.print() + " of filegroup '" + name
                        + "' refers to an unknown dimension");
                }
                if (!cs.isShared()) {
                    throw new ConfigException("Matcher " + m.print() + " of filegroup '" + name
                        + "' refers to dimension '" + m.coord() + "' which is not shared");
                }
            }
            List<String> sharedDims = new ArrayList<>();
            for (CoordScan cs : scans.values()) {
                cs.setSink(sink);
                if (cs.isShared()) {
                    sharedDims.add(cs.name());
                    if (compiled.matchersOf(cs.name()).isEmpty()) {
                        throw new ConfigException("Shared dimension '" + cs.name() + "' of filegroup '" + name
                            + "' has no matcher in " + compiled.pregex());
                    }
                }
            }
            if (sharedDims.size() > 1) {
                for (Matcher[] pair : compiled.ambiguousPairs()) {
                    sink.log(GridEvent.PREGEX_AMBIGUOUS, "filegroup", name, "first", pair[0].print(),
                        "second", pair[1].print());
                }
            }
            return new Filegroup(this, compiled);
        }
    }
}
