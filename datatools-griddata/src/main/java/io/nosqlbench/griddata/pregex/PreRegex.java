package io.nosqlbench.griddata.pregex;

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

import io.nosqlbench.griddata.errors.ConfigException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/// A compiled pre-regex: the regular expression file names must match, and the
/// matchers whose captures locate coordinate values.
///
/// @param pregex the pre-regex, constants substituted
/// @param pattern the compiled regex, one named group per matcher
/// @param matchers the matchers, in order of appearance
/// @param literals the regex text between matchers; one more than there are matchers
public record PreRegex(String pregex, Pattern pattern, List<Matcher> matchers, List<String> literals) {

    /// Copies the lists
    public PreRegex {
        matchers = List.copyOf(matchers);
        literals = List.copyOf(literals);
    }

    /// Match a file name.
    ///
    /// @param file path relative to the filegroup root, with `/` separators
    /// @return the captures, or empty if the name does not match
    public Optional<FileMatch> match(String file) {
        java.util.regex.Matcher m = pattern.matcher(file);
        if (!m.matches()) {
            return Optional.empty();
        }
        List<String> captures = new ArrayList<>();
        List<String> segments = new ArrayList<>();
        int last = 0;
        for (Matcher matcher : matchers) {
            String g = matcher.group();
            segments.add(file.substring(last, m.start(g)));
            captures.add(m.group(g));
            last = m.end(g);
        }
        segments.add(file.substring(last));
        return Optional.of(new FileMatch(file, matchers, captures, segments));
    }

    /// Rebuild a file name from captures, using the text around captures of a
    /// previously matched file.
    ///
    /// @param segments the text around the captures of a matched file
    /// @param captures one capture per matcher
    /// @return the file name
    public String rebuild(List<String> segments, List<String> captures) {
        if (captures.size() != matchers.size() || segments.size() != matchers.size() + 1) {
            throw new ConfigException("Cannot rebuild a file name of " + pregex + " from " + captures.size()
                + " captures and " + segments.size() + " segments");
        }
        StringBuilder sb = new StringBuilder(segments.get(0));
        for (int i = 0; i < captures.size(); i++) {
            sb.append(captures.get(i)).append(segments.get(i + 1));
        }
        return sb.toString();
    }

    /// @param coord a coordinate
    /// @return the matchers of this coordinate
    public List<Matcher> matchersOf(String coord) {
        return matchers.stream().filter(m -> m.coord().equals(coord)).toList();
    }

    /// Pairs of adjacent matchers of different coordinates, both of variable width
    /// and separated by no literal text. Captures of such pairs can be split in
    /// more than one way.
    ///
    /// @return the ambiguous pairs
    public List<Matcher[]> ambiguousPairs() {
        List<Matcher[]> out = new ArrayList<>();
        for (int i = 1; i < matchers.size(); i++) {
            Matcher a = matchers.get(i - 1);
            Matcher b = matchers.get(i);
            if (!a.coord().equals(b.coord()) && literals.get(i).isEmpty()
                && a.isVariableWidth() && b.isVariableWidth()) {
                out.add(new Matcher[]{a, b});
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return pregex;
    }
}
