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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// The captures of one file name matched against a [PreRegex].
///
/// @param file the matched path, relative to the filegroup root
/// @param matchers the matchers of the pre-regex
/// @param captures one capture per matcher, in matcher order
/// @param segments the text around the captures; one more than there are captures
public record FileMatch(String file, List<Matcher> matchers, List<String> captures, List<String> segments) {

    /// Copies the lists
    public FileMatch {
        matchers = List.copyOf(matchers);
        captures = List.copyOf(captures);
        segments = List.copyOf(segments);
    }

    /// @param coord a coordinate
    /// @return the captures of every matcher of this coordinate, dummies included
    public List<String> capturesOf(String coord) {
        List<String> out = new ArrayList<>();
        for (int i = 0; i < matchers.size(); i++) {
            if (matchers.get(i).coord().equals(coord)) {
                out.add(captures.get(i));
            }
        }
        return out;
    }

    /// Elementary parts captured for a coordinate, composite elements split.
    ///
    /// Dummy matchers are left out. When several matchers give the same part the
    /// first one wins.
    ///
    /// @param coord a coordinate
    /// @return element name to captured text
    public Map<String, String> elements(String coord) {
        Map<String, String> out = new LinkedHashMap<>();
        for (int i = 0; i < matchers.size(); i++) {
            Matcher m = matchers.get(i);
            if (m.coord().equals(coord) && !m.dummy()) {
                m.expand(captures.get(i)).forEach(out::putIfAbsent);
            }
        }
        return out;
    }
}
