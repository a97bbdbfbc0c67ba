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

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/// One kind of placeholder in a pre-regex: a name, the regex a capture must match,
/// and how a capture splits into elementary date or value parts.
///
/// Elementary elements split into themselves. Composite elements, such as `x`
/// for `yyyymmdd`, split into several elementary parts.
///
/// @param name the element name, as written after the coordinate in `%(coord:name)`
/// @param regex the regex a capture must match
/// @param expand splits a capture into elementary element names and values
public record MatcherElement(String name, String regex, Function<String, Map<String, String>> expand) {

    /// Validates the fields
    public MatcherElement {
        Objects.requireNonNull(name, "element name");
        Objects.requireNonNull(regex, "element regex");
        Objects.requireNonNull(expand, "element expansion");
    }

    /// @param name the element name
    /// @param regex its regex
    /// @return an elementary element, whose capture is its own single part
    public static MatcherElement simple(String name, String regex) {
        return new MatcherElement(name, regex, s -> Map.of(name, s));
    }

    /// @return true if the regex can match captures of different lengths
    public boolean isVariableWidth() {
        return isVariableWidth(regex);
    }

    static boolean isVariableWidth(String regex) {
        return regex.contains("*") || regex.contains("+") || regex.contains("?") || regex.matches(".*\\{\\d*,\\d*}.*");
    }
}
