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
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Textual keys, as typed on the command line or written in a layout file.
///
/// | spec      | key                       |
/// |-----------|---------------------------|
/// | `3`       | integer 3                 |
/// | `1,4,7`   | list [1, 4, 7]            |
/// | `2:10:2`  | slice 2:10:2              |
/// | `:`       | every index               |
/// | `sst`     | the variable `sst`        |
/// | `sst,chl` | the variables sst and chl |
/// | `sst:chl` | every variable from sst to chl |
public final class KeySpecs {
    /// An integer slice with optional bounds and step
    public static final Pattern SLICE = Pattern.compile(
        """
            \\s*(?<start>-?\\d+)?\\s*
            :\\s*(?<stop>-?\\d+)?\\s*
            (:\\s*(?<step>-?\\d+)?\\s*)?
            """, Pattern.COMMENTS
    );
    private static final Pattern INT = Pattern.compile("\\s*-?\\d+\\s*");
    private static final Pattern NAME = Pattern.compile("\\s*[A-Za-z_][\\w.-]*\\s*");

    private KeySpecs() {
    }

    /// Parse a textual key.
    ///
    /// @param spec the key text
    /// @return the key
    /// @throws IllegalArgumentException if the text is not a key
    public static Key parse(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new IllegalArgumentException("empty key spec");
        }
        if (INT.matcher(spec).matches()) {
            return Key.of(Integer.parseInt(spec.trim()));
        }
        Matcher slice = SLICE.matcher(spec);
        if (slice.matches()) {
            String step = slice.group("step");
            return Key.slice(toInt(slice.group("start")), toInt(slice.group("stop")),
                step == null ? 1 : Integer.parseInt(step));
        }
        if (spec.contains(",")) {
            List<String> parts = Arrays.stream(spec.split(",")).map(String::trim).toList();
            if (parts.stream().allMatch(p -> INT.matcher(p).matches())) {
                return Key.ofList(parts.stream().map(Integer::parseInt).toList());
            }
            if (parts.stream().allMatch(p -> NAME.matcher(p).matches())) {
                return Key.names(parts);
            }
            throw new IllegalArgumentException("list key '" + spec + "' must hold only integers or only names");
        }
        if (spec.contains(":")) {
            String[] bounds = spec.split(":", -1);
            if (bounds.length == 2) {
                return Key.nameRange(emptyToNull(bounds[0]), emptyToNull(bounds[1]));
            }
        } else if (NAME.matcher(spec).matches()) {
            return Key.name(spec.trim());
        }
        throw new IllegalArgumentException("invalid key spec '" + spec + "', expected an index, a list such as "
            + "'1,4,7', a slice such as '2:10:2', or variable names such as 'sst,chl' or 'sst:chl'");
    }

    /// Build a key from a value of a parsed YAML document.
    ///
    /// @param o a number, a string, or a list of numbers or names
    /// @return the key
    public static Key fromObject(Object o) {
        if (o instanceof Key k) {
            return k;
        } else if (o instanceof Number n) {
            return Key.of(n.intValue());
        } else if (o instanceof String s) {
            return parse(s);
        } else if (o instanceof List<?> list) {
            if (list.stream().allMatch(e -> e instanceof Number)) {
                return Key.ofList(list.stream().map(e -> ((Number) e).intValue()).toList());
            }
            return Key.names(list.stream().map(String::valueOf).toList());
        } else if (o instanceof Map<?, ?> map) {
            Object start = map.get("start");
            Object stop = map.get("stop");
            Object step = map.get("step");
            return Key.slice(start == null ? null : ((Number) start).intValue(),
                stop == null ? null : ((Number) stop).intValue(),
                step == null ? 1 : ((Number) step).intValue());
        }
        throw new IllegalArgumentException("invalid key: " + o);
    }

    private static Integer toInt(String s) {
        return s == null ? null : Integer.parseInt(s.trim());
    }

    private static String emptyToNull(String s) {
        return s.isBlank() ? null : s.trim();
    }
}
