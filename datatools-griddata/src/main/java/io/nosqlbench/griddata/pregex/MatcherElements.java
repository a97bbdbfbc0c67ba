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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Registry of [MatcherElement]s, looked up by name while compiling pre-regexes.
///
/// | element | regex        | meaning                          |
/// |---------|--------------|----------------------------------|
/// | `idx`   | `\d*`        | an integer index or value        |
/// | `value` | `[-+]?[\d.]+` | a decimal value                 |
/// | `Y`     | `\d{4}`      | year                             |
/// | `yy`    | `\d\d`       | two digit year, in the 2000s     |
/// | `M`     | `[a-zA-Z]*`  | month name or abbreviation       |
/// | `mm`    | `\d?\d`      | month number                     |
/// | `dd`    | `\d?\d`      | day of month                     |
/// | `doy`   | `\d?\d?\d`   | day of year                      |
/// | `hh`    | `\d\d`       | hour                             |
/// | `text`  | `[a-zA-Z]*`  | letters                          |
/// | `char`  | `\S*`        | any non blank characters         |
/// | `x`     | `\d{8}`      | `yyyymmdd`, split into Y, mm, dd |
/// | `F`     | `\d{4}-\d\d-\d\d` | `yyyy-mm-dd`, split into Y, mm, dd |
public final class MatcherElements {
    private final Map<String, MatcherElement> elements = new LinkedHashMap<>();

    /// @return a registry holding the default elements
    public static MatcherElements defaults() {
        MatcherElements r = new MatcherElements();
        r.register(MatcherElement.simple("idx", "\\d*"));
        r.register(MatcherElement.simple("value", "[-+]?[\\d.]+"));
        r.register(MatcherElement.simple("Y", "\\d\\d\\d\\d"));
        r.register(new MatcherElement("yy", "\\d\\d", s -> Map.of("Y", "20" + s)));
        r.register(MatcherElement.simple("M", "[a-zA-Z]*"));
        r.register(MatcherElement.simple("mm", "\\d?\\d"));
        r.register(MatcherElement.simple("dd", "\\d?\\d"));
        r.register(MatcherElement.simple("doy", "\\d?\\d?\\d"));
        r.register(MatcherElement.simple("hh", "\\d\\d"));
        r.register(MatcherElement.simple("text", "[a-zA-Z]*"));
        r.register(MatcherElement.simple("char", "\\S*"));
        r.register(new MatcherElement("x", "\\d\\d\\d\\d\\d\\d\\d\\d",
            s -> Map.of("Y", s.substring(0, 4), "mm", s.substring(4, 6), "dd", s.substring(6, 8))));
        r.register(new MatcherElement("F", "\\d\\d\\d\\d-\\d\\d-\\d\\d",
            s -> Map.of("Y", s.substring(0, 4), "mm", s.substring(5, 7), "dd", s.substring(8, 10))));
        return r;
    }

    /// Add or replace an element.
    ///
    /// @param element the element
    /// @return this registry
    public MatcherElements register(MatcherElement element) {
        if (!element.name().matches("[a-zA-Z]+")) {
            throw new ConfigException("Matcher element names are made of letters only, not '" + element.name() + "'");
        }
        elements.put(element.name(), element);
        return this;
    }

    /// @param name an element name
    /// @return the element, if registered
    public Optional<MatcherElement> find(String name) {
        return Optional.ofNullable(elements.get(name));
    }

    /// @return the registered element names
    public Set<String> names() {
        return elements.keySet();
    }
}
