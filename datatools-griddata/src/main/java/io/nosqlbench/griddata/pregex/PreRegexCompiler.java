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
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/// Compiles pre-regexes into [PreRegex] instances.
///
/// A pre-regex is a regex in which placeholders stand for the parts of file
/// names that vary with a coordinate:
///
/// - `%(coord:elt)` captures element `elt` of coordinate `coord`; an empty
///   element means `idx`
/// - `%(coord:elt:custom=RGX:)` uses `RGX` instead of the element's regex; the
///   custom regex ends at the next colon
/// - `%(coord:elt:dummy)` must match but gives no value
/// - `%(name)` is replaced by a constant from the replacements
/// - `%%` is a literal `%`
///
/// Everything else is used as regex text.
public class PreRegexCompiler {
    private static final Pattern NAME = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

    private final MatcherElements elements;

    /// A compiler knowing the default elements
    public PreRegexCompiler() {
        this(MatcherElements.defaults());
    }

    /// @param elements the elements placeholders may use
    public PreRegexCompiler(MatcherElements elements) {
        this.elements = elements;
    }

    /// @return the element registry
    public MatcherElements elements() {
        return elements;
    }

    /// @param pregex the pre-regex
    /// @return the compiled form
    public PreRegex compile(String pregex) {
        return compile(pregex, Map.of());
    }

    /// Compile a pre-regex.
    ///
    /// @param pregex the pre-regex
    /// @param replacements constants substituted for `%(name)` placeholders
    /// @return the compiled form
    /// @throws ConfigException for malformed or unknown placeholders, unresolved
    ///     constants, or a regex that does not compile
    public PreRegex compile(String pregex, Map<String, String> replacements) {
        String text = substituteConstants(pregex.strip(), replacements);
        List<Matcher> matchers = new ArrayList<>();
        List<String> literals = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        StringBuilder regex = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '%' && i + 1 < text.length() && text.charAt(i + 1) == '%') {
                literal.append('%');
                i += 2;
            } else if (c == '%' && i + 1 < text.length() && text.charAt(i + 1) == '(') {
                int[] end = new int[1];
                Matcher m = parseMatcher(text, i, matchers.size(), end);
                literals.add(literal.toString());
                regex.append(literal).append("(?<").append(m.group()).append('>').append(m.regex()).append(')');
                literal.setLength(0);
                matchers.add(m);
                i = end[0];
            } else if (c == '%') {
                throw new ConfigException("Lone '%' at position " + i + " of pre-regex '" + pregex + "', use '%%'");
            } else {
                literal.append(c);
                i++;
            }
        }
        literals.add(literal.toString());
        regex.append(literal);
        try {
            return new PreRegex(text, Pattern.compile(regex.toString()), matchers, literals);
        } catch (PatternSyntaxException e) {
            throw new ConfigException("Pre-regex '" + pregex + "' compiles to an invalid regex: " + e.getDescription(), e);
        }
    }

    private String substituteConstants(String pregex, Map<String, String> replacements) {
        StringBuilder out = new StringBuilder();
        int i = 0;
        while (i < pregex.length()) {
            if (pregex.startsWith("%%", i)) {
                out.append("%%");
                i += 2;
                continue;
            }
            if (pregex.startsWith("%(", i)) {
                int close = pregex.indexOf(')', i);
                int colon = pregex.indexOf(':', i);
                if (close > 0 && (colon < 0 || colon > close)) {
                    String name = pregex.substring(i + 2, close);
                    String value = replacements.get(name);
                    if (value == null) {
                        throw new ConfigException("No replacement for constant '%(" + name + ")' in pre-regex '"
                            + pregex + "'");
                    }
                    out.append(value);
                    i = close + 1;
                    continue;
                }
            }
            out.append(pregex.charAt(i));
            i++;
        }
        return out.toString();
    }

    private Matcher parseMatcher(String text, int start, int index, int[] end) {
        int i = start + 2;
        int colon = text.indexOf(':', i);
        if (colon < 0) {
            throw malformed(text, start, "missing ':' after coordinate name");
        }
        String coord = text.substring(i, colon);
        if (!NAME.matcher(coord).matches()) {
            throw malformed(text, start, "invalid coordinate name '" + coord + "'");
        }
        i = colon + 1;
        int j = i;
        while (j < text.length() && Character.isLetter(text.charAt(j))) {
            j++;
        }
        String eltName = text.substring(i, j);
        if (eltName.isEmpty()) {
            eltName = "idx";
        }
        i = j;
        String custom = null;
        boolean dummy = false;
        if (text.startsWith(":custom=", i)) {
            int stop = text.indexOf(':', i + 8);
            if (stop < 0) {
                throw malformed(text, start, "custom regex must be terminated by ':'");
            }
            custom = text.substring(i + 8, stop);
            if (custom.isEmpty()) {
                throw malformed(text, start, "empty custom regex");
            }
            i = stop + 1;
            if (text.startsWith("dummy", i)) {
                dummy = true;
                i += 5;
            }
        } else if (text.startsWith(":dummy", i)) {
            dummy = true;
            i += 6;
        }
        if (i >= text.length() || text.charAt(i) != ')') {
            throw malformed(text, start, "expected ')'");
        }
        MatcherElement element = elements.find(eltName).orElse(null);
        if (element == null) {
            if (custom == null) {
                throw new ConfigException("Unknown matcher element '" + eltName + "' in pre-regex '" + text
                    + "', known elements: " + elements.names());
            }
            element = MatcherElement.simple(eltName, custom);
        }
        end[0] = i + 1;
        return new Matcher(coord, element, custom != null ? custom : element.regex(), dummy, index);
    }

    private static ConfigException malformed(String text, int position, String reason) {
        return new ConfigException("Malformed matcher at position " + position + " of pre-regex '" + text + "': " + reason);
    }
}
