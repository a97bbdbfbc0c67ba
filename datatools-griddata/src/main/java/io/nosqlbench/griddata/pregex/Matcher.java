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

/// One placeholder of a compiled pre-regex.
///
/// @param coord the coordinate the capture belongs to
/// @param element the element kind
/// @param regex the regex actually used, the element's or a custom one
/// @param dummy true if the capture varies but carries no coordinate value
/// @param index position of the placeholder in the pre-regex
public record Matcher(String coord, MatcherElement element, String regex, boolean dummy, int index) {

    /// @return name of the capture group in the compiled regex
    public String group() {
        return "m" + index;
    }

    /// @return the element name
    public String elementName() {
        return element.name();
    }

    /// @param capture a captured string
    /// @return elementary parts of the capture
    public Map<String, String> expand(String capture) {
        return element.expand().apply(capture);
    }

    /// @return true if captures of this matcher may differ in length
    public boolean isVariableWidth() {
        return MatcherElement.isVariableWidth(regex);
    }

    /// @return the placeholder as it would be written in a pre-regex
    public String print() {
        StringBuilder sb = new StringBuilder("%(").append(coord).append(':').append(element.name());
        if (!regex.equals(element.regex())) {
            sb.append(":custom=").append(regex).append(':');
        }
        if (dummy) {
            sb.append(":dummy");
        }
        return sb.append(')').toString();
    }

    @Override
    public String toString() {
        return print();
    }
}
