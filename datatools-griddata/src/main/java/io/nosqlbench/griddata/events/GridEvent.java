package io.nosqlbench.griddata.events;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Diagnostics reported while scanning files, reconciling coordinates and loading data.
///
/// None of these is an error by itself. Conditions that make the available space or a
/// load command inconsistent are raised as exceptions instead.
public enum GridEvent implements EventType {
    /// A file under the filegroup root does not match the pre-regex, or cannot be scanned
    FILE_SKIPPED       (EventType.Level.WARN,
                        param("filegroup", String.class, "The filegroup being scanned"),
                        param("file", String.class, "The file that was skipped"),
                        param("reason", String.class, "Why the file was skipped")),

    /// A file was scanned for one coordinate
    FILE_SCANNED       (EventType.Level.DEBUG,
                        param("filegroup", String.class, "The filegroup being scanned"),
                        param("coord", String.class, "The coordinate being scanned"),
                        param("file", String.class, "The scanned file"),
                        param("values", Integer.class, "Number of values found")),

    /// Two variable width matchers of different coordinates touch each other
    PREGEX_AMBIGUOUS   (EventType.Level.WARN,
                        param("filegroup", String.class, "The filegroup owning the pre-regex"),
                        param("first", String.class, "The first matcher"),
                        param("second", String.class, "The matcher that follows it")),

    /// Scanned values were converted to the reference units of the coordinate
    UNITS_CONVERTED    (EventType.Level.INFO,
                        param("filegroup", String.class, "The filegroup"),
                        param("coord", String.class, "The converted coordinate"),
                        param("from", String.class, "The scanned units"),
                        param("to", String.class, "The reference units")),

    /// Scanned units differ from the reference units and no conversion exists
    UNITS_NOT_CONVERTED(EventType.Level.WARN,
                        param("filegroup", String.class, "The filegroup"),
                        param("coord", String.class, "The coordinate"),
                        param("from", String.class, "The scanned units"),
                        param("to", String.class, "The reference units")),

    /// A filegroup lost values in the intersection of available values
    COORD_TRIMMED      (EventType.Level.WARN,
                        param("filegroup", String.class, "The filegroup that lost values"),
                        param("coord", String.class, "The coordinate"),
                        param("before", Integer.class, "Number of values scanned"),
                        param("after", Integer.class, "Number of values kept")),

    /// Summary of the values shared across filegroups for one coordinate
    COMMON_VALUES      (EventType.Level.INFO,
                        param("coord", String.class, "The coordinate"),
                        param("size", Integer.class, "Number of available values"),
                        param("extent", String.class, "First and last values")),

    /// The tolerance used to compare values of one coordinate
    TOLERANCE_USED     (EventType.Level.DEBUG,
                        param("coord", String.class, "The coordinate"),
                        param("tolerance", Double.class, "The tolerance in coordinate units")),

    /// Two filegroups hold the same data points and the later one wins
    DUPLICATE_TOLERATED(EventType.Level.WARN,
                        param("first", String.class, "The earlier filegroup"),
                        param("second", String.class, "The later filegroup")),

    /// A file is about to be read
    LOAD_FILE          (EventType.Level.INFO,
                        param("filegroup", String.class, "The filegroup"),
                        param("file", String.class, "The file opened for reading"),
                        param("commands", Integer.class, "Number of reads in this file")),

    /// A file could not be opened, read or closed
    LOAD_FILE_FAILED   (EventType.Level.ERROR,
                        param("file", String.class, "The file"),
                        param("text", String.class, "The failure message")),

    /// A file holds an axis unknown to its filegroup, read at its first index
    EXTRA_AXIS         (EventType.Level.WARN,
                        param("file", String.class, "The file"),
                        param("axis", String.class, "The unexpected axis"),
                        param("size", Integer.class, "Size of the axis in the file")),

    /// A requested keyring matches no filegroup
    NOTHING_LOADED     (EventType.Level.WARN,
                        param("keyring", String.class, "The requested keyring"));

    private record ParamInfo(String name, Class<?> type, String description) {
        private ParamInfo {
            Objects.requireNonNull(name, "Parameter name cannot be null");
            Objects.requireNonNull(type, "Parameter type cannot be null");
        }
    }

    private final EventType.Level level;
    private final Map<String, Class<?>> requiredParams;
    private final Map<String, String> paramDescriptions;

    GridEvent(EventType.Level level, ParamInfo... requiredParams) {
        this.level = level;
        Map<String, Class<?>> params = new LinkedHashMap<>();
        Map<String, String> descriptions = new LinkedHashMap<>();
        for (ParamInfo info : requiredParams) {
            params.put(info.name(), info.type());
            descriptions.put(info.name(), info.description());
        }
        this.requiredParams = Collections.unmodifiableMap(params);
        this.paramDescriptions = Collections.unmodifiableMap(descriptions);
    }

    @Override
    public EventType.Level getLevel() {
        return level;
    }

    @Override
    public Map<String, Class<?>> getRequiredParams() {
        return requiredParams;
    }

    /// @return Map of parameter names to their descriptions
    public Map<String, String> getParamDescriptions() {
        return paramDescriptions;
    }

    private static ParamInfo param(String name, Class<?> type, String description) {
        return new ParamInfo(name, type, description);
    }
}
