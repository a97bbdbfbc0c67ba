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

import java.util.Map;

/// Interface for diagnostic event types that can be logged through an [EventSink].
///
/// Implement this as an enum where each constant names one diagnostic, carries
/// its logging level, and declares the parameters that must accompany it.
public interface EventType {
    /// Logging levels for events
    enum Level {
        /// Fine grained tracing
        TRACE,
        /// Details useful while debugging a layout or a load plan
        DEBUG,
        /// Normal progress of scanning and loading
        INFO,
        /// Something was skipped, trimmed, or guessed
        WARN,
        /// A file failed but the operation continues
        ERROR;

        /// @return A single character representing the level
        public char getSymbol() {
            return name().charAt(0);
        }
    }

    /// @return The logging level
    Level getLevel();

    /// @return Map of parameter names to their required types
    Map<String, Class<?>> getRequiredParams();

    /// @return The event name
    String name();

    /// @return A single character representing the event level
    default char getLevelSymbol() {
        return getLevel().getSymbol();
    }
}
