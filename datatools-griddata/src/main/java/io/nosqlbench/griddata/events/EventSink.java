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

import java.util.LinkedHashMap;
import java.util.Map;

/// Receiver for the diagnostics produced while scanning, reconciling and loading.
///
/// A sink is handed explicitly to the components that report diagnostics, so that
/// nothing in the core writes to a process wide logger on its own. Events carry
/// an [EventType] whose level decides how the message is reported.
public interface EventSink {
    /// Log a debug message.
    ///
    /// @param format The message format string
    /// @param args The arguments to be formatted
    void debug(String format, Object... args);

    /// Log an info message.
    ///
    /// @param format The message format string
    /// @param args The arguments to be formatted
    void info(String format, Object... args);

    /// Log a warning message.
    ///
    /// @param format The message format string
    /// @param args The arguments to be formatted
    void warn(String format, Object... args);

    /// Log an error message.
    ///
    /// @param format The message format string
    /// @param args The arguments to be formatted
    void error(String format, Object... args);

    /// Log an error message with an exception.
    ///
    /// @param message The error message
    /// @param t The throwable associated with the error
    void error(String message, Throwable t);

    /// Log a trace message.
    ///
    /// @param format The message format string
    /// @param args The arguments to be formatted
    void trace(String format, Object... args);

    /// Log a message with an EventType and named parameters.
    /// The logging level is determined by the event's level.
    ///
    /// @param event The EventType enum value
    /// @param params Map of parameter names to values
    default void log(EventType event, Map<String, Object> params) {
        validateRequiredParams(event, params);
        String message = formatEventMessage(event, params);
        switch (event.getLevel()) {
            case TRACE -> trace("{}", message);
            case DEBUG -> debug("{}", message);
            case INFO -> info("{}", message);
            case WARN -> warn("{}", message);
            case ERROR -> error("{}", message);
        }
    }

    /// Convenience method to log an event with alternating parameter names and values.
    ///
    /// @param event The EventType enum value
    /// @param params Alternating parameter names and values
    default void log(EventType event, Object... params) {
        log(event, paramsToMap(params));
    }

    /// Validate that all required parameters are present and of the correct type
    ///
    /// @param event The EventType enum value
    /// @param params Map of parameter names to values
    default void validateRequiredParams(EventType event, Map<String, Object> params) {
        for (Map.Entry<String, Class<?>> required : event.getRequiredParams().entrySet()) {
            String name = required.getKey();
            if (!params.containsKey(name)) {
                throw new IllegalArgumentException("Missing required parameter: " + name + " for event: " + event.name());
            }
            Object value = params.get(name);
            if (value == null || required.getValue().isInstance(value)) {
                continue;
            }
            if (Number.class.isAssignableFrom(required.getValue()) && value instanceof Number) {
                continue;
            }
            throw new IllegalArgumentException("Parameter " + name + " for event " + event.name()
                + " must be of type " + required.getValue().getSimpleName() + ", but was "
                + value.getClass().getSimpleName());
        }
    }

    /// Format an event message with named parameters.
    ///
    /// @param event The EventType enum value
    /// @param params Map of parameter names to values
    /// @return Formatted message string
    default String formatEventMessage(EventType event, Map<String, Object> params) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-19s", event.name()));
        if (params != null) {
            for (Map.Entry<String, Object> entry : params.entrySet()) {
                sb.append(" ").append(entry.getKey()).append(":=").append(entry.getValue());
            }
        }
        return sb.toString().trim();
    }

    /// Convert varargs parameters to a map.
    ///
    /// @param params Alternating parameter names and values
    /// @return Map of parameter names to values
    default Map<String, Object> paramsToMap(Object... params) {
        if (params.length % 2 != 0) {
            throw new IllegalArgumentException("Parameters must be provided as name-value pairs");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < params.length; i += 2) {
            if (!(params[i] instanceof String name)) {
                throw new IllegalArgumentException("Parameter names must be strings");
            }
            map.put(name, params[i + 1]);
        }
        return map;
    }
}
