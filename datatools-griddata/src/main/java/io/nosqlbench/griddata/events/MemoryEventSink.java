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

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/// An in-memory implementation of EventSink.
///
/// Events are kept in arrival order up to a configurable limit (default 10000);
/// events past the limit are printed to System.err instead. Used by tests and by
/// callers that want to inspect what a scan or a load reported.
public class MemoryEventSink implements EventSink {
    private static final int DEFAULT_EVENT_LIMIT = 10000;

    private final int eventLimit;
    private final CopyOnWriteArrayList<LogEvent> events = new CopyOnWriteArrayList<>();

    /// Represents a log event stored in memory
    ///
    /// @param timestamp The time when the event occurred
    /// @param level The severity level of the event
    /// @param message The formatted message
    /// @param params Parameters of a typed event, or null for plain messages
    /// @param eventType The type of a typed event, or null for plain messages
    public record LogEvent(Instant timestamp, EventType.Level level, String message,
                           Map<String, Object> params, EventType eventType) {
        /// Copies the parameter map
        public LogEvent {
            params = params != null ? Map.copyOf(nonNullValues(params)) : null;
        }

        private static Map<String, Object> nonNullValues(Map<String, Object> params) {
            Map<String, Object> copy = new LinkedHashMap<>();
            params.forEach((k, v) -> copy.put(k, v == null ? "null" : v));
            return copy;
        }
    }

    /// Construct a MemoryEventSink with the default event limit (10000).
    public MemoryEventSink() {
        this(DEFAULT_EVENT_LIMIT);
    }

    /// @param eventLimit The maximum number of events to store in memory
    public MemoryEventSink(int eventLimit) {
        this.eventLimit = eventLimit;
    }

    @Override
    public void debug(String format, Object... args) {
        writeLog(EventType.Level.DEBUG, format, args);
    }

    @Override
    public void info(String format, Object... args) {
        writeLog(EventType.Level.INFO, format, args);
    }

    @Override
    public void warn(String format, Object... args) {
        writeLog(EventType.Level.WARN, format, args);
    }

    @Override
    public void error(String format, Object... args) {
        writeLog(EventType.Level.ERROR, format, args);
    }

    @Override
    public void error(String message, Throwable t) {
        StringWriter sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));
        addEvent(new LogEvent(Instant.now(), EventType.Level.ERROR, message + "\n" + sw, null, null));
    }

    @Override
    public void trace(String format, Object... args) {
        writeLog(EventType.Level.TRACE, format, args);
    }

    @Override
    public void log(EventType event, Map<String, Object> params) {
        validateRequiredParams(event, params);
        addEvent(new LogEvent(Instant.now(), event.getLevel(), formatEventMessage(event, params), params, event));
    }

    private void writeLog(EventType.Level level, String format, Object... args) {
        String message = args.length == 0 ? format : String.format(format.replace("%", "%%").replace("{}", "%s"), args);
        addEvent(new LogEvent(Instant.now(), level, message, null, null));
    }

    private void addEvent(LogEvent event) {
        if (events.size() >= eventLimit) {
            System.err.println(event.level().getSymbol() + " " + event.message());
            return;
        }
        events.add(event);
    }

    /// @return A list of all events, in arrival order
    public List<LogEvent> getEvents() {
        return new ArrayList<>(events);
    }

    /// @return The number of events
    public int getEventCount() {
        return events.size();
    }

    /// Get the parameters of every event of one type.
    ///
    /// @param eventType The event type to filter by
    /// @return A list of parameter maps for events of the specified type
    public List<Map<String, Object>> getEventsByType(EventType eventType) {
        return events.stream()
            .filter(e -> e.eventType() == eventType)
            .map(LogEvent::params)
            .toList();
    }

    /// @param eventType The event type to look for
    /// @return true if at least one event of this type was logged
    public boolean hasEvent(EventType eventType) {
        return events.stream().anyMatch(e -> e.eventType() == eventType);
    }

    /// Clear all events from the buffer.
    public void clear() {
        events.clear();
    }
}
