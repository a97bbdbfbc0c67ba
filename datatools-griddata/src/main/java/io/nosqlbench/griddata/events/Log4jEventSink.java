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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// The default [EventSink], forwarding every event to a Log4j logger.
public class Log4jEventSink implements EventSink {
    private final Logger logger;

    /// Forward events to the `io.nosqlbench.griddata` logger.
    public Log4jEventSink() {
        this(LogManager.getLogger("io.nosqlbench.griddata"));
    }

    /// @param logger The logger receiving the events
    public Log4jEventSink(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void debug(String format, Object... args) {
        logger.debug(format, args);
    }

    @Override
    public void info(String format, Object... args) {
        logger.info(format, args);
    }

    @Override
    public void warn(String format, Object... args) {
        logger.warn(format, args);
    }

    @Override
    public void error(String format, Object... args) {
        logger.error(format, args);
    }

    @Override
    public void error(String message, Throwable t) {
        logger.error(message, t);
    }

    @Override
    public void trace(String format, Object... args) {
        logger.trace(format, args);
    }
}
