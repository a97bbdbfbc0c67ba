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


import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/// The default routing of typed events to the plain logging methods
class EventSinkTest {

    /// Keeps what the default event routing hands to the plain methods
    private static class RecordingSink implements EventSink {
        final List<String> formats = new ArrayList<>();
        final List<Object[]> args = new ArrayList<>();

        private void record(String format, Object... a) {
            formats.add(format);
            args.add(a);
        }

        @Override
        public void debug(String format, Object... args) {
            record(format, args);
        }

        @Override
        public void info(String format, Object... args) {
            record(format, args);
        }

        @Override
        public void warn(String format, Object... args) {
            record(format, args);
        }

        @Override
        public void error(String format, Object... args) {
            record(format, args);
        }

        @Override
        public void error(String message, Throwable t) {
            record(message, t);
        }

        @Override
        public void trace(String format, Object... args) {
            record(format, args);
        }
    }

    @Test
    void eventMessagesAreNeverUsedAsFormats() {
        RecordingSink sink = new RecordingSink();
        sink.log(GridEvent.FILE_SKIPPED, "filegroup", "sst", "file", "SST_{}.dat", "reason", "50% done");

        assertThat(sink.formats).containsExactly("{}");
        assertThat(sink.args.get(0)).hasSize(1);
        assertThat(sink.args.get(0)[0].toString())
            .startsWith("FILE_SKIPPED")
            .contains("SST_{}.dat")
            .contains("50% done");
    }

    @Test
    void eventLevelPicksTheMethod() {
        List<String> levels = new ArrayList<>();
        EventSink sink = new RecordingSink() {
            @Override
            public void info(String format, Object... args) {
                levels.add("info");
            }

            @Override
            public void warn(String format, Object... args) {
                levels.add("warn");
            }
        };
        sink.log(GridEvent.COMMON_VALUES, "coord", "time", "size", 3, "extent", "0.5 to 2.5");
        sink.log(GridEvent.COORD_TRIMMED, "filegroup", "sst", "coord", "time", "before", 4, "after", 2);

        assertThat(levels).containsExactly("info", "warn");
    }
}
