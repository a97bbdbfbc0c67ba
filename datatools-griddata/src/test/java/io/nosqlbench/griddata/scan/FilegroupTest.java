package io.nosqlbench.griddata.scan;

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


import io.nosqlbench.griddata.coords.NumericCoordinate;
import io.nosqlbench.griddata.coords.TimeCoordinate;
import io.nosqlbench.griddata.errors.ConfigException;
import io.nosqlbench.griddata.errors.ScanException;
import io.nosqlbench.griddata.events.GridEvent;
import io.nosqlbench.griddata.events.MemoryEventSink;
import io.nosqlbench.griddata.format.MemoryFormatAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Building filegroups and scanning their files from a temporary directory.
class FilegroupTest {

    @TempDir
    Path root;

    private MemoryFormatAdapter format;
    private MemoryEventSink sink;

    @BeforeEach
    void setUp() throws IOException {
        format = new MemoryFormatAdapter();
        sink = new MemoryEventSink();
        for (String day : new String[]{"20070101", "20070102"}) {
            Files.createFile(root.resolve("SST_" + day + ".dat"));
            format.file("SST_" + day + ".dat").coordinate("lat", 10, 20, 30);
        }
        Files.createFile(root.resolve("README.txt"));
    }

    private Filegroup.Builder sst() {
        return Filegroup.builder("sst")
            .root(root)
            .format(format)
            .sink(sink)
            .pregex("SST_%(time:x)\\.dat")
            .in(NumericCoordinate.empty("lat", "degrees_north"))
            .shared(TimeCoordinate.empty("time", "days since 2007-01-01"));
    }

    private Filegroup scanned() {
        Filegroup fg = sst().build();
        fg.scan("lat").addScanner(MemoryFormatAdapter.coordinateValues());
        fg.scan("time").addScanner(ScanLibrary.dateFromFilename());
        new FilegroupScanner().scan(fg);
        return fg;
    }

    @Test
    void dimensionsKeepDeclarationOrder() {
        Filegroup fg = sst().build();
        assertThat(fg.dims()).containsExactly("lat", "time");
        assertThat(fg.inDims()).containsExactly("lat");
        assertThat(fg.sharedDims()).containsExactly("time");
        assertThat(fg.hasDim("depth")).isFalse();
        assertThatThrownBy(() -> fg.scan("depth")).isInstanceOf(ConfigException.class);
    }

    @Test
    void invalidFilegroupsAreRejected() {
        assertThatThrownBy(() -> Filegroup.builder("x").format(format).pregex("a").build())
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("needs a root");
        assertThatThrownBy(() -> sst().pregex("SST_%(time:x)_%(depth:idx)\\.dat").build())
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("unknown dimension");
        assertThatThrownBy(() -> sst().pregex("SST_%(time:x)_%(lat:idx)\\.dat").build())
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("not shared");
        assertThatThrownBy(() -> sst().pregex("SST\\.dat").build())
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("has no matcher");
        assertThatThrownBy(() -> sst().in(NumericCoordinate.empty("lat", "degrees_north")))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("declared twice");
    }

    @Test
    void ambiguousMatchersAreReported() {
        Filegroup.builder("grid")
            .root(root)
            .format(format)
            .sink(sink)
            .pregex("%(lat:idx)%(lon:idx)\\.dat")
            .shared(NumericCoordinate.empty("lat", "degrees_north"))
            .shared(NumericCoordinate.empty("lon", "degrees_east"))
            .build();
        assertThat(sink.hasEvent(GridEvent.PREGEX_AMBIGUOUS)).isTrue();
    }

    @Test
    void filesAreListedRelativeToTheRoot() throws IOException {
        Files.createDirectories(root.resolve("sub"));
        Files.createFile(root.resolve("sub/SST_20070103.dat"));
        Filegroup fg = sst().build();
        assertThat(fg.findFiles())
            .containsExactly("README.txt", "SST_20070101.dat", "SST_20070102.dat", "sub/SST_20070103.dat");

        Filegroup single = sst().singleFile(root.resolve("SST_20070102.dat")).build();
        assertThat(single.findFiles()).containsExactly("SST_20070102.dat");
    }

    @Test
    void scanningOpensOnlyWhatIsNeeded() {
        Filegroup fg = scanned();
        assertThat(fg.scan("lat").values()).containsExactly(10.0, 20.0, 30.0);
        assertThat(fg.scan("time").values()).containsExactly(0.5, 1.5);
        assertThat(format.opened()).isEqualTo(1);
        assertThat(format.closed()).isEqualTo(1);
        assertThat(sink.getEventsByType(GridEvent.FILE_SKIPPED))
            .singleElement()
            .satisfies(p -> assertThat(p).containsEntry("file", "README.txt"));
    }

    @Test
    void unreadableFilesAreSkipped() throws IOException {
        Files.createFile(root.resolve("SST_20061231.dat"));
        Filegroup fg = scanned();
        assertThat(fg.scan("lat").values()).containsExactly(10.0, 20.0, 30.0);
        assertThat(fg.scan("time").size()).isEqualTo(2);
        assertThat(sink.getEventsByType(GridEvent.FILE_SKIPPED))
            .anySatisfy(p -> assertThat(p)
                .containsEntry("file", "SST_20061231.dat")
                .containsEntry("reason", "unreadable SST_20061231.dat"));
        assertThat(format.opened()).isEqualTo(format.closed());
    }

    @Test
    void aFileFailingHalfwayAddsNoValue() {
        format.file("SST_20070101.dat");
        Filegroup fg = Filegroup.builder("sst")
            .root(root)
            .format(format)
            .sink(sink)
            .pregex("SST_%(time:x)\\.dat")
            .shared(TimeCoordinate.empty("time", "days since 2007-01-01"))
            .in(NumericCoordinate.empty("lat", "degrees_north"))
            .build();
        fg.scan("time").addScanner(ScanLibrary.dateFromFilename());
        fg.scan("lat").addScanner(MemoryFormatAdapter.coordinateValues());
        new FilegroupScanner().scan(fg);

        assertThat(fg.scan("time").values()).containsExactly(1.5);
        assertThat(fg.scan("time").matchOf(0)).containsExactly("20070102");
        assertThat(fg.scan("lat").values()).containsExactly(10.0, 20.0, 30.0);
        assertThat(sink.getEventsByType(GridEvent.FILE_SKIPPED))
            .anySatisfy(p -> assertThat(p)
                .containsEntry("file", "SST_20070101.dat")
                .hasEntrySatisfying("reason", r -> assertThat(r.toString()).contains("no coordinate lat")));
        assertThat(format.opened()).isEqualTo(format.closed());
    }

    @Test
    void scanningTwiceGivesTheSameValues() {
        Filegroup fg = scanned();
        new FilegroupScanner().scan(fg);
        assertThat(fg.scan("time").values()).containsExactly(0.5, 1.5);
        assertThat(fg.scan("lat").size()).isEqualTo(3);
    }

    @Test
    void noMatchingFileFails() {
        Filegroup fg = sst().pregex("SSH_%(time:x)\\.nc").build();
        fg.scan("time").addScanner(ScanLibrary.dateFromFilename());
        assertThatThrownBy(() -> new FilegroupScanner().scan(fg))
            .isInstanceOf(ScanException.class)
            .hasMessageContaining("No file under");
    }

    @Test
    void filenamesAreRebuilt() {
        Filegroup fg = scanned();
        assertThat(fg.rebuildFilename(Map.of("time", 1))).isEqualTo("SST_20070102.dat");
        assertThat(fg.rebuildFilename(Map.of("time", 0))).isEqualTo("SST_20070101.dat");
        assertThatThrownBy(() -> fg.rebuildFilename(Map.of()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> sst().build().rebuildFilename(Map.of("time", 0)))
            .isInstanceOf(ScanException.class);
    }
}
