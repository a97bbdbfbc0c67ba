package io.nosqlbench.griddata.cli;

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


import io.nosqlbench.griddata.format.hdf5.Hdf5Samples;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/// Runs the griddata commands against two small HDF5 files.
class CMD_griddataTest {

    private static final String LAYOUT = """
        coordinates:
          - {name: var, kind: variable}
          - {name: time, kind: time, units: days since 2007-01-01}
          - {name: lat, units: degrees_north}
        filegroups:
          - name: sst
            pregex: 'SST_%(time:x)\\.h5'
            coordinates: {var: in, time: shared, lat: in}
            scanners: {var: [variables_in_file], time: [date_from_filename], lat: [values_in_file]}
        """;

    @TempDir
    Path dir;

    private Path layout;
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @BeforeEach
    void setUp() throws IOException {
        Hdf5Samples.writeLat(dir.resolve("SST_20070101.h5"), 100);
        Hdf5Samples.writeLat(dir.resolve("SST_20070102.h5"), 200);
        layout = Files.writeString(dir.resolve("layout.yaml"), LAYOUT);
    }

    private int run(String... args) {
        CommandLine cmd = CMD_griddata.commandLine();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    @Test
    void scanPrintsTheAvailableValues() {
        assertThat(run("scan", layout.toString())).isEqualTo(0);
        assertThat(out.toString()).contains("var").contains("time").contains("lat");
        assertThat(out.toString().lines()).hasSize(3);
    }

    @Test
    void scanAsJson() {
        assertThat(run("scan", layout.toString(), "--format", "json")).isEqualTo(0);
        assertThat(out.toString()).contains("\"lat\"").contains("\"units\": \"degrees_north\"");
    }

    @Test
    void loadPrintsStatistics() {
        assertThat(run("load", layout.toString(), "-k", "var=sst", "-k", "time=1")).isEqualTo(0);
        assertThat(out.toString())
            .contains("shape    [3]")
            .contains("missing  0")
            .contains("min      201.0")
            .contains("max      203.0");
    }

    @Test
    void loadByRangeAsJson() {
        assertThat(run("load", layout.toString(), "-k", "var=sst", "-r", "lat=15,35", "-f", "JSON")).isEqualTo(0);
        assertThat(out.toString()).contains("\"size\": 4").contains("\"mean\": 152.5");
    }

    @Test
    void planListsFiles() {
        assertThat(run("plan", layout.toString(), "-k", "time=0")).isEqualTo(0);
        assertThat(out.toString()).contains("1 files").contains("SST_20070101.h5");

        out.getBuffer().setLength(0);
        assertThat(run("plan", layout.toString(), "--format", "json")).isEqualTo(0);
        assertThat(out.toString()).contains("\"file\": \"SST_20070102.h5\"").contains("\"inFile\"");
    }

    @Test
    void datasetErrorsExitWithOne() {
        assertThat(run("scan", dir.resolve("missing.yaml").toString())).isEqualTo(1);
        assertThat(err.toString()).contains("Cannot read layout");
        assertThat(run("load", layout.toString(), "-k", "depth=0")).isEqualTo(1);
        assertThat(run("load", layout.toString(), "-r", "lat=15")).isEqualTo(1);
    }

    @Test
    void noSubcommandPrintsUsage() {
        assertThat(run()).isEqualTo(2);
        assertThat(err.toString()).contains("griddata").contains("scan").contains("load");
    }
}
