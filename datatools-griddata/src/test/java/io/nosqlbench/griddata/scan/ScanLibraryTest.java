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
import io.nosqlbench.griddata.coords.VariableCoordinate;
import io.nosqlbench.griddata.errors.ConfigException;
import io.nosqlbench.griddata.errors.ScanException;
import io.nosqlbench.griddata.pregex.FileMatch;
import io.nosqlbench.griddata.pregex.PreRegexCompiler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ScanLibraryTest {

    private final PreRegexCompiler compiler = new PreRegexCompiler();

    private FileMatch match(String pregex, String file) {
        return compiler.compile(pregex).match(file).orElseThrow();
    }

    private CoordScan timeScan() {
        return new CoordScan("fg", TimeCoordinate.empty("time", "days since 2007-01-01"), true);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "SSH_%(time:x)\\.nc        | SSH_20070109.nc | 8.5",
        "%(time:M)%(time:Y)        | jan2007         | 0.5",
        "%(time:Y)-%(time:M)       | 2007-FEBRUARY   | 31.5",
        "%(time:Y)%(time:doy)      | 2007032         | 31.5",
        "%(time:F)T%(time:hh)      | 2007-01-02T06   | 1.25",
        "%(time:yy)%(time:mm)      | 0703            | 59.5"
    })
    void datesFromFilenames(String pregex, String file, double expected) {
        ScanResult result = ScanLibrary.dateFromFilename().scan(timeScan(), match(pregex, file), List.of());
        assertThat(result.values()).hasSize(1);
        assertThat((Double) result.values().get(0)).isCloseTo(expected, within(1e-9));
        assertThat(result.inIndices()).isNull();
    }

    @Test
    void datesNeedATimeCoordinate() {
        CoordScan depth = new CoordScan("fg", NumericCoordinate.of("depth"), true);
        assertThatThrownBy(() -> ScanLibrary.dateFromFilename().scan(depth, match("%(depth:Y)", "2007"), List.of()))
            .isInstanceOf(ScanException.class);
    }

    @Test
    void unknownMonthIsAScanError() {
        assertThatThrownBy(() -> ScanLibrary.dateFromFilename()
            .scan(timeScan(), match("%(time:M)%(time:Y)", "xyz2007"), List.of()))
            .isInstanceOf(ScanException.class)
            .hasMessageContaining("xyz2007");
    }

    @Test
    void valuesFromFilenames() {
        CoordScan depth = new CoordScan("fg", NumericCoordinate.of("depth"), true);
        assertThat(ScanLibrary.valueFromFilename().scan(depth, match("%(depth:value)m", "12.5m"), List.of())
            .values()).containsExactly(12.5);
        assertThat(ScanLibrary.valueFromFilename().scan(depth, match("d%(depth:idx)", "d7"), List.of())
            .values()).containsExactly(7.0);
        assertThatThrownBy(() -> ScanLibrary.valueFromFilename()
            .scan(depth, match("d%(depth:text)", "dxx"), List.of()))
            .isInstanceOf(ScanException.class);
    }

    @Test
    void indexFromFilenameTagsPriorValues() {
        CoordScan depth = new CoordScan("fg", NumericCoordinate.of("depth"), true);
        FileMatch m = match("d%(depth:value)_i%(depth:idx)", "d12.5_i3");
        ScanResult result = ScanLibrary.indexFromFilename().scan(depth, m, List.of(12.5));
        assertThat(result.values()).containsExactly(12.5);
        assertThat(result.inIndices()).containsExactly(InFileIndex.of(3));

        ScanResult alone = ScanLibrary.indexFromFilename().scan(depth, m, List.of());
        assertThat(alone.values()).containsExactly(3.0);
    }

    @Test
    void stringsFromFilenames() {
        CoordScan var = new CoordScan("fg", VariableCoordinate.of(), true);
        assertThat(ScanLibrary.stringFromFilename().scan(var, match("%(var:text)_x", "sst_x"), List.of())
            .values()).containsExactly("sst");
    }

    @Test
    void registryLookups() {
        ScanFunctions functions = ScanFunctions.defaults();
        assertThat(functions.names()).contains("date_from_filename", "value_from_filename",
            "index_from_filename", "string_from_filename");
        assertThat(functions.get("date_from_filename")).isInstanceOf(FilenameScanner.class);
        assertThatThrownBy(() -> functions.get("nope")).isInstanceOf(ConfigException.class);
    }
}
