package io.nosqlbench.griddata.coords;

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


import io.nosqlbench.griddata.errors.ConfigException;
import io.nosqlbench.griddata.keys.Key;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CoordinatesTest {

    @Test
    void lookupWithinTolerance() {
        NumericCoordinate lat = new NumericCoordinate("lat", "degrees_north", List.of("latitude"), 0.01,
            new double[]{-10, -5, 0, 5, 10});
        assertThat(lat.indexOfExact(5.004)).isEqualTo(3);
        assertThat(lat.indexOfExact(5.1)).isEqualTo(-1);
        assertThat(lat.indexOfExact("5")).isEqualTo(-1);
        assertThat(lat.indexOf(1.0, Coordinate.Locate.CLOSEST)).isEqualTo(2);
        assertThat(lat.indexOf(1.0, Coordinate.Locate.ABOVE)).isEqualTo(3);
        assertThat(lat.indexOf(1.0, Coordinate.Locate.BELOW)).isEqualTo(2);
        assertThat(lat.indexOf(50, Coordinate.Locate.ABOVE)).isEqualTo(4);
    }

    @Test
    void subsetIncludesBothBounds() {
        NumericCoordinate depth = NumericCoordinate.of("depth", 0, 1, 2, 3, 4);
        Key key = depth.subset(1, 3);
        assertThat(key.asArray()).containsExactly(1, 2, 3);
        assertThat(key.parentSize()).isEqualTo(5);
    }

    @Test
    void subsetOfDescendingValuesIsDescending() {
        NumericCoordinate lat = NumericCoordinate.of("lat", 4, 3, 2, 1, 0);
        assertThat(lat.isDescending()).isTrue();
        Key key = lat.subset(1, 3);
        assertThat(key.slice().step()).isEqualTo(-1);
        assertThat(key.apply(lat.values())).containsExactly(1.0, 2.0, 3.0);
    }

    @Test
    void regularity() {
        assertThat(NumericCoordinate.of("x", 0, 0.5, 1, 1.5).isRegular()).isTrue();
        assertThat(NumericCoordinate.of("x", 0, 0.5, 2).isRegular()).isFalse();
    }

    @Test
    void withValuesKeepsMetadata() {
        TimeCoordinate time = TimeCoordinate.empty("time", "days since 2000-01-01");
        TimeCoordinate filled = time.withValues(List.of(0.0, 1.0, 2.0));
        assertThat(filled.size()).isEqualTo(3);
        assertThat(filled.units()).isEqualTo("days since 2000-01-01");
        assertThat(filled.dateOf(2)).isEqualTo(LocalDateTime.of(2000, 1, 3, 0, 0));
        assertThat(filled.format(1.0)).isEqualTo("2000-01-02 00:00:00");
        assertThat(filled.extentString()).isEqualTo("2000-01-01 00:00:00 - 2000-01-03 00:00:00");
        assertThat(filled.subsetDates(LocalDateTime.of(2000, 1, 2, 0, 0), LocalDateTime.of(2000, 1, 9, 0, 0))
            .asArray()).containsExactly(1, 2);
    }

    @Test
    void onlyTimeCoordinatesConvertUnits() {
        TimeCoordinate time = TimeCoordinate.empty("time", "days since 2000-01-01");
        assertThat(time.convertUnits(new double[]{2}, "days since 2000-01-01", "hours since 2000-01-01"))
            .containsExactly(48);
        assertThatThrownBy(() -> NumericCoordinate.of("depth").convertUnits(new double[]{1}, "m", "km"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void variablesKeepTheirOrder() {
        VariableCoordinate vars = VariableCoordinate.of("sst", "chl");
        assertThat(vars.isString()).isTrue();
        assertThat(vars.nameOf(-1)).isEqualTo("chl");
        assertThat(vars.withValues(List.of("u", "v", "sst")).names()).containsExactly("u", "v", "sst");
    }

    @Test
    void registryResolvesAlternateNames() {
        CoordinateRegistry registry = new CoordinateRegistry()
            .register(new NumericCoordinate("lat", "", List.of("latitude", "y"), 1e-5, null))
            .register(NumericCoordinate.of("lon"));
        assertThat(registry.get("latitude").name()).isEqualTo("lat");
        assertThat(registry.dims()).containsExactly("lat", "lon");
        assertThat(registry.find("depth")).isEmpty();
        assertThatThrownBy(() -> registry.get("depth")).isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> registry.register(NumericCoordinate.of("y")))
            .isInstanceOf(ConfigException.class);
    }
}
