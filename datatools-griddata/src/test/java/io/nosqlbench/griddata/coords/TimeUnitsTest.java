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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TimeUnitsTest {

    @ParameterizedTest
    @ValueSource(strings = {
        "days since 1950-01-01",
        "hours since 2000-01-01 12:00:00",
        "seconds since 1970-1-1T00:00:00Z",
        "Minutes since 2010-06-15 06:30"
    })
    void recognizesCfUnits(String units) {
        assertThat(TimeUnits.isTimeUnits(units)).isTrue();
    }

    @Test
    void rejectsOtherUnits() {
        assertThat(TimeUnits.isTimeUnits("degrees_north")).isFalse();
        assertThat(TimeUnits.isTimeUnits(null)).isFalse();
        assertThatThrownBy(() -> TimeUnits.parse("weeks since 2000-01-01")).isInstanceOf(ConfigException.class);
    }

    @Test
    void datesAndValues() {
        TimeUnits days = TimeUnits.parse("days since 1950-01-01");
        assertThat(days.seconds()).isEqualTo(86400);
        assertThat(days.valueOf(LocalDateTime.of(1950, 1, 2, 12, 0))).isCloseTo(1.5, within(1e-9));
        assertThat(days.dateOf(31)).isEqualTo(LocalDateTime.of(1950, 2, 1, 0, 0));

        TimeUnits hours = TimeUnits.parse("hours since 2000-01-01 12:00:00");
        assertThat(hours.dateOf(12)).isEqualTo(LocalDateTime.of(2000, 1, 2, 0, 0));
        assertThat(hours.valueOf(LocalDateTime.of(2000, 1, 1, 0, 0))).isCloseTo(-12, within(1e-9));
    }

    @Test
    void conversionShiftsAndScales() {
        TimeUnits days1950 = TimeUnits.parse("days since 1950-01-01");
        TimeUnits hours1950 = TimeUnits.parse("hours since 1950-01-01");
        TimeUnits days1951 = TimeUnits.parse("days since 1951-01-01");
        assertThat(days1950.convert(new double[]{1, 2}, hours1950)).containsExactly(24, 48);
        assertThat(days1950.convert(new double[]{365}, days1951)).containsExactly(0);
    }
}
