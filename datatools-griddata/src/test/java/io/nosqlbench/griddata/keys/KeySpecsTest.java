package io.nosqlbench.griddata.keys;

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

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeySpecsTest {

    @Test
    void parsesIndices() {
        assertThat(KeySpecs.parse("3")).isEqualTo(Key.of(3));
        assertThat(KeySpecs.parse(" -1 ")).isEqualTo(Key.of(-1));
        assertThat(KeySpecs.parse("1,4,7")).isEqualTo(Key.of(1, 4, 7));
    }

    @Test
    void parsesSlices() {
        assertThat(KeySpecs.parse("2:10:2")).isEqualTo(Key.slice(2, 10, 2));
        assertThat(KeySpecs.parse(":")).isEqualTo(Key.all());
        assertThat(KeySpecs.parse("::-1")).isEqualTo(Key.slice(null, null, -1));
        assertThat(KeySpecs.parse("-5:")).isEqualTo(Key.slice(-5, null, 1));
    }

    @Test
    void parsesVariableNames() {
        assertThat(KeySpecs.parse("sst")).isEqualTo(Key.name("sst"));
        assertThat(KeySpecs.parse("sst, chl")).isEqualTo(Key.names(List.of("sst", "chl")));
        assertThat(KeySpecs.parse("sst:chl")).isEqualTo(Key.nameRange("sst", "chl"));
        assertThat(KeySpecs.parse("sst:")).isEqualTo(Key.nameRange("sst", null));
    }

    @Test
    void rejectsMixedLists() {
        assertThatThrownBy(() -> KeySpecs.parse("1,sst")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> KeySpecs.parse("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> KeySpecs.parse("1:2:3:4")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void buildsKeysFromYamlValues() {
        assertThat(KeySpecs.fromObject(4)).isEqualTo(Key.of(4));
        assertThat(KeySpecs.fromObject(List.of(1, 2))).isEqualTo(Key.of(1, 2));
        assertThat(KeySpecs.fromObject(List.of("sst"))).isEqualTo(Key.names(List.of("sst")));
        assertThat(KeySpecs.fromObject("0:4")).isEqualTo(Key.slice(0, 4, 1));
        assertThat(KeySpecs.fromObject(Map.of("start", 1, "step", 2))).isEqualTo(Key.slice(1, null, 2));
        assertThatThrownBy(() -> KeySpecs.fromObject(new Object()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
