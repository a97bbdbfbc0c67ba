package io.nosqlbench.griddata.array;

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


import io.nosqlbench.griddata.keys.AccessStrategy;
import io.nosqlbench.griddata.keys.Key;
import io.nosqlbench.griddata.keys.Keyring;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArrayAccessorTest {

    private static GridArray range(int... shape) {
        double[] values = new double[GridArray.zeros(shape).size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = i;
        }
        return GridArray.of(values, shape);
    }

    @Test
    void integerKeysSqueeze() {
        GridArray out = ArrayAccessor.take(range(3, 4), Keyring.of("y", Key.of(1), "x", Key.slice(1, 3, 1)));
        assertThat(out.shape()).containsExactly(2);
        assertThat(out.toArray()).containsExactly(5, 6);
    }

    @Test
    void regularListsBecomeSlices() {
        Keyring kr = Keyring.of("y", Key.of(2, 0), "x", Key.of(3, 1));
        assertThat(kr.simplify().accessStrategy()).isEqualTo(AccessStrategy.DIRECT);
        assertThat(ArrayAccessor.take(range(3, 4), kr).toArray()).containsExactly(11, 9, 3, 1);
    }

    @Test
    void severalIrregularListsUseCompoundAccess() {
        Keyring kr = Keyring.of("y", Key.of(2, 0, 1), "x", Key.of(0, 3, 1));
        assertThat(kr.accessStrategy()).isEqualTo(AccessStrategy.COMPOUND);
        GridArray out = ArrayAccessor.take(range(3, 4), kr);
        assertThat(out.shape()).containsExactly(3, 3);
        assertThat(out.toArray()).containsExactly(8, 11, 9, 0, 3, 1, 4, 7, 5);
    }

    @Test
    void placeWithListAndInteger() {
        GridArray dest = GridArray.zeros(3, 4);
        ArrayAccessor.place(dest, Keyring.of("y", Key.of(1), "x", Key.of(0, 3, 1)),
            GridArray.of(new double[]{10, 20, 30}, 3));
        assertThat(dest.get(1, 0)).isEqualTo(10.0);
        assertThat(dest.get(1, 3)).isEqualTo(20.0);
        assertThat(dest.get(1, 1)).isEqualTo(30.0);
        assertThat(dest.get(0, 0)).isZero();
    }

    @Test
    void placeWithOneListAndSlice() {
        GridArray dest = GridArray.zeros(3, 4);
        ArrayAccessor.place(dest, Keyring.of("y", Key.of(2, 0, 1), "x", Key.slice(1, 3, 1)),
            GridArray.of(new double[]{1, 2, 3, 4, 5, 6}, 3, 2));
        assertThat(dest.get(2, 1)).isEqualTo(1.0);
        assertThat(dest.get(2, 2)).isEqualTo(2.0);
        assertThat(dest.get(0, 1)).isEqualTo(3.0);
        assertThat(dest.get(1, 2)).isEqualTo(6.0);
    }

    @Test
    void placeRejectsMismatchedChunks() {
        GridArray dest = GridArray.zeros(3, 4);
        Keyring kr = Keyring.of("y", Key.of(2, 0, 1), "x", Key.slice(1, 3, 1));
        assertThatThrownBy(() -> ArrayAccessor.place(dest, kr, GridArray.zeros(2, 2)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void keyringMustMatchRankAndHoldIndices() {
        assertThatThrownBy(() -> ArrayAccessor.take(range(3, 4), Keyring.of("y", Key.of(1))))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ArrayAccessor.take(range(3, 4), Keyring.of("y", Key.name("sst"), "x", Key.all())))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
