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
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SliceTest {

    @Test
    void zeroStepIsRejected() {
        assertThatThrownBy(() -> new Slice(0, 4, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @CsvSource({
        "2, 8, 1, 10, 6",
        "0, 10, 3, 10, 4",
        "-3, , 1, 10, 3",
        ", , -1, 4, 4",
        "5, 2, 1, 10, 0",
        "0, 100, 1, 10, 10"
    })
    void lengthAgainstAxis(Integer start, Integer stop, int step, int size, int expected) {
        assertThat(new Slice(start, stop, step).length(size)).isEqualTo(expected);
    }

    @Test
    void negativeStepRunsToTheStart() {
        assertThat(new Slice(null, null, -1).toIndices(4)).containsExactly(3, 2, 1, 0);
        assertThat(new Slice(5, 1, -2).toIndices(10)).containsExactly(5, 3);
    }

    @Test
    void negativeBoundsCountFromTheEnd() {
        assertThat(Slice.of(-3, null).toIndices(10)).containsExactly(7, 8, 9);
        assertThat(Slice.of(1, -1).toIndices(5)).containsExactly(1, 2, 3);
    }

    @Test
    void fromListStopsOnePastTheLastIndex() {
        assertThat(Slice.fromList(new int[]{0, 2, 4})).contains(new Slice(0, 5, 2));
        assertThat(Slice.fromList(new int[]{3, 4, 5, 6})).contains(new Slice(3, 7, 1));
    }

    @Test
    void fromListDescendingToZeroHasNoStop() {
        assertThat(Slice.fromList(new int[]{3, 2, 1, 0})).contains(new Slice(3, null, -1));
    }

    @Test
    void fromListRejectsIrregularLists() {
        assertThat(Slice.fromList(new int[]{1, 2, 4})).isEqualTo(Optional.empty());
        assertThat(Slice.fromList(new int[]{5})).isEmpty();
        assertThat(Slice.fromList(new int[]{-1, 0, 1})).isEmpty();
        assertThat(Slice.fromList(new int[]{2, 2})).isEmpty();
    }

    static Stream<int[]> regularLists() {
        return Stream.of(
            new int[]{0, 2, 4},
            new int[]{5, 7},
            new int[]{7, 5},
            new int[]{1, 0},
            new int[]{3, 2, 1, 0},
            new int[]{-1, -2, -3},
            new int[]{-3, -2, -1},
            new int[]{-2, -1},
            new int[]{-4, -6}
        );
    }

    @ParameterizedTest
    @MethodSource("regularLists")
    void regularListsSelectTheSameIndicesAsSlices(int[] list) {
        int size = 10;
        Slice slice = Slice.fromList(list).orElseThrow();
        int[] resolved = Arrays.stream(list).map(i -> i < 0 ? i + size : i).toArray();
        assertThat(slice.toIndices(size)).containsExactly(resolved);

        Key key = Key.of(list).withParentSize(size).simplify();
        assertThat(key.kind()).isEqualTo(Key.Kind.SLICE);
        assertThat(key.asArray()).containsExactly(resolved);
    }

    @Test
    void guessWorksWhenBoundsShareASign() {
        assertThat(Slice.of(2, 8).guessLength()).isEqualTo(6);
        assertThat(Slice.of(null, 4).guessIndices()).containsExactly(0, 1, 2, 3);
        assertThat(Slice.of(-3, -1).guessIndices()).containsExactly(-3, -2);
        assertThat(Slice.of(2, null).guessLength()).isNull();
        assertThat(Slice.all().guessLength()).isNull();
        assertThatThrownBy(() -> Slice.of(-2, 5).guessIndices()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void reverseOrderTakesTheSameIndicesBackwards() {
        Slice reversed = new Slice(0, 5, 2).reverseOrder(10);
        assertThat(reversed).isEqualTo(new Slice(4, null, -2));
        assertThat(reversed.toIndices(10)).containsExactly(4, 2, 0);
        assertThat(Slice.of(3, 4).reverseOrder(10)).isEqualTo(Slice.of(3, 4));
    }

    @Test
    void printOmitsDefaults() {
        assertThat(Slice.all().print()).isEqualTo(":");
        assertThat(new Slice(0, 5, 2).print()).isEqualTo("0:5:2");
        assertThat(new Slice(4, null, -1).print()).isEqualTo("4::-1");
        assertThat(Slice.all().isTotal()).isTrue();
        assertThat(Slice.of(0, null).isTotal()).isTrue();
        assertThat(Slice.of(1, null).isTotal()).isFalse();
    }
}
