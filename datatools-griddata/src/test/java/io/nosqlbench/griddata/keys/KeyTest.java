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


import io.nosqlbench.griddata.coords.VariableCoordinate;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeyTest {

    @Nested
    class Shapes {
        @Test
        void integerKeysSqueeze() {
            assertThat(Key.of(3).shape()).isZero();
            assertThat(Key.none().shape()).isZero();
        }

        @Test
        void listAndSliceShapes() {
            assertThat(Key.of(1, 2, 3).shape()).isEqualTo(3);
            assertThat(Key.slice(0, 10, 2).shape()).isEqualTo(5);
            assertThat(Key.all().shape()).isNull();
            assertThat(Key.all().withParentSize(7).shape()).isEqualTo(7);
        }

        @Test
        void parentSizeDoesNotTakePartInEquality() {
            assertThat(Key.all().withParentSize(7)).isEqualTo(Key.all());
        }
    }

    @Nested
    class Composition {
        @Test
        void sliceThenList() {
            Key composed = Key.slice(2, 10, 1).compose(Key.of(1, 3));
            assertThat(composed).isEqualTo(Key.of(3, 5));
        }

        @Test
        void sliceThenIntegerGivesInteger() {
            assertThat(Key.slice(0, 10, 2).compose(Key.of(1))).isEqualTo(Key.of(2));
        }

        @Test
        void sliceThenSliceStaysASlice() {
            Key composed = Key.slice(0, 20, 2).compose(Key.slice(1, 5, 1));
            assertThat(composed.kind()).isEqualTo(Key.Kind.SLICE);
            assertThat(composed.asArray()).containsExactly(2, 4, 6, 8);
        }

        @Test
        void sliceThenSliceOfOneElementStaysASlice() {
            Key composed = Key.slice(0, 20, 2).compose(Key.slice(2, 3, 1));
            assertThat(composed.kind()).isEqualTo(Key.Kind.SLICE);
            assertThat(composed.slice()).isEqualTo(new Slice(4, 5, 1));
            assertThat(composed.asArray()).containsExactly(4);
        }

        @Test
        void sliceThenEmptySliceStaysASlice() {
            Key composed = Key.slice(0, 20, 2).compose(Key.slice(5, 5, 1));
            assertThat(composed.kind()).isEqualTo(Key.Kind.SLICE);
            assertThat(composed.shape()).isZero();
        }

        @Test
        void totalSliceIsNeutral() {
            Key list = Key.of(4, 1, 7);
            assertThat(Key.all().compose(list)).isEqualTo(list);
            assertThat(list.compose(Key.all())).isEqualTo(list);
        }

        @Test
        void stringKeysCannotRestrictIndices() {
            assertThatThrownBy(() -> Key.of(1, 2).compose(Key.name("sst")))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    void concatenationSimplifiesSlices() {
        assertThat(Key.of(0, 1).concat(Key.of(5))).isEqualTo(Key.of(0, 1, 5));
        assertThat(Key.slice(0, 3, 1).concat(Key.slice(3, 6, 1))).isEqualTo(Key.slice(0, 6, 1));
    }

    @Test
    void resolveCountsNegativeIndicesFromTheEnd() {
        assertThat(Key.of(-1).resolve(5).index()).isEqualTo(4);
        assertThat(Key.of(-1, 0, 2).resolve(5).indices()).containsExactly(4, 0, 2);
        assertThat(Key.of(-1).resolve(5).parentSize()).isEqualTo(5);
        assertThat(Key.slice(-2, null, 1).resolve(5).asArray()).containsExactly(3, 4);
    }

    @Test
    void resolveRejectsIndicesOutsideTheAxis() {
        assertThatThrownBy(() -> Key.of(5).resolve(5)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> Key.of(0, -6).resolve(5))
            .isInstanceOf(IndexOutOfBoundsException.class)
            .hasMessageContaining("-6");
    }

    @Test
    void mirrorMapsIndicesAcrossTheAxis() {
        assertThat(Key.of(0, 1).mirror(5)).isEqualTo(Key.of(4, 3));
        assertThat(Key.of(-1).mirror(5)).isEqualTo(Key.of(0));
        assertThat(Key.slice(0, 3, 1).mirror(5).asArray()).containsExactly(4, 3, 2);
    }

    @Test
    void reverseAndSort() {
        assertThat(Key.of(1, 2, 3).reverseOrder()).isEqualTo(Key.of(3, 2, 1));
        assertThat(Key.of(3, 1, 3, 2).sortedUnique()).isEqualTo(Key.of(1, 2, 3));
        assertThat(Key.slice(4, null, -2).withParentSize(10).sortedUnique().asArray())
            .containsExactly(0, 2, 4);
    }

    @Test
    void intAndSingletonListConvert() {
        assertThat(Key.of(4).intToList()).isEqualTo(Key.of(new int[]{4}));
        assertThat(Key.of(new int[]{4}).listToInt()).isEqualTo(Key.of(4));
        assertThat(Key.of(4, 5).listToInt()).isEqualTo(Key.of(4, 5));
    }

    @Test
    void applySelectsFromASequence() {
        List<String> seq = List.of("a", "b", "c", "d");
        assertThat(Key.of(1, 3).apply(seq)).containsExactly("b", "d");
        assertThat(Key.slice(null, null, -1).apply(seq)).containsExactly("d", "c", "b", "a");
        assertThat(Key.of(-1).apply(seq)).containsExactly("d");
    }

    @Nested
    class Variables {
        private final VariableCoordinate vars = VariableCoordinate.of("sst", "chl", "sss", "wind");

        @Test
        void namesBecomeIndices() {
            assertThat(Key.name("sss").toIndices(vars)).isEqualTo(Key.of(2));
            assertThat(Key.names(List.of("wind", "sst")).toIndices(vars)).isEqualTo(Key.of(3, 0));
            assertThat(Key.nameRange("chl", "wind").toIndices(vars).asArray()).containsExactly(1, 2, 3);
            assertThat(Key.nameRange(null, "chl").toIndices(vars).asArray()).containsExactly(0, 1);
        }

        @Test
        void indicesBecomeNames() {
            assertThat(Key.of(1).toNames(vars)).isEqualTo(Key.name("chl"));
            assertThat(Key.slice(0, 2, 1).toNames(vars)).isEqualTo(Key.names(List.of("sst", "chl")));
        }

        @Test
        void unknownNameFails() {
            assertThatThrownBy(() -> Key.name("ice").toIndices(vars))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ice");
        }

        @Test
        void stringKeysRefuseIndexAccess() {
            assertThat(Key.name("sst").isString()).isTrue();
            assertThatThrownBy(() -> Key.name("sst").asArray()).isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    void printShortensLongLists() {
        assertThat(Key.of(1, 2, 3).print()).isEqualTo("[1, 2, 3]");
        assertThat(Key.of(1, 2, 3, 4, 5, 6, 7).print()).isEqualTo("[1, 2, ..., 6, 7]");
        assertThat(Key.none().print()).isEqualTo("None");
    }
}
