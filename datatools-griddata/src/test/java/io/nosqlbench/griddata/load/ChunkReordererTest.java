package io.nosqlbench.griddata.load;

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


import io.nosqlbench.griddata.array.GridArray;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkReordererTest {

    private final GridArray chunk = GridArray.fromNested(new double[][]{{1, 2}, {3, 4}, {5, 6}});

    @Test
    void axesFollowTheDestination() {
        GridArray out = ChunkReorderer.reorder(chunk, List.of("lat", "time"), List.of("time", "depth", "lat"));
        assertThat(out.shape()).containsExactly(2, 1, 3);
        assertThat(out.get(0, 0, 0)).isEqualTo(1.0);
        assertThat(out.get(1, 0, 0)).isEqualTo(2.0);
        assertThat(out.get(0, 0, 2)).isEqualTo(5.0);
        assertThat(out.get(1, 0, 1)).isEqualTo(4.0);
    }

    @Test
    void sameOrderIsUnchanged() {
        GridArray out = ChunkReorderer.reorder(chunk, List.of("lat", "time"), List.of("lat", "time"));
        assertThat(out.toArray()).containsExactly(1, 2, 3, 4, 5, 6);
    }

    @Test
    void mismatchedChunksAreRejected() {
        assertThatThrownBy(() -> ChunkReorderer.reorder(chunk, List.of("lat"), List.of("lat")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ChunkReorderer.reorder(chunk, List.of("lat", "lon"), List.of("lat", "time")))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
