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


import io.nosqlbench.griddata.errors.LoadException;
import io.nosqlbench.griddata.keys.Key;
import io.nosqlbench.griddata.keys.Keyring;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandMergerTest {

    private static CommandKey read(int time, int depth, int memTime, int memDepth) {
        return new CommandKey(
            Keyring.of("time", Key.of(time), "depth", Key.of(depth)),
            Keyring.of("time", Key.of(memTime), "depth", Key.of(memDepth)));
    }

    @Test
    void stridedReadsBecomeOneSlice() {
        List<CommandKey> merged = CommandMerger.merge(List.of(read(0, 0, 0, 0), read(2, 0, 1, 0), read(4, 0, 2, 0)));
        assertThat(merged).hasSize(1);
        CommandKey ck = merged.get(0);
        assertThat(ck.inFile().get("time")).isEqualTo(Key.slice(0, 5, 2));
        assertThat(ck.inFile().get("depth")).isEqualTo(Key.of(0));
        assertThat(ck.memory().get("time")).isEqualTo(Key.slice(0, 3, 1));
        assertThat(ck.memory().get("depth")).isEqualTo(Key.of(0));
    }

    @Test
    void inputOrderDoesNotMatter() {
        List<CommandKey> ordered = CommandMerger.merge(List.of(read(0, 0, 0, 0), read(2, 0, 1, 0), read(4, 0, 2, 0)));
        List<CommandKey> shuffled = CommandMerger.merge(List.of(read(4, 0, 2, 0), read(0, 0, 0, 0), read(2, 0, 1, 0)));
        assertThat(shuffled).isEqualTo(ordered);
    }

    @Test
    void dimensionsAreMergedOneAfterTheOther() {
        List<CommandKey> merged = CommandMerger.merge(List.of(
            read(0, 0, 0, 0), read(1, 0, 1, 0), read(0, 1, 0, 1), read(1, 1, 1, 1)));
        assertThat(merged).hasSize(1);
        assertThat(merged.get(0).inFile().get("time")).isEqualTo(Key.slice(0, 2, 1));
        assertThat(merged.get(0).inFile().get("depth")).isEqualTo(Key.slice(0, 2, 1));
    }

    @Test
    void irregularListsStayLists() {
        List<CommandKey> merged = CommandMerger.merge(List.of(read(0, 0, 0, 0), read(1, 0, 1, 0), read(5, 0, 2, 0)));
        assertThat(merged).hasSize(1);
        assertThat(merged.get(0).inFile().get("time")).isEqualTo(Key.of(0, 1, 5));
        assertThat(merged.get(0).memory().get("time")).isEqualTo(Key.slice(0, 3, 1));
    }

    @Test
    void slicesAreNotMerged() {
        CommandKey a = new CommandKey(Keyring.of("lat", Key.slice(0, 2, 1)), Keyring.of("lat", Key.slice(0, 2, 1)));
        CommandKey b = new CommandKey(Keyring.of("lat", Key.slice(4, 6, 1)), Keyring.of("lat", Key.slice(2, 4, 1)));
        assertThat(CommandMerger.merge(List.of(a, b))).hasSize(2);
    }

    @Test
    void absentDimensionsCannotHoldSeveralValues() {
        CommandKey a = new CommandKey(Keyring.of("time", Key.none()), Keyring.of("time", Key.of(0)));
        CommandKey b = new CommandKey(Keyring.of("time", Key.none()), Keyring.of("time", Key.of(1)));
        assertThat(CommandMerger.merge(List.of(a))).containsExactly(a);
        assertThatThrownBy(() -> CommandMerger.merge(List.of(a, b)))
            .isInstanceOf(LoadException.class)
            .hasMessageContaining("no 'time' dimension");
    }

    @Test
    void nothingToMerge() {
        assertThat(CommandMerger.merge(List.of())).isEmpty();
    }
}
