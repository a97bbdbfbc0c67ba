package io.nosqlbench.griddata.reconcile;

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


import io.nosqlbench.griddata.coords.CoordinateRegistry;
import io.nosqlbench.griddata.coords.NumericCoordinate;
import io.nosqlbench.griddata.coords.VariableCoordinate;
import io.nosqlbench.griddata.errors.ReconciliationException;
import io.nosqlbench.griddata.events.GridEvent;
import io.nosqlbench.griddata.events.MemoryEventSink;
import io.nosqlbench.griddata.format.MemoryFormatAdapter;
import io.nosqlbench.griddata.scan.CoordScan;
import io.nosqlbench.griddata.scan.Filegroup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReconcilerTest {

    private CoordinateRegistry registry;
    private MemoryEventSink sink;

    @BeforeEach
    void setUp() {
        registry = new CoordinateRegistry()
            .register(NumericCoordinate.empty("time", "days since 2007-01-01"))
            .register(NumericCoordinate.of("lat", 10, 20));
        sink = new MemoryEventSink();
    }

    /// A filegroup whose dimensions are all in-file, with values set by hand.
    private Filegroup filegroup(String name, Map<String, List<?>> values) {
        Filegroup.Builder b = Filegroup.builder(name)
            .root(Path.of("."))
            .format(new MemoryFormatAdapter())
            .pregex("data\\.nc");
        registry.all().forEach(b::in);
        Filegroup fg = b.build();
        values.forEach((dim, v) -> fg.scan(dim).setManual(v, null));
        fg.scans().forEach(CoordScan::finishScan);
        return fg;
    }

    private Reconciler reconciler(ReconcileOptions options) {
        return new Reconciler(options, sink);
    }

    @Test
    void defaultModeKeepsCommonValues() {
        Filegroup a = filegroup("a", Map.of("time", List.of(0.0, 1.0, 2.0, 3.0)));
        Filegroup b = filegroup("b", Map.of("time", List.of(2.0, 3.0, 4.0)));

        AvailableSpace space = reconciler(ReconcileOptions.defaults().withDuplicates(DuplicatePolicy.WARN))
            .reconcile(registry, List.of(a, b));

        assertThat(space.dims()).containsExactly("time", "lat");
        assertThat(space.coordinate("time").values()).containsExactly(2.0, 3.0);
        assertThat(space.coordinate("lat").values()).containsExactly(10.0, 20.0);
        assertThat(space.contains("a", "time")).containsExactly(2, 3);
        assertThat(space.contains("b", "time")).containsExactly(0, 1);
        assertThat(space.contains("a", "lat")).containsExactly(0, 1);
        assertThat(space.sizes()).containsEntry("time", 2).containsEntry("lat", 2);

        assertThat(sink.getEventsByType(GridEvent.COORD_TRIMMED)).hasSize(2)
            .anySatisfy(p -> assertThat(p).containsEntry("filegroup", "a")
                .containsEntry("before", 4).containsEntry("after", 2));
        assertThat(sink.hasEvent(GridEvent.DUPLICATE_TOLERATED)).isTrue();
    }

    @Test
    void duplicatePointsAreRejected() {
        Filegroup a = filegroup("a", Map.of("time", List.of(0.0, 1.0)));
        Filegroup b = filegroup("b", Map.of("time", List.of(1.0, 2.0)));
        assertThatThrownBy(() -> reconciler(ReconcileOptions.defaults()).reconcile(registry, List.of(a, b)))
            .isInstanceOf(ReconciliationException.class)
            .hasMessageContaining("same points");
    }

    @Test
    void advancedModeKeepsEveryValue() {
        Filegroup a = filegroup("a", Map.of("time", List.of(0.0, 1.0)));
        Filegroup b = filegroup("b", Map.of("time", List.of(2.0, 3.0)));

        AvailableSpace space = reconciler(ReconcileOptions.defaults().withMode(ReconciliationMode.ADVANCED))
            .reconcile(registry, List.of(a, b));

        assertThat(space.coordinate("time").values()).containsExactly(0.0, 1.0, 2.0, 3.0);
        assertThat(space.contains("a", "time")).containsExactly(0, 1, -1, -1);
        assertThat(space.contains("b", "time")).containsExactly(-1, -1, 0, 1);
        assertThat(space.filegroups()).containsExactly("a", "b");
    }

    @Test
    void disjointValuesHaveNothingInCommon() {
        Filegroup a = filegroup("a", Map.of("time", List.of(0.0, 1.0)));
        Filegroup b = filegroup("b", Map.of("time", List.of(2.0, 3.0)));
        assertThatThrownBy(() -> reconciler(ReconcileOptions.defaults()).reconcile(registry, List.of(a, b)))
            .isInstanceOf(ReconciliationException.class)
            .hasMessageContaining("no value in common");
    }

    @Test
    void largestToleranceWins() {
        Filegroup a = filegroup("a", Map.of("time", List.of(0.0, 1.0)));
        a.scan("time").setTolerance(0.1);
        Filegroup b = filegroup("b", Map.of("time", List.of(0.05, 1.05)));

        AvailableSpace space = reconciler(ReconcileOptions.defaults().withDuplicates(DuplicatePolicy.WARN))
            .reconcile(registry, List.of(a, b));

        assertThat(space.tolerance("time")).isEqualTo(0.1);
        assertThat(space.coordinate("time").values()).containsExactly(0.0, 1.0);
        assertThat(space.contains("b", "time")).containsExactly(0, 1);
        assertThat(sink.getEventsByType(GridEvent.TOLERANCE_USED))
            .anySatisfy(p -> assertThat(p).containsEntry("tolerance", 0.1));
    }

    @Test
    void emptyScansInheritTheOthers() {
        Filegroup a = filegroup("a", Map.of("time", List.of(0.0, 1.0)));
        Filegroup c = filegroup("c", Map.of());

        AvailableSpace space = reconciler(ReconcileOptions.defaults().withDuplicates(DuplicatePolicy.WARN))
            .reconcile(registry, List.of(a, c));

        assertThat(space.coordinate("time").values()).containsExactly(0.0, 1.0);
        assertThat(space.contains("c", "time")).containsExactly(0, 1);
    }

    @Test
    void dimensionsWithoutValuesFail() {
        registry.register(NumericCoordinate.empty("depth", "m"));
        Filegroup a = filegroup("a", Map.of("time", List.of(0.0)));
        assertThatThrownBy(() -> reconciler(ReconcileOptions.defaults()).reconcile(registry, List.of(a)))
            .isInstanceOf(ReconciliationException.class)
            .hasMessageContaining("No values were scanned or declared");
    }

    @Test
    void variablesAreAlwaysMerged() {
        registry = new CoordinateRegistry().register(VariableCoordinate.of());
        Filegroup a = filegroup("a", Map.of("var", List.of("sst", "chl")));
        Filegroup b = filegroup("b", Map.of("var", List.of("chl", "ssh")));

        AvailableSpace space = reconciler(ReconcileOptions.defaults().withDuplicates(DuplicatePolicy.WARN))
            .reconcile(registry, List.of(a, b));

        assertThat(space.coordinate("var").values()).containsExactly("sst", "chl", "ssh");
        assertThat(space.contains("a", "var")).containsExactly(0, 1, -1);
        assertThat(space.contains("b", "var")).containsExactly(-1, 0, 1);
    }
}
