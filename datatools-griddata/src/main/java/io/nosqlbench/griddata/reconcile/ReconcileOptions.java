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

/// Options of a [Reconciler].
///
/// @param mode how values are combined
/// @param duplicates what to do with filegroups holding the same points
public record ReconcileOptions(ReconciliationMode mode, DuplicatePolicy duplicates) {

    /// @return intersection of values, duplicates rejected
    public static ReconcileOptions defaults() {
        return new ReconcileOptions(ReconciliationMode.DEFAULT, DuplicatePolicy.REJECT);
    }

    /// @param mode how values are combined
    /// @return a copy with this mode
    public ReconcileOptions withMode(ReconciliationMode mode) {
        return new ReconcileOptions(mode, duplicates);
    }

    /// @param duplicates what to do with duplicated points
    /// @return a copy with this policy
    public ReconcileOptions withDuplicates(DuplicatePolicy duplicates) {
        return new ReconcileOptions(mode, duplicates);
    }
}
