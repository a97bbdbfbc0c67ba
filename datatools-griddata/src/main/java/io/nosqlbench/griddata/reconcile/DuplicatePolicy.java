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

/// What to do when two filegroups hold data for the same points
public enum DuplicatePolicy {
    /// Fail the reconciliation
    REJECT,
    /// Warn, and let the later filegroup overwrite the earlier one when loading
    WARN
}
