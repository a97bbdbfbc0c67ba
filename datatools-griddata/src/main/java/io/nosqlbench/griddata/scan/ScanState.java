package io.nosqlbench.griddata.scan;

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

/// Lifecycle of a [CoordScan]
public enum ScanState {
    /// Nothing scanned yet
    UNSCANNED,
    /// Files are being scanned
    SCANNING,
    /// Values are final, sorted and checked
    SCANNED,
    /// Values were given by hand and are never rescanned
    MANUALLY_SET
}
