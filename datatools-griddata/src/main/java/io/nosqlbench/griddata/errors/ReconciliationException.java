package io.nosqlbench.griddata.errors;

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

/// Dataset level failure while merging the scanned values of several filegroups.
public class ReconciliationException extends GridDataException {

    private final String dimension;

    /// @param dimension The dimension being reconciled, may be null
    /// @param message The error message
    public ReconciliationException(String dimension, String message) {
        super(dimension == null ? message : "'" + dimension + "': " + message);
        this.dimension = dimension;
    }

    /// @return the dimension that could not be reconciled, or null
    public String getDimension() {
        return dimension;
    }
}
