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

/// Base type of every error raised by the grid data core.
///
/// All subtypes are unchecked, so callers decide where to handle them. Adapter
/// level I/O failures are carried as the cause.
public class GridDataException extends RuntimeException {

    /// Creates a new exception with a message.
    /// @param message The error message
    public GridDataException(String message) {
        super(message);
    }

    /// Creates a new exception with a message and a cause.
    /// @param message The error message
    /// @param cause The underlying cause
    public GridDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
