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

/// Raised for malformed pre-regexes, unknown matcher elements, and inconsistent
/// dimension declarations. Always raised before any file is opened.
public class ConfigException extends GridDataException {

    /// @param message The error message
    public ConfigException(String message) {
        super(message);
    }

    /// @param message The error message
    /// @param cause The underlying cause
    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
