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

import io.nosqlbench.griddata.keys.Keyring;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/// Raised once a load has run every command it could, when some requested values
/// could only come from files that failed to open or read.
public class LoadException extends GridDataException {

    /// One file that failed, together with the destination region it should have filled.
    ///
    /// @param file The file that could not be read
    /// @param memory The destination keyring the failed read was meant for
    /// @param cause The failure raised at the adapter boundary
    public record FileFailure(Path file, Keyring memory, Throwable cause) {
        @Override
        public String toString() {
            return file + " -> " + memory.print() + ": " + cause.getMessage();
        }
    }

    private final List<FileFailure> failures;

    /// @param message The error message
    /// @param failures The unrecovered failures
    public LoadException(String message, List<FileFailure> failures) {
        super(message + "\n" + failures.stream().map(FileFailure::toString)
            .collect(Collectors.joining("\n")),
            failures.isEmpty() ? null : failures.get(0).cause());
        this.failures = List.copyOf(failures);
    }

    /// @param message The error message
    public LoadException(String message) {
        super(message);
        this.failures = List.of();
    }

    /// @param message The error message
    /// @param cause The underlying cause
    public LoadException(String message, Throwable cause) {
        super(message, cause);
        this.failures = List.of();
    }

    /// @return the files whose failure left requested values unsatisfied
    public List<FileFailure> getFailures() {
        return failures;
    }
}
