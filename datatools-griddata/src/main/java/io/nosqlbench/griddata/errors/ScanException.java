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

/// Fatal scanning failure for one filegroup, such as no matching file, a
/// duplicated coordinate value, or values that stay non monotonic after sorting.
public class ScanException extends GridDataException {

    /// The filegroup being scanned
    private final String filegroup;

    /// The coordinate being scanned, or null when the failure is filegroup wide
    private final String coordinate;

    /// @param filegroup The filegroup name
    /// @param coordinate The coordinate name, may be null
    /// @param message The error message
    public ScanException(String filegroup, String coordinate, String message) {
        super(format(filegroup, coordinate, message));
        this.filegroup = filegroup;
        this.coordinate = coordinate;
    }

    /// @param filegroup The filegroup name
    /// @param coordinate The coordinate name, may be null
    /// @param message The error message
    /// @param cause The underlying cause
    public ScanException(String filegroup, String coordinate, String message, Throwable cause) {
        super(format(filegroup, coordinate, message), cause);
        this.filegroup = filegroup;
        this.coordinate = coordinate;
    }

    /// @return the name of the filegroup that failed
    public String getFilegroup() {
        return filegroup;
    }

    /// @return the name of the coordinate that failed, or null
    public String getCoordinate() {
        return coordinate;
    }

    private static String format(String filegroup, String coordinate, String message) {
        if (coordinate == null) {
            return "[" + filegroup + "] " + message;
        }
        return "[" + filegroup + "/" + coordinate + "] " + message;
    }
}
