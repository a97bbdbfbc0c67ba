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

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/// Every read to do in one file.
///
/// @param filegroup the filegroup holding the file
/// @param file the file name, relative to the filegroup root
/// @param path the file path
/// @param keys the reads, done in order with the file open once
public record LoadCommand(String filegroup, String file, Path path, List<CommandKey> keys) {

    /// Copies the list
    public LoadCommand {
        keys = List.copyOf(keys);
    }

    @Override
    public String toString() {
        return filegroup + ":" + file + keys.stream().map(k -> "\n  " + k).collect(Collectors.joining());
    }
}
