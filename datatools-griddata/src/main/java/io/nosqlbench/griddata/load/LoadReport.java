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

import io.nosqlbench.griddata.array.ArrayAccessor;
import io.nosqlbench.griddata.array.GridArray;
import io.nosqlbench.griddata.errors.LoadException;
import io.nosqlbench.griddata.errors.LoadException.FileFailure;
import io.nosqlbench.griddata.keys.Keyring;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// What a load did: reads done, failures, and which part of the destination was
/// filled.
public class LoadReport {
    private final GridArray covered;
    private final List<FileFailure> failures = new ArrayList<>();
    private int filesOpened;
    private int reads;

    /// @param shape the destination shape
    public LoadReport(int... shape) {
        this.covered = GridArray.zeros(shape);
    }

    /// @param memory the destination region filled by a successful read
    public void succeeded(Keyring memory) {
        reads++;
        GridArray region = ArrayAccessor.take(covered, memory);
        region.fill(1.0);
        ArrayAccessor.place(covered, memory, region);
    }

    /// @param file the file that failed
    /// @param memory the destination region it should have filled
    /// @param cause the failure
    public void failed(Path file, Keyring memory, Throwable cause) {
        failures.add(new FileFailure(file, memory, cause));
    }

    void opened() {
        filesOpened++;
    }

    /// @return number of files opened
    public int filesOpened() {
        return filesOpened;
    }

    /// @return number of successful reads
    public int reads() {
        return reads;
    }

    /// @return every failure, recovered or not
    public List<FileFailure> failures() {
        return List.copyOf(failures);
    }

    /// @return failures whose destination region no successful read filled
    public List<FileFailure> unsatisfied() {
        List<FileFailure> out = new ArrayList<>();
        for (FileFailure f : failures) {
            double[] region = ArrayAccessor.take(covered, f.memory()).toArray();
            if (Arrays.stream(region).anyMatch(v -> v == 0.0)) {
                out.add(f);
            }
        }
        return out;
    }

    /// @throws LoadException if some requested values could not be read from any file
    public void throwIfUnsatisfied() {
        List<FileFailure> missing = unsatisfied();
        if (!missing.isEmpty()) {
            throw new LoadException(missing.size() + " reads failed and no other file provided their values",
                missing);
        }
    }

    @Override
    public String toString() {
        return "opened " + filesOpened + " files, " + reads + " reads, " + failures.size() + " failures";
    }
}
