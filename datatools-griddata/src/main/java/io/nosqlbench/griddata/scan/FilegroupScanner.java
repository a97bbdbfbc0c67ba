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

import io.nosqlbench.griddata.errors.ScanException;
import io.nosqlbench.griddata.events.EventSink;
import io.nosqlbench.griddata.events.GridEvent;
import io.nosqlbench.griddata.format.FileHandle;
import io.nosqlbench.griddata.format.FormatAdapter;
import io.nosqlbench.griddata.pregex.FileMatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Scans the files of a [Filegroup] and fills its [CoordScan]s.
///
/// Files that do not match the pre-regex, or cannot be opened, are skipped with
/// a warning. A file is opened only when some dimension reads its content, and
/// is always closed again. Scanning starts from scratch each time, so scanning
/// twice gives the same values.
public class FilegroupScanner {
    private static final Logger logger = LogManager.getLogger(FilegroupScanner.class);

    /// Scan every file of the filegroup, then finish each dimension.
    ///
    /// @param fg the filegroup
    /// @throws ScanException if no file matches, or a dimension cannot be finished
    public void scan(Filegroup fg) {
        EventSink sink = fg.sink();
        fg.reset();
        List<String> files = fg.findFiles();
        logger.debug("Scanning {} candidate files for filegroup {}", files.size(), fg.name());
        int matched = 0;
        for (String file : files) {
            Optional<FileMatch> match = fg.pregex().match(file);
            if (match.isEmpty()) {
                sink.log(GridEvent.FILE_SKIPPED, "filegroup", fg.name(), "file", file,
                    "reason", "does not match " + fg.pregex());
                continue;
            }
            matched++;
            fg.rememberSegments(match.get());
            if (fg.scans().stream().noneMatch(CoordScan::wantsFile)) {
                continue;
            }
            try {
                scanFile(fg, match.get());
            } catch (IOException e) {
                logger.debug("Cannot scan " + file, e);
                sink.log(GridEvent.FILE_SKIPPED, "filegroup", fg.name(), "file", file,
                    "reason", String.valueOf(e.getMessage()));
            }
        }
        if (matched == 0) {
            throw new ScanException(fg.name(), null, "No file under " + fg.root() + " matches " + fg.pregex());
        }
        for (CoordScan cs : fg.scans()) {
            cs.finishScan();
            logger.debug("Scanned {}", cs);
        }
    }

    /// A file either contributes to every dimension or to none.
    private void scanFile(Filegroup fg, FileMatch match) throws IOException {
        boolean open = fg.scans().stream().anyMatch(CoordScan::needsFile);
        FormatAdapter format = fg.format();
        FileHandle handle = open ? format.open(fg.resolve(match.file())) : null;
        Map<CoordScan, CoordScan.Checkpoint> checkpoints = new LinkedHashMap<>();
        try {
            for (CoordScan cs : fg.scans()) {
                checkpoints.put(cs, cs.checkpoint(match));
                cs.scanFile(match, handle);
            }
        } catch (IOException e) {
            checkpoints.forEach(CoordScan::rollback);
            throw e;
        } finally {
            if (handle != null) {
                format.close(handle);
            }
        }
    }
}
