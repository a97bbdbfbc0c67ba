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

import io.nosqlbench.griddata.coords.TimeCoordinate;
import io.nosqlbench.griddata.coords.TimeUnits;
import io.nosqlbench.griddata.errors.ScanException;
import io.nosqlbench.griddata.pregex.FileMatch;

import java.time.LocalDateTime;
import java.time.Month;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/// Scanning functions that read values from file name captures.
///
/// Each one finds a single value per file, leaving in-file indices to their
/// default.
public final class ScanLibrary {

    /// Date used for the parts a file name does not carry
    public static final LocalDateTime DEFAULT_DATE = LocalDateTime.of(1970, 1, 1, 12, 0, 0);

    private ScanLibrary() {
    }

    /// Build a date from the `Y`, `mm`, `M`, `dd`, `doy` and `hh` captures of the
    /// coordinate, and express it in the coordinate's time units. Missing parts
    /// are taken from [#DEFAULT_DATE].
    ///
    /// @return the scanning function
    public static FilenameScanner dateFromFilename() {
        return (scan, match, prior) -> {
            if (!(scan.coordinate() instanceof TimeCoordinate time)) {
                throw new ScanException(scan.filegroup(), scan.name(),
                    "Dates can only be scanned for a time coordinate");
            }
            LocalDateTime date = dateOf(match.elements(scan.name()), scan, match);
            TimeUnits units = time.timeUnits();
            return ScanResult.values(List.of(units.valueOf(date)));
        };
    }

    static LocalDateTime dateOf(Map<String, String> elements, CoordScan scan, FileMatch match) {
        LocalDateTime date = DEFAULT_DATE;
        try {
            if (elements.containsKey("Y")) {
                date = date.withYear(Integer.parseInt(elements.get("Y")));
            }
            if (elements.containsKey("mm")) {
                date = date.withMonth(Integer.parseInt(elements.get("mm")));
            } else if (elements.containsKey("M")) {
                date = date.withMonth(monthOf(elements.get("M")).getValue());
            }
            if (elements.containsKey("dd")) {
                date = date.withDayOfMonth(Integer.parseInt(elements.get("dd")));
            }
            if (elements.containsKey("doy")) {
                date = date.withDayOfYear(Integer.parseInt(elements.get("doy")));
            }
            if (elements.containsKey("hh")) {
                date = date.withHour(Integer.parseInt(elements.get("hh")));
            }
        } catch (RuntimeException e) {
            throw new ScanException(scan.filegroup(), scan.name(), "Cannot read a date from " + match.file()
                + " captures " + elements, e);
        }
        return date;
    }

    /// @param name a month name or its three letter abbreviation, any case
    /// @return the month
    static Month monthOf(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (Month m : Month.values()) {
            String full = m.name().toLowerCase(Locale.ROOT);
            if (lower.length() >= 3 && full.startsWith(lower)) {
                return m;
            }
        }
        throw new IllegalArgumentException("Not a month name: '" + name + "'");
    }

    /// Read a decimal value from the `value` capture, or an integer from the `idx`
    /// capture.
    ///
    /// @return the scanning function
    public static FilenameScanner valueFromFilename() {
        return (scan, match, prior) -> {
            Map<String, String> elements = match.elements(scan.name());
            try {
                if (elements.containsKey("value")) {
                    return ScanResult.values(List.of(Double.parseDouble(elements.get("value"))));
                }
                if (elements.containsKey("idx")) {
                    return ScanResult.values(List.of((double) Integer.parseInt(elements.get("idx"))));
                }
            } catch (NumberFormatException e) {
                throw new ScanException(scan.filegroup(), scan.name(), "Cannot read a value from " + match.file(), e);
            }
            throw new ScanException(scan.filegroup(), scan.name(), "No 'value' or 'idx' capture in " + match.file());
        };
    }

    /// Read the in-file index of the values already found from the `idx` capture.
    /// Every value found so far is given this index.
    ///
    /// @return the scanning function
    public static FilenameScanner indexFromFilename() {
        return (scan, match, prior) -> {
            String idx = match.elements(scan.name()).get("idx");
            if (idx == null) {
                throw new ScanException(scan.filegroup(), scan.name(), "No 'idx' capture in " + match.file());
            }
            InFileIndex index = InFileIndex.of(Integer.parseInt(idx));
            List<Object> values = prior.isEmpty() ? List.<Object>of(Double.valueOf(index.position())) : prior;
            return ScanResult.of(values, Collections.nCopies(values.size(), index));
        };
    }

    /// Read a string value from the first `text` or `char` capture. Meant for the
    /// variable dimension, one variable per file.
    ///
    /// @return the scanning function
    public static FilenameScanner stringFromFilename() {
        return (scan, match, prior) -> {
            Map<String, String> elements = match.elements(scan.name());
            for (Map.Entry<String, String> e : elements.entrySet()) {
                if (e.getKey().equals("text") || e.getKey().equals("char")) {
                    return ScanResult.values(List.of(e.getValue()));
                }
            }
            throw new ScanException(scan.filegroup(), scan.name(), "No 'text' or 'char' capture in " + match.file());
        };
    }
}
