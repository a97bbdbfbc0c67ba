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

import io.nosqlbench.griddata.coords.Coordinate;
import io.nosqlbench.griddata.errors.ScanException;
import io.nosqlbench.griddata.events.EventSink;
import io.nosqlbench.griddata.events.GridEvent;
import io.nosqlbench.griddata.events.NoOpEventSink;
import io.nosqlbench.griddata.format.FileHandle;
import io.nosqlbench.griddata.keys.Key;
import io.nosqlbench.griddata.pregex.FileMatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.IntStream;

/// The values of one coordinate as found in the files of one filegroup.
///
/// An *in* coordinate lives entirely inside each file, so only the first file that
/// yields values is scanned. A *shared* coordinate is spread over several files:
/// every file is scanned and each value remembers the file name captures it came
/// from, so that file names can be rebuilt when loading.
///
/// Values are kept alongside their in-file indices. Once scanning is finished
/// the values are converted to the coordinate units, sorted (except string
/// values), and checked for duplicates.
public class CoordScan {
    private static final Logger logger = LogManager.getLogger(CoordScan.class);

    private final String filegroup;
    private final Coordinate coordinate;
    private final boolean shared;
    private final List<ScanFunction> scanners = new ArrayList<>();
    private EventSink sink = new NoOpEventSink();

    private ScanState state = ScanState.UNSCANNED;
    private List<Object> values = new ArrayList<>();
    private List<InFileIndex> inIndices = new ArrayList<>();
    private List<List<String>> matches = new ArrayList<>();
    private final Map<String, List<String>> variableDimensions = new LinkedHashMap<>();
    private final Set<List<String>> seenMatches = new HashSet<>();

    private List<Object> manualValues;
    private List<InFileIndex> manualIndices;
    private InFileIndex constantIndex;
    private boolean forceIndexDescending;
    private String scanUnits;
    private UnitConverter converter;
    private Double tolerance;
    private Key selection;
    private double[] valueSelection;
    private int[] contains = new int[0];

    /// @param filegroup name of the owning filegroup
    /// @param coordinate the dataset coordinate this scan contributes to
    /// @param shared true if values are spread over several files
    public CoordScan(String filegroup, Coordinate coordinate, boolean shared) {
        this.filegroup = filegroup;
        this.coordinate = coordinate;
        this.shared = shared;
    }

    /// @param function a scanning function, run after those already added
    /// @return this
    public CoordScan addScanner(ScanFunction function) {
        scanners.add(function);
        return this;
    }

    /// Set values by hand. They are never rescanned. For a shared coordinate the
    /// files are still scanned, to find which file holds each value.
    ///
    /// @param values the values
    /// @param indices their in-file indices, or null for positions (in) or none (shared)
    /// @return this
    public CoordScan setManual(List<?> values, List<InFileIndex> indices) {
        if (indices != null && indices.size() != values.size()) {
            throw new ScanException(filegroup, name(), "Manual values and in-file indices differ in size: "
                + values.size() + " and " + indices.size());
        }
        this.manualValues = List.copyOf(values);
        this.manualIndices = indices == null ? null : List.copyOf(indices);
        this.state = ScanState.MANUALLY_SET;
        reset();
        return this;
    }

    /// Every value of this coordinate sits at the same in-file index.
    ///
    /// @param index the constant in-file index
    /// @return this
    public CoordScan setConstantIndex(InFileIndex index) {
        this.constantIndex = index;
        return this;
    }

    /// Treat the in-file indices as running opposite to the values when nothing
    /// was scanned for this coordinate.
    ///
    /// @param force true to mirror in-file indices
    /// @return this
    public CoordScan setForceIndexDescending(boolean force) {
        this.forceIndexDescending = force;
        return this;
    }

    /// @param converter conversion used in place of the coordinate's own
    /// @return this
    public CoordScan setUnitConverter(UnitConverter converter) {
        this.converter = converter;
        return this;
    }

    /// @param tolerance tolerance used in place of the coordinate's own
    /// @return this
    public CoordScan setTolerance(double tolerance) {
        this.tolerance = tolerance;
        return this;
    }

    /// Keep only part of the scanned values, selected by index.
    ///
    /// @param key the selection
    /// @return this
    public CoordScan select(Key key) {
        this.selection = key;
        return this;
    }

    /// Keep only the scanned values between two bounds, both included.
    ///
    /// @param min lower bound
    /// @param max upper bound
    /// @return this
    public CoordScan selectValues(double min, double max) {
        this.valueSelection = new double[]{min, max};
        return this;
    }

    /// @param units units the scanned values are expressed in
    public void setScanUnits(String units) {
        this.scanUnits = units;
    }

    void setSink(EventSink sink) {
        this.sink = sink;
    }

    /// Forget scanned values, keeping configuration and manual values.
    public void reset() {
        seenMatches.clear();
        variableDimensions.clear();
        contains = new int[0];
        if (manualValues != null) {
            values = new ArrayList<>(manualValues);
            if (manualIndices != null) {
                inIndices = new ArrayList<>(manualIndices);
            } else if (constantIndex != null) {
                inIndices = new ArrayList<>(Collections.nCopies(values.size(), constantIndex));
            } else {
                inIndices = new ArrayList<>(defaultIndices(values.size()));
            }
            matches = new ArrayList<>(Collections.nCopies(values.size(), null));
            state = ScanState.MANUALLY_SET;
            return;
        }
        values = new ArrayList<>();
        inIndices = new ArrayList<>();
        matches = new ArrayList<>();
        state = ScanState.UNSCANNED;
    }

    /// @return true if this coordinate still has to look at the next file
    public boolean wantsFile() {
        if (scanners.isEmpty()) {
            return false;
        }
        if (shared) {
            return state != ScanState.SCANNED;
        }
        return state == ScanState.UNSCANNED;
    }

    /// @return true if the next file must be opened for this coordinate
    public boolean needsFile() {
        return wantsFile() && scanners.stream().anyMatch(f -> f instanceof InFileScanner);
    }

    /// Scan one file with every scanning function, in order.
    ///
    /// Functions receive the values found by the previous ones. A shared
    /// coordinate skips files whose captures were already scanned.
    ///
    /// @param match the captures of the file name
    /// @param handle the open file, or null if no function reads it
    /// @throws IOException if a function cannot read the file
    public void scanFile(FileMatch match, FileHandle handle) throws IOException {
        if (!wantsFile()) {
            return;
        }
        List<String> captures = shared ? match.capturesOf(name()) : List.of();
        if (shared && !seenMatches.add(captures)) {
            return;
        }
        List<Object> found = null;
        List<InFileIndex> indices = null;
        for (ScanFunction function : scanners) {
            List<Object> prior = found == null ? List.of() : found;
            ScanResult result;
            if (function instanceof FilenameScanner fs) {
                result = fs.scan(this, match, prior);
            } else if (function instanceof InFileScanner is) {
                if (handle == null) {
                    throw new IllegalStateException("File " + match.file() + " was not opened for " + name());
                }
                result = is.scan(this, handle, prior);
            } else {
                throw new IllegalStateException("Unknown scanning function " + function);
            }
            if (result.values() != null) {
                found = new ArrayList<>(result.values());
            }
            if (result.inIndices() != null) {
                indices = result.inIndices();
            }
            if (result.units() != null) {
                scanUnits = result.units();
            }
            if (result.dimensions() != null) {
                variableDimensions.putAll(result.dimensions());
            }
        }
        if (found == null) {
            sink.log(GridEvent.FILE_SCANNED, "filegroup", filegroup, "coord", name(), "file", match.file(),
                "values", 0);
            return;
        }
        if (constantIndex != null) {
            indices = Collections.nCopies(found.size(), constantIndex);
        } else if (indices == null) {
            indices = defaultIndices(found.size());
        }
        if (indices.size() != found.size()) {
            throw new ScanException(filegroup, name(), "Found " + found.size() + " values but "
                + indices.size() + " in-file indices in " + match.file());
        }

        if (state == ScanState.MANUALLY_SET) {
            assignManual(found, indices, captures, match.file());
        } else {
            state = ScanState.SCANNING;
            values.addAll(found);
            inIndices.addAll(indices);
            if (shared) {
                matches.addAll(Collections.nCopies(found.size(), captures));
            }
        }
        sink.log(GridEvent.FILE_SCANNED, "filegroup", filegroup, "coord", name(), "file", match.file(),
            "values", found.size());
    }

    private void assignManual(List<Object> found, List<InFileIndex> indices, List<String> captures, String file) {
        for (int k = 0; k < found.size(); k++) {
            int i = indexOfValue(values, found.get(k), tolerance());
            if (i < 0) {
                logger.debug("Value {} of {} is not among the manual values of {}", found.get(k), file, name());
                continue;
            }
            if (shared) {
                matches.set(i, captures);
            }
            if (manualIndices == null) {
                inIndices.set(i, indices.get(k));
            }
        }
    }

    /// State of this scan before a file, so that the file can be taken back.
    record Checkpoint(ScanState state, int size, List<InFileIndex> inIndices, List<List<String>> matches,
                      List<String> captures, boolean seen, Map<String, List<String>> dimensions,
                      String scanUnits) {
    }

    Checkpoint checkpoint(FileMatch match) {
        List<String> captures = shared ? match.capturesOf(name()) : List.of();
        boolean manual = state == ScanState.MANUALLY_SET;
        return new Checkpoint(state, values.size(),
            manual ? new ArrayList<>(inIndices) : null,
            manual ? new ArrayList<>(matches) : null,
            captures, seenMatches.contains(captures), new LinkedHashMap<>(variableDimensions), scanUnits);
    }

    /// Forget whatever the file scanned since the checkpoint added.
    void rollback(Checkpoint cp) {
        if (cp.inIndices() != null) {
            inIndices = cp.inIndices();
            matches = cp.matches();
        } else {
            values.subList(cp.size(), values.size()).clear();
            inIndices.subList(cp.size(), inIndices.size()).clear();
            if (matches.size() > cp.size()) {
                matches.subList(cp.size(), matches.size()).clear();
            }
        }
        if (!cp.seen()) {
            seenMatches.remove(cp.captures());
        }
        variableDimensions.clear();
        variableDimensions.putAll(cp.dimensions());
        scanUnits = cp.scanUnits();
        state = cp.state();
    }

    private List<InFileIndex> defaultIndices(int n) {
        if (shared) {
            return new ArrayList<>(Collections.nCopies(n, InFileIndex.NONE));
        }
        return IntStream.range(0, n).mapToObj(InFileIndex::of).toList();
    }

    /// Finish scanning: convert units, sort, check values, then apply the selection.
    ///
    /// @throws ScanException if a shared coordinate found no value, a manual value
    /// matched no file, or two values are duplicates
    public void finishScan() {
        if (state == ScanState.MANUALLY_SET) {
            if (shared) {
                for (int i = 0; i < values.size(); i++) {
                    if (matches.get(i) == null) {
                        throw new ScanException(filegroup, name(), "No file matches manual value "
                            + coordinate.format(values.get(i)));
                    }
                }
            }
            if (!coordinate.isString()) {
                sortValues();
            }
            checkValues();
            applySelection();
            return;
        }
        if (values.isEmpty()) {
            if (shared) {
                throw new ScanException(filegroup, name(), "No values found for shared coordinate");
            }
            if (!scanners.isEmpty()) {
                throw new ScanException(filegroup, name(), "No values found in any file");
            }
            state = ScanState.SCANNED;
            return;
        }
        convertUnits();
        if (!coordinate.isString()) {
            sortValues();
        }
        checkValues();
        state = ScanState.SCANNED;
        applySelection();
    }

    private void convertUnits() {
        String target = coordinate.units();
        if (scanUnits == null || coordinate.isString() || target == null || target.isEmpty()
            || scanUnits.equals(target)) {
            return;
        }
        double[] raw = values.stream().mapToDouble(v -> ((Number) v).doubleValue()).toArray();
        try {
            double[] converted = converter != null
                ? converter.convert(raw, scanUnits, target)
                : coordinate.convertUnits(raw, scanUnits, target);
            values = new ArrayList<>(Arrays.stream(converted).boxed().toList());
            sink.log(GridEvent.UNITS_CONVERTED, "filegroup", filegroup, "coord", name(), "from", scanUnits,
                "to", target);
        } catch (UnsupportedOperationException e) {
            logger.debug(e.getMessage());
            sink.log(GridEvent.UNITS_NOT_CONVERTED, "filegroup", filegroup, "coord", name(), "from", scanUnits,
                "to", target);
        }
    }

    private void sortValues() {
        Integer[] order = IntStream.range(0, values.size()).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble(i -> ((Number) values.get(i)).doubleValue()));
        reorder(Arrays.stream(order).mapToInt(Integer::intValue).toArray());
    }

    private void reorder(int[] order) {
        List<Object> v = new ArrayList<>();
        List<InFileIndex> idx = new ArrayList<>();
        List<List<String>> m = new ArrayList<>();
        for (int i : order) {
            v.add(values.get(i));
            idx.add(inIndices.get(i));
            if (!matches.isEmpty()) {
                m.add(matches.get(i));
            }
        }
        values = v;
        inIndices = idx;
        matches = m;
    }

    private void checkValues() {
        if (coordinate.isString()) {
            Set<Object> seen = new HashSet<>();
            for (Object v : values) {
                if (!seen.add(v)) {
                    throw new ScanException(filegroup, name(), "Duplicate value " + v);
                }
            }
            return;
        }
        double tol = tolerance();
        for (int i = 1; i < values.size(); i++) {
            double a = ((Number) values.get(i - 1)).doubleValue();
            double b = ((Number) values.get(i)).doubleValue();
            if (Math.abs(b - a) <= tol) {
                throw new ScanException(filegroup, name(), "Duplicate value " + coordinate.format(b)
                    + describeOrigin(i - 1, i));
            }
            if (!(b > a)) {
                throw new ScanException(filegroup, name(), "Values are not monotonic at "
                    + coordinate.format(b));
            }
        }
    }

    private String describeOrigin(int i, int j) {
        if (matches.isEmpty()) {
            return "";
        }
        return " (captures " + matches.get(i) + " and " + matches.get(j) + ")";
    }

    private void applySelection() {
        Key key = selection;
        if (valueSelection != null && !coordinate.isString()) {
            key = coordinate.withValues(values).subset(valueSelection[0], valueSelection[1]);
        }
        if (key == null || values.isEmpty()) {
            return;
        }
        int[] idx = key.withParentSize(values.size()).intToList().asArray();
        reorder(idx);
        logger.debug("Selected {} values of {} in filegroup {}", values.size(), name(), filegroup);
    }

    /// Find, for each available value, its index among the scanned values.
    ///
    /// A coordinate with no scanned values is taken to hold every available value.
    ///
    /// @param available the available values after reconciliation
    /// @param tolerance the reconciled tolerance
    public void findContained(List<Object> available, double tolerance) {
        if (values.isEmpty()) {
            contains = IntStream.range(0, available.size()).toArray();
            return;
        }
        contains = new int[available.size()];
        for (int a = 0; a < available.size(); a++) {
            contains[a] = indexOfValue(values, available.get(a), tolerance);
        }
    }

    static int indexOfValue(List<Object> values, Object value, double tolerance) {
        if (value instanceof Number n) {
            double x = n.doubleValue();
            for (int i = 0; i < values.size(); i++) {
                if (values.get(i) instanceof Number v && Math.abs(v.doubleValue() - x) <= tolerance) {
                    return i;
                }
            }
            return -1;
        }
        return values.indexOf(value);
    }

    /// In-file indices for a selection of this coordinate's values.
    ///
    /// When nothing was scanned the key already addresses the file axis. It is
    /// then mirrored if in-file indices are forced descending.
    ///
    /// @param key a selection of scanned values
    /// @param size size of the file axis, used when nothing was scanned
    /// @return the in-file indices
    public List<InFileIndex> inFileIndices(Key key, int size) {
        if (values.isEmpty()) {
            Key k = forceIndexDescending ? key.mirror(size) : key.withParentSize(size);
            return Arrays.stream(k.intToList().asArray()).mapToObj(InFileIndex::of).toList();
        }
        return key.withParentSize(values.size()).intToList().apply(inIndices);
    }

    /// True if in-file indices run opposite to the values.
    ///
    /// Only positional in-file indices are considered. With no scanned values,
    /// the forced flag decides.
    ///
    /// @return true if descending
    public boolean isIndexDescending() {
        if (values.isEmpty()) {
            return forceIndexDescending;
        }
        if (inIndices.size() < 2 || inIndices.stream().anyMatch(i -> i.position() == null)) {
            return false;
        }
        for (int i = 1; i < inIndices.size(); i++) {
            if (inIndices.get(i).position() >= inIndices.get(i - 1).position()) {
                return false;
            }
        }
        return true;
    }

    /// @return the dimension name
    public String name() {
        return coordinate.name();
    }

    /// @return the owning filegroup name
    public String filegroup() {
        return filegroup;
    }

    /// @return the dataset coordinate this scan contributes to
    public Coordinate coordinate() {
        return coordinate;
    }

    /// @return true if values are spread over several files
    public boolean isShared() {
        return shared;
    }

    /// @return the scanning state
    public ScanState state() {
        return state;
    }

    /// @return true if values were given by hand
    public boolean isManual() {
        return manualValues != null;
    }

    /// @return the scanning functions, in order
    public List<ScanFunction> scanners() {
        return Collections.unmodifiableList(scanners);
    }

    /// @return the tolerance for this filegroup
    public double tolerance() {
        return tolerance != null ? tolerance : coordinate.tolerance();
    }

    /// @return the scanned values
    public List<Object> values() {
        return Collections.unmodifiableList(values);
    }

    /// @return number of scanned values
    public int size() {
        return values.size();
    }

    /// @return the in-file index of each value
    public List<InFileIndex> inIndices() {
        return Collections.unmodifiableList(inIndices);
    }

    /// @param i position of a value
    /// @return the file name captures of this value; empty for in coordinates
    public List<String> matchOf(int i) {
        return shared ? matches.get(i) : List.of();
    }

    /// @return units of the scanned values, or null
    public String scanUnits() {
        return scanUnits;
    }

    /// @return the in-file dimensions of each variable, when scanned
    public Map<String, List<String>> variableDimensions() {
        return Collections.unmodifiableMap(variableDimensions);
    }

    /// @return for each available value, its scanned index or -1
    public int[] contains() {
        return contains.clone();
    }

    @Override
    public String toString() {
        return filegroup + "/" + name() + (shared ? " (shared)" : " (in)") + " " + state + " "
            + coordinate.withValues(values).extentString();
    }
}
