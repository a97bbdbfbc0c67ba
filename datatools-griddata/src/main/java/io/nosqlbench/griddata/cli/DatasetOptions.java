package io.nosqlbench.griddata.cli;

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

import io.nosqlbench.griddata.GridDataset;
import io.nosqlbench.griddata.errors.ConfigException;
import io.nosqlbench.griddata.events.Log4jEventSink;
import io.nosqlbench.griddata.keys.Key;
import io.nosqlbench.griddata.keys.KeySpecs;
import io.nosqlbench.griddata.keys.Keyring;
import io.nosqlbench.griddata.layout.GridLayout;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/// Options shared by the griddata subcommands: the layout, and the selection.
public class DatasetOptions {

    /// Output formats
    public enum Format {
        /// plain text
        text,
        /// JSON
        json
    }

    @CommandLine.Parameters(index = "0", description = "The YAML layout of the dataset")
    Path layout;

    @CommandLine.Option(names = {"-k", "--key"},
        description = "Selection along a dimension, by index: dim=3, dim=0:10:2, dim=1,4,5, var=sst")
    Map<String, String> keys = new LinkedHashMap<>();

    @CommandLine.Option(names = {"-r", "--range"},
        description = "Selection along a dimension, by value, bounds included: dim=min,max")
    Map<String, String> ranges = new LinkedHashMap<>();

    @CommandLine.Option(names = {"-f", "--format"}, defaultValue = "text",
        description = "Output format: ${COMPLETION-CANDIDATES}")
    Format format = Format.text;

    /// @return the dataset described by the layout, not scanned yet
    GridDataset dataset() {
        Path file = layout.toAbsolutePath().normalize();
        return GridLayout.load(file).toDataset(file.getParent(), new Log4jEventSink());
    }

    /// @param dataset a scanned dataset
    /// @return the requested selection
    Keyring keyring(GridDataset dataset) {
        LinkedHashMap<String, Key> out = new LinkedHashMap<>();
        keys.forEach((dim, spec) -> out.put(dim, KeySpecs.parse(spec)));
        Keyring k = Keyring.of(out);
        for (Map.Entry<String, String> e : ranges.entrySet()) {
            String[] bounds = e.getValue().split(",");
            if (bounds.length != 2) {
                throw new ConfigException("A range needs two bounds: " + e.getKey() + "=" + e.getValue());
            }
            Keyring byValue = dataset.keyringByValue(e.getKey(), Double.parseDouble(bounds[0].trim()),
                Double.parseDouble(bounds[1].trim()));
            k = k.with(e.getKey(), byValue.get(e.getKey()));
        }
        return k;
    }
}
