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
import io.nosqlbench.griddata.array.GridArray;
import io.nosqlbench.griddata.errors.GridDataException;
import io.nosqlbench.griddata.keys.Keyring;
import io.nosqlbench.griddata.layout.LayoutYaml;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.Arrays;
import java.util.DoubleSummaryStatistics;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/// Load a selection and print a summary of it
@CommandLine.Command(name = "load",
    header = "Load a selection and print its shape and statistics",
    exitCodeList = {"0:success", "1:dataset error"})
public class CMD_griddata_load implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_griddata_load.class);

    @CommandLine.Mixin
    private DatasetOptions options = new DatasetOptions();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            GridDataset dataset = options.dataset();
            dataset.scanAll();
            Keyring request = options.keyring(dataset);
            GridArray data = dataset.load(request);
            Map<String, Object> summary = summary(data);
            if (options.format == DatasetOptions.Format.json) {
                out.println(LayoutYaml.gson.toJson(summary));
            } else {
                summary.forEach((k, v) -> out.printf("%-8s %s%n", k, v instanceof int[] a ? Arrays.toString(a) : v));
            }
            out.flush();
            return 0;
        } catch (GridDataException | IllegalArgumentException e) {
            logger.error("Load failed: {}", e.getMessage(), e);
            spec.commandLine().getErr().println(e.getMessage());
            return 1;
        }
    }

    static Map<String, Object> summary(GridArray data) {
        double[] values = data.toArray();
        DoubleSummaryStatistics stats = Arrays.stream(values).filter(v -> !Double.isNaN(v)).summaryStatistics();
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("shape", data.shape());
        map.put("size", values.length);
        map.put("missing", values.length - (int) stats.getCount());
        if (stats.getCount() > 0) {
            map.put("min", stats.getMin());
            map.put("max", stats.getMax());
            map.put("mean", stats.getAverage());
        }
        return map;
    }
}
