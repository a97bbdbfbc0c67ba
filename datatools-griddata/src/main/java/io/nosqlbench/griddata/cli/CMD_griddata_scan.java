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
import io.nosqlbench.griddata.coords.Coordinate;
import io.nosqlbench.griddata.errors.GridDataException;
import io.nosqlbench.griddata.layout.LayoutYaml;
import io.nosqlbench.griddata.reconcile.AvailableSpace;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/// Scan a dataset and print its available values
@CommandLine.Command(name = "scan",
    header = "Scan every filegroup and print the available values of each dimension",
    exitCodeList = {"0:success", "1:dataset error"})
public class CMD_griddata_scan implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_griddata_scan.class);

    @CommandLine.Mixin
    private DatasetOptions options = new DatasetOptions();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            GridDataset dataset = options.dataset();
            AvailableSpace space = dataset.scanAll();
            if (options.format == DatasetOptions.Format.json) {
                out.println(LayoutYaml.gson.toJson(summary(space)));
            } else {
                for (String dim : space.dims()) {
                    Coordinate c = space.coordinate(dim);
                    out.printf("%-10s %6d  %s%n", dim, c.size(), c.extentString());
                }
            }
            out.flush();
            return 0;
        } catch (GridDataException e) {
            logger.error("Scan failed: {}", e.getMessage(), e);
            spec.commandLine().getErr().println(e.getMessage());
            return 1;
        }
    }

    static Map<String, Object> summary(AvailableSpace space) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (String dim : space.dims()) {
            Coordinate c = space.coordinate(dim);
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("size", c.size());
            entry.put("units", c.units());
            entry.put("tolerance", space.tolerance(dim));
            entry.put("values", c.values());
            out.put(dim, entry);
        }
        return out;
    }
}
