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
import io.nosqlbench.griddata.errors.GridDataException;
import io.nosqlbench.griddata.keys.Keyring;
import io.nosqlbench.griddata.layout.LayoutYaml;
import io.nosqlbench.griddata.load.CommandKey;
import io.nosqlbench.griddata.load.LoadCommand;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/// Print the reads a selection needs
@CommandLine.Command(name = "plan",
    header = "Print the reads a selection needs, file by file, without reading",
    exitCodeList = {"0:success", "1:dataset error"})
public class CMD_griddata_plan implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_griddata_plan.class);

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
            List<LoadCommand> commands = dataset.plan(request);
            if (options.format == DatasetOptions.Format.json) {
                out.println(LayoutYaml.gson.toJson(commands.stream().map(CMD_griddata_plan::toData).toList()));
            } else {
                out.println("request " + dataset.normalize(request).print() + ": " + commands.size() + " files");
                commands.forEach(out::println);
            }
            out.flush();
            return 0;
        } catch (GridDataException | IllegalArgumentException e) {
            logger.error("Plan failed: {}", e.getMessage(), e);
            spec.commandLine().getErr().println(e.getMessage());
            return 1;
        }
    }

    private static Map<String, Object> toData(LoadCommand command) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("filegroup", command.filegroup());
        map.put("file", command.file());
        map.put("reads", command.keys().stream().map(CMD_griddata_plan::toData).toList());
        return map;
    }

    private static Map<String, Object> toData(CommandKey key) {
        Map<String, Object> map = new LinkedHashMap<>();
        Map<String, String> inFile = new LinkedHashMap<>();
        key.inFile().forEach(e -> inFile.put(e.getKey(), e.getValue().print()));
        Map<String, String> memory = new LinkedHashMap<>();
        key.memory().forEach(e -> memory.put(e.getKey(), e.getValue().print()));
        map.put("inFile", inFile);
        map.put("memory", memory);
        return map;
    }
}
