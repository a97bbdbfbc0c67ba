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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Inspect and load gridded datasets described by a YAML layout.
///
/// - `scan`: scan every filegroup and print the available values
/// - `plan`: print the reads a selection needs, file by file
/// - `load`: load a selection and print its shape and statistics
@CommandLine.Command(name = "griddata",
    headerHeading = "Usage:%n%n",
    synopsisHeading = "%n",
    descriptionHeading = "%nDescription%n%n",
    parameterListHeading = "%nParameters:%n",
    optionListHeading = "%nOptions:%n",
    header = "Scan, plan and load gridded datasets spread over many files",
    description = """
        A dataset is described by a YAML layout naming its coordinates and, for each
        filegroup, how files are named and which dimensions they hold. Selections
        are given per dimension, by index with --key or by value with --range.
        """,
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0:success", "1:dataset error", "2:usage error"},
    subcommands = {CMD_griddata_scan.class, CMD_griddata_plan.class, CMD_griddata_load.class,
        CommandLine.HelpCommand.class})
public class CMD_griddata implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_griddata.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    /// Create the griddata command
    public CMD_griddata() {
    }

    /// @return a command line for this command, configured the way main runs it
    public static CommandLine commandLine() {
        return new CommandLine(new CMD_griddata())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true);
    }

    /// Without a subcommand, print usage
    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return 2;
    }

    /// Run a griddata command
    ///
    /// @param args command line arguments
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        logger.debug("Exiting main with code: {}", exitCode);
        System.exit(exitCode);
    }
}
