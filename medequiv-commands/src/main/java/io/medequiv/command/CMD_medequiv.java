package io.medequiv.command;

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

import io.medequiv.command.homologate.CMD_homologate;
import io.medequiv.command.inspect.CMD_inspect;
import io.medequiv.command.query.CMD_query;
import io.medequiv.command.train.CMD_train;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Medication equivalence engine command line
@CommandLine.Command(name = "medequiv",
    header = "Medication equivalence engine",
    description = "Train homologation models from registry records and query them for substitutes",
    mixinStandardHelpOptions = true,
    version = "medequiv 0.1.0",
    subcommands = {
        CMD_train.class,
        CMD_query.class,
        CMD_homologate.class,
        CMD_inspect.class,
        CommandLine.HelpCommand.class
    })
public class CMD_medequiv implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_medequiv.class);

    /// Create the CMD_medequiv command
    public CMD_medequiv() {}

    /// Run the command line
    /// @param args Command line arguments
    public static void main(String[] args) {
        logger.debug("executing commandline");
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    /// @return a command line configured the same way as [#main]
    public static CommandLine commandLine() {
        return new CommandLine(new CMD_medequiv())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }
}
