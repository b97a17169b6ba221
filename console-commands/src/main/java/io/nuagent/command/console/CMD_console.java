/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package io.nuagent.command.console;

import io.nuagent.command.console.subcommands.CMD_console_demo;
import io.nuagent.command.console.subcommands.CMD_console_stress;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// The console command exercises the shared output console from the command line.
///
/// This is an umbrella command for the demo and stress subcommands.
@CommandLine.Command(name = "console",
    header = "Exercise the thread-safe output console",
    description = "Contains subcommands that animate the waiting spinner while worker threads write output",
    mixinStandardHelpOptions = true,
    subcommands = {
        CMD_console_demo.class,
        CMD_console_stress.class
    })
public class CMD_console implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_console.class);

    /// Run CMD_console
    ///
    /// @param args Command line arguments
    public static void main(String[] args) {
        System.exit(new CommandLine(new CMD_console()).execute(args));
    }

    /// Execute the console command
    ///
    /// @return 0 for success
    @Override
    public Integer call() {
        logger.debug("No subcommand given, printing usage");
        CommandLine.usage(this, System.out);
        return 0;
    }
}
