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


package io.nuagent.command.common;

import io.nuagent.console.OutputConsole;
import picocli.CommandLine;

import java.io.PrintStream;
import java.time.Duration;

/**
 * Shared console output options. Commands that write through an {@link OutputConsole} include
 * this mixin so that {@code --debug}, {@code --no-color} and {@code --frame-interval} behave the
 * same everywhere.
 *
 * <p>The frame interval is checked while parsing, so an out-of-range value is reported as a
 * usage error before the command runs.</p>
 */
public final class ConsoleOutputOption {

    @CommandLine.Spec(CommandLine.Spec.Target.MIXEE)
    private CommandLine.Model.CommandSpec mixee;

    @CommandLine.Option(
        names = {"--debug"},
        description = "Show debug output (dimmed)"
    )
    private boolean debug = false;

    @CommandLine.Option(
        names = {"--no-color"},
        description = "Write plain text without ANSI colour sequences"
    )
    private boolean noColor = false;

    private Duration frameInterval = OutputConsole.DEFAULT_FRAME_INTERVAL;

    /**
     * Sets the spinner frame interval from the command line.
     *
     * @param millis interval in milliseconds, between 10 and 1000
     */
    @CommandLine.Option(
        names = {"--frame-interval"},
        paramLabel = "MS",
        defaultValue = "100",
        description = "Milliseconds between spinner frames, 10 to 1000 (default: ${DEFAULT-VALUE})"
    )
    public void setFrameIntervalMillis(long millis) {
        if (millis < 10 || millis > 1000) {
            throw new CommandLine.ParameterException(mixee.commandLine(),
                "Invalid value for option '--frame-interval': " + millis + " is not between 10 and 1000");
        }
        this.frameInterval = Duration.ofMillis(millis);
    }

    public boolean isDebug() {
        return debug;
    }

    public boolean isColorOutput() {
        return !noColor;
    }

    public Duration getFrameInterval() {
        return frameInterval;
    }

    /**
     * Builds a console configured from the parsed options.
     *
     * @param out the stream the console writes to
     * @return a new console
     */
    public OutputConsole buildConsole(PrintStream out) {
        return OutputConsole.builder()
            .withOutput(out)
            .withDebug(debug)
            .withColorOutput(!noColor)
            .withFrameInterval(frameInterval)
            .build();
    }
}
