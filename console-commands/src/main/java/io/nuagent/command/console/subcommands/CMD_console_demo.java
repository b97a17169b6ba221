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


package io.nuagent.command.console.subcommands;

import io.nuagent.command.common.ConsoleOutputOption;
import io.nuagent.command.common.DurationConverter;
import io.nuagent.console.ConsoleWriteException;
import io.nuagent.console.OutputBuffer;
import io.nuagent.console.OutputConsole;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.PrintStream;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/// Animate the waiting spinner while worker threads write through one console.
///
/// Each worker walks through a fixed number of steps spread over `--duration`, writing an
/// informational line per step and a debug line with timing detail. The first worker also
/// reports a simulated error halfway through. When every worker is done, a summary is flushed
/// as one block and the waiting period ends.
///
/// ## Usage
///
/// ```bash
/// console demo --workers 4 --duration 3s --debug
/// ```
///
/// ## Example Output
///
/// ```
/// [worker-1] step 1/4 done
/// [worker-0] step 1/4 done
/// [worker-0] simulated failure on step 2
/// ...
/// Summary: 4 workers, 16 steps
/// ⠹ Thinking... (1.2s)
/// ```
@CommandLine.Command(
    name = "demo",
    header = "Animate the spinner while workers write output",
    description = "Starts a waiting period, lets worker threads interleave output, debug and error lines, "
        + "flushes a summary block and ends the waiting period.",
    mixinStandardHelpOptions = true,
    exitCodeList = {
        "0: Success",
        "1: The run failed",
        "2: Invalid options"
    }
)
public class CMD_console_demo implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_console_demo.class);

    static final int STEPS_PER_WORKER = 4;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private ConsoleOutputOption consoleOptions = new ConsoleOutputOption();

    @CommandLine.Option(
        names = {"-m", "--message"},
        description = "Message shown beside the spinner (default: ${DEFAULT-VALUE})",
        defaultValue = OutputConsole.DEFAULT_WAITING_MESSAGE
    )
    private String message;

    @CommandLine.Option(
        names = {"-w", "--workers"},
        description = "Number of worker threads (default: ${DEFAULT-VALUE})",
        defaultValue = "3"
    )
    private int workers;

    @CommandLine.Option(
        names = {"-d", "--duration"},
        description = "How long the workers run, e.g. 500ms, 2s (default: ${DEFAULT-VALUE})",
        defaultValue = "2s",
        converter = DurationConverter.class
    )
    private Duration duration;

    private final PrintStream out;

    public CMD_console_demo() {
        this(System.out);
    }

    CMD_console_demo(PrintStream out) {
        this.out = out;
    }

    @Override
    public Integer call() {
        if (workers < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Invalid value for option '--workers': must be at least 1, got " + workers);
        }

        long stepPauseMillis = duration.toMillis() / STEPS_PER_WORKER;
        logger.info("Running demo with {} workers for {}", workers, duration);

        try (OutputConsole console = consoleOptions.buildConsole(out)) {
            Instant startedAt = Instant.now();
            console.startWaiting(message, startedAt);

            ExecutorService pool = Executors.newFixedThreadPool(workers);
            try {
                List<Future<Integer>> results = new ArrayList<>();
                for (int i = 0; i < workers; i++) {
                    int id = i;
                    results.add(pool.submit(() -> runWorker(console, id, stepPauseMillis)));
                }
                int steps = 0;
                for (Future<Integer> result : results) {
                    steps += result.get();
                }

                OutputBuffer summary = new OutputBuffer()
                    .add("Summary: " + workers + " workers, " + steps + " steps")
                    .debug("elapsed " + Duration.between(startedAt, Instant.now()).toMillis() + "ms, "
                        + "frame interval " + consoleOptions.getFrameInterval().toMillis() + "ms");
                console.flush(summary);
            } finally {
                pool.shutdownNow();
                console.stopWaiting();
            }
            console.output("Done.");
            return 0;
        } catch (ExecutionException e) {
            logger.error("A demo worker failed: {}", e.getCause().getMessage(), e.getCause());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Demo interrupted");
            return 1;
        } catch (ConsoleWriteException e) {
            logger.error("Console output failed: {}", e.getMessage(), e);
            return 1;
        }
    }

    private int runWorker(OutputConsole console, int id, long stepPauseMillis) throws InterruptedException {
        String name = "[worker-" + id + "]";
        for (int step = 1; step <= STEPS_PER_WORKER; step++) {
            long began = System.nanoTime();
            TimeUnit.MILLISECONDS.sleep(stepPauseMillis);
            console.output(name + " step " + step + "/" + STEPS_PER_WORKER + " done");
            console.debugOutput(name + " step " + step + " took "
                + TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - began) + "ms");
            if (id == 0 && step == 2) {
                console.errorOutput(name + " simulated failure on step " + step);
            }
        }
        return STEPS_PER_WORKER;
    }
}
