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
import io.nuagent.console.OutputConsole;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.PrintStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/// Hammer one console with concurrent writers while the waiting period is toggled on and off.
///
/// Every writer thread writes a single `stress-line-N` at a random moment inside the
/// `--toggle-for` window while a separate thread keeps starting and stopping the spinner.
/// Afterwards the command reports how many lines were written and how often the spinner was
/// toggled. Each line appears exactly once and no spinner residue is left behind.
///
/// ## Usage
///
/// ```bash
/// console stress --threads 50 --toggle-for 2s
/// ```
@CommandLine.Command(
    name = "stress",
    header = "Write from many threads while the spinner toggles",
    description = "Runs concurrent writers against one console while another thread starts and stops "
        + "the waiting period, then reports the number of lines written.",
    mixinStandardHelpOptions = true,
    exitCodeList = {
        "0: Success",
        "1: The run failed",
        "2: Invalid options"
    }
)
public class CMD_console_stress implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_console_stress.class);

    static final String LINE_PREFIX = "stress-line-";

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private ConsoleOutputOption consoleOptions = new ConsoleOutputOption();

    @CommandLine.Option(
        names = {"-t", "--threads"},
        description = "Number of writer threads (default: ${DEFAULT-VALUE})",
        defaultValue = "20"
    )
    private int threads;

    @CommandLine.Option(
        names = {"--toggle-for"},
        description = "How long the spinner is toggled, e.g. 500ms, 1s (default: ${DEFAULT-VALUE})",
        defaultValue = "1s",
        converter = DurationConverter.class
    )
    private Duration toggleFor;

    private final PrintStream out;

    public CMD_console_stress() {
        this(System.out);
    }

    CMD_console_stress(PrintStream out) {
        this.out = out;
    }

    @Override
    public Integer call() {
        if (threads < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Invalid value for option '--threads': must be at least 1, got " + threads);
        }
        long windowMillis = Math.max(1L, toggleFor.toMillis());
        logger.info("Stressing console with {} writers over {}", threads, toggleFor);

        try (OutputConsole console = consoleOptions.buildConsole(out)) {
            AtomicBoolean toggling = new AtomicBoolean(true);
            AtomicInteger toggles = new AtomicInteger();
            CountDownLatch go = new CountDownLatch(1);

            ExecutorService pool = Executors.newFixedThreadPool(threads + 1);
            try {
                Future<?> toggler = pool.submit(() -> {
                    go.await();
                    try {
                        while (toggling.get()) {
                            console.startWaiting("Toggling...");
                            TimeUnit.MILLISECONDS.sleep(ThreadLocalRandom.current().nextLong(1, 20));
                            console.stopWaiting();
                            toggles.incrementAndGet();
                            TimeUnit.MILLISECONDS.sleep(ThreadLocalRandom.current().nextLong(0, 5));
                        }
                    } finally {
                        console.stopWaiting();
                    }
                    return null;
                });

                List<Future<?>> writers = new ArrayList<>();
                for (int i = 0; i < threads; i++) {
                    String line = LINE_PREFIX + i;
                    writers.add(pool.submit(() -> {
                        go.await();
                        TimeUnit.MILLISECONDS.sleep(ThreadLocalRandom.current().nextLong(windowMillis));
                        console.output(line);
                        return null;
                    }));
                }

                go.countDown();
                for (Future<?> writer : writers) {
                    writer.get();
                }
                toggling.set(false);
                toggler.get();
            } finally {
                toggling.set(false);
                pool.shutdownNow();
            }

            console.output("Wrote " + threads + " lines while toggling the spinner " + toggles.get() + " times");
            return 0;
        } catch (ExecutionException e) {
            logger.error("A stress thread failed: {}", e.getCause().getMessage(), e.getCause());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Stress run interrupted");
            return 1;
        } catch (ConsoleWriteException e) {
            logger.error("Console output failed: {}", e.getMessage(), e);
            return 1;
        }
    }
}
