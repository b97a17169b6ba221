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

package io.nuagent.console;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutputConsoleConcurrencyTest {

    private static OutputConsole console(ByteArrayOutputStream bytes, boolean debug) {
        return OutputConsole.builder()
            .withOutput(new PrintStream(bytes, true, StandardCharsets.UTF_8))
            .withFrameInterval(Duration.ofMillis(10))
            .withDebug(debug)
            .build();
    }

    /**
     * Toggles the waiting period in a tight loop until {@code stop} is set.
     */
    private static Runnable toggler(OutputConsole console, AtomicBoolean stop) {
        return () -> {
            try {
                while (!stop.get()) {
                    console.startWaiting("Toggling");
                    TimeUnit.MILLISECONDS.sleep(ThreadLocalRandom.current().nextInt(1, 15));
                    console.stopWaiting();
                    TimeUnit.MILLISECONDS.sleep(ThreadLocalRandom.current().nextInt(0, 5));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                console.stopWaiting();
            }
        };
    }

    @Test
    void twentyWritersWhileWaitingIsToggled() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        OutputConsole console = console(bytes, false);
        AtomicBoolean stopToggling = new AtomicBoolean(false);
        CountDownLatch go = new CountDownLatch(1);

        ExecutorService writers = Executors.newFixedThreadPool(20);
        Thread toggle = new Thread(toggler(console, stopToggling), "toggler");
        toggle.start();

        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            int id = i;
            futures.add(writers.submit(() -> {
                go.await();
                TimeUnit.MILLISECONDS.sleep(ThreadLocalRandom.current().nextInt(0, 900));
                console.output("msg-" + id);
                return null;
            }));
        }
        go.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        writers.shutdown();

        TimeUnit.MILLISECONDS.sleep(100);
        stopToggling.set(true);
        toggle.join(5000);
        console.stopWaiting();

        TerminalTranscript transcript = TerminalTranscript.of(bytes.toString(StandardCharsets.UTF_8));
        List<String> expected = IntStream.range(0, 20).mapToObj(i -> "msg-" + i).collect(Collectors.toList());
        assertThat(transcript.lines()).containsExactlyInAnyOrderElementsOf(expected);
        assertEquals("", transcript.currentLine(), "spinner residue left on the last line");
        assertTrue(writers.awaitTermination(5, TimeUnit.SECONDS));
    }

    @Test
    void mixedOutputKindsAreEachWrittenExactlyOnce() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        OutputConsole console = console(bytes, true);
        AtomicBoolean stopToggling = new AtomicBoolean(false);
        Thread toggle = new Thread(toggler(console, stopToggling), "toggler");
        toggle.start();

        int threads = 8;
        int perThread = 25;
        ExecutorService writers = Executors.newFixedThreadPool(threads);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            int thread = t;
            futures.add(writers.submit(() -> {
                for (int i = 0; i < perThread; i++) {
                    String text = "t" + thread + "-" + i;
                    switch (i % 3) {
                        case 0 -> console.output(text);
                        case 1 -> console.debugOutput(text);
                        default -> console.errorOutput(text);
                    }
                    if (i % 5 == 0) {
                        Thread.sleep(2);
                    }
                }
                return null;
            }));
        }
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        writers.shutdown();
        stopToggling.set(true);
        toggle.join(5000);

        TerminalTranscript transcript = TerminalTranscript.of(bytes.toString(StandardCharsets.UTF_8));
        List<String> expected = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            for (int i = 0; i < perThread; i++) {
                expected.add("t" + t + "-" + i);
            }
        }
        assertThat(transcript.lines()).containsExactlyInAnyOrderElementsOf(expected);
        assertEquals("", transcript.currentLine());
    }

    @Test
    void perThreadOrderIsPreserved() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        OutputConsole console = console(bytes, false);
        console.startWaiting("Ordering");

        ExecutorService writers = Executors.newFixedThreadPool(4);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            String prefix = "w" + t + ":";
            futures.add(writers.submit(() -> {
                for (int i = 0; i < 50; i++) {
                    console.output(prefix + i);
                }
                return null;
            }));
        }
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        writers.shutdown();
        console.stopWaiting();

        List<String> lines = TerminalTranscript.of(bytes.toString(StandardCharsets.UTF_8)).lines();
        assertEquals(200, lines.size());
        for (int t = 0; t < 4; t++) {
            String prefix = "w" + t + ":";
            List<String> mine = lines.stream().filter(l -> l.startsWith(prefix)).collect(Collectors.toList());
            List<String> inOrder = IntStream.range(0, 50).mapToObj(i -> prefix + i).collect(Collectors.toList());
            assertEquals(inOrder, mine, "writes from one thread must keep their order");
        }
    }

    @Test
    void flushedBlockIsNeverSplitByOtherWriters() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        OutputConsole console = console(bytes, true);
        console.startWaiting("Blocking");

        ExecutorService writers = Executors.newFixedThreadPool(5);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            int thread = t;
            futures.add(writers.submit(() -> {
                for (int i = 0; i < 40; i++) {
                    console.output("noise-" + thread + "-" + i);
                }
                return null;
            }));
        }
        futures.add(writers.submit(() -> {
            for (int b = 0; b < 10; b++) {
                OutputBuffer buffer = new OutputBuffer()
                    .add("block-" + b + "-a")
                    .debug("block-" + b + "-b")
                    .error("block-" + b + "-c");
                console.flush(buffer);
            }
            return null;
        }));
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        writers.shutdown();
        console.stopWaiting();

        List<String> lines = TerminalTranscript.of(bytes.toString(StandardCharsets.UTF_8)).lines();
        for (int b = 0; b < 10; b++) {
            int start = lines.indexOf("block-" + b + "-a");
            assertTrue(start >= 0, "block " + b + " missing");
            assertEquals(List.of("block-" + b + "-a", "block-" + b + "-b", "block-" + b + "-c"),
                lines.subList(start, start + 3));
        }
    }
}
