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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Background render loop that redraws the waiting indicator in place on the console's
 * current line. Each {@link OutputConsole} owns exactly one animator and is the only
 * component that starts or stops it.
 *
 * <p>Lifecycle: {@code Idle -> Running -> Stopping -> Idle}.
 * <ol>
 *   <li>{@link #start} spawns a daemon render thread (retiring any previous one first)</li>
 *   <li>{@link #stop} sets the interrupt flag, wakes the thread and joins it</li>
 *   <li>the thread observes the flag, erases its line and exits</li>
 * </ol>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li><strong>Control:</strong> {@link #start}, {@link #stop} and {@link #updateMessage} must be
 *       called while holding the console lock; this is checked.</li>
 *   <li><strong>Rendering:</strong> each frame is drawn under the same lock, which is released
 *       before the frame interval sleep so foreground writes interleave between frames.</li>
 *   <li><strong>Final erase:</strong> runs after the stopping thread has set the interrupt flag.
 *       That thread holds the lock until the join returns, so no other writer can proceed.</li>
 *   <li><strong>Lock waits:</strong> the render thread acquires the lock interruptibly, so a stop
 *       issued while it waits for the lock never deadlocks.</li>
 * </ul>
 *
 * <p>This class is package-private and should only be instantiated by {@link OutputConsole}.
 *
 * @see OutputConsole
 * @since 1.0.0
 */
final class SpinnerAnimator {

    private static final Logger logger = LogManager.getLogger(SpinnerAnimator.class);

    /** Braille animation glyphs, drawn in order. */
    static final String[] FRAMES = {"⠋", "⠙", "⠹", "⠸", "⠼", "⠴", "⠦", "⠧", "⠇", "⠏"};

    /** Prefix of every render thread name. */
    static final String THREAD_NAME_PREFIX = "OutputConsole-Spinner-";

    private static final AtomicInteger threadSequence = new AtomicInteger();

    private final ReentrantLock lock;
    private final TerminalStream stream;
    private final long frameIntervalMillis;
    private final Clock clock;
    private final boolean useColors;
    private final SpinnerState state = new SpinnerState();

    SpinnerAnimator(ReentrantLock lock, TerminalStream stream, Duration frameInterval, Clock clock, boolean useColors) {
        this.lock = lock;
        this.stream = stream;
        this.frameIntervalMillis = frameInterval.toMillis();
        this.clock = clock;
        this.useColors = useColors;
    }

    /**
     * Starts a render loop showing {@code message}. A loop that is still alive is fully retired
     * first, so at most one render thread ever exists.
     *
     * @param message text shown beside the glyph
     * @param startedAt when the waiting period began, or {@code null} for no elapsed-time suffix
     */
    void start(String message, Instant startedAt) {
        requireLock();
        if (state.getOwnerHandle() != null) {
            stop();
        }

        Thread renderer = new Thread(this::renderLoop, THREAD_NAME_PREFIX + threadSequence.incrementAndGet());
        renderer.setDaemon(true);
        state.start(message, startedAt, renderer);
        renderer.start();
        logger.debug("Started spinner thread {} with message '{}'", renderer.getName(), message);
    }

    /**
     * Stops the render loop and blocks until it has erased its line and exited. Does nothing
     * when no loop is running. The wait is bounded by roughly one frame interval.
     */
    void stop() {
        requireLock();
        Thread owner = state.getOwnerHandle();
        if (owner == null) {
            return;
        }
        if (owner == Thread.currentThread()) {
            throw new IllegalStateException("The spinner render thread cannot stop itself");
        }

        state.requestInterrupt();
        owner.interrupt();

        boolean interrupted = false;
        while (owner.isAlive()) {
            try {
                owner.join();
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        state.stop();
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        logger.debug("Stopped spinner thread {}", owner.getName());
    }

    /**
     * Replaces the message of the running loop without restarting it. The frame counter keeps
     * advancing from where it was.
     *
     * @param message the new text shown beside the glyph
     * @param startedAt the new elapsed-time origin, or {@code null} for none
     */
    void updateMessage(String message, Instant startedAt) {
        requireLock();
        state.update(message, startedAt);
    }

    /**
     * @return {@code true} while a render loop is running
     */
    boolean active() {
        return state.isActive();
    }

    String getMessage() {
        return state.getMessage();
    }

    Instant getStartedAt() {
        return state.getStartedAt();
    }

    private void renderLoop() {
        try {
            while (!state.isInterruptRequested()) {
                try {
                    drawFrame();
                    TimeUnit.MILLISECONDS.sleep(frameIntervalMillis);
                } catch (InterruptedException e) {
                    if (!state.isInterruptRequested()) {
                        logger.debug("Spinner thread woken without a stop request, continuing");
                    }
                }
            }
            stream.eraseLine();
        } catch (ConsoleWriteException e) {
            logger.error("Spinner render loop terminated: {}", e.getMessage(), e);
        }
        logger.debug("Spinner render loop exited");
    }

    private void drawFrame() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            if (state.isInterruptRequested()) {
                return;
            }
            int frame = state.advanceFrame(FRAMES.length);
            stream.write(TerminalStream.ERASE_LINE + ConsoleStyle.SPINNER.render(renderText(frame), useColors));
        } finally {
            lock.unlock();
        }
    }

    private String renderText(int frame) {
        StringBuilder text = new StringBuilder(FRAMES[frame % FRAMES.length])
            .append(' ')
            .append(state.getMessage());
        Instant startedAt = state.getStartedAt();
        if (startedAt != null) {
            text.append(" (").append(formatElapsed(Duration.between(startedAt, clock.instant()))).append(')');
        }
        return text.toString();
    }

    /**
     * Formats a waiting duration for the spinner line: {@code 30.5s} under a minute,
     * {@code 2m 5s} under an hour, {@code 2h 2m} beyond. Negative durations render as zero.
     *
     * @param elapsed time since the waiting period began
     * @return the compact elapsed-time label
     */
    static String formatElapsed(Duration elapsed) {
        long millis = Math.max(0L, elapsed.toMillis());
        if (millis < 60_000L) {
            return String.format(Locale.ROOT, "%.1fs", millis / 1000.0);
        }
        long seconds = millis / 1000L;
        if (seconds < 3600L) {
            return (seconds / 60L) + "m " + (seconds % 60L) + "s";
        }
        return (seconds / 3600L) + "h " + ((seconds % 3600L) / 60L) + "m";
    }

    private void requireLock() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("The spinner may only be controlled while holding the console lock");
        }
    }
}
