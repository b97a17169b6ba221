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

import java.io.PrintStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serializes every write to a shared console while a background spinner animates the
 * current line during waiting periods.
 *
 * <p>Callers emit informational, debug and error text from any thread. A caller waiting on a
 * long-running operation brackets it with {@link #startWaiting(String)} and
 * {@link #stopWaiting()}; in between, the console's {@link SpinnerAnimator} redraws a glyph and
 * message in place. A write arriving during a waiting period stops the spinner (erasing its
 * line), prints, and restarts the spinner with its unchanged message.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * OutputConsole console = OutputConsole.builder()
 *     .withDebug(config.isDebug())
 *     .build();
 *
 * console.startWaiting("Thinking...");
 * try {
 *     Response response = client.send(request);
 *     console.output(response.text());
 * } catch (Exception e) {
 *     console.errorOutput("Request failed: " + e.getMessage());
 * } finally {
 *     console.stopWaiting();
 * }
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <ul>
 *   <li><strong>One lock:</strong> every public operation holds the console lock for its whole
 *       duration, including stopping and restarting the spinner, so operations never interleave
 *       and writes appear in lock acquisition order.</li>
 *   <li><strong>Render loop:</strong> takes the same lock only to draw a single frame and
 *       releases it before sleeping.</li>
 *   <li><strong>Waiting intent:</strong> {@code waiting} records what the caller asked for. The
 *       spinner itself is briefly stopped around every print while the intent persists.</li>
 *   <li><strong>Debug flag:</strong> volatile, checked before taking the lock so disabled debug
 *       output costs nothing.</li>
 * </ul>
 *
 * <h2>Errors</h2>
 * <p>A failing output stream raises {@link ConsoleWriteException} to the calling thread. There
 * is no retry or fallback.</p>
 *
 * @see OutputBuffer
 * @see ConsoleStyle
 * @since 1.0.0
 */
public final class OutputConsole implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(OutputConsole.class);

    /** Message shown when {@link #startWaiting()} is called without one. */
    public static final String DEFAULT_WAITING_MESSAGE = "Thinking...";

    /** Frame interval used unless the builder overrides it. */
    public static final Duration DEFAULT_FRAME_INTERVAL = Duration.ofMillis(100);

    static final Duration MIN_FRAME_INTERVAL = Duration.ofMillis(10);
    static final Duration MAX_FRAME_INTERVAL = Duration.ofMillis(1000);

    private final ReentrantLock lock = new ReentrantLock();
    private final TerminalStream stream;
    private final SpinnerAnimator spinner;
    private final boolean useColors;
    private volatile boolean debugEnabled;
    private boolean waiting;

    private OutputConsole(Builder builder) {
        this.stream = new TerminalStream(builder.output);
        this.useColors = builder.useColors;
        this.debugEnabled = builder.debug;
        this.spinner = new SpinnerAnimator(lock, stream, builder.frameInterval, builder.clock, useColors);
    }

    /**
     * Creates a console writing to {@code System.out} with default settings.
     *
     * @return a new console
     */
    public static OutputConsole create() {
        return builder().build();
    }

    /**
     * @return a builder for configuring a console
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Writes informational text followed by a line break.
     *
     * @param text the text to write
     * @throws ConsoleWriteException if the output stream fails
     */
    public void output(String text) {
        write(text, ConsoleStyle.PLAIN);
    }

    /**
     * Writes diagnostic text in a dimmed style. Does nothing, and does not touch the lock,
     * while debug output is disabled.
     *
     * @param text the text to write
     * @throws ConsoleWriteException if the output stream fails
     */
    public void debugOutput(String text) {
        if (!debugEnabled) {
            return;
        }
        write(text, ConsoleStyle.DEBUG);
    }

    /**
     * Writes error text in an alert style. Always written, regardless of debug settings.
     *
     * @param text the text to write
     * @throws ConsoleWriteException if the output stream fails
     */
    public void errorOutput(String text) {
        write(text, ConsoleStyle.ERROR);
    }

    /**
     * Writes every line of {@code buffer} as one uninterrupted block and clears the buffer.
     * Debug lines are skipped while debug output is disabled.
     *
     * @param buffer the lines to write
     * @throws ConsoleWriteException if the output stream fails
     */
    public void flush(OutputBuffer buffer) {
        Objects.requireNonNull(buffer, "buffer");
        lock.lock();
        try {
            StringBuilder block = new StringBuilder();
            for (OutputBuffer.Line line : buffer.getLines()) {
                if (line.style() == ConsoleStyle.DEBUG && !debugEnabled) {
                    continue;
                }
                block.append(line.style().render(line.text(), useColors)).append(System.lineSeparator());
            }
            if (block.length() > 0) {
                writeAroundSpinner(block.toString());
            }
            buffer.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Starts a waiting period with {@value #DEFAULT_WAITING_MESSAGE}.
     *
     * @see #startWaiting(String)
     */
    public void startWaiting() {
        startWaiting(DEFAULT_WAITING_MESSAGE);
    }

    /**
     * Starts a waiting period. If the spinner is already animating only its message changes;
     * a second render loop is never started.
     *
     * @param message text shown beside the spinner glyph
     */
    public void startWaiting(String message) {
        startWaiting(message, null);
    }

    /**
     * Starts a waiting period whose spinner line shows the time elapsed since
     * {@code startedAt}, e.g. {@code ⠹ Thinking... (2m 5s)}.
     *
     * @param message text shown beside the spinner glyph
     * @param startedAt when the waited-on operation began, or {@code null} for no elapsed time
     */
    public void startWaiting(String message, Instant startedAt) {
        Objects.requireNonNull(message, "message");
        lock.lock();
        try {
            waiting = true;
            if (spinner.active()) {
                spinner.updateMessage(message, startedAt);
            } else {
                spinner.start(message, startedAt);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ends the waiting period, stopping the spinner and erasing its line. Calling this while
     * not waiting writes nothing.
     */
    public void stopWaiting() {
        lock.lock();
        try {
            waiting = false;
            if (spinner.active()) {
                spinner.stop();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reports whether the spinner is animating. Collaborators that read input, such as a
     * confirmation prompt, use this to pick a spinner-aware input path.
     *
     * @return {@code true} between {@link #startWaiting} and the matching {@link #stopWaiting}
     */
    public boolean active() {
        lock.lock();
        try {
            return spinner.active();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return whether {@link #debugOutput(String)} produces output
     */
    public boolean isDebugEnabled() {
        return debugEnabled;
    }

    /**
     * Enables or disables debug output at runtime.
     *
     * @param debugEnabled {@code true} to show debug output
     */
    public void setDebugEnabled(boolean debugEnabled) {
        this.debugEnabled = debugEnabled;
        logger.debug("Debug output {}", debugEnabled ? "enabled" : "disabled");
    }

    /**
     * Ends any waiting period. The console remains usable afterwards.
     */
    @Override
    public void close() {
        stopWaiting();
    }

    private void write(String text, ConsoleStyle style) {
        String rendered = style.render(String.valueOf(text), useColors) + System.lineSeparator();
        lock.lock();
        try {
            writeAroundSpinner(rendered);
        } finally {
            lock.unlock();
        }
    }

    private void writeAroundSpinner(String rendered) {
        if (!waiting) {
            stream.write(rendered);
            return;
        }

        String message = spinner.getMessage();
        Instant startedAt = spinner.getStartedAt();
        spinner.stop();
        stream.write(rendered);
        spinner.start(message, startedAt);
    }

    /**
     * Builder for {@link OutputConsole}.
     *
     * <pre>{@code
     * OutputConsole console = OutputConsole.builder()
     *     .withOutput(System.out)
     *     .withDebug(true)
     *     .withColorOutput(true)
     *     .withFrameInterval(Duration.ofMillis(100))
     *     .build();
     * }</pre>
     */
    public static final class Builder {
        private PrintStream output = System.out;
        private boolean debug = false;
        private boolean useColors = true;
        private Duration frameInterval = DEFAULT_FRAME_INTERVAL;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        /**
         * Sets the stream all output is written to. Defaults to {@code System.out}.
         *
         * @param output the target stream
         * @return this builder
         */
        public Builder withOutput(PrintStream output) {
            this.output = Objects.requireNonNull(output, "output");
            return this;
        }

        /**
         * Sets whether {@link OutputConsole#debugOutput(String)} produces output. Defaults to {@code false}.
         *
         * @param debug {@code true} to show debug output
         * @return this builder
         */
        public Builder withDebug(boolean debug) {
            this.debug = debug;
            return this;
        }

        /**
         * Sets whether styled output carries ANSI colour sequences. Defaults to {@code true}.
         *
         * @param useColors {@code false} for plain text on dumb terminals
         * @return this builder
         */
        public Builder withColorOutput(boolean useColors) {
            this.useColors = useColors;
            return this;
        }

        /**
         * Sets the pause between spinner frames, which also bounds how long stopping the
         * spinner can block. Must lie between 10 ms and 1 s.
         *
         * @param frameInterval time between frames
         * @return this builder
         * @throws IllegalArgumentException if the interval is out of range
         */
        public Builder withFrameInterval(Duration frameInterval) {
            Objects.requireNonNull(frameInterval, "frameInterval");
            if (frameInterval.compareTo(MIN_FRAME_INTERVAL) < 0 || frameInterval.compareTo(MAX_FRAME_INTERVAL) > 0) {
                throw new IllegalArgumentException("Frame interval must be between " + MIN_FRAME_INTERVAL.toMillis()
                    + "ms and " + MAX_FRAME_INTERVAL.toMillis() + "ms, got " + frameInterval.toMillis() + "ms");
            }
            this.frameInterval = frameInterval;
            return this;
        }

        /**
         * Sets the clock used for the spinner's elapsed-time suffix.
         *
         * @param clock the time source
         * @return this builder
         */
        public Builder withClock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * @return a new console with this builder's settings
         */
        public OutputConsole build() {
            return new OutputConsole(this);
        }
    }
}
