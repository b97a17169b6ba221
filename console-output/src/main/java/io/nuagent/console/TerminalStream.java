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

import java.io.PrintStream;
import java.util.Objects;

/**
 * The shared terminal stream written by both {@link OutputConsole} and {@link SpinnerAnimator}.
 * Callers must hold the console lock; this class adds no synchronization of its own.
 *
 * <p>{@link PrintStream} records failures instead of throwing them, so every write checks the
 * error state and converts a failure into a {@link ConsoleWriteException}.</p>
 */
final class TerminalStream {

    /** Carriage return followed by ANSI "erase to end of line". */
    static final String ERASE_LINE = "\r\u001b[K";

    private final PrintStream out;

    TerminalStream(PrintStream out) {
        this.out = Objects.requireNonNull(out, "output stream");
    }

    void write(String text) {
        out.print(text);
        if (out.checkError()) {
            throw new ConsoleWriteException("Failed writing " + text.length() + " chars to the console");
        }
    }

    void eraseLine() {
        write(ERASE_LINE);
    }
}
