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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects lines to be written to an {@link OutputConsole} as one contiguous block.
 * A tool that reports several diagnostic lines fills a buffer and hands it to
 * {@link OutputConsole#flush(OutputBuffer)}, so no other caller or spinner frame lands
 * between its lines.
 *
 * <p>Each stored entry is exactly one line. Text containing line breaks is split; leading and
 * trailing blank lines are dropped and runs of blank lines collapse into one.</p>
 *
 * <p>Not thread-safe: a buffer is meant to be filled by one caller.</p>
 *
 * <pre>{@code
 * OutputBuffer buffer = new OutputBuffer();
 * buffer.debug("[file_glob] pattern: " + pattern);
 * buffer.debug("[file_glob] sort_by: " + sortBy + ", limit: " + limit);
 * console.flush(buffer);
 * }</pre>
 *
 * @since 1.0.0
 */
public final class OutputBuffer {

    /**
     * One buffered line and the style it is written with.
     *
     * @param text line text, never containing a line break
     * @param style how the line is rendered
     */
    public record Line(String text, ConsoleStyle style) {
    }

    private final List<Line> lines = new ArrayList<>();

    /**
     * Adds informational text.
     *
     * @param text the text, possibly spanning several lines
     * @return this buffer
     */
    public OutputBuffer add(String text) {
        return add(text, ConsoleStyle.PLAIN);
    }

    /**
     * Adds diagnostic text, written only when the console has debug output enabled.
     *
     * @param text the text, possibly spanning several lines
     * @return this buffer
     */
    public OutputBuffer debug(String text) {
        return add(text, ConsoleStyle.DEBUG);
    }

    /**
     * Adds error text.
     *
     * @param text the text, possibly spanning several lines
     * @return this buffer
     */
    public OutputBuffer error(String text) {
        return add(text, ConsoleStyle.ERROR);
    }

    /**
     * Adds text with an explicit style.
     *
     * @param text the text, possibly spanning several lines; {@code null} is stored as "null"
     * @param style the style of every line produced from {@code text}
     * @return this buffer
     */
    public OutputBuffer add(String text, ConsoleStyle style) {
        String value = String.valueOf(text);
        if (value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
            lines.add(new Line(value, style));
            return this;
        }

        List<String> split = new ArrayList<>(value.lines().toList());
        while (!split.isEmpty() && split.get(0).isEmpty()) {
            split.remove(0);
        }
        while (!split.isEmpty() && split.get(split.size() - 1).isEmpty()) {
            split.remove(split.size() - 1);
        }

        boolean previousBlank = false;
        for (String line : split) {
            boolean blank = line.isEmpty();
            if (!(blank && previousBlank)) {
                lines.add(new Line(line, style));
            }
            previousBlank = blank;
        }
        return this;
    }

    /**
     * @return {@code true} when nothing has been buffered
     */
    public boolean isEmpty() {
        return lines.isEmpty();
    }

    /**
     * @return an unmodifiable view of the buffered lines, in insertion order
     */
    public List<Line> getLines() {
        return Collections.unmodifiableList(lines);
    }

    /**
     * Discards all buffered lines.
     */
    public void clear() {
        lines.clear();
    }
}
