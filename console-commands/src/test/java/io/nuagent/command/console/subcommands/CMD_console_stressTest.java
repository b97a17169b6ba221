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

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class CMD_console_stressTest {

    @Test
    void everyLineIsWrittenExactlyOnce() {
        CapturedConsole captured = new CapturedConsole();
        int exitCode = new CommandLine(new CMD_console_stress(captured.stream()))
            .execute("--threads", "20", "--toggle-for", "500ms", "--no-color", "--frame-interval", "10");

        assertEquals(0, exitCode);
        List<String> lines = captured.lines();
        List<String> written = lines.stream()
            .filter(l -> l.startsWith(CMD_console_stress.LINE_PREFIX))
            .collect(Collectors.toList());
        List<String> expected = IntStream.range(0, 20)
            .mapToObj(i -> CMD_console_stress.LINE_PREFIX + i)
            .collect(Collectors.toList());

        assertThat(written).containsExactlyInAnyOrderElementsOf(expected);
        assertThat(lines.get(lines.size() - 1)).startsWith("Wrote 20 lines while toggling the spinner ");
        assertEquals(lines.size(), written.size() + 1, "no spinner text may leak into committed lines");
        assertEquals("", captured.residue());
    }

    @Test
    void brokenOutputFailsTheRun() {
        int exitCode = new CommandLine(new CMD_console_stress(CapturedConsole.failingStream()))
            .execute("--threads", "4", "--toggle-for", "100ms", "--frame-interval", "10");

        assertEquals(1, exitCode);
    }

    @Test
    void zeroThreadsIsAUsageError() {
        assertEquals(2, new CommandLine(new CMD_console_stress(new CapturedConsole().stream()))
            .execute("--threads", "0"));
    }
}
