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

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DurationConverterTest {

    private final DurationConverter converter = new DurationConverter();

    @Test
    void parsesShortForms() {
        assertEquals(Duration.ofMillis(250), converter.convert("250ms"));
        assertEquals(Duration.ofSeconds(2), converter.convert("2s"));
        assertEquals(Duration.ofMillis(1500), converter.convert("1.5s"));
        assertEquals(Duration.ofMinutes(3), converter.convert("3m"));
        assertEquals(Duration.ofHours(1), converter.convert("1h"));
    }

    @Test
    void bareNumbersAreMilliseconds() {
        assertEquals(Duration.ofMillis(75), converter.convert(" 75 "));
    }

    @Test
    void acceptsIsoDurations() {
        assertEquals(Duration.ofSeconds(2), converter.convert("PT2S"));
        assertEquals(Duration.ofMillis(500), converter.convert("pt0.5s"));
    }

    @Test
    void rejectsGarbage() {
        assertThrows(CommandLine.TypeConversionException.class, () -> converter.convert("soon"));
        assertThrows(CommandLine.TypeConversionException.class, () -> converter.convert(""));
        assertThrows(CommandLine.TypeConversionException.class, () -> converter.convert("-2s"));
        assertThrows(CommandLine.TypeConversionException.class, () -> converter.convert("PTxS"));
    }
}
