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

import picocli.CommandLine;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picocli type converter for short duration specs such as {@code 250ms}, {@code 2s},
 * {@code 1.5s} or {@code 3m}. A bare number is read as milliseconds, and ISO-8601 forms like
 * {@code PT2S} are accepted as well.
 */
public class DurationConverter implements CommandLine.ITypeConverter<Duration> {

    private static final Pattern SHORT_FORM = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*(ms|s|m|h)?");

    @Override
    public Duration convert(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new CommandLine.TypeConversionException("Duration must not be empty");
        }
        String spec = value.trim().toLowerCase(Locale.ROOT);
        if (spec.startsWith("pt")) {
            try {
                return Duration.parse(spec.toUpperCase(Locale.ROOT));
            } catch (DateTimeParseException e) {
                throw new CommandLine.TypeConversionException("Invalid ISO-8601 duration: " + value);
            }
        }

        Matcher matcher = SHORT_FORM.matcher(spec);
        if (!matcher.matches()) {
            throw new CommandLine.TypeConversionException(
                "Invalid duration: " + value + ". Expected a number with an optional ms, s, m or h suffix.");
        }
        double amount = Double.parseDouble(matcher.group(1));
        String unit = matcher.group(2) == null ? "ms" : matcher.group(2);
        double millis = switch (unit) {
            case "s" -> amount * 1_000d;
            case "m" -> amount * 60_000d;
            case "h" -> amount * 3_600_000d;
            default -> amount;
        };
        return Duration.ofMillis(Math.round(millis));
    }
}
