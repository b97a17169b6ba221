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

import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStyle;

/**
 * Visual treatments applied to text written through {@link OutputConsole}.
 *
 * <ul>
 *   <li><strong>PLAIN</strong> - informational output, written untouched</li>
 *   <li><strong>DEBUG</strong> - diagnostics, dimmed (bright black)</li>
 *   <li><strong>ERROR</strong> - alerts, red</li>
 *   <li><strong>SPINNER</strong> - the waiting indicator line, bright blue</li>
 * </ul>
 *
 * <p>Styles are rendered to ANSI sequences through JLine's {@link AttributedString}. When colour
 * output is disabled every style renders as the bare text.</p>
 *
 * @since 1.0.0
 */
public enum ConsoleStyle {
    PLAIN(AttributedStyle.DEFAULT),
    DEBUG(AttributedStyle.DEFAULT.foreground(AttributedStyle.BRIGHT | AttributedStyle.BLACK)),
    ERROR(AttributedStyle.DEFAULT.foreground(AttributedStyle.RED)),
    SPINNER(AttributedStyle.DEFAULT.foreground(AttributedStyle.BRIGHT | AttributedStyle.BLUE));

    private final AttributedStyle style;

    ConsoleStyle(AttributedStyle style) {
        this.style = style;
    }

    /**
     * Renders text with this style.
     *
     * @param text the text to render
     * @param useColors whether ANSI styling should be emitted
     * @return the text, wrapped in ANSI style sequences when colours are enabled
     */
    public String render(String text, boolean useColors) {
        if (!useColors || this == PLAIN || text.isEmpty()) {
            return text;
        }
        return new AttributedString(text, style).toAnsi();
    }
}
