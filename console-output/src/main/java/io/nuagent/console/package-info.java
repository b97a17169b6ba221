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

/**
 * Thread-safe console output with an animated waiting indicator.
 *
 * <h2>Core Architecture</h2>
 * <ul>
 *   <li><strong>{@link io.nuagent.console.OutputConsole}</strong> - the only entry point for callers;
 *       serializes all writes and owns the waiting intent</li>
 *   <li><strong>{@link io.nuagent.console.SpinnerAnimator}</strong> - package-private render loop
 *       that redraws the spinner line in place on a daemon thread</li>
 *   <li><strong>{@link io.nuagent.console.OutputBuffer}</strong> - collects several lines to be
 *       written as one uninterrupted block</li>
 *   <li><strong>{@link io.nuagent.console.ConsoleStyle}</strong> - ANSI treatments for plain, debug,
 *       error and spinner text</li>
 * </ul>
 *
 * <h2>Concurrency Model</h2>
 * <p>Any number of foreground threads write through the console while at most one render thread
 * animates the spinner. Both the output stream and the spinner state are guarded by one lock owned
 * by the console. Foreground operations hold it end to end; the render loop holds it for a single
 * frame. Stopping the spinner is cooperative and waits at most about one frame interval.</p>
 *
 * <h2>Rendered Output</h2>
 * <pre>
 * \r\e[K⠋ Thinking...        spinner frame, redrawn in place
 * \r\e[K                     erase before a foreground write
 * tool finished              the foreground line
 * \r\e[K⠋ Thinking...        spinner resumed on the next line
 * </pre>
 *
 * @since 1.0.0
 */
package io.nuagent.console;
