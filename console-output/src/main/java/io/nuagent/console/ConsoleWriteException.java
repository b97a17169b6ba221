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

/**
 * Thrown when the console's output stream reports a write failure. The terminal is the
 * last-resort channel for reporting problems, so there is no local recovery: the failure
 * is handed to whichever caller attempted the write.
 *
 * @since 1.0.0
 */
public class ConsoleWriteException extends RuntimeException {

    /**
     * Creates a new exception describing the failed write.
     *
     * @param message description of the write that failed
     */
    public ConsoleWriteException(String message) {
        super(message);
    }
}
