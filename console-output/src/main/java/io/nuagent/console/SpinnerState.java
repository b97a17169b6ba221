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

import java.time.Instant;

/**
 * Mutable state of one {@link SpinnerAnimator}.
 *
 * <p>Writers hold the console lock. Fields read by the render thread outside that lock
 * ({@code interruptRequested}) or by observers ({@code running}, {@code ownerHandle}) are
 * volatile. {@code frame} is touched only by the render loop, and by {@link #start} before
 * the loop's thread is started.</p>
 *
 * <p>Invariant: {@code running} implies a non-null {@code ownerHandle}.</p>
 */
final class SpinnerState {

    private volatile boolean running;
    private volatile String message = "";
    private volatile Instant startedAt;
    private volatile Thread ownerHandle;
    private volatile boolean interruptRequested;
    private int frame;

    boolean isActive() {
        return running && ownerHandle != null;
    }

    String getMessage() {
        return message;
    }

    void update(String message, Instant startedAt) {
        this.message = message;
        this.startedAt = startedAt;
    }

    Instant getStartedAt() {
        return startedAt;
    }

    Thread getOwnerHandle() {
        return ownerHandle;
    }

    boolean isInterruptRequested() {
        return interruptRequested;
    }

    void requestInterrupt() {
        this.interruptRequested = true;
    }

    /**
     * Returns the current frame and advances the counter, wrapping at {@code glyphCount}.
     */
    int advanceFrame(int glyphCount) {
        int current = frame;
        frame = (frame + 1) % glyphCount;
        return current;
    }

    void start(String message, Instant startedAt, Thread owner) {
        this.message = message;
        this.startedAt = startedAt;
        this.frame = 0;
        this.interruptRequested = false;
        this.ownerHandle = owner;
        this.running = true;
    }

    void stop() {
        this.running = false;
        this.ownerHandle = null;
    }
}
