package me.golemcore.argon.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.time.Duration;

/**
 * Scoped timer for one call, acquired at call start. The first
 * {@code recordSuccess}/{@code recordFailure} wins; closing a timer that was
 * never recorded counts as a failure.
 */
public final class CallTimer implements AutoCloseable {

    private final SlowCallMonitor monitor;
    private final String operation;
    private final long startNanos;
    private Duration elapsed;

    CallTimer(SlowCallMonitor monitor, String operation, long startNanos) {
        this.monitor = monitor;
        this.operation = operation;
        this.startNanos = startNanos;
    }

    public Duration recordSuccess() {
        return finish(null);
    }

    public Duration recordFailure(Throwable failure) {
        return finish(failure != null ? failure : new IllegalStateException("call failed"));
    }

    public synchronized boolean isRecorded() {
        return elapsed != null;
    }

    @Override
    public synchronized void close() {
        if (elapsed == null) {
            finish(new IllegalStateException("call ended without a recorded outcome"));
        }
    }

    private synchronized Duration finish(Throwable failure) {
        if (elapsed != null) {
            return elapsed;
        }
        elapsed = Duration.ofNanos(monitor.now() - startNanos);
        monitor.record(operation, elapsed, failure);
        return elapsed;
    }
}
