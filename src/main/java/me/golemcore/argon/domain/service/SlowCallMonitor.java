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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.argon.infrastructure.config.ArgonProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Times service calls and flags the ones slower than
 * {@code argon.monitoring.slow-call-threshold}. Observability only: a slow call
 * is never interrupted.
 */
@Component
@Slf4j
public class SlowCallMonitor {

    private final ArgonProperties properties;
    private final LongSupplier nanoTime;
    private final AtomicLong slowCalls = new AtomicLong();
    private final AtomicLong failedCalls = new AtomicLong();

    @Autowired
    public SlowCallMonitor(ArgonProperties properties) {
        this(properties, System::nanoTime);
    }

    SlowCallMonitor(ArgonProperties properties, LongSupplier nanoTime) {
        this.properties = properties;
        this.nanoTime = nanoTime;
    }

    /**
     * Starts timing; use in try-with-resources and record the outcome before the
     * block ends.
     */
    public CallTimer start(String operation) {
        return new CallTimer(this, operation, nanoTime.getAsLong());
    }

    long now() {
        return nanoTime.getAsLong();
    }

    void record(String operation, Duration elapsed, Throwable failure) {
        Duration threshold = properties.getMonitoring().getSlowCallThreshold();
        boolean slow = threshold != null && elapsed.compareTo(threshold) > 0;
        if (slow) {
            slowCalls.incrementAndGet();
            log.warn("[SlowCall] {} took {}ms (threshold {}ms)", operation, elapsed.toMillis(), threshold.toMillis());
        }
        if (failure != null) {
            failedCalls.incrementAndGet();
            log.warn("[SlowCall] {} failed after {}ms: {}", operation, elapsed.toMillis(), failure.getMessage());
        } else if (!slow) {
            log.debug("[SlowCall] {} completed in {}ms", operation, elapsed.toMillis());
        }
    }

    public long getSlowCallCount() {
        return slowCalls.get();
    }

    public long getFailedCallCount() {
        return failedCalls.get();
    }
}
