/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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
 */

package org.fireflyframework.automation.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Per-node retry policy applied by the engine, not by node executors.
 *
 * <p>A {@code multiplier} of {@code 1.0} gives a fixed backoff; anything greater
 * grows the delay exponentially up to {@code maxDelay}.
 */
public record RetryPolicy(
        int maxAttempts,
        Duration initialDelay,
        Duration maxDelay,
        double multiplier,
        double jitterFactor
) {
    public static final RetryPolicy NO_RETRY = new RetryPolicy(
            1, Duration.ZERO, Duration.ZERO, 1.0, 0.0);

    public static final RetryPolicy DEFAULT = new RetryPolicy(
            3, Duration.ofSeconds(1), Duration.ofMinutes(5), 2.0, 0.0);

    public RetryPolicy {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        initialDelay = initialDelay != null ? initialDelay : Duration.ZERO;
        maxDelay = maxDelay != null ? maxDelay : initialDelay;
        if (initialDelay.isNegative()) throw new IllegalArgumentException("initialDelay must not be negative");
        if (maxDelay.compareTo(initialDelay) < 0) maxDelay = initialDelay;
        // 0.0 means the field was absent from a serialized definition
        if (multiplier == 0.0) multiplier = 1.0;
        if (multiplier < 1.0) throw new IllegalArgumentException("multiplier must be >= 1.0");
        if (jitterFactor < 0.0 || jitterFactor > 1.0) throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0");
    }

    public static RetryPolicy fixed(int maxAttempts, Duration delay) {
        return new RetryPolicy(maxAttempts, delay, delay, 1.0, 0.0);
    }

    public static RetryPolicy exponential(int maxAttempts, Duration initialDelay, Duration maxDelay) {
        return new RetryPolicy(maxAttempts, initialDelay, maxDelay, 2.0, 0.0);
    }

    @JsonIgnore
    public boolean isExponential() {
        return multiplier > 1.0;
    }

    /**
     * Delay before the retry following the given zero-based retry index
     * (0 is the wait between attempt 1 and attempt 2).
     */
    public Duration calculateDelay(int retryIndex) {
        if (retryIndex <= 0) return applyJitter(initialDelay.toMillis());
        long delayMs = initialDelay.toMillis();
        for (int i = 0; i < retryIndex; i++) {
            delayMs = (long) (delayMs * multiplier);
        }
        delayMs = Math.min(delayMs, maxDelay.toMillis());
        return applyJitter(delayMs);
    }

    private Duration applyJitter(long delayMs) {
        if (jitterFactor > 0.0 && delayMs > 0) {
            long jitter = (long) (delayMs * jitterFactor);
            delayMs = delayMs - jitter + ThreadLocalRandom.current().nextLong(2 * jitter + 1);
            delayMs = Math.max(0, delayMs);
        }
        return Duration.ofMillis(delayMs);
    }

    /**
     * Whether another attempt is allowed after {@code completedAttempts} attempts.
     */
    public boolean shouldRetry(int completedAttempts) {
        return completedAttempts < maxAttempts;
    }
}
