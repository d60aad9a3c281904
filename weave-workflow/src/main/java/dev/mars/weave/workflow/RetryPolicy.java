/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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


package dev.mars.weave.workflow;

import dev.mars.weave.config.WeaveConfiguration;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry budget and linear backoff for one task.
 *
 * A task gets {@code maxRetries + 1} attempts. After the failed attempt with zero-based index
 * {@code i} the next attempt is delayed by {@code baseDelay * (i + 1)}.
 */
public final class RetryPolicy {

    private final int maxRetries;
    private final Duration baseDelay;
    private final Duration timeout;

    public RetryPolicy(int maxRetries, Duration baseDelay, Duration timeout) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries cannot be negative: " + maxRetries);
        }
        this.maxRetries = maxRetries;
        this.baseDelay = Objects.requireNonNull(baseDelay, "Base delay cannot be null");
        this.timeout = timeout != null ? timeout : Duration.ZERO;
    }

    /**
     * Per-task settings where declared, engine configuration otherwise.
     */
    public static RetryPolicy forTask(TaskSpec task, WeaveConfiguration configuration) {
        int retries = task.getMaxRetries() != null ? task.getMaxRetries() : configuration.getMaxRetries();
        Duration delay = task.getRetryDelay() != null ? task.getRetryDelay() : configuration.getRetryDelay();
        Duration attemptTimeout = task.getTimeout() != null ? task.getTimeout() : configuration.getTaskTimeout();
        return new RetryPolicy(Math.max(0, retries), delay, attemptTimeout);
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public int getMaxAttempts() {
        return maxRetries + 1;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    /**
     * @return the per-attempt timeout, {@link Duration#ZERO} when attempts are not timed out
     */
    public Duration getTimeout() {
        return timeout;
    }

    public boolean hasTimeout() {
        return !timeout.isZero() && !timeout.isNegative();
    }

    public boolean hasAttemptsRemaining(int attemptsMade) {
        return attemptsMade < getMaxAttempts();
    }

    /**
     * Delay before the attempt following the failed attempt {@code failedAttemptIndex} (zero-based).
     */
    public Duration delayBeforeRetry(int failedAttemptIndex) {
        return baseDelay.multipliedBy(failedAttemptIndex + 1L);
    }

    @Override
    public String toString() {
        return "RetryPolicy{" +
               "maxRetries=" + maxRetries +
               ", baseDelay=" + baseDelay +
               ", timeout=" + timeout +
               '}';
    }
}
