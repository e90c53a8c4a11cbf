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


package org.fireflyframework.scheduler.core.model;

import java.time.Duration;

/**
 * Bounded retry with a constant delay between attempts.
 *
 * @param maxAttempts total attempts including the first one
 * @param backoff     delay between a failed attempt and the next one
 */
public record RetryPolicy(int maxAttempts, Duration backoff) {

    public static final Duration DEFAULT_BACKOFF = Duration.ofSeconds(5);

    public RetryPolicy {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (backoff == null || backoff.isNegative()) throw new IllegalArgumentException("backoff must be >= 0");
    }

    public static RetryPolicy forJob(JobSpec job, Duration backoff) {
        return new RetryPolicy(Math.max(0, job.retries()) + 1, backoff);
    }

    /**
     * @param attemptsMade number of attempts already executed
     */
    public boolean shouldRetry(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    /**
     * Trigger descriptor for the given zero-based attempt. The first attempt keeps
     * the initial trigger; retries are annotated with their index.
     */
    public static String describe(String trigger, int attempt) {
        return attempt == 0 ? trigger : trigger + "[retry=" + attempt + "]";
    }
}
