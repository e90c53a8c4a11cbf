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


package org.fireflyframework.scheduler.core.observability;

import org.fireflyframework.scheduler.core.notify.WebhookFormat;

import java.time.Duration;

public interface JobSchedulerEvents {
    // Engine lifecycle
    default void onEngineStarted(int jobCount) {}
    default void onEngineStopped(int inFlight) {}

    // Dispatch
    default void onJobTriggered(String job, String trigger) {}
    default void onDispatchSkipped(String job, String reason) {}

    // Attempts
    default void onAttemptCompleted(String job, String trigger, int attempt, int status, long durationMs) {}
    default void onRetryScheduled(String job, int nextAttempt, Duration backoff) {}
    default void onJobCompleted(String job, String trigger, int status, int attempts) {}

    // Cascade
    default void onDependentTriggered(String parent, String dependent) {}
    default void onWebhookDelivered(String job, String url, WebhookFormat format) {}
    default void onWebhookFailed(String job, String url, WebhookFormat format, Throwable error) {}

    // History
    default void onRecordFailed(String job, Throwable error) {}
}
