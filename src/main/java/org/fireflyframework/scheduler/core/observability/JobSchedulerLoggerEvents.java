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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.scheduler.core.notify.WebhookFormat;

import java.time.Duration;

@Slf4j
public class JobSchedulerLoggerEvents implements JobSchedulerEvents {
    @Override
    public void onEngineStarted(int jobCount) {
        log.info("[scheduler] started jobs={}", jobCount);
    }
    @Override
    public void onEngineStopped(int inFlight) {
        log.info("[scheduler] stopped inFlight={}", inFlight);
    }
    @Override
    public void onJobTriggered(String job, String trigger) {
        log.info("[scheduler] job.triggered job={} trigger={}", job, trigger);
    }
    @Override
    public void onDispatchSkipped(String job, String reason) {
        log.info("[scheduler] job.skipped job={} reason={}", job, reason);
    }
    @Override
    public void onAttemptCompleted(String job, String trigger, int attempt, int status, long durationMs) {
        if (status == 0) {
            log.info("[job-runner] attempt.success job={} trigger={} attempt={} durationMs={}", job, trigger, attempt, durationMs);
        } else {
            log.warn("[job-runner] attempt.failed job={} trigger={} attempt={} status={} durationMs={}", job, trigger, attempt, status, durationMs);
        }
    }
    @Override
    public void onRetryScheduled(String job, int nextAttempt, Duration backoff) {
        log.info("[job-runner] retry.scheduled job={} attempt={} backoff={}", job, nextAttempt, backoff);
    }
    @Override
    public void onJobCompleted(String job, String trigger, int status, int attempts) {
        log.info("[job-runner] completed job={} trigger={} status={} attempts={}", job, trigger, status, attempts);
    }
    @Override
    public void onDependentTriggered(String parent, String dependent) {
        log.info("[cascade] dependent.triggered parent={} job={}", parent, dependent);
    }
    @Override
    public void onWebhookDelivered(String job, String url, WebhookFormat format) {
        log.debug("[notifier] delivered job={} url={} format={}", job, url, format);
    }
    @Override
    public void onWebhookFailed(String job, String url, WebhookFormat format, Throwable error) {
        log.warn("[notifier] delivery.failed job={} url={} format={} error={}", job, url, format, error.getMessage());
    }
    @Override
    public void onRecordFailed(String job, Throwable error) {
        log.warn("[run-recorder] record.failed job={} error={}", job, error.getMessage());
    }
}
