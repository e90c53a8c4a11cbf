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
import java.util.List;
import java.util.function.Consumer;

@Slf4j
public class CompositeJobSchedulerEvents implements JobSchedulerEvents {
    private final List<JobSchedulerEvents> delegates;

    public CompositeJobSchedulerEvents(List<JobSchedulerEvents> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    private void safeForEach(Consumer<JobSchedulerEvents> action) {
        for (var d : delegates) {
            try { action.accept(d); }
            catch (Exception e) { log.warn("[composite-events] Delegate {} failed: {}", d.getClass().getSimpleName(), e.getMessage()); }
        }
    }

    @Override public void onEngineStarted(int jobCount) { safeForEach(d -> d.onEngineStarted(jobCount)); }
    @Override public void onEngineStopped(int inFlight) { safeForEach(d -> d.onEngineStopped(inFlight)); }
    @Override public void onJobTriggered(String job, String trigger) { safeForEach(d -> d.onJobTriggered(job, trigger)); }
    @Override public void onDispatchSkipped(String job, String reason) { safeForEach(d -> d.onDispatchSkipped(job, reason)); }
    @Override public void onAttemptCompleted(String job, String trigger, int attempt, int status, long durationMs) { safeForEach(d -> d.onAttemptCompleted(job, trigger, attempt, status, durationMs)); }
    @Override public void onRetryScheduled(String job, int nextAttempt, Duration backoff) { safeForEach(d -> d.onRetryScheduled(job, nextAttempt, backoff)); }
    @Override public void onJobCompleted(String job, String trigger, int status, int attempts) { safeForEach(d -> d.onJobCompleted(job, trigger, status, attempts)); }
    @Override public void onDependentTriggered(String parent, String dependent) { safeForEach(d -> d.onDependentTriggered(parent, dependent)); }
    @Override public void onWebhookDelivered(String job, String url, WebhookFormat format) { safeForEach(d -> d.onWebhookDelivered(job, url, format)); }
    @Override public void onWebhookFailed(String job, String url, WebhookFormat format, Throwable error) { safeForEach(d -> d.onWebhookFailed(job, url, format, error)); }
    @Override public void onRecordFailed(String job, Throwable error) { safeForEach(d -> d.onRecordFailed(job, error)); }
}
