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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.fireflyframework.scheduler.core.notify.WebhookFormat;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

public class JobSchedulerMetrics implements JobSchedulerEvents {
    private static final String PREFIX = "firefly.scheduler";
    private final MeterRegistry registry;
    private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();

    public JobSchedulerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onJobTriggered(String job, String trigger) {
        counter("jobs.triggered", "job", job).increment();
    }

    @Override
    public void onDispatchSkipped(String job, String reason) {
        counter("jobs.skipped", "job", job).increment();
    }

    @Override
    public void onAttemptCompleted(String job, String trigger, int attempt, int status, long durationMs) {
        counter("attempts.completed", "job", job, "success", String.valueOf(status == 0)).increment();
        timer("attempts.duration", "job", job).record(Duration.ofMillis(durationMs));
    }

    @Override
    public void onRetryScheduled(String job, int nextAttempt, Duration backoff) {
        counter("attempts.retries", "job", job).increment();
    }

    @Override
    public void onJobCompleted(String job, String trigger, int status, int attempts) {
        counter("jobs.completed", "job", job, "success", String.valueOf(status == 0)).increment();
    }

    @Override
    public void onWebhookDelivered(String job, String url, WebhookFormat format) {
        counter("webhooks.sent", "format", format.name(), "success", "true").increment();
    }

    @Override
    public void onWebhookFailed(String job, String url, WebhookFormat format, Throwable error) {
        counter("webhooks.sent", "format", format.name(), "success", "false").increment();
    }

    @Override
    public void onRecordFailed(String job, Throwable error) {
        counter("history.failures", "job", job).increment();
    }

    private Counter counter(String metricName, String... tags) {
        String key = metricName + String.join(",", tags);
        return counters.computeIfAbsent(key, k -> Counter.builder(PREFIX + "." + metricName).tags(tags).register(registry));
    }

    private Timer timer(String metricName, String... tags) {
        String key = metricName + String.join(",", tags);
        return timers.computeIfAbsent(key, k -> Timer.builder(PREFIX + "." + metricName).tags(tags).register(registry));
    }
}
