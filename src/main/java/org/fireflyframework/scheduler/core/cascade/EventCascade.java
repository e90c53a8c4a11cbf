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


package org.fireflyframework.scheduler.core.cascade;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.scheduler.core.execution.JobLauncher;
import org.fireflyframework.scheduler.core.model.JobRun;
import org.fireflyframework.scheduler.core.model.JobSpec;
import org.fireflyframework.scheduler.core.model.OnEvent;
import org.fireflyframework.scheduler.core.model.Schedule;
import org.fireflyframework.scheduler.core.notify.WebhookFormat;
import org.fireflyframework.scheduler.core.notify.WebhookNotifier;
import org.fireflyframework.scheduler.core.observability.JobSchedulerEvents;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Fires the follow-on actions of a finished run: dependent jobs, generic webhooks
 * and Slack webhooks.
 *
 * <p>All actions of one run are dispatched concurrently and the returned {@link Mono}
 * completes only after every one of them has completed or failed. Since dependents
 * are full executions with their own cascades, a chain of triggers completes as a
 * whole. Failures are logged and never propagate.
 */
@Slf4j
public class EventCascade {

    private final Schedule schedule;
    private final WebhookNotifier notifier;
    private final JobSchedulerEvents events;

    /**
     * @param schedule registry used to resolve dependents and schedule-wide defaults;
     *                 may be {@code null} for a job running on its own
     */
    public EventCascade(Schedule schedule, WebhookNotifier notifier, JobSchedulerEvents events) {
        this.schedule = schedule;
        this.notifier = notifier;
        this.events = events;
    }

    public CascadePlan plan(JobSpec job, JobRun run) {
        boolean success = run.isSuccess();
        OnEvent local = success ? job.onSuccess() : job.onError();
        OnEvent global = schedule == null ? OnEvent.EMPTY : (success ? schedule.onSuccess() : schedule.onError());
        OnEvent merged = OnEvent.merge(local, global);
        return new CascadePlan(merged.triggerJob(), merged.notifyWebhook(), merged.notifySlackWebhook());
    }

    public Mono<Void> fire(JobSpec job, JobRun run, JobLauncher launcher) {
        return Mono.defer(() -> fire(job, run, plan(job, run), launcher));
    }

    public Mono<Void> fire(JobSpec job, JobRun run, CascadePlan plan, JobLauncher launcher) {
        if (plan.isEmpty()) {
            return Mono.empty();
        }
        return Mono.defer(() -> {
            List<Mono<?>> units = new ArrayList<>();
            plan.jobs().forEach(dependent -> units.add(launchDependent(job, dependent, launcher)));
            plan.webhooks().forEach(url -> units.add(deliver(run, url, WebhookFormat.GENERIC)));
            plan.slackWebhooks().forEach(url -> units.add(deliver(run, url, WebhookFormat.SLACK)));
            log.debug("[cascade] firing job={} status={} units={}", job.name(), run.status(), units.size());
            return Mono.when(units);
        });
    }

    private Mono<Void> launchDependent(JobSpec parent, String dependentName, JobLauncher launcher) {
        JobSpec dependent = schedule == null ? null : schedule.jobs().get(dependentName);
        if (dependent == null) {
            log.warn("[cascade] cannot find dependent job={} parent={}", dependentName, parent.name());
            return Mono.empty();
        }
        return Mono.defer(() -> {
                    events.onDependentTriggered(parent.name(), dependentName);
                    return launcher.launch(dependent, "job[" + parent.name() + "]", Map.of());
                })
                .onErrorResume(e -> {
                    log.warn("[cascade] dependent failed job={} parent={} error={}", dependentName, parent.name(), e.getMessage());
                    return Mono.empty();
                })
                .then();
    }

    private Mono<Void> deliver(JobRun run, String url, WebhookFormat format) {
        return notifier.notify(run, url, format)
                .doOnSuccess(body -> events.onWebhookDelivered(run.name(), url, format))
                .onErrorResume(e -> {
                    events.onWebhookFailed(run.name(), url, format, e);
                    return Mono.empty();
                })
                .then();
    }
}
