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


package org.fireflyframework.scheduler.core.execution;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.scheduler.core.cascade.CascadePlan;
import org.fireflyframework.scheduler.core.cascade.EventCascade;
import org.fireflyframework.scheduler.core.history.RunRecorder;
import org.fireflyframework.scheduler.core.model.JobRun;
import org.fireflyframework.scheduler.core.model.JobSpec;
import org.fireflyframework.scheduler.core.model.RetryPolicy;
import org.fireflyframework.scheduler.core.observability.JobSchedulerEvents;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Map;

/**
 * Executes a job with bounded, fixed-delay retries.
 *
 * <p>Every attempt is finalized before the next one starts: the run is recorded,
 * added to the job's recent runs, and its cascade is fired and awaited. Retries
 * therefore fire their own {@code on_error} actions. The first successful attempt
 * ends the execution; otherwise the last failed run is returned.
 */
@Slf4j
public class RetryController implements JobLauncher {

    private final JobExecutor executor;
    private final RunRecorder recorder;
    private final EventCascade cascade;
    private final Duration backoff;
    private final JobSchedulerEvents events;
    private final Scheduler blockingScheduler;

    public RetryController(JobExecutor executor, RunRecorder recorder, EventCascade cascade,
                           Duration backoff, JobSchedulerEvents events) {
        this(executor, recorder, cascade, backoff, events, Schedulers.boundedElastic());
    }

    public RetryController(JobExecutor executor, RunRecorder recorder, EventCascade cascade,
                           Duration backoff, JobSchedulerEvents events, Scheduler blockingScheduler) {
        this.executor = executor;
        this.recorder = recorder;
        this.cascade = cascade;
        this.backoff = backoff != null ? backoff : RetryPolicy.DEFAULT_BACKOFF;
        this.events = events;
        this.blockingScheduler = blockingScheduler;
    }

    @Override
    public Mono<JobRun> launch(JobSpec job, String trigger, Map<String, String> params) {
        return execute(job, trigger, params);
    }

    public Mono<JobRun> execute(JobSpec job, String trigger, Map<String, String> params) {
        RetryPolicy policy = RetryPolicy.forJob(job, backoff);
        return Mono.defer(() -> {
            events.onJobTriggered(job.name(), trigger);
            return attempt(job, trigger, params, policy, 0);
        });
    }

    /**
     * Runs a single attempt with no retry and finalizes it.
     */
    public Mono<JobRun> executeOnce(JobSpec job, String trigger, Map<String, String> params) {
        return Mono.defer(() -> {
            events.onJobTriggered(job.name(), trigger);
            return runAttempt(job, trigger, params, 0)
                    .doOnNext(run -> events.onJobCompleted(job.name(), trigger, run.status(), 1));
        });
    }

    private Mono<JobRun> attempt(JobSpec job, String trigger, Map<String, String> params,
                                 RetryPolicy policy, int attempt) {
        return runAttempt(job, RetryPolicy.describe(trigger, attempt), params, attempt)
                .flatMap(run -> {
                    int made = attempt + 1;
                    if (run.isSuccess() || !policy.shouldRetry(made)) {
                        events.onJobCompleted(job.name(), trigger, run.status(), made);
                        return Mono.just(run);
                    }
                    events.onRetryScheduled(job.name(), made, policy.backoff());
                    return Mono.delay(policy.backoff())
                            .then(Mono.defer(() -> attempt(job, trigger, params, policy, made)));
                });
    }

    private Mono<JobRun> runAttempt(JobSpec job, String trigger, Map<String, String> params, int attempt) {
        Map<String, String> passed = params != null ? params : Map.of();
        return Mono.fromCallable(() -> executor.execute(job, trigger, passed))
                .subscribeOn(blockingScheduler)
                .doOnNext(run -> events.onAttemptCompleted(job.name(), trigger, attempt,
                        run.status(), run.duration().toMillis()))
                .flatMap(run -> finalizeRun(job, run));
    }

    Mono<JobRun> finalizeRun(JobSpec job, JobRun run) {
        CascadePlan plan = cascade.plan(job, run);
        JobRun finished = run.withTriggered(plan.targets());
        return recorder.record(finished)
                .onErrorResume(e -> {
                    events.onRecordFailed(job.name(), e);
                    return Mono.empty();
                })
                .then(Mono.fromRunnable(() -> job.runs().add(finished)))
                .then(cascade.fire(job, finished, plan, this))
                .thenReturn(finished);
    }
}
