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


package org.fireflyframework.scheduler.core.scheduling;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.scheduler.core.exception.JobNotFoundException;
import org.fireflyframework.scheduler.core.execution.RetryController;
import org.fireflyframework.scheduler.core.history.RunRecorder;
import org.fireflyframework.scheduler.core.model.JobRun;
import org.fireflyframework.scheduler.core.model.JobSpec;
import org.fireflyframework.scheduler.core.model.Schedule;
import org.fireflyframework.scheduler.core.observability.JobSchedulerEvents;
import org.fireflyframework.scheduler.core.validation.ScheduleValidator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Owns a validated {@link Schedule} and drives its cron jobs.
 *
 * <p>A single tick thread evaluates, once per tick, which jobs are due and dispatches
 * each of them through the {@link RetryController} without waiting for it. Lifecycle:
 * {@link #validate()}, {@link #start()} or the blocking {@link #run()}, then {@link #stop()}.
 */
@Slf4j
public class ScheduleEngine {

    static final String CRON_TRIGGER = "cron";
    static final String MANUAL_TRIGGER = "manual";

    private final Schedule schedule;
    private final RetryController controller;
    private final RunRecorder recorder;
    private final ScheduleValidator validator;
    private final EngineSettings settings;
    private final Clock clock;
    private final JobSchedulerEvents events;

    private final InFlightTracker inFlight = new InFlightTracker();
    private final CountDownLatch stopped = new CountDownLatch(1);
    private final Map<String, CronSchedule> crons = new LinkedHashMap<>();
    // confined to the tick thread
    private final Map<String, Instant> nextFire = new HashMap<>();

    private volatile EngineState state = EngineState.LOADING;
    private ScheduledExecutorService ticker;

    public ScheduleEngine(Schedule schedule, RetryController controller, RunRecorder recorder,
                          ScheduleValidator validator, EngineSettings settings, Clock clock,
                          JobSchedulerEvents events) {
        this.schedule = schedule;
        this.controller = controller;
        this.recorder = recorder;
        this.validator = validator;
        this.settings = settings != null ? settings : EngineSettings.defaults();
        this.clock = clock;
        this.events = events;
    }

    /**
     * Validates the schedule and seeds every job's recent runs from the recorder.
     *
     * @throws org.fireflyframework.scheduler.core.exception.ScheduleValidationException on any definition error
     */
    public synchronized void validate() {
        if (state != EngineState.LOADING) {
            return;
        }
        state = EngineState.VALIDATING;
        validator.validateAndThrow(schedule);
        for (JobSpec job : schedule.jobs().values()) {
            if (job.hasCron()) {
                crons.put(job.name(), CronSchedule.parse(job.cron()));
            }
        }
        Flux.fromIterable(schedule.jobs().values())
                .flatMap(job -> recorder.readLast(job.name(), settings.recentRuns())
                        .doOnNext(runs -> job.runs().replaceAll(runs))
                        .onErrorResume(e -> {
                            log.warn("[scheduler] could not load recent runs job={} error={}", job.name(), e.getMessage());
                            return Mono.empty();
                        }))
                .then()
                .block();
        log.info("[scheduler] validated jobs={} cronJobs={}", schedule.size(), crons.size());
    }

    public synchronized void start() {
        if (state == EngineState.LOADING) {
            validate();
        }
        if (state != EngineState.VALIDATING) {
            return;
        }
        ticker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "job-scheduler-tick");
            t.setDaemon(true);
            return t;
        });
        long period = settings.tickInterval().toMillis();
        long initialDelay = period - (clock.millis() % period);
        ticker.scheduleAtFixedRate(this::safeTick, initialDelay, period, TimeUnit.MILLISECONDS);
        state = EngineState.RUNNING;
        events.onEngineStarted(schedule.size());
    }

    /**
     * Starts the engine if needed and blocks until {@link #stop()} is called.
     */
    public void run() {
        start();
        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[scheduler] run interrupted, stopping");
            stop();
        }
    }

    public void stop() {
        synchronized (this) {
            if (state == EngineState.STOPPING || state == EngineState.STOPPED) {
                return;
            }
            state = EngineState.STOPPING;
        }
        if (ticker != null) {
            ticker.shutdown();
            try {
                if (!ticker.awaitTermination(5, TimeUnit.SECONDS)) {
                    ticker.shutdownNow();
                }
            } catch (InterruptedException e) {
                ticker.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        if (settings.awaitInFlight()) {
            try {
                if (!inFlight.awaitIdle(settings.shutdownTimeout())) {
                    log.warn("[scheduler] shutdown timeout reached inFlight={}", inFlight.total());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        state = EngineState.STOPPED;
        events.onEngineStopped(inFlight.total());
        stopped.countDown();
    }

    /**
     * Executes one job once, with no retry, as a {@code manual} trigger.
     */
    public Mono<JobRun> runJob(String name) {
        return Mono.defer(() -> {
            JobSpec job = schedule.jobs().get(name);
            if (job == null) {
                return Mono.error(new JobNotFoundException(name));
            }
            inFlight.tryAcquire(name, false);
            return controller.executeOnce(job, MANUAL_TRIGGER, Map.of())
                    .doFinally(signal -> inFlight.release(name));
        });
    }

    private void safeTick() {
        try {
            tick(clock.instant());
        } catch (Exception e) {
            log.error("[scheduler] tick failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Dispatches every cron job due at {@code now} and returns their names. Called by
     * the tick thread; must not be called concurrently with it.
     */
    public List<String> tick(Instant now) {
        ZoneId zone = clock.getZone();
        List<String> dispatched = new ArrayList<>();
        for (Map.Entry<String, CronSchedule> entry : crons.entrySet()) {
            String name = entry.getKey();
            CronSchedule cron = entry.getValue();
            Instant due = nextFire.computeIfAbsent(name, k -> cron.next(now.minusSeconds(1), zone));
            if (due == null || now.isBefore(due)) {
                continue;
            }
            Instant following = cron.next(now, zone);
            if (following != null) {
                nextFire.put(name, following);
            } else {
                nextFire.remove(name);
            }
            if (dispatch(schedule.jobs().get(name))) {
                dispatched.add(name);
            }
        }
        return dispatched;
    }

    private boolean dispatch(JobSpec job) {
        if (!inFlight.tryAcquire(job.name(), settings.overlap() == OverlapPolicy.SKIP)) {
            events.onDispatchSkipped(job.name(), "previous execution still running");
            return false;
        }
        controller.execute(job, CRON_TRIGGER, Map.of())
                .doFinally(signal -> inFlight.release(job.name()))
                .subscribe(
                        run -> log.debug("[scheduler] dispatch finished job={} status={}", job.name(), run.status()),
                        e -> log.error("[scheduler] dispatch failed job={} error={}", job.name(), e.getMessage(), e));
        return true;
    }

    public Schedule schedule() {
        return schedule;
    }

    public EngineState state() {
        return state;
    }

    public InFlightTracker inFlight() {
        return inFlight;
    }
}
