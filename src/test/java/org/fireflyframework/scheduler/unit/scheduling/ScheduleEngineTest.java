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


package org.fireflyframework.scheduler.unit.scheduling;

import org.fireflyframework.scheduler.core.cascade.EventCascade;
import org.fireflyframework.scheduler.core.exception.JobNotFoundException;
import org.fireflyframework.scheduler.core.exception.ScheduleValidationException;
import org.fireflyframework.scheduler.core.execution.JobExecutor;
import org.fireflyframework.scheduler.core.execution.RetryController;
import org.fireflyframework.scheduler.core.history.InMemoryRunRecorder;
import org.fireflyframework.scheduler.core.model.JobRun;
import org.fireflyframework.scheduler.core.model.JobSpec;
import org.fireflyframework.scheduler.core.model.OnEvent;
import org.fireflyframework.scheduler.core.model.Schedule;
import org.fireflyframework.scheduler.core.notify.WebhookNotifier;
import org.fireflyframework.scheduler.core.observability.JobSchedulerEvents;
import org.fireflyframework.scheduler.core.scheduling.EngineSettings;
import org.fireflyframework.scheduler.core.scheduling.EngineState;
import org.fireflyframework.scheduler.core.scheduling.OverlapPolicy;
import org.fireflyframework.scheduler.core.scheduling.ScheduleEngine;
import org.fireflyframework.scheduler.core.validation.ScheduleValidator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

class ScheduleEngineTest {

    private static final Instant NOON = Instant.parse("2024-01-01T12:00:00Z");

    private final Clock clock = Clock.fixed(NOON, ZoneOffset.UTC);
    private final InMemoryRunRecorder recorder = new InMemoryRunRecorder();
    private final JobSchedulerEvents events = new JobSchedulerEvents() {};
    private final List<ScheduleEngine> engines = new ArrayList<>();

    private ScheduleEngine engine(Schedule schedule, EngineSettings settings) {
        var executor = new JobExecutor(clock, true);
        var notifier = new WebhookNotifier(WebClient.create(), Duration.ofSeconds(2));
        var controller = new RetryController(executor, recorder, new EventCascade(schedule, notifier, events),
                Duration.ZERO, events);
        var engine = new ScheduleEngine(schedule, controller, recorder, new ScheduleValidator(), settings, clock, events);
        engines.add(engine);
        return engine;
    }

    private ScheduleEngine engine(Schedule schedule) {
        return engine(schedule, EngineSettings.defaults());
    }

    private static EngineSettings overlap(OverlapPolicy policy) {
        return new EngineSettings(Duration.ofSeconds(1), policy, 10, true, Duration.ofSeconds(10));
    }

    @AfterEach
    void tearDown() {
        engines.forEach(ScheduleEngine::stop);
    }

    @Test
    void tick_dispatchesDueJobsOncePerOccurrence() {
        var everyMinute = JobSpec.builder("every-minute").cron("* * * * *").command("true").build();
        var nightly = JobSpec.builder("nightly").cron("0 3 * * *").command("true").build();
        var manualOnly = JobSpec.builder("manual-only").command("true").build();
        var engine = engine(Schedule.of(everyMinute, nightly, manualOnly));
        engine.validate();

        assertThat(engine.tick(NOON.plusMillis(100))).containsExactly("every-minute");
        assertThat(engine.tick(NOON.plusMillis(900))).isEmpty();
        assertThat(engine.tick(NOON.plusSeconds(30))).isEmpty();
        assertThat(engine.tick(NOON.plusSeconds(60).plusMillis(50))).containsExactly("every-minute");

        await().atMost(Duration.ofSeconds(10)).until(() -> recorder.all("every-minute").size() == 2);
        assertThat(recorder.all("every-minute")).extracting(JobRun::triggeredBy).containsOnly("cron");
        assertThat(recorder.all("nightly")).isEmpty();
    }

    @Test
    void tick_overlapSkip_suppressesSecondDispatchWhileRunning() {
        var slow = JobSpec.builder("slow").cron("* * * * *").command("sh", "-c", "sleep 1").build();
        var engine = engine(Schedule.of(slow), overlap(OverlapPolicy.SKIP));
        engine.validate();

        assertThat(engine.tick(NOON)).containsExactly("slow");
        assertThat(engine.tick(NOON.plusSeconds(60))).isEmpty();

        await().atMost(Duration.ofSeconds(10)).until(() -> engine.inFlight().total() == 0);
        assertThat(recorder.all("slow")).hasSize(1);
    }

    @Test
    void tick_overlapAllow_dispatchesAgainWhileRunning() {
        var slow = JobSpec.builder("slow").cron("* * * * *").command("sh", "-c", "sleep 1").build();
        var engine = engine(Schedule.of(slow), overlap(OverlapPolicy.ALLOW));
        engine.validate();

        assertThat(engine.tick(NOON)).containsExactly("slow");
        assertThat(engine.tick(NOON.plusSeconds(60))).containsExactly("slow");

        await().atMost(Duration.ofSeconds(10)).until(() -> recorder.all("slow").size() == 2);
    }

    @Test
    void validate_invalidCron_failsNamingTheJob() {
        var bad = JobSpec.builder("broken").cron("every day").command("true").build();
        var engine = engine(Schedule.of(bad));

        assertThatThrownBy(engine::validate)
                .isInstanceOf(ScheduleValidationException.class)
                .hasMessageContaining("cron string for job 'broken' not valid");
    }

    @Test
    void validate_danglingTrigger_fails() {
        var job = JobSpec.builder("a").command("true").onSuccess(OnEvent.triggering("ghost")).build();
        var engine = engine(Schedule.of(job));

        assertThatThrownBy(engine::validate)
                .isInstanceOf(ScheduleValidationException.class)
                .hasMessageContaining("cannot find spec of job 'ghost'");
    }

    @Test
    void validate_seedsRecentRunsFromRecorder() {
        for (int i = 0; i < 4; i++) {
            recorder.record(new JobRun(i, "", "a", NOON, "cron", List.of(), Duration.ZERO, null)).block();
        }
        var job = JobSpec.builder("a").command("true").recentRuns(3).build();
        var engine = engine(Schedule.of(job), new EngineSettings(Duration.ofSeconds(1), OverlapPolicy.ALLOW, 3, false, Duration.ofSeconds(1)));

        engine.validate();

        assertThat(job.runs().snapshot()).extracting(JobRun::status).containsExactly(1, 2, 3);
    }

    @Test
    void runJob_unknownName_failsWithNotFound() {
        var engine = engine(Schedule.of(JobSpec.builder("a").command("true").build()));
        engine.validate();

        StepVerifier.create(engine.runJob("missing"))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(JobNotFoundException.class);
                    assertThat(((JobNotFoundException) e).getErrorCode()).isEqualTo("SCHEDULER_JOB_NOT_FOUND");
                })
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void runJob_runsOnceAsManualWithoutRetry() {
        var job = JobSpec.builder("b").command("false").retries(3).build();
        var engine = engine(Schedule.of(job));
        engine.validate();

        StepVerifier.create(engine.runJob("b"))
                .assertNext(run -> {
                    assertThat(run.triggeredBy()).isEqualTo("manual");
                    assertThat(run.status()).isNotZero();
                })
                .verifyComplete();
        assertThat(recorder.all("b")).hasSize(1);
    }

    @Test
    void run_blocksUntilStopped() throws Exception {
        var engine = engine(Schedule.of(JobSpec.builder("a").cron("0 3 * * *").command("true").build()));
        Thread runner = new Thread(engine::run);
        runner.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> engine.state() == EngineState.RUNNING);
        assertThat(runner.isAlive()).isTrue();

        engine.stop();
        runner.join(5_000);
        assertThat(runner.isAlive()).isFalse();
        assertThat(engine.state()).isEqualTo(EngineState.STOPPED);
    }

    @Test
    void stop_awaitInFlight_waitsForRunningJobs() {
        var slow = JobSpec.builder("slow").cron("* * * * *").command("sh", "-c", "sleep 0.5").build();
        var engine = engine(Schedule.of(slow), overlap(OverlapPolicy.ALLOW));
        engine.validate();
        engine.tick(NOON);

        engine.stop();

        assertThat(engine.inFlight().total()).isZero();
        assertThat(recorder.all("slow")).hasSize(1);
    }

    @Test
    void stop_isIdempotent() {
        var engine = engine(Schedule.of());
        engine.start();
        engine.stop();
        engine.stop();

        assertThat(engine.state()).isEqualTo(EngineState.STOPPED);
        assertThat(engine.state().isTerminal()).isTrue();
    }
}
