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


package org.fireflyframework.scheduler.config;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.scheduler.core.cascade.EventCascade;
import org.fireflyframework.scheduler.core.execution.JobExecutor;
import org.fireflyframework.scheduler.core.execution.RetryController;
import org.fireflyframework.scheduler.core.history.RunRecorder;
import org.fireflyframework.scheduler.core.model.Schedule;
import org.fireflyframework.scheduler.core.notify.WebhookNotifier;
import org.fireflyframework.scheduler.core.observability.JobSchedulerEvents;
import org.fireflyframework.scheduler.core.scheduling.EngineSettings;
import org.fireflyframework.scheduler.core.scheduling.ScheduleEngine;
import org.fireflyframework.scheduler.core.validation.ScheduleValidator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * Wires the scheduling engine around a {@link Schedule} bean. The schedule is
 * validated while the engine bean is created, so an invalid definition fails the
 * application context on startup.
 */
@Slf4j
@AutoConfiguration(after = JobSchedulerAutoConfiguration.class)
@ConditionalOnBean(Schedule.class)
@ConditionalOnProperty(name = "firefly.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class JobSchedulerEngineAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public EventCascade eventCascade(Schedule schedule, WebhookNotifier notifier, JobSchedulerEvents events) {
        return new EventCascade(schedule, notifier, events);
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryController retryController(JobExecutor executor, RunRecorder recorder, EventCascade cascade,
                                           JobSchedulerEvents events, JobSchedulerProperties properties) {
        return new RetryController(executor, recorder, cascade, properties.getRetry().getBackoff(), events);
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleEngine scheduleEngine(Schedule schedule, RetryController controller, RunRecorder recorder,
                                         ScheduleValidator validator, Clock clock, JobSchedulerEvents events,
                                         JobSchedulerProperties properties) {
        EngineSettings settings = new EngineSettings(
                properties.getTickInterval(),
                properties.getOverlap(),
                properties.getRecentRuns(),
                properties.getShutdown().isAwaitInFlight(),
                properties.getShutdown().getTimeout());
        ScheduleEngine engine = new ScheduleEngine(schedule, controller, recorder, validator, settings, clock, events);
        engine.validate();
        log.info("[scheduler] Engine initialized jobs={} overlap={} tick={}",
                schedule.size(), settings.overlap(), settings.tickInterval());
        return engine;
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "firefly.scheduler.auto-start", havingValue = "true", matchIfMissing = true)
    public ScheduleEngineLifecycle scheduleEngineLifecycle(ScheduleEngine engine) {
        return new ScheduleEngineLifecycle(engine);
    }
}
