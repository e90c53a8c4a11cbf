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
import org.fireflyframework.scheduler.core.health.JobSchedulerHealthIndicator;
import org.fireflyframework.scheduler.core.history.RunRecorder;
import org.fireflyframework.scheduler.core.model.Schedule;
import org.fireflyframework.scheduler.core.rest.ScheduleController;
import org.fireflyframework.scheduler.core.scheduling.ScheduleEngine;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Auto-configuration for the inspection endpoints and the health indicator.
 */
@Slf4j
@AutoConfiguration(after = {JobSchedulerAutoConfiguration.class, JobSchedulerEngineAutoConfiguration.class})
@ConditionalOnProperty(name = "firefly.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class JobSchedulerRestAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(Schedule.class)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.REACTIVE)
    @ConditionalOnProperty(name = "firefly.scheduler.rest.enabled", havingValue = "true", matchIfMissing = true)
    public ScheduleController scheduleController(Schedule schedule, RunRecorder recorder) {
        log.info("[scheduler] REST controller initialized");
        return new ScheduleController(schedule, recorder);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "org.springframework.boot.actuate.health.ReactiveHealthIndicator")
    static class HealthConfiguration {

        @Bean
        @ConditionalOnMissingBean
        @ConditionalOnBean(RunRecorder.class)
        @ConditionalOnProperty(name = "firefly.scheduler.health.enabled", havingValue = "true", matchIfMissing = true)
        public JobSchedulerHealthIndicator jobSchedulerHealthIndicator(RunRecorder recorder,
                                                                       ObjectProvider<ScheduleEngine> engine) {
            log.info("[scheduler] Health indicator initialized");
            return new JobSchedulerHealthIndicator(recorder, engine.getIfAvailable());
        }
    }
}
