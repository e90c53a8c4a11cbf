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

import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.fireflyframework.scheduler.core.exception.ScheduleValidationException;
import org.fireflyframework.scheduler.core.health.JobSchedulerHealthIndicator;
import org.fireflyframework.scheduler.core.history.InMemoryRunRecorder;
import org.fireflyframework.scheduler.core.history.JsonlRunRecorder;
import org.fireflyframework.scheduler.core.history.RunRecorder;
import org.fireflyframework.scheduler.core.model.Schedule;
import org.fireflyframework.scheduler.core.observability.CompositeJobSchedulerEvents;
import org.fireflyframework.scheduler.core.observability.JobSchedulerEvents;
import org.fireflyframework.scheduler.core.observability.JobSchedulerLoggerEvents;
import org.fireflyframework.scheduler.core.resilience.WebhookResilienceDecorator;
import org.fireflyframework.scheduler.core.rest.ScheduleController;
import org.fireflyframework.scheduler.core.scheduling.EngineState;
import org.fireflyframework.scheduler.core.scheduling.ScheduleEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.context.runner.ReactiveWebApplicationContextRunner;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

/**
 * Verifies the bean graph produced by the scheduler auto-configurations.
 */
class JobSchedulerAutoConfigurationTest {

    private static final AutoConfigurations ALL = AutoConfigurations.of(
            JobSchedulerResilienceAutoConfiguration.class,
            JobSchedulerAutoConfiguration.class,
            JobSchedulerEngineAutoConfiguration.class,
            JobSchedulerRestAutoConfiguration.class);

    @TempDir
    Path dir;

    private ApplicationContextRunner contextRunner;

    @BeforeEach
    void setUp() {
        contextRunner = new ApplicationContextRunner()
                .withConfiguration(ALL)
                .withPropertyValues("firefly.scheduler.log-dir=" + dir.resolve("logs"));
    }

    private String definition(String yaml) throws IOException {
        Path file = dir.resolve("jobs.yaml");
        Files.writeString(file, yaml);
        return "firefly.scheduler.definition-file=" + file;
    }

    private String validDefinition() throws IOException {
        return definition("""
                jobs:
                  ping:
                    cron: "0 3 * * *"
                    command: ["echo", "pong"]
                """);
    }

    @Test
    void noDefinitionFile_infrastructureOnly() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(RunRecorder.class);
            assertThat(context).doesNotHaveBean(Schedule.class);
            assertThat(context).doesNotHaveBean(ScheduleEngine.class);
            assertThat(context).doesNotHaveBean(ScheduleEngineLifecycle.class);
        });
    }

    @Test
    void definitionFile_createsValidatedEngine() throws IOException {
        contextRunner
                .withPropertyValues(validDefinition(), "firefly.scheduler.auto-start=false")
                .run(context -> {
                    assertThat(context).hasSingleBean(ScheduleEngine.class);
                    assertThat(context).doesNotHaveBean(ScheduleEngineLifecycle.class);
                    assertThat(context.getBean(RunRecorder.class)).isInstanceOf(JsonlRunRecorder.class);
                    ScheduleEngine engine = context.getBean(ScheduleEngine.class);
                    assertThat(engine.state()).isEqualTo(EngineState.VALIDATING);
                    assertThat(engine.schedule().job("ping")).isPresent();
                });
    }

    @Test
    void invalidDefinition_failsStartup() throws IOException {
        contextRunner
                .withPropertyValues(definition("""
                        jobs:
                          broken:
                            cron: "whenever"
                            command: ["true"]
                        """), "firefly.scheduler.auto-start=false")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasRootCauseInstanceOf(ScheduleValidationException.class)
                            .rootCause()
                            .hasMessageContaining("cron string for job 'broken' not valid");
                });
    }

    @Test
    void autoStart_runsEngineForContextLifetime() throws IOException {
        AtomicReference<ScheduleEngine> captured = new AtomicReference<>();
        contextRunner
                .withPropertyValues(validDefinition())
                .run(context -> {
                    assertThat(context).hasSingleBean(ScheduleEngineLifecycle.class);
                    ScheduleEngine engine = context.getBean(ScheduleEngine.class);
                    captured.set(engine);
                    assertThat(engine.state()).isEqualTo(EngineState.RUNNING);
                });

        assertThat(captured.get().state()).isEqualTo(EngineState.STOPPED);
    }

    @Test
    void inMemoryHistoryProvider() {
        contextRunner
                .withPropertyValues("firefly.scheduler.history.provider=in-memory")
                .run(context -> assertThat(context.getBean(RunRecorder.class)).isInstanceOf(InMemoryRunRecorder.class));
    }

    @Test
    void events_loggerOnly_withoutMeterRegistry() {
        contextRunner.run(context ->
                assertThat(context.getBean(JobSchedulerEvents.class)).isInstanceOf(JobSchedulerLoggerEvents.class));
    }

    @Test
    void events_compositeWithMetrics_whenMeterRegistryPresent() {
        contextRunner
                .withBean(SimpleMeterRegistry.class, SimpleMeterRegistry::new)
                .run(context ->
                        assertThat(context.getBean(JobSchedulerEvents.class)).isInstanceOf(CompositeJobSchedulerEvents.class));
    }

    @Test
    void events_metricsDisabled_staysLoggerOnly() {
        contextRunner
                .withBean(SimpleMeterRegistry.class, SimpleMeterRegistry::new)
                .withPropertyValues("firefly.scheduler.metrics.enabled=false")
                .run(context ->
                        assertThat(context.getBean(JobSchedulerEvents.class)).isInstanceOf(JobSchedulerLoggerEvents.class));
    }

    @Test
    void resilienceDecorator_whenCircuitBreakerRegistryPresent() {
        contextRunner
                .withBean(CircuitBreakerRegistry.class, CircuitBreakerRegistry::ofDefaults)
                .run(context -> assertThat(context).hasSingleBean(WebhookResilienceDecorator.class));
        contextRunner
                .run(context -> assertThat(context).doesNotHaveBean(WebhookResilienceDecorator.class));
    }

    @Test
    void healthIndicator_registered() {
        contextRunner.run(context -> assertThat(context).hasSingleBean(JobSchedulerHealthIndicator.class));
    }

    @Test
    void controller_onlyInReactiveWebApplication() throws IOException {
        String definition = validDefinition();
        new ReactiveWebApplicationContextRunner()
                .withConfiguration(ALL)
                .withPropertyValues(definition, "firefly.scheduler.auto-start=false",
                        "firefly.scheduler.log-dir=" + dir.resolve("logs"))
                .run(context -> assertThat(context).hasSingleBean(ScheduleController.class));
        contextRunner
                .withPropertyValues(definition, "firefly.scheduler.auto-start=false")
                .run(context -> assertThat(context).doesNotHaveBean(ScheduleController.class));
    }

    @Test
    void disabled_registersNothing() {
        contextRunner
                .withPropertyValues("firefly.scheduler.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(RunRecorder.class);
                    assertThat(context).doesNotHaveBean(JobSchedulerProperties.class);
                });
    }
}
