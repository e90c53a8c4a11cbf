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

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.scheduler.core.definition.ScheduleDefinitionLoader;
import org.fireflyframework.scheduler.core.execution.JobExecutor;
import org.fireflyframework.scheduler.core.history.InMemoryRunRecorder;
import org.fireflyframework.scheduler.core.history.JsonlRunRecorder;
import org.fireflyframework.scheduler.core.history.RunRecorder;
import org.fireflyframework.scheduler.core.history.RunSerializer;
import org.fireflyframework.scheduler.core.model.Schedule;
import org.fireflyframework.scheduler.core.notify.WebhookNotifier;
import org.fireflyframework.scheduler.core.observability.CompositeJobSchedulerEvents;
import org.fireflyframework.scheduler.core.observability.JobSchedulerEvents;
import org.fireflyframework.scheduler.core.observability.JobSchedulerLoggerEvents;
import org.fireflyframework.scheduler.core.observability.JobSchedulerMetrics;
import org.fireflyframework.scheduler.core.resilience.WebhookResilienceDecorator;
import org.fireflyframework.scheduler.core.validation.ScheduleValidator;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Main auto-configuration of the job scheduler.
 *
 * <p>Wires the infrastructure shared by the engine and the inspection endpoints:
 * observability, run history, process execution, webhook delivery and, when
 * {@code firefly.scheduler.definition-file} is set, the {@link Schedule} itself.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(JobSchedulerProperties.class)
@ConditionalOnProperty(name = "firefly.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class JobSchedulerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock jobSchedulerClock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    @ConditionalOnMissingBean(JobSchedulerEvents.class)
    public JobSchedulerEvents jobSchedulerEvents(ObjectProvider<MeterRegistry> meterRegistry,
                                                 JobSchedulerProperties properties) {
        List<JobSchedulerEvents> delegates = new ArrayList<>();
        delegates.add(new JobSchedulerLoggerEvents());
        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (registry != null && properties.getMetrics().isEnabled()) {
            log.info("[scheduler] Micrometer metrics enabled");
            delegates.add(new JobSchedulerMetrics(registry));
        }
        if (delegates.size() == 1) {
            return delegates.get(0);
        }
        return new CompositeJobSchedulerEvents(delegates);
    }

    @Bean
    @ConditionalOnMissingBean
    public RunSerializer runSerializer() {
        return new RunSerializer();
    }

    @Bean
    @ConditionalOnMissingBean
    public RunRecorder runRecorder(JobSchedulerProperties properties, RunSerializer serializer) {
        if ("in-memory".equalsIgnoreCase(properties.getHistory().getProvider())) {
            log.info("[scheduler] Using in-memory run history");
            return new InMemoryRunRecorder();
        }
        Path dir = Path.of(properties.getLogDir());
        log.info("[scheduler] Writing run history to {}", dir);
        return new JsonlRunRecorder(dir, serializer);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobExecutor jobExecutor(Clock clock, JobSchedulerProperties properties) {
        return new JobExecutor(clock, properties.isSuppressLogs());
    }

    @Bean
    @ConditionalOnMissingBean
    public WebhookNotifier webhookNotifier(ObjectProvider<WebClient.Builder> webClientBuilder,
                                           RunSerializer serializer,
                                           ObjectProvider<WebhookResilienceDecorator> decorator,
                                           JobSchedulerProperties properties) {
        WebClient client = webClientBuilder.getIfAvailable(WebClient::builder).build();
        return new WebhookNotifier(client, serializer, properties.getNotify().getTimeout(), decorator.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleDefinitionLoader scheduleDefinitionLoader(JobSchedulerProperties properties) {
        return new ScheduleDefinitionLoader(properties.getRecentRuns());
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleValidator scheduleValidator() {
        return new ScheduleValidator();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "firefly.scheduler.definition-file")
    public Schedule schedule(ScheduleDefinitionLoader loader, JobSchedulerProperties properties) {
        return loader.load(Path.of(properties.getDefinitionFile()));
    }
}
