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
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.scheduler.core.resilience.WebhookResilienceDecorator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for per-webhook circuit breakers.
 *
 * <p>Activated when resilience4j is on the classpath and a {@code CircuitBreakerRegistry}
 * bean is available.
 */
@Slf4j
@AutoConfiguration(before = JobSchedulerAutoConfiguration.class)
@ConditionalOnClass(CircuitBreakerRegistry.class)
@ConditionalOnBean(CircuitBreakerRegistry.class)
@ConditionalOnProperty(name = "firefly.scheduler.resilience.enabled", havingValue = "true", matchIfMissing = true)
public class JobSchedulerResilienceAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public WebhookResilienceDecorator webhookResilienceDecorator(CircuitBreakerRegistry registry) {
        log.info("[scheduler] Webhook circuit breakers enabled");
        return new WebhookResilienceDecorator(registry);
    }
}
