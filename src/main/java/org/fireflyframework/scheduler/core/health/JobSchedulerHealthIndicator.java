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


package org.fireflyframework.scheduler.core.health;

import org.fireflyframework.scheduler.core.history.RunRecorder;
import org.fireflyframework.scheduler.core.scheduling.EngineState;
import org.fireflyframework.scheduler.core.scheduling.ScheduleEngine;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import reactor.core.publisher.Mono;

public class JobSchedulerHealthIndicator implements ReactiveHealthIndicator {

    private final RunRecorder recorder;
    private final ScheduleEngine engine;

    /**
     * @param engine may be {@code null} when no schedule is configured
     */
    public JobSchedulerHealthIndicator(RunRecorder recorder, ScheduleEngine engine) {
        this.recorder = recorder;
        this.engine = engine;
    }

    @Override
    public Mono<Health> health() {
        return recorder.isHealthy()
                .map(healthy -> {
                    Health.Builder builder = healthy ? Health.up() : Health.down().withDetail("reason", "Run history not writable");
                    if (engine != null) {
                        EngineState state = engine.state();
                        if (state.isTerminal() || state == EngineState.STOPPING) {
                            builder = Health.down().withDetail("reason", "Engine " + state.name().toLowerCase());
                        }
                        builder.withDetail("state", state)
                                .withDetail("jobs", engine.schedule().size())
                                .withDetail("inFlight", engine.inFlight().total());
                    }
                    return builder.build();
                })
                .onErrorResume(e -> Mono.just(Health.down().withException(e).build()));
    }
}
