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


package org.fireflyframework.scheduler.core.rest;

import org.fireflyframework.scheduler.core.history.RunRecorder;
import org.fireflyframework.scheduler.core.model.JobRun;
import org.fireflyframework.scheduler.core.model.Schedule;
import org.fireflyframework.scheduler.core.rest.dto.HealthzDto;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Read-only view of the running schedule.
 */
@RestController
public class ScheduleController {

    private final Schedule schedule;
    private final RunRecorder recorder;

    public ScheduleController(Schedule schedule, RunRecorder recorder) {
        this.schedule = schedule;
        this.recorder = recorder;
    }

    @GetMapping("/healthz")
    public Mono<HealthzDto> healthz() {
        return Mono.just(new HealthzDto(schedule.size(), "ok"));
    }

    @GetMapping("/schedule")
    public Mono<Schedule> schedule() {
        return Mono.just(schedule);
    }

    @GetMapping("/jobs/{name}/runs")
    public Mono<List<JobRun>> runs(@PathVariable String name,
                                   @RequestParam(defaultValue = "10") int limit) {
        if (!schedule.jobs().containsKey(name)) {
            return Mono.error(new ResponseStatusException(HttpStatus.NOT_FOUND, "cannot find job '" + name + "'"));
        }
        return recorder.readLast(name, Math.max(1, limit));
    }
}
