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


package org.fireflyframework.scheduler.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Root registry of jobs plus the schedule-wide event defaults applied to every job.
 * The job map is fixed at construction.
 */
public record Schedule(
        Map<String, JobSpec> jobs,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) @JsonProperty("on_success") OnEvent onSuccess,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) @JsonProperty("on_error") OnEvent onError
) {
    public Schedule {
        jobs = jobs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(jobs)) : Map.of();
        onSuccess = onSuccess != null ? onSuccess : OnEvent.EMPTY;
        onError = onError != null ? onError : OnEvent.EMPTY;
    }

    public static Schedule of(JobSpec... jobs) {
        return of(OnEvent.EMPTY, OnEvent.EMPTY, jobs);
    }

    public static Schedule of(OnEvent onSuccess, OnEvent onError, JobSpec... jobs) {
        Map<String, JobSpec> byName = new LinkedHashMap<>();
        Arrays.stream(jobs).forEach(job -> byName.put(job.name(), job));
        return new Schedule(byName, onSuccess, onError);
    }

    public Optional<JobSpec> job(String name) {
        return Optional.ofNullable(jobs.get(name));
    }

    @JsonIgnore
    public int size() {
        return jobs.size();
    }
}
