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

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Record of a single execution attempt of a job. This is also the shape of one
 * line in the per-job run log and of the generic webhook payload.
 *
 * @param status      process exit code, or {@link #STATUS_NOT_COMPLETED} if the process never ran to completion
 * @param log         combined stdout/stderr of the attempt
 * @param name        job name
 * @param triggeredAt wall-clock time the attempt was triggered
 * @param triggeredBy provenance of the attempt, e.g. {@code cron}, {@code manual}, {@code job[parent]}, {@code cron[retry=1]}
 * @param triggered   jobs and webhooks fired as a consequence of this attempt
 * @param duration    elapsed time from trigger to completion
 * @param params      template bindings the command was rendered with
 */
public record JobRun(
        int status,
        String log,
        String name,
        @JsonProperty("triggered_at") Instant triggeredAt,
        @JsonProperty("triggered_by") String triggeredBy,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> triggered,
        Duration duration,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, String> params
) {
    public static final int STATUS_NOT_COMPLETED = -1;

    public JobRun {
        log = log != null ? log : "";
        triggered = triggered != null ? List.copyOf(triggered) : List.of();
        duration = duration != null ? duration : Duration.ZERO;
        params = params != null ? Map.copyOf(params) : Map.of();
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == 0;
    }

    public JobRun withTriggered(List<String> targets) {
        return new JobRun(status, log, name, triggeredAt, triggeredBy, targets, duration, params);
    }
}
