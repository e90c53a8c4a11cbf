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


package org.fireflyframework.scheduler.core.execution;

import org.fireflyframework.scheduler.core.model.JobRun;
import org.fireflyframework.scheduler.core.model.JobSpec;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Starts a full, retrying execution of a job. Used by the cascade to run dependents.
 */
@FunctionalInterface
public interface JobLauncher {
    Mono<JobRun> launch(JobSpec job, String trigger, Map<String, String> params);
}
