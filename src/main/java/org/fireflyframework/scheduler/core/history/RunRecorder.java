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


package org.fireflyframework.scheduler.core.history;

import org.fireflyframework.scheduler.core.model.JobRun;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Append-only store of job runs.
 *
 * <p>Implementations never fail {@link #record(JobRun)} because of an I/O problem:
 * a run's outcome does not depend on its persistence.
 */
public interface RunRecorder {

    Mono<Void> record(JobRun run);

    /**
     * Returns up to {@code n} of the most recently recorded runs of the job, oldest first.
     * An unknown job yields an empty list.
     */
    Mono<List<JobRun>> readLast(String jobName, int n);

    Mono<Boolean> isHealthy();
}
