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


package org.fireflyframework.scheduler.core.scheduling;

import org.fireflyframework.scheduler.core.history.RecentRuns;

import java.time.Duration;

/**
 * Runtime knobs of the {@link ScheduleEngine}.
 *
 * @param tickInterval    period of due-time evaluation
 * @param overlap         handling of a cron occurrence while the job is still running
 * @param recentRuns      number of runs loaded into each job's recent-run window at start
 * @param awaitInFlight   whether {@code stop()} waits for running executions
 * @param shutdownTimeout upper bound of that wait
 */
public record EngineSettings(Duration tickInterval, OverlapPolicy overlap, int recentRuns,
                             boolean awaitInFlight, Duration shutdownTimeout) {

    public EngineSettings {
        tickInterval = tickInterval != null && !tickInterval.isZero() && !tickInterval.isNegative()
                ? tickInterval : Duration.ofSeconds(1);
        overlap = overlap != null ? overlap : OverlapPolicy.ALLOW;
        recentRuns = recentRuns > 0 ? recentRuns : RecentRuns.DEFAULT_CAPACITY;
        shutdownTimeout = shutdownTimeout != null ? shutdownTimeout : Duration.ofSeconds(30);
    }

    public static EngineSettings defaults() {
        return new EngineSettings(Duration.ofSeconds(1), OverlapPolicy.ALLOW, RecentRuns.DEFAULT_CAPACITY,
                false, Duration.ofSeconds(30));
    }
}
