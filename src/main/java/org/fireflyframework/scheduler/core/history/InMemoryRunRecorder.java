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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable recorder keeping every run in memory. Used when no log directory is
 * available and in tests.
 */
public class InMemoryRunRecorder implements RunRecorder {

    private final ConcurrentHashMap<String, List<JobRun>> store = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> record(JobRun run) {
        return Mono.fromRunnable(() -> store.compute(run.name(), (k, v) -> {
            List<JobRun> runs = v != null ? v : new ArrayList<>();
            runs.add(run);
            return runs;
        }));
    }

    @Override
    public Mono<List<JobRun>> readLast(String jobName, int n) {
        return Mono.fromCallable(() -> {
            if (n <= 0) {
                return List.<JobRun>of();
            }
            List<JobRun> out = new ArrayList<>();
            store.computeIfPresent(jobName, (k, v) -> {
                out.addAll(v.subList(Math.max(0, v.size() - n), v.size()));
                return v;
            });
            return List.copyOf(out);
        });
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return Mono.just(true);
    }

    // Test helpers
    public List<JobRun> all(String jobName) {
        List<JobRun> out = new ArrayList<>();
        store.computeIfPresent(jobName, (k, v) -> {
            out.addAll(v);
            return v;
        });
        return out;
    }
}
