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

import com.fasterxml.jackson.annotation.JsonValue;
import org.fireflyframework.scheduler.core.model.JobRun;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.List;

/**
 * Bounded window of the most recent runs of one job, oldest first. Guarded by its
 * own monitor; readers get a snapshot copy.
 */
public final class RecentRuns {

    public static final int DEFAULT_CAPACITY = 10;

    private final int capacity;
    private final ArrayDeque<JobRun> runs;

    public RecentRuns(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1");
        this.capacity = capacity;
        this.runs = new ArrayDeque<>(capacity);
    }

    public int capacity() {
        return capacity;
    }

    public synchronized void add(JobRun run) {
        if (runs.size() == capacity) {
            runs.removeFirst();
        }
        runs.addLast(run);
    }

    /**
     * Replaces the window contents; only the last {@link #capacity()} entries are kept.
     */
    public synchronized void replaceAll(Collection<JobRun> seed) {
        runs.clear();
        seed.forEach(this::add);
    }

    @JsonValue
    public synchronized List<JobRun> snapshot() {
        return List.copyOf(runs);
    }

    public synchronized int size() {
        return runs.size();
    }

    @Override
    public String toString() {
        return "RecentRuns[size=" + size() + ", capacity=" + capacity + "]";
    }
}
