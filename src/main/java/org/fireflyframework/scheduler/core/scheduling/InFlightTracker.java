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

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Counts dispatched executions that have not finished yet, per job.
 */
public final class InFlightTracker {

    private final Map<String, Integer> counts = new HashMap<>();
    private int total;

    /**
     * @param exclusive refuse when the job already has an execution in flight
     * @return whether the execution was admitted
     */
    public synchronized boolean tryAcquire(String job, boolean exclusive) {
        int current = counts.getOrDefault(job, 0);
        if (exclusive && current > 0) {
            return false;
        }
        counts.put(job, current + 1);
        total++;
        return true;
    }

    public synchronized void release(String job) {
        Integer current = counts.get(job);
        if (current == null) {
            return;
        }
        if (current <= 1) {
            counts.remove(job);
        } else {
            counts.put(job, current - 1);
        }
        total--;
        if (total == 0) {
            notifyAll();
        }
    }

    public synchronized int count(String job) {
        return counts.getOrDefault(job, 0);
    }

    public synchronized int total() {
        return total;
    }

    /**
     * Waits until no execution is in flight.
     *
     * @return {@code true} if idle was reached before the timeout
     */
    public synchronized boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (total > 0) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            long millis = Math.max(1, remaining / 1_000_000);
            wait(millis);
        }
        return true;
    }
}
