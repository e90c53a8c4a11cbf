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


package org.fireflyframework.scheduler.config;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.scheduler.core.scheduling.ScheduleEngine;
import org.springframework.context.SmartLifecycle;

/**
 * Runs the blocking engine loop on its own thread for the lifetime of the
 * application context and stops it when the context closes.
 */
@Slf4j
public class ScheduleEngineLifecycle implements SmartLifecycle {

    static final String THREAD_NAME = "job-scheduler-engine";

    private final ScheduleEngine engine;
    private volatile Thread runner;

    public ScheduleEngineLifecycle(ScheduleEngine engine) {
        this.engine = engine;
    }

    @Override
    public synchronized void start() {
        if (runner != null) {
            return;
        }
        engine.start();
        Thread t = new Thread(engine::run, THREAD_NAME);
        t.setDaemon(false);
        t.start();
        runner = t;
        log.info("[scheduler] engine thread started");
    }

    @Override
    public synchronized void stop() {
        Thread t = runner;
        if (t == null) {
            return;
        }
        engine.stop();
        try {
            t.join(5_000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        runner = null;
        log.info("[scheduler] engine thread stopped");
    }

    @Override
    public boolean isRunning() {
        return runner != null;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 1000;
    }
}
