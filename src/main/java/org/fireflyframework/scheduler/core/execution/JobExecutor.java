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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.scheduler.core.model.JobRun;
import org.fireflyframework.scheduler.core.model.JobSpec;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one attempt of a job as an external process and blocks until it exits.
 *
 * <p>stdout and stderr are merged into the run's log and, unless suppressed, mirrored
 * to the given stream as they are produced. A process that cannot be started yields
 * a run with {@link JobRun#STATUS_NOT_COMPLETED}; this method never throws for
 * problems of the job itself.
 */
@Slf4j
public class JobExecutor {

    static final String NO_COMMAND = "Job unable to start: no command specified";

    private final Clock clock;
    private final boolean suppressLogs;
    private final PrintStream mirror;

    public JobExecutor(Clock clock, boolean suppressLogs, PrintStream mirror) {
        this.clock = clock;
        this.suppressLogs = suppressLogs;
        this.mirror = mirror;
    }

    public JobExecutor(Clock clock, boolean suppressLogs) {
        this(clock, suppressLogs, System.out);
    }

    public JobRun execute(JobSpec job, String trigger, Map<String, String> params) {
        Instant triggeredAt = clock.instant();
        long startNanos = System.nanoTime();
        Map<String, String> passed = params != null ? params : Map.of();

        if (job.command().isEmpty()) {
            log.warn("[job-runner] no command job={}", job.name());
            return new JobRun(JobRun.STATUS_NOT_COMPLETED, NO_COMMAND, job.name(), triggeredAt, trigger,
                    List.of(), elapsed(startNanos), passed);
        }

        Map<String, String> bindings = new LinkedHashMap<>(job.params());
        bindings.putAll(passed);

        List<String> argv = new ArrayList<>(job.command().size());
        argv.add(job.command().get(0));
        for (String arg : job.command().subList(1, job.command().size())) {
            argv.add(ArgumentRenderer.render(arg, bindings));
        }

        ProcessBuilder pb = new ProcessBuilder(argv).redirectErrorStream(true);
        pb.environment().putAll(job.env());
        if (!job.workingDirectory().isEmpty()) {
            pb.directory(new File(job.workingDirectory()));
        }

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            log.warn("[job-runner] start failed job={} error={}", job.name(), e.getMessage());
            return new JobRun(JobRun.STATUS_NOT_COMPLETED, "job unable to start: " + e.getMessage(), job.name(),
                    triggeredAt, trigger, List.of(), elapsed(startNanos), passed);
        }

        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        pump(job, process.getInputStream(), capture);

        int status = JobRun.STATUS_NOT_COMPLETED;
        try {
            status = process.waitFor();
        } catch (InterruptedException e) {
            log.warn("[job-runner] interrupted while waiting job={}, destroying process", job.name());
            process.destroyForcibly();
            Thread.currentThread().interrupt();
        }
        return new JobRun(status, capture.toString(StandardCharsets.UTF_8), job.name(), triggeredAt, trigger,
                List.of(), elapsed(startNanos), passed);
    }

    private void pump(JobSpec job, InputStream in, ByteArrayOutputStream capture) {
        byte[] buffer = new byte[8192];
        try (in) {
            int n;
            while ((n = in.read(buffer)) != -1) {
                capture.write(buffer, 0, n);
                if (!suppressLogs && mirror != null) {
                    mirror.write(buffer, 0, n);
                    mirror.flush();
                }
            }
        } catch (IOException e) {
            log.warn("[job-runner] output capture failed job={} error={}", job.name(), e.getMessage());
            capture.writeBytes(("\noutput capture failed: " + e.getMessage()).getBytes(StandardCharsets.UTF_8));
        }
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
