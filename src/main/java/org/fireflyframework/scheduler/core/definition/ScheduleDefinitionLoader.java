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


package org.fireflyframework.scheduler.core.definition;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.scheduler.core.exception.ScheduleDefinitionException;
import org.fireflyframework.scheduler.core.history.RecentRuns;
import org.fireflyframework.scheduler.core.model.JobSpec;
import org.fireflyframework.scheduler.core.model.Schedule;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads a YAML schedule definition:
 *
 * <pre>{@code
 * on_error:
 *   notify_slack_webhook: [https://hooks.slack.com/services/...]
 * jobs:
 *   backup:
 *     cron: "0 3 * * *"
 *     command: [pg_dump, "{{.db}}"]
 *     params: {db: main}
 *     retries: 2
 *     on_success:
 *       trigger_job: [cleanup]
 *   cleanup:
 *     command: ./cleanup.sh
 * }</pre>
 *
 * Unknown keys are ignored. Nothing is validated here beyond the file's shape.
 */
@Slf4j
public class ScheduleDefinitionLoader {

    private final ObjectMapper mapper;
    private final int recentRuns;

    public ScheduleDefinitionLoader(int recentRuns) {
        this.mapper = new ObjectMapper(new YAMLFactory());
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.recentRuns = recentRuns > 0 ? recentRuns : RecentRuns.DEFAULT_CAPACITY;
    }

    public ScheduleDefinitionLoader() {
        this(RecentRuns.DEFAULT_CAPACITY);
    }

    public Schedule load(Path file) {
        log.info("[scheduler] loading schedule file={}", file);
        try (InputStream in = Files.newInputStream(file)) {
            return load(in);
        } catch (IOException e) {
            throw new ScheduleDefinitionException("cannot read schedule definition " + file + ": " + e.getMessage(), e);
        }
    }

    public Schedule load(InputStream in) {
        try {
            return toSchedule(mapper.readValue(in, ScheduleDefinition.class));
        } catch (IOException e) {
            throw new ScheduleDefinitionException("cannot parse schedule definition: " + e.getMessage(), e);
        }
    }

    public Schedule parse(String yaml) {
        try {
            return toSchedule(mapper.readValue(yaml, ScheduleDefinition.class));
        } catch (IOException e) {
            throw new ScheduleDefinitionException("cannot parse schedule definition: " + e.getMessage(), e);
        }
    }

    private Schedule toSchedule(ScheduleDefinition def) {
        if (def == null) {
            return new Schedule(Map.of(), null, null);
        }
        Map<String, JobSpec> jobs = new LinkedHashMap<>();
        if (def.jobs() != null) {
            def.jobs().forEach((name, job) -> jobs.put(name, toJob(name, job)));
        }
        return new Schedule(jobs, def.onSuccess(), def.onError());
    }

    private JobSpec toJob(String name, JobDefinition def) {
        JobSpec.Builder builder = JobSpec.builder(name).recentRuns(recentRuns);
        if (def == null) {
            return builder.build();
        }
        if (def.cron() != null) builder.cron(def.cron());
        if (def.command() != null) builder.command(def.command());
        if (def.params() != null) builder.params(withoutNulls(def.params()));
        if (def.env() != null) builder.env(withoutNulls(def.env()));
        if (def.workingDirectory() != null) builder.workingDirectory(def.workingDirectory());
        if (def.retries() != null) builder.retries(def.retries());
        if (def.onSuccess() != null) builder.onSuccess(def.onSuccess());
        if (def.onError() != null) builder.onError(def.onError());
        return builder.build();
    }

    // YAML "key:" with no value parses to null
    private static Map<String, String> withoutNulls(Map<String, String> values) {
        Map<String, String> out = new LinkedHashMap<>();
        values.forEach((k, v) -> out.put(k, v != null ? v : ""));
        return out;
    }
}
