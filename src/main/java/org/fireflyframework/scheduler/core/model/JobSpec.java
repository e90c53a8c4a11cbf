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
import org.fireflyframework.scheduler.core.history.RecentRuns;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Definition of a single job. Everything except {@link #runs()} is immutable;
 * the recent-run window is thread-safe and owned by the job.
 *
 * <p>A job does not hold a reference to its schedule. Dependents and schedule-wide
 * defaults are resolved by whoever holds the {@link Schedule}, so a job can be
 * executed on its own.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record JobSpec(
        String name,
        String cron,
        List<String> command,
        Map<String, String> params,
        Map<String, String> env,
        @JsonProperty("working_directory") String workingDirectory,
        int retries,
        @JsonProperty("on_success") OnEvent onSuccess,
        @JsonProperty("on_error") OnEvent onError,
        RecentRuns runs
) {
    public JobSpec {
        Objects.requireNonNull(name, "name");
        cron = cron != null ? cron.trim() : "";
        command = command != null ? List.copyOf(command) : List.of();
        params = params != null ? Map.copyOf(params) : Map.of();
        env = env != null ? Map.copyOf(env) : Map.of();
        workingDirectory = workingDirectory != null ? workingDirectory : "";
        onSuccess = onSuccess != null ? onSuccess : OnEvent.EMPTY;
        onError = onError != null ? onError : OnEvent.EMPTY;
        runs = runs != null ? runs : new RecentRuns(RecentRuns.DEFAULT_CAPACITY);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @JsonIgnore
    public boolean hasCron() {
        return !cron.isEmpty();
    }

    public static final class Builder {
        private final String name;
        private String cron = "";
        private final List<String> command = new ArrayList<>();
        private final Map<String, String> params = new LinkedHashMap<>();
        private final Map<String, String> env = new LinkedHashMap<>();
        private String workingDirectory = "";
        private int retries;
        private OnEvent onSuccess = OnEvent.EMPTY;
        private OnEvent onError = OnEvent.EMPTY;
        private int recentRuns = RecentRuns.DEFAULT_CAPACITY;

        private Builder(String name) {
            this.name = name;
        }

        public Builder cron(String cron) { this.cron = cron; return this; }
        public Builder command(String... parts) { this.command.addAll(List.of(parts)); return this; }
        public Builder command(List<String> parts) { this.command.addAll(parts); return this; }
        public Builder param(String key, String value) { this.params.put(key, value); return this; }
        public Builder params(Map<String, String> values) { this.params.putAll(values); return this; }
        public Builder env(String key, String value) { this.env.put(key, value); return this; }
        public Builder env(Map<String, String> values) { this.env.putAll(values); return this; }
        public Builder workingDirectory(String dir) { this.workingDirectory = dir; return this; }
        public Builder retries(int retries) { this.retries = retries; return this; }
        public Builder onSuccess(OnEvent onSuccess) { this.onSuccess = onSuccess; return this; }
        public Builder onError(OnEvent onError) { this.onError = onError; return this; }
        public Builder recentRuns(int capacity) { this.recentRuns = capacity; return this; }

        public JobSpec build() {
            return new JobSpec(name, cron, command, params, env, workingDirectory, retries,
                    onSuccess, onError, new RecentRuns(recentRuns));
        }
    }
}
