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

import org.fireflyframework.scheduler.core.scheduling.OverlapPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;

/**
 * Configuration properties of the job scheduler.
 *
 * <p>Example YAML:
 * <pre>{@code
 * firefly:
 *   scheduler:
 *     definition-file: /etc/cheek/schedule.yaml
 *     auto-start: true
 *     log-dir: /var/log/cheek
 *     suppress-logs: false
 *     tick-interval: 1s
 *     recent-runs: 10
 *     overlap: allow
 *     history:
 *       provider: jsonl
 *     retry:
 *       backoff: 5s
 *     notify:
 *       timeout: 10s
 *     shutdown:
 *       await-in-flight: false
 *       timeout: 30s
 *     rest:
 *       enabled: true
 *     health:
 *       enabled: true
 *     metrics:
 *       enabled: true
 *     resilience:
 *       enabled: true
 * }</pre>
 */
@ConfigurationProperties(prefix = "firefly.scheduler")
public class JobSchedulerProperties {

    private boolean enabled = true;
    private boolean autoStart = true;
    private String definitionFile;
    private String logDir = System.getProperty("user.home") + "/.cheek";
    private boolean suppressLogs = false;
    private Duration tickInterval = Duration.ofSeconds(1);
    private int recentRuns = 10;
    private OverlapPolicy overlap = OverlapPolicy.ALLOW;

    @NestedConfigurationProperty
    private HistoryProperties history = new HistoryProperties();

    @NestedConfigurationProperty
    private RetryProperties retry = new RetryProperties();

    @NestedConfigurationProperty
    private NotifyProperties notify = new NotifyProperties();

    @NestedConfigurationProperty
    private ShutdownProperties shutdown = new ShutdownProperties();

    @NestedConfigurationProperty
    private RestProperties rest = new RestProperties();

    @NestedConfigurationProperty
    private HealthProperties health = new HealthProperties();

    @NestedConfigurationProperty
    private MetricsProperties metrics = new MetricsProperties();

    @NestedConfigurationProperty
    private ResilienceProperties resilience = new ResilienceProperties();

    // --- Getters and Setters ---

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public boolean isAutoStart() { return autoStart; }
    public void setAutoStart(boolean autoStart) { this.autoStart = autoStart; }

    public String getDefinitionFile() { return definitionFile; }
    public void setDefinitionFile(String definitionFile) { this.definitionFile = definitionFile; }

    public String getLogDir() { return logDir; }
    public void setLogDir(String logDir) { this.logDir = logDir; }

    public boolean isSuppressLogs() { return suppressLogs; }
    public void setSuppressLogs(boolean suppressLogs) { this.suppressLogs = suppressLogs; }

    public Duration getTickInterval() { return tickInterval; }
    public void setTickInterval(Duration tickInterval) { this.tickInterval = tickInterval; }

    public int getRecentRuns() { return recentRuns; }
    public void setRecentRuns(int recentRuns) { this.recentRuns = recentRuns; }

    public OverlapPolicy getOverlap() { return overlap; }
    public void setOverlap(OverlapPolicy overlap) { this.overlap = overlap; }

    public HistoryProperties getHistory() { return history; }
    public void setHistory(HistoryProperties history) { this.history = history; }

    public RetryProperties getRetry() { return retry; }
    public void setRetry(RetryProperties retry) { this.retry = retry; }

    public NotifyProperties getNotify() { return notify; }
    public void setNotify(NotifyProperties notify) { this.notify = notify; }

    public ShutdownProperties getShutdown() { return shutdown; }
    public void setShutdown(ShutdownProperties shutdown) { this.shutdown = shutdown; }

    public RestProperties getRest() { return rest; }
    public void setRest(RestProperties rest) { this.rest = rest; }

    public HealthProperties getHealth() { return health; }
    public void setHealth(HealthProperties health) { this.health = health; }

    public MetricsProperties getMetrics() { return metrics; }
    public void setMetrics(MetricsProperties metrics) { this.metrics = metrics; }

    public ResilienceProperties getResilience() { return resilience; }
    public void setResilience(ResilienceProperties resilience) { this.resilience = resilience; }

    // --- Nested Property Classes ---

    public static class HistoryProperties {
        /** {@code jsonl} writes per-job files under {@code log-dir}; {@code in-memory} keeps nothing on disk. */
        private String provider = "jsonl";

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }
    }

    public static class RetryProperties {
        private Duration backoff = Duration.ofSeconds(5);

        public Duration getBackoff() { return backoff; }
        public void setBackoff(Duration backoff) { this.backoff = backoff; }
    }

    public static class NotifyProperties {
        private Duration timeout = Duration.ofSeconds(10);

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    public static class ShutdownProperties {
        private boolean awaitInFlight = false;
        private Duration timeout = Duration.ofSeconds(30);

        public boolean isAwaitInFlight() { return awaitInFlight; }
        public void setAwaitInFlight(boolean awaitInFlight) { this.awaitInFlight = awaitInFlight; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    public static class RestProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class HealthProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class MetricsProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class ResilienceProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
