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


package org.fireflyframework.scheduler.core.validation;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.scheduler.core.exception.ScheduleValidationException;
import org.fireflyframework.scheduler.core.model.JobSpec;
import org.fireflyframework.scheduler.core.model.OnEvent;
import org.fireflyframework.scheduler.core.model.Schedule;
import org.fireflyframework.scheduler.core.scheduling.CronSchedule;
import org.fireflyframework.scheduler.core.validation.ValidationIssue.Severity;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Validates a {@link Schedule} before the engine starts. Produces a list of
 * {@link ValidationIssue}s categorized by severity; {@link #validateAndThrow(Schedule)}
 * aborts startup when ERROR-level issues exist.
 */
@Slf4j
public class ScheduleValidator {

    public List<ValidationIssue> validate(Schedule schedule) {
        List<ValidationIssue> issues = new ArrayList<>();
        Set<String> referenced = new HashSet<>();

        for (JobSpec job : schedule.jobs().values()) {
            String loc = "job." + job.name();

            if (job.hasCron() && !CronSchedule.isValid(job.cron())) {
                issues.add(new ValidationIssue(Severity.ERROR,
                        "cron string for job '" + job.name() + "' not valid", loc + ".cron"));
            }

            if (job.retries() < 0) {
                issues.add(new ValidationIssue(Severity.ERROR,
                        "Job has negative retries (" + job.retries() + ")", loc + ".retries"));
            }

            if (job.command().isEmpty()) {
                issues.add(new ValidationIssue(Severity.WARNING,
                        "Job has no command and will fail every time it runs", loc + ".command"));
            }

            checkEvent(schedule, job.onSuccess(), "referenced in job '" + job.name() + "'",
                    loc + ".on_success", issues, referenced);
            checkEvent(schedule, job.onError(), "referenced in job '" + job.name() + "'",
                    loc + ".on_error", issues, referenced);
        }

        checkEvent(schedule, schedule.onSuccess(), "referenced in the schedule-level on_success",
                "schedule.on_success", issues, referenced);
        checkEvent(schedule, schedule.onError(), "referenced in the schedule-level on_error",
                "schedule.on_error", issues, referenced);

        for (JobSpec job : schedule.jobs().values()) {
            if (!job.hasCron() && !referenced.contains(job.name())) {
                issues.add(new ValidationIssue(Severity.INFO,
                        "Job has no cron and is not triggered by any other job; it only runs manually",
                        "job." + job.name()));
            }
        }
        return issues;
    }

    /**
     * Validates the schedule, logs every issue and throws when at least one is an error.
     *
     * @throws ScheduleValidationException carrying the ERROR-level issues
     */
    public List<ValidationIssue> validateAndThrow(Schedule schedule) {
        List<ValidationIssue> issues = validate(schedule);
        for (ValidationIssue issue : issues) {
            switch (issue.severity()) {
                case WARNING -> log.warn("[validation] {} at {}", issue.message(), issue.location());
                case INFO -> log.info("[validation] {} at {}", issue.message(), issue.location());
                case ERROR -> log.error("[validation] {} at {}", issue.message(), issue.location());
            }
        }

        List<ValidationIssue> errors = issues.stream()
                .filter(i -> i.severity() == Severity.ERROR)
                .toList();
        if (!errors.isEmpty()) {
            throw new ScheduleValidationException(errors);
        }
        return issues;
    }

    private void checkEvent(Schedule schedule, OnEvent event, String origin, String loc,
                            List<ValidationIssue> issues, Set<String> referenced) {
        for (String target : event.triggerJob()) {
            referenced.add(target);
            if (!schedule.jobs().containsKey(target)) {
                issues.add(new ValidationIssue(Severity.ERROR,
                        "cannot find spec of job '" + target + "' that is " + origin, loc + ".trigger_job"));
            }
        }
        for (String url : event.notifyWebhook()) {
            checkUrl(url, loc + ".notify_webhook", issues);
        }
        for (String url : event.notifySlackWebhook()) {
            checkUrl(url, loc + ".notify_slack_webhook", issues);
        }
    }

    private void checkUrl(String url, String loc, List<ValidationIssue> issues) {
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            if (uri.getHost() == null || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                issues.add(new ValidationIssue(Severity.WARNING, "Webhook URL is not an absolute http(s) URL: " + url, loc));
            }
        } catch (URISyntaxException e) {
            issues.add(new ValidationIssue(Severity.WARNING, "Webhook URL is malformed: " + e.getMessage(), loc));
        }
    }
}
