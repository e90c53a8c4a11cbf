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


package org.fireflyframework.scheduler.core.exception;

import org.fireflyframework.scheduler.core.validation.ValidationIssue;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when a schedule fails validation. The engine never starts in that case.
 */
public final class ScheduleValidationException extends JobSchedulerException {
    private final List<ValidationIssue> issues;

    public ScheduleValidationException(List<ValidationIssue> issues) {
        super(describe(issues), "SCHEDULER_VALIDATION_ERROR");
        this.issues = List.copyOf(issues);
    }

    public List<ValidationIssue> getIssues() {
        return issues;
    }

    private static String describe(List<ValidationIssue> issues) {
        return "Schedule validation failed: " + issues.stream()
                .map(ValidationIssue::toString)
                .collect(Collectors.joining("; "));
    }
}
