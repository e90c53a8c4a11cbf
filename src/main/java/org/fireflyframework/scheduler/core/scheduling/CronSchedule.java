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

import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * A standard five-field cron expression ({@code minute hour day-of-month month day-of-week})
 * or one of the {@code @hourly}, {@code @daily}, {@code @weekly}, {@code @monthly},
 * {@code @yearly} macros.
 */
public final class CronSchedule {

    private final String expression;
    private final CronExpression cron;

    private CronSchedule(String expression, CronExpression cron) {
        this.expression = expression;
        this.cron = cron;
    }

    public static CronSchedule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("cron expression must not be empty");
        }
        String trimmed = expression.trim();
        if (trimmed.startsWith("@")) {
            return new CronSchedule(trimmed, CronExpression.parse(trimmed));
        }
        String[] fields = trimmed.split("\\s+");
        if (fields.length != 5) {
            throw new IllegalArgumentException("cron expression must have 5 fields, found "
                    + fields.length + " in '" + trimmed + "'");
        }
        return new CronSchedule(trimmed, CronExpression.parse("0 " + String.join(" ", fields)));
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Next fire time strictly after {@code after}, or {@code null} if the expression
     * never fires again.
     */
    public Instant next(Instant after, ZoneId zone) {
        ZonedDateTime next = cron.next(ZonedDateTime.ofInstant(after, zone));
        return next != null ? next.toInstant() : null;
    }

    @Override
    public String toString() {
        return expression;
    }
}
