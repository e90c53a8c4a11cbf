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

/**
 * Base type for every failure raised by the job scheduler. Carries a stable
 * {@code errorCode} so callers can branch without parsing messages.
 */
public class JobSchedulerException extends RuntimeException {
    private final String errorCode;

    public JobSchedulerException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public JobSchedulerException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
