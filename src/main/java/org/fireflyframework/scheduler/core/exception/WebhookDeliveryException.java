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
 * A webhook call that did not produce a 2xx response, either because the
 * endpoint answered with an error status or because it could not be reached.
 */
public final class WebhookDeliveryException extends JobSchedulerException {
    private final String url;
    private final int statusCode;

    public WebhookDeliveryException(String url, int statusCode, String responseBody) {
        super("webhook '" + url + "' responded with status " + statusCode
                + (responseBody == null || responseBody.isBlank() ? "" : ": " + responseBody),
                "SCHEDULER_WEBHOOK_ERROR");
        this.url = url;
        this.statusCode = statusCode;
    }

    public WebhookDeliveryException(String url, Throwable cause) {
        super("webhook '" + url + "' could not be called: " + cause.getMessage(), "SCHEDULER_WEBHOOK_ERROR", cause);
        this.url = url;
        this.statusCode = -1;
    }

    public String getUrl() {
        return url;
    }

    /** HTTP status of the response, or {@code -1} when no response was received. */
    public int getStatusCode() {
        return statusCode;
    }
}
