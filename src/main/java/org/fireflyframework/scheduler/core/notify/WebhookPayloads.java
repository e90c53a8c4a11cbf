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


package org.fireflyframework.scheduler.core.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.fireflyframework.scheduler.core.history.RunSerializer;
import org.fireflyframework.scheduler.core.model.JobRun;

import java.util.Map;

/**
 * Builds webhook request bodies for a finished run.
 */
public final class WebhookPayloads {

    private final RunSerializer serializer;

    public WebhookPayloads(RunSerializer serializer) {
        this.serializer = serializer;
    }

    public byte[] body(JobRun run, WebhookFormat format) {
        return switch (format) {
            case GENERIC -> serializer.serializeToBytes(run);
            case SLACK -> slackBody(run);
        };
    }

    public static String slackText(JobRun run) {
        return run.name() + " finished with status " + run.status() + ", triggered by " + run.triggeredBy();
    }

    private byte[] slackBody(JobRun run) {
        try {
            return serializer.mapper().writeValueAsBytes(Map.of("text", slackText(run)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize Slack payload", e);
        }
    }
}
