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

import java.util.ArrayList;
import java.util.List;

/**
 * Actions to take after a job outcome: jobs to trigger, generic webhooks and
 * Slack-style webhooks to notify.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record OnEvent(
        @JsonProperty("trigger_job") List<String> triggerJob,
        @JsonProperty("notify_webhook") List<String> notifyWebhook,
        @JsonProperty("notify_slack_webhook") List<String> notifySlackWebhook
) {
    public static final OnEvent EMPTY = new OnEvent(List.of(), List.of(), List.of());

    public OnEvent {
        triggerJob = triggerJob != null ? List.copyOf(triggerJob) : List.of();
        notifyWebhook = notifyWebhook != null ? List.copyOf(notifyWebhook) : List.of();
        notifySlackWebhook = notifySlackWebhook != null ? List.copyOf(notifySlackWebhook) : List.of();
    }

    public static OnEvent triggering(String... jobs) {
        return new OnEvent(List.of(jobs), List.of(), List.of());
    }

    /**
     * Unions two specs list by list. Entries of {@code local} come first, followed
     * by those of {@code global}; duplicates are kept.
     */
    public static OnEvent merge(OnEvent local, OnEvent global) {
        OnEvent l = local != null ? local : EMPTY;
        OnEvent g = global != null ? global : EMPTY;
        return new OnEvent(
                concat(l.triggerJob, g.triggerJob),
                concat(l.notifyWebhook, g.notifyWebhook),
                concat(l.notifySlackWebhook, g.notifySlackWebhook));
    }

    @JsonIgnore
    public boolean isEmpty() {
        return triggerJob.isEmpty() && notifyWebhook.isEmpty() && notifySlackWebhook.isEmpty();
    }

    private static List<String> concat(List<String> first, List<String> second) {
        if (second.isEmpty()) return first;
        if (first.isEmpty()) return second;
        List<String> out = new ArrayList<>(first.size() + second.size());
        out.addAll(first);
        out.addAll(second);
        return out;
    }
}
