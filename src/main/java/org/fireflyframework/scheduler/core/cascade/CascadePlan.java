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


package org.fireflyframework.scheduler.core.cascade;

import java.util.ArrayList;
import java.util.List;

/**
 * Downstream actions selected for one finished run.
 */
public record CascadePlan(List<String> jobs, List<String> webhooks, List<String> slackWebhooks) {

    public CascadePlan {
        jobs = jobs != null ? List.copyOf(jobs) : List.of();
        webhooks = webhooks != null ? List.copyOf(webhooks) : List.of();
        slackWebhooks = slackWebhooks != null ? List.copyOf(slackWebhooks) : List.of();
    }

    /** Dependent job names followed by webhook URLs, in dispatch order. */
    public List<String> targets() {
        List<String> all = new ArrayList<>(jobs.size() + webhooks.size() + slackWebhooks.size());
        all.addAll(jobs);
        all.addAll(webhooks);
        all.addAll(slackWebhooks);
        return all;
    }

    public boolean isEmpty() {
        return jobs.isEmpty() && webhooks.isEmpty() && slackWebhooks.isEmpty();
    }
}
