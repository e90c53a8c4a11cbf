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


package org.fireflyframework.scheduler.unit.history;

import org.fireflyframework.scheduler.core.history.RunSerializer;
import org.fireflyframework.scheduler.core.model.JobRun;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class RunSerializerTest {

    private final RunSerializer serializer = new RunSerializer();

    @Test
    void serialize_usesSnakeCaseFieldsOnOneLine() {
        var run = new JobRun(0, "hello\n", "backup", Instant.parse("2024-03-01T10:15:30Z"), "cron",
                List.of("cleanup"), Duration.ofMillis(1500), Map.of("db", "main"));

        String json = serializer.serialize(run);

        assertThat(json).doesNotContain("\n").contains("\"log\":\"hello\\n\"");
        assertThat(json).contains("\"status\":0")
                .contains("\"name\":\"backup\"")
                .contains("\"triggered_at\":\"2024-03-01T10:15:30Z\"")
                .contains("\"triggered_by\":\"cron\"")
                .contains("\"triggered\":[\"cleanup\"]")
                .contains("\"duration\":\"PT1.5S\"")
                .contains("\"params\":{\"db\":\"main\"}");
        assertThat(json).doesNotContain("success");
    }

    @Test
    void serialize_omitsEmptyTriggeredAndParams() {
        var run = new JobRun(1, "", "a", Instant.EPOCH, "manual", List.of(), Duration.ZERO, Map.of());

        assertThat(serializer.serialize(run)).doesNotContain("\"triggered\"").doesNotContain("\"params\"");
    }

    @Test
    void deserialize_readsWhatWasWritten() {
        var run = new JobRun(-1, "job unable to start: boom", "a", Instant.parse("2024-01-01T00:00:00Z"),
                "cron[retry=1]", List.of("b"), Duration.ofSeconds(2), Map.of());

        assertThat(serializer.deserialize(serializer.serialize(run))).isEqualTo(run);
    }

    @Test
    void deserialize_invalidJson_throwsIllegalState() {
        assertThatThrownBy(() -> serializer.deserialize("{not json"))
                .isInstanceOf(IllegalStateException.class);
    }
}
