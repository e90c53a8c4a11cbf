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


package org.fireflyframework.scheduler.core.history;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.fireflyframework.scheduler.core.model.JobRun;

/**
 * Serializes {@link JobRun} to and from the single-line JSON form used by run logs
 * and generic webhook payloads.
 */
public class RunSerializer {

    private final ObjectMapper mapper;

    public RunSerializer() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
        mapper.disable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public RunSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public String serialize(JobRun run) {
        try {
            return mapper.writeValueAsString(run);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize JobRun", e);
        }
    }

    public byte[] serializeToBytes(JobRun run) {
        try {
            return mapper.writeValueAsBytes(run);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize JobRun to bytes", e);
        }
    }

    public JobRun deserialize(String json) {
        try {
            return mapper.readValue(json, JobRun.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize JobRun", e);
        }
    }
}
