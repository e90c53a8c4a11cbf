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


package org.fireflyframework.scheduler.core.definition;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a {@code command} given either as a single string or as a list of strings.
 * A single string becomes a one-element list; it is not split on whitespace.
 */
public class CommandDeserializer extends JsonDeserializer<List<String>> {

    @Override
    public List<String> deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonToken token = p.currentToken();
        if (token == JsonToken.VALUE_STRING) {
            return List.of(p.getText());
        }
        if (token == JsonToken.START_ARRAY) {
            List<String> parts = new ArrayList<>();
            while (p.nextToken() != JsonToken.END_ARRAY) {
                if (!p.currentToken().isScalarValue()) {
                    return ctxt.reportInputMismatch(List.class,
                            "command list entries must be strings, found %s", p.currentToken());
                }
                parts.add(p.getValueAsString());
            }
            return parts;
        }
        if (token != null && token.isScalarValue()) {
            return List.of(p.getValueAsString());
        }
        return ctxt.reportInputMismatch(List.class, "command must be a string or a list of strings");
    }

    @Override
    public List<String> getNullValue(DeserializationContext ctxt) {
        return List.of();
    }
}
