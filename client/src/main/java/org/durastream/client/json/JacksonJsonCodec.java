/*
 * Copyright 2024 The Durastream Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.durastream.client.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.durastream.streaming.api.exception.ClientException;
import org.durastream.streaming.api.json.JsonCodec;

import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * A {@link JsonCodec} backed by a Jackson {@link ObjectMapper}.
 */
public class JacksonJsonCodec implements JsonCodec {
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public JacksonJsonCodec() {
        this(new ObjectMapper());
    }

    public JacksonJsonCodec(ObjectMapper objectMapper) {
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        this.objectMapper = objectMapper;
    }

    @Override
    public String encode(Map<String, Object> data) {
        requireNonNull(data, "data cannot be null");
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new ClientException("Failed to encode message to json", e);
        }
    }

    @Override
    public Map<String, Object> decode(String json) {
        requireNonNull(json, "json cannot be null");
        try {
            Map<String, Object> data = objectMapper.readValue(json, MAP_TYPE);
            if (data == null) {
                throw new ClientException("Failed to decode json, expected an object but was " + json);
            }
            return data;
        } catch (JsonProcessingException e) {
            throw new ClientException("Failed to decode json", e);
        }
    }
}
