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

package org.durastream.testsupport;

import org.durastream.streaming.api.StreamingMessage;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds inbound messages shaped like the ones pushed by the Salesforce Streaming API.
 */
public class Messages {
    public static final String DEFAULT_CREATED_DATE = "2024-03-01T10:15:30.000+0000";

    private Messages() {
    }

    public static StreamingMessage pushTopicEvent(String channel, long replayId) {
        return pushTopicEvent(channel, replayId, DEFAULT_CREATED_DATE, Map.of("Id", "a00" + replayId, "Name", "record " + replayId));
    }

    /**
     * A PushTopic event: {@code {event: {replayId, createdDate, type}, sobject: {...}}}
     */
    public static StreamingMessage pushTopicEvent(String channel, long replayId, String createdDate, Map<String, Object> sobject) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("replayId", replayId);
        event.put("createdDate", createdDate);
        event.put("type", "created");

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("event", event);
        data.put("sobject", sobject);
        return new StreamingMessage(channel, data);
    }

    /**
     * A platform event: {@code {event: {replayId}, payload: {CreatedDate, ...}}}
     */
    public static StreamingMessage platformEvent(String channel, long replayId, String createdDate, Map<String, Object> fields) {
        Map<String, Object> payload = new LinkedHashMap<>(fields);
        payload.put("CreatedDate", createdDate);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("event", Map.of("replayId", replayId));
        data.put("payload", payload);
        return new StreamingMessage(channel, data);
    }

    /**
     * A message without replay information.
     */
    public static StreamingMessage withoutReplayId(String channel, Map<String, Object> data) {
        return new StreamingMessage(channel, data);
    }
}
