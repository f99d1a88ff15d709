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

package org.durastream.replay;

import org.durastream.streaming.api.StreamingMessage;
import org.durastream.streaming.api.exception.ReplayExtractionException;
import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Extracts {@link ReplayMarker}s from inbound messages.
 * <p>
 * The position is read from the {@code replay} extension ({@code ext.replay.id} and {@code ext.replay.createdDate}) if present,
 * otherwise from the message payload: {@code data.event.replayId} together with {@code data.event.createdDate} (PushTopic events)
 * or {@code data.payload.CreatedDate} (platform events).
 * </p>
 */
public class ReplayMarkers {

    // Accepts "2018-06-19T11:47:27.000+0000" as well as ISO-8601 offsets such as "+00:00" and "Z"
    private static final DateTimeFormatter CREATED_DATE_FORMAT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
            .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
            .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
            .toFormatter();

    private ReplayMarkers() {
    }

    /**
     * @param message An inbound message
     * @return The replay marker of the message
     * @throws ReplayExtractionException If the replay id or the creation date is missing or malformed
     */
    public static ReplayMarker extract(StreamingMessage message) {
        Map<String, Object> replayExtension = mapOrNull(message.ext().get("replay"));
        final Object replayId;
        final Object createdDate;
        if (replayExtension != null && replayExtension.containsKey("id")) {
            replayId = replayExtension.get("id");
            createdDate = replayExtension.get("createdDate");
        } else {
            Map<String, Object> event = mapOrNull(message.data().get("event"));
            Map<String, Object> payload = mapOrNull(message.data().get("payload"));
            replayId = event == null ? null : event.get("replayId");
            if (event != null && event.containsKey("createdDate")) {
                createdDate = event.get("createdDate");
            } else {
                createdDate = payload == null ? null : payload.get("CreatedDate");
            }
        }

        return new ReplayMarker(message.channel(), toReplayId(message.channel(), replayId), toCreatedAt(message.channel(), createdDate));
    }

    private static long toReplayId(String channel, @Nullable Object value) {
        if (value == null) {
            throw new ReplayExtractionException("No replay id found in message on channel " + channel);
        } else if (!(value instanceof Number)) {
            throw new ReplayExtractionException("Replay id of message on channel " + channel + " is not a number: " + value);
        }

        try {
            return new BigDecimal(value.toString()).longValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            throw new ReplayExtractionException("Replay id of message on channel " + channel + " is not an integer: " + value, e);
        }
    }

    private static OffsetDateTime toCreatedAt(String channel, @Nullable Object value) {
        if (!(value instanceof String)) {
            throw new ReplayExtractionException("No message creation date found in message on channel " + channel);
        }

        try {
            return OffsetDateTime.parse((String) value, CREATED_DATE_FORMAT);
        } catch (DateTimeParseException e) {
            throw new ReplayExtractionException("Message creation date on channel " + channel + " is malformed: " + value, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static @Nullable Map<String, Object> mapOrNull(@Nullable Object value) {
        return value instanceof Map ? (Map<String, Object>) value : null;
    }
}
