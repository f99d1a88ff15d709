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

package org.durastream.client;

import org.durastream.replay.ReplayMarker;
import org.durastream.streaming.api.StreamingMessage;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * A message returned by {@link StreamingClient#receive()}, together with the replay marker extracted from it.
 */
@NullMarked
public final class ReceivedMessage {
    private final StreamingMessage message;
    private final @Nullable ReplayMarker replayMarker;
    private final boolean committable;

    ReceivedMessage(StreamingMessage message, @Nullable ReplayMarker replayMarker, boolean committable) {
        requireNonNull(message, StreamingMessage.class.getSimpleName() + " cannot be null");
        this.message = message;
        this.replayMarker = replayMarker;
        this.committable = committable && replayMarker != null;
    }

    public String channel() {
        return message.channel();
    }

    public Map<String, Object> data() {
        return message.data();
    }

    public StreamingMessage message() {
        return message;
    }

    /**
     * @return The position of this message, or empty if the message doesn't carry one
     */
    public Optional<ReplayMarker> replayMarker() {
        return Optional.ofNullable(replayMarker);
    }

    /**
     * @return {@code false} if committing this message doesn't store its position. That's the case for messages without a replay marker
     * and for messages that were received before the client reconnected and resubscribed to the channel.
     */
    public boolean isCommittable() {
        return committable;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReceivedMessage)) return false;
        ReceivedMessage that = (ReceivedMessage) o;
        return committable == that.committable && Objects.equals(message, that.message) && Objects.equals(replayMarker, that.replayMarker);
    }

    @Override
    public int hashCode() {
        return Objects.hash(message, replayMarker, committable);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", ReceivedMessage.class.getSimpleName() + "[", "]")
                .add("message=" + message)
                .add("replayMarker=" + replayMarker)
                .add("committable=" + committable)
                .toString();
    }
}
