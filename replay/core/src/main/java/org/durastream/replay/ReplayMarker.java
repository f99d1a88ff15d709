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

import org.jspecify.annotations.NullMarked;

import java.time.OffsetDateTime;

import static java.util.Objects.requireNonNull;

/**
 * The position of a delivered message on a channel.
 * <p>
 * Markers of the same channel are ordered by {@code replayId}, markers of different channels can't be compared.
 * {@code createdAt} is the creation time of the message as reported by the server and is informational only.
 * </p>
 */
@NullMarked
public record ReplayMarker(String channel, long replayId, OffsetDateTime createdAt) {

    public ReplayMarker {
        requireNonNull(channel, "channel cannot be null");
        requireNonNull(createdAt, "createdAt cannot be null");
    }

    /**
     * @return {@code true} if this marker is at the same position as, or after, {@code other}
     * @throws IllegalArgumentException If the markers belong to different channels
     */
    public boolean isAtOrAfter(ReplayMarker other) {
        requireNonNull(other, "other cannot be null");
        if (!channel.equals(other.channel)) {
            throw new IllegalArgumentException("Cannot compare replay markers of channel " + channel + " and " + other.channel);
        }
        return replayId >= other.replayId;
    }
}
