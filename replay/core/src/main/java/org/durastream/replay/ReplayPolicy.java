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

import org.durastream.replay.storage.ReplayMarkerStorage;
import org.jspecify.annotations.Nullable;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Decides which replay position to request when a channel is (re)subscribed.
 * <p>
 * The storage is the single source of truth, so the position is looked up again on every attempt and never cached.
 * </p>
 */
public class ReplayPolicy {

    private final ReplayMarkerStorage storage;
    private final @Nullable ReplayOption replayFallback;

    /**
     * @param storage        The storage holding the replay markers
     * @param replayFallback The replay option to retry with if the server rejects the stored position, or {@code null} to not retry
     */
    public ReplayPolicy(ReplayMarkerStorage storage, @Nullable ReplayOption replayFallback) {
        requireNonNull(storage, ReplayMarkerStorage.class.getSimpleName() + " cannot be null");
        this.storage = storage;
        this.replayFallback = replayFallback;
    }

    /**
     * @return {@link ReplayOption#replayId(long)} of the stored marker, or the storage's default replay option if no marker is stored,
     * or {@link ReplayOption#NEW_EVENTS} if the storage doesn't define a default.
     */
    public ReplayOption resolveReplayOption(String channel) {
        requireNonNull(channel, "channel cannot be null");
        ReplayMarker replayMarker = storage.read(channel);
        if (replayMarker != null) {
            return ReplayOption.after(replayMarker);
        }
        return storage.defaultReplayOption().orElse(ReplayOption.NEW_EVENTS);
    }

    public Optional<ReplayOption> resolveFallback(String channel) {
        requireNonNull(channel, "channel cannot be null");
        return Optional.ofNullable(replayFallback);
    }
}
