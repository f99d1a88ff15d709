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

package org.durastream.replay.storage;

import org.durastream.replay.ReplayMarker;
import org.durastream.replay.ReplayOption;
import org.durastream.streaming.api.exception.ReplayMarkerStorageException;
import org.jspecify.annotations.Nullable;

import java.util.Optional;

/**
 * A {@code ReplayMarkerStorage} provides means to read and write the replay marker of a channel to storage.
 * This allows a subscription to continue where it left off when the client reconnects or the application is restarted.
 * <p>
 * A missing marker is not an error. When no marker is stored for a channel the subscription starts from
 * {@link #defaultReplayOption()}, or from the server default ({@link ReplayOption#NEW_EVENTS}) if the storage doesn't define one.
 * </p>
 */
public interface ReplayMarkerStorage {

    /**
     * Read the replay marker of a channel.
     *
     * @param channel The channel whose marker to find
     * @return The stored {@link ReplayMarker} or {@code null} if no marker is stored for {@code channel}
     * @throws ReplayMarkerStorageException If the storage couldn't be read
     */
    @Nullable
    ReplayMarker read(String channel);

    /**
     * Save the replay marker of a channel, replacing the previous one.
     *
     * @throws ReplayMarkerStorageException If the marker couldn't be written
     */
    void save(String channel, ReplayMarker replayMarker);

    /**
     * Delete the replay marker of a channel, for example when the stored position is no longer valid.
     *
     * @throws ReplayMarkerStorageException If the marker couldn't be deleted
     */
    void delete(String channel);

    /**
     * @return The replay option to use for channels that don't have a stored marker, or empty to use the server default.
     */
    default Optional<ReplayOption> defaultReplayOption() {
        return Optional.empty();
    }
}
