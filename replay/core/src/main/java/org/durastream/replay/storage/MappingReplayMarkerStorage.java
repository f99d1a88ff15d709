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
import org.durastream.streaming.api.exception.ReplayMarkerStorageException;
import org.jspecify.annotations.Nullable;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static java.util.Objects.requireNonNull;

/**
 * A {@link ReplayMarkerStorage} backed by a {@link Map} whose keys are channel names. Any map implementation
 * can be used, from a {@link ConcurrentHashMap} to a map that is persisted by a key-value store.
 * Exceptions thrown by the map are rethrown as {@link ReplayMarkerStorageException}.
 */
public class MappingReplayMarkerStorage implements ReplayMarkerStorage {

    private final Map<String, ReplayMarker> mapping;

    /**
     * Create a {@code MappingReplayMarkerStorage} that keeps the markers in memory.
     */
    public MappingReplayMarkerStorage() {
        this(new ConcurrentHashMap<>());
    }

    /**
     * @param mapping The map used to store the replay markers
     */
    public MappingReplayMarkerStorage(Map<String, ReplayMarker> mapping) {
        requireNonNull(mapping, "mapping cannot be null");
        this.mapping = mapping;
    }

    @Override
    public @Nullable ReplayMarker read(String channel) {
        requireNonNull(channel, "channel cannot be null");
        try {
            return mapping.get(channel);
        } catch (RuntimeException e) {
            throw new ReplayMarkerStorageException("Failed to read replay marker of channel " + channel, e);
        }
    }

    @Override
    public void save(String channel, ReplayMarker replayMarker) {
        requireNonNull(channel, "channel cannot be null");
        requireNonNull(replayMarker, ReplayMarker.class.getSimpleName() + " cannot be null");
        try {
            mapping.put(channel, replayMarker);
        } catch (RuntimeException e) {
            throw new ReplayMarkerStorageException("Failed to save replay marker of channel " + channel, e);
        }
    }

    @Override
    public void delete(String channel) {
        requireNonNull(channel, "channel cannot be null");
        try {
            mapping.remove(channel);
        } catch (RuntimeException e) {
            throw new ReplayMarkerStorageException("Failed to delete replay marker of channel " + channel, e);
        }
    }

    @Override
    public String toString() {
        return MappingReplayMarkerStorage.class.getSimpleName() + "[mapping=" + mapping.getClass().getSimpleName() + ", size=" + mapping.size() + "]";
    }
}
