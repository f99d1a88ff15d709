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
import org.jspecify.annotations.Nullable;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Decorates a {@link ReplayMarkerStorage} so that channels without a stored marker start from a configured
 * {@link ReplayOption} (typically {@link ReplayOption#ALL_EVENTS}). Markers saved later take precedence over the default.
 */
public class DefaultingReplayMarkerStorage implements ReplayMarkerStorage {

    private final ReplayMarkerStorage storage;
    private final ReplayOption defaultReplayOption;

    public DefaultingReplayMarkerStorage(ReplayMarkerStorage storage, ReplayOption defaultReplayOption) {
        requireNonNull(storage, ReplayMarkerStorage.class.getSimpleName() + " cannot be null");
        requireNonNull(defaultReplayOption, "defaultReplayOption cannot be null");
        this.storage = storage;
        this.defaultReplayOption = defaultReplayOption;
    }

    @Override
    public @Nullable ReplayMarker read(String channel) {
        return storage.read(channel);
    }

    @Override
    public void save(String channel, ReplayMarker replayMarker) {
        storage.save(channel, replayMarker);
    }

    @Override
    public void delete(String channel) {
        storage.delete(channel);
    }

    @Override
    public Optional<ReplayOption> defaultReplayOption() {
        return Optional.of(defaultReplayOption);
    }

    public ReplayMarkerStorage getDelegatedStorage() {
        return storage;
    }

    @Override
    public String toString() {
        return DefaultingReplayMarkerStorage.class.getSimpleName() + "[storage=" + storage + ", defaultReplayOption=" + defaultReplayOption + "]";
    }
}
