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
 * A {@link ReplayMarkerStorage} that doesn't store anything. Every subscription starts from the same {@link ReplayOption}.
 */
public class ConstantReplayMarkerStorage implements ReplayMarkerStorage {

    private final ReplayOption replayOption;

    public ConstantReplayMarkerStorage(ReplayOption replayOption) {
        requireNonNull(replayOption, ReplayOption.class.getSimpleName() + " cannot be null");
        this.replayOption = replayOption;
    }

    @Override
    public @Nullable ReplayMarker read(String channel) {
        return null;
    }

    @Override
    public void save(String channel, ReplayMarker replayMarker) {
    }

    @Override
    public void delete(String channel) {
    }

    @Override
    public Optional<ReplayOption> defaultReplayOption() {
        return Optional.of(replayOption);
    }

    @Override
    public String toString() {
        return ConstantReplayMarkerStorage.class.getSimpleName() + "[" + replayOption + "]";
    }
}
