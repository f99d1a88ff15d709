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
import org.durastream.replay.ReplayStoragePolicy;
import org.durastream.replay.storage.ReplayMarkerStorage;
import org.durastream.streaming.api.exception.ReplayMarkerStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * Persists the replay markers of received messages to a {@link ReplayMarkerStorage}.
 * <p>
 * Commits of the same channel are serialized and never move the stored marker backwards, so committing a message that was
 * replayed after a reconnect doesn't overwrite the position of a later message.
 * </p>
 */
public class ReplayCommitter {
    private static final Logger log = LoggerFactory.getLogger(ReplayCommitter.class);

    private final ReplayMarkerStorage storage;
    private final ReplayStoragePolicy replayStoragePolicy;
    private final ConcurrentMap<String, Lock> channelLocks = new ConcurrentHashMap<>();

    public ReplayCommitter(ReplayMarkerStorage storage, ReplayStoragePolicy replayStoragePolicy) {
        requireNonNull(storage, ReplayMarkerStorage.class.getSimpleName() + " cannot be null");
        requireNonNull(replayStoragePolicy, ReplayStoragePolicy.class.getSimpleName() + " cannot be null");
        this.storage = storage;
        this.replayStoragePolicy = replayStoragePolicy;
    }

    /**
     * Store the position of {@code message}.
     *
     * @return {@code true} if the marker was written, {@code false} if the message isn't committable or the stored marker is already ahead of it
     * @throws ReplayMarkerStorageException If the storage failed
     */
    public boolean commit(ReceivedMessage message) {
        requireNonNull(message, ReceivedMessage.class.getSimpleName() + " cannot be null");
        Optional<ReplayMarker> replayMarker = message.replayMarker();
        if (!message.isCommittable() || replayMarker.isEmpty()) {
            log.debug("Message on {} is not committable, ignoring commit", message.channel());
            return false;
        }
        return commit(replayMarker.get());
    }

    /**
     * Run {@code action} and commit {@code message} only if the action completes normally.
     * An exception thrown by the action is propagated and nothing is committed.
     */
    public void processThenCommit(ReceivedMessage message, Consumer<ReceivedMessage> action) {
        requireNonNull(message, ReceivedMessage.class.getSimpleName() + " cannot be null");
        requireNonNull(action, "action cannot be null");
        action.accept(message);
        commit(message);
    }

    /**
     * Delete the stored marker of {@code channel}, the next subscription falls back to the storage's default replay option.
     */
    public void discard(String channel) {
        requireNonNull(channel, "channel cannot be null");
        Lock lock = lockFor(channel);
        lock.lock();
        try {
            storage.delete(channel);
            log.info("Discarded replay marker of {}", channel);
        } finally {
            lock.unlock();
        }
    }

    private boolean commit(ReplayMarker replayMarker) {
        String channel = replayMarker.channel();
        Lock lock = lockFor(channel);
        lock.lock();
        try {
            ReplayMarker stored = storage.read(channel);
            if (stored != null && !replayMarker.isAtOrAfter(stored)) {
                log.debug("Not storing replay marker {} of {} since the stored replay marker {} is ahead of it", replayMarker.replayId(), channel, stored.replayId());
                return false;
            }
            storage.save(channel, replayMarker);
            log.trace("Stored replay marker {} of {}", replayMarker.replayId(), channel);
            return true;
        } finally {
            lock.unlock();
        }
    }

    private Lock lockFor(String channel) {
        return channelLocks.computeIfAbsent(channel, __ -> new ReentrantLock());
    }

    public ReplayStoragePolicy replayStoragePolicy() {
        return replayStoragePolicy;
    }
}
