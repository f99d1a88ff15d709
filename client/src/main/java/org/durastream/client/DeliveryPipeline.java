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
import org.durastream.replay.ReplayMarkers;
import org.durastream.replay.ReplayStoragePolicy;
import org.durastream.streaming.api.StreamingMessage;
import org.durastream.streaming.api.exception.ClientException;
import org.durastream.streaming.api.exception.ReplayExtractionException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

import static java.util.Objects.requireNonNull;

/**
 * Hands messages from the transport to the consumer, in the order they arrived per channel, and commits their replay
 * markers according to the {@link ReplayStoragePolicy}.
 * <p>
 * Under {@link ReplayStoragePolicy#IMMEDIATE} the marker is stored before {@link #receive()} returns, and the message stays
 * at the head of the buffer until it has been stored. A failed commit is thrown from {@code receive()} and the next call
 * returns the same message again. Messages that arrived before the latest reconnect are delivered but never committed since
 * the stored position might be ahead of them. The same goes for messages that are received while their channel is still being resubscribed to.
 * </p>
 */
public class DeliveryPipeline {
    private static final Logger log = LoggerFactory.getLogger(DeliveryPipeline.class);

    private final PendingMessageBuffer buffer;
    private final ReplayCommitter replayCommitter;
    private final Predicate<String> resubscribing;
    private final ReentrantLock receiveLock = new ReentrantLock();

    /**
     * @param maxPendingCount The maximum number of messages that are buffered before the transport is blocked
     * @param replayCommitter The committer storing the replay markers
     * @param resubscribing   Tells if a channel is being resubscribed to after a reconnect
     */
    public DeliveryPipeline(int maxPendingCount, ReplayCommitter replayCommitter, Predicate<String> resubscribing) {
        requireNonNull(replayCommitter, ReplayCommitter.class.getSimpleName() + " cannot be null");
        requireNonNull(resubscribing, "resubscribing cannot be null");
        this.buffer = new PendingMessageBuffer(maxPendingCount);
        this.replayCommitter = replayCommitter;
        this.resubscribing = resubscribing;
    }

    /**
     * Buffer a message received from the transport. Blocks while the buffer is full.
     */
    public void accept(StreamingMessage message) {
        requireNonNull(message, StreamingMessage.class.getSimpleName() + " cannot be null");
        boolean committable = !resubscribing.test(message.channel());
        try {
            if (!buffer.put(message, committable)) {
                log.debug("Discarding message on {} since the client is closed", message.channel());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while waiting for room for a message on {}, discarding it", message.channel());
        }
    }

    /**
     * Wait for the next message.
     *
     * @throws org.durastream.streaming.api.exception.ReplayMarkerStorageException If the replay marker couldn't be stored under {@link ReplayStoragePolicy#IMMEDIATE}.
     *                                                                              The message is returned again by the next call.
     * @throws org.durastream.streaming.api.exception.ClientInvalidOperationException If the pipeline is closed
     */
    public ReceivedMessage receive() {
        try {
            receiveLock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClientException("Interrupted while waiting for a message", e);
        }

        try {
            PendingMessageBuffer.Entry head = buffer.awaitHead();
            ReceivedMessage receivedMessage = toReceivedMessage(head);
            if (replayCommitter.replayStoragePolicy() == ReplayStoragePolicy.IMMEDIATE) {
                replayCommitter.commit(receivedMessage);
            }
            buffer.removeHead(head);
            return receivedMessage;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClientException("Interrupted while waiting for a message", e);
        } finally {
            receiveLock.unlock();
        }
    }

    private ReceivedMessage toReceivedMessage(PendingMessageBuffer.Entry entry) {
        StreamingMessage message = entry.message;
        ReplayMarker replayMarker = extractReplayMarker(message);
        // A message flagged while its channel was resubscribing belongs to the new subscription once the resubscription has completed
        boolean committable = !buffer.isStale(entry) && (entry.committable || !resubscribing.test(message.channel()));
        if (!committable) {
            log.debug("Message on {} was received before the channel was resubscribed to, its position won't be committed", message.channel());
        }
        return new ReceivedMessage(message, replayMarker, committable);
    }

    private static @Nullable ReplayMarker extractReplayMarker(StreamingMessage message) {
        try {
            return ReplayMarkers.extract(message);
        } catch (ReplayExtractionException e) {
            log.warn("Failed to extract the replay marker of a message on {}, its position won't be committed: {}", message.channel(), e.getMessage());
            return null;
        }
    }

    /**
     * Messages that are already buffered become stale, their positions are no longer committed.
     */
    public void startNewEpoch() {
        buffer.startNewEpoch();
    }

    /**
     * Throw {@code error} from the next call to {@link #receive()}. Subsequent calls continue to deliver messages.
     */
    public void reportError(RuntimeException error) {
        buffer.reportError(error);
    }

    /**
     * Throw {@code failure} from every subsequent call to {@link #receive()}.
     */
    public void fail(RuntimeException failure) {
        buffer.fail(failure);
    }

    public void close() {
        buffer.close();
    }

    public int pendingCount() {
        return buffer.size();
    }

    public boolean hasPendingMessages() {
        return pendingCount() > 0;
    }
}
