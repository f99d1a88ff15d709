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

package org.durastream.testsupport;

import org.durastream.streaming.api.ConnectionState;
import org.durastream.streaming.api.StreamingMessage;
import org.durastream.streaming.api.StreamingTransport;
import org.durastream.streaming.api.TransportListener;
import org.durastream.streaming.api.exception.ServerErrorException;
import org.durastream.streaming.api.exception.TransportException;
import org.durastream.streaming.api.exception.TransportInvalidOperationException;
import org.durastream.streaming.api.json.JsonCodec;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * An in-memory {@link StreamingTransport} that plays the role of the streaming server in tests.
 * <p>
 * Messages are delivered to the listener from a single background thread, just like a real transport, so that a listener
 * that blocks (back-pressure) blocks delivery of subsequent messages. Connection state changes are reported on the calling thread.
 * The transport records every subscribe request and can simulate a retention window, rejected subscriptions, slow subscribe
 * acknowledgements, connection loss and the server closing the session.
 * </p>
 */
public class InMemoryStreamingTransport implements StreamingTransport {
    private static final long NEW_EVENTS = -1;
    private static final long ALL_EVENTS = -2;

    private final JsonCodec jsonCodec;
    private final ExecutorService deliveryExecutor;
    private final List<SubscribeRequest> subscribeRequests = new CopyOnWriteArrayList<>();
    private final List<String> unsubscribeRequests = new CopyOnWriteArrayList<>();
    private final List<String> publishedJson = new CopyOnWriteArrayList<>();
    private final Set<String> subscribedChannels = ConcurrentHashMap.newKeySet();
    private final ConcurrentMap<String, Long> oldestRetainedReplayIds = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Queue<RuntimeException>> subscribeFailures = new ConcurrentHashMap<>();

    private volatile @Nullable TransportListener listener;
    private volatile @Nullable RuntimeException connectFailure;
    private volatile @Nullable CountDownLatch subscribeGate;
    private volatile boolean connected;
    private volatile boolean closed;

    public InMemoryStreamingTransport(JsonCodec jsonCodec) {
        requireNonNull(jsonCodec, JsonCodec.class.getSimpleName() + " cannot be null");
        this.jsonCodec = jsonCodec;
        this.deliveryExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "in-memory-transport-delivery");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void setListener(TransportListener listener) {
        requireNonNull(listener, TransportListener.class.getSimpleName() + " cannot be null");
        this.listener = listener;
    }

    @Override
    public void connect(@Nullable Duration timeout) {
        ensureNotClosed();
        RuntimeException failure = connectFailure;
        if (failure != null) {
            throw failure;
        }
        connected = true;
        notifyState(ConnectionState.CONNECTED);
    }

    @Override
    public void subscribe(String channel, long replay) {
        ensureConnected();
        subscribeRequests.add(new SubscribeRequest(channel, replay));
        awaitSubscribeGate();

        Queue<RuntimeException> failures = subscribeFailures.get(channel);
        RuntimeException failure = failures == null ? null : failures.poll();
        if (failure != null) {
            throw failure;
        }

        Long oldestRetainedReplayId = oldestRetainedReplayIds.get(channel);
        if (oldestRetainedReplayId != null && replay != NEW_EVENTS && replay != ALL_EVENTS && replay < oldestRetainedReplayId - 1) {
            throw invalidReplayId(channel, replay);
        }
        subscribedChannels.add(channel);
    }

    @Override
    public void unsubscribe(String channel) {
        ensureConnected();
        unsubscribeRequests.add(channel);
        subscribedChannels.remove(channel);
    }

    /**
     * Publishing to a channel that is subscribed to echoes the message back, after a round-trip through the {@link JsonCodec}.
     */
    @Override
    public void publish(String channel, Map<String, Object> data) {
        ensureConnected();
        String json = jsonCodec.encode(data);
        publishedJson.add(json);
        if (subscribedChannels.contains(channel)) {
            deliver(new StreamingMessage(channel, jsonCodec.decode(json)));
        }
    }

    @Override
    public void close() {
        closed = true;
        connected = false;
        subscribedChannels.clear();
        releaseSubscribes();
        deliveryExecutor.shutdownNow();
    }

    // Simulation

    /**
     * Deliver a message to the listener from the delivery thread.
     *
     * @return A future that completes once the listener has accepted the message
     */
    public Future<?> deliver(StreamingMessage message) {
        requireNonNull(message, StreamingMessage.class.getSimpleName() + " cannot be null");
        return deliveryExecutor.submit(() -> {
            TransportListener currentListener = listener;
            if (currentListener != null) {
                currentListener.onMessage(message);
            }
        });
    }

    /**
     * Only events with a replay id greater than or equal to {@code oldestReplayId} are retained for {@code channel}.
     * Subscribing with a replay id before that position is rejected like the server does.
     */
    public InMemoryStreamingTransport retainFrom(String channel, long oldestReplayId) {
        oldestRetainedReplayIds.put(channel, oldestReplayId);
        return this;
    }

    /**
     * Make the next subscribe request for {@code channel} fail with {@code failure}.
     */
    public InMemoryStreamingTransport failNextSubscribe(String channel, RuntimeException failure) {
        subscribeFailures.computeIfAbsent(channel, __ -> new ConcurrentLinkedQueue<>()).add(failure);
        return this;
    }

    /**
     * Subscribe requests are recorded but not acknowledged until {@link #releaseSubscribes()} or {@link #close()} is called.
     * Requests that are waiting when the transport is closed fail with a {@link TransportInvalidOperationException}.
     */
    public InMemoryStreamingTransport blockSubscribes() {
        subscribeGate = new CountDownLatch(1);
        return this;
    }

    public void releaseSubscribes() {
        CountDownLatch gate = subscribeGate;
        subscribeGate = null;
        if (gate != null) {
            gate.countDown();
        }
    }

    public InMemoryStreamingTransport failConnect(@Nullable RuntimeException failure) {
        this.connectFailure = failure;
        return this;
    }

    /**
     * The connection drops, the server forgets about all subscriptions and the transport starts reconnecting.
     */
    public void loseConnection() {
        connected = false;
        subscribedChannels.clear();
        notifyState(ConnectionState.DISCONNECTED);
        notifyState(ConnectionState.RECONNECTING);
    }

    /**
     * The transport has re-established the connection with a new session.
     */
    public void restoreConnection() {
        ensureNotClosed();
        connected = true;
        notifyState(ConnectionState.CONNECTED);
    }

    public void reconnect() {
        loseConnection();
        restoreConnection();
    }

    public void closeByServer() {
        connected = false;
        subscribedChannels.clear();
        notifyState(ConnectionState.CLOSED);
    }

    // Inspection

    public List<SubscribeRequest> subscribeRequests() {
        return List.copyOf(subscribeRequests);
    }

    public List<SubscribeRequest> subscribeRequests(String channel) {
        return subscribeRequests.stream().filter(request -> request.channel().equals(channel)).collect(Collectors.toList());
    }

    public List<String> unsubscribeRequests() {
        return List.copyOf(unsubscribeRequests);
    }

    public List<String> publishedJson() {
        return List.copyOf(publishedJson);
    }

    public Set<String> subscribedChannels() {
        return Set.copyOf(subscribedChannels);
    }

    public boolean isConnected() {
        return connected;
    }

    public boolean isClosed() {
        return closed;
    }

    public static ServerErrorException invalidReplayId(String channel, long replayId) {
        return new ServerErrorException("Subscribe request to " + channel + " failed",
                "400::The replayId {" + replayId + "} you provided was invalid.  Please provide a valid ID, -2 to replay all events, or -1 to replay only new events.");
    }

    private void notifyState(ConnectionState state) {
        TransportListener currentListener = listener;
        if (currentListener != null) {
            currentListener.onConnectionStateChanged(state);
        }
    }

    private void awaitSubscribeGate() {
        CountDownLatch gate = subscribeGate;
        if (gate == null) {
            return;
        }
        try {
            gate.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while waiting for the subscribe acknowledgement", e);
        }
        ensureConnected();
    }

    private void ensureNotClosed() {
        if (closed) {
            throw new TransportInvalidOperationException("Transport is closed");
        }
    }

    private void ensureConnected() {
        ensureNotClosed();
        if (!connected) {
            throw new TransportException("Transport is not connected");
        }
    }

    /**
     * A subscribe request as it was received by the server.
     *
     * @param channel The channel
     * @param replay  The value of the {@code replay} extension
     */
    public record SubscribeRequest(String channel, long replay) {
    }
}
