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

import org.durastream.client.internal.ExecutorShutdown;
import org.durastream.replay.ReplayOption;
import org.durastream.replay.ReplayPolicy;
import org.durastream.streaming.api.StreamingTransport;
import org.durastream.streaming.api.exception.ClientInvalidOperationException;
import org.durastream.streaming.api.exception.ReplayException;
import org.durastream.streaming.api.exception.ServerErrorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;
import static org.durastream.client.SubscriptionState.*;

/**
 * Keeps track of the channels that the client wants to be subscribed to and subscribes to them on the transport,
 * using the replay position resolved by the {@link ReplayPolicy}.
 * <p>
 * A channel moves from {@code UNSUBSCRIBED} to {@code SUBSCRIBING} to {@code SUBSCRIBED} and back through {@code UNSUBSCRIBING}.
 * If the server rejects the replay position of a subscribe request and a replay fallback is configured, the request is
 * retried exactly once with the fallback. After the transport has reconnected, {@link #resubscribeAll()} subscribes to every
 * channel again, in the order they were first subscribed to, so that a reconnect resumes from the latest stored position
 * in the same way as a first subscribe.
 * </p>
 */
public class SubscriptionManager {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionManager.class);

    private final StreamingTransport transport;
    private final ReplayPolicy replayPolicy;
    private final Consumer<RuntimeException> resubscriptionErrorListener;
    private final ExecutorService resubscriber;
    private final ConcurrentMap<String, SubscriptionState> states = new ConcurrentHashMap<>();
    // Guarded by itself. Insertion order is the order channels are resubscribed in.
    private final Set<String> desiredChannels = new LinkedHashSet<>();
    private final Set<String> resubscribingChannels = ConcurrentHashMap.newKeySet();
    // Guarded by desiredChannels. Maps a channel to the attempt number of its in-flight first subscribe request.
    private final Map<String, Long> inFlightSubscribes = new HashMap<>();
    private long attemptSequence;
    // Guarded by desiredChannels. Incremented every time the transport establishes a new session.
    private long sessionGeneration;

    private volatile boolean closed;

    /**
     * @param transport                   The transport to subscribe with
     * @param replayPolicy                Resolves the replay position of each subscribe request
     * @param resubscriptionErrorListener Receives errors of resubscriptions that failed after a reconnect
     */
    public SubscriptionManager(StreamingTransport transport, ReplayPolicy replayPolicy, Consumer<RuntimeException> resubscriptionErrorListener) {
        requireNonNull(transport, StreamingTransport.class.getSimpleName() + " cannot be null");
        requireNonNull(replayPolicy, ReplayPolicy.class.getSimpleName() + " cannot be null");
        requireNonNull(resubscriptionErrorListener, "resubscriptionErrorListener cannot be null");
        this.transport = transport;
        this.replayPolicy = replayPolicy;
        this.resubscriptionErrorListener = resubscriptionErrorListener;
        this.resubscriber = Executors.newSingleThreadExecutor(ExecutorShutdown.daemonThreadFactory("durastream-resubscriber"));
    }

    /**
     * Subscribe to {@code channel}. Does nothing if the channel is already subscribed or being subscribed to.
     * <p>
     * If the transport reconnects while the subscribe request is in flight, the channel is resubscribed to on the new session.
     * If the channel is unsubscribed from while the request is in flight, the subscription is undone once the server has acknowledged it.
     * </p>
     *
     * @throws ReplayException      If the server rejected the replay position and no fallback is configured, or the fallback was rejected as well
     * @throws ServerErrorException If the server rejected the subscription for another reason
     */
    public void subscribe(String channel) {
        requireNonNull(channel, "channel cannot be null");
        ensureNotClosed();

        final long attempt;
        final long generation;
        synchronized (desiredChannels) {
            if (!beginSubscribing(channel)) {
                log.debug("Already subscribed or subscribing to {}, ignoring subscribe request", channel);
                return;
            }
            attempt = ++attemptSequence;
            inFlightSubscribes.put(channel, attempt);
            generation = sessionGeneration;
        }

        try {
            subscribeWithFallback(channel);
        } catch (RuntimeException e) {
            synchronized (desiredChannels) {
                if (inFlightSubscribes.remove(channel, attempt)) {
                    states.remove(channel, SUBSCRIBING);
                }
            }
            throw e;
        }

        final boolean undo;
        synchronized (desiredChannels) {
            if (inFlightSubscribes.remove(channel, attempt)) {
                undo = false;
                desiredChannels.add(channel);
                if (generation == sessionGeneration) {
                    states.put(channel, SUBSCRIBED);
                    log.info("Subscribed to {}", channel);
                } else if (!closed) {
                    log.info("Transport reconnected while subscribing to {}, subscribing again on the new session", channel);
                    resubscribingChannels.add(channel);
                    resubscriber.execute(() -> resubscribe(channel));
                }
            } else {
                // Unsubscribed while in flight. A newer subscribe request owns the channel if it's still known.
                undo = !inFlightSubscribes.containsKey(channel) && !desiredChannels.contains(channel);
            }
        }

        if (undo) {
            log.info("{} was unsubscribed from while the subscribe request was in flight, unsubscribing", channel);
            transport.unsubscribe(channel);
        }
    }

    /**
     * Unsubscribe from {@code channel}. Unsubscribing from a channel that isn't subscribed to is not an error.
     * The replay marker of the channel is kept, so subscribing again resumes from where the subscription left off.
     */
    public void unsubscribe(String channel) {
        requireNonNull(channel, "channel cannot be null");
        ensureNotClosed();

        final SubscriptionState previousState;
        final boolean subscribeInFlight;
        synchronized (desiredChannels) {
            desiredChannels.remove(channel);
            previousState = states.remove(channel);
            subscribeInFlight = inFlightSubscribes.remove(channel) != null;
        }

        if (subscribeInFlight) {
            log.debug("Subscribe request to {} is in flight, the subscription is undone once it completes", channel);
            return;
        } else if (previousState != SUBSCRIBED && previousState != SUBSCRIBING) {
            log.debug("Not subscribed to {}, ignoring unsubscribe request", channel);
            return;
        }

        states.putIfAbsent(channel, UNSUBSCRIBING);
        try {
            transport.unsubscribe(channel);
            log.info("Unsubscribed from {}", channel);
        } finally {
            states.remove(channel, UNSUBSCRIBING);
        }
    }

    /**
     * Subscribe to all desired channels again, typically after the transport has established a new session.
     * The channels are marked as {@code SUBSCRIBING} before this method returns and are then resubscribed in the background.
     * Channels whose first subscribe request is still in flight are resubscribed once that request completes.
     */
    public void resubscribeAll() {
        if (closed) {
            return;
        }

        final List<String> channels;
        synchronized (desiredChannels) {
            sessionGeneration++;
            channels = new ArrayList<>(desiredChannels);
            for (String channel : channels) {
                states.put(channel, SUBSCRIBING);
                resubscribingChannels.add(channel);
            }
        }

        if (channels.isEmpty()) {
            return;
        }
        log.info("Resubscribing to {}", channels);
        resubscriber.execute(() -> channels.forEach(this::resubscribe));
    }

    private void resubscribe(String channel) {
        boolean undo = false;
        try {
            synchronized (desiredChannels) {
                if (closed || !desiredChannels.contains(channel)) {
                    return;
                }
            }

            subscribeWithFallback(channel);
            // Messages that arrive from now on belong to the new subscription
            resubscribingChannels.remove(channel);

            synchronized (desiredChannels) {
                if (states.replace(channel, SUBSCRIBING, SUBSCRIBED)) {
                    log.info("Resubscribed to {}", channel);
                } else {
                    undo = !closed && !desiredChannels.contains(channel) && !inFlightSubscribes.containsKey(channel);
                }
            }
        } catch (RuntimeException e) {
            synchronized (desiredChannels) {
                desiredChannels.remove(channel);
                states.remove(channel, SUBSCRIBING);
            }
            if (!closed) {
                log.error("Failed to resubscribe to {}, the channel is no longer subscribed to", channel, e);
                resubscriptionErrorListener.accept(e);
            }
        } finally {
            resubscribingChannels.remove(channel);
        }

        if (undo) {
            try {
                transport.unsubscribe(channel);
                log.info("{} was unsubscribed from while it was being resubscribed to, unsubscribed again", channel);
            } catch (RuntimeException e) {
                log.warn("Failed to unsubscribe from {} after it was unsubscribed from during resubscription", channel, e);
            }
        }
    }

    private boolean beginSubscribing(String channel) {
        boolean[] began = new boolean[1];
        states.compute(channel, (__, state) -> {
            if (state == SUBSCRIBED || state == SUBSCRIBING) {
                return state;
            }
            began[0] = true;
            return SUBSCRIBING;
        });
        return began[0];
    }

    private void subscribeWithFallback(String channel) {
        // Resolved on every attempt since the stored marker may have advanced since the last subscribe
        ReplayOption replayOption = replayPolicy.resolveReplayOption(channel);
        log.debug("Subscribing to {} with replay option {}", channel, replayOption);
        try {
            transport.subscribe(channel, replayOption.value());
        } catch (ServerErrorException e) {
            if (!e.isReplayRejection()) {
                throw e;
            }

            Optional<ReplayOption> replayFallback = replayPolicy.resolveFallback(channel);
            if (replayFallback.isEmpty()) {
                throw new ReplayException("Server rejected replay option " + replayOption + " when subscribing to " + channel + " and no replay fallback is configured", e);
            }

            ReplayOption fallback = replayFallback.get();
            log.warn("Server rejected replay option {} when subscribing to {} ({}), retrying with replay fallback {}", replayOption, channel, e.errorMessage(), fallback);
            try {
                transport.subscribe(channel, fallback.value());
            } catch (ServerErrorException fallbackError) {
                throw new ReplayException("Server rejected replay fallback " + fallback + " when subscribing to " + channel, fallbackError);
            }
        }
    }

    public SubscriptionState state(String channel) {
        return states.getOrDefault(channel, UNSUBSCRIBED);
    }

    /**
     * @return The channels that are subscribed to, in the order they were subscribed to
     */
    public Set<String> subscriptions() {
        synchronized (desiredChannels) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(desiredChannels));
        }
    }

    /**
     * @return {@code true} if {@code channel} is being resubscribed to after a reconnect
     */
    public boolean isResubscribing(String channel) {
        return resubscribingChannels.contains(channel);
    }

    /**
     * Stop resubscribing. In-flight subscribe requests are failed by closing the transport.
     */
    public void close() {
        closed = true;
        ExecutorShutdown.shutdownSafely(resubscriber, 1, TimeUnit.SECONDS);
    }

    private void ensureNotClosed() {
        if (closed) {
            throw new ClientInvalidOperationException("Client is closed");
        }
    }
}
