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
import org.durastream.replay.ReplayPolicy;
import org.durastream.streaming.api.ConnectionState;
import org.durastream.streaming.api.StreamingMessage;
import org.durastream.streaming.api.StreamingTransport;
import org.durastream.streaming.api.StreamingTransportFactory;
import org.durastream.streaming.api.TransportListener;
import org.durastream.streaming.api.auth.CredentialProvider;
import org.durastream.streaming.api.auth.Credentials;
import org.durastream.streaming.api.exception.AuthenticationException;
import org.durastream.streaming.api.exception.ClientInvalidOperationException;
import org.durastream.streaming.api.exception.TransportConnectionClosedException;
import org.durastream.streaming.api.exception.TransportTimeoutException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.PreDestroy;
import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * A client that subscribes to channels of a streaming server and remembers, per channel, the position of the last message
 * that was processed, so that a reconnecting or restarted client resumes where it left off.
 *
 * <pre>
 * try (StreamingClient client = new StreamingClient(credentialProvider, transportFactory, StreamingClientConfig.withConfig().replay(storage))) {
 *     client.open();
 *     client.subscribe("/topic/InvoiceStatementUpdates");
 *     for (ReceivedMessage message : client) {
 *         handle(message);
 *     }
 * }
 * </pre>
 * <p>
 * Messages are received by the transport on its own thread and buffered until {@link #receive()} is called. If the buffer
 * is full, the transport is blocked until the consumer catches up. The client can be opened again after it has been closed,
 * subscriptions then have to be made again.
 * </p>
 */
public class StreamingClient implements AutoCloseable, Iterable<ReceivedMessage> {
    private static final Logger log = LoggerFactory.getLogger(StreamingClient.class);
    private static final String COMETD_PATH = "cometd";

    private final CredentialProvider credentialProvider;
    private final StreamingTransportFactory transportFactory;
    private final StreamingClientConfig config;
    private final ReplayPolicy replayPolicy;
    private final ReplayCommitter replayCommitter;

    private volatile @Nullable Session session;

    public StreamingClient(CredentialProvider credentialProvider, StreamingTransportFactory transportFactory) {
        this(credentialProvider, transportFactory, StreamingClientConfig.withConfig());
    }

    public StreamingClient(CredentialProvider credentialProvider, StreamingTransportFactory transportFactory, StreamingClientConfig config) {
        requireNonNull(credentialProvider, CredentialProvider.class.getSimpleName() + " cannot be null");
        requireNonNull(transportFactory, StreamingTransportFactory.class.getSimpleName() + " cannot be null");
        requireNonNull(config, StreamingClientConfig.class.getSimpleName() + " cannot be null");
        this.credentialProvider = credentialProvider;
        this.transportFactory = transportFactory;
        this.config = config;
        this.replayPolicy = new ReplayPolicy(config.replayStorage, config.replayFallback);
        this.replayCommitter = new ReplayCommitter(config.replayStorage, config.replayStoragePolicy);
    }

    /**
     * Authenticate and connect to the server.
     *
     * @throws AuthenticationException         If the credentials couldn't be obtained
     * @throws ClientInvalidOperationException If the client is already open
     */
    public synchronized void open() {
        Session current = session;
        if (current != null && !current.isClosed()) {
            throw new ClientInvalidOperationException("Client is already open");
        }

        Credentials credentials = authenticate();
        URI endpoint = streamingEndpoint(credentials.instanceUrl(), config.apiVersion);
        StreamingTransport transport = transportFactory.create(endpoint, credentials, config.jsonCodec);
        Session newSession = new Session(transport);
        transport.setListener(newSession);
        try {
            transport.connect(config.connectionTimeout);
        } catch (RuntimeException e) {
            newSession.close(null);
            throw e;
        }
        session = newSession;
        log.info("Connected to {}", endpoint);
    }

    private Credentials authenticate() {
        try {
            return requireNonNull(credentialProvider.authenticate(), "Credentials cannot be null");
        } catch (AuthenticationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AuthenticationException("Failed to authenticate: " + e.getMessage(), e);
        }
    }

    static URI streamingEndpoint(String instanceUrl, String apiVersion) {
        String baseUrl = instanceUrl.endsWith("/") ? instanceUrl.substring(0, instanceUrl.length() - 1) : instanceUrl;
        return URI.create(baseUrl + "/" + COMETD_PATH + "/" + apiVersion);
    }

    /**
     * Close the client. Blocked calls to {@link #receive()} are woken up, buffered messages are discarded.
     * Closing a client that is already closed does nothing.
     */
    @PreDestroy
    @Override
    public void close() {
        Session current = session;
        if (current != null) {
            current.close(null);
        }
    }

    public boolean isClosed() {
        Session current = session;
        return current == null || current.isClosed();
    }

    /**
     * Subscribe to {@code channel}, resuming from the stored replay marker of the channel if there is one.
     * Blocks until the server has acknowledged the subscription.
     */
    public void subscribe(String channel) {
        openSession().subscriptionManager.subscribe(channel);
    }

    public void unsubscribe(String channel) {
        openSession().subscriptionManager.unsubscribe(channel);
    }

    public void publish(String channel, Map<String, Object> data) {
        requireNonNull(channel, "channel cannot be null");
        requireNonNull(data, "data cannot be null");
        openSession().transport.publish(channel, data);
    }

    /**
     * Wait for the next message. Under {@link org.durastream.replay.ReplayStoragePolicy#IMMEDIATE} the position of the message is stored before it's returned.
     *
     * @throws ClientInvalidOperationException If the client is closed
     * @throws org.durastream.streaming.api.exception.TransportTimeoutException If the connection was lost and didn't come back in time
     * @throws TransportConnectionClosedException If the server closed the session
     * @throws org.durastream.streaming.api.exception.ReplayMarkerStorageException If the position couldn't be stored, the next call returns the same message again
     */
    public ReceivedMessage receive() {
        Session current = session;
        if (current == null) {
            throw new ClientInvalidOperationException("Client is not open");
        }
        return current.deliveryPipeline.receive();
    }

    /**
     * Iterate over received messages. The iterator blocks while waiting for messages and is exhausted when the client is closed.
     */
    @Override
    public Iterator<ReceivedMessage> iterator() {
        return new Iterator<>() {
            private @Nullable ReceivedMessage next;

            @Override
            public boolean hasNext() {
                if (next != null) {
                    return true;
                }
                Session current = session;
                if (current == null) {
                    return false;
                }
                try {
                    next = current.deliveryPipeline.receive();
                    return true;
                } catch (ClientInvalidOperationException e) {
                    log.debug("Client is closed, no more messages to iterate over");
                    return false;
                }
            }

            @Override
            public ReceivedMessage next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                ReceivedMessage message = next;
                next = null;
                return message;
            }
        };
    }

    /**
     * Store the position of {@code message}. Only needed under {@link org.durastream.replay.ReplayStoragePolicy#MANUAL}.
     *
     * @return {@code true} if the position was stored
     */
    public boolean commit(ReceivedMessage message) {
        return replayCommitter.commit(message);
    }

    /**
     * Process {@code message} with {@code action} and store its position only if the action completes normally.
     */
    public void processThenCommit(ReceivedMessage message, Consumer<ReceivedMessage> action) {
        replayCommitter.processThenCommit(message, action);
    }

    /**
     * Delete the stored replay marker of {@code channel}, for example when it has fallen out of the retention window.
     */
    public void discardReplayMarker(String channel) {
        replayCommitter.discard(channel);
    }

    public Set<String> subscriptions() {
        Session current = session;
        return current == null || current.isClosed() ? Collections.emptySet() : current.subscriptionManager.subscriptions();
    }

    public SubscriptionState subscriptionState(String channel) {
        requireNonNull(channel, "channel cannot be null");
        Session current = session;
        return current == null || current.isClosed() ? SubscriptionState.UNSUBSCRIBED : current.subscriptionManager.state(channel);
    }

    public int pendingCount() {
        Session current = session;
        return current == null ? 0 : current.deliveryPipeline.pendingCount();
    }

    public boolean hasPendingMessages() {
        return pendingCount() > 0;
    }

    private Session openSession() {
        Session current = session;
        if (current == null || current.isClosed()) {
            throw new ClientInvalidOperationException("Client is not open");
        }
        return current;
    }

    /**
     * The transport and the subscriptions of one call to {@link #open()}.
     */
    private final class Session implements TransportListener {
        private final StreamingTransport transport;
        private final SubscriptionManager subscriptionManager;
        private final DeliveryPipeline deliveryPipeline;
        private final ScheduledExecutorService connectionWatchdog;

        // Guarded by this
        private @Nullable ScheduledFuture<?> reconnectTimeout;
        private boolean connectionLost;
        private volatile boolean closed;

        private Session(StreamingTransport transport) {
            this.transport = transport;
            this.subscriptionManager = new SubscriptionManager(transport, replayPolicy, this::onResubscriptionFailed);
            this.deliveryPipeline = new DeliveryPipeline(config.maxPendingCount, replayCommitter, subscriptionManager::isResubscribing);
            this.connectionWatchdog = Executors.newSingleThreadScheduledExecutor(ExecutorShutdown.daemonThreadFactory("durastream-connection-watchdog"));
        }

        @Override
        public void onMessage(StreamingMessage message) {
            if (!closed) {
                deliveryPipeline.accept(message);
            }
        }

        @Override
        public void onConnectionStateChanged(ConnectionState connectionState) {
            log.debug("Connection state changed to {}", connectionState);
            switch (connectionState) {
                case CONNECTED:
                    onConnected();
                    break;
                case DISCONNECTED:
                case RECONNECTING:
                    onConnectionLost();
                    break;
                case CLOSED:
                    log.warn("The server closed the session, closing the client");
                    close(new TransportConnectionClosedException("The server closed the session"));
                    break;
                default:
                    throw new IllegalStateException("Unexpected connection state: " + connectionState);
            }
        }

        private void onConnected() {
            synchronized (this) {
                if (reconnectTimeout != null) {
                    reconnectTimeout.cancel(false);
                    reconnectTimeout = null;
                }
                if (!connectionLost || closed) {
                    return;
                }
                connectionLost = false;
            }
            log.info("Reconnected to the server");
            deliveryPipeline.startNewEpoch();
            subscriptionManager.resubscribeAll();
        }

        private synchronized void onConnectionLost() {
            if (closed) {
                return;
            }
            if (!connectionLost) {
                log.warn("Lost the connection to the server");
            }
            connectionLost = true;
            Duration connectionTimeout = config.connectionTimeout;
            if (connectionTimeout != null && reconnectTimeout == null) {
                reconnectTimeout = connectionWatchdog.schedule(() -> onReconnectTimeout(connectionTimeout), connectionTimeout.toMillis(), TimeUnit.MILLISECONDS);
            }
        }

        private void onReconnectTimeout(Duration connectionTimeout) {
            synchronized (this) {
                if (!connectionLost || closed) {
                    return;
                }
            }
            log.error("The connection to the server wasn't restored within {}, closing the client", connectionTimeout);
            close(new TransportTimeoutException("The connection to the server wasn't restored within " + connectionTimeout));
        }

        private void onResubscriptionFailed(RuntimeException error) {
            if (!closed) {
                deliveryPipeline.reportError(error);
            }
        }

        private boolean isClosed() {
            return closed;
        }

        private void close(@Nullable RuntimeException failure) {
            synchronized (this) {
                if (closed) {
                    return;
                }
                closed = true;
                if (reconnectTimeout != null) {
                    reconnectTimeout.cancel(false);
                    reconnectTimeout = null;
                }
            }

            if (failure != null) {
                deliveryPipeline.fail(failure);
            }
            try {
                transport.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close the transport", e);
            }
            subscriptionManager.close();
            deliveryPipeline.close();
            connectionWatchdog.shutdownNow();
            log.info("Closed the client");
        }
    }
}
