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
import org.durastream.replay.ReplayOption;
import org.durastream.replay.ReplayStoragePolicy;
import org.durastream.replay.storage.MappingReplayMarkerStorage;
import org.durastream.streaming.api.StreamingTransportFactory;
import org.durastream.streaming.api.auth.CredentialProvider;
import org.durastream.streaming.api.auth.Credentials;
import org.durastream.streaming.api.exception.AuthenticationException;
import org.durastream.streaming.api.exception.ClientInvalidOperationException;
import org.durastream.streaming.api.exception.ReplayException;
import org.durastream.streaming.api.exception.ReplayMarkerStorageException;
import org.durastream.streaming.api.exception.ServerErrorException;
import org.durastream.streaming.api.exception.TransportConnectionClosedException;
import org.durastream.streaming.api.exception.TransportInvalidOperationException;
import org.durastream.streaming.api.exception.TransportTimeoutException;
import org.durastream.testsupport.InMemoryStreamingTransport;
import org.durastream.testsupport.InMemoryStreamingTransport.SubscribeRequest;
import org.durastream.testsupport.Messages;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.awaitility.Awaitility.await;
import static org.hamcrest.Matchers.hasSize;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class StreamingClientTest {
    private static final String CHANNEL = "/topic/Invoices";
    private static final String INSTANCE_URL = "https://example.my.salesforce.com";
    private static final OffsetDateTime CREATED_AT = OffsetDateTime.parse("2024-03-01T10:15:30Z");

    private final CredentialProvider credentialProvider = () -> new Credentials("00Dxx!token", INSTANCE_URL);
    private final List<URI> endpoints = new CopyOnWriteArrayList<>();
    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final MappingReplayMarkerStorage storage = new MappingReplayMarkerStorage();

    private volatile InMemoryStreamingTransport transport;
    private StreamingClient client;

    private final StreamingTransportFactory transportFactory = (endpoint, credentials, jsonCodec) -> {
        endpoints.add(endpoint);
        transport = new InMemoryStreamingTransport(jsonCodec);
        return transport;
    };

    @AfterEach
    void shutdown() {
        if (client != null) {
            client.close();
        }
        executor.shutdownNow();
    }

    @Nested
    class Lifecycle {

        @Test
        void open_connects_to_the_streaming_endpoint_of_the_instance() {
            // Given
            client = new StreamingClient(credentialProvider, transportFactory);

            // When
            client.open();

            // Then
            assertThat(endpoints).containsExactly(URI.create(INSTANCE_URL + "/cometd/42.0"));
            assertThat(transport.isConnected()).isTrue();
            assertThat(client.isClosed()).isFalse();
        }

        @Test
        void api_version_is_configurable() {
            // Given
            client = new StreamingClient(() -> new Credentials("token", INSTANCE_URL + "/"), transportFactory, StreamingClientConfig.withConfig().apiVersion("59.0"));

            // When
            client.open();

            // Then
            assertThat(endpoints).containsExactly(URI.create(INSTANCE_URL + "/cometd/59.0"));
        }

        @Test
        void authentication_failure_is_reported_as_authentication_exception() {
            // Given
            IllegalStateException failure = new IllegalStateException("token endpoint unavailable");
            client = new StreamingClient(() -> {
                throw failure;
            }, transportFactory);

            // When
            Throwable throwable = catchThrowable(client::open);

            // Then
            assertThat(throwable).isExactlyInstanceOf(AuthenticationException.class).hasCause(failure);
            assertThat(endpoints).isEmpty();
            assertThat(client.isClosed()).isTrue();
        }

        @Test
        void opening_an_open_client_is_not_allowed() {
            // Given
            client = new StreamingClient(credentialProvider, transportFactory);
            client.open();

            // When
            Throwable throwable = catchThrowable(client::open);

            // Then
            assertThat(throwable).isExactlyInstanceOf(ClientInvalidOperationException.class);
        }

        @Test
        void operations_require_an_open_client() {
            // Given
            client = new StreamingClient(credentialProvider, transportFactory);

            // Then
            assertThat(catchThrowable(() -> client.subscribe(CHANNEL))).isExactlyInstanceOf(ClientInvalidOperationException.class);
            assertThat(catchThrowable(() -> client.publish(CHANNEL, Map.of()))).isExactlyInstanceOf(ClientInvalidOperationException.class);
            assertThat(catchThrowable(client::receive)).isExactlyInstanceOf(ClientInvalidOperationException.class);
        }

        @Test
        void close_wakes_up_blocked_receive() {
            // Given
            client = new StreamingClient(credentialProvider, transportFactory);
            client.open();
            Future<ReceivedMessage> receive = executor.submit(client::receive);

            // When
            client.close();

            // Then
            assertThat(catchThrowable(() -> receive.get(1, SECONDS))).hasCauseExactlyInstanceOf(ClientInvalidOperationException.class);
            assertThat(transport.isClosed()).isTrue();
            assertThat(client.isClosed()).isTrue();
            assertThat(client.subscriptions()).isEmpty();
        }

        @Test
        void close_cancels_subscribe_waiting_for_acknowledgement() {
            // Given
            client = new StreamingClient(credentialProvider, transportFactory);
            client.open();
            transport.blockSubscribes();
            Future<?> subscribe = executor.submit(() -> client.subscribe(CHANNEL));
            await().atMost(2, SECONDS).until(() -> transport.subscribeRequests(CHANNEL), hasSize(1));

            // When
            client.close();

            // Then
            assertThat(catchThrowable(() -> subscribe.get(1, SECONDS))).hasCauseExactlyInstanceOf(TransportInvalidOperationException.class);
            assertThat(client.subscriptionState(CHANNEL)).isEqualTo(SubscriptionState.UNSUBSCRIBED);
            assertThat(client.subscriptions()).isEmpty();
        }

        @Test
        void iteration_ends_when_client_is_closed() throws Exception {
            // Given
            client = new StreamingClient(credentialProvider, transportFactory);
            client.open();
            client.subscribe(CHANNEL);
            transport.deliver(Messages.pushTopicEvent(CHANNEL, 1)).get(1, SECONDS);
            transport.deliver(Messages.pushTopicEvent(CHANNEL, 2)).get(1, SECONDS);
            List<Long> replayIds = new CopyOnWriteArrayList<>();

            // When
            for (ReceivedMessage message : client) {
                replayIds.add(message.replayMarker().orElseThrow().replayId());
                if (replayIds.size() == 2) {
                    client.close();
                }
            }

            // Then
            assertThat(replayIds).containsExactly(1L, 2L);
        }

        @Test
        void closed_client_can_be_opened_again_without_subscriptions() {
            // Given
            client = new StreamingClient(credentialProvider, transportFactory);
            client.open();
            client.subscribe(CHANNEL);
            client.close();

            // When
            client.open();

            // Then
            assertThat(endpoints).hasSize(2);
            assertThat(client.isClosed()).isFalse();
            assertThat(client.subscriptions()).isEmpty();
        }

        @Test
        void published_message_is_echoed_through_the_json_codec() throws Exception {
            // Given
            client = new StreamingClient(credentialProvider, transportFactory);
            client.open();
            client.subscribe("/u/notifications");

            // When
            client.publish("/u/notifications", Map.of("text", "hello"));

            // Then
            assertThat(transport.publishedJson()).containsExactly("{\"text\":\"hello\"}");
            ReceivedMessage receivedMessage = executor.submit(client::receive).get(1, SECONDS);
            assertThat(receivedMessage.data()).containsEntry("text", "hello");
            assertThat(receivedMessage.isCommittable()).isFalse();
        }
    }

    @Nested
    class Replay {

        @Test
        void subscribes_with_new_events_when_nothing_is_stored() {
            // Given
            client = new StreamingClient(credentialProvider, transportFactory, StreamingClientConfig.withConfig().replay(storage));
            client.open();

            // When
            client.subscribe(CHANNEL);

            // Then
            assertThat(transport.subscribeRequests()).containsExactly(new SubscribeRequest(CHANNEL, -1));
            assertThat(client.subscriptionState(CHANNEL)).isEqualTo(SubscriptionState.SUBSCRIBED);
            assertThat(client.subscriptions()).containsExactly(CHANNEL);
        }

        @Test
        void constant_replay_option_is_used_for_every_subscription() {
            // Given
            client = new StreamingClient(credentialProvider, transportFactory, StreamingClientConfig.withConfig().replay(ReplayOption.ALL_EVENTS));
            client.open();

            // When
            client.subscribe(CHANNEL);

            // Then
            assertThat(transport.subscribeRequests()).containsExactly(new SubscribeRequest(CHANNEL, -2));
        }

        @Test
        void subscribing_twice_sends_a_single_subscribe_request() {
            // Given
            client = new StreamingClient(credentialProvider, transportFactory, StreamingClientConfig.withConfig().replay(storage));
            client.open();

            // When
            client.subscribe(CHANNEL);
            client.subscribe(CHANNEL);

            // Then
            assertThat(transport.subscribeRequests()).hasSize(1);
        }

        @Test
        void reconnect_resumes_after_the_last_received_message() throws Exception {
            // Given
            client = new StreamingClient(credentialProvider, transportFactory, StreamingClientConfig.withConfig().replay(storage));
            client.open();
            client.subscribe(CHANNEL);
            for (long replayId = 1; replayId <= 10; replayId++) {
                transport.deliver(Messages.pushTopicEvent(CHANNEL, replayId)).get(1, SECONDS);
                client.receive();
            }

            // When
            transport.reconnect();

            // Then
            await().atMost(2, SECONDS).until(() -> transport.subscribeRequests(CHANNEL), hasSize(2));
            assertThat(transport.subscribeRequests(CHANNEL).get(1)).isEqualTo(new SubscribeRequest(CHANNEL, 10));
            assertThat(storage.read(CHANNEL).replayId()).isEqualTo(10);
        }

        @Test
        void unsubscribing_and_subscribing_again_resumes_from_stored_marker() throws Exception {
            // Given
            client = new StreamingClient(credentialProvider, transportFactory, StreamingClientConfig.withConfig().replay(storage));
            client.open();
            client.subscribe(CHANNEL);
            transport.deliver(Messages.pushTopicEvent(CHANNEL, 3)).get(1, SECONDS);
            client.receive();

            // When
            client.unsubscribe(CHANNEL);
            client.subscribe(CHANNEL);

            // Then
            assertThat(transport.subscribeRequests(CHANNEL)).containsExactly(new SubscribeRequest(CHANNEL, -1), new SubscribeRequest(CHANNEL, 3));
        }

        @Test
        void message_that_failed_processing_is_replayed_after_reconnect() throws Exception {
            // Given
            client = new StreamingClient(credentialProvider, transportFactory, StreamingClientConfig.withConfig().replay(storage).replayStoragePolicy(ReplayStoragePolicy.MANUAL));
            client.open();
            client.subscribe(CHANNEL);
            for (long replayId = 1; replayId <= 5; replayId++) {
                transport.deliver(Messages.pushTopicEvent(CHANNEL, replayId)).get(1, SECONDS);
            }
            for (int i = 0; i < 4; i++) {
                client.processThenCommit(client.receive(), message -> {
                });
            }

            // When
            Throwable throwable = catchThrowable(() -> client.processThenCommit(client.receive(), message -> {
                throw new IllegalStateException("processing failed");
            }));
            transport.reconnect();

            // Then
            assertThat(throwable).isExactlyInstanceOf(IllegalStateException.class);
            await().atMost(2, SECONDS).until(() -> transport.subscribeRequests(CHANNEL), hasSize(2));
            assertThat(transport.subscribeRequests(CHANNEL).get(1)).isEqualTo(new SubscribeRequest(CHANNEL, 4));
        }

        @Test
        void manual_commit_stores_the_marker() throws Exception {
            // Given
            client = new StreamingClient(credentialProvider, transportFactory, StreamingClientConfig.withConfig().replay(storage).replayStoragePolicy(ReplayStoragePolicy.MANUAL));
            client.open();
            client.subscribe(CHANNEL);
            transport.deliver(Messages.pushTopicEvent(CHANNEL, 6)).get(1, SECONDS);
            ReceivedMessage receivedMessage = client.receive();

            // When
            boolean committed = client.commit(receivedMessage);

            // Then
            assertThat(committed).isTrue();
            assertThat(storage.read(CHANNEL).replayId()).isEqualTo(6);
        }

        @Test
        void rejected_replay_id_falls_back_to_all_events() {
            // Given
            storage.save(CHANNEL, new ReplayMarker(CHANNEL, 5, CREATED_AT));
            client = new StreamingClient(credentialProvider, transportFactory, StreamingClientConfig.withConfig().replay(storage).replayFallback(ReplayOption.ALL_EVENTS));
            client.open();
            transport.retainFrom(CHANNEL, 100);

            // When
            client.subscribe(CHANNEL);

            // Then
            assertThat(transport.subscribeRequests(CHANNEL)).containsExactly(new SubscribeRequest(CHANNEL, 5), new SubscribeRequest(CHANNEL, -2));
            assertThat(client.subscriptionState(CHANNEL)).isEqualTo(SubscriptionState.SUBSCRIBED);
        }

        @Test
        void rejected_replay_id_without_fallback_fails_subscribe() {
            // Given
            storage.save(CHANNEL, new ReplayMarker(CHANNEL, 5, CREATED_AT));
            client = new StreamingClient(credentialProvider, transportFactory, StreamingClientConfig.withConfig().replay(storage));
            client.open();
            transport.retainFrom(CHANNEL, 100);

            // When
            Throwable throwable = catchThrowable(() -> client.subscribe(CHANNEL));

            // Then
            assertThat(throwable).isExactlyInstanceOf(ReplayException.class).hasCauseExactlyInstanceOf(ServerErrorException.class);
            assertThat(client.subscriptionState(CHANNEL)).isEqualTo(SubscriptionState.UNSUBSCRIBED);
        }

        @Test
        void discarded_replay_marker_is_no_longer_used() {
            // Given
            storage.save(CHANNEL, new ReplayMarker(CHANNEL, 5, CREATED_AT));
            client = new StreamingClient(credentialProvider, transportFactory, StreamingClientConfig.withConfig().replay(storage));
            client.open();

            // When
            client.discardReplayMarker(CHANNEL);
            client.subscribe(CHANNEL);

            // Then
            assertThat(storage.read(CHANNEL)).isNull();
            assertThat(transport.subscribeRequests(CHANNEL)).containsExactly(new SubscribeRequest(CHANNEL, -1));
        }

        @Test
        void message_buffered_before_reconnect_is_not_committed() throws Exception {
            // Given
            client = new StreamingClient(credentialProvider, transportFactory, StreamingClientConfig.withConfig().replay(storage));
            client.open();
            client.subscribe(CHANNEL);
            transport.deliver(Messages.pushTopicEvent(CHANNEL, 5)).get(1, SECONDS);
            transport.reconnect();
            await().atMost(2, SECONDS).until(() -> transport.subscribeRequests(CHANNEL), hasSize(2));

            // When
            ReceivedMessage receivedMessage = client.receive();

            // Then
            assertThat(receivedMessage.isCommittable()).isFalse();
            assertThat(storage.read(CHANNEL)).isNull();
        }
    }

    @Nested
    class Failures {

        @Test
        void back_pressure_blocks_the_transport_when_max_pending_count_is_reached() throws Exception {
            // Given
            client = new StreamingClient(credentialProvider, transportFactory, StreamingClientConfig.withConfig().maxPendingCount(2));
            client.open();
            client.subscribe(CHANNEL);
            transport.deliver(Messages.pushTopicEvent(CHANNEL, 1)).get(1, SECONDS);
            transport.deliver(Messages.pushTopicEvent(CHANNEL, 2)).get(1, SECONDS);

            // When
            Future<?> third = transport.deliver(Messages.pushTopicEvent(CHANNEL, 3));

            // Then
            await().during(200, MILLISECONDS).atMost(1, SECONDS).until(() -> !third.isDone());
            assertThat(client.pendingCount()).isEqualTo(2);
            assertThat(client.hasPendingMessages()).isTrue();
            client.receive();
            third.get(1, SECONDS);
            assertThat(client.pendingCount()).isEqualTo(2);
        }

        @Test
        void failed_immediate_commit_is_retried_by_the_next_receive() throws Exception {
            // Given
            AtomicBoolean failNextSave = new AtomicBoolean(true);
            Map<String, ReplayMarker> failingMap = new ConcurrentHashMap<>() {
                @Override
                public ReplayMarker put(String key, ReplayMarker value) {
                    if (failNextSave.getAndSet(false)) {
                        throw new IllegalStateException("storage unavailable");
                    }
                    return super.put(key, value);
                }
            };
            client = new StreamingClient(credentialProvider, transportFactory, StreamingClientConfig.withConfig().replay(failingMap));
            client.open();
            client.subscribe(CHANNEL);
            transport.deliver(Messages.pushTopicEvent(CHANNEL, 9)).get(1, SECONDS);

            // When
            Throwable throwable = catchThrowable(client::receive);
            ReceivedMessage receivedMessage = client.receive();

            // Then
            assertThat(throwable).isExactlyInstanceOf(ReplayMarkerStorageException.class);
            assertThat(receivedMessage.replayMarker().orElseThrow().replayId()).isEqualTo(9);
            assertThat(failingMap.get(CHANNEL).replayId()).isEqualTo(9);
        }

        @Test
        void server_closing_the_session_is_reported_by_receive() {
            // Given
            client = new StreamingClient(credentialProvider, transportFactory);
            client.open();
            client.subscribe(CHANNEL);

            // When
            transport.closeByServer();

            // Then
            assertThat(client.isClosed()).isTrue();
            assertThat(catchThrowable(client::receive)).isExactlyInstanceOf(TransportConnectionClosedException.class);
        }

        @Test
        void connection_that_is_not_restored_in_time_closes_the_client() {
            // Given
            client = new StreamingClient(credentialProvider, transportFactory, StreamingClientConfig.withConfig().connectionTimeout(Duration.ofMillis(200)));
            client.open();
            client.subscribe(CHANNEL);

            // When
            transport.loseConnection();

            // Then
            await().atMost(2, SECONDS).until(client::isClosed);
            assertThat(catchThrowable(client::receive)).isExactlyInstanceOf(TransportTimeoutException.class);
            await().atMost(2, SECONDS).until(transport::isClosed);
        }

        @Test
        void connection_restored_in_time_keeps_the_client_open() {
            // Given
            client = new StreamingClient(credentialProvider, transportFactory, StreamingClientConfig.withConfig().connectionTimeout(Duration.ofMillis(200)));
            client.open();
            client.subscribe(CHANNEL);

            // When
            transport.loseConnection();
            transport.restoreConnection();

            // Then
            await().during(400, MILLISECONDS).atMost(1, SECONDS).until(() -> !client.isClosed());
        }

        @Test
        void failed_resubscription_is_reported_by_receive() {
            // Given
            client = new StreamingClient(credentialProvider, transportFactory);
            client.open();
            client.subscribe(CHANNEL);
            ServerErrorException error = new ServerErrorException("Subscribe failed", "403::Access denied");
            transport.failNextSubscribe(CHANNEL, error);

            // When
            transport.reconnect();

            // Then
            assertThat(catchThrowable(client::receive)).isSameAs(error);
            assertThat(client.subscriptions()).isEmpty();
            assertThat(client.isClosed()).isFalse();
        }
    }
}
