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
import org.durastream.replay.storage.MappingReplayMarkerStorage;
import org.durastream.streaming.api.exception.ReplayMarkerStorageException;
import org.durastream.testsupport.Messages;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.awaitility.Awaitility.await;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class DeliveryPipelineTest {
    private static final String CHANNEL = "/topic/Invoices";

    private final ExecutorService executor = Executors.newSingleThreadExecutor();
    private final MappingReplayMarkerStorage storage = new MappingReplayMarkerStorage();

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    @Test
    void immediate_policy_stores_marker_before_message_is_returned() {
        // Given
        DeliveryPipeline deliveryPipeline = newDeliveryPipeline(ReplayStoragePolicy.IMMEDIATE, 10);
        deliveryPipeline.accept(Messages.pushTopicEvent(CHANNEL, 4));

        // When
        ReceivedMessage receivedMessage = deliveryPipeline.receive();

        // Then
        assertThat(receivedMessage.replayMarker()).map(ReplayMarker::replayId).contains(4L);
        assertThat(storage.read(CHANNEL)).isEqualTo(receivedMessage.replayMarker().orElseThrow());
        assertThat(deliveryPipeline.hasPendingMessages()).isFalse();
    }

    @Test
    void manual_policy_leaves_storing_to_the_consumer() {
        // Given
        DeliveryPipeline deliveryPipeline = newDeliveryPipeline(ReplayStoragePolicy.MANUAL, 10);
        deliveryPipeline.accept(Messages.pushTopicEvent(CHANNEL, 4));

        // When
        ReceivedMessage receivedMessage = deliveryPipeline.receive();

        // Then
        assertThat(receivedMessage.isCommittable()).isTrue();
        assertThat(storage.read(CHANNEL)).isNull();
    }

    @Test
    void messages_are_received_in_arrival_order() {
        // Given
        DeliveryPipeline deliveryPipeline = newDeliveryPipeline(ReplayStoragePolicy.IMMEDIATE, 10);
        deliveryPipeline.accept(Messages.pushTopicEvent(CHANNEL, 1));
        deliveryPipeline.accept(Messages.pushTopicEvent(CHANNEL, 2));
        deliveryPipeline.accept(Messages.pushTopicEvent(CHANNEL, 3));

        // When
        long first = deliveryPipeline.receive().replayMarker().orElseThrow().replayId();
        long second = deliveryPipeline.receive().replayMarker().orElseThrow().replayId();
        long third = deliveryPipeline.receive().replayMarker().orElseThrow().replayId();

        // Then
        assertThat(new long[]{first, second, third}).containsExactly(1, 2, 3);
        assertThat(storage.read(CHANNEL).replayId()).isEqualTo(3);
    }

    @Test
    void failed_immediate_commit_returns_the_same_message_on_next_receive() {
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
        MappingReplayMarkerStorage failingStorage = new MappingReplayMarkerStorage(failingMap);
        DeliveryPipeline deliveryPipeline = new DeliveryPipeline(10, new ReplayCommitter(failingStorage, ReplayStoragePolicy.IMMEDIATE), channel -> false);
        deliveryPipeline.accept(Messages.pushTopicEvent(CHANNEL, 8));

        // When
        Throwable throwable = catchThrowable(deliveryPipeline::receive);
        ReceivedMessage receivedMessage = deliveryPipeline.receive();

        // Then
        assertThat(throwable).isExactlyInstanceOf(ReplayMarkerStorageException.class);
        assertThat(receivedMessage.replayMarker()).map(ReplayMarker::replayId).contains(8L);
        assertThat(failingStorage.read(CHANNEL)).isEqualTo(receivedMessage.replayMarker().orElseThrow());
    }

    @Test
    void message_without_replay_marker_is_delivered_but_not_committed() {
        // Given
        DeliveryPipeline deliveryPipeline = newDeliveryPipeline(ReplayStoragePolicy.IMMEDIATE, 10);
        deliveryPipeline.accept(Messages.withoutReplayId(CHANNEL, Map.of("text", "hello")));

        // When
        ReceivedMessage receivedMessage = deliveryPipeline.receive();

        // Then
        assertThat(receivedMessage.data()).containsEntry("text", "hello");
        assertThat(receivedMessage.replayMarker()).isEmpty();
        assertThat(receivedMessage.isCommittable()).isFalse();
        assertThat(storage.read(CHANNEL)).isNull();
    }

    @Test
    void messages_buffered_before_a_new_epoch_are_not_committed() {
        // Given
        DeliveryPipeline deliveryPipeline = newDeliveryPipeline(ReplayStoragePolicy.IMMEDIATE, 10);
        deliveryPipeline.accept(Messages.pushTopicEvent(CHANNEL, 20));
        deliveryPipeline.startNewEpoch();
        deliveryPipeline.accept(Messages.pushTopicEvent(CHANNEL, 21));

        // When
        ReceivedMessage stale = deliveryPipeline.receive();
        ReceivedMessage current = deliveryPipeline.receive();

        // Then
        assertThat(stale.isCommittable()).isFalse();
        assertThat(current.isCommittable()).isTrue();
        assertThat(storage.read(CHANNEL).replayId()).isEqualTo(21);
    }

    @Test
    void messages_received_while_channel_is_resubscribing_are_not_committed() {
        // Given
        AtomicBoolean resubscribing = new AtomicBoolean(true);
        DeliveryPipeline deliveryPipeline = new DeliveryPipeline(10, new ReplayCommitter(storage, ReplayStoragePolicy.IMMEDIATE), channel -> resubscribing.get());
        deliveryPipeline.accept(Messages.pushTopicEvent(CHANNEL, 30));

        // When
        ReceivedMessage receivedMessage = deliveryPipeline.receive();

        // Then
        assertThat(receivedMessage.isCommittable()).isFalse();
        assertThat(storage.read(CHANNEL)).isNull();
    }

    @Test
    void messages_that_arrived_while_resubscribing_are_committed_once_resubscription_has_completed() {
        // Given
        AtomicBoolean resubscribing = new AtomicBoolean(true);
        DeliveryPipeline deliveryPipeline = new DeliveryPipeline(10, new ReplayCommitter(storage, ReplayStoragePolicy.MANUAL), channel -> resubscribing.get());
        deliveryPipeline.accept(Messages.pushTopicEvent(CHANNEL, 31));
        resubscribing.set(false);

        // When
        ReceivedMessage receivedMessage = deliveryPipeline.receive();

        // Then
        assertThat(receivedMessage.isCommittable()).isTrue();
        assertThat(storage.read(CHANNEL)).isNull();
    }

    @Test
    void accept_blocks_while_max_pending_count_is_reached() throws Exception {
        // Given
        DeliveryPipeline deliveryPipeline = newDeliveryPipeline(ReplayStoragePolicy.IMMEDIATE, 2);
        deliveryPipeline.accept(Messages.pushTopicEvent(CHANNEL, 1));
        deliveryPipeline.accept(Messages.pushTopicEvent(CHANNEL, 2));

        // When
        Future<?> third = executor.submit(() -> deliveryPipeline.accept(Messages.pushTopicEvent(CHANNEL, 3)));

        // Then
        await().during(200, MILLISECONDS).atMost(1, SECONDS).until(() -> !third.isDone());
        assertThat(deliveryPipeline.pendingCount()).isEqualTo(2);
        deliveryPipeline.receive();
        third.get(1, SECONDS);
        assertThat(deliveryPipeline.pendingCount()).isEqualTo(2);
    }

    private DeliveryPipeline newDeliveryPipeline(ReplayStoragePolicy replayStoragePolicy, int maxPendingCount) {
        return new DeliveryPipeline(maxPendingCount, new ReplayCommitter(storage, replayStoragePolicy), channel -> false);
    }
}
