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

import org.durastream.client.json.JacksonJsonCodec;
import org.durastream.replay.ReplayMarker;
import org.durastream.replay.ReplayOption;
import org.durastream.replay.ReplayStoragePolicy;
import org.durastream.replay.storage.ConstantReplayMarkerStorage;
import org.durastream.replay.storage.MappingReplayMarkerStorage;
import org.durastream.replay.storage.ReplayMarkerStorage;
import org.durastream.streaming.api.json.JsonCodec;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.Map;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * Configuration for the {@link StreamingClient}. Instances are immutable, every setter returns a new configuration.
 *
 * <pre>
 * var config = StreamingClientConfig.withConfig()
 *                                   .replay(new SpringRedisReplayMarkerStorage(redisTemplate))
 *                                   .replayFallback(ReplayOption.ALL_EVENTS)
 *                                   .replayStoragePolicy(ReplayStoragePolicy.MANUAL);
 * </pre>
 */
public class StreamingClientConfig {
    public static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(10);
    public static final int DEFAULT_MAX_PENDING_COUNT = 100;
    public static final String DEFAULT_API_VERSION = "42.0";

    final ReplayMarkerStorage replayStorage;
    final @Nullable ReplayOption replayFallback;
    final ReplayStoragePolicy replayStoragePolicy;
    final @Nullable Duration connectionTimeout;
    final int maxPendingCount;
    final JsonCodec jsonCodec;
    final String apiVersion;

    /**
     * Create a configuration that subscribes to new events only, stores nothing, commits immediately,
     * waits 10 seconds for a lost connection to come back and buffers at most 100 messages.
     */
    public StreamingClientConfig() {
        this(new ConstantReplayMarkerStorage(ReplayOption.NEW_EVENTS), null, ReplayStoragePolicy.IMMEDIATE, DEFAULT_CONNECTION_TIMEOUT,
                DEFAULT_MAX_PENDING_COUNT, new JacksonJsonCodec(), DEFAULT_API_VERSION);
    }

    private StreamingClientConfig(ReplayMarkerStorage replayStorage, @Nullable ReplayOption replayFallback, ReplayStoragePolicy replayStoragePolicy,
                                  @Nullable Duration connectionTimeout, int maxPendingCount, JsonCodec jsonCodec, String apiVersion) {
        requireNonNull(replayStorage, ReplayMarkerStorage.class.getSimpleName() + " cannot be null");
        requireNonNull(replayStoragePolicy, ReplayStoragePolicy.class.getSimpleName() + " cannot be null");
        requireNonNull(jsonCodec, JsonCodec.class.getSimpleName() + " cannot be null");
        requireNonNull(apiVersion, "apiVersion cannot be null");
        if (maxPendingCount < 1) {
            throw new IllegalArgumentException("maxPendingCount must be greater than zero");
        }
        if (connectionTimeout != null && (connectionTimeout.isNegative() || connectionTimeout.isZero())) {
            throw new IllegalArgumentException("connectionTimeout must be positive");
        }
        this.replayStorage = replayStorage;
        this.replayFallback = replayFallback;
        this.replayStoragePolicy = replayStoragePolicy;
        this.connectionTimeout = connectionTimeout;
        this.maxPendingCount = maxPendingCount;
        this.jsonCodec = jsonCodec;
        this.apiVersion = apiVersion;
    }

    /**
     * Syntactic sugar for {@link #StreamingClientConfig()}.
     */
    public static StreamingClientConfig withConfig() {
        return new StreamingClientConfig();
    }

    /**
     * Always subscribe with {@code replayOption}. Nothing is stored.
     */
    public StreamingClientConfig replay(ReplayOption replayOption) {
        return replay(new ConstantReplayMarkerStorage(replayOption));
    }

    /**
     * Store replay markers in {@code replayStorage} and resume from them when subscribing.
     */
    public StreamingClientConfig replay(ReplayMarkerStorage replayStorage) {
        return new StreamingClientConfig(replayStorage, replayFallback, replayStoragePolicy, connectionTimeout, maxPendingCount, jsonCodec, apiVersion);
    }

    /**
     * Store replay markers in {@code replayMarkers}, for example a map backed by a persistent store.
     */
    public StreamingClientConfig replay(Map<String, ReplayMarker> replayMarkers) {
        return replay(new MappingReplayMarkerStorage(replayMarkers));
    }

    /**
     * The replay option to subscribe with if the server rejects the stored position, typically because it's older than the
     * retention window. No fallback is used by default, in which case the subscription fails.
     */
    public StreamingClientConfig replayFallback(@Nullable ReplayOption replayFallback) {
        return new StreamingClientConfig(replayStorage, replayFallback, replayStoragePolicy, connectionTimeout, maxPendingCount, jsonCodec, apiVersion);
    }

    /**
     * @param replayStoragePolicy {@link ReplayStoragePolicy#IMMEDIATE} (default) or {@link ReplayStoragePolicy#MANUAL}
     */
    public StreamingClientConfig replayStoragePolicy(ReplayStoragePolicy replayStoragePolicy) {
        return new StreamingClientConfig(replayStorage, replayFallback, replayStoragePolicy, connectionTimeout, maxPendingCount, jsonCodec, apiVersion);
    }

    /**
     * The time to wait for the initial connection and for a lost connection to come back before the client is closed.
     */
    public StreamingClientConfig connectionTimeout(Duration connectionTimeout) {
        requireNonNull(connectionTimeout, "connectionTimeout cannot be null");
        return new StreamingClientConfig(replayStorage, replayFallback, replayStoragePolicy, connectionTimeout, maxPendingCount, jsonCodec, apiVersion);
    }

    /**
     * Never time out while waiting for a connection.
     */
    public StreamingClientConfig waitIndefinitely() {
        return new StreamingClientConfig(replayStorage, replayFallback, replayStoragePolicy, null, maxPendingCount, jsonCodec, apiVersion);
    }

    /**
     * The maximum number of received messages that are buffered. The transport is blocked while the buffer is full.
     */
    public StreamingClientConfig maxPendingCount(int maxPendingCount) {
        return new StreamingClientConfig(replayStorage, replayFallback, replayStoragePolicy, connectionTimeout, maxPendingCount, jsonCodec, apiVersion);
    }

    public StreamingClientConfig jsonCodec(JsonCodec jsonCodec) {
        return new StreamingClientConfig(replayStorage, replayFallback, replayStoragePolicy, connectionTimeout, maxPendingCount, jsonCodec, apiVersion);
    }

    public StreamingClientConfig apiVersion(String apiVersion) {
        return new StreamingClientConfig(replayStorage, replayFallback, replayStoragePolicy, connectionTimeout, maxPendingCount, jsonCodec, apiVersion);
    }

    public ReplayMarkerStorage replayStorage() {
        return replayStorage;
    }

    public @Nullable ReplayOption replayFallback() {
        return replayFallback;
    }

    public ReplayStoragePolicy replayStoragePolicy() {
        return replayStoragePolicy;
    }

    public @Nullable Duration connectionTimeout() {
        return connectionTimeout;
    }

    public int maxPendingCount() {
        return maxPendingCount;
    }

    public JsonCodec jsonCodec() {
        return jsonCodec;
    }

    public String apiVersion() {
        return apiVersion;
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", StreamingClientConfig.class.getSimpleName() + "[", "]")
                .add("replayStorage=" + replayStorage)
                .add("replayFallback=" + replayFallback)
                .add("replayStoragePolicy=" + replayStoragePolicy)
                .add("connectionTimeout=" + connectionTimeout)
                .add("maxPendingCount=" + maxPendingCount)
                .add("apiVersion='" + apiVersion + "'")
                .toString();
    }
}
