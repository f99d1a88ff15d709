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

package org.durastream.replay.redis.spring;

import org.durastream.replay.ReplayMarker;
import org.durastream.replay.storage.ReplayMarkerStorage;
import org.durastream.streaming.api.exception.ReplayMarkerStorageException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.retry.support.RetryTemplate;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * A Spring implementation of {@link ReplayMarkerStorage} that stores {@link ReplayMarker}s in Redis.
 * <p>
 * Each marker is stored in a hash, with the fields {@code replayId} and {@code createdAt}, whose key is the channel name
 * prefixed by {@link #DEFAULT_KEY_PREFIX} (or a custom prefix). Redis operations are retried according to a {@link RetryTemplate},
 * and failures that remain once it has given up are rethrown as {@link ReplayMarkerStorageException}.
 * </p>
 */
public class SpringRedisReplayMarkerStorage implements ReplayMarkerStorage {
    private static final Logger log = LoggerFactory.getLogger(SpringRedisReplayMarkerStorage.class);

    public static final String DEFAULT_KEY_PREFIX = "durastream:replay:";

    static final String REPLAY_ID = "replayId";
    static final String CREATED_AT = "createdAt";

    private final RedisOperations<String, String> redis;
    private final String keyPrefix;
    private final RetryTemplate retryTemplate;

    /**
     * Create a {@link ReplayMarkerStorage} that uses the {@link #DEFAULT_KEY_PREFIX} for its keys.
     * It will by default retry {@link DataAccessException}s with exponential backoff starting with 100 ms and progressively go up to
     * max 2 seconds wait time between each retry, giving up after 5 attempts.
     *
     * @param redis The {@link RedisOperations} that'll be used to store the replay markers
     */
    public SpringRedisReplayMarkerStorage(RedisOperations<String, String> redis) {
        this(redis, DEFAULT_KEY_PREFIX);
    }

    /**
     * @param redis     The {@link RedisOperations} that'll be used to store the replay markers
     * @param keyPrefix The prefix of the Redis keys, allows several clients to share a Redis database
     */
    public SpringRedisReplayMarkerStorage(RedisOperations<String, String> redis, String keyPrefix) {
        this(redis, keyPrefix, defaultRetryTemplate());
    }

    /**
     * @param redis         The {@link RedisOperations} that'll be used to store the replay markers
     * @param keyPrefix     The prefix of the Redis keys, allows several clients to share a Redis database
     * @param retryTemplate A custom {@link RetryTemplate} to use if there's a problem reading/saving/deleting a replay marker
     */
    public SpringRedisReplayMarkerStorage(RedisOperations<String, String> redis, String keyPrefix, RetryTemplate retryTemplate) {
        requireNonNull(redis, "Redis operations cannot be null");
        requireNonNull(keyPrefix, "keyPrefix cannot be null");
        requireNonNull(retryTemplate, RetryTemplate.class.getSimpleName() + " cannot be null");
        this.redis = redis;
        this.keyPrefix = keyPrefix;
        this.retryTemplate = retryTemplate;
    }

    static RetryTemplate defaultRetryTemplate() {
        return RetryTemplate.builder()
                .maxAttempts(5)
                .exponentialBackoff(100, 2.0, 2000)
                .retryOn(DataAccessException.class)
                .build();
    }

    @Override
    public @Nullable ReplayMarker read(String channel) {
        requireNonNull(channel, "channel cannot be null");
        Map<String, String> entries = execute("read", channel, () -> hash().entries(key(channel)));
        if (entries == null || entries.isEmpty()) {
            return null;
        }

        String replayId = entries.get(REPLAY_ID);
        String createdAt = entries.get(CREATED_AT);
        if (replayId == null || createdAt == null) {
            log.warn("Ignoring incomplete replay marker stored for channel {} (fields={})", channel, entries.keySet());
            return null;
        }

        try {
            return new ReplayMarker(channel, Long.parseLong(replayId), OffsetDateTime.parse(createdAt));
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new ReplayMarkerStorageException("Replay marker stored for channel " + channel + " is malformed", e);
        }
    }

    @Override
    public void save(String channel, ReplayMarker replayMarker) {
        requireNonNull(channel, "channel cannot be null");
        requireNonNull(replayMarker, ReplayMarker.class.getSimpleName() + " cannot be null");

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(REPLAY_ID, Long.toString(replayMarker.replayId()));
        fields.put(CREATED_AT, replayMarker.createdAt().toString());
        execute("save", channel, () -> {
            hash().putAll(key(channel), fields);
            return null;
        });
    }

    @Override
    public void delete(String channel) {
        requireNonNull(channel, "channel cannot be null");
        execute("delete", channel, () -> redis.delete(key(channel)));
    }

    String key(String channel) {
        return keyPrefix + channel;
    }

    private HashOperations<String, String, String> hash() {
        return redis.opsForHash();
    }

    private <T> T execute(String operation, String channel, Supplier<T> supplier) {
        try {
            return retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.debug("Retrying {} of replay marker of channel {} (attempt {})", operation, channel, context.getRetryCount() + 1);
                }
                return supplier.get();
            });
        } catch (RuntimeException e) {
            throw new ReplayMarkerStorageException("Failed to " + operation + " replay marker of channel " + channel + " in Redis", e);
        }
    }

    @Override
    public String toString() {
        return SpringRedisReplayMarkerStorage.class.getSimpleName() + "[keyPrefix=" + keyPrefix + "]";
    }
}
