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

package org.durastream.streaming.api;

import org.jspecify.annotations.NullMarked;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * A message received from, or published to, a channel of the streaming endpoint.
 * <p>
 * {@code data} is the decoded JSON payload of the message and {@code ext} the decoded extension fields
 * (for example the {@code replay} extension). Both are unmodifiable.
 * </p>
 */
@NullMarked
public final class StreamingMessage {
    private final String channel;
    private final Map<String, Object> data;
    private final Map<String, Object> ext;

    public StreamingMessage(String channel, Map<String, Object> data) {
        this(channel, data, Collections.emptyMap());
    }

    public StreamingMessage(String channel, Map<String, Object> data, Map<String, Object> ext) {
        requireNonNull(channel, "channel cannot be null");
        requireNonNull(data, "data cannot be null");
        requireNonNull(ext, "ext cannot be null");
        this.channel = channel;
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
        this.ext = Collections.unmodifiableMap(new LinkedHashMap<>(ext));
    }

    public String channel() {
        return channel;
    }

    public Map<String, Object> data() {
        return data;
    }

    public Map<String, Object> ext() {
        return ext;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StreamingMessage)) return false;
        StreamingMessage that = (StreamingMessage) o;
        return channel.equals(that.channel) && data.equals(that.data) && ext.equals(that.ext);
    }

    @Override
    public int hashCode() {
        return java.util.Objects.hash(channel, data, ext);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", StreamingMessage.class.getSimpleName() + "[", "]")
                .add("channel='" + channel + "'")
                .add("data=" + data)
                .add("ext=" + ext)
                .toString();
    }
}
