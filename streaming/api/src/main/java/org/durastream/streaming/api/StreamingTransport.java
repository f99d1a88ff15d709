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

import org.durastream.streaming.api.exception.ServerErrorException;
import org.durastream.streaming.api.exception.TransportException;
import org.durastream.streaming.api.exception.TransportTimeoutException;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.Map;

/**
 * The publish/subscribe transport used to talk to the streaming endpoint (for example a CometD/Bayeux client).
 * <p>
 * Implementations own the wire protocol and the reconnection of the underlying connection. They report connection
 * state changes and inbound messages to the {@link TransportListener} registered with {@link #setListener(TransportListener)}.
 * All blocking methods return once the server has acknowledged the request.
 * </p>
 */
public interface StreamingTransport extends AutoCloseable {

    /**
     * Register the listener that receives inbound messages and connection state changes. Must be called before {@link #connect(Duration)}.
     */
    void setListener(TransportListener listener);

    /**
     * Establish the connection.
     *
     * @param timeout The maximum time to wait for the connection, {@code null} to wait indefinitely.
     * @throws TransportTimeoutException If the connection could not be established within {@code timeout}
     * @throws TransportException        If a network or protocol error occurs
     * @throws ServerErrorException      If the server rejects the handshake
     */
    void connect(@Nullable Duration timeout);

    /**
     * Subscribe to a channel, asking the server to start at the given replay position. The value is sent as
     * {@code ext: {replay: {<channel>: <replay>}}} where {@code -1} requests new events only, {@code -2} all events in the
     * retention window and any other value the events after that replay id.
     *
     * @throws ServerErrorException If the server rejects the subscription, for example because the replay id is outside the retention window
     * @throws TransportException   If a network or protocol error occurs
     */
    void subscribe(String channel, long replay);

    /**
     * Unsubscribe from a channel.
     */
    void unsubscribe(String channel);

    /**
     * Publish {@code data} to {@code channel}.
     */
    void publish(String channel, Map<String, Object> data);

    /**
     * Disconnect and release all resources. Pending {@code subscribe}/{@code unsubscribe} calls fail with a {@link TransportException}.
     */
    @Override
    void close();
}
