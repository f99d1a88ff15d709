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

/**
 * Callbacks from a {@link StreamingTransport}.
 * <p>
 * {@link #onMessage(StreamingMessage)} is always invoked from a single thread at a time and may block, which is how
 * back-pressure is propagated to the transport. {@link #onConnectionStateChanged(ConnectionState)} may be invoked from
 * any thread maintained by the transport.
 * </p>
 */
public interface TransportListener {

    /**
     * Invoked for every message broadcast on a subscribed channel.
     *
     * @param message The received message
     */
    void onMessage(StreamingMessage message);

    /**
     * Invoked when the state of the underlying connection changes.
     *
     * @param state The new state
     */
    void onConnectionStateChanged(ConnectionState state);
}
