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
 * Connection states reported by a {@link StreamingTransport} to its {@link TransportListener}.
 */
public enum ConnectionState {
    /**
     * The transport has an established session, either the first one or a new one after a reconnect.
     */
    CONNECTED,
    /**
     * The connection was lost. The transport will try to reconnect on its own.
     */
    DISCONNECTED,
    /**
     * The transport is trying to re-establish the connection.
     */
    RECONNECTING,
    /**
     * The server closed the session. The transport will not reconnect.
     */
    CLOSED
}
