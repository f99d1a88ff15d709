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

import org.durastream.streaming.api.auth.Credentials;
import org.durastream.streaming.api.json.JsonCodec;

import java.net.URI;

/**
 * Creates a {@link StreamingTransport} for an endpoint once the client has been authenticated.
 */
@FunctionalInterface
public interface StreamingTransportFactory {

    /**
     * @param endpoint    The streaming endpoint, for example {@code https://instance.my.salesforce.com/cometd/42.0}
     * @param credentials The credentials to authorize the requests with
     * @param jsonCodec   The codec to use when encoding and decoding message payloads
     * @return A new, not yet connected, transport
     */
    StreamingTransport create(URI endpoint, Credentials credentials, JsonCodec jsonCodec);
}
