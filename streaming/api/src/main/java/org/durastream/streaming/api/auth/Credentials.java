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

package org.durastream.streaming.api.auth;

import org.jspecify.annotations.NullMarked;

import static java.util.Objects.requireNonNull;

/**
 * The result of a successful authentication.
 *
 * @param accessToken The OAuth2 access token
 * @param instanceUrl The URL of the instance that the streaming endpoint is served from
 * @param tokenType   The token type, typically {@code Bearer}
 */
@NullMarked
public record Credentials(String accessToken, String instanceUrl, String tokenType) {
    public static final String DEFAULT_TOKEN_TYPE = "Bearer";

    public Credentials {
        requireNonNull(accessToken, "accessToken cannot be null");
        requireNonNull(instanceUrl, "instanceUrl cannot be null");
        requireNonNull(tokenType, "tokenType cannot be null");
        if (instanceUrl.isBlank()) {
            throw new IllegalArgumentException("instanceUrl cannot be blank");
        }
    }

    public Credentials(String accessToken, String instanceUrl) {
        this(accessToken, instanceUrl, DEFAULT_TOKEN_TYPE);
    }

    /**
     * @return The value of the {@code Authorization} header, e.g. {@code Bearer 00D...}
     */
    public String authorizationHeader() {
        return tokenType + " " + accessToken;
    }

    @Override
    public String toString() {
        // Never log the token
        return "Credentials[instanceUrl=" + instanceUrl + ", tokenType=" + tokenType + "]";
    }
}
