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
import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Describes the token request of one of the supported OAuth2 flows: the "username-password" flow and the
 * "refresh token" flow. A {@link CredentialProvider} posts {@link #formParameters()} to {@link #tokenEndpoint()}.
 */
@NullMarked
public sealed interface OAuthGrant {
    URI PRODUCTION_TOKEN_ENDPOINT = URI.create("https://login.salesforce.com/services/oauth2/token");
    URI SANDBOX_TOKEN_ENDPOINT = URI.create("https://test.salesforce.com/services/oauth2/token");

    URI tokenEndpoint();

    Map<String, String> formParameters();

    /**
     * Create a "username-password" grant for a production org.
     */
    static PasswordGrant password(String consumerKey, String consumerSecret, String username, String password) {
        return new PasswordGrant(consumerKey, consumerSecret, username, password, null);
    }

    /**
     * Create a "username-password" grant for the sandbox named {@code sandboxName}. The sandbox name is appended to the
     * username and the sandbox token endpoint is used.
     */
    static PasswordGrant sandboxPassword(String consumerKey, String consumerSecret, String username, String password, String sandboxName) {
        requireNonNull(sandboxName, "sandboxName cannot be null");
        return new PasswordGrant(consumerKey, consumerSecret, username, password, sandboxName);
    }

    static RefreshTokenGrant refreshToken(String consumerKey, String consumerSecret, String refreshToken) {
        return new RefreshTokenGrant(consumerKey, consumerSecret, refreshToken, false);
    }

    static RefreshTokenGrant sandboxRefreshToken(String consumerKey, String consumerSecret, String refreshToken) {
        return new RefreshTokenGrant(consumerKey, consumerSecret, refreshToken, true);
    }

    /**
     * @return {@code username} suffixed with {@code .sandboxName}, the naming convention of sandbox org users
     */
    static String sandboxUsername(String username, String sandboxName) {
        requireNonNull(username, "username cannot be null");
        requireNonNull(sandboxName, "sandboxName cannot be null");
        return username + "." + sandboxName;
    }

    record PasswordGrant(String consumerKey, String consumerSecret, String username, String password,
                         @Nullable String sandboxName) implements OAuthGrant {
        public PasswordGrant {
            requireNonNull(consumerKey, "consumerKey cannot be null");
            requireNonNull(consumerSecret, "consumerSecret cannot be null");
            requireNonNull(username, "username cannot be null");
            requireNonNull(password, "password cannot be null");
        }

        public boolean isSandbox() {
            return sandboxName != null;
        }

        public String effectiveUsername() {
            return sandboxName == null ? username : sandboxUsername(username, sandboxName);
        }

        @Override
        public URI tokenEndpoint() {
            return isSandbox() ? SANDBOX_TOKEN_ENDPOINT : PRODUCTION_TOKEN_ENDPOINT;
        }

        @Override
        public Map<String, String> formParameters() {
            Map<String, String> parameters = new LinkedHashMap<>();
            parameters.put("grant_type", "password");
            parameters.put("client_id", consumerKey);
            parameters.put("client_secret", consumerSecret);
            parameters.put("username", effectiveUsername());
            parameters.put("password", password);
            return parameters;
        }

        @Override
        public String toString() {
            return "PasswordGrant[username=" + effectiveUsername() + ", tokenEndpoint=" + tokenEndpoint() + "]";
        }
    }

    record RefreshTokenGrant(String consumerKey, String consumerSecret, String refreshToken, boolean sandbox) implements OAuthGrant {
        public RefreshTokenGrant {
            requireNonNull(consumerKey, "consumerKey cannot be null");
            requireNonNull(consumerSecret, "consumerSecret cannot be null");
            requireNonNull(refreshToken, "refreshToken cannot be null");
        }

        @Override
        public URI tokenEndpoint() {
            return sandbox ? SANDBOX_TOKEN_ENDPOINT : PRODUCTION_TOKEN_ENDPOINT;
        }

        @Override
        public Map<String, String> formParameters() {
            Map<String, String> parameters = new LinkedHashMap<>();
            parameters.put("grant_type", "refresh_token");
            parameters.put("client_id", consumerKey);
            parameters.put("client_secret", consumerSecret);
            parameters.put("refresh_token", refreshToken);
            return parameters;
        }

        @Override
        public String toString() {
            return "RefreshTokenGrant[tokenEndpoint=" + tokenEndpoint() + "]";
        }
    }
}
