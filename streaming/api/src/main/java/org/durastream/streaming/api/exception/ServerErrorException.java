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

package org.durastream.streaming.api.exception;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * The server rejected an operation.
 * <p>
 * If an error string is available it's parsed according to the Bayeux error format {@code code:arg1,arg2:message},
 * for example {@code 400::The replayId {42} you provided was invalid.}, so that callers can act on
 * {@link #errorCode()}, {@link #errorArgs()} and {@link #errorMessage()}.
 * </p>
 */
@NullMarked
public class ServerErrorException extends DurastreamException {
    private static final int INVALID_REQUEST_CODE = 400;

    private final @Nullable String error;
    private final @Nullable Integer errorCode;
    private final List<String> errorArgs;
    private final @Nullable String errorMessage;

    /**
     * @param message A description of the failed operation
     * @param error   The {@code error} field of the server response, or {@code null} if the response didn't contain one
     */
    public ServerErrorException(String message, @Nullable String error) {
        super(error == null ? message : message + " (" + error + ")");
        this.error = error;
        String[] parts = error == null ? new String[0] : error.split(":", 3);
        if (parts.length == 3) {
            this.errorCode = parseCode(parts[0]);
            this.errorArgs = parts[1].isEmpty() ? Collections.emptyList() : List.copyOf(Arrays.asList(parts[1].split(",")));
            this.errorMessage = parts[2];
        } else {
            this.errorCode = null;
            this.errorArgs = Collections.emptyList();
            this.errorMessage = error;
        }
    }

    public @Nullable String error() {
        return error;
    }

    public @Nullable Integer errorCode() {
        return errorCode;
    }

    public List<String> errorArgs() {
        return errorArgs;
    }

    public @Nullable String errorMessage() {
        return errorMessage;
    }

    /**
     * @return {@code true} if the server rejected the replay id that was sent when subscribing, typically because it's outside the retention window.
     */
    public boolean isReplayRejection() {
        return errorCode != null && errorCode == INVALID_REQUEST_CODE
                && errorMessage != null && errorMessage.toLowerCase(Locale.ROOT).contains("replayid");
    }

    private static @Nullable Integer parseCode(String code) {
        try {
            return Integer.valueOf(code.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
