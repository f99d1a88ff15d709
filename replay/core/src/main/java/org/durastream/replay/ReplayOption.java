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

package org.durastream.replay;

import java.util.Objects;

/**
 * Specifies where a (re)subscription to a channel should start consuming events from.
 * <p>
 * There are two sentinel options, {@link #NEW_EVENTS} and {@link #ALL_EVENTS}, and a concrete {@link ReplayId} that
 * resumes after a given position. {@link #value()} is the value sent to the server in the {@code replay} extension.
 * </p>
 */
public sealed interface ReplayOption {

    /**
     * Receive new events that are broadcast after the client subscribes
     */
    ReplayOption NEW_EVENTS = new NewEvents();

    /**
     * Receive all events, including past events that are within the retention window and new events sent after subscription
     */
    ReplayOption ALL_EVENTS = new AllEvents();

    long value();

    default boolean isNewEvents() {
        return this instanceof NewEvents;
    }

    default boolean isAllEvents() {
        return this instanceof AllEvents;
    }

    default boolean isReplayId() {
        return this instanceof ReplayId;
    }

    final class NewEvents implements ReplayOption {
        private static final long VALUE = -1;

        private NewEvents() {
        }

        @Override
        public long value() {
            return VALUE;
        }

        @Override
        public String toString() {
            return "NEW_EVENTS";
        }
    }

    final class AllEvents implements ReplayOption {
        private static final long VALUE = -2;

        private AllEvents() {
        }

        @Override
        public long value() {
            return VALUE;
        }

        @Override
        public String toString() {
            return "ALL_EVENTS";
        }
    }

    final class ReplayId implements ReplayOption {
        public final long replayId;

        private ReplayId(long replayId) {
            if (replayId < 0) {
                throw new IllegalArgumentException("replayId must be greater than or equal to 0, was " + replayId);
            }
            this.replayId = replayId;
        }

        @Override
        public long value() {
            return replayId;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof ReplayId)) return false;
            ReplayId that = (ReplayId) o;
            return replayId == that.replayId;
        }

        @Override
        public int hashCode() {
            return Objects.hash(replayId);
        }

        @Override
        public String toString() {
            return ReplayId.class.getSimpleName() + "[" + replayId + "]";
        }
    }

    /**
     * Resume after the event with the given replay id
     */
    static ReplayOption replayId(long replayId) {
        return new ReplayId(replayId);
    }

    /**
     * Resume after the position recorded by the supplied marker
     */
    static ReplayOption after(ReplayMarker replayMarker) {
        Objects.requireNonNull(replayMarker, ReplayMarker.class.getSimpleName() + " cannot be null");
        return new ReplayId(replayMarker.replayId());
    }

    /**
     * Map a value sent on the wire back to a {@code ReplayOption}.
     *
     * @throws IllegalArgumentException If {@code value} is negative but not one of the sentinel values
     */
    static ReplayOption fromValue(long value) {
        if (value == NEW_EVENTS.value()) {
            return NEW_EVENTS;
        } else if (value == ALL_EVENTS.value()) {
            return ALL_EVENTS;
        }
        return new ReplayId(value);
    }
}
