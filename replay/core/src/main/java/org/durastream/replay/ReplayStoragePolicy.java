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

/**
 * Defines when the replay marker of a message is persisted relative to handing the message to the consumer.
 */
public enum ReplayStoragePolicy {
    /**
     * The marker is stored before the message is returned to the consumer. A crash while the consumer processes the
     * message means that it won't be replayed.
     */
    IMMEDIATE,
    /**
     * The consumer commits the marker itself after it has processed the message. Messages that were not committed are
     * requested again the next time the channel is subscribed to.
     */
    MANUAL
}
