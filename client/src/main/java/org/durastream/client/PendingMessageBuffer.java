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

package org.durastream.client;

import org.durastream.streaming.api.StreamingMessage;
import org.durastream.streaming.api.exception.ClientInvalidOperationException;
import org.jspecify.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO buffer between the transport (producer) and the consumer calling {@code receive}.
 * <p>
 * {@link #put(StreamingMessage, boolean)} blocks while the buffer is full and {@link #awaitHead()} blocks while it's empty.
 * The head is only removed by {@link #removeHead(Entry)} so that a consumer can leave a message in place if it fails
 * to process it. Every entry is tagged with the connection epoch it arrived in.
 * Errors reported with {@link #reportError(RuntimeException)} are handed to the consumer once, before any message,
 * while a failure set with {@link #fail(RuntimeException)} is terminal.
 * </p>
 */
class PendingMessageBuffer {

    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    // All fields below are guarded by lock
    private final Deque<Entry> entries = new ArrayDeque<>();
    private final Deque<RuntimeException> errors = new ArrayDeque<>();
    private long epoch;
    private boolean closed;
    private @Nullable RuntimeException failure;

    PendingMessageBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be greater than zero");
        }
        this.capacity = capacity;
    }

    /**
     * Append a message, waiting for space if the buffer is full.
     *
     * @return {@code false} if the buffer was closed and the message was discarded
     */
    boolean put(StreamingMessage message, boolean committable) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (entries.size() >= capacity && !closed) {
                notFull.await();
            }
            if (closed) {
                return false;
            }
            entries.addLast(new Entry(message, epoch, committable));
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait for the head of the buffer without removing it.
     *
     * @throws RuntimeException                 A reported error or the terminal failure
     * @throws ClientInvalidOperationException If the buffer is closed
     */
    Entry awaitHead() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (true) {
                RuntimeException error = errors.pollFirst();
                if (error != null) {
                    throw error;
                } else if (failure != null) {
                    throw failure;
                } else if (closed) {
                    throw new ClientInvalidOperationException("Client is closed");
                }

                Entry head = entries.peekFirst();
                if (head != null) {
                    return head;
                }
                notEmpty.await();
            }
        } finally {
            lock.unlock();
        }
    }

    void removeHead(Entry entry) {
        lock.lock();
        try {
            if (entries.peekFirst() == entry) {
                entries.removeFirst();
                notFull.signal();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return {@code true} if {@code entry} arrived in an earlier connection epoch than the current one
     */
    boolean isStale(Entry entry) {
        lock.lock();
        try {
            return entry.epoch < epoch;
        } finally {
            lock.unlock();
        }
    }

    void startNewEpoch() {
        lock.lock();
        try {
            epoch++;
        } finally {
            lock.unlock();
        }
    }

    void reportError(RuntimeException error) {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            errors.addLast(error);
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Close the buffer with a terminal failure that is thrown to every subsequent consumer. The first failure wins.
     */
    void fail(RuntimeException failure) {
        lock.lock();
        try {
            if (this.failure == null) {
                this.failure = failure;
            }
            closeInternal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Discard all entries and wake up blocked producers and consumers.
     */
    void close() {
        lock.lock();
        try {
            closeInternal();
        } finally {
            lock.unlock();
        }
    }

    private void closeInternal() {
        closed = true;
        entries.clear();
        errors.clear();
        notEmpty.signalAll();
        notFull.signalAll();
    }

    int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    static final class Entry {
        final StreamingMessage message;
        final long epoch;
        final boolean committable;

        private Entry(StreamingMessage message, long epoch, boolean committable) {
            this.message = message;
            this.epoch = epoch;
            this.committable = committable;
        }
    }
}
