/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.courier.channels.mpsc;

import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codahale.metrics.Timer;
import com.salesforce.courier.sync.ScopedLock;
import com.salesforce.courier.sync.UniqueLock;

/**
 * The single consumer handle of an mpsc channel. Values arrive in the order
 * they were enqueued, across all senders.
 *
 * @author hal.hildebrand
 *
 */
public class Receiver<T> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Receiver.class);

    private final AtomicBoolean closed = new AtomicBoolean();
    private final Inner<T>      inner;

    Receiver(Inner<T> inner) {
        this.inner = inner;
    }

    /**
     * Close the channel. Buffered values are dropped and every subsequent send
     * fails; senders blocked on a full buffer are released.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        int dropped;
        try (var guard = ScopedLock.exclusive(inner.lock)) {
            inner.receiverClosed = true;
            dropped = inner.buffer.size();
            inner.buffer.clear();
            inner.nonFull.signalAll();
        }
        log.debug("Receiver closed on: {} dropped: {}", inner, dropped);
        if (inner.metrics != null) {
            inner.metrics.closed().mark();
        }
    }

    /**
     * @return true if this handle is closed, or every sender is gone and the
     *         buffer is drained
     */
    public boolean isClosed() {
        if (closed.get()) {
            return true;
        }
        try (var guard = ScopedLock.exclusive(inner.lock)) {
            return inner.sendersClosed && inner.buffer.isEmpty();
        }
    }

    /**
     * Dequeue the next value, waiting as long as necessary
     *
     * @return the value, or empty once all senders are closed and the buffer is
     *         drained
     */
    public Optional<T> recv() throws InterruptedException {
        if (closed.get()) {
            return Optional.empty();
        }
        try (var lock = UniqueLock.exclusive(inner.lock)) {
            if (inner.buffer.isEmpty() && !inner.sendersClosed) {
                final Timer.Context timer = inner.metrics == null ? null : inner.metrics.blocked().time();
                try {
                    while (inner.buffer.isEmpty() && !inner.sendersClosed) {
                        lock.await(inner.nonEmpty);
                    }
                } finally {
                    if (timer != null) {
                        timer.stop();
                    }
                }
            }
            return dequeue();
        }
    }

    /**
     * Dequeue the next value, waiting at most the timeout
     *
     * @return the value, or empty if the timeout elapsed or the channel ended
     */
    public Optional<T> recvTimeout(Duration timeout) throws InterruptedException {
        requireNonNull(timeout, "timeout");
        if (closed.get()) {
            return Optional.empty();
        }
        final var deadline = System.nanoTime() + TimeUnit.NANOSECONDS.convert(timeout);
        try (var lock = UniqueLock.exclusive(inner.lock)) {
            if (inner.buffer.isEmpty() && !inner.sendersClosed) {
                final Timer.Context timer = inner.metrics == null ? null : inner.metrics.blocked().time();
                try {
                    while (inner.buffer.isEmpty() && !inner.sendersClosed) {
                        final var remaining = deadline - System.nanoTime();
                        if (remaining <= 0) {
                            log.trace("Receive timed out on: {}", inner);
                            if (inner.metrics != null) {
                                inner.metrics.timeouts().mark();
                            }
                            return Optional.empty();
                        }
                        lock.await(inner.nonEmpty, Duration.ofNanos(remaining));
                    }
                } finally {
                    if (timer != null) {
                        timer.stop();
                    }
                }
            }
            return dequeue();
        }
    }

    /**
     * @return the number of buffered values
     */
    public int size() {
        try (var guard = ScopedLock.exclusive(inner.lock)) {
            return inner.buffer.size();
        }
    }

    /**
     * Dequeue the next value if one is buffered, without blocking
     */
    public Optional<T> tryRecv() {
        if (closed.get()) {
            return Optional.empty();
        }
        try (var guard = ScopedLock.exclusive(inner.lock)) {
            return dequeue();
        }
    }

    // lock held
    private Optional<T> dequeue() {
        final var value = inner.buffer.poll();
        if (value == null) {
            return Optional.empty();
        }
        inner.nonFull.signal();
        log.trace("Received on: {} size: {}", inner, inner.buffer.size());
        if (inner.metrics != null) {
            inner.metrics.received().mark();
        }
        return Optional.of(value);
    }
}
