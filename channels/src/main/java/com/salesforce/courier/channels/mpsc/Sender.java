/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.courier.channels.mpsc;

import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codahale.metrics.Timer;
import com.salesforce.courier.sync.ScopedLock;
import com.salesforce.courier.sync.UniqueLock;

/**
 * A producer handle of an mpsc channel. Further producers are made with
 * {@link #clone()}; the receiver sees the channel end once every handle is
 * closed.
 *
 * @author hal.hildebrand
 *
 */
public class Sender<T> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Sender.class);

    private final AtomicBoolean closed = new AtomicBoolean();
    private final Inner<T>      inner;

    Sender(Inner<T> inner) {
        this.inner = inner;
    }

    /**
     * Answer another producer handle on the same channel
     *
     * @throws IllegalStateException if this handle is closed
     */
    @Override
    public Sender<T> clone() {
        if (closed.get()) {
            throw new IllegalStateException("Sender is closed: " + inner);
        }
        inner.senders.retain();
        log.trace("Cloned sender on: {} senders: {}", inner, inner.senders.refCnt());
        return new Sender<>(inner);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.debug("Sender closed on: {}", inner);
        if (inner.metrics != null) {
            inner.metrics.closed().mark();
        }
        inner.senders.release();
    }

    /**
     * @return true if this handle is closed or the receiver is gone
     */
    public boolean isClosed() {
        if (closed.get()) {
            return true;
        }
        try (var guard = ScopedLock.exclusive(inner.lock)) {
            return inner.receiverClosed;
        }
    }

    /**
     * Enqueue the value, waiting as long as necessary for room in the buffer
     *
     * @return FAILURE if the channel is closed
     */
    public SendResult send(T value) throws InterruptedException {
        requireNonNull(value, "value");
        if (closed.get()) {
            return failed("handle closed");
        }
        try (var lock = UniqueLock.exclusive(inner.lock)) {
            if (inner.isFull() && !inner.receiverClosed) {
                final Timer.Context timer = inner.metrics == null ? null : inner.metrics.blocked().time();
                try {
                    while (inner.isFull() && !inner.receiverClosed) {
                        lock.await(inner.nonFull);
                    }
                } finally {
                    if (timer != null) {
                        timer.stop();
                    }
                }
            }
            return enqueue(value);
        }
    }

    /**
     * Enqueue the value, waiting at most the timeout for room in the buffer
     *
     * @return TIMEOUT if the buffer stayed full, FAILURE if the channel is
     *         closed
     */
    public SendResult sendTimeout(T value, Duration timeout) throws InterruptedException {
        requireNonNull(value, "value");
        requireNonNull(timeout, "timeout");
        if (closed.get()) {
            return failed("handle closed");
        }
        final var deadline = System.nanoTime() + TimeUnit.NANOSECONDS.convert(timeout);
        try (var lock = UniqueLock.exclusive(inner.lock)) {
            if (inner.isFull() && !inner.receiverClosed) {
                final Timer.Context timer = inner.metrics == null ? null : inner.metrics.blocked().time();
                try {
                    while (inner.isFull() && !inner.receiverClosed) {
                        final var remaining = deadline - System.nanoTime();
                        if (remaining <= 0) {
                            return timedOut();
                        }
                        lock.await(inner.nonFull, Duration.ofNanos(remaining));
                    }
                } finally {
                    if (timer != null) {
                        timer.stop();
                    }
                }
            }
            return enqueue(value);
        }
    }

    /**
     * Enqueue the value only if the buffer has room
     *
     * @return FAILURE if the buffer is full or the channel is closed
     */
    public SendResult trySend(T value) {
        requireNonNull(value, "value");
        if (closed.get()) {
            return failed("handle closed");
        }
        try (var guard = ScopedLock.exclusive(inner.lock)) {
            if (inner.isFull()) {
                return failed("full");
            }
            return enqueue(value);
        }
    }

    // lock held
    private SendResult enqueue(T value) {
        if (inner.receiverClosed) {
            return failed("receiver closed");
        }
        inner.buffer.add(value);
        inner.nonEmpty.signal();
        log.trace("Sent on: {} size: {}", inner, inner.buffer.size());
        if (inner.metrics != null) {
            inner.metrics.sent().mark();
        }
        return SendResult.SUCCESS;
    }

    private SendResult failed(String reason) {
        log.trace("Send failed on: {} reason: {}", inner, reason);
        if (inner.metrics != null) {
            inner.metrics.failedSends().mark();
        }
        return SendResult.FAILURE;
    }

    private SendResult timedOut() {
        log.trace("Send timed out on: {}", inner);
        if (inner.metrics != null) {
            inner.metrics.timeouts().mark();
        }
        return SendResult.TIMEOUT;
    }
}
