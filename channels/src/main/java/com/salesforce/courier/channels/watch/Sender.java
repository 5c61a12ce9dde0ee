/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.courier.channels.watch;

import static java.util.Objects.requireNonNull;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.salesforce.courier.sync.LockUsageException;
import com.salesforce.courier.sync.ScopedLock;
import com.salesforce.courier.sync.UniqueLock;

/**
 * The single publishing handle of a watch channel. The sender does not keep
 * the channel alive: once every receiver is closed, broadcasts fail and
 * {@link #closed()} answers true.
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
     * Replace the current value and wake every waiting receiver
     *
     * @return FAILURE if this handle is closed or no receiver remains
     * @throws LockUsageException if the calling thread holds an open
     *         {@link Borrow}
     */
    public SendResult broadcast(T value) {
        requireNonNull(value, "value");
        inner.checkNotBorrowing("broadcast");
        if (closed.get()) {
            return failed("handle closed");
        }
        if (!inner.tryRetain()) {
            return failed("no receivers");
        }
        long version;
        try {
            try (var guard = ScopedLock.exclusive(inner.lock)) {
                inner.value = value;
                version = inner.version.addAndGet(2);
                inner.changed.signalAll();
            }
        } finally {
            inner.release();
        }
        log.trace("Broadcast on: {} version: {}", inner, version);
        if (inner.metrics != null) {
            inner.metrics.sent().mark();
        }
        return SendResult.SUCCESS;
    }

    /**
     * Close the channel. Receivers observe any value they have not yet seen,
     * then closure.
     */
    @Override
    public void close() {
        inner.checkNotBorrowing("close");
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try (var guard = ScopedLock.exclusive(inner.lock)) {
            inner.version.accumulateAndGet(Inner.CLOSED, (current, flag) -> current | flag);
            inner.changed.signalAll();
        }
        log.debug("Sender closed on: {}", inner);
        if (inner.metrics != null) {
            inner.metrics.closed().mark();
        }
    }

    /**
     * @return true if every receiver has been closed
     */
    public boolean closed() {
        return inner.isReleased();
    }

    /**
     * Answer a new receiver that has already seen the current value, so its
     * first {@link Receiver#recv()} waits for the next broadcast
     *
     * @return empty if no receiver remains and the channel is gone
     */
    public Optional<Receiver<T>> subscribe() {
        if (!inner.tryRetain()) {
            return Optional.empty();
        }
        final var current = Inner.published(inner.version.get());
        log.trace("Subscribed to: {} at version: {}", inner, current);
        return Optional.of(new Receiver<>(inner, current));
    }

    /**
     * Block until every receiver has been closed
     */
    public void waitClosed() throws InterruptedException {
        inner.checkNotBorrowing("waitClosed");
        try (var lock = UniqueLock.exclusive(inner.lock)) {
            while (!inner.isReleased()) {
                lock.await(inner.drained);
            }
        }
    }

    private SendResult failed(String reason) {
        log.trace("Broadcast failed on: {} reason: {}", inner, reason);
        if (inner.metrics != null) {
            inner.metrics.failedSends().mark();
        }
        return SendResult.FAILURE;
    }
}
