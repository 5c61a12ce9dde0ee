/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.courier.channels.watch;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codahale.metrics.Timer;
import com.salesforce.courier.sync.LockUsageException;
import com.salesforce.courier.sync.UniqueLock;

/**
 * An observer of a watch channel. Each receiver remembers the version it last
 * saw; {@link #recv()} waits for a newer one. Intermediate values may be
 * skipped.
 * <p>
 * A receiver handle is meant for one thread at a time; {@link #clone()} one
 * for each consumer.
 *
 * @author hal.hildebrand
 *
 */
public class Receiver<T> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Receiver.class);

    private final AtomicBoolean closed = new AtomicBoolean();
    private final Inner<T>      inner;
    private volatile long       version;

    Receiver(Inner<T> inner, long version) {
        this.inner = inner;
        this.version = version;
    }

    /**
     * Answer a read only view of the current value. The view holds the shared
     * lock until closed and blocks broadcasts meanwhile, so keep it short.
     */
    public Borrow<T> borrow() {
        if (closed.get()) {
            throw new IllegalStateException("Receiver is closed: " + inner);
        }
        return new Borrow<>(inner, UniqueLock.shared(inner.lock), version);
    }

    /**
     * Answer a new receiver that has seen the same version as this one
     *
     * @throws IllegalStateException if this handle is closed
     */
    @Override
    public Receiver<T> clone() {
        if (closed.get()) {
            throw new IllegalStateException("Receiver is closed: " + inner);
        }
        inner.retain();
        return new Receiver<>(inner, version);
    }

    @Override
    public void close() {
        inner.checkNotBorrowing("close");
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.debug("Receiver closed on: {} receivers: {}", inner, inner.refCnt() - 1);
        if (inner.metrics != null) {
            inner.metrics.closed().mark();
        }
        inner.release();
    }

    /**
     * @return true if a value newer than the last one received has been
     *         broadcast
     */
    public boolean hasChanged() {
        return !closed.get() && Inner.published(inner.version.get()) != version;
    }

    /**
     * Wait for a value newer than the last one this receiver saw and answer a
     * copy of it. A value broadcast just before the sender closed is still
     * delivered; closure is reported on the following call.
     *
     * @return the newest value, or empty once the sender is closed and nothing
     *         newer remains
     * @throws LockUsageException if the calling thread holds an open
     *         {@link Borrow}
     */
    public Optional<T> recv() throws InterruptedException {
        inner.checkNotBorrowing("recv");
        if (closed.get()) {
            return Optional.empty();
        }
        final UniqueLock reading;
        final long observed;
        try (var lock = UniqueLock.exclusive(inner.lock)) {
            var current = inner.version.get();
            if (Inner.published(current) == version) {
                if (Inner.isClosed(current)) {
                    return Optional.empty();
                }
                final Timer.Context timer = inner.metrics == null ? null : inner.metrics.blocked().time();
                try {
                    while (Inner.published(current) == version && !Inner.isClosed(current)) {
                        lock.await(inner.changed);
                        current = inner.version.get();
                    }
                } finally {
                    if (timer != null) {
                        timer.stop();
                    }
                }
                if (Inner.published(current) == version) {
                    log.trace("Closed while awaiting change on: {}", inner);
                    return Optional.empty();
                }
            }
            observed = Inner.published(current);
            // downgrade, so the copy runs alongside other readers
            reading = UniqueLock.shared(inner.lock);
        }
        try (reading) {
            final var copy = inner.copier.apply(inner.value);
            version = observed;
            log.trace("Received on: {} version: {}", inner, observed);
            if (inner.metrics != null) {
                inner.metrics.received().mark();
            }
            return Optional.of(copy);
        }
    }
}
