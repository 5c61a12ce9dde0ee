/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.courier.channels.oneshot;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codahale.metrics.Timer;
import com.salesforce.courier.sync.ScopedLock;
import com.salesforce.courier.sync.UniqueLock;

/**
 * The receiving half of a oneshot channel
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
     * Close the channel from the receiving side. Idempotent. After this no send
     * can succeed and any value not yet taken is discarded; a value sent
     * concurrently with the close may still have been accepted, so a graceful
     * shutdown calls {@link #tryRecv()} before closing.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        State prev;
        try (var guard = ScopedLock.exclusive(inner.lock)) {
            prev = inner.closeReceiver();
        }
        log.debug("Receiver closed: {} prev: {}", inner, prev);
        if (inner.metrics != null) {
            inner.metrics.closed().mark();
        }
    }

    public boolean isClosed() {
        if (closed.get()) {
            return true;
        }
        try (var guard = ScopedLock.exclusive(inner.lock)) {
            return inner.state.isClosed();
        }
    }

    /**
     * Wait for the value
     *
     * @return the value, or empty if the channel closed without one
     */
    public Optional<T> recv() throws InterruptedException {
        if (closed.get()) {
            return Optional.empty();
        }
        try (var lock = UniqueLock.exclusive(inner.lock)) {
            if (inner.state.isClosed()) {
                return Optional.empty();
            }
            if (!inner.state.hasValue()) {
                inner.swap(State.WAIT_SEND);
                log.trace("Awaiting value on: {}", inner);
                final Timer.Context timer = inner.metrics == null ? null : inner.metrics.blocked().time();
                try {
                    while (inner.state == State.WAIT_SEND) {
                        lock.await(inner.rxCv);
                    }
                } catch (InterruptedException e) {
                    if (inner.state == State.WAIT_SEND) {
                        inner.swap(State.INIT);
                    }
                    throw e;
                } finally {
                    if (timer != null) {
                        timer.stop();
                    }
                }
                if (!inner.state.hasValue()) {
                    log.trace("Closed while awaiting value on: {}", inner);
                    return Optional.empty();
                }
            }
            return Optional.of(received(inner.take()));
        }
    }

    /**
     * Take the value if it has been sent, without blocking
     */
    public Optional<T> tryRecv() {
        if (closed.get()) {
            return Optional.empty();
        }
        try (var guard = ScopedLock.exclusive(inner.lock)) {
            if (!inner.state.hasValue()) {
                return Optional.empty();
            }
            return Optional.of(received(inner.take()));
        }
    }

    private T received(T value) {
        log.trace("Received on: {}", inner);
        if (inner.metrics != null) {
            inner.metrics.received().mark();
        }
        return value;
    }
}
