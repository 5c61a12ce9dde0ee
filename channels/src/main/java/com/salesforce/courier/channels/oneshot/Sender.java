/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.courier.channels.oneshot;

import static java.util.Objects.requireNonNull;

import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codahale.metrics.Timer;
import com.salesforce.courier.sync.ScopedLock;
import com.salesforce.courier.sync.UniqueLock;

/**
 * The sending half of a oneshot channel. At most one value is ever delivered;
 * closing the handle tells the receiver no value is coming.
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
     * Close the channel from the sending side. Idempotent. A value previously
     * handed off by {@link #sendAsync(Object)} remains available to the
     * receiver.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        State prev;
        try (var guard = ScopedLock.exclusive(inner.lock)) {
            prev = inner.closeSender();
        }
        log.debug("Sender closed: {} prev: {}", inner, prev);
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
     * Store the value for the receiver and return without waiting for it to be
     * taken.
     *
     * @return FAILURE if the channel is closed or already carries a value
     */
    public SendResult sendAsync(T value) {
        requireNonNull(value, "value");
        if (closed.get()) {
            return failed("handle closed");
        }
        try (var guard = ScopedLock.exclusive(inner.lock)) {
            if (!inner.state.acceptsSend()) {
                return failed(inner.state);
            }
            inner.value = value;
            if (inner.swap(State.SENT) == State.WAIT_SEND) {
                inner.rxCv.signal();
            }
        }
        return sent();
    }

    /**
     * Store the value and wait until the receiver takes it or the channel is
     * closed.
     *
     * @return SUCCESS only if the receiver took the value
     */
    public SendResult sendSync(T value) throws InterruptedException {
        requireNonNull(value, "value");
        if (closed.get()) {
            return failed("handle closed");
        }
        try (var lock = UniqueLock.exclusive(inner.lock)) {
            if (!inner.state.acceptsSend()) {
                return failed(inner.state);
            }
            inner.value = value;
            if (inner.state == State.WAIT_SEND) {
                inner.swap(State.SENT);
                inner.rxCv.signal();
                return sent();
            }
            inner.swap(State.WAIT_RECV);
            log.trace("Awaiting receipt on: {}", inner);
            final Timer.Context timer = inner.metrics == null ? null : inner.metrics.blocked().time();
            try {
                while (inner.state == State.WAIT_RECV) {
                    lock.await(inner.txCv);
                }
            } catch (InterruptedException e) {
                if (inner.state == State.WAIT_RECV) {
                    inner.value = null;
                    inner.swap(State.CLOSED);
                }
                throw e;
            } finally {
                if (timer != null) {
                    timer.stop();
                }
            }
            return inner.state == State.CLOSED_RECV ? sent() : failed(inner.state);
        }
    }

    private SendResult failed(Object reason) {
        log.trace("Send failed on: {} reason: {}", inner, reason);
        if (inner.metrics != null) {
            inner.metrics.failedSends().mark();
        }
        return SendResult.FAILURE;
    }

    private SendResult sent() {
        log.trace("Sent on: {}", inner);
        if (inner.metrics != null) {
            inner.metrics.sent().mark();
        }
        return SendResult.SUCCESS;
    }
}
