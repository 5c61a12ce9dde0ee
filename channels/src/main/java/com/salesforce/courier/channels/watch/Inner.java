/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.courier.channels.watch;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.salesforce.courier.channels.ChannelMetrics;
import com.salesforce.courier.sync.LockUsageException;
import com.salesforce.courier.sync.RefCounted;
import com.salesforce.courier.sync.ScopedLock;

/**
 * The value slot of a watch channel. The reference count tracks receiver
 * handles only; the sender resolves its reference with {@link #tryRetain()}, so
 * the slot is released as soon as the last receiver goes away.
 * <p>
 * The low bit of {@link #version} is the closed flag; every broadcast adds 2.
 * The value and the version only change together, under the exclusive side of
 * {@link #lock}.
 *
 * @author hal.hildebrand
 *
 */
final class Inner<T> extends RefCounted {
    static final long           CLOSED = 1L;
    private static final Logger log    = LoggerFactory.getLogger(Inner.class);

    static boolean isClosed(long version) {
        return (version & CLOSED) != 0;
    }

    static long published(long version) {
        return version & ~CLOSED;
    }

    /** Signalled on every broadcast and on sender close */
    final Condition              changed;
    final UnaryOperator<T>       copier;
    /** Signalled when the last receiver is released */
    final Condition              drained;
    final String                 label;
    final ReentrantReadWriteLock lock    = new ReentrantReadWriteLock();
    final ChannelMetrics         metrics;
    T                            value;
    final AtomicLong             version = new AtomicLong();

    Inner(T initial, UnaryOperator<T> copier, String label, ChannelMetrics metrics) {
        this.value = initial;
        this.copier = copier;
        this.label = label;
        this.metrics = metrics;
        changed = lock.writeLock().newCondition();
        drained = lock.writeLock().newCondition();
    }

    /**
     * The exclusive side of {@link #lock} cannot be taken while this thread
     * still holds the shared side through a {@link Borrow}
     */
    void checkNotBorrowing(String operation) {
        if (lock.getReadHoldCount() > 0) {
            throw new LockUsageException("Cannot " + operation + " while borrowing from: " + this);
        }
    }

    @Override
    public String toString() {
        return "watch[" + label + "]";
    }

    @Override
    protected void deallocate() {
        try (var guard = ScopedLock.exclusive(lock)) {
            value = null;
            drained.signalAll();
        }
        log.debug("All receivers closed on: {}", this);
    }
}
