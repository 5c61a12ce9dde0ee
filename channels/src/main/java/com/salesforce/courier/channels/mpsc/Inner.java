/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.courier.channels.mpsc;

import java.util.ArrayDeque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.salesforce.courier.channels.ChannelMetrics;
import com.salesforce.courier.sync.RefCounted;
import com.salesforce.courier.sync.ScopedLock;

/**
 * State shared by the senders and the receiver of an mpsc channel. The buffer
 * and the closed flags are guarded by {@link #lock}, always taken exclusively.
 *
 * @author hal.hildebrand
 *
 */
final class Inner<T> {
    private static final Logger log = LoggerFactory.getLogger(Inner.class);

    final ArrayDeque<T>          buffer;
    final int                    capacity;
    final String                 label;
    final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    final ChannelMetrics         metrics;
    final Condition              nonEmpty;
    final Condition              nonFull;
    boolean                      receiverClosed;
    /**
     * One reference per live sender handle
     */
    final RefCounted             senders;
    boolean                      sendersClosed;

    Inner(int capacity, String label, ChannelMetrics metrics) {
        this.capacity = capacity;
        this.label = label;
        this.metrics = metrics;
        buffer = new ArrayDeque<>(Math.min(capacity, 1024));
        nonEmpty = lock.writeLock().newCondition();
        nonFull = lock.writeLock().newCondition();
        senders = new RefCounted() {
            @Override
            protected void deallocate() {
                try (var guard = ScopedLock.exclusive(lock)) {
                    sendersClosed = true;
                    nonEmpty.signalAll();
                }
                log.debug("All senders closed on: {}", Inner.this);
            }
        };
    }

    boolean isFull() {
        return buffer.size() >= capacity;
    }

    @Override
    public String toString() {
        return "mpsc[" + label + "]";
    }
}
