/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.courier.channels.oneshot;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.salesforce.courier.channels.ChannelMetrics;

/**
 * State shared by the two handles of a oneshot channel. Every field is guarded
 * by {@link #lock}, always taken exclusively.
 *
 * @author hal.hildebrand
 *
 */
final class Inner<T> {
    final String                 label;
    final ReentrantReadWriteLock lock  = new ReentrantReadWriteLock();
    final ChannelMetrics         metrics;
    /** Signalled when a parked receiver may proceed */
    final Condition              rxCv  = lock.writeLock().newCondition();
    State                        state = State.INIT;
    /** Signalled when a sender parked in sendSync() may proceed */
    final Condition              txCv  = lock.writeLock().newCondition();
    T                            value;

    Inner(String label, ChannelMetrics metrics) {
        this.label = label;
        this.metrics = metrics;
    }

    /**
     * Close on behalf of the receiver. Any stored value is discarded.
     *
     * @return the state before closing
     */
    State closeReceiver() {
        if (state == State.CLOSED_RECV) {
            return state;
        }
        value = null;
        return wake(swap(State.CLOSED));
    }

    /**
     * Close on behalf of the sender. A value already handed off with sendAsync()
     * stays available to the receiver; one still parked in sendSync() is
     * withdrawn.
     *
     * @return the state before closing
     */
    State closeSender() {
        if (state.isClosed() || state == State.SENT) {
            return state;
        }
        value = null;
        return wake(swap(State.CLOSED));
    }

    State swap(State updated) {
        final var prev = state;
        state = updated;
        return prev;
    }

    /**
     * Take the stored value, completing the channel
     */
    T take() {
        final var taken = value;
        value = null;
        if (swap(State.CLOSED_RECV) == State.WAIT_RECV) {
            txCv.signal();
        }
        return taken;
    }

    @Override
    public String toString() {
        return "oneshot[" + label + "]";
    }

    private State wake(State prev) {
        switch (prev) {
        case WAIT_SEND:
            rxCv.signal();
            break;
        case WAIT_RECV:
            txCv.signal();
            break;
        default:
            break;
        }
        return prev;
    }
}
