/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.courier.channels.oneshot;

/**
 * Lifecycle of a oneshot channel. {@link #CLOSED} and {@link #CLOSED_RECV} are
 * terminal.
 *
 * @author hal.hildebrand
 *
 */
enum State {
    /** Closed without the value reaching the receiver */
    CLOSED,
    /** The value was received */
    CLOSED_RECV,
    INIT,
    /** Value stored, nobody parked */
    SENT,
    /** Receiver parked in recv(), no value yet */
    WAIT_SEND,
    /** Value stored, sender parked in sendSync() until it is taken */
    WAIT_RECV;

    boolean acceptsSend() {
        return this == INIT || this == WAIT_SEND;
    }

    boolean hasValue() {
        return this == SENT || this == WAIT_RECV;
    }

    boolean isClosed() {
        return this == CLOSED || this == CLOSED_RECV;
    }
}
