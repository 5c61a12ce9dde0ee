/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.courier.channels.mpsc;

/**
 * Outcome of a send. {@link #TIMEOUT} means the deadline passed while the
 * buffer stayed full; the channel may still be usable. {@link #FAILURE} means
 * the buffer was full on a non blocking send, or the channel is closed.
 *
 * @author hal.hildebrand
 *
 */
public enum SendResult {
    FAILURE, SUCCESS, TIMEOUT;
}
