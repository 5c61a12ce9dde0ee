/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.courier.channels;

import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;

/**
 * @author hal.hildebrand
 *
 */
public interface ChannelMetrics {

    String BLOCKED      = "blocked";
    String CLOSED       = "closed";
    String FAILED_SENDS = "send.failed";
    String RECEIVED     = "received";
    String SENT         = "sent";
    String TIMEOUTS     = "timeouts";

    /**
     * Time spent parked in blocking send and receive operations
     */
    Timer blocked();

    Meter closed();

    Meter failedSends();

    Meter received();

    Meter sent();

    Meter timeouts();

}
