/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.courier.channels;

import static com.codahale.metrics.MetricRegistry.name;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

/**
 * @author hal.hildebrand
 *
 */
public class ChannelMetricsImpl implements ChannelMetrics {
    private final Timer blocked;
    private final Meter closed;
    private final Meter failedSends;
    private final Meter received;
    private final Meter sent;
    private final Meter timeouts;

    public ChannelMetricsImpl(String prefix, MetricRegistry registry) {
        blocked = registry.timer(name(prefix, BLOCKED));
        closed = registry.meter(name(prefix, CLOSED));
        failedSends = registry.meter(name(prefix, FAILED_SENDS));
        received = registry.meter(name(prefix, RECEIVED));
        sent = registry.meter(name(prefix, SENT));
        timeouts = registry.meter(name(prefix, TIMEOUTS));
    }

    @Override
    public Timer blocked() {
        return blocked;
    }

    @Override
    public Meter closed() {
        return closed;
    }

    @Override
    public Meter failedSends() {
        return failedSends;
    }

    @Override
    public Meter received() {
        return received;
    }

    @Override
    public Meter sent() {
        return sent;
    }

    @Override
    public Meter timeouts() {
        return timeouts;
    }
}
