/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.courier.channels.oneshot;

import static java.util.Objects.requireNonNull;

import com.salesforce.courier.channels.ChannelMetrics;
import com.salesforce.courier.channels.Endpoints;

/**
 * A single use channel carrying at most one value from one sender to one
 * receiver.
 *
 * <pre>
 * var channel = Oneshot.&lt;Integer&gt;create();
 * channel.sender().sendAsync(42);
 * channel.receiver().tryRecv(); // Optional[42]
 * </pre>
 *
 * @author hal.hildebrand
 *
 */
public final class Oneshot {

    public static class Builder<T> {
        private String         label = "oneshot";
        private ChannelMetrics metrics;

        private Builder() {
        }

        public Endpoints<Sender<T>, Receiver<T>> build() {
            var inner = new Inner<T>(label, metrics);
            return new Endpoints<>(new Sender<>(inner), new Receiver<>(inner));
        }

        public String getLabel() {
            return label;
        }

        public ChannelMetrics getMetrics() {
            return metrics;
        }

        public Builder<T> setLabel(String label) {
            this.label = requireNonNull(label);
            return this;
        }

        public Builder<T> setMetrics(ChannelMetrics metrics) {
            this.metrics = metrics;
            return this;
        }
    }

    public static <T> Endpoints<Sender<T>, Receiver<T>> create() {
        return Oneshot.<T>newBuilder().build();
    }

    public static <T> Builder<T> newBuilder() {
        return new Builder<>();
    }

    private Oneshot() {
    }
}
