/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.courier.channels.mpsc;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.salesforce.courier.channels.ChannelMetrics;
import com.salesforce.courier.channels.Endpoints;

/**
 * A bounded FIFO channel from any number of senders to a single receiver
 *
 * @author hal.hildebrand
 *
 */
public final class Mpsc {

    public static class Builder<T> {
        private int            capacity = DEFAULT_CAPACITY;
        private String         label    = "mpsc";
        private ChannelMetrics metrics;

        private Builder() {
        }

        public Endpoints<Sender<T>, Receiver<T>> build() {
            checkArgument(capacity > 0, "Capacity must be positive: %s", capacity);
            var inner = new Inner<T>(capacity, label, metrics);
            return new Endpoints<>(new Sender<>(inner), new Receiver<>(inner));
        }

        public int getCapacity() {
            return capacity;
        }

        public String getLabel() {
            return label;
        }

        public ChannelMetrics getMetrics() {
            return metrics;
        }

        public Builder<T> setCapacity(int capacity) {
            checkArgument(capacity > 0, "Capacity must be positive: %s", capacity);
            this.capacity = capacity;
            return this;
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

    public static final int DEFAULT_CAPACITY = 100;

    public static <T> Endpoints<Sender<T>, Receiver<T>> create(int capacity) {
        return Mpsc.<T>newBuilder().setCapacity(capacity).build();
    }

    public static <T> Builder<T> newBuilder() {
        return new Builder<>();
    }

    private Mpsc() {
    }
}
