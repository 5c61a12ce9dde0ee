/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.courier.channels.watch;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import java.util.function.UnaryOperator;

import com.salesforce.courier.channels.ChannelMetrics;
import com.salesforce.courier.channels.Endpoints;

/**
 * A single slot channel broadcasting the latest value from one sender to any
 * number of receivers. The initial value counts as already seen by the first
 * receiver; it is visible through {@link Receiver#borrow()} and
 * {@link Receiver#recv()} waits for the first broadcast.
 *
 * @author hal.hildebrand
 *
 */
public final class Watch {

    public static class Builder<T> {
        private UnaryOperator<T> copier = UnaryOperator.identity();
        private T                initial;
        private String           label  = "watch";
        private ChannelMetrics   metrics;

        private Builder() {
        }

        public Endpoints<Sender<T>, Receiver<T>> build() {
            checkState(initial != null, "Initial value must be set");
            var inner = new Inner<T>(initial, copier, label, metrics);
            return new Endpoints<>(new Sender<>(inner), new Receiver<>(inner, 0L));
        }

        public UnaryOperator<T> getCopier() {
            return copier;
        }

        public T getInitial() {
            return initial;
        }

        public String getLabel() {
            return label;
        }

        public ChannelMetrics getMetrics() {
            return metrics;
        }

        /**
         * The function used by {@link Receiver#recv()} to copy the value out of the
         * channel. Identity by default, which suits immutable values.
         */
        public Builder<T> setCopier(UnaryOperator<T> copier) {
            this.copier = requireNonNull(copier);
            return this;
        }

        public Builder<T> setInitial(T initial) {
            this.initial = requireNonNull(initial);
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

    public static <T> Endpoints<Sender<T>, Receiver<T>> create(T initial) {
        return Watch.<T>newBuilder().setInitial(initial).build();
    }

    public static <T> Builder<T> newBuilder() {
        return new Builder<>();
    }

    private Watch() {
    }
}
