/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.courier.channels.watch;

import com.salesforce.courier.sync.UniqueLock;

/**
 * A read only view of a watch channel's current value, holding the shared lock
 * until closed
 *
 * <pre>
 * try (var borrowed = receiver.borrow()) {
 *     render(borrowed.get());
 * }
 * </pre>
 *
 * @author hal.hildebrand
 *
 */
public final class Borrow<T> implements AutoCloseable {
    private final UniqueLock guard;
    private final Inner<T>   inner;
    private final long       seen;

    Borrow(Inner<T> inner, UniqueLock guard, long seen) {
        this.inner = inner;
        this.guard = guard.transfer();
        this.seen = seen;
    }

    @Override
    public void close() {
        guard.close();
    }

    /**
     * @throws IllegalStateException if the view has been closed
     */
    public T get() {
        if (!guard.ownsLock()) {
            throw new IllegalStateException("Borrow is closed: " + inner);
        }
        return inner.value;
    }

    /**
     * @return true if the borrowed value is newer than the one last received by
     *         the borrowing receiver
     */
    public boolean hasChanged() {
        return Inner.published(inner.version.get()) != seen;
    }
}
