/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.courier.sync;

import static java.util.Objects.requireNonNull;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;

/**
 * Holds a lock for the extent of a try-with-resources block. The lock is taken
 * in the constructor and released by {@link #close()}; there is no way to hand
 * the ownership to another guard.
 *
 * <pre>
 * try (var guard = ScopedLock.exclusive(lock)) {
 *     // critical section
 * }
 * </pre>
 *
 * @author hal.hildebrand
 *
 */
public final class ScopedLock implements AutoCloseable {

    public static ScopedLock exclusive(ReadWriteLock lock) {
        return new ScopedLock(lock, Acquire.EXCLUSIVE);
    }

    public static ScopedLock shared(ReadWriteLock lock) {
        return new ScopedLock(lock, Acquire.SHARED);
    }

    private final Lock    held;
    private final Acquire mode;
    private boolean       released;

    public ScopedLock(ReadWriteLock lock, Acquire mode) {
        this.mode = requireNonNull(mode);
        this.held = mode.of(requireNonNull(lock));
        held.lock();
    }

    @Override
    public void close() {
        if (released) {
            return;
        }
        released = true;
        held.unlock();
    }

    public Acquire mode() {
        return mode;
    }
}
