/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.courier.sync;

import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;

/**
 * A lock guard that may be unlocked and relocked explicitly, waited on, and
 * whose ownership may be transferred to a new guard. Closing releases the lock
 * if it is still owned.
 * <p>
 * Java locks are owned by the acquiring thread, so a transfer only moves the
 * guard between scopes of that thread.
 *
 * @author hal.hildebrand
 *
 */
public class UniqueLock implements AutoCloseable {

    /**
     * Answer a guard over the lock that has not yet acquired it
     */
    public static UniqueLock deferred(ReadWriteLock lock, Acquire mode) {
        return new UniqueLock(mode.of(requireNonNull(lock)), mode, false);
    }

    public static UniqueLock exclusive(ReadWriteLock lock) {
        return new UniqueLock(lock, Acquire.EXCLUSIVE);
    }

    public static UniqueLock shared(ReadWriteLock lock) {
        return new UniqueLock(lock, Acquire.SHARED);
    }

    private Lock          held;
    private final Acquire mode;
    private boolean       owned;

    public UniqueLock(ReadWriteLock lock, Acquire mode) {
        this(mode.of(requireNonNull(lock)), mode, true);
    }

    private UniqueLock(Lock held, Acquire mode, boolean acquire) {
        this.held = held;
        this.mode = requireNonNull(mode);
        if (acquire) {
            held.lock();
            owned = true;
        }
    }

    /**
     * Release the monitored lock and wait on the condition until signalled,
     * reacquiring the lock before returning. Callers re-check their predicate.
     */
    public void await(Condition condition) throws InterruptedException {
        checkCanWait();
        condition.await();
    }

    /**
     * Timed variant of {@link #await(Condition)}
     *
     * @return false if the timeout elapsed before a signal arrived
     */
    public boolean await(Condition condition, Duration timeout) throws InterruptedException {
        checkCanWait();
        return condition.awaitNanos(TimeUnit.NANOSECONDS.convert(timeout)) > 0;
    }

    @Override
    public void close() {
        if (held != null && owned) {
            owned = false;
            held.unlock();
        }
    }

    public void lock() {
        checkLive();
        if (owned) {
            throw new LockUsageException("Lock already owned");
        }
        held.lock();
        owned = true;
    }

    public Acquire mode() {
        return mode;
    }

    public boolean ownsLock() {
        return held != null && owned;
    }

    /**
     * Move this guard's lock and ownership state into a new guard. This guard
     * is left unlocked and inert; any further lock operation on it fails.
     */
    public UniqueLock transfer() {
        checkLive();
        var moved = new UniqueLock(held, mode, false);
        moved.owned = owned;
        held = null;
        owned = false;
        return moved;
    }

    public void unlock() {
        checkLive();
        if (!owned) {
            throw new LockUsageException("Lock not owned");
        }
        owned = false;
        held.unlock();
    }

    private void checkCanWait() {
        checkLive();
        if (!owned || mode != Acquire.EXCLUSIVE) {
            throw new LockUsageException("Waiting requires exclusive ownership, mode: " + mode + " owned: " + owned);
        }
    }

    private void checkLive() {
        if (held == null) {
            throw new LockUsageException("Lock has been transferred");
        }
    }
}
