/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.courier.sync;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;

/**
 * The mode in which a guard takes a {@link ReadWriteLock}
 *
 * @author hal.hildebrand
 *
 */
public enum Acquire {
    EXCLUSIVE {
        @Override
        public Lock of(ReadWriteLock lock) {
            return lock.writeLock();
        }
    },
    SHARED {
        @Override
        public Lock of(ReadWriteLock lock) {
            return lock.readLock();
        }
    };

    /**
     * @return the side of the read/write lock this mode acquires
     */
    public abstract Lock of(ReadWriteLock lock);
}
