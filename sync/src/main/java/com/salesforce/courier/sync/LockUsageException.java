/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.courier.sync;

/**
 * Raised when a lock guard is used against its contract: locking an owned
 * guard, unlocking an unowned one, waiting without exclusive ownership, or
 * touching a guard whose lock was transferred away.
 *
 * @author hal.hildebrand
 *
 */
public class LockUsageException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    public LockUsageException(String message) {
        super(message);
    }
}
