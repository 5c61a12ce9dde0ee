/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.courier.sync;

import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reference count over state shared between channel handles. The count starts
 * at one, owned by the creator. Strong holders {@link #retain()} and
 * {@link #release()}; a non-owning holder resolves its reference with
 * {@link #tryRetain()}, which fails once the last strong holder has released.
 * {@link #deallocate()} runs exactly once, on the release that drops the count
 * to zero.
 *
 * @author hal.hildebrand
 *
 */
abstract public class RefCounted {
    private static final Logger log = LoggerFactory.getLogger(RefCounted.class);

    private final AtomicInteger refCnt = new AtomicInteger(1);

    public boolean isReleased() {
        return refCnt.get() == 0;
    }

    public int refCnt() {
        return refCnt.get();
    }

    /**
     * Drop one strong reference
     *
     * @return true if this was the last reference and the state was deallocated
     */
    public boolean release() {
        for (;;) {
            final var current = refCnt.get();
            if (current == 0) {
                throw new IllegalStateException("Double release: already deallocated");
            }
            if (refCnt.compareAndSet(current, current - 1)) {
                if (current > 1) {
                    return false;
                }
                break;
            }
        }
        log.trace("Deallocating: {}", this);
        deallocate();
        return true;
    }

    /**
     * Add a strong reference
     *
     * @throws IllegalStateException if the state has already been deallocated
     */
    public void retain() {
        if (!tryRetain()) {
            throw new IllegalStateException("Already deallocated");
        }
    }

    /**
     * Add a strong reference if the state is still live
     *
     * @return false if the state has already been deallocated
     */
    public boolean tryRetain() {
        for (;;) {
            final var current = refCnt.get();
            if (current == 0) {
                return false;
            }
            if (refCnt.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    /**
     * Invoked once the last strong reference has been released
     */
    protected abstract void deallocate();
}
