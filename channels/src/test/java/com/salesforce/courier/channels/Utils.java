/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.courier.channels;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * @author hal.hildebrand
 *
 */
public class Utils {

    /**
     * Run the task on a new thread, completing the future with its result
     */
    public static <T> CompletableFuture<T> fork(String name, Callable<T> task) {
        var result = new CompletableFuture<T>();
        var t = new Thread(() -> {
            try {
                result.complete(task.call());
            } catch (Throwable e) {
                result.completeExceptionally(e);
            }
        }, name);
        t.setDaemon(true);
        t.start();
        return result;
    }

    /**
     * Answer true once some thread with the given name is parked
     */
    public static boolean waitForParked(String name) {
        return waitForCondition(5_000, 5, () -> Thread.getAllStackTraces()
                                                      .keySet()
                                                      .stream()
                                                      .filter(t -> t.getName().equals(name))
                                                      .anyMatch(t -> t.getState() == Thread.State.WAITING ||
                                                                     t.getState() == Thread.State.TIMED_WAITING));
    }

    public static boolean waitForCondition(int maxWaitTime, final int sleepTime, Supplier<Boolean> condition) {
        long endTime = System.currentTimeMillis() + maxWaitTime;
        while (System.currentTimeMillis() <= endTime) {
            if (condition.get()) {
                return true;
            }
            try {
                Thread.sleep(sleepTime);
            } catch (InterruptedException e) {
                return false;
            }
        }
        return false;
    }

    public static boolean waitForCondition(int maxWaitTime, Supplier<Boolean> condition) {
        return waitForCondition(maxWaitTime, 100, condition);
    }
}
