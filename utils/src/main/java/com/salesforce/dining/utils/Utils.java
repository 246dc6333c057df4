/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.dining.utils;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

public class Utils {

    /**
     * Sleep for the duration, a zero or negative duration returns immediately
     */
    public static void sleep(Duration duration) throws InterruptedException {
        if (duration.isZero() || duration.isNegative()) {
            if (Thread.interrupted()) {
                throw new InterruptedException();
            }
            return;
        }
        TimeUnit.NANOSECONDS.sleep(duration.toNanos());
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

    private Utils() {
    }
}
