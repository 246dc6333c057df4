/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.dining;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicIntegerArray;

/**
 * Independent record of who eats with which forks, kept by the philosophers themselves rather than by any protocol.
 * Detects a fork claimed by two philosophers at once.
 */
public class ForkLedger {

    private final AtomicInteger      eating = new AtomicInteger();
    private final AtomicIntegerArray holders;
    private final AtomicInteger      peak   = new AtomicInteger();

    public ForkLedger(int seats) {
        holders = new AtomicIntegerArray(seats);
        for (int i = 0; i < seats; i++) {
            holders.set(i, Fork.FREE);
        }
    }

    /**
     * Record the philosopher as eating with both forks
     *
     * @throws StateCorruptionException if either fork is already claimed
     */
    public void claim(int philosopher, int left, int right) {
        claim(philosopher, left);
        try {
            claim(philosopher, right);
        } catch (StateCorruptionException e) {
            holders.compareAndSet(left, philosopher, Fork.FREE);
            throw e;
        }
        peak.accumulateAndGet(eating.incrementAndGet(), Math::max);
    }

    public int eating() {
        return eating.get();
    }

    public int holder(int fork) {
        return holders.get(fork);
    }

    /**
     * @return the most philosophers ever recorded eating at once
     */
    public int peakEating() {
        return peak.get();
    }

    public void surrender(int philosopher, int left, int right) {
        eating.decrementAndGet();
        surrender(philosopher, right);
        surrender(philosopher, left);
    }

    private void claim(int philosopher, int fork) {
        if (!holders.compareAndSet(fork, Fork.FREE, philosopher)) {
            throw new StateCorruptionException("Fork: " + fork + " claimed by: " + philosopher + " is held by: "
            + holders.get(fork));
        }
    }

    private void surrender(int philosopher, int fork) {
        if (!holders.compareAndSet(fork, philosopher, Fork.FREE)) {
            throw new StateCorruptionException("Fork: " + fork + " surrendered by: " + philosopher + " is held by: "
            + holders.get(fork));
        }
    }
}
