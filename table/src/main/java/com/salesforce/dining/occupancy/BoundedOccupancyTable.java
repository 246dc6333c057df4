/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.dining.occupancy;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.salesforce.dining.AbstractTable;
import com.salesforce.dining.Fork;

/**
 * At most N-1 philosophers are admitted to the table at once, so at least one is always thinking and the wait for
 * graph can never close around all N forks. Admitted philosophers take their forks naively, left then right.
 */
public class BoundedOccupancyTable extends AbstractTable {
    private static final Logger log = LoggerFactory.getLogger(BoundedOccupancyTable.class);

    private final AtomicInteger admitted = new AtomicInteger();
    private volatile Fork[]     forks;
    private volatile Semaphore  gate;
    private final AtomicInteger peak     = new AtomicInteger();

    /**
     * @return the number of philosophers currently holding an admission permit
     */
    public int admitted() {
        return admitted.get();
    }

    /**
     * @return the permits the gate was created with
     */
    public int capacity() {
        return seats() - 1;
    }

    /**
     * @return the philosopher holding the fork, or {@link Fork#FREE}
     */
    public int holder(int fork) {
        return forks[fork].holder();
    }

    /**
     * @return the highest number of simultaneously admitted philosophers observed
     */
    public int peakAdmitted() {
        return peak.get();
    }

    @Override
    protected void acquire(int philosopher) throws InterruptedException {
        gate.acquire();
        boolean acquired = false;
        try {
            checkOpen();
            final int occupancy = admitted.incrementAndGet();
            peak.accumulateAndGet(occupancy, Math::max);
            log.trace("Admitted philosopher: {} occupancy: {}", philosopher, occupancy);
            try {
                takeForks(philosopher);
                acquired = true;
            } finally {
                if (!acquired) {
                    admitted.decrementAndGet();
                }
            }
        } finally {
            if (!acquired) {
                gate.release();
                log.trace("Philosopher: {} left without eating", philosopher);
            }
        }
    }

    @Override
    protected void initialize(int seats) {
        final var laid = new Fork[seats];
        for (int i = 0; i < seats; i++) {
            laid[i] = new Fork(i);
        }
        forks = laid;
        gate = new Semaphore(seats - 1, true);
    }

    @Override
    protected void release(int philosopher) {
        forks[right(philosopher)].put(philosopher);
        forks[left(philosopher)].put(philosopher);
        admitted.decrementAndGet();
        gate.release();
    }

    @Override
    protected void shutdown() {
        for (Fork fork : forks) {
            fork.close();
        }
        // waiters wake, observe the stop and hand their permit straight back
        gate.release(seats());
    }

    private void takeForks(int philosopher) throws InterruptedException {
        final Fork left = forks[left(philosopher)];
        final Fork right = forks[right(philosopher)];
        left.take(philosopher);
        boolean acquired = false;
        try {
            right.take(philosopher);
            acquired = true;
        } finally {
            if (!acquired) {
                left.put(philosopher);
            }
        }
    }
}
