/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.dining.hierarchy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.salesforce.dining.AbstractTable;
import com.salesforce.dining.Fork;

/**
 * Forks are totally ordered by index and every philosopher takes the lower indexed of its two forks first. The last
 * philosopher therefore takes fork 0 before fork N-1, which breaks the circular wait. Deadlock free, not starvation
 * free.
 */
public class ResourceHierarchyTable extends AbstractTable {
    private static final Logger log = LoggerFactory.getLogger(ResourceHierarchyTable.class);

    /**
     * @return the two fork indices of the philosopher, in the order they must be taken
     */
    public static int[] acquisitionOrder(int philosopher, int seats) {
        final int left = philosopher;
        final int right = (philosopher + 1) % seats;
        return new int[] { Math.min(left, right), Math.max(left, right) };
    }

    private volatile Fork[] forks;

    /**
     * @return the philosopher holding the fork, or {@link Fork#FREE}
     */
    public int holder(int fork) {
        return forks[fork].holder();
    }

    @Override
    protected void acquire(int philosopher) throws InterruptedException {
        final int[] order = acquisitionOrder(philosopher, seats());
        final Fork first = forks[order[0]];
        final Fork second = forks[order[1]];
        first.take(philosopher);
        log.trace("Philosopher: {} took first: {}", philosopher, first);
        boolean acquired = false;
        try {
            second.take(philosopher);
            acquired = true;
            log.trace("Philosopher: {} took second: {}", philosopher, second);
        } finally {
            if (!acquired) {
                first.put(philosopher);
                log.trace("Philosopher: {} abandoned second: {}, returned: {}", philosopher, second, first);
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
    }

    @Override
    protected void release(int philosopher) {
        final int[] order = acquisitionOrder(philosopher, seats());
        forks[order[1]].put(philosopher);
        forks[order[0]].put(philosopher);
    }

    @Override
    protected void shutdown() {
        for (Fork fork : forks) {
            fork.close();
        }
    }
}
