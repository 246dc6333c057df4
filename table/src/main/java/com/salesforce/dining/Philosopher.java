/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.dining;

import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codahale.metrics.Timer;
import com.salesforce.dining.utils.Utils;

/**
 * One philosopher: hungry, eat holding both forks, release them, think, repeat. Protocol agnostic; all
 * synchronization lives in the {@link Table}.
 * <p>
 * Forks are only ever held inside {@link #dine()}, which always hands them back. Should handing them back fail, the
 * table is poisoned.
 */
public class Philosopher implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Philosopher.class);

    private volatile boolean      holding;
    private final int             id;
    private final ForkLedger      ledger;
    private final AtomicLong      longestWait = new AtomicLong();
    private final AtomicInteger   meals       = new AtomicInteger();
    private final DiningMetrics   metrics;
    private final Parameters      parameters;
    private volatile Phase        phase       = Phase.THINKING;
    private final Table           table;

    public Philosopher(int id, Table table, Parameters parameters, ForkLedger ledger, DiningMetrics metrics) {
        this.id = id;
        this.table = table;
        this.parameters = parameters;
        this.ledger = ledger;
        this.metrics = metrics;
    }

    @Override
    public Integer call() throws Exception {
        log.debug("Philosopher: {} seated at: {}", id, table.getClass().getSimpleName());
        try {
            while (parameters.isUnbounded() || meals.get() < parameters.cycles()) {
                if (Thread.currentThread().isInterrupted()) {
                    break;
                }
                dine();
                think();
            }
        } catch (InterruptedException e) {
            log.debug("Philosopher: {} interrupted after: {} meals", id, meals.get());
            cancelled();
        } catch (CancellationException e) {
            log.debug("Philosopher: {} stopped after: {} meals", id, meals.get());
            cancelled();
        } catch (Throwable t) {
            log.error("Philosopher: {} failed in: {} after: {} meals", id, phase, meals.get(), t);
            if (metrics != null) {
                metrics.failure();
            }
            if (holding) {
                table.poison(t);
            }
            throw t;
        } finally {
            phase = Phase.THINKING;
        }
        log.debug("Philosopher: {} finished: {} meals", id, meals.get());
        return meals.get();
    }

    public int getId() {
        return id;
    }

    /**
     * @return the longest time, in nanoseconds, this philosopher has waited for its forks
     */
    public long getLongestWait() {
        return longestWait.get();
    }

    public int getMeals() {
        return meals.get();
    }

    public Phase getPhase() {
        return phase;
    }

    private void cancelled() {
        if (metrics != null) {
            metrics.cancelled();
        }
    }

    private void dine() throws InterruptedException {
        phase = Phase.HUNGRY;
        final Timer.Context timer = metrics == null ? null : metrics.hungry().time();
        final long start = System.nanoTime();
        table.acquirePair(id);
        holding = true;
        final long waited = System.nanoTime() - start;
        longestWait.accumulateAndGet(waited, Math::max);
        if (timer != null) {
            timer.stop();
        }
        final int left = table.left(id);
        final int right = table.right(id);
        try {
            ledger.claim(id, left, right);
            try {
                phase = Phase.EATING;
                log.trace("Philosopher: {} eating after waiting: {}ms", id, waited / 1_000_000);
                Utils.sleep(parameters.eatDuration());
                meals.incrementAndGet();
                if (metrics != null) {
                    metrics.meal(id);
                }
            } finally {
                ledger.surrender(id, left, right);
            }
        } finally {
            phase = Phase.THINKING;
            table.releasePair(id);
            holding = false;
        }
    }

    private void think() throws InterruptedException {
        log.trace("Philosopher: {} thinking", id);
        Utils.sleep(parameters.thinkDuration());
    }
}
