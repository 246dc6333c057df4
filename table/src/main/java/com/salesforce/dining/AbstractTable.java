/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.dining;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lifecycle, argument checking and poisoning common to all tables.
 */
abstract public class AbstractTable implements Table {
    private static final Logger log = LoggerFactory.getLogger(AbstractTable.class);

    private final AtomicReference<Throwable> poisoned = new AtomicReference<>();
    private volatile int                     seats;
    private final AtomicBoolean              started  = new AtomicBoolean();
    private final AtomicBoolean              stopped  = new AtomicBoolean();

    @Override
    public void acquirePair(int philosopher) throws InterruptedException {
        checkSeat(philosopher);
        checkOpen();
        try {
            acquire(philosopher);
        } catch (CancellationException e) {
            // a poisoned table reports the corruption rather than a cooperative stop
            checkOpen();
            throw e;
        }
    }

    @Override
    public boolean isStopped() {
        return stopped.get();
    }

    @Override
    public void poison(Throwable cause) {
        if (poisoned.compareAndSet(null, cause)) {
            log.error("Table: {} poisoned", getClass().getSimpleName(), cause);
            stop();
        }
    }

    @Override
    public void releasePair(int philosopher) {
        checkSeat(philosopher);
        release(philosopher);
    }

    @Override
    public int seats() {
        return seats;
    }

    @Override
    public void start(int seats) {
        if (seats < 2) {
            throw new ConfigurationException("A table requires at least 2 seats: " + seats);
        }
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Table already started");
        }
        initialize(seats);
        this.seats = seats;
        log.debug("Started: {} seats: {}", getClass().getSimpleName(), seats);
    }

    @Override
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        log.debug("Stopping: {}", getClass().getSimpleName());
        if (started.get()) {
            shutdown();
        }
    }

    /**
     * Block until both forks are held. Called only with a valid seat on an open table.
     */
    protected abstract void acquire(int philosopher) throws InterruptedException;

    /**
     * Throw if the table can no longer grant forks
     */
    protected void checkOpen() {
        final var cause = poisoned.get();
        if (cause != null) {
            throw new StateCorruptionException("Table has been poisoned", cause);
        }
        if (stopped.get()) {
            throw new CancellationException("Table has been stopped");
        }
    }

    protected void checkSeat(int philosopher) {
        final int current = seats;
        if (current == 0) {
            throw new IllegalStateException("Table has not been started");
        }
        if (philosopher < 0 || philosopher >= current) {
            throw new IllegalArgumentException("No such seat: " + philosopher + " of: " + current);
        }
    }

    protected abstract void initialize(int seats);

    protected abstract void release(int philosopher);

    protected abstract void shutdown();
}
