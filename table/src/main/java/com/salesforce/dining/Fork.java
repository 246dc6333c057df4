/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.dining;

import java.util.concurrent.CancellationException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * An exclusively held fork guarded by its own lock. The lock is held only while the hold state changes, never while
 * a philosopher waits for another fork.
 */
public class Fork {
    public static final int FREE = -1;

    private boolean             closed;
    private int                 holder   = FREE;
    private final int           id;
    private final ReentrantLock lock     = new ReentrantLock();
    private final Condition     released = lock.newCondition();

    public Fork(int id) {
        this.id = id;
    }

    /**
     * Wake every waiter; all later takes fail with {@link CancellationException}. A held fork may still be put back.
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
            released.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the philosopher holding this fork, or {@link #FREE}
     */
    public int holder() {
        lock.lock();
        try {
            return holder;
        } finally {
            lock.unlock();
        }
    }

    public int id() {
        return id;
    }

    public void put(int philosopher) {
        lock.lock();
        try {
            if (holder != philosopher) {
                throw new StateCorruptionException("Philosopher: " + philosopher + " returning fork: " + id
                + " held by: " + holder);
            }
            holder = FREE;
            released.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Block until the fork is free and take it.
     */
    public void take(int philosopher) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            if (holder == philosopher) {
                throw new StateCorruptionException("Philosopher: " + philosopher + " already holds fork: " + id);
            }
            while (!closed && holder != FREE) {
                released.await();
            }
            if (closed) {
                throw new CancellationException("Fork: " + id + " closed");
            }
            holder = philosopher;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "Fork[" + id + "]";
    }
}
