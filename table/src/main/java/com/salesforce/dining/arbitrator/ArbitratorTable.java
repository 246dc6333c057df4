/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.dining.arbitrator;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Iterator;
import java.util.concurrent.CancellationException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.salesforce.dining.AbstractTable;
import com.salesforce.dining.Fork;
import com.salesforce.dining.StateCorruptionException;

/**
 * A waiter mediates every fork request. All fork state is owned by the waiter and mutated only under its single lock.
 * Free forks are handed out on request, except that the last free fork on the table is reserved for a right hand, so
 * that every philosopher can never end up holding only a left fork.
 * <p>
 * Pending requests are granted in FIFO order among those that can be granted.
 */
public class ArbitratorTable extends AbstractTable {

    private static class Request {
        private final int       fork;
        private boolean         granted;
        private final int       philosopher;
        private final Condition ready;
        private final Side      side;

        private Request(int philosopher, Side side, int fork, Condition ready) {
            this.philosopher = philosopher;
            this.side = side;
            this.fork = fork;
            this.ready = ready;
        }

        @Override
        public String toString() {
            return "Request[" + philosopher + ":" + side + " fork: " + fork + "]";
        }
    }

    private static final Logger log = LoggerFactory.getLogger(ArbitratorTable.class);

    private boolean              closed;
    private int                  free;
    private int[]                holders;
    private final ReentrantLock  lock    = new ReentrantLock();
    private final Deque<Request> pending = new ArrayDeque<>();

    /**
     * @return the number of forks not held by anyone
     */
    public int freeForks() {
        lock.lock();
        try {
            return free;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the philosopher holding the fork, or {@link Fork#FREE}
     */
    public int holder(int fork) {
        lock.lock();
        try {
            return holders[fork];
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the number of requests waiting to be granted
     */
    public int pendingRequests() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Return the fork held in the philosopher's hand to the waiter
     */
    public void release(int philosopher, Side side) {
        checkSeat(philosopher);
        final int fork = fork(philosopher, side);
        lock.lock();
        try {
            if (holders[fork] != philosopher) {
                throw new StateCorruptionException("Philosopher: " + philosopher + " returning " + side + " fork: "
                + fork + " held by: " + holders[fork]);
            }
            surrender(fork);
            log.trace("Philosopher: {} returned {} fork: {} free: {}", philosopher, side, fork, free);
            dispatch();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ask the waiter for the fork in the philosopher's hand, blocking until it is granted. If the wait is interrupted
     * or the table is stopped, the request is withdrawn and nothing remains held.
     */
    public void request(int philosopher, Side side) throws InterruptedException {
        checkSeat(philosopher);
        checkOpen();
        final int fork = fork(philosopher, side);
        lock.lockInterruptibly();
        try {
            if (closed) {
                throw new CancellationException("Waiter has been stopped");
            }
            if (holders[fork] == philosopher) {
                throw new StateCorruptionException("Philosopher: " + philosopher + " already holds fork: " + fork);
            }
            final var request = new Request(philosopher, side, fork, lock.newCondition());
            pending.addLast(request);
            dispatch();
            boolean complete = false;
            try {
                while (!request.granted) {
                    if (closed) {
                        throw new CancellationException("Waiter has been stopped");
                    }
                    request.ready.await();
                }
                complete = true;
            } finally {
                if (!complete) {
                    withdraw(request);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    protected void acquire(int philosopher) throws InterruptedException {
        request(philosopher, Side.LEFT);
        boolean acquired = false;
        try {
            request(philosopher, Side.RIGHT);
            acquired = true;
        } finally {
            if (!acquired) {
                release(philosopher, Side.LEFT);
            }
        }
    }

    @Override
    protected void initialize(int seats) {
        lock.lock();
        try {
            holders = new int[seats];
            Arrays.fill(holders, Fork.FREE);
            free = seats;
        } finally {
            lock.unlock();
        }
    }

    @Override
    protected void release(int philosopher) {
        release(philosopher, Side.RIGHT);
        release(philosopher, Side.LEFT);
    }

    @Override
    protected void shutdown() {
        lock.lock();
        try {
            closed = true;
            pending.forEach(r -> r.ready.signal());
        } finally {
            lock.unlock();
        }
    }

    // Grant, in FIFO order, every pending request that can now be satisfied. Lock held.
    private void dispatch() {
        for (Iterator<Request> requests = pending.iterator(); requests.hasNext();) {
            final var request = requests.next();
            if (grantable(request)) {
                requests.remove();
                holders[request.fork] = request.philosopher;
                free--;
                request.granted = true;
                request.ready.signal();
                log.trace("Granted: {} free: {}", request, free);
            }
        }
    }

    private int fork(int philosopher, Side side) {
        return side == Side.LEFT ? left(philosopher) : right(philosopher);
    }

    // The last free fork only goes to a right hand. Lock held.
    private boolean grantable(Request request) {
        if (holders[request.fork] != Fork.FREE) {
            return false;
        }
        return request.side == Side.RIGHT || free > 1;
    }

    private void surrender(int fork) {
        holders[fork] = Fork.FREE;
        free++;
    }

    // Lock held.
    private void withdraw(Request request) {
        if (request.granted) {
            surrender(request.fork);
            log.debug("Withdrawn after grant: {} free: {}", request, free);
        } else {
            pending.remove(request);
            log.debug("Withdrawn: {}", request);
        }
        dispatch();
    }
}
