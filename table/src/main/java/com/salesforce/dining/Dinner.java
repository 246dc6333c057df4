/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.dining;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

/**
 * Seats one {@link Philosopher} per seat around a table and runs them concurrently, one thread each.
 */
public class Dinner {
    private static final Logger log = LoggerFactory.getLogger(Dinner.class);

    private volatile ExecutorService      executor;
    private final List<Throwable>         failures = new ArrayList<>();
    private final List<Future<Integer>>   futures  = new ArrayList<>();
    private final ForkLedger              ledger;
    private final Parameters              parameters;
    private final List<Philosopher>       philosophers;
    private volatile boolean              laid;
    private final AtomicBoolean           started  = new AtomicBoolean();
    private final Table                   table;

    public Dinner(Table table, Parameters parameters) {
        this(table, parameters, null);
    }

    public Dinner(Table table, Parameters parameters, DiningMetrics metrics) {
        this.table = table;
        this.parameters = parameters;
        ledger = new ForkLedger(parameters.seats());
        var seated = new ArrayList<Philosopher>();
        for (int i = 0; i < parameters.seats(); i++) {
            seated.add(new Philosopher(i, table, parameters, ledger, metrics));
        }
        philosophers = ImmutableList.copyOf(seated);
    }

    /**
     * Wait for every philosopher to finish its cycles. Once all have finished the philosopher threads are released,
     * and a table laid by this dinner is stopped.
     *
     * @return false if the timeout elapsed first
     * @throws StateCorruptionException if any philosopher failed
     */
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        if (!started.get()) {
            throw new IllegalStateException("Dinner has not started");
        }
        final long deadline = System.nanoTime() + timeout.toNanos();
        for (Future<Integer> future : futures) {
            try {
                future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                return false;
            } catch (ExecutionException e) {
                synchronized (failures) {
                    if (!failures.contains(e.getCause())) {
                        failures.add(e.getCause());
                    }
                }
            }
        }
        finished();
        final var failed = failures();
        if (!failed.isEmpty()) {
            final var corruption = new StateCorruptionException(failed.size() + " philosopher(s) failed",
                                                                failed.get(0));
            failed.stream().skip(1).forEach(corruption::addSuppressed);
            throw corruption;
        }
        return true;
    }

    public List<Throwable> failures() {
        synchronized (failures) {
            return ImmutableList.copyOf(failures);
        }
    }

    public ForkLedger getLedger() {
        return ledger;
    }

    public Parameters getParameters() {
        return parameters;
    }

    public Table getTable() {
        return table;
    }

    /**
     * @return true once every philosopher thread has exited
     */
    public boolean isTerminated() {
        final var current = executor;
        return current != null && current.isTerminated();
    }

    /**
     * @return the longest time, in nanoseconds, any philosopher waited for its forks
     */
    public long longestWait() {
        return philosophers.stream().mapToLong(Philosopher::getLongestWait).max().orElse(0);
    }

    public int meals(int philosopher) {
        return philosophers.get(philosopher).getMeals();
    }

    public Phase phase(int philosopher) {
        return philosophers.get(philosopher).getPhase();
    }

    public List<Philosopher> philosophers() {
        return philosophers;
    }

    /**
     * Lay the table, if not already laid, and start every philosopher
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        if (table.seats() == 0) {
            table.start(parameters.seats());
            laid = true;
        } else if (table.seats() != parameters.seats()) {
            throw new ConfigurationException("Table has: " + table.seats() + " seats, dinner requires: "
            + parameters.seats());
        }
        final var count = new AtomicInteger();
        executor = Executors.newFixedThreadPool(parameters.seats(), r -> {
            Thread t = new Thread(r, "philosopher-" + count.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        for (Philosopher philosopher : philosophers) {
            futures.add(executor.submit(philosopher));
        }
        log.info("Started dinner of: {} at: {}", parameters.seats(), table.getClass().getSimpleName());
    }

    /**
     * Stop the table and interrupt every philosopher. Held forks are returned as each philosopher unwinds.
     */
    public void stop() {
        table.stop();
        final var current = executor;
        if (current == null) {
            return;
        }
        current.shutdownNow();
        try {
            if (!current.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Philosophers did not terminate after stop");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Stopped dinner, meals: {}", philosophers.stream().mapToInt(Philosopher::getMeals).sum());
    }

    public int totalMeals() {
        return philosophers.stream().mapToInt(Philosopher::getMeals).sum();
    }

    private void finished() {
        executor.shutdown();
        if (laid) {
            table.stop();
        }
        log.debug("Dinner finished, meals: {}", totalMeals());
    }
}
