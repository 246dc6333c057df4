/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.dining.chandymisra;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicIntegerArray;
import java.util.concurrent.atomic.AtomicReferenceArray;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.salesforce.dining.AbstractTable;
import com.salesforce.dining.ConfigurationException;
import com.salesforce.dining.StateCorruptionException;
import com.salesforce.dining.chandymisra.Message.Hungry;
import com.salesforce.dining.chandymisra.Message.Retract;
import com.salesforce.dining.chandymisra.Message.Sated;

/**
 * The Chandy-Misra hygienic solution. There is no mediator: each philosopher's {@link Diner} trades forks with its two
 * neighbours by message. A dirty fork must be given up on request, a clean one may be kept until its holder has eaten,
 * and forks travel clean. Eating dirties both forks, so a neighbour that was kept waiting gets them next. Starvation
 * free as well as deadlock free.
 */
public class ChandyMisraTable extends AbstractTable {
    public static final int DEFAULT_LINK_CAPACITY = 16;

    private static final int    CONTROL_CAPACITY = 16;
    private static final Logger log              = LoggerFactory.getLogger(ChandyMisraTable.class);

    private volatile AtomicReferenceArray<CompletableFuture<Void>> attempts;
    private volatile Diner[]                                       diners;
    private volatile AtomicIntegerArray                            eating;
    private final int                                              linkCapacity;
    private final ForkListener                                     listener;

    public ChandyMisraTable() {
        this(ForkListener.NONE);
    }

    public ChandyMisraTable(ForkListener listener) {
        this(listener, DEFAULT_LINK_CAPACITY);
    }

    public ChandyMisraTable(ForkListener listener, int linkCapacity) {
        if (linkCapacity < 2) {
            throw new ConfigurationException("Link capacity must be at least 2: " + linkCapacity);
        }
        this.listener = listener;
        this.linkCapacity = linkCapacity;
    }

    @Override
    protected void acquire(int philosopher) throws InterruptedException {
        final var seated = new CompletableFuture<Void>();
        attempts.set(philosopher, seated);
        try {
            checkOpen();
            if (!submit(philosopher, new Hungry(seated))) {
                throw new CancellationException("Table has been stopped");
            }
            try {
                seated.get();
            } catch (InterruptedException | CancellationException e) {
                retract(philosopher);
                throw e;
            } catch (ExecutionException e) {
                retract(philosopher);
                throw new StateCorruptionException("Philosopher: " + philosopher + " could not be seated",
                                                   e.getCause());
            }
            eating.set(philosopher, 1);
        } finally {
            attempts.compareAndSet(philosopher, seated, null);
        }
    }

    @Override
    protected void initialize(int seats) {
        final var laid = new Diner[seats];
        for (int i = 0; i < seats; i++) {
            laid[i] = new Diner(i, seats, linkCapacity, CONTROL_CAPACITY, listener, this::poison);
        }
        for (int i = 0; i < seats; i++) {
            laid[i].connect(laid[(i + seats - 1) % seats], laid[(i + 1) % seats]);
        }
        attempts = new AtomicReferenceArray<>(seats);
        eating = new AtomicIntegerArray(seats);
        diners = laid;
        for (Diner diner : laid) {
            diner.start();
        }
    }

    @Override
    protected void release(int philosopher) {
        if (!eating.compareAndSet(philosopher, 1, 0)) {
            throw new StateCorruptionException("Philosopher: " + philosopher + " is not eating");
        }
        if (!submit(philosopher, new Sated())) {
            log.debug("Philosopher: {} finished eating after the table stopped", philosopher);
        }
    }

    @Override
    protected void shutdown() {
        for (int i = 0; i < attempts.length(); i++) {
            final var attempt = attempts.get(i);
            if (attempt != null) {
                attempt.cancel(true);
            }
        }
        for (Diner diner : diners) {
            diner.close();
        }
    }

    private void retract(int philosopher) {
        log.debug("Philosopher: {} abandoned attempt to eat", philosopher);
        submit(philosopher, new Retract());
    }

    /**
     * @return false if the table has stopped and the message was dropped
     */
    private boolean submit(int philosopher, Message message) {
        final var control = diners[philosopher].control();
        if (control.offer(message)) {
            return true;
        }
        if (control.isClosed()) {
            return false;
        }
        throw new StateCorruptionException("Control link of philosopher: " + philosopher + " overflow");
    }
}
