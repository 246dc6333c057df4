/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.dining.utils;

import java.io.Closeable;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A bounded FIFO channel. An optional doorbell is rung once for every element accepted, which lets a single
 * consumer wait on many channels at once.
 *
 * @param <T>
 */
public class SimpleChannel<T> implements Closeable, Channel<T> {
    private static final Logger log = LoggerFactory.getLogger(SimpleChannel.class);

    private final AtomicBoolean    closed = new AtomicBoolean();
    private final Runnable         doorbell;
    private final String           label;
    private final BlockingQueue<T> queue;

    public SimpleChannel(String label, int capacity) {
        this(label, capacity, () -> {
        });
    }

    public SimpleChannel(String label, int capacity, Runnable doorbell) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Channel capacity must be positive: " + capacity);
        }
        this.queue = new LinkedBlockingDeque<>(capacity);
        this.label = label;
        this.doorbell = doorbell;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        int dropped = queue.size();
        queue.clear();
        if (dropped > 0) {
            log.debug("Closed channel: {} dropping: {} elements", label, dropped);
        }
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public String label() {
        return label;
    }

    @Override
    public boolean offer(T element) {
        if (closed.get()) {
            return false;
        }
        if (!queue.offer(element)) {
            log.warn("Channel: {} is full, rejecting: {}", label, element);
            return false;
        }
        doorbell.run();
        return true;
    }

    @Override
    public T poll() {
        if (closed.get()) {
            return null;
        }
        return queue.poll();
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public String toString() {
        return "Channel[" + label + "]";
    }
}
