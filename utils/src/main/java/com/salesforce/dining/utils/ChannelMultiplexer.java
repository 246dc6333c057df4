/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.dining.utils;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drains any number of inbound channels on a single consumer thread. Each channel keeps its own FIFO order; the
 * channels are visited round robin so that no one sender can starve the others.
 *
 * @param <T>
 */
public class ChannelMultiplexer<T> {
    private static final Logger log = LoggerFactory.getLogger(ChannelMultiplexer.class);

    private final List<SimpleChannel<T>> channels = new CopyOnWriteArrayList<>();
    private final AtomicBoolean          closed   = new AtomicBoolean();
    private volatile Thread              handler;
    private final String                 label;
    private int                          next;
    private final Semaphore              pending  = new Semaphore(0);

    public ChannelMultiplexer(String label) {
        this.label = label;
    }

    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        channels.forEach(SimpleChannel::close);
        final var current = handler;
        if (current != null) {
            current.interrupt();
            handler = null;
        }
    }

    public void consumeEach(Consumer<T> consumer) {
        if (closed.get()) {
            throw new IllegalStateException("Multiplexer already closed: " + label);
        }
        if (handler != null) {
            throw new IllegalStateException("Handler already established: " + label);
        }
        handler = new Thread(() -> {
            while (!closed.getAcquire()) {
                try {
                    if (!pending.tryAcquire(1, TimeUnit.SECONDS)) {
                        continue;
                    }
                    if (closed.get()) {
                        return;
                    }
                    T element = next();
                    if (element == null) {
                        continue;
                    }
                    try {
                        consumer.accept(element);
                    } catch (Throwable e) {
                        log.error("Error in consumer: {} processing: {}", label, element, e);
                    }
                } catch (InterruptedException e) {
                    return; // Normal exit
                }
            }
        }, label);
        handler.setDaemon(true);
        handler.start();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Open a new inbound channel drained by this multiplexer
     */
    public Channel<T> open(String channelLabel, int capacity) {
        if (closed.get()) {
            throw new IllegalStateException("Multiplexer already closed: " + label);
        }
        var channel = new SimpleChannel<T>(channelLabel, capacity, pending::release);
        channels.add(channel);
        return channel;
    }

    /**
     * @return the number of elements waiting in all channels
     */
    public int size() {
        return channels.stream().mapToInt(Channel::size).sum();
    }

    // Only called on the handler thread
    private T next() {
        final int count = channels.size();
        for (int i = 0; i < count; i++) {
            var channel = channels.get((next + i) % count);
            T element = channel.poll();
            if (element != null) {
                next = (next + i + 1) % count;
                return element;
            }
        }
        return null;
    }
}
