/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.dining.utils;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;

public class ChannelMultiplexerTest {

    private record Envelope(int sender, int sequence) {
    }

    @Test
    public void closeStopsConsumer() throws Exception {
        var multiplexer = new ChannelMultiplexer<String>("closing");
        var channel = multiplexer.open("in", 4);
        var thread = new AtomicReference<Thread>();
        var started = new CountDownLatch(1);
        multiplexer.consumeEach(s -> {
            thread.set(Thread.currentThread());
            started.countDown();
        });
        assertTrue(channel.offer("wake"));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        multiplexer.close();
        assertTrue(multiplexer.isClosed());
        assertTrue(channel.isClosed());
        thread.get().join(5_000);
        assertFalse(thread.get().isAlive(), "Consumer thread should exit on close");
        assertThrows(IllegalStateException.class, () -> multiplexer.open("late", 1));
    }

    @Test
    public void consumerErrorsDoNotStopDelivery() throws Exception {
        var multiplexer = new ChannelMultiplexer<Integer>("errors");
        var channel = multiplexer.open("in", 4);
        var delivered = new CountDownLatch(2);
        multiplexer.consumeEach(i -> {
            delivered.countDown();
            if (i == 0) {
                throw new IllegalStateException("Expected");
            }
        });
        try {
            channel.offer(0);
            channel.offer(1);
            assertTrue(delivered.await(5, TimeUnit.SECONDS));
        } finally {
            multiplexer.close();
        }
    }

    @Test
    public void onlyOneHandler() {
        var multiplexer = new ChannelMultiplexer<String>("single");
        try {
            multiplexer.consumeEach(s -> {
            });
            assertThrows(IllegalStateException.class, () -> multiplexer.consumeEach(s -> {
            }));
        } finally {
            multiplexer.close();
        }
    }

    @Test
    public void perChannelOrdering() throws Exception {
        final int senders = 3;
        final int messages = 200;
        var multiplexer = new ChannelMultiplexer<Envelope>("ordering");
        List<Channel<Envelope>> channels = new ArrayList<>();
        for (int i = 0; i < senders; i++) {
            channels.add(multiplexer.open("sender-" + i, messages));
        }
        var received = new CopyOnWriteArrayList<Envelope>();
        var done = new CountDownLatch(senders * messages);
        multiplexer.consumeEach(e -> {
            received.add(e);
            done.countDown();
        });

        List<Thread> threads = new ArrayList<>();
        for (int i = 0; i < senders; i++) {
            final int sender = i;
            threads.add(new Thread(() -> {
                for (int j = 0; j < messages; j++) {
                    assertTrue(channels.get(sender).offer(new Envelope(sender, j)));
                }
            }));
        }
        threads.forEach(Thread::start);
        try {
            assertTrue(done.await(10, TimeUnit.SECONDS), "Not all messages delivered");
            int[] expected = new int[senders];
            for (Envelope e : received) {
                assertEquals(expected[e.sender()], e.sequence(), "Out of order delivery from sender " + e.sender());
                expected[e.sender()]++;
            }
            assertEquals(0, multiplexer.size());
        } finally {
            multiplexer.close();
        }
    }
}
