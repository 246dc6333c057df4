/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.dining.utils;

import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

public class SimpleChannelTest {

    @Test
    public void boundedCapacity() {
        var channel = new SimpleChannel<String>("bounded", 2);
        assertTrue(channel.offer("a"));
        assertTrue(channel.offer("b"));
        assertFalse(channel.offer("c"), "Offer should fail when the channel is full");
        assertThat(channel.size(), is(equalTo(2)));
        assertThat(channel.poll(), is(equalTo("a")));
        assertTrue(channel.offer("c"));
    }

    @Test
    public void closeDropsElements() {
        var channel = new SimpleChannel<Integer>("closing", 4);
        channel.offer(1);
        channel.offer(2);
        channel.close();
        assertTrue(channel.isClosed());
        assertThat(channel.size(), is(equalTo(0)));
        assertThat(channel.poll(), is(nullValue()));
        assertFalse(channel.offer(3), "Closed channel should reject elements");
    }

    @Test
    public void doorbellRungPerAcceptedElement() {
        var rung = new AtomicInteger();
        var channel = new SimpleChannel<Integer>("doorbell", 1, rung::incrementAndGet);
        assertTrue(channel.offer(1));
        assertFalse(channel.offer(2));
        assertThat(rung.get(), is(equalTo(1)));
    }

    @Test
    public void fifo() {
        var channel = new SimpleChannel<Integer>("fifo", 10);
        for (int i = 0; i < 10; i++) {
            assertTrue(channel.offer(i));
        }
        for (int i = 0; i < 10; i++) {
            assertThat(channel.poll(), is(equalTo(i)));
        }
        assertThat(channel.poll(), is(nullValue()));
    }

    @Test
    public void invalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new SimpleChannel<String>("invalid", 0));
    }
}
