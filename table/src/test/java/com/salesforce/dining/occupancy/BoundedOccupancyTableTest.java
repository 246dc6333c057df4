/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.dining.occupancy;

import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.common.util.concurrent.Uninterruptibles;

import com.salesforce.dining.Dinner;
import com.salesforce.dining.Fork;
import com.salesforce.dining.Parameters;
import com.salesforce.dining.utils.Utils;

public class BoundedOccupancyTableTest {

    private ExecutorService exec;

    @BeforeEach
    public void before() {
        exec = Executors.newCachedThreadPool();
    }

    @AfterEach
    public void after() {
        exec.shutdownNow();
    }

    @Test
    public void abandonedWaiterReturnsPermit() throws Exception {
        var table = new BoundedOccupancyTable();
        table.start(3);
        assertThat(table.capacity(), is(equalTo(2)));
        table.acquirePair(0);

        // philosopher 1 is admitted and waits on fork 1
        var first = exec.submit(() -> {
            table.acquirePair(1);
            return null;
        });
        assertTrue(Utils.waitForCondition(5_000, 10, () -> table.admitted() == 2));

        // philosopher 2 waits at the gate
        var second = exec.submit(() -> {
            table.acquirePair(2);
            return null;
        });
        Uninterruptibles.sleepUninterruptibly(50, TimeUnit.MILLISECONDS);
        assertThat(table.admitted(), is(equalTo(2)));
        assertThat(table.holder(2), is(equalTo(Fork.FREE)));

        first.cancel(true);
        assertTrue(Utils.waitForCondition(5_000, 10, () -> table.holder(2) == 2));
        assertThat(table.admitted(), is(equalTo(2)));
        assertFalse(second.isDone());

        table.releasePair(0);
        second.get(5, TimeUnit.SECONDS);
        assertThat(table.holder(0), is(equalTo(2)));
        table.releasePair(2);
        assertThat(table.admitted(), is(equalTo(0)));
        assertThat(table.peakAdmitted(), is(lessThanOrEqualTo(2)));
    }

    @Test
    public void occupancyBounded() throws Exception {
        var parameters = Parameters.newBuilder()
                                   .setSeats(5)
                                   .setCycles(50)
                                   .setEatDuration(Duration.ofMillis(1))
                                   .setThinkDuration(Duration.ZERO)
                                   .build();
        var table = new BoundedOccupancyTable();
        var dinner = new Dinner(table, parameters);
        dinner.start();
        try {
            assertTrue(dinner.awaitCompletion(Duration.ofSeconds(60)));
        } finally {
            dinner.stop();
        }
        assertThat(dinner.totalMeals(), is(equalTo(250)));
        assertThat(table.peakAdmitted(), is(lessThanOrEqualTo(4)));
        assertThat(table.admitted(), is(equalTo(0)));
        assertThat(dinner.getLedger().peakEating(), is(lessThanOrEqualTo(2)));
    }

    @Test
    public void stopFloodsGate() throws Exception {
        var table = new BoundedOccupancyTable();
        table.start(3);
        table.acquirePair(0);
        var admitted = exec.submit(() -> {
            table.acquirePair(1);
            return null;
        });
        assertTrue(Utils.waitForCondition(5_000, 10, () -> table.admitted() == 2));
        var gated = exec.submit(() -> {
            table.acquirePair(2);
            return null;
        });
        Uninterruptibles.sleepUninterruptibly(50, TimeUnit.MILLISECONDS);
        table.stop();
        for (var waiting : List.of(admitted, gated)) {
            try {
                waiting.get(5, TimeUnit.SECONDS);
            } catch (ExecutionException e) {
                assertTrue(e.getCause() instanceof CancellationException);
            }
        }
        assertTrue(admitted.isDone());
        assertTrue(gated.isDone());
        table.releasePair(0);
        assertThat(table.admitted(), is(equalTo(0)));
        assertThat(table.holder(1), is(equalTo(Fork.FREE)));
        assertThat(table.holder(2), is(equalTo(Fork.FREE)));
    }
}
