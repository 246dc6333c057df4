/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.dining;

import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import org.junit.jupiter.api.Test;

import com.codahale.metrics.MetricRegistry;
import com.salesforce.dining.arbitrator.ArbitratorTable;
import com.salesforce.dining.chandymisra.ChandyMisraTable;

public class DinnerConfigurationTest {

    @Test
    public void defaults() throws Exception {
        var config = DinnerConfiguration.load(new ByteArrayInputStream("seats: 4\n".getBytes(StandardCharsets.UTF_8)));
        assertThat(config.seats, is(equalTo(4)));
        assertThat(config.protocol, is(equalTo(Protocol.CHANDY_MISRA)));
        assertThat(config.parameters().cycles(), is(equalTo(10)));
        assertTrue(config.newTable() instanceof ChandyMisraTable);
    }

    @Test
    public void invalid() throws Exception {
        var config = DinnerConfiguration.load(new ByteArrayInputStream("seats: 1\n".getBytes(StandardCharsets.UTF_8)));
        assertThrows(ConfigurationException.class, () -> config.parameters());
        assertThrows(ConfigurationException.class, () -> config.newDinner());
    }

    @Test
    public void load() throws Exception {
        var config = DinnerConfiguration.load(getClass().getResource("/dinner.yml"));
        assertThat(config.protocol, is(equalTo(Protocol.ARBITRATOR)));
        assertThat(config.seats, is(equalTo(3)));
        assertThat(config.cycles, is(equalTo(5)));
        assertThat(config.eatDuration, is(equalTo(Duration.ofMillis(1))));
        assertThat(config.thinkDuration, is(equalTo(Duration.ZERO)));

        var registry = new MetricRegistry();
        var dinner = config.newDinner(registry);
        assertTrue(dinner.getTable() instanceof ArbitratorTable);
        dinner.start();
        try {
            assertTrue(dinner.awaitCompletion(Duration.ofSeconds(30)));
        } finally {
            dinner.stop();
        }
        assertThat(dinner.totalMeals(), is(equalTo(15)));
        assertThat(registry.meter("arbitrator.meals").getCount(), is(equalTo(15L)));
    }
}
