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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import com.salesforce.dining.chandymisra.ChandyMisraTable;

public class ParametersTest {

    @Test
    public void defaults() {
        var parameters = Parameters.newBuilder().build();
        assertThat(parameters.seats(), is(equalTo(5)));
        assertThat(parameters.cycles(), is(equalTo(10)));
        assertThat(parameters.eatDuration(), is(equalTo(Duration.ofMillis(10))));
        assertThat(parameters.thinkDuration(), is(equalTo(Duration.ofMillis(10))));
        assertThat(parameters.linkCapacity(), is(equalTo(ChandyMisraTable.DEFAULT_LINK_CAPACITY)));
        assertFalse(parameters.isUnbounded());
    }

    @Test
    public void invalid() {
        assertThrows(ConfigurationException.class, () -> Parameters.newBuilder().setSeats(1).build());
        assertThrows(ConfigurationException.class, () -> Parameters.newBuilder().setCycles(-2).build());
        assertThrows(ConfigurationException.class,
                     () -> Parameters.newBuilder().setEatDuration(Duration.ofMillis(-1)).build());
        assertThrows(ConfigurationException.class, () -> Parameters.newBuilder().setThinkDuration(null).build());
        assertThrows(ConfigurationException.class, () -> Parameters.newBuilder().setLinkCapacity(1).build());
    }

    @Test
    public void unbounded() {
        var parameters = Parameters.newBuilder().setSeats(2).setUnbounded().build();
        assertTrue(parameters.isUnbounded());
        assertThat(parameters.cycles(), is(equalTo(Parameters.UNBOUNDED)));
        assertThat(Parameters.newBuilder().setCycles(0).build().cycles(), is(equalTo(0)));
    }
}
