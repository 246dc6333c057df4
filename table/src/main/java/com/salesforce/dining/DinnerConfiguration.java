/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.dining;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.time.Duration;

import com.codahale.metrics.MetricRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.salesforce.dining.chandymisra.ChandyMisraTable;

/**
 * YAML friendly description of a dinner
 */
public class DinnerConfiguration {

    public static DinnerConfiguration load(InputStream yaml) throws IOException {
        return mapper().readValue(yaml, DinnerConfiguration.class);
    }

    public static DinnerConfiguration load(URL yaml) throws IOException {
        try (var is = yaml.openStream()) {
            return load(is);
        }
    }

    private static ObjectMapper mapper() {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    public int      cycles        = 10;
    public Duration eatDuration   = Duration.ofMillis(10);
    public int      linkCapacity  = ChandyMisraTable.DEFAULT_LINK_CAPACITY;
    public Protocol protocol      = Protocol.CHANDY_MISRA;
    public int      seats         = 5;
    public Duration thinkDuration = Duration.ofMillis(10);

    public Dinner newDinner() {
        return new Dinner(newTable(), parameters());
    }

    public Dinner newDinner(MetricRegistry registry) {
        return new Dinner(newTable(), parameters(), new DiningMetricsImpl(protocol.name().toLowerCase(), registry));
    }

    public Table newTable() {
        return protocol.newTable(parameters());
    }

    /**
     * @throws ConfigurationException if the configuration is invalid
     */
    public Parameters parameters() {
        return Parameters.newBuilder()
                         .setSeats(seats)
                         .setCycles(cycles)
                         .setEatDuration(eatDuration)
                         .setThinkDuration(thinkDuration)
                         .setLinkCapacity(linkCapacity)
                         .build();
    }
}
