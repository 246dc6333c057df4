/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.dining.chandymisra;

import java.util.concurrent.CompletableFuture;

/**
 * Everything a diner can receive. Requests and deliveries arrive on neighbour links, the rest on the control link
 * from the diner's own philosopher.
 */
interface Message {

    /**
     * A fork handed over by a neighbour
     */
    record Delivery(int from, Token token) implements Message {
    }

    /**
     * The philosopher wants to eat; completed when it may
     */
    record Hungry(CompletableFuture<Void> seated) implements Message {
    }

    /**
     * A neighbour asks for the fork they share
     */
    record Request(int from, int fork) implements Message {
    }

    /**
     * The philosopher abandoned its attempt to eat
     */
    record Retract() implements Message {
    }

    /**
     * The philosopher finished eating
     */
    record Sated() implements Message {
    }
}
