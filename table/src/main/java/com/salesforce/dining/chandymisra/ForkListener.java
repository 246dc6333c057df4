/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.dining.chandymisra;

/**
 * Observes fork movement. Callbacks run on the diner threads and must not block.
 */
public interface ForkListener {
    ForkListener NONE = new ForkListener() {
    };

    /**
     * A request for a fork the holder keeps for now
     */
    default void deferred(int fork, int holder, int requester) {
    }

    /**
     * The fork arrived at its new holder
     */
    default void delivered(int fork, int from, int to, boolean dirty) {
    }

    /**
     * The holder used the fork
     */
    default void dirtied(int fork, int holder) {
    }

    /**
     * The philosopher holds both forks and starts eating
     */
    default void seated(int philosopher) {
    }
}
