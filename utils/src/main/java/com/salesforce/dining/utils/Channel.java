/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.dining.utils;

/**
 * A bounded, ordered, single direction channel. Elements are received in the order they were submitted.
 *
 * @param <T>
 */
public interface Channel<T> {

    void close();

    boolean isClosed();

    String label();

    /**
     * @return true if the element was enqueued, false if the channel is closed or full
     */
    boolean offer(T element);

    /**
     * @return the next element, or null if none is available
     */
    T poll();

    int size();

}
