/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.dining;

import com.codahale.metrics.Timer;

public interface DiningMetrics {

    /**
     * A philosopher gave up waiting for forks
     */
    void cancelled();

    /**
     * A philosopher terminated abnormally
     */
    void failure();

    /**
     * Time spent hungry, from asking for forks to holding both
     */
    Timer hungry();

    void meal(int philosopher);
}
