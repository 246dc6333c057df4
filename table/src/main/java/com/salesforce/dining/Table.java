/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.dining;

import java.util.concurrent.CancellationException;

/**
 * The philosopher facing contract shared by every deadlock free protocol. Philosopher i needs fork {@link #left(int)}
 * and fork {@link #right(int)} to eat.
 */
public interface Table {

    /**
     * Block until the philosopher holds both adjacent forks.
     *
     * @throws InterruptedException  if interrupted while waiting; nothing remains held
     * @throws CancellationException if the table is or becomes stopped; nothing remains held
     * @throws StateCorruptionException if the table has been poisoned
     */
    void acquirePair(int philosopher) throws InterruptedException;

    boolean isStopped();

    default int left(int philosopher) {
        return philosopher;
    }

    /**
     * Mark the table as corrupt, typically because a philosopher terminated abnormally while holding forks. The table
     * is stopped and every later acquisition fails with {@link StateCorruptionException}.
     */
    void poison(Throwable cause);

    /**
     * Release both forks held by the philosopher.
     *
     * @throws StateCorruptionException if the philosopher does not hold them
     */
    void releasePair(int philosopher);

    default int right(int philosopher) {
        return (philosopher + 1) % seats();
    }

    /**
     * @return the number of seats, or 0 if the table has not been started
     */
    int seats();

    /**
     * Lay the table for the given number of philosophers.
     *
     * @throws ConfigurationException if fewer than two seats are requested
     */
    void start(int seats);

    /**
     * Cooperatively stop the table. Waiting acquisitions unwind with {@link CancellationException}. Idempotent.
     */
    void stop();
}
