/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.dining;

/**
 * A violated exclusion invariant: a fork held by two philosophers, released by one that does not hold it, or a table
 * poisoned by a philosopher that failed while holding forks. Never recoverable.
 */
public class StateCorruptionException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    public StateCorruptionException(String message) {
        super(message);
    }

    public StateCorruptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
