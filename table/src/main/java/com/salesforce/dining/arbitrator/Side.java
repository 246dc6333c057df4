/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.dining.arbitrator;

/**
 * The hand a fork is requested for. By convention the left hand asks first.
 */
public enum Side {
    LEFT, RIGHT;
}
