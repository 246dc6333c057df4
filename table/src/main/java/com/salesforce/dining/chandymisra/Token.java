/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.dining.chandymisra;

/**
 * A fork as it travels between diners. Only the diner currently holding the token reads or changes it.
 */
public class Token {
    private boolean   dirty = true;
    private final int fork;

    Token(int fork) {
        this.fork = fork;
    }

    public int fork() {
        return fork;
    }

    public boolean isDirty() {
        return dirty;
    }

    @Override
    public String toString() {
        return "Token[" + fork + (dirty ? " dirty" : " clean") + "]";
    }

    void clean() {
        dirty = false;
    }

    void soil() {
        dirty = true;
    }
}
