/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.dining;

import static com.codahale.metrics.MetricRegistry.name;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

public class DiningMetricsImpl implements DiningMetrics {

    private final Meter          cancelled;
    private final Meter          failures;
    private final Timer          hungry;
    private final Meter          meals;
    private final String         prefix;
    private final MetricRegistry registry;

    public DiningMetricsImpl(String prefix, MetricRegistry registry) {
        this.prefix = prefix;
        this.registry = registry;
        cancelled = registry.meter(name(prefix, "philosophers.cancelled"));
        failures = registry.meter(name(prefix, "philosophers.failed"));
        hungry = registry.timer(name(prefix, "hungry.duration"));
        meals = registry.meter(name(prefix, "meals"));
    }

    @Override
    public void cancelled() {
        cancelled.mark();
    }

    @Override
    public void failure() {
        failures.mark();
    }

    @Override
    public Timer hungry() {
        return hungry;
    }

    @Override
    public void meal(int philosopher) {
        meals.mark();
        registry.meter(name(prefix, "philosopher", Integer.toString(philosopher), "meals")).mark();
    }
}
