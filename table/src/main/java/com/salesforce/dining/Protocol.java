/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.dining;

import com.salesforce.dining.arbitrator.ArbitratorTable;
import com.salesforce.dining.chandymisra.ChandyMisraTable;
import com.salesforce.dining.chandymisra.ForkListener;
import com.salesforce.dining.hierarchy.ResourceHierarchyTable;
import com.salesforce.dining.occupancy.BoundedOccupancyTable;

/**
 * The available deadlock free protocols
 */
public enum Protocol {
    ARBITRATOR {
        @Override
        public Table newTable(Parameters parameters) {
            return new ArbitratorTable();
        }
    },
    BOUNDED_OCCUPANCY {
        @Override
        public Table newTable(Parameters parameters) {
            return new BoundedOccupancyTable();
        }
    },
    CHANDY_MISRA {
        @Override
        public Table newTable(Parameters parameters) {
            return new ChandyMisraTable(ForkListener.NONE, parameters.linkCapacity());
        }
    },
    RESOURCE_HIERARCHY {
        @Override
        public Table newTable(Parameters parameters) {
            return new ResourceHierarchyTable();
        }
    };

    /**
     * @return a new, unstarted table
     */
    public abstract Table newTable(Parameters parameters);
}
