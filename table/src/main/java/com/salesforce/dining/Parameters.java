/*
 * Copyright (c) 2021, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.dining;

import java.time.Duration;

import com.salesforce.dining.chandymisra.ChandyMisraTable;

/**
 * How a dinner is run.
 */
public record Parameters(int seats, Duration eatDuration, Duration thinkDuration, int cycles, int linkCapacity) {

    /**
     * Cycle count meaning run until stopped
     */
    public static final int UNBOUNDED = -1;

    public static Builder newBuilder() {
        return new Builder();
    }

    public boolean isUnbounded() {
        return cycles == UNBOUNDED;
    }

    public static class Builder {
        /**
         * Meals per philosopher, or {@link Parameters#UNBOUNDED}
         */
        private int      cycles        = 10;
        /**
         * How long a philosopher holds both forks
         */
        private Duration eatDuration   = Duration.ofMillis(10);
        /**
         * Bound of each Chandy-Misra neighbour link
         */
        private int      linkCapacity  = ChandyMisraTable.DEFAULT_LINK_CAPACITY;
        private int      seats         = 5;
        /**
         * How long a philosopher idles between meals
         */
        private Duration thinkDuration = Duration.ofMillis(10);

        public Parameters build() {
            if (seats < 2) {
                throw new ConfigurationException("A dinner requires at least 2 seats: " + seats);
            }
            if (cycles < 0 && cycles != UNBOUNDED) {
                throw new ConfigurationException("Invalid cycle count: " + cycles);
            }
            if (eatDuration == null || eatDuration.isNegative()) {
                throw new ConfigurationException("Invalid eat duration: " + eatDuration);
            }
            if (thinkDuration == null || thinkDuration.isNegative()) {
                throw new ConfigurationException("Invalid think duration: " + thinkDuration);
            }
            if (linkCapacity < 2) {
                throw new ConfigurationException("Link capacity must be at least 2: " + linkCapacity);
            }
            return new Parameters(seats, eatDuration, thinkDuration, cycles, linkCapacity);
        }

        public int getCycles() {
            return cycles;
        }

        public Duration getEatDuration() {
            return eatDuration;
        }

        public int getLinkCapacity() {
            return linkCapacity;
        }

        public int getSeats() {
            return seats;
        }

        public Duration getThinkDuration() {
            return thinkDuration;
        }

        public Builder setCycles(int cycles) {
            this.cycles = cycles;
            return this;
        }

        public Builder setEatDuration(Duration eatDuration) {
            this.eatDuration = eatDuration;
            return this;
        }

        public Builder setLinkCapacity(int linkCapacity) {
            this.linkCapacity = linkCapacity;
            return this;
        }

        public Builder setSeats(int seats) {
            this.seats = seats;
            return this;
        }

        public Builder setThinkDuration(Duration thinkDuration) {
            this.thinkDuration = thinkDuration;
            return this;
        }

        public Builder setUnbounded() {
            this.cycles = UNBOUNDED;
            return this;
        }
    }
}
