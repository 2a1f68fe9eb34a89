/*
 * Copyright (c) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.compact;

/**
 * Configuration for {@link CompactContainer}.
 *
 * @author <a href="mailto:hal.hildebrand@gmail.com">Hal Hildebrand</a>
 */
public class CompactContainerConfiguration {
    /** Largest capacity the container will grow to; leaves room for the two sentinels of a maximal block */
    public static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

    private final GrowthPolicy growthPolicy;
    private final int          maxCapacity;
    private final boolean      enableValidation;
    private final boolean      enableTimeStamping;

    private CompactContainerConfiguration(Builder builder) {
        this.growthPolicy = builder.growthPolicy;
        this.maxCapacity = builder.maxCapacity;
        this.enableValidation = builder.enableValidation;
        this.enableTimeStamping = builder.enableTimeStamping;
    }

    /**
     * Get the default configuration.
     * - Growth: doubling, first block of 16 slots
     * - Max capacity: {@link #MAX_CAPACITY}
     * - Validation: disabled
     * - Time stamping: enabled
     */
    public static CompactContainerConfiguration getDefault() {
        return new Builder().build();
    }

    /**
     * Default configuration with invariant validation after every mutation. Each validation walks the whole
     * container, use for testing and debugging only.
     */
    public static CompactContainerConfiguration getValidating() {
        return new Builder().withValidation(true).build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public GrowthPolicy getGrowthPolicy() {
        return growthPolicy;
    }

    public int getMaxCapacity() {
        return maxCapacity;
    }

    public boolean isTimeStampingEnabled() {
        return enableTimeStamping;
    }

    public boolean isValidationEnabled() {
        return enableValidation;
    }

    @Override
    public String toString() {
        return "CompactContainerConfiguration[growth=" + growthPolicy + ", maxCapacity=" + maxCapacity
        + ", validation=" + enableValidation + ", timeStamping=" + enableTimeStamping + "]";
    }

    public static class Builder {
        private GrowthPolicy growthPolicy       = GrowthPolicy.doubling();
        private int          maxCapacity        = MAX_CAPACITY;
        private boolean      enableValidation   = false;
        private boolean      enableTimeStamping = true;

        public CompactContainerConfiguration build() {
            return new CompactContainerConfiguration(this);
        }

        public Builder withGrowthPolicy(GrowthPolicy policy) {
            if (policy == null) {
                throw new IllegalArgumentException("Growth policy must not be null");
            }
            this.growthPolicy = policy;
            return this;
        }

        public Builder withMaxCapacity(int maxCapacity) {
            if (maxCapacity <= 0 || maxCapacity > MAX_CAPACITY) {
                throw new IllegalArgumentException(
                "Max capacity must be in [1, " + MAX_CAPACITY + "]: " + maxCapacity);
            }
            this.maxCapacity = maxCapacity;
            return this;
        }

        public Builder withTimeStamping(boolean enable) {
            this.enableTimeStamping = enable;
            return this;
        }

        public Builder withValidation(boolean enable) {
            this.enableValidation = enable;
            return this;
        }
    }
}
