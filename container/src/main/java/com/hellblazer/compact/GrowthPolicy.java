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
 * Chooses the size of each block appended to a {@link CompactContainer}. Implementations are pure functions of the
 * container's current capacity and block count; the container makes no other sizing decision.
 *
 * @author <a href="mailto:hal.hildebrand@gmail.com">Hal Hildebrand</a>
 */
public interface GrowthPolicy {

    /**
     * Blocks of {@code initial + blockCount * increment} slots.
     */
    static GrowthPolicy additive(int initial, int increment) {
        return new Additive(initial, increment);
    }

    /**
     * Every block has the same size. Allocation cost stays amortized O(1) but the number of blocks grows linearly.
     */
    static GrowthPolicy constant(int size) {
        return new Additive(size, 0);
    }

    /**
     * Geometric growth, doubling the capacity with each block once the initial block is in place.
     */
    static GrowthPolicy doubling() {
        return geometric(16, 1.0);
    }

    /**
     * Blocks of {@code max(initial, ceil(capacity * ratio))} slots.
     */
    static GrowthPolicy geometric(int initial, double ratio) {
        return new Geometric(initial, ratio);
    }

    /**
     * @param capacity   total number of slots in the container's current blocks
     * @param blockCount number of blocks in the container
     * @return the number of slots of the next block, always positive
     */
    int nextBlockSize(int capacity, int blockCount);

    record Additive(int initial, int increment) implements GrowthPolicy {
        public Additive {
            if (initial <= 0) {
                throw new IllegalArgumentException("Initial block size must be positive: " + initial);
            }
            if (increment < 0) {
                throw new IllegalArgumentException("Increment must be non-negative: " + increment);
            }
        }

        @Override
        public int nextBlockSize(int capacity, int blockCount) {
            long size = initial + (long) blockCount * increment;
            return (int) Math.min(size, Integer.MAX_VALUE - 2);
        }
    }

    record Geometric(int initial, double ratio) implements GrowthPolicy {
        public Geometric {
            if (initial <= 0) {
                throw new IllegalArgumentException("Initial block size must be positive: " + initial);
            }
            if (!(ratio > 0.0) || Double.isInfinite(ratio)) {
                throw new IllegalArgumentException("Ratio must be positive and finite: " + ratio);
            }
        }

        @Override
        public int nextBlockSize(int capacity, int blockCount) {
            double scaled = Math.ceil(capacity * ratio);
            return (int) Math.min(Math.max(initial, scaled), Integer.MAX_VALUE - 2);
        }
    }
}
