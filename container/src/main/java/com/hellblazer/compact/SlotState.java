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
 * The four interpretations of a slot's link field. The ordinal is the tag
 * stored in the two low bits of the link.
 *
 * @author <a href="mailto:hal.hildebrand@gmail.com">Hal Hildebrand</a>
 */
public enum SlotState {
    /** Slot holds a live element */
    USED,
    /** Sentinel linking to the neighbouring block */
    BLOCK_BOUNDARY,
    /** Slot is on the free list */
    FREE,
    /** Sentinel marking the first or last position of the whole container */
    START_END;

    private static final SlotState[] BY_TAG = values();

    static SlotState ofTag(int tag) {
        return BY_TAG[tag];
    }

    boolean isSentinel() {
        return this == BLOCK_BOUNDARY || this == START_END;
    }
}
