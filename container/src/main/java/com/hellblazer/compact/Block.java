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

import java.util.Arrays;

/**
 * A fixed run of slots allocated in one shot, bracketed by two sentinels. Offset {@code 0} is the before-begin
 * sentinel, offsets {@code 1..capacity} are real slots and offset {@code capacity + 1} is the after-end sentinel.
 * <p>
 * The arrays are never resized; a block's slots keep their identity for the block's lifetime. The owner, id and
 * first index change only when the block is handed to another container by merge or swap.
 *
 * @author <a href="mailto:hal.hildebrand@gmail.com">Hal Hildebrand</a>
 */
final class Block<T> {
    final int      capacity;
    final Object[] elements;
    final long[]   links;

    CompactContainer<T> owner;
    int                 id;
    int                 firstIndex;

    Block(CompactContainer<T> owner, int id, int firstIndex, int capacity) {
        this.capacity = capacity;
        this.elements = new Object[capacity + 2];
        this.links = new long[capacity + 2];
        this.owner = owner;
        this.id = id;
        this.firstIndex = firstIndex;
        links[0] = SlotLink.START_END;
        links[capacity + 1] = SlotLink.START_END;
    }

    int afterEnd() {
        return capacity + 1;
    }

    /**
     * Release the block from its container; handles into it become stale
     */
    void detach() {
        owner = null;
        Arrays.fill(elements, null);
    }

    @SuppressWarnings("unchecked")
    T element(int offset) {
        return (T) elements[offset];
    }

    boolean isRealSlot(int offset) {
        return offset >= 1 && offset <= capacity;
    }

    int lastSlot() {
        return capacity;
    }

    SlotState state(int offset) {
        return SlotLink.state(links[offset]);
    }

    @Override
    public String toString() {
        return "Block[id=" + id + ", capacity=" + capacity + ", first=" + firstIndex + "]";
    }
}
