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

import java.util.NoSuchElementException;

/**
 * Stable reference to one slot of a {@link CompactContainer}, and the container's bidirectional iterator
 * position.
 * <p>
 * A handle obtained for a live element keeps referring to that element until the element is erased. Neither
 * growth of the container nor erasure of other elements affects it. Handles are immutable; stepping returns a new
 * handle. Each container has a single canonical end handle, the position past the last element.
 * <p>
 * Stepping only depends on the handle's position, not on the state of its slot, so a traversal may erase the
 * element under the current handle and then continue with {@link #next()}.
 *
 * @author <a href="mailto:hal.hildebrand@gmail.com">Hal Hildebrand</a>
 */
public final class Handle<T> {
    final Block<T>            block;
    final int                 offset;
    private final CompactContainer<T> endOf;

    Handle(Block<T> block, int offset) {
        this.block = block;
        this.offset = offset;
        this.endOf = null;
    }

    private Handle(CompactContainer<T> endOf) {
        this.block = null;
        this.offset = 0;
        this.endOf = endOf;
    }

    static <T> Handle<T> endOf(CompactContainer<T> container) {
        return new Handle<>(container);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Handle<?> other)) {
            return false;
        }
        if (block == null) {
            return other.block == null && endOf == other.endOf;
        }
        return block == other.block && offset == other.offset;
    }

    /**
     * The element in the referenced slot.
     *
     * @throws NoSuchElementException if this is an end handle
     * @throws IllegalStateException  if the slot is free or the handle's container has been cleared
     */
    public T get() {
        if (block == null) {
            throw new NoSuchElementException("Cannot dereference the end handle");
        }
        container();
        if (!SlotLink.isUsed(block.links[offset])) {
            throw new IllegalStateException("Slot is not in use: " + this);
        }
        return block.element(offset);
    }

    @Override
    public int hashCode() {
        if (block == null) {
            return System.identityHashCode(endOf);
        }
        return 31 * System.identityHashCode(block) + offset;
    }

    public boolean isEnd() {
        return block == null;
    }

    /**
     * The position of the next live element, or the end handle.
     *
     * @throws NoSuchElementException if this is the end handle
     */
    public Handle<T> next() {
        if (block == null) {
            throw new NoSuchElementException("Cannot advance past the end");
        }
        return container().following(block, offset);
    }

    /**
     * The position of the previous live element.
     *
     * @throws NoSuchElementException if there is no live element before this position
     */
    public Handle<T> previous() {
        if (block == null) {
            return endOf.last();
        }
        return container().preceding(block, offset);
    }

    @Override
    public String toString() {
        if (block == null) {
            return "Handle[end]";
        }
        return "Handle[" + block.id + ":" + offset + " " + SlotLink.toString(block.links[offset]) + "]";
    }

    CompactContainer<T> container() {
        if (block == null) {
            return endOf;
        }
        var owner = block.owner;
        if (owner == null) {
            throw new IllegalStateException("Stale handle, its container was cleared: " + this);
        }
        return owner;
    }
}
