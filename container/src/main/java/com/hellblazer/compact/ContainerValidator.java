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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks the structural invariants of a {@link CompactContainer}: the block chain and its sentinels, the slot
 * states, the free list and the live count. A container configured with validation runs these checks after
 * every mutation.
 *
 * @author <a href="mailto:hal.hildebrand@gmail.com">Hal Hildebrand</a>
 */
public class ContainerValidator {
    private static final Logger log = LoggerFactory.getLogger(ContainerValidator.class);

    private final CompactContainer<?> container;

    public ContainerValidator(CompactContainer<?> container) {
        this.container = container;
    }

    /**
     * Validate all invariants of the container.
     *
     * @throws AssertionError if any invariant is violated
     */
    public void validateInvariants() {
        int used = validateBlocks();
        if (used != container.size()) {
            fail("Live count " + container.size() + " does not match " + used + " used slots");
        }
        validateFreeList();
        validateTraversal();
    }

    /**
     * Validate the block chain and the state of every slot.
     *
     * @return the number of used slots
     */
    private int validateBlocks() {
        var blocks = container.blocks();
        int expectedIndex = 0;
        int used = 0;
        for (int k = 0; k < blocks.size(); k++) {
            Block<?> block = blocks.get(k);
            if (block.owner != container) {
                fail(block + " is not owned by the container");
            }
            if (block.id != k) {
                fail(block + " is at position " + k);
            }
            if (block.firstIndex != expectedIndex) {
                fail(block + " should start at index " + expectedIndex);
            }
            expectedIndex += block.capacity;

            long before = block.links[0];
            if (k == 0) {
                expectState(block, 0, SlotState.START_END);
            } else {
                var previous = blocks.get(k - 1);
                expectState(block, 0, SlotState.BLOCK_BOUNDARY);
                if (SlotLink.target(before) != SlotLink.address(previous.id, previous.lastSlot())) {
                    fail(block + " before-begin sentinel does not lead to the last slot of " + previous);
                }
            }
            long after = block.links[block.afterEnd()];
            if (k == blocks.size() - 1) {
                expectState(block, block.afterEnd(), SlotState.START_END);
            } else {
                expectState(block, block.afterEnd(), SlotState.BLOCK_BOUNDARY);
                if (SlotLink.target(after) != SlotLink.address(k + 1, 1)) {
                    fail(block + " after-end sentinel does not lead to the first slot of block " + (k + 1));
                }
            }

            for (int i = 1; i <= block.capacity; i++) {
                switch (block.state(i)) {
                    case USED -> {
                        if (block.elements[i] == null) {
                            fail("Used slot " + k + ":" + i + " holds no element");
                        }
                        used++;
                    }
                    case FREE -> {
                        if (block.elements[i] != null) {
                            fail("Free slot " + k + ":" + i + " still holds an element");
                        }
                    }
                    default -> fail("Slot " + k + ":" + i + " is marked as a sentinel");
                }
            }
        }
        if (expectedIndex != container.capacity()) {
            fail("Capacity " + container.capacity() + " does not match the " + expectedIndex + " slots of the blocks");
        }
        return used;
    }

    private void validateFreeList() {
        int expected = container.capacity() - container.size();
        int count = 0;
        var blocks = container.blocks();
        long address = container.freeListHead();
        while (address != SlotLink.NO_SLOT) {
            if (++count > expected) {
                fail("Free list is longer than the " + expected + " free slots, or cyclic");
            }
            int blockId = SlotLink.blockId(address);
            int offset = SlotLink.offset(address);
            if (blockId < 0 || blockId >= blocks.size() || !blocks.get(blockId).isRealSlot(offset)) {
                fail("Free list references slot " + blockId + ":" + offset + " outside the container");
            }
            long link = blocks.get(blockId).links[offset];
            if (SlotLink.state(link) != SlotState.FREE) {
                fail("Free list references " + SlotLink.state(link) + " slot " + blockId + ":" + offset);
            }
            address = SlotLink.nextFree(link);
        }
        if (count != expected) {
            fail("Free list holds " + count + " slots, expected " + expected);
        }
    }

    private void validateTraversal() {
        int forward = 0;
        var handle = container.begin();
        while (!handle.isEnd()) {
            forward++;
            handle = handle.next();
        }
        if (forward != container.size()) {
            fail("Forward traversal visited " + forward + " elements, size is " + container.size());
        }
        int backward = 0;
        var descending = container.descendingIterator();
        while (descending.hasNext()) {
            descending.next();
            backward++;
        }
        if (backward != container.size()) {
            fail("Backward traversal visited " + backward + " elements, size is " + container.size());
        }
    }

    private void expectState(Block<?> block, int offset, SlotState expected) {
        var actual = block.state(offset);
        if (actual != expected) {
            fail(block + " slot " + offset + " is " + actual + ", expected " + expected);
        }
    }

    private void fail(String message) {
        log.error("Container invariant violated: {}", message);
        throw new AssertionError(message);
    }
}
