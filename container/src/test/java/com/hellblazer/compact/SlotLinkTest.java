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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author <a href="mailto:hal.hildebrand@gmail.com">Hal Hildebrand</a>
 */
public class SlotLinkTest {

    @Test
    public void testUsedIsReserved() {
        assertEquals(SlotState.USED, SlotLink.state(SlotLink.USED));
        assertTrue(SlotLink.isUsed(SlotLink.USED));
        assertFalse(SlotLink.isUsed(SlotLink.free(SlotLink.NO_SLOT)));
        assertFalse(SlotLink.isUsed(SlotLink.free(SlotLink.address(0, 1))));
        assertFalse(SlotLink.isUsed(SlotLink.boundary(SlotLink.address(0, 1))));
        assertFalse(SlotLink.isUsed(SlotLink.START_END));
    }

    @Test
    public void testFreeChain() {
        long address = SlotLink.address(12, 345);
        long link = SlotLink.free(address);
        assertEquals(SlotState.FREE, SlotLink.state(link));
        assertEquals(address, SlotLink.nextFree(link));
        assertEquals(SlotLink.NO_SLOT, SlotLink.nextFree(SlotLink.free(SlotLink.NO_SLOT)));
        assertEquals("FREE->12:345", SlotLink.toString(link));
        assertEquals("FREE->nil", SlotLink.toString(SlotLink.free(SlotLink.NO_SLOT)));
    }

    @Test
    public void testAddresses() {
        long address = SlotLink.address(1 << 20, Integer.MAX_VALUE);
        assertEquals(1 << 20, SlotLink.blockId(address));
        assertEquals(Integer.MAX_VALUE, SlotLink.offset(address));
        long boundary = SlotLink.boundary(address);
        assertEquals(SlotState.BLOCK_BOUNDARY, SlotLink.state(boundary));
        assertEquals(address, SlotLink.target(boundary));
    }

    @Test
    public void testRebase() {
        long free = SlotLink.free(SlotLink.address(2, 3));
        assertEquals(SlotLink.address(7, 3), SlotLink.nextFree(SlotLink.rebase(free, 5)));

        long tail = SlotLink.free(SlotLink.NO_SLOT);
        assertEquals(tail, SlotLink.rebase(tail, 5));

        long boundary = SlotLink.boundary(SlotLink.address(0, 9));
        assertEquals(SlotLink.address(4, 9), SlotLink.target(SlotLink.rebase(boundary, 4)));

        assertEquals(SlotLink.USED, SlotLink.rebase(SlotLink.USED, 3));
        assertEquals(SlotLink.START_END, SlotLink.rebase(SlotLink.START_END, 3));
    }
}
