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
 * Encoding of the per-slot link field and of slot addresses.
 * <p>
 * A link is a {@code long} whose two low bits are the {@link SlotState} tag and whose remaining bits are the
 * payload. USED carries no payload, so the USED link is the reserved value {@code 0} and can never be confused
 * with a chain reference. FREE carries the address of the next free slot plus one, leaving a zero payload for the
 * tail of the free list. BLOCK_BOUNDARY carries the address of the slot on the other side of the block boundary.
 * <p>
 * An address is {@code (blockId << 32) | offset} where offset {@code 0} and {@code capacity + 1} are the block's
 * sentinels.
 *
 * @author <a href="mailto:hal.hildebrand@gmail.com">Hal Hildebrand</a>
 */
final class SlotLink {
    static final long NO_SLOT   = -1L;
    static final long USED      = SlotState.USED.ordinal();
    static final long START_END = SlotState.START_END.ordinal();

    private static final int  TAG_BITS    = 2;
    private static final long TAG_MASK    = (1L << TAG_BITS) - 1;
    private static final long OFFSET_MASK = 0xFFFF_FFFFL;

    private SlotLink() {
    }

    static long address(int blockId, int offset) {
        return ((long) blockId << 32) | offset;
    }

    static int blockId(long address) {
        return (int) (address >>> 32);
    }

    /**
     * Link for a boundary sentinel pointing at the given address
     */
    static long boundary(long address) {
        return (address << TAG_BITS) | SlotState.BLOCK_BOUNDARY.ordinal();
    }

    /**
     * Link for a free slot whose successor on the free list is the given address, or {@link #NO_SLOT} for the tail
     */
    static long free(long nextAddress) {
        return ((nextAddress + 1) << TAG_BITS) | SlotState.FREE.ordinal();
    }

    static boolean isUsed(long link) {
        return link == USED;
    }

    /**
     * Next free address of a FREE link, {@link #NO_SLOT} at the tail
     */
    static long nextFree(long link) {
        assert state(link) == SlotState.FREE : "not a free link: " + link;
        return (link >>> TAG_BITS) - 1;
    }

    static int offset(long address) {
        return (int) (address & OFFSET_MASK);
    }

    /**
     * Shift the block id carried by a FREE or BLOCK_BOUNDARY link. Other links are returned unchanged.
     */
    static long rebase(long link, int blockShift) {
        return switch (state(link)) {
            case FREE -> {
                long next = nextFree(link);
                yield next == NO_SLOT ? link : free(shift(next, blockShift));
            }
            case BLOCK_BOUNDARY -> boundary(shift(target(link), blockShift));
            default -> link;
        };
    }

    static SlotState state(long link) {
        return SlotState.ofTag((int) (link & TAG_MASK));
    }

    /**
     * Address carried by a BLOCK_BOUNDARY link
     */
    static long target(long link) {
        assert state(link) == SlotState.BLOCK_BOUNDARY : "not a boundary link: " + link;
        return link >>> TAG_BITS;
    }

    static String toString(long link) {
        return switch (state(link)) {
            case USED, START_END -> state(link).name();
            case FREE -> {
                long next = nextFree(link);
                yield next == NO_SLOT ? "FREE->nil" : "FREE->" + blockId(next) + ":" + offset(next);
            }
            case BLOCK_BOUNDARY -> {
                long t = target(link);
                yield "BOUNDARY->" + blockId(t) + ":" + offset(t);
            }
        };
    }

    private static long shift(long address, int blockShift) {
        return address(blockId(address) + blockShift, offset(address));
    }
}
