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
 * Raised when a {@link CompactContainer} cannot append a block, either because the JVM could not allocate it or
 * because the configured maximum capacity would be exceeded. The container is left exactly as it was before the
 * failed growth.
 *
 * @author <a href="mailto:hal.hildebrand@gmail.com">Hal Hildebrand</a>
 */
public class BlockAllocationException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final int requestedSlots;

    public BlockAllocationException(String message, int requestedSlots) {
        super(message);
        this.requestedSlots = requestedSlots;
    }

    public BlockAllocationException(String message, int requestedSlots, Throwable cause) {
        super(message, cause);
        this.requestedSlots = requestedSlots;
    }

    /**
     * Number of slots of the block that could not be appended
     */
    public int getRequestedSlots() {
        return requestedSlots;
    }
}
