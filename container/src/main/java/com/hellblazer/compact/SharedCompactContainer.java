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

import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * A {@link CompactContainer} shared between threads behind one coarse lock. Allocation, erasure and growth all
 * touch the container wide free list and block sequence, so the whole container is guarded jointly. Readers may
 * traverse concurrently; any mutation is exclusive.
 * <p>
 * Handles obtained through this wrapper carry no synchronization of their own. Dereference them inside
 * {@link #read(Function)} or {@link #write(Function)}.
 *
 * @author <a href="mailto:hal.hildebrand@gmail.com">Hal Hildebrand</a>
 */
public class SharedCompactContainer<T> {
    private final CompactContainer<T> container;
    private final ReadWriteLock       lock = new ReentrantReadWriteLock();

    public SharedCompactContainer(CompactContainer<T> container) {
        this.container = Objects.requireNonNull(container, "container");
    }

    public Handle<T> emplace(Supplier<? extends T> constructor) {
        return write(c -> c.emplace(constructor));
    }

    public void erase(Handle<T> handle) {
        update(c -> c.erase(handle));
    }

    public boolean isUsed(Handle<T> handle) {
        return read(c -> c.isUsed(handle));
    }

    /**
     * Run a query against the container under the read lock. The action must not modify the container.
     */
    public <R> R read(Function<? super CompactContainer<T>, ? extends R> action) {
        lock.readLock().lock();
        try {
            return action.apply(container);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        return read(CompactContainer::size);
    }

    /**
     * Run a mutation against the container under the write lock.
     */
    public void update(Consumer<? super CompactContainer<T>> action) {
        lock.writeLock().lock();
        try {
            action.accept(container);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Run a mutation against the container under the write lock and return its result.
     */
    public <R> R write(Function<? super CompactContainer<T>, ? extends R> action) {
        lock.writeLock().lock();
        try {
            return action.apply(container);
        } finally {
            lock.writeLock().unlock();
        }
    }
}
