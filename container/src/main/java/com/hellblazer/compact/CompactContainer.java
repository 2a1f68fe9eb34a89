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

import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Block structured object pool with stable handles.
 * <p>
 * Elements live in slots of blocks that are allocated in one shot and never moved or resized. A handle returned by
 * {@link #emplace(Supplier)} refers to its element until that element is erased: growing the container, reserving
 * capacity, merging another container in or erasing other elements never invalidates it. Erased slots are threaded
 * onto a free list and reused before the container grows; memory is only reclaimed by {@link #clear()}.
 * <p>
 * Iteration visits the live elements in block creation order, then slot order, skipping free slots. Each block
 * is bracketed by two sentinel slots whose links lead to the neighbouring blocks, so stepping never needs more
 * than the current position.
 * <p>
 * Not thread safe. Use {@link SharedCompactContainer} for a container shared between threads.
 *
 * @author <a href="mailto:hal.hildebrand@gmail.com">Hal Hildebrand</a>
 */
public class CompactContainer<T> implements Iterable<T> {
    private static final Logger log = LoggerFactory.getLogger(CompactContainer.class);

    private final CompactContainerConfiguration configuration;
    private final Consumer<? super T>           destroyer;
    private final Handle<T>                     end = Handle.endOf(this);
    private final ContainerValidator            validator;

    private ArrayList<Block<T>> blocks   = new ArrayList<>();
    private long                freeList = SlotLink.NO_SLOT;
    private int                 size;
    private int                 capacity;
    private long                nextStamp;

    // Metrics for monitoring
    private long emplaceCount;
    private long eraseCount;
    private long growthCount;

    public CompactContainer() {
        this(CompactContainerConfiguration.getDefault());
    }

    public CompactContainer(CompactContainerConfiguration configuration) {
        this(configuration, e -> {
        });
    }

    /**
     * @param configuration the container's configuration
     * @param destroyer     invoked exactly once for every element, when it is erased or when the container is
     *                      cleared
     */
    public CompactContainer(CompactContainerConfiguration configuration, Consumer<? super T> destroyer) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.destroyer = Objects.requireNonNull(destroyer, "destroyer");
        this.validator = new ContainerValidator(this);
    }

    /**
     * Position of the first live element, or {@link #end()} if the container is empty
     */
    public Handle<T> begin() {
        if (blocks.isEmpty()) {
            return end;
        }
        return following(blocks.get(0), 0);
    }

    public int blockCount() {
        return blocks.size();
    }

    /**
     * Total number of slots, used and free, in all blocks
     */
    public int capacity() {
        return capacity;
    }

    /**
     * Destroy every element and release all blocks, returning the container to its initial empty state. Handles
     * into the container become stale.
     */
    public void clear() {
        var released = blocks;
        int destroyed = size;
        blocks = new ArrayList<>();
        freeList = SlotLink.NO_SLOT;
        size = 0;
        capacity = 0;
        nextStamp = 0;

        RuntimeException failure = null;
        for (var block : released) {
            for (int i = 1; i <= block.capacity; i++) {
                if (SlotLink.isUsed(block.links[i])) {
                    try {
                        destroyer.accept(block.element(i));
                    } catch (RuntimeException e) {
                        if (failure == null) {
                            failure = e;
                        } else {
                            failure.addSuppressed(e);
                        }
                    }
                }
            }
            block.detach();
        }
        log.trace("Cleared {} elements in {} blocks", destroyed, released.size());
        if (failure != null) {
            throw failure;
        }
    }

    public Iterator<T> descendingIterator() {
        return new ElementIterator(true);
    }

    /**
     * Construct an element into a free slot, growing the container when no slot is free.
     *
     * @param constructor supplies the new element, must not return null. If it throws, no slot is consumed. It is
     *                    not called when growth fails.
     * @return the handle of the new element
     * @throws BlockAllocationException if the container had to grow and could not
     */
    public Handle<T> emplace(Supplier<? extends T> constructor) {
        Objects.requireNonNull(constructor, "constructor");
        if (freeList == SlotLink.NO_SLOT) {
            grow();
        }
        T element = Objects.requireNonNull(constructor.get(), "constructed element");
        if (freeList == SlotLink.NO_SLOT) {
            // the constructor itself emplaced into this container
            grow();
        }
        return occupy(element);
    }

    /**
     * Construct an element that needs its own handle, such as a mesh cell registering itself with its neighbours.
     * The factory receives the handle the element will have. It must not modify this container.
     *
     * @throws ConcurrentModificationException if the factory modified the container
     */
    public Handle<T> emplaceWithHandle(Function<? super Handle<T>, ? extends T> factory) {
        Objects.requireNonNull(factory, "factory");
        if (freeList == SlotLink.NO_SLOT) {
            grow();
        }
        long reserved = freeList;
        T element = Objects.requireNonNull(factory.apply(handleOf(reserved)), "constructed element");
        if (freeList != reserved) {
            throw new ConcurrentModificationException("Element factory modified the container");
        }
        return occupy(element);
    }

    /**
     * The canonical past-the-end position
     */
    public Handle<T> end() {
        return end;
    }

    /**
     * Containers are equal if they hold equal elements in the same iteration order
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CompactContainer<?> other) || size != other.size) {
            return false;
        }
        Iterator<?> mine = iterator();
        Iterator<?> theirs = other.iterator();
        while (mine.hasNext()) {
            if (!Objects.equals(mine.next(), theirs.next())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Destroy the element referenced by the handle and return its slot to the free list. Other handles are not
     * affected.
     *
     * @throws IllegalArgumentException if the handle belongs to another container
     * @throws IllegalStateException    if the slot is not in use or the handle is stale
     * @throws NoSuchElementException   if the handle is the end handle
     */
    public void erase(Handle<T> handle) {
        checkOwned(handle);
        if (handle.isEnd()) {
            throw new NoSuchElementException("Cannot erase the end handle");
        }
        var block = handle.block;
        int offset = handle.offset;
        if (!block.isRealSlot(offset) || !SlotLink.isUsed(block.links[offset])) {
            throw new IllegalStateException("Slot is not in use: " + handle);
        }
        T element = block.element(offset);
        block.elements[offset] = null;
        block.links[offset] = SlotLink.free(freeList);
        freeList = SlotLink.address(block.id, offset);
        size--;
        eraseCount++;
        validate();
        destroyer.accept(element);
    }

    /**
     * Erase every element in the half open range {@code [first, last)}.
     *
     * The range is checked before anything is erased, so a rejected range leaves the container unchanged.
     *
     * @throws IllegalArgumentException if {@code last} is neither the end handle nor in use, or is not reachable
     *                                  from {@code first}
     * @throws IllegalStateException    if {@code first} is neither the end handle nor in use
     */
    public void erase(Handle<T> first, Handle<T> last) {
        checkOwned(first);
        checkOwned(last);
        if (!first.isEnd() && !isUsed(first)) {
            throw new IllegalStateException("Range start is not in use: " + first);
        }
        if (!last.isEnd() && !isUsed(last)) {
            throw new IllegalArgumentException("Range end is not in use: " + last);
        }
        var current = first;
        while (!current.equals(last)) {
            if (current.isEnd()) {
                throw new IllegalArgumentException("Range end is not reachable from its start: " + last);
            }
            current = current.next();
        }
        current = first;
        while (!current.equals(last)) {
            var next = current.next();
            erase(current);
            current = next;
        }
    }

    /**
     * The element at a global slot index.
     *
     * @throws IndexOutOfBoundsException if the index is not in {@code [0, capacity())}
     * @throws IllegalStateException     if the slot is free
     */
    public T get(int index) {
        return handleAt(index).get();
    }

    public CompactContainerConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Get container statistics for monitoring
     */
    public String getStatistics() {
        return String.format("CompactContainer[size=%d, capacity=%d, blocks=%d, emplaced=%d, erased=%d, grown=%d, occupancy=%.2f%%]",
                             size, capacity, blocks.size(), emplaceCount, eraseCount, growthCount,
                             capacity > 0 ? (100.0 * size / capacity) : 0.0);
    }

    /**
     * The handle of the slot with the given global index. Indices cover free slots as well as used ones; the index
     * of a slot never changes while the slot's block belongs to this container.
     *
     * @throws IndexOutOfBoundsException if the index is not in {@code [0, capacity())}
     */
    public Handle<T> handleAt(int index) {
        Objects.checkIndex(index, capacity);
        int low = 0;
        int high = blocks.size() - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (blocks.get(mid).firstIndex <= index) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        var block = blocks.get(low);
        return new Handle<>(block, index - block.firstIndex + 1);
    }

    /**
     * Handles of the live elements, in iteration order
     */
    public Iterable<Handle<T>> handles() {
        return HandleIterator::new;
    }

    @Override
    public int hashCode() {
        int hash = 1;
        for (var element : this) {
            hash = 31 * hash + element.hashCode();
        }
        return hash;
    }

    /**
     * The global slot index of the handle's slot.
     *
     * @throws NoSuchElementException if the handle is the end handle
     */
    public int index(Handle<T> handle) {
        checkOwned(handle);
        if (handle.isEnd()) {
            throw new NoSuchElementException("The end handle has no index");
        }
        return handle.block.firstIndex + handle.offset - 1;
    }

    /**
     * Store an existing value, growing the container when no slot is free.
     */
    public Handle<T> insert(T value) {
        Objects.requireNonNull(value, "value");
        if (freeList == SlotLink.NO_SLOT) {
            grow();
        }
        return occupy(value);
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Whether the handle's slot holds a live element. Constant time, decided by the slot's link alone.
     *
     * @throws IllegalArgumentException if the handle belongs to another container
     * @throws IllegalStateException    if the handle is stale
     */
    public boolean isUsed(Handle<T> handle) {
        checkOwned(handle);
        if (handle.isEnd()) {
            return false;
        }
        return SlotLink.isUsed(handle.block.links[handle.offset]);
    }

    /**
     * Whether the slot with the given global index holds a live element. Agrees with {@link #isUsed(Handle)} for
     * the handle returned by {@link #handleAt(int)}.
     *
     * @throws IndexOutOfBoundsException if the index is not in {@code [0, capacity())}
     */
    public boolean isUsed(int index) {
        var handle = handleAt(index);
        return SlotLink.isUsed(handle.block.links[handle.offset]);
    }

    @Override
    public Iterator<T> iterator() {
        return new ElementIterator(false);
    }

    public int maxCapacity() {
        return configuration.getMaxCapacity();
    }

    /**
     * Move all blocks of {@code other} to the end of this container. Handles into {@code other} stay valid and
     * now belong to this container; {@code other} is left empty. Runs in time proportional to the capacity of
     * {@code other}.
     *
     * @throws IllegalArgumentException if {@code other} is this container
     * @throws BlockAllocationException if the combined capacity exceeds this container's maximum
     */
    public void merge(CompactContainer<T> other) {
        Objects.requireNonNull(other, "other");
        if (other == this) {
            throw new IllegalArgumentException("Cannot merge a container into itself");
        }
        if (other.blocks.isEmpty()) {
            return;
        }
        if ((long) capacity + other.capacity > configuration.getMaxCapacity()) {
            throw new BlockAllocationException("Merged capacity " + ((long) capacity + other.capacity)
                                               + " exceeds the maximum capacity " + configuration.getMaxCapacity(),
                                               other.capacity);
        }
        blocks.ensureCapacity(blocks.size() + other.blocks.size());

        int blockShift = blocks.size();
        int indexShift = capacity;
        for (var block : other.blocks) {
            block.owner = this;
            block.id += blockShift;
            block.firstIndex += indexShift;
            for (int i = 0; i < block.links.length; i++) {
                block.links[i] = SlotLink.rebase(block.links[i], blockShift);
            }
        }

        var first = other.blocks.get(0);
        if (!blocks.isEmpty()) {
            var last = blocks.get(blocks.size() - 1);
            last.links[last.afterEnd()] = SlotLink.boundary(SlotLink.address(first.id, 1));
            first.links[0] = SlotLink.boundary(SlotLink.address(last.id, last.lastSlot()));
        }
        blocks.addAll(other.blocks);

        // incoming free slots go in front, the existing free list hangs off their tail
        if (other.freeList != SlotLink.NO_SLOT) {
            long head = SlotLink.address(SlotLink.blockId(other.freeList) + blockShift,
                                         SlotLink.offset(other.freeList));
            long tail = head;
            long next = SlotLink.nextFree(linkAt(tail));
            while (next != SlotLink.NO_SLOT) {
                tail = next;
                next = SlotLink.nextFree(linkAt(tail));
            }
            setLink(tail, SlotLink.free(freeList));
            freeList = head;
        }

        size += other.size;
        capacity += other.capacity;
        nextStamp = Math.max(nextStamp, other.nextStamp);
        log.debug("Merged {} blocks, {} elements, capacity: {}", other.blocks.size(), other.size, capacity);

        other.blocks = new ArrayList<>();
        other.freeList = SlotLink.NO_SLOT;
        other.size = 0;
        other.capacity = 0;
        other.nextStamp = 0;
        validate();
    }

    /**
     * Whether the handle refers to a position of this container, the end position included
     */
    public boolean owns(Handle<T> handle) {
        if (handle == null) {
            return false;
        }
        if (handle.isEnd()) {
            return handle.equals(end);
        }
        return handle.block.owner == this && handle.block.isRealSlot(handle.offset);
    }

    /**
     * Whether the handle refers to a live element of this container
     */
    public boolean ownsDereferenceable(Handle<T> handle) {
        return owns(handle) && !handle.isEnd() && SlotLink.isUsed(handle.block.links[handle.offset]);
    }

    /**
     * Ensure capacity for at least {@code slots} elements. If the container is smaller, a single block making up
     * the difference is appended, so that {@code slots - size()} further elements can be stored without growth.
     */
    public void reserve(int slots) {
        if (slots < 0) {
            throw new IllegalArgumentException("Reserved slots must be non-negative: " + slots);
        }
        if (slots <= capacity) {
            return;
        }
        if (slots > configuration.getMaxCapacity()) {
            throw new BlockAllocationException(
            "Cannot reserve " + slots + " slots, maximum capacity is " + configuration.getMaxCapacity(),
            slots - capacity);
        }
        appendBlock(slots - capacity);
        log.debug("Reserved {} slots", slots);
        validate();
    }

    /**
     * Number of live elements
     */
    public int size() {
        return size;
    }

    @Override
    public Spliterator<T> spliterator() {
        return Spliterators.spliterator(iterator(), size,
                                        Spliterator.ORDERED | Spliterator.SIZED | Spliterator.NONNULL);
    }

    public Stream<T> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    /**
     * Exchange the contents of two containers. Handles follow their elements into the other container. Each
     * container keeps its own configuration and destroyer.
     */
    public void swap(CompactContainer<T> other) {
        Objects.requireNonNull(other, "other");
        if (other == this) {
            return;
        }
        var swappedBlocks = blocks;
        blocks = other.blocks;
        other.blocks = swappedBlocks;

        long swappedFreeList = freeList;
        freeList = other.freeList;
        other.freeList = swappedFreeList;

        int swappedSize = size;
        size = other.size;
        other.size = swappedSize;

        int swappedCapacity = capacity;
        capacity = other.capacity;
        other.capacity = swappedCapacity;

        long swappedStamp = nextStamp;
        nextStamp = other.nextStamp;
        other.nextStamp = swappedStamp;

        blocks.forEach(b -> b.owner = this);
        other.blocks.forEach(b -> b.owner = other);
        validate();
        other.validate();
    }

    @Override
    public String toString() {
        return "CompactContainer[size=" + size + ", capacity=" + capacity + ", blocks=" + blocks.size() + "]";
    }

    List<Block<T>> blocks() {
        return blocks;
    }

    long freeListHead() {
        return freeList;
    }

    /**
     * Position of the next live element after the given position, or the end handle
     */
    Handle<T> following(Block<T> block, int offset) {
        var b = block;
        int i = offset + 1;
        while (true) {
            long link = b.links[i];
            switch (SlotLink.state(link)) {
                case USED -> {
                    return new Handle<>(b, i);
                }
                case FREE -> i++;
                case BLOCK_BOUNDARY -> {
                    long target = SlotLink.target(link);
                    b = blocks.get(SlotLink.blockId(target));
                    i = SlotLink.offset(target);
                }
                case START_END -> {
                    return end;
                }
            }
        }
    }

    /**
     * Position of the last live element
     *
     * @throws NoSuchElementException if the container is empty
     */
    Handle<T> last() {
        var last = lastOrNull();
        if (last == null) {
            throw new NoSuchElementException("Container is empty");
        }
        return last;
    }

    long linkAt(long address) {
        return blocks.get(SlotLink.blockId(address)).links[SlotLink.offset(address)];
    }

    /**
     * Position of the previous live element before the given position
     *
     * @throws NoSuchElementException if there is none
     */
    Handle<T> preceding(Block<T> block, int offset) {
        var previous = precedingOrNull(block, offset);
        if (previous == null) {
            throw new NoSuchElementException("No element before " + new Handle<>(block, offset));
        }
        return previous;
    }

    private void checkOwned(Handle<T> handle) {
        Objects.requireNonNull(handle, "handle");
        if (handle.container() != this) {
            throw new IllegalArgumentException("Handle does not belong to this container: " + handle);
        }
    }

    private void grow() {
        int requested = configuration.getGrowthPolicy().nextBlockSize(capacity, blocks.size());
        if (requested <= 0) {
            throw new IllegalStateException(
            "Growth policy " + configuration.getGrowthPolicy() + " returned block size " + requested);
        }
        int available = configuration.getMaxCapacity() - capacity;
        if (available <= 0) {
            log.error("Container is at its maximum capacity of {} slots", configuration.getMaxCapacity());
            throw new BlockAllocationException(
            "Container is at its maximum capacity of " + configuration.getMaxCapacity() + " slots", requested);
        }
        appendBlock(Math.min(requested, available));
    }

    private Block<T> appendBlock(int slots) {
        Block<T> block;
        try {
            block = new Block<>(this, blocks.size(), capacity, slots);
            blocks.add(block);
        } catch (OutOfMemoryError e) {
            log.error("Unable to allocate a block of {} slots, capacity: {}", slots, capacity);
            throw new BlockAllocationException("Unable to allocate a block of " + slots + " slots", slots, e);
        }

        if (block.id > 0) {
            var previous = blocks.get(block.id - 1);
            previous.links[previous.afterEnd()] = SlotLink.boundary(SlotLink.address(block.id, 1));
            block.links[0] = SlotLink.boundary(SlotLink.address(previous.id, previous.lastSlot()));
        }
        // pushed in reverse so the block fills from its first slot
        for (int i = slots; i >= 1; i--) {
            block.links[i] = SlotLink.free(freeList);
            freeList = SlotLink.address(block.id, i);
        }
        capacity += slots;
        growthCount++;
        log.debug("Appended block {} of {} slots, capacity: {}", block.id, slots, capacity);
        return block;
    }

    private Handle<T> handleOf(long address) {
        return new Handle<>(blocks.get(SlotLink.blockId(address)), SlotLink.offset(address));
    }

    private Handle<T> lastOrNull() {
        if (blocks.isEmpty()) {
            return null;
        }
        var last = blocks.get(blocks.size() - 1);
        return precedingOrNull(last, last.afterEnd());
    }

    private Handle<T> occupy(T element) {
        long address = freeList;
        var block = blocks.get(SlotLink.blockId(address));
        int offset = SlotLink.offset(address);
        freeList = SlotLink.nextFree(block.links[offset]);
        block.elements[offset] = element;
        block.links[offset] = SlotLink.USED;
        size++;
        emplaceCount++;
        if (configuration.isTimeStampingEnabled() && element instanceof TimeStamped stamped) {
            stamped.setTimeStamp(nextStamp++);
        }
        validate();
        return new Handle<>(block, offset);
    }

    private Handle<T> precedingOrNull(Block<T> block, int offset) {
        var b = block;
        int i = offset - 1;
        while (true) {
            long link = b.links[i];
            switch (SlotLink.state(link)) {
                case USED -> {
                    return new Handle<>(b, i);
                }
                case FREE -> i--;
                case BLOCK_BOUNDARY -> {
                    long target = SlotLink.target(link);
                    b = blocks.get(SlotLink.blockId(target));
                    i = SlotLink.offset(target);
                }
                case START_END -> {
                    return null;
                }
            }
        }
    }

    private void setLink(long address, long link) {
        blocks.get(SlotLink.blockId(address)).links[SlotLink.offset(address)] = link;
    }

    private void validate() {
        if (configuration.isValidationEnabled()) {
            validator.validateInvariants();
        }
    }

    private class ElementIterator implements Iterator<T> {
        private final boolean descending;
        private Handle<T>     cursor;
        private Handle<T>     lastReturned;

        ElementIterator(boolean descending) {
            this.descending = descending;
            this.cursor = descending ? lastOrNull() : begin();
        }

        @Override
        public boolean hasNext() {
            return cursor != null && !cursor.isEnd();
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            lastReturned = cursor;
            cursor = descending ? precedingOrNull(cursor.block, cursor.offset) : cursor.next();
            return lastReturned.get();
        }

        @Override
        public void remove() {
            if (lastReturned == null) {
                throw new IllegalStateException("next() has not been called since the last remove()");
            }
            erase(lastReturned);
            lastReturned = null;
        }
    }

    private class HandleIterator implements Iterator<Handle<T>> {
        private Handle<T> cursor = begin();

        @Override
        public boolean hasNext() {
            return !cursor.isEnd();
        }

        @Override
        public Handle<T> next() {
            if (cursor.isEnd()) {
                throw new NoSuchElementException();
            }
            var current = cursor;
            cursor = cursor.next();
            return current;
        }
    }
}
