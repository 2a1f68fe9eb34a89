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

import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Random sequences of emplace and erase checked against a plain list of live handles.
 *
 * @author <a href="mailto:hal.hildebrand@gmail.com">Hal Hildebrand</a>
 */
@Label("Compact container properties")
class CompactContainerPropertyTest {

    @Provide
    Arbitrary<GrowthPolicy> policies() {
        return Arbitraries.of(GrowthPolicy.doubling(), GrowthPolicy.constant(1), GrowthPolicy.constant(7),
                              GrowthPolicy.additive(3, 2), GrowthPolicy.geometric(2, 0.75));
    }

    @Property(tries = 200)
    @Label("Handles keep their elements across any mix of emplace and erase")
    void handlesAreStable(@ForAll @Size(max = 400) List<@IntRange(min = 0, max = 99) Integer> operations,
                          @ForAll("policies") GrowthPolicy policy) {
        var destroyed = new IdentityHashMap<Object, Integer>();
        var container = new CompactContainer<Object>(CompactContainerConfiguration.newBuilder()
                                                                                  .withGrowthPolicy(policy)
                                                                                  .build(),
                                                     e -> destroyed.merge(e, 1, Integer::sum));
        var live = new ArrayList<Handle<Object>>();
        var elements = new ArrayList<Object>();
        int peakCapacity = 0;

        for (int op : operations) {
            if (op < 60 || live.isEmpty()) {
                var element = new Object();
                var handle = container.insert(element);
                assertFalse(live.contains(handle), "live slot handed out twice");
                live.add(handle);
                elements.add(element);
            } else {
                int victim = op % live.size();
                var handle = live.remove(victim);
                var element = elements.remove(victim);
                int capacity = container.capacity();
                container.erase(handle);
                assertFalse(container.isUsed(handle));
                assertEquals(capacity, container.capacity());
                assertEquals(1, destroyed.get(element));
            }
            peakCapacity = Math.max(peakCapacity, container.capacity());

            assertEquals(live.size(), container.size());
            for (int i = 0; i < live.size(); i++) {
                assertTrue(container.isUsed(live.get(i)));
                assertSame(elements.get(i), live.get(i).get());
            }
        }
        new ContainerValidator(container).validateInvariants();

        var visited = new IdentityHashMap<Object, Boolean>();
        container.forEach(e -> assertNull(visited.put(e, Boolean.TRUE), "element visited twice"));
        assertEquals(live.size(), visited.size());
        for (var element : elements) {
            assertTrue(visited.containsKey(element));
        }
        // capacity never shrinks
        assertEquals(peakCapacity, container.capacity());
    }

    @Property(tries = 100)
    @Label("Erasing k elements and emplacing k again does not grow the container")
    void reusePrecedesGrowth(@ForAll @IntRange(min = 1, max = 300) int count,
                             @ForAll @IntRange(min = 0, max = 300) int erased,
                             @ForAll("policies") GrowthPolicy policy) {
        var container = new CompactContainer<Integer>(CompactContainerConfiguration.newBuilder()
                                                                                   .withGrowthPolicy(policy)
                                                                                   .build());
        var handles = new ArrayList<Handle<Integer>>();
        for (int i = 0; i < count; i++) {
            handles.add(container.insert(i));
        }
        int k = Math.min(erased, count);
        for (int i = 0; i < k; i++) {
            container.erase(handles.get(i));
        }
        int capacity = container.capacity();
        int blocks = container.blockCount();
        for (int i = 0; i < k; i++) {
            container.insert(-i);
        }
        assertEquals(capacity, container.capacity());
        assertEquals(blocks, container.blockCount());
        assertEquals(count, container.size());
    }

    @Property(tries = 100)
    @Label("Index and handle views of a slot agree")
    void indexViewAgrees(@ForAll @Size(min = 1, max = 200) List<Boolean> keep) {
        var container = new CompactContainer<Integer>(CompactContainerConfiguration.newBuilder()
                                                                                   .withGrowthPolicy(
                                                                                   GrowthPolicy.constant(9))
                                                                                   .build());
        var handles = new ArrayList<Handle<Integer>>();
        for (int i = 0; i < keep.size(); i++) {
            handles.add(container.insert(i));
        }
        for (int i = 0; i < keep.size(); i++) {
            if (!keep.get(i)) {
                container.erase(handles.get(i));
            }
        }
        for (int index = 0; index < container.capacity(); index++) {
            var handle = container.handleAt(index);
            assertEquals(index, container.index(handle));
            assertEquals(container.isUsed(handle), container.isUsed(index));
            if (index < keep.size()) {
                assertEquals(keep.get(index), container.isUsed(index));
            } else {
                assertFalse(container.isUsed(index));
            }
        }
    }
}
