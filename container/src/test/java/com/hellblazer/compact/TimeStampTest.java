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

import java.util.ArrayList;
import java.util.Comparator;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author <a href="mailto:hal.hildebrand@gmail.com">Hal Hildebrand</a>
 */
public class TimeStampTest {

    @Test
    public void testStampsFollowCreationOrder() {
        var container = new CompactContainer<Stamped>();
        var handles = new ArrayList<Handle<Stamped>>();
        for (int i = 0; i < 10; i++) {
            handles.add(container.emplace(Stamped::new));
        }
        container.erase(handles.get(2));
        container.erase(handles.get(5));
        var late = container.emplace(Stamped::new);
        var later = container.emplace(Stamped::new);

        // reused slots come before younger elements in iteration order, stamps still give creation order
        assertEquals(10, late.get().getTimeStamp());
        assertEquals(11, later.get().getTimeStamp());
        assertTrue(container.index(later) < container.index(handles.get(9)));

        var byStamp = container.stream().sorted(Comparator.comparingLong(Stamped::getTimeStamp)).toList();
        assertSame(later.get(), byStamp.get(byStamp.size() - 1));
        assertSame(handles.get(0).get(), byStamp.get(0));
    }

    @Test
    public void testClearResetsStamps() {
        var container = new CompactContainer<Stamped>();
        container.emplace(Stamped::new);
        container.emplace(Stamped::new);
        container.clear();
        assertEquals(0, container.emplace(Stamped::new).get().getTimeStamp());
    }

    @Test
    public void testStampingDisabled() {
        var container = new CompactContainer<Stamped>(CompactContainerConfiguration.newBuilder()
                                                                                   .withTimeStamping(false)
                                                                                   .build());
        container.emplace(Stamped::new);
        assertEquals(-1, container.emplace(Stamped::new).get().getTimeStamp());
    }

    @Test
    public void testUnstampedElementsAreIgnored() {
        var container = new CompactContainer<Object>();
        container.insert("plain");
        var stamped = container.insert(new Stamped());
        assertEquals(0, ((Stamped) stamped.get()).getTimeStamp());
    }

    static class Stamped implements TimeStamped {
        private long stamp = -1;

        @Override
        public long getTimeStamp() {
            return stamp;
        }

        @Override
        public void setTimeStamp(long stamp) {
            this.stamp = stamp;
        }
    }
}
