/*
 * CallbackRouterTest.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of Cassava, a streaming CSV parser.
 *
 * Cassava is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * Cassava is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with Cassava.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.cassava;

import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link CallbackRouter}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class CallbackRouterTest {

    @Test
    public void testWithoutHeader() {
        RecordingHandler data = new RecordingHandler();
        CallbackRouter router = new CallbackRouter(null, data, null, data);
        assertFalse(router.isHeaderPending());

        router.field("a", 0, 1L);
        assertNull(router.record(Arrays.asList("a"), 1L));
        assertEquals(Arrays.asList("field:a:0:1", "record:[a]:1"), data.events);
        assertNull(router.getHeader());
    }

    @Test
    public void testHeaderRoutedOnce() {
        RecordingHandler header = new RecordingHandler();
        RecordingHandler data = new RecordingHandler();
        CallbackRouter router = new CallbackRouter(header, data, header, data);
        assertTrue(router.isHeaderPending());

        router.field("h", 0, 1L);
        router.record(Arrays.asList("h"), 1L);
        assertFalse(router.isHeaderPending());
        router.field("v", 0, 2L);
        router.record(Arrays.asList("v"), 2L);

        assertEquals(Arrays.asList("field:h:0:1", "record:[h]:1"), header.events);
        assertEquals(Arrays.asList("field:v:0:2", "record:[v]:2"), data.events);
        assertEquals(Arrays.asList("h"), router.getHeader());

        router.reset();
        assertTrue(router.isHeaderPending());
        assertNull(router.getHeader());
    }

    @Test
    public void testHeaderFieldHandlerOnly() {
        RecordingHandler header = new RecordingHandler();
        RecordingHandler data = new RecordingHandler();
        CallbackRouter router = new CallbackRouter(header, null, null, data);
        assertTrue(router.isHeaderPending());

        router.field("h", 0, 1L);
        assertNull(router.record(Arrays.asList("h"), 1L));
        router.field("v", 0, 2L);
        router.record(Arrays.asList("v"), 2L);

        assertEquals(Arrays.asList("field:h:0:1"), header.events);
        assertEquals(Arrays.asList("record:[v]:2"), data.events);
    }

}
