/*
 * CSVParserChunkingTest.java
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

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.Assert.*;

/**
 * Verifies that the events produced by {@link CSVParser} do not depend on
 * how the input is divided into buffers.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class CSVParserChunkingTest {

    private static final String[] DOCUMENTS = {
        "x,y\r\nz,\"a\"\"b\"\n",
        "a\rb\nc\r\nd",
        "\"multi\r\nline\",\"with,comma\"\r\n\"\"\"\",\r",
        "a,b\"c,d\ne,f\n\"g\"h\r\ni\rj\"\rk\n",
        "naïve,日本語,€\n\"ü\"\"ö\",ß",
        "\uFEFFid,name\n1,Smith\n",
        "a,\"unterminated\n",
    };

    private static final String HEADED_DOCUMENT =
        "id,\"na\"\"me\"\r\n1,\"multi\r\nline\"\r\n2,bad\"\rquote\r3,\"\"\n4,x";

    /**
     * Returns a configuration delivering fields, records and errors to the
     * handler, and optionally the header to a second handler sharing its
     * event list.
     */
    private static CSVConfiguration configure(RecordingHandler handler, boolean quoteRequired,
                                              boolean header) {
        CSVConfiguration.Builder builder = handler.builder()
            .fieldHandler(handler)
            .quoteRequired(quoteRequired);
        if (header) {
            RecordingHandler headerHandler = new RecordingHandler("header-", handler.events);
            builder.headerFieldHandler(headerHandler).headerHandler(headerHandler);
        }
        return builder.build();
    }

    private static List<String> parseWhole(byte[] data, CSVConfiguration config,
                                           RecordingHandler handler) {
        CSVParser parser = new CSVParser(config);
        parser.receive(data);
        handler.events.add("finish:" + parser.finish());
        return handler.events;
    }

    private static List<String> parseSplit(byte[] data, int split, CSVConfiguration config,
                                           RecordingHandler handler) {
        CSVParser parser = new CSVParser(config);
        ByteBuffer first = ByteBuffer.wrap(data, 0, split);
        parser.receive(first);
        assertFalse(first.hasRemaining());
        ByteBuffer second = ByteBuffer.wrap(data, split, data.length - split);
        parser.receive(second);
        assertFalse(second.hasRemaining());
        handler.events.add("finish:" + parser.finish());
        return handler.events;
    }

    private static void assertSplitInvariant(String document, boolean quoteRequired, boolean header) {
        byte[] data = document.getBytes(StandardCharsets.UTF_8);
        RecordingHandler whole = new RecordingHandler();
        List<String> expected = parseWhole(data, configure(whole, quoteRequired, header), whole);
        for (int split = 0; split <= data.length; split++) {
            RecordingHandler handler = new RecordingHandler();
            List<String> actual = parseSplit(data, split, configure(handler, quoteRequired, header), handler);
            assertEquals("split at " + split + " of " + document, expected, actual);
        }
    }

    @Test
    public void testEverySplitPoint() {
        for (String document : DOCUMENTS) {
            assertSplitInvariant(document, false, false);
        }
    }

    @Test
    public void testEverySplitPointQuoteRequired() {
        for (String document : DOCUMENTS) {
            assertSplitInvariant(document, true, false);
        }
    }

    @Test
    public void testEverySplitPointWithHeader() {
        for (String document : DOCUMENTS) {
            assertSplitInvariant(document, false, true);
        }
        assertSplitInvariant(HEADED_DOCUMENT, false, true);
    }

    @Test
    public void testHeaderAndFieldEvents() {
        RecordingHandler handler = new RecordingHandler();
        List<String> events = parseWhole(HEADED_DOCUMENT.getBytes(StandardCharsets.UTF_8),
                                         configure(handler, false, true), handler);

        assertEquals("header-field:id:0:1", events.get(0));
        assertEquals("header-field:na\"me:1:1", events.get(1));
        assertEquals("header-record:[id, na\"me]:1", events.get(2));
        assertEquals("field:1:0:2", events.get(3));
        assertEquals("field:multi\r\nline:1:2", events.get(4));
        assertEquals("record:[1, multi\r\nline]:2", events.get(5));
        assertEquals("field:2:0:3", events.get(6));
        assertEquals("error:\":3:6:35:IN_UNQUOTED_FIELD", events.get(7));
        assertEquals("field:quote:0:4", events.get(8));
        assertTrue(events.contains("record:[4, x]:6"));
        assertEquals("finish:true", events.get(events.size() - 1));
    }

    @Test
    public void testByteAtATime() {
        String document = "\uFEFF\"q\"\"uo\nte\",x\r\nbad\"line,here\r\n€,\"\"\r\n";
        byte[] data = document.getBytes(StandardCharsets.UTF_8);
        RecordingHandler whole = new RecordingHandler();
        List<String> expected = parseWhole(data, whole.builder().fieldHandler(whole).build(), whole);

        RecordingHandler handler = new RecordingHandler();
        CSVParser parser = new CSVParser(handler.builder().fieldHandler(handler).build());
        for (int i = 0; i < data.length; i++) {
            parser.receive(new byte[] { data[i] });
        }
        handler.events.add("finish:" + parser.finish());
        assertEquals(expected, handler.events);

        assertEquals(2, handler.records.size());
        assertEquals("q\"uo\nte", handler.records.get(0).get(0));
        assertEquals("€", handler.records.get(1).get(0));
        assertEquals(1, handler.errors.size());
        assertEquals("\"line,here", handler.errors.get(0).getInput());
        assertEquals(2L, handler.errors.get(0).getLineNumber());
    }

    @Test
    public void testEmptyBuffers() {
        RecordingHandler handler = new RecordingHandler();
        CSVParser parser = new CSVParser(handler.builder().build());
        parser.receive(new byte[0]);
        parser.receive("a,");
        parser.receive(new byte[0]);
        parser.receive("b\n");

        assertEquals(1, handler.records.size());
        assertEquals("b", handler.records.get(0).get(1));
    }

    @Test
    public void testLargeDocument() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        int count = 5000;
        for (int i = 0; i < count; i++) {
            byte[] line = (i + ",\"value " + i + "\",\"a\"\"b\"\r\n").getBytes(StandardCharsets.UTF_8);
            out.write(line, 0, line.length);
        }
        byte[] data = out.toByteArray();

        RecordingHandler handler = new RecordingHandler();
        CSVParser parser = new CSVParser(handler.builder().build());
        int chunk = 777;
        for (int pos = 0; pos < data.length; pos += chunk) {
            parser.receive(ByteBuffer.wrap(data, pos, Math.min(chunk, data.length - pos)));
        }
        assertTrue(parser.finish());

        assertEquals(count, handler.records.size());
        assertTrue(handler.errors.isEmpty());
        List<String> last = handler.records.get(count - 1);
        assertEquals(String.valueOf(count - 1), last.get(0));
        assertEquals("value " + (count - 1), last.get(1));
        assertEquals("a\"b", last.get(2));
        assertEquals(Long.valueOf(count), handler.lines.get(count - 1));
    }

}
