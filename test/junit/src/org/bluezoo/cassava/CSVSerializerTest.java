/*
 * CSVSerializerTest.java
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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link CSVSerializer}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class CSVSerializerTest {

    @Test
    public void testQuoted() {
        CSVSerializer serializer = new CSVSerializer(CSVConfiguration.DEFAULT);
        assertEquals("\"a\",\"b\"\"c\",\"d,e\"", serializer.format(Arrays.asList("a", "b\"c", "d,e")));
        assertEquals("\"\"\"\"\"\"", serializer.format(Collections.singletonList("\"\"")));
    }

    @Test
    public void testNullAndEmptyFields() {
        CSVSerializer serializer = new CSVSerializer(CSVConfiguration.DEFAULT);
        assertEquals("\"\",\"x\",\"\"", serializer.format(Arrays.asList(null, "x", "")));
    }

    @Test
    public void testCustomDelimiterAndQuote() {
        CSVConfiguration config = new CSVConfiguration.Builder().delimiter(';').quote('\'').build();
        CSVSerializer serializer = new CSVSerializer(config);
        assertEquals("'it''s';'\"'", serializer.format(Arrays.asList("it's", "\"")));
    }

    @Test
    public void testUnquoted() {
        CSVConfiguration config = new CSVConfiguration.Builder().delimiter('\t').noQuote().build();
        CSVSerializer serializer = new CSVSerializer(config);
        assertEquals("a\tb,c\t\"d\"", serializer.format(Arrays.asList("a", "b,c", "\"d\"")));

        StringBuilder buf = new StringBuilder("> ");
        serializer.format(Arrays.asList("x", "y"), buf);
        assertEquals("> x\ty", buf.toString());
    }

    @Test
    public void testUnquotedRejectsUnrepresentable() {
        CSVSerializer serializer = new CSVSerializer(new CSVConfiguration.Builder().noQuote().build());
        for (String field : new String[] { "a,b", "a\nb", "a\rb" }) {
            try {
                serializer.format(Arrays.asList("ok", field));
                fail("Expected IllegalArgumentException for " + field);
            } catch (IllegalArgumentException e) {
                assertTrue(e.getMessage().startsWith("Field cannot be written without quoting"));
            }
        }
    }

    @Test
    public void testParsesBack() {
        List<List<String>> records = new ArrayList<>();
        records.add(Arrays.asList("plain", "with,comma", "with \"quotes\""));
        records.add(Arrays.asList("multi\r\nline", "", "\""));
        records.add(Arrays.asList("ünïcödé", "lone\rcr"));

        RecordingHandler handler = new RecordingHandler();
        CSVParser parser = new CSVParser(handler.builder().build());
        StringBuilder doc = new StringBuilder();
        for (List<String> record : records) {
            doc.append(parser.serialize(record)).append("\r\n");
        }
        parser.receive(doc.toString());
        assertTrue(parser.finish());

        assertEquals(records, handler.records);
        assertTrue(handler.errors.isEmpty());
    }

}
