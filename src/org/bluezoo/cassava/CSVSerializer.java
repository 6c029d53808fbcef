/*
 * CSVSerializer.java
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

import java.text.MessageFormat;
import java.util.List;

/**
 * Renders records as delimited text, the inverse of {@link CSVParser}.
 * <p>
 * When quoting is enabled every field is quoted, and quote characters in
 * the field are doubled:
 * <pre>
 * [a, b"c, d,e]  &rarr;  "a","b""c","d,e"
 * </pre>
 * When quoting is disabled fields are joined with the delimiter as they
 * are. Such a field must not contain the delimiter or a line break
 * character, since it could not be read back.
 * <p>
 * No line terminator is appended.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class CSVSerializer {

    private final char delimiter;
    private final boolean quoting;
    private final char quote;

    /**
     * Creates a serializer using the delimiter and quote of the given
     * configuration.
     * @param configuration the configuration
     */
    public CSVSerializer(CSVConfiguration configuration) {
        this.delimiter = configuration.getDelimiter();
        this.quoting = configuration.isQuoteEnabled();
        this.quote = configuration.getQuote();
    }

    /**
     * Formats a record. A null field is written as an empty field.
     * @param record the fields
     * @return the delimited text
     * @throws IllegalArgumentException if quoting is disabled and a field
     * contains the delimiter or a line break
     */
    public String format(List<String> record) {
        StringBuilder buf = new StringBuilder();
        format(record, buf);
        return buf.toString();
    }

    /**
     * Formats a record, appending to the given buffer.
     * @param record the fields
     * @param buf the buffer to append to
     * @throws IllegalArgumentException if quoting is disabled and a field
     * contains the delimiter or a line break
     */
    public void format(List<String> record, StringBuilder buf) {
        if (quoting) {
            buf.append(quote);
        }
        int count = record.size();
        for (int i = 0; i < count; i++) {
            if (i > 0) {
                if (quoting) {
                    buf.append(quote).append(delimiter).append(quote);
                } else {
                    buf.append(delimiter);
                }
            }
            String field = record.get(i);
            if (field == null) {
                continue;
            }
            if (quoting) {
                appendEscaped(field, buf);
            } else {
                checkUnquoted(field);
                buf.append(field);
            }
        }
        if (quoting) {
            buf.append(quote);
        }
    }

    private void appendEscaped(String field, StringBuilder buf) {
        int length = field.length();
        for (int i = 0; i < length; i++) {
            char c = field.charAt(i);
            if (c == quote) {
                buf.append(quote);
            }
            buf.append(c);
        }
    }

    private void checkUnquoted(String field) {
        if (field.indexOf(delimiter) >= 0 || field.indexOf('\r') >= 0 || field.indexOf('\n') >= 0) {
            String msg = MessageFormat.format(CSVParser.L10N.getString("err.unrepresentable_field"), field);
            throw new IllegalArgumentException(msg);
        }
    }

}
