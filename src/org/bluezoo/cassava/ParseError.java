/*
 * ParseError.java
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

/**
 * Report of a malformed line, delivered to an {@link ErrorHandler}.
 * <p>
 * The parser does not throw on malformed input. It reports the span that
 * could not be parsed, discards the record in progress and resumes at the
 * next line.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ParseError {

    private final String input;
    private final long lineNumber;
    private final long columnNumber;
    private final long offset;
    private final ScanState state;

    ParseError(String input, long lineNumber, long columnNumber, long offset, ScanState state) {
        this.input = input;
        this.lineNumber = lineNumber;
        this.columnNumber = columnNumber;
        this.offset = offset;
        this.state = state;
    }

    /**
     * Returns the offending text, from the first malformed byte up to the
     * end of the line (excluding the line break).
     * @return the offending text
     */
    public String getInput() {
        return input;
    }

    /**
     * Returns the line on which the malformed span occurred.
     * @return the line number (1-based)
     */
    public long getLineNumber() {
        return lineNumber;
    }

    /**
     * Returns the column of the first malformed byte.
     * @return the column number
     */
    public long getColumnNumber() {
        return columnNumber;
    }

    /**
     * Returns the stream offset of the first malformed byte.
     * @return the byte offset
     */
    public long getOffset() {
        return offset;
    }

    /**
     * Returns the automaton state in which the first malformed byte was
     * read. This identifies the kind of error:
     * <ul>
     * <li>{@link ScanState#FIELD_START}: field not opened with a quote
     * when quotes are required</li>
     * <li>{@link ScanState#IN_UNQUOTED_FIELD}: quote inside an unquoted
     * field</li>
     * <li>{@link ScanState#AFTER_CLOSING_QUOTE}: content after a closing
     * quote</li>
     * </ul>
     * @return the state at the checkpoint
     */
    public ScanState getState() {
        return state;
    }

    /**
     * Returns a localized description of this error.
     * @return the message
     */
    public String getMessage() {
        String key;
        switch (state) {
            case FIELD_START:
                key = "err.quote_required";
                break;
            case IN_UNQUOTED_FIELD:
                key = "err.quote_in_unquoted_field";
                break;
            case AFTER_CLOSING_QUOTE:
                key = "err.content_after_quote";
                break;
            default:
                key = "err.malformed";
        }
        return MessageFormat.format(CSVParser.L10N.getString(key), lineNumber, columnNumber, input);
    }

    @Override
    public String toString() {
        return getMessage();
    }

}
