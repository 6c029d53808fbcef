/*
 * ErrorTracker.java
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

import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;

/**
 * Tracks a malformed span from the byte where it was detected to the end
 * of its line.
 * <p>
 * The tracker keeps its own copy of the offending bytes, so a span may
 * continue across any number of input buffers. The copy is capped at
 * {@link #MAX_SPAN_LENGTH} bytes; the rest of a longer line is discarded.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
class ErrorTracker {

    static final int MAX_SPAN_LENGTH = 65536;

    private final ByteArrayOutputStream span = new ByteArrayOutputStream();
    private Checkpoint checkpoint;

    /**
     * Starts tracking a malformed span, superseding any previous one.
     *
     * @param state the state in which the offending byte was read
     * @param columnNumber the column of the offending byte
     * @param offset the stream offset of the offending byte
     * @param b the offending byte
     */
    void checkpoint(ScanState state, long columnNumber, long offset, byte b) {
        checkpoint = new Checkpoint(state, columnNumber, offset);
        span.reset();
        span.write(b);
    }

    /**
     * Adds a discarded byte to the current span.
     *
     * @param b the byte
     */
    void append(byte b) {
        if (checkpoint != null && span.size() < MAX_SPAN_LENGTH) {
            span.write(b);
        }
    }

    /**
     * Returns the current checkpoint, or null if no span is being tracked.
     */
    Checkpoint getCheckpoint() {
        return checkpoint;
    }

    /**
     * Builds the error report for the current span and stops tracking it.
     *
     * @param lineNumber the line on which the span occurred
     * @param charset the charset used to decode the offending bytes
     * @return the error report
     * @throws IllegalStateException if no span is being tracked
     */
    ParseError emit(long lineNumber, Charset charset) {
        if (checkpoint == null) {
            throw new IllegalStateException("No checkpoint for error on line " + lineNumber);
        }
        String input = new String(span.toByteArray(), charset);
        ParseError error = new ParseError(input, lineNumber, checkpoint.getColumnNumber(),
                                          checkpoint.getOffset(), checkpoint.getState());
        clear();
        return error;
    }

    /**
     * Discards the current span, if any.
     */
    void clear() {
        checkpoint = null;
        span.reset();
    }

}
