/*
 * Checkpoint.java
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

/**
 * Snapshot of the parser position taken where a malformed span begins.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Checkpoint {

    private final ScanState state;
    private final long columnNumber;
    private final long offset;

    Checkpoint(ScanState state, long columnNumber, long offset) {
        this.state = state;
        this.columnNumber = columnNumber;
        this.offset = offset;
    }

    /**
     * Returns the state in which the offending byte was read.
     * @return the scan state
     */
    public ScanState getState() {
        return state;
    }

    /**
     * Returns the column of the offending byte within its line (1-based).
     * @return the column number
     */
    public long getColumnNumber() {
        return columnNumber;
    }

    /**
     * Returns the offset of the offending byte from the start of the stream.
     * @return the byte offset
     */
    public long getOffset() {
        return offset;
    }

    @Override
    public String toString() {
        return state + "@" + columnNumber + "[" + offset + "]";
    }

}
