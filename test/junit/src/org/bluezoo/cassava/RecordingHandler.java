/*
 * RecordingHandler.java
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

import java.util.ArrayList;
import java.util.List;

/**
 * Test handler that records parser events for verification.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
class RecordingHandler implements FieldHandler, RecordHandler, ErrorHandler {

    final List<String> events;
    final List<List<String>> records = new ArrayList<>();
    final List<Long> lines = new ArrayList<>();
    final List<ParseError> errors = new ArrayList<>();
    private final String prefix;

    RecordingHandler() {
        this("", new ArrayList<String>());
    }

    /**
     * Creates a handler that adds its events, marked with the given
     * prefix, to a list shared with other handlers.
     */
    RecordingHandler(String prefix, List<String> events) {
        this.prefix = prefix;
        this.events = events;
    }

    @Override
    public void field(String field, int index, long lineNumber) {
        events.add(prefix + "field:" + field + ":" + index + ":" + lineNumber);
    }

    @Override
    public String record(List<String> record, long lineNumber) {
        events.add(prefix + "record:" + record + ":" + lineNumber);
        records.add(new ArrayList<>(record));
        lines.add(lineNumber);
        return null;
    }

    @Override
    public void error(ParseError error) {
        events.add(prefix + "error:" + error.getInput() + ":" + error.getLineNumber() + ":"
                   + error.getColumnNumber() + ":" + error.getOffset() + ":" + error.getState());
        errors.add(error);
    }

    /**
     * Returns a configuration builder delivering records and errors to
     * this handler.
     */
    CSVConfiguration.Builder builder() {
        return new CSVConfiguration.Builder()
            .recordHandler(this)
            .errorHandler(this);
    }

}
