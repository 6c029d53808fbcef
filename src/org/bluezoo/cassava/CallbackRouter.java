/*
 * CallbackRouter.java
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

import java.util.List;

/**
 * Routes completed fields and records to the configured handlers.
 * <p>
 * If a header handler or header field handler is configured, the first
 * record is the header: its fields go to the header field handler and the
 * record itself to the header handler, and it is retained. After the first
 * record routing switches permanently to the data handlers, until
 * {@link #reset}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
class CallbackRouter {

    private final FieldHandler headerFieldHandler;
    private final FieldHandler fieldHandler;
    private final RecordHandler headerHandler;
    private final RecordHandler recordHandler;

    private boolean header; // true while the first record is being read
    private List<String> headerRecord;

    CallbackRouter(FieldHandler headerFieldHandler, FieldHandler fieldHandler,
                   RecordHandler headerHandler, RecordHandler recordHandler) {
        this.headerFieldHandler = headerFieldHandler;
        this.fieldHandler = fieldHandler;
        this.headerHandler = headerHandler;
        this.recordHandler = recordHandler;
        reset();
    }

    void reset() {
        header = (headerHandler != null || headerFieldHandler != null);
        headerRecord = null;
    }

    /**
     * Returns true if the next record completed will be the header.
     */
    boolean isHeaderPending() {
        return header;
    }

    List<String> getHeader() {
        return headerRecord;
    }

    void field(String field, int index, long lineNumber) {
        FieldHandler handler = header ? headerFieldHandler : fieldHandler;
        if (handler != null) {
            handler.field(field, index, lineNumber);
        }
    }

    /**
     * Routes a completed record.
     *
     * @return the handler's output, or null
     */
    String record(List<String> record, long lineNumber) {
        if (header) {
            header = false;
            headerRecord = record;
            return (headerHandler == null) ? null : headerHandler.record(record, lineNumber);
        }
        return recordHandler.record(record, lineNumber);
    }

}
