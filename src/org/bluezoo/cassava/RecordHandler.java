/*
 * RecordHandler.java
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
 * Receives each record as soon as it is complete.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see CSVConfiguration.Builder#recordHandler(RecordHandler)
 * @see CSVConfiguration.Builder#headerHandler(RecordHandler)
 */
public interface RecordHandler {

    /**
     * Receive notification of a complete record.
     * <p>
     * The handler may return text, for example a re-serialized form of the
     * record. The parser appends any non-null return value to the output
     * returned by the current {@code receive} or {@code finish} call.
     * @param record the fields of the record, unmodifiable
     * @param lineNumber the line of the record
     * @return text to append to the parsed output, or null
     */
    String record(List<String> record, long lineNumber);

}
