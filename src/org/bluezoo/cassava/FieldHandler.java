/*
 * FieldHandler.java
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
 * Receives each field as soon as it is complete.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see CSVConfiguration.Builder#fieldHandler(FieldHandler)
 * @see CSVConfiguration.Builder#headerFieldHandler(FieldHandler)
 */
public interface FieldHandler {

    /**
     * Receive notification of a complete field.
     * @param field the decoded field text, with quotes removed and
     * escaped quotes unescaped
     * @param index the index of the field within its record (0-based)
     * @param lineNumber the line of the record
     */
    void field(String field, int index, long lineNumber);

}
