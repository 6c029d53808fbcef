/*
 * ErrorHandler.java
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
 * Receives reports of malformed input.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see CSVConfiguration.Builder#errorHandler(ErrorHandler)
 */
public interface ErrorHandler {

    /**
     * Receive notification of a malformed line. The record in progress
     * has been discarded and parsing resumes at the next line.
     * @param error the error report
     */
    void error(ParseError error);

}
