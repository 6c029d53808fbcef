/*
 * ByteClass.java
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
 * Byte classification for CSV scanning.
 * <p>
 * Every input byte falls into exactly one class. Which byte values are the
 * delimiter and the quote depends on the configuration, so classification is
 * done by the {@link TransitionTable} built for that configuration. When
 * quoting is disabled no byte is ever classified as {@link #QUOTE}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
enum ByteClass {

    /** The field delimiter, ',' by default */
    DELIMITER,

    /** The quote character, '"' by default */
    QUOTE,

    /** Carriage return */
    CR,

    /** Line feed */
    LF,

    /** Any other byte */
    OTHER;

}
