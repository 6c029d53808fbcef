/*
 * ScanState.java
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
 * States of the CSV scanning automaton.
 * <p>
 * The parser is always in exactly one of these states. The state, together
 * with the class of the next input byte, selects a transition in the
 * {@link TransitionTable}. Because the state is kept between calls to
 * {@link CSVParser#receive(java.nio.ByteBuffer)}, a field or record may span
 * any number of input buffers.
 * <p>
 * The two SKIP states are error-recovery states: they discard input up to
 * the next line boundary after a malformed field has been detected.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum ScanState {

    /**
     * Ready to start a new field or record.
     */
    FIELD_START,

    /**
     * Seen a CR. A following LF belongs to the same line break.
     */
    AFTER_CR,

    /**
     * Accumulating a field that did not begin with a quote.
     */
    IN_UNQUOTED_FIELD,

    /**
     * Seen an opening quote, or an escaped (doubled) quote inside a
     * quoted field.
     */
    QUOTE_OPENED,

    /**
     * Accumulating a quoted field. Delimiters and line breaks are content.
     */
    IN_QUOTED_FIELD,

    /**
     * Seen a quote inside a quoted field: either the closing quote or the
     * first half of an escaped quote.
     */
    AFTER_CLOSING_QUOTE,

    /**
     * Discarding the rest of a malformed line.
     */
    SKIP_TO_EOL,

    /**
     * Discarding the rest of a malformed line, last byte was CR.
     */
    SKIP_TO_EOL_AFTER_CR;

}
