/*
 * Action.java
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
 * Side effect performed by the scan engine when it follows a transition.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
enum Action {

    /**
     * Append the current byte to the field being accumulated.
     */
    APPEND(false),

    /**
     * State change only.
     */
    NONE(false),

    /**
     * Present the current byte again, to the new state.
     */
    PUSHBACK(true),

    /**
     * Complete the current field and add it to the record.
     */
    COMMIT_FIELD(false),

    /**
     * Complete the current field, then the current record.
     */
    COMMIT_RECORD(false),

    /**
     * Remember where a malformed span starts.
     */
    CHECKPOINT(false),

    /**
     * Report the malformed span and discard the current record.
     * The current byte terminated the line and is consumed.
     */
    ERROR(false),

    /**
     * Report the malformed span and discard the current record, then
     * present the current byte again as the first byte of the next line.
     */
    ERROR_PUSHBACK(true);

    private final boolean pushback;

    Action(boolean pushback) {
        this.pushback = pushback;
    }

    /**
     * Returns true if the current byte is not consumed by this action and
     * must be presented again.
     */
    boolean isPushback() {
        return pushback;
    }

}
