/*
 * TransitionTable.java
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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Immutable transition table of the CSV scanning automaton.
 * <p>
 * The table maps a ({@link ScanState}, {@link ByteClass}) pair to a
 * {@link Transition}. Lookups use a flat array indexed by
 * {@code state.ordinal() * NUM_BYTE_CLASSES + byteClass.ordinal()}, and byte
 * classification uses a 256-entry array, so scanning a byte costs two
 * array reads.
 * <p>
 * Tables are created by {@link TransitionTableBuilder} and are a pure
 * function of the delimiter, quote and strict-quoting settings. They hold
 * no mutable state and may be shared.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class TransitionTable {

    static final int NUM_BYTE_CLASSES = ByteClass.values().length;
    static final int NUM_STATES = ScanState.values().length;

    private final Transition[] transitions;
    private final ByteClass[] byteClasses;
    private final Set<ScanState> accepting;

    TransitionTable(Transition[] transitions, ByteClass[] byteClasses, Set<ScanState> accepting) {
        this.transitions = transitions;
        this.byteClasses = byteClasses;
        this.accepting = Collections.unmodifiableSet(EnumSet.copyOf(accepting));
    }

    /**
     * Returns the class of the given input byte.
     *
     * @param b the byte
     * @return its byte class
     */
    ByteClass classify(byte b) {
        return byteClasses[b & 0xff];
    }

    /**
     * Returns the transition to follow when the given byte is read in the
     * given state. Never returns null.
     *
     * @param state the current state
     * @param b the input byte
     * @return the transition
     */
    Transition lookup(ScanState state, byte b) {
        return transitions[state.ordinal() * NUM_BYTE_CLASSES + (byteClasses[b & 0xff].ordinal())];
    }

    /**
     * Returns the transition for the given state and byte class.
     *
     * @param state the current state
     * @param byteClass the class of the input byte
     * @return the transition
     */
    Transition lookup(ScanState state, ByteClass byteClass) {
        return transitions[state.ordinal() * NUM_BYTE_CLASSES + byteClass.ordinal()];
    }

    /**
     * Returns true if input may end in the given state without a
     * terminating line break.
     *
     * @param state the state
     * @return true if the state is accepting
     */
    boolean isAccepting(ScanState state) {
        return accepting.contains(state);
    }

    Set<ScanState> getAcceptingStates() {
        return accepting;
    }

    /**
     * A single transition of the automaton.
     */
    static final class Transition {

        final ScanState nextState;
        final Action action;

        Transition(ScanState nextState, Action action) {
            this.nextState = nextState;
            this.action = action;
        }

        @Override
        public String toString() {
            return nextState + "(" + action + ")";
        }

    }

}
