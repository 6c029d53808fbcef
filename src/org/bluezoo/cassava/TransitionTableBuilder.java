/*
 * TransitionTableBuilder.java
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

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Builder for the CSV automaton's transition table.
 * <p>
 * This builder provides a fluent API for declaring, per {@link ScanState},
 * explicit transitions on individual byte classes and one default
 * transition for every other byte:
 * <pre>{@code
 * builder.state(ScanState.IN_QUOTED_FIELD)
 *     .on(ByteClass.QUOTE).to(ScanState.AFTER_CLOSING_QUOTE).done()
 *     .otherwise().to(ScanState.IN_QUOTED_FIELD).action(Action.APPEND).done();
 * }</pre>
 * <p>
 * {@link #forConfiguration} declares the complete CSV automaton for a
 * delimiter, optional quote and strict-quoting flag.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
class TransitionTableBuilder {

    private static final byte CR = (byte) '\r';
    private static final byte LF = (byte) '\n';

    private final byte delimiter;
    private final int quote; // -1 if quoting is disabled
    private final Map<ScanState, Map<ByteClass, TransitionTable.Transition>> rules =
        new EnumMap<>(ScanState.class);
    private final Map<ScanState, TransitionTable.Transition> defaults =
        new EnumMap<>(ScanState.class);
    private final Set<ScanState> accepting = EnumSet.noneOf(ScanState.class);

    /**
     * Constructor.
     *
     * @param delimiter the delimiter byte
     * @param quote the quote byte (0-255), or -1 to disable quoting
     */
    TransitionTableBuilder(byte delimiter, int quote) {
        this.delimiter = delimiter;
        this.quote = quote;
    }

    /**
     * Builds the CSV automaton for the given settings.
     *
     * @param delimiter the delimiter byte
     * @param quote the quote byte (0-255), or -1 to disable quoting
     * @param quoteRequired whether every field must begin with the quote
     * @return the transition table
     */
    static TransitionTable forConfiguration(byte delimiter, int quote, boolean quoteRequired) {
        boolean quoting = quote >= 0;
        quoteRequired = quoting && quoteRequired;
        TransitionTableBuilder builder = new TransitionTableBuilder(delimiter, quote);

        // FIELD_START - beginning of a field or record
        StateBuilder fieldStart = builder.state(ScanState.FIELD_START);
        if (quoting) {
            fieldStart.on(ByteClass.QUOTE).to(ScanState.QUOTE_OPENED).done();
        }
        fieldStart
            .on(ByteClass.DELIMITER).to(ScanState.FIELD_START).action(Action.COMMIT_FIELD).done()
            .on(ByteClass.CR).to(ScanState.AFTER_CR).action(Action.COMMIT_RECORD).done()
            .on(ByteClass.LF).to(ScanState.FIELD_START).action(Action.COMMIT_RECORD).done();
        if (quoteRequired) {
            // A field that does not open with the quote is malformed
            fieldStart.otherwise().to(ScanState.SKIP_TO_EOL).action(Action.CHECKPOINT).done();
        } else {
            fieldStart.otherwise().to(ScanState.IN_UNQUOTED_FIELD).action(Action.APPEND).done();
        }

        // AFTER_CR - CRLF is one line break, a lone CR is a line break too
        builder.state(ScanState.AFTER_CR)
            .on(ByteClass.LF).to(ScanState.FIELD_START).done()
            .on(ByteClass.CR).to(ScanState.AFTER_CR).action(Action.COMMIT_RECORD).done()
            .otherwise().to(ScanState.FIELD_START).action(Action.PUSHBACK).done();

        // IN_UNQUOTED_FIELD
        StateBuilder unquoted = builder.state(ScanState.IN_UNQUOTED_FIELD)
            .on(ByteClass.DELIMITER).to(ScanState.FIELD_START).action(Action.COMMIT_FIELD).done()
            .on(ByteClass.CR).to(ScanState.AFTER_CR).action(Action.COMMIT_RECORD).done()
            .on(ByteClass.LF).to(ScanState.FIELD_START).action(Action.COMMIT_RECORD).done()
            .otherwise().to(ScanState.IN_UNQUOTED_FIELD).action(Action.APPEND).done();
        if (quoting) {
            unquoted.on(ByteClass.QUOTE).to(ScanState.SKIP_TO_EOL).action(Action.CHECKPOINT).done();

            builder.state(ScanState.QUOTE_OPENED)
                .on(ByteClass.QUOTE).to(ScanState.AFTER_CLOSING_QUOTE).done()
                .otherwise().to(ScanState.IN_QUOTED_FIELD).action(Action.APPEND).done();

            builder.state(ScanState.IN_QUOTED_FIELD)
                .on(ByteClass.QUOTE).to(ScanState.AFTER_CLOSING_QUOTE).done()
                .otherwise().to(ScanState.IN_QUOTED_FIELD).action(Action.APPEND).done();

            builder.state(ScanState.AFTER_CLOSING_QUOTE)
                .on(ByteClass.DELIMITER).to(ScanState.FIELD_START).action(Action.COMMIT_FIELD).done()
                .on(ByteClass.QUOTE).to(ScanState.QUOTE_OPENED).action(Action.APPEND).done()
                .on(ByteClass.CR).to(ScanState.AFTER_CR).action(Action.COMMIT_RECORD).done()
                .on(ByteClass.LF).to(ScanState.FIELD_START).action(Action.COMMIT_RECORD).done()
                .otherwise().to(ScanState.SKIP_TO_EOL).action(Action.CHECKPOINT).done();
        } else {
            // Unreachable without quoting, but every state has a default
            builder.state(ScanState.QUOTE_OPENED)
                .otherwise().to(ScanState.IN_QUOTED_FIELD).action(Action.APPEND).done();
            builder.state(ScanState.IN_QUOTED_FIELD)
                .otherwise().to(ScanState.IN_QUOTED_FIELD).action(Action.APPEND).done();
            builder.state(ScanState.AFTER_CLOSING_QUOTE)
                .otherwise().to(ScanState.SKIP_TO_EOL).action(Action.CHECKPOINT).done();
        }

        // Error recovery: discard up to the next line boundary
        builder.state(ScanState.SKIP_TO_EOL)
            .on(ByteClass.CR).to(ScanState.SKIP_TO_EOL_AFTER_CR).done()
            .on(ByteClass.LF).to(ScanState.FIELD_START).action(Action.ERROR).done()
            .otherwise().to(ScanState.SKIP_TO_EOL).done();

        builder.state(ScanState.SKIP_TO_EOL_AFTER_CR)
            .on(ByteClass.LF).to(ScanState.FIELD_START).action(Action.ERROR).done()
            .otherwise().to(ScanState.FIELD_START).action(Action.ERROR_PUSHBACK).done();

        builder.accepting(ScanState.FIELD_START, ScanState.AFTER_CR, ScanState.IN_UNQUOTED_FIELD);
        if (quoting) {
            builder.accepting(ScanState.AFTER_CLOSING_QUOTE);
        }
        return builder.build();
    }

    /**
     * Begins defining the transitions of a state.
     *
     * @param state the state to configure
     * @return a builder for this state
     */
    StateBuilder state(ScanState state) {
        if (!rules.containsKey(state)) {
            rules.put(state, new EnumMap<>(ByteClass.class));
        }
        return new StateBuilder(state);
    }

    /**
     * Marks states as accepting.
     *
     * @param states the accepting states
     * @return this builder
     */
    TransitionTableBuilder accepting(ScanState... states) {
        for (ScanState state : states) {
            accepting.add(state);
        }
        return this;
    }

    /**
     * Builds the flat transition table.
     *
     * @return the transition table
     * @throws IllegalStateException if a state has no default transition
     */
    TransitionTable build() {
        int numClasses = TransitionTable.NUM_BYTE_CLASSES;
        TransitionTable.Transition[] flat =
            new TransitionTable.Transition[TransitionTable.NUM_STATES * numClasses];
        for (ScanState state : ScanState.values()) {
            TransitionTable.Transition fallback = defaults.get(state);
            if (fallback == null) {
                throw new IllegalStateException("No default transition for state " + state);
            }
            Map<ByteClass, TransitionTable.Transition> explicit = rules.get(state);
            int base = state.ordinal() * numClasses;
            for (ByteClass byteClass : ByteClass.values()) {
                TransitionTable.Transition transition = (explicit == null) ? null : explicit.get(byteClass);
                flat[base + byteClass.ordinal()] = (transition != null) ? transition : fallback;
            }
        }
        return new TransitionTable(flat, classifier(), accepting);
    }

    private ByteClass[] classifier() {
        ByteClass[] classes = new ByteClass[256];
        for (int i = 0; i < classes.length; i++) {
            classes[i] = ByteClass.OTHER;
        }
        classes[CR & 0xff] = ByteClass.CR;
        classes[LF & 0xff] = ByteClass.LF;
        classes[delimiter & 0xff] = ByteClass.DELIMITER;
        if (quote >= 0) {
            classes[quote & 0xff] = ByteClass.QUOTE;
        }
        return classes;
    }

    /**
     * Builder for the transitions of a specific state.
     */
    class StateBuilder {

        private final ScanState state;

        StateBuilder(ScanState state) {
            this.state = state;
        }

        /**
         * Begins defining the transition taken on a specific byte class.
         *
         * @param byteClass the class of byte that triggers this transition
         * @return a builder for this transition
         */
        TransitionBuilder on(ByteClass byteClass) {
            return new TransitionBuilder(this, byteClass);
        }

        /**
         * Begins defining the default transition, taken on any byte class
         * that has no explicit transition in this state.
         *
         * @return a builder for this transition
         */
        TransitionBuilder otherwise() {
            return new TransitionBuilder(this, null);
        }

    }

    /**
     * Builder for a single transition.
     */
    class TransitionBuilder {

        private final StateBuilder stateBuilder;
        private final ByteClass byteClass; // null for the default transition
        private ScanState nextState;
        private Action action = Action.NONE;

        TransitionBuilder(StateBuilder stateBuilder, ByteClass byteClass) {
            this.stateBuilder = stateBuilder;
            this.byteClass = byteClass;
        }

        /**
         * Specifies the state to transition to.
         *
         * @param nextState the next state
         * @return this builder
         */
        TransitionBuilder to(ScanState nextState) {
            this.nextState = nextState;
            return this;
        }

        /**
         * Specifies the action performed during this transition.
         * The default is {@link Action#NONE}.
         *
         * @param action the action
         * @return this builder
         */
        TransitionBuilder action(Action action) {
            this.action = action;
            return this;
        }

        /**
         * Completes this transition and adds it to the table.
         *
         * @return the StateBuilder to continue defining transitions
         */
        StateBuilder done() {
            if (nextState == null) {
                throw new IllegalStateException("No target state for " + stateBuilder.state);
            }
            TransitionTable.Transition transition = new TransitionTable.Transition(nextState, action);
            if (byteClass == null) {
                defaults.put(stateBuilder.state, transition);
            } else {
                rules.get(stateBuilder.state).put(byteClass, transition);
            }
            return stateBuilder;
        }

    }

}
