/*
 * package-info.java
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

/**
 * Cassava: a non-blocking, streaming CSV parser and serializer.
 *
 * <h2>Overview</h2>
 *
 * <p>Cassava parses delimited text (CSV and its variants, such as
 * semicolon- or tab-separated files) using a push model: data is pushed to
 * the {@link org.bluezoo.cassava.CSVParser} as it arrives, in buffers of
 * any size, and complete fields and records are delivered to handlers.
 * Fields, records and even malformed spans may cross buffer boundaries.
 *
 * <pre>{@code
 * CSVConfiguration config = new CSVConfiguration.Builder()
 *     .headerHandler(new RecordHandler() {
 *         public String record(List<String> header, long line) {
 *             columns = header;
 *             return null;
 *         }
 *     })
 *     .recordHandler(myRecordHandler)
 *     .errorHandler(myErrorHandler)
 *     .build();
 * CSVParser parser = new CSVParser(config);
 *
 * while (channel.read(buffer) > 0) {
 *     buffer.flip();
 *     parser.receive(buffer);
 *     buffer.clear();
 * }
 * if (!parser.finish()) {
 *     // input ended inside a quoted field
 * }
 * }</pre>
 *
 * <h2>Architecture</h2>
 *
 * <ol>
 *   <li>{@link org.bluezoo.cassava.TransitionTableBuilder} - builds the
 *       automaton for a delimiter, quote and strict-quoting setting</li>
 *   <li>{@link org.bluezoo.cassava.TransitionTable} - flat lookup of
 *       (state, byte class) to (next state, action)</li>
 *   <li>{@link org.bluezoo.cassava.CSVParser} - scans bytes against the
 *       table and performs the actions</li>
 *   <li>{@link org.bluezoo.cassava.ErrorTracker} - records where a
 *       malformed span starts and its text</li>
 *   <li>{@link org.bluezoo.cassava.CallbackRouter} - routes the first
 *       record to header handlers</li>
 * </ol>
 *
 * <h2>Serialization</h2>
 *
 * <p>{@link org.bluezoo.cassava.CSVSerializer} renders a record as text,
 * quoting every field, and {@link org.bluezoo.cassava.CSVWriter} streams
 * records to a {@link java.nio.channels.WritableByteChannel}.
 *
 * @author Chris Burdess
 * @see org.bluezoo.cassava.CSVParser
 * @see org.bluezoo.cassava.CSVConfiguration
 */
package org.bluezoo.cassava;
