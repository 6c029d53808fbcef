/*
 * CSVParser.java
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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.ReadableByteChannel;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A streaming parser for delimited text (CSV and its variants).
 *
 * <p>This parser uses a push design: byte data is supplied via the
 * {@code receive} methods as and when it arrives, in any chunk sizes, and
 * completed fields and records are delivered to the handlers of the
 * {@link CSVConfiguration}. A field or record may span any number of
 * chunks. When the input is complete, {@link #finish()} flushes a final
 * record that has no terminating line break.
 *
 * <p>Scanning is driven by a {@link TransitionTable}: each byte is
 * classified, the transition for the current {@link ScanState} and byte
 * class is looked up, and its action is performed. CRLF, lone CR and lone
 * LF are all accepted as line breaks. Quoted fields may contain delimiters,
 * line breaks and doubled quotes.
 *
 * <p>Malformed lines do not abort parsing. When a stray quote or other
 * malformed content is found, the parser discards the rest of the line,
 * reports it to the {@link ErrorHandler} as a {@link ParseError} and
 * resumes at the next line.
 *
 * <h3>Typical Usage</h3>
 * <pre>
 * CSVConfiguration config = new CSVConfiguration.Builder()
 *     .recordHandler(myRecordHandler)
 *     .build();
 * CSVParser parser = new CSVParser(config);
 *
 * while (channel.read(buffer) &gt; 0) {
 *     buffer.flip();
 *     parser.receive(buffer);
 *     buffer.clear();
 * }
 * parser.finish();
 * </pre>
 *
 * <h3>Buffer Contract</h3>
 * <p>{@link #receive(ByteBuffer)} consumes all the remaining bytes of the
 * buffer and leaves its position at its limit. The buffer is not retained.
 * If a handler throws an exception, the exception propagates, the buffer's
 * position marks the first byte not yet consumed, and the parser state is
 * consistent with the bytes consumed.
 *
 * <p>Fields are accumulated as bytes and decoded with the configured
 * encoding when they are complete. Delimiter and quote are matched
 * byte-wise, so they must be single-byte characters.
 *
 * <p>This class is not thread-safe.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class CSVParser {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.cassava.L10N");

    private static final Logger LOGGER = Logger.getLogger(CSVParser.class.getName());

    private static final byte LF = (byte) '\n';
    private static final byte[] UTF8_BOM = { (byte) 0xEF, (byte) 0xBB, (byte) 0xBF };
    private static final int DEFAULT_BUFFER_SIZE = 8192;

    private CSVConfiguration configuration;
    private TransitionTable table;
    private CSVSerializer serializer;
    private CallbackRouter router;
    private ErrorHandler errorHandler;

    private ScanState state = ScanState.FIELD_START;
    private final ByteArrayOutputStream field = new ByteArrayOutputStream();
    private List<String> record = new ArrayList<>();
    private final ErrorTracker errorTracker = new ErrorTracker();
    private long lineNumber;
    private long columnNumber;
    private long offset; // bytes consumed since reset
    private int bomMatched; // BOM bytes seen so far, -1 when detection is over
    private final StringBuilder parsed = new StringBuilder();
    private String lastParsed = "";

    /**
     * Creates a parser with the default configuration.
     */
    public CSVParser() {
        this(CSVConfiguration.DEFAULT);
    }

    /**
     * Creates a parser with the given configuration.
     * @param configuration the configuration
     */
    public CSVParser(CSVConfiguration configuration) {
        reset(configuration);
    }

    /**
     * Creates a parser with the given configuration.
     * @param configuration the configuration
     * @return the parser
     */
    public static CSVParser create(CSVConfiguration configuration) {
        return new CSVParser(configuration);
    }

    /**
     * Parses a complete document held in a string: receives it and calls
     * {@link #finish()}.
     * @param text the document
     * @param configuration the configuration
     * @return the parser, for inspection
     */
    public static CSVParser parse(String text, CSVConfiguration configuration) {
        CSVParser parser = new CSVParser(configuration);
        parser.receive(text);
        parser.finish();
        return parser;
    }

    /**
     * Parses a complete document held in a buffer: receives it and calls
     * {@link #finish()}.
     * @param data the document
     * @param configuration the configuration
     * @return the parser, for inspection
     */
    public static CSVParser parse(ByteBuffer data, CSVConfiguration configuration) {
        CSVParser parser = new CSVParser(configuration);
        parser.receive(data);
        parser.finish();
        return parser;
    }

    /**
     * Resets the parser to process a new stream with the same
     * configuration. All state of the current stream is discarded.
     */
    public void reset() {
        state = ScanState.FIELD_START;
        field.reset();
        record = new ArrayList<>();
        errorTracker.clear();
        router.reset();
        lineNumber = 1L;
        columnNumber = 0L;
        offset = 0L;
        // EF BB BF is only a byte order mark in UTF-8
        boolean utf8 = StandardCharsets.UTF_8.equals(configuration.getEncoding());
        bomMatched = (configuration.isDetectBOM() && utf8) ? 0 : -1;
        parsed.setLength(0);
        lastParsed = "";
    }

    /**
     * Resets the parser to process a new stream with a new configuration.
     * @param configuration the configuration, or null for the defaults
     */
    public void reset(CSVConfiguration configuration) {
        if (configuration == null) {
            configuration = CSVConfiguration.DEFAULT;
        }
        this.configuration = configuration;
        table = TransitionTableBuilder.forConfiguration(configuration.getDelimiterByte(),
                                                        configuration.getQuoteByte(),
                                                        configuration.isQuoteRequired());
        serializer = new CSVSerializer(configuration);
        RecordHandler recordHandler = configuration.getRecordHandler();
        if (recordHandler == null) {
            recordHandler = new LoggingRecordHandler(serializer);
        }
        router = new CallbackRouter(configuration.getHeaderFieldHandler(),
                                    configuration.getFieldHandler(),
                                    configuration.getHeaderHandler(),
                                    recordHandler);
        errorHandler = configuration.getErrorHandler();
        if (errorHandler == null) {
            errorHandler = new LoggingErrorHandler();
        }
        reset();
    }

    /**
     * Processes all the remaining bytes of the given buffer.
     *
     * <p>The buffer must be in read mode. On return its position is at
     * its limit. Partial fields and records are retained until the next
     * call.
     *
     * @param data the byte data
     * @return the text returned by record handlers during this call,
     * concatenated, or the empty string
     */
    public String receive(ByteBuffer data) {
        parsed.setLength(0);
        try {
            if (bomMatched >= 0) {
                detectBOM(data);
            }
            scan(data);
        } finally {
            lastParsed = parsed.toString();
        }
        return lastParsed;
    }

    /**
     * Processes the given bytes.
     * @param data the byte data
     * @return the text returned by record handlers during this call
     */
    public String receive(byte[] data) {
        return receive(ByteBuffer.wrap(data));
    }

    /**
     * Processes the given text, encoded with the configured encoding.
     * @param text the text
     * @return the text returned by record handlers during this call
     */
    public String receive(String text) {
        return receive(ByteBuffer.wrap(text.getBytes(configuration.getEncoding())));
    }

    /**
     * Signals the end of the input.
     *
     * <p>If the parser is in an accepting state, a final record without a
     * terminating line break is flushed to the handlers and true is
     * returned. Otherwise, for example if the input ended inside a quoted
     * field, the incomplete field and record are discarded and false is
     * returned; it is up to the caller to treat this as an error.
     *
     * <p>In both cases the parser is then ready to start a new line.
     *
     * @return true if the input ended in an accepting state
     */
    public boolean finish() {
        parsed.setLength(0);
        try {
            if (bomMatched > 0) {
                replayBOMPrefix();
            }
            bomMatched = -1;
            if (table.isAccepting(state)) {
                boolean pending = !record.isEmpty()
                    || state == ScanState.IN_UNQUOTED_FIELD
                    || state == ScanState.AFTER_CLOSING_QUOTE;
                state = ScanState.FIELD_START;
                errorTracker.clear();
                if (pending) {
                    commitRecord();
                }
                return true;
            }
            if (LOGGER.isLoggable(Level.FINE)) {
                String msg = MessageFormat.format(L10N.getString("log.unterminated"), lineNumber, state);
                LOGGER.fine(msg);
            }
            state = ScanState.FIELD_START;
            field.reset();
            record.clear();
            errorTracker.clear();
            return false;
        } finally {
            lastParsed = parsed.toString();
        }
    }

    /**
     * Parses a complete document from a stream, blocking until the end of
     * the stream, then calls {@link #finish()}. The stream is not closed.
     * @param in the input stream
     * @return the result of {@link #finish()}
     * @throws IOException if there was an error reading the stream
     */
    public boolean parse(InputStream in) throws IOException {
        return parse(Channels.newChannel(in));
    }

    /**
     * Parses a complete document from a channel, blocking until the end of
     * the stream, then calls {@link #finish()}. The channel is not closed.
     * @param channel a blocking channel
     * @return the result of {@link #finish()}
     * @throws IOException if there was an error reading the channel
     */
    public boolean parse(ReadableByteChannel channel) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(DEFAULT_BUFFER_SIZE);
        while (channel.read(buffer) != -1) {
            buffer.flip();
            receive(buffer);
            buffer.clear();
        }
        return finish();
    }

    /**
     * Renders a record as delimited text using this parser's delimiter and
     * quote.
     * @param record the fields
     * @return the text, without line terminator
     * @see CSVSerializer
     */
    public String serialize(List<String> record) {
        return serializer.format(record);
    }

    // -- Introspection --

    /**
     * @return the configuration
     */
    public CSVConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * @return the delimiter character
     */
    public char getDelimiter() {
        return configuration.getDelimiter();
    }

    /**
     * @return the quote character, or 0 if quoting is disabled
     */
    public char getQuote() {
        return configuration.getQuote();
    }

    /**
     * @return whether quoting is enabled
     */
    public boolean isQuoteEnabled() {
        return configuration.isQuoteEnabled();
    }

    /**
     * @return whether every field must begin with the quote
     */
    public boolean isQuoteRequired() {
        return configuration.isQuoteRequired();
    }

    /**
     * Returns the current line number (1-based). Lines are counted as
     * records and malformed lines are terminated; line breaks inside quoted
     * fields do not count.
     * @return the line number
     */
    public long getLineNumber() {
        return lineNumber;
    }

    /**
     * Returns the number of bytes read on the current line, excluding
     * line feeds.
     * @return the column number
     */
    public long getColumnNumber() {
        return columnNumber;
    }

    /**
     * Returns the field accumulated so far.
     * @return the partial field
     */
    public String getField() {
        return decode(field.toByteArray());
    }

    /**
     * Returns a copy of the fields completed so far on the current line.
     * @return the partial record
     */
    public List<String> getRecord() {
        return Collections.unmodifiableList(new ArrayList<>(record));
    }

    /**
     * @return the current automaton state
     */
    public ScanState getState() {
        return state;
    }

    /**
     * Returns true if the input could end here without losing data.
     * @return whether the current state is accepting
     */
    public boolean isAccepting() {
        return table.isAccepting(state);
    }

    /**
     * Returns the start of the malformed span currently being skipped, or
     * null if there is none.
     * @return the checkpoint, or null
     */
    public Checkpoint getCheckpoint() {
        return errorTracker.getCheckpoint();
    }

    /**
     * Returns the header record, if header handling is configured and the
     * header has been read.
     * @return the header fields, or null
     */
    public List<String> getHeader() {
        return router.getHeader();
    }

    /**
     * Returns the output accumulated by record handlers during the last
     * {@code receive} or {@code finish} call.
     * @return the parsed output
     */
    public String getParsed() {
        return lastParsed;
    }

    // -- Scanning --

    private void detectBOM(ByteBuffer data) {
        while (bomMatched >= 0 && data.hasRemaining()) {
            if (data.get(data.position()) == UTF8_BOM[bomMatched]) {
                data.get();
                bomMatched++;
                if (bomMatched == UTF8_BOM.length) {
                    offset += UTF8_BOM.length;
                    bomMatched = -1;
                    LOGGER.fine(L10N.getString("log.bom_stripped"));
                }
            } else {
                replayBOMPrefix();
            }
        }
    }

    /**
     * Scans the bytes held back as a possible BOM, which turned out not to
     * be one.
     */
    private void replayBOMPrefix() {
        int matched = bomMatched;
        bomMatched = -1;
        if (matched > 0) {
            scan(ByteBuffer.wrap(UTF8_BOM, 0, matched));
        }
    }

    private void scan(ByteBuffer data) {
        int start = data.position();
        int end = data.limit();
        int pos = start;
        try {
            while (pos < end) {
                byte c = data.get(pos);
                long index = offset + (pos - start);
                if (c != LF) {
                    columnNumber++;
                }
                TransitionTable.Transition transition = table.lookup(state, c);
                ScanState current = state;
                state = transition.nextState;
                if (!transition.action.isPushback()) {
                    pos++;
                }
                perform(transition.action, current, c, index);
            }
        } finally {
            data.position(pos);
            offset += pos - start;
        }
    }

    private void perform(Action action, ScanState current, byte c, long index) {
        switch (action) {
            case APPEND:
                field.write(c);
                break;
            case NONE:
                if (current == ScanState.SKIP_TO_EOL && state == ScanState.SKIP_TO_EOL) {
                    errorTracker.append(c);
                }
                break;
            case PUSHBACK:
                columnNumber--; // counted again when presented to the new state
                break;
            case COMMIT_FIELD:
                commitField();
                break;
            case COMMIT_RECORD:
                commitRecord();
                break;
            case CHECKPOINT:
                errorTracker.checkpoint(current, columnNumber, index, c);
                break;
            case ERROR:
            case ERROR_PUSHBACK:
                raiseError();
                break;
            default:
                throw new IllegalStateException("Unexpected action: " + action);
        }
    }

    private void commitField() {
        String value = decode(field.toByteArray());
        field.reset();
        int index = record.size();
        record.add(value);
        router.field(value, index, lineNumber);
    }

    private void commitRecord() {
        String value = decode(field.toByteArray());
        field.reset();
        int index = record.size();
        record.add(value);
        List<String> completed = Collections.unmodifiableList(record);
        record = new ArrayList<>();
        long line = lineNumber;
        lineNumber++;
        columnNumber = 0L;
        router.field(value, index, line);
        String output = router.record(completed, line);
        if (output != null) {
            parsed.append(output);
        }
    }

    private void raiseError() {
        ParseError error = errorTracker.emit(lineNumber, configuration.getEncoding());
        lineNumber++;
        columnNumber = 0L;
        field.reset();
        record.clear();
        errorHandler.error(error);
    }

    private String decode(byte[] bytes) {
        Charset charset = configuration.getEncoding();
        return new String(bytes, charset);
    }

    /**
     * Default error handler: logs each error as a warning.
     */
    static class LoggingErrorHandler implements ErrorHandler {

        @Override
        public void error(ParseError error) {
            LOGGER.warning(error.getMessage());
        }

    }

    /**
     * Default record handler: logs each record at FINE level.
     */
    static class LoggingRecordHandler implements RecordHandler {

        private final CSVSerializer serializer;

        LoggingRecordHandler(CSVSerializer serializer) {
            this.serializer = serializer;
        }

        @Override
        public String record(List<String> record, long lineNumber) {
            if (LOGGER.isLoggable(Level.FINE)) {
                String msg = MessageFormat.format(L10N.getString("log.record"), lineNumber, serializer.format(record));
                LOGGER.fine(msg);
            }
            return null;
        }

    }

}
