/*
 * CSVWriter.java
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

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.WritableByteChannel;
import java.nio.charset.Charset;
import java.text.MessageFormat;
import java.util.Arrays;
import java.util.List;

/**
 * Streaming CSV writer.
 * <p>
 * Records are serialized with a {@link CSVSerializer}, encoded with the
 * configured encoding and collected in an internal buffer, which is sent to
 * the {@link WritableByteChannel} whenever it fills beyond a threshold.
 * Each record is followed by the line terminator, CRLF by default.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * CSVWriter writer = new CSVWriter(channel, CSVConfiguration.DEFAULT);
 * writer.writeRecord("id", "name");
 * writer.writeRecord("1", "Smith, \"Bob\"");
 * writer.close();
 *
 * // Output:
 * // "id","name"
 * // "1","Smith, ""Bob"""
 * }</pre>
 *
 * <p>This class is NOT thread-safe.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class CSVWriter {

    private static final int DEFAULT_CAPACITY = 4096;
    private static final float SEND_THRESHOLD = 0.75f;

    private final WritableByteChannel channel;
    private final CSVSerializer serializer;
    private final Charset encoding;
    private ByteBuffer buffer;
    private final int sendThreshold;
    private final StringBuilder line = new StringBuilder();
    private String lineTerminator = "\r\n";
    private long recordCount;

    /**
     * Creates a writer on an output stream.
     * @param out the output stream to write to
     * @param configuration supplies the delimiter, quote and encoding
     */
    public CSVWriter(OutputStream out, CSVConfiguration configuration) {
        this(Channels.newChannel(out), configuration, DEFAULT_CAPACITY);
    }

    /**
     * Creates a writer on a channel.
     * @param channel the channel to write to
     * @param configuration supplies the delimiter, quote and encoding
     */
    public CSVWriter(WritableByteChannel channel, CSVConfiguration configuration) {
        this(channel, configuration, DEFAULT_CAPACITY);
    }

    /**
     * Creates a writer on a channel with the given initial buffer capacity.
     * @param channel the channel to write to
     * @param configuration supplies the delimiter, quote and encoding
     * @param bufferCapacity initial buffer capacity in bytes
     */
    public CSVWriter(WritableByteChannel channel, CSVConfiguration configuration, int bufferCapacity) {
        this.channel = channel;
        this.serializer = new CSVSerializer(configuration);
        this.encoding = configuration.getEncoding();
        this.buffer = ByteBuffer.allocate(bufferCapacity);
        this.sendThreshold = (int) (bufferCapacity * SEND_THRESHOLD);
    }

    /**
     * Sets the line terminator written after each record.
     * @param lineTerminator "\r\n", "\n" or "\r"
     * @throws IllegalArgumentException for any other value
     */
    public void setLineTerminator(String lineTerminator) {
        if (!"\r\n".equals(lineTerminator) && !"\n".equals(lineTerminator) && !"\r".equals(lineTerminator)) {
            String msg = MessageFormat.format(CSVParser.L10N.getString("err.line_terminator"), escape(lineTerminator));
            throw new IllegalArgumentException(msg);
        }
        this.lineTerminator = lineTerminator;
    }

    /**
     * Writes a record followed by the line terminator.
     * @param record the fields
     * @throws IOException if there is an error sending data
     * @throws IllegalArgumentException if a field cannot be represented
     */
    public void writeRecord(List<String> record) throws IOException {
        line.setLength(0);
        serializer.format(record, line);
        line.append(lineTerminator);
        byte[] bytes = line.toString().getBytes(encoding);
        ensureCapacity(bytes.length);
        buffer.put(bytes);
        recordCount++;
        sendIfNeeded();
    }

    /**
     * Writes a record followed by the line terminator.
     * @param fields the fields
     * @throws IOException if there is an error sending data
     */
    public void writeRecord(String... fields) throws IOException {
        writeRecord(Arrays.asList(fields));
    }

    /**
     * Returns the number of records written.
     * @return the record count
     */
    public long getRecordCount() {
        return recordCount;
    }

    /**
     * Sends any buffered data to the channel.
     * @throws IOException if there is an error sending data
     */
    public void flush() throws IOException {
        if (buffer.position() > 0) {
            send();
        }
    }

    /**
     * Flushes the writer. This does NOT close the underlying channel.
     * @throws IOException if there is an error sending data
     */
    public void close() throws IOException {
        flush();
    }

    private void ensureCapacity(int needed) {
        if (buffer.remaining() < needed) {
            ByteBuffer newBuffer = ByteBuffer.allocate(Math.max(buffer.capacity() * 2, buffer.position() + needed));
            buffer.flip();
            newBuffer.put(buffer);
            buffer = newBuffer;
        }
    }

    private void sendIfNeeded() throws IOException {
        if (buffer.position() >= sendThreshold) {
            send();
        }
    }

    private void send() throws IOException {
        buffer.flip();
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
        buffer.clear();
    }

    private static String escape(String s) {
        if (s == null) {
            return "null";
        }
        return s.replace("\r", "\\r").replace("\n", "\\n");
    }

}
