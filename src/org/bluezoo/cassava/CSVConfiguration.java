/*
 * CSVConfiguration.java
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

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.text.MessageFormat;
import java.util.Properties;

/**
 * Immutable configuration of a {@link CSVParser}.
 * <p>
 * Instances are created with a {@link Builder}:
 * <pre>{@code
 * CSVConfiguration config = new CSVConfiguration.Builder()
 *     .delimiter(';')
 *     .quoteRequired(true)
 *     .recordHandler(myRecordHandler)
 *     .build();
 * }</pre>
 * or from properties with {@link #fromProperties(Properties, String)}.
 * <p>
 * The scanner works on bytes, so the delimiter and quote must each encode
 * to exactly one byte in the configured encoding.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class CSVConfiguration {

    /** Configuration with every setting at its default. */
    public static final CSVConfiguration DEFAULT = new Builder().build();

    private final char delimiter;
    private final byte delimiterByte;
    private final int quote; // quote byte or -1 if disabled
    private final char quoteChar;
    private final boolean quoteRequired;
    private final Charset encoding;
    private final boolean detectBOM;
    private final ErrorHandler errorHandler;
    private final FieldHandler headerFieldHandler;
    private final FieldHandler fieldHandler;
    private final RecordHandler headerHandler;
    private final RecordHandler recordHandler;

    private CSVConfiguration(Builder builder, char delimiter, byte delimiterByte,
                             int quote, char quoteChar, Charset encoding) {
        this.delimiter = delimiter;
        this.delimiterByte = delimiterByte;
        this.quote = quote;
        this.quoteChar = quoteChar;
        this.quoteRequired = quote >= 0 && builder.quoteRequired;
        this.encoding = encoding;
        this.detectBOM = builder.detectBOM;
        this.errorHandler = builder.errorHandler;
        this.headerFieldHandler = builder.headerFieldHandler;
        this.fieldHandler = builder.fieldHandler;
        this.headerHandler = builder.headerHandler;
        this.recordHandler = builder.recordHandler;
    }

    /**
     * Reads a configuration from properties. Recognised keys, each
     * preceded by the given prefix, are {@code delimiter}, {@code quote}
     * (empty to disable quoting), {@code quoteRequired}, {@code encoding}
     * and {@code detectBOM}. Missing keys take their default values.
     * Handlers cannot be given as properties.
     *
     * @param properties the properties
     * @param prefix the key prefix, e.g. "csv.", or null
     * @return a builder initialised from the properties
     * @throws IllegalArgumentException if a value is invalid
     */
    public static Builder fromProperties(Properties properties, String prefix) {
        if (prefix == null) {
            prefix = "";
        }
        Builder builder = new Builder();
        String value = properties.getProperty(prefix + "delimiter");
        if (value != null) {
            builder.delimiter(value);
        }
        value = properties.getProperty(prefix + "quote");
        if (value != null) {
            builder.quote(value);
        }
        value = properties.getProperty(prefix + "quoteRequired");
        if (value != null) {
            builder.quoteRequired(Boolean.parseBoolean(value.trim()));
        }
        value = properties.getProperty(prefix + "encoding");
        if (value != null) {
            builder.encoding(value.trim());
        }
        value = properties.getProperty(prefix + "detectBOM");
        if (value != null) {
            builder.detectBOM(Boolean.parseBoolean(value.trim()));
        }
        return builder;
    }

    /**
     * Returns the field delimiter.
     * @return the delimiter character
     */
    public char getDelimiter() {
        return delimiter;
    }

    byte getDelimiterByte() {
        return delimiterByte;
    }

    /**
     * Returns true if fields may be quoted.
     * @return whether quoting is enabled
     */
    public boolean isQuoteEnabled() {
        return quote >= 0;
    }

    /**
     * Returns the quote character, or 0 if quoting is disabled.
     * @return the quote character
     */
    public char getQuote() {
        return quoteChar;
    }

    /**
     * Returns the quote byte, or -1 if quoting is disabled.
     */
    int getQuoteByte() {
        return quote;
    }

    /**
     * Returns true if every field must begin with the quote.
     * Always false when quoting is disabled.
     * @return whether quotes are required
     */
    public boolean isQuoteRequired() {
        return quoteRequired;
    }

    /**
     * Returns the encoding used to decode fields and string input.
     * @return the charset
     */
    public Charset getEncoding() {
        return encoding;
    }

    /**
     * Returns true if a UTF-8 byte order mark at the start of the input is
     * to be dropped. This only applies when the encoding is UTF-8; in any
     * other encoding the bytes EF BB BF are content.
     * @return whether BOM detection is enabled
     */
    public boolean isDetectBOM() {
        return detectBOM;
    }

    /**
     * @return the error handler, or null for the default
     */
    public ErrorHandler getErrorHandler() {
        return errorHandler;
    }

    /**
     * @return the header field handler, or null
     */
    public FieldHandler getHeaderFieldHandler() {
        return headerFieldHandler;
    }

    /**
     * @return the field handler, or null
     */
    public FieldHandler getFieldHandler() {
        return fieldHandler;
    }

    /**
     * @return the header record handler, or null
     */
    public RecordHandler getHeaderHandler() {
        return headerHandler;
    }

    /**
     * @return the record handler, or null for the default
     */
    public RecordHandler getRecordHandler() {
        return recordHandler;
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder("CSVConfiguration[delimiter=");
        buf.append(delimiter);
        buf.append(",quote=");
        buf.append(isQuoteEnabled() ? String.valueOf(quoteChar) : "none");
        if (quoteRequired) {
            buf.append(",quoteRequired");
        }
        buf.append(",encoding=").append(encoding.name());
        if (detectBOM) {
            buf.append(",detectBOM");
        }
        buf.append(']');
        return buf.toString();
    }

    /**
     * Builder for {@link CSVConfiguration}.
     * Validation happens in {@link #build()}.
     */
    public static class Builder {

        private String delimiter = ",";
        private String quote = "\"";
        private boolean quoteRequired;
        private Charset encoding = StandardCharsets.UTF_8;
        private String encodingName;
        private boolean detectBOM = true;
        private ErrorHandler errorHandler;
        private FieldHandler headerFieldHandler;
        private FieldHandler fieldHandler;
        private RecordHandler headerHandler;
        private RecordHandler recordHandler;

        /**
         * Creates a builder with default settings.
         */
        public Builder() {
        }

        /**
         * Creates a builder initialised from an existing configuration.
         * @param configuration the configuration to copy
         */
        public Builder(CSVConfiguration configuration) {
            delimiter = String.valueOf(configuration.delimiter);
            quote = configuration.isQuoteEnabled() ? String.valueOf(configuration.quoteChar) : null;
            quoteRequired = configuration.quoteRequired;
            encoding = configuration.encoding;
            detectBOM = configuration.detectBOM;
            errorHandler = configuration.errorHandler;
            headerFieldHandler = configuration.headerFieldHandler;
            fieldHandler = configuration.fieldHandler;
            headerHandler = configuration.headerHandler;
            recordHandler = configuration.recordHandler;
        }

        /**
         * Sets the field delimiter (default ',').
         * @param delimiter the delimiter
         * @return this builder
         */
        public Builder delimiter(char delimiter) {
            this.delimiter = String.valueOf(delimiter);
            return this;
        }

        /**
         * Sets the field delimiter, which must be a single character.
         * @param delimiter the delimiter
         * @return this builder
         */
        public Builder delimiter(String delimiter) {
            this.delimiter = delimiter;
            return this;
        }

        /**
         * Sets the quote character (default '"').
         * @param quote the quote
         * @return this builder
         */
        public Builder quote(char quote) {
            this.quote = String.valueOf(quote);
            return this;
        }

        /**
         * Sets the quote character. Null or the empty string disables
         * quoting; otherwise it must be a single character.
         * @param quote the quote
         * @return this builder
         */
        public Builder quote(String quote) {
            this.quote = quote;
            return this;
        }

        /**
         * Disables quoting: the quote character has no special meaning.
         * @return this builder
         */
        public Builder noQuote() {
            this.quote = null;
            return this;
        }

        /**
         * Sets whether every field must begin with the quote (default
         * false). Ignored when quoting is disabled.
         * @param quoteRequired whether quotes are required
         * @return this builder
         */
        public Builder quoteRequired(boolean quoteRequired) {
            this.quoteRequired = quoteRequired;
            return this;
        }

        /**
         * Sets the encoding (default UTF-8).
         * @param encoding the charset
         * @return this builder
         */
        public Builder encoding(Charset encoding) {
            this.encoding = encoding;
            this.encodingName = null;
            return this;
        }

        /**
         * Sets the encoding by name.
         * @param encoding the charset name
         * @return this builder
         */
        public Builder encoding(String encoding) {
            this.encodingName = encoding;
            return this;
        }

        /**
         * Sets whether a leading UTF-8 byte order mark is dropped
         * (default true). Has no effect unless the encoding is UTF-8.
         * @param detectBOM whether to detect the BOM
         * @return this builder
         */
        public Builder detectBOM(boolean detectBOM) {
            this.detectBOM = detectBOM;
            return this;
        }

        /**
         * Sets the handler notified of malformed lines. By default errors
         * are logged as warnings.
         * @param handler the error handler
         * @return this builder
         */
        public Builder errorHandler(ErrorHandler handler) {
            this.errorHandler = handler;
            return this;
        }

        /**
         * Sets the handler notified of each field of the header record.
         * Setting it makes the first record the header.
         * @param handler the header field handler
         * @return this builder
         */
        public Builder headerFieldHandler(FieldHandler handler) {
            this.headerFieldHandler = handler;
            return this;
        }

        /**
         * Sets the handler notified of each data field.
         * @param handler the field handler
         * @return this builder
         */
        public Builder fieldHandler(FieldHandler handler) {
            this.fieldHandler = handler;
            return this;
        }

        /**
         * Sets the handler notified of the header record.
         * Setting it makes the first record the header.
         * @param handler the header handler
         * @return this builder
         */
        public Builder headerHandler(RecordHandler handler) {
            this.headerHandler = handler;
            return this;
        }

        /**
         * Sets the handler notified of each data record. By default
         * records are logged at FINE level.
         * @param handler the record handler
         * @return this builder
         */
        public Builder recordHandler(RecordHandler handler) {
            this.recordHandler = handler;
            return this;
        }

        /**
         * Validates the settings and builds the configuration.
         * @return the configuration
         * @throws IllegalArgumentException if the delimiter or quote is not
         * a single byte in the encoding, is a line break character, or if
         * both are the same, or if the encoding is unknown
         */
        public CSVConfiguration build() {
            Charset charset = encoding;
            if (encodingName != null) {
                try {
                    charset = Charset.forName(encodingName);
                } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                    String msg = MessageFormat.format(CSVParser.L10N.getString("err.unknown_encoding"), encodingName);
                    throw new IllegalArgumentException(msg, e);
                }
            }
            if (delimiter == null || delimiter.length() != 1) {
                String msg = MessageFormat.format(CSVParser.L10N.getString("err.delimiter_length"), delimiter);
                throw new IllegalArgumentException(msg);
            }
            char d = delimiter.charAt(0);
            byte delimiterByte = singleByte(d, charset);
            int quoteByte = -1;
            char q = 0;
            if (quote != null && quote.length() > 0) {
                if (quote.length() != 1) {
                    String msg = MessageFormat.format(CSVParser.L10N.getString("err.quote_length"), quote);
                    throw new IllegalArgumentException(msg);
                }
                q = quote.charAt(0);
                if (q == d) {
                    String msg = MessageFormat.format(CSVParser.L10N.getString("err.delimiter_is_quote"), d);
                    throw new IllegalArgumentException(msg);
                }
                quoteByte = singleByte(q, charset) & 0xff;
            }
            return new CSVConfiguration(this, d, delimiterByte, quoteByte, q, charset);
        }

        private static byte singleByte(char c, Charset charset) {
            if (c == '\r' || c == '\n') {
                throw new IllegalArgumentException(CSVParser.L10N.getString("err.line_break"));
            }
            byte[] bytes = String.valueOf(c).getBytes(charset);
            if (bytes.length != 1 || !charset.newEncoder().canEncode(c)) {
                String msg = MessageFormat.format(CSVParser.L10N.getString("err.not_single_byte"), c, charset.name());
                throw new IllegalArgumentException(msg);
            }
            return bytes[0];
        }

    }

}
