package org.querydump.file;

import org.apache.commons.csv.CSVFormat;
import org.querydump.exception.EncodingException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * CSV rows under a {@link CsvDialect}, UTF-8.
 */
public class CsvRecordEncoder implements RecordEncoder {

    private final List<String> columns;
    private final CsvDialect dialect;
    private final CSVFormat format;
    private final boolean includeHeader;
    private final StringBuilder buffer = new StringBuilder(256);

    public CsvRecordEncoder(List<String> columns, CsvDialect dialect, boolean includeHeader) {
        this.columns = columns;
        this.dialect = dialect;
        this.format = dialect.toCsvFormat();
        this.includeHeader = includeHeader;
    }

    @Override
    public FileFormats getFileFormat() {
        return FileFormats.CSV;
    }

    @Override
    public byte[] encode(Object[] values) throws EncodingException {
        if (values.length != columns.size()) {
            throw new EncodingException("Row has " + values.length + " values but the query has " + columns.size() + " columns");
        }
        return print(values);
    }

    @Override
    public byte[] encodeHeader() throws EncodingException {
        if (!includeHeader) {
            return null;
        }
        return print(columns.toArray());
    }

    private byte[] print(Object[] values) throws EncodingException {
        for (Object value : values) {
            checkRepresentable(value);
        }
        Object[] printed = values;
        if (dialect.getQuoting() == CsvQuoting.NONE && dialect.getEscapechar() != null) {
            printed = new Object[values.length];
            for (int i = 0; i < values.length; i++) {
                printed[i] = values[i] == null ? null : escapeUnquoted(values[i].toString());
            }
        }
        buffer.setLength(0);
        try {
            format.printRecord(buffer, printed);
        } catch (IOException | IllegalArgumentException | IllegalStateException e) {
            throw new EncodingException("Could not write CSV record: " + e.getMessage(), e);
        }
        return buffer.toString().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Rejects values that need escaping when the dialect gives no way to escape them.
     */
    private void checkRepresentable(Object value) throws EncodingException {
        if (value == null || value instanceof Number) {
            return;
        }
        String text = value.toString();
        boolean quoteCanBeEscaped = dialect.isDoublequote() || dialect.getEscapechar() != null;

        if (dialect.getQuoting() == CsvQuoting.NONE) {
            if (dialect.getEscapechar() != null) {
                return;
            }
            if (needsEscapeWithoutQuotes(text)) {
                throw new EncodingException("Need to escape, but no escapechar set: field '" + text
                        + "' cannot be written with quoting NONE");
            }
        } else if (!quoteCanBeEscaped && text.indexOf(dialect.getQuotechar()) >= 0) {
            throw new EncodingException("Need to escape, but no escapechar set: field '" + text
                    + "' contains the quote character and doublequote is disabled");
        }
    }

    private boolean needsEscapeWithoutQuotes(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (isSpecialUnquoted(text.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Puts the escape character before every delimiter, quote character, escape character and line break.
     */
    private String escapeUnquoted(String text) {
        char escape = dialect.getEscapechar();
        StringBuilder escaped = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (isSpecialUnquoted(c)) {
                escaped.append(escape);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    private boolean isSpecialUnquoted(char c) {
        return c == dialect.getDelimiter() || c == '\r' || c == '\n'
                || (dialect.getQuotechar() != null && c == dialect.getQuotechar())
                || (dialect.getEscapechar() != null && c == dialect.getEscapechar())
                || dialect.getLineterminator().indexOf(c) >= 0;
    }
}
