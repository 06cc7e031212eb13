package org.querydump.file;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.querydump.exception.EncodingException;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Newline delimited JSON: one object per row, keys sorted, UTF-8.
 */
public class JsonRecordEncoder implements RecordEncoder {

    private static final byte NEWLINE = '\n';

    private final List<String> columns;
    private final ObjectMapper mapper;

    public JsonRecordEncoder(List<String> columns, ObjectMapper mapper) {
        this.columns = columns;
        this.mapper = mapper.copy().enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    @Override
    public FileFormats getFileFormat() {
        return FileFormats.JSON;
    }

    @Override
    public byte[] encode(Object[] values) throws EncodingException {
        if (values.length != columns.size()) {
            throw new EncodingException("Row has " + values.length + " values but the query has " + columns.size() + " columns");
        }
        Map<String, Object> record = new TreeMap<>();
        for (int i = 0; i < values.length; i++) {
            record.put(columns.get(i), values[i]);
        }

        byte[] json;
        try {
            json = mapper.writeValueAsBytes(record);
        } catch (JsonProcessingException e) {
            throw new EncodingException("Could not serialize row as JSON: " + e.getOriginalMessage(), e);
        }
        byte[] line = new byte[json.length + 1];
        System.arraycopy(json, 0, line, 0, json.length);
        line[json.length] = NEWLINE;
        return line;
    }

    @Override
    public byte[] encodeHeader() {
        return null;
    }
}
