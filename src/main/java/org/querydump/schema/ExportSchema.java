package org.querydump.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The content of the schema file: either a caller supplied blob written verbatim,
 * or an ordered list of fields serialized as a JSON array.
 */
public final class ExportSchema {

    private final String blob;
    private final List<SchemaField> fields;

    private ExportSchema(String blob, List<SchemaField> fields) {
        this.blob = blob;
        this.fields = fields;
    }

    public static ExportSchema ofBlob(String blob) {
        return new ExportSchema(Objects.requireNonNull(blob, "blob"), null);
    }

    public static ExportSchema ofFields(List<SchemaField> fields) {
        return new ExportSchema(null, Collections.unmodifiableList(fields));
    }

    public boolean isBlob() {
        return blob != null;
    }

    public List<SchemaField> getFields() {
        return fields;
    }

    /**
     * The blob as UTF-8, or the fields as a JSON array with every object's keys sorted,
     * including the additional keys of user supplied fields.
     */
    public byte[] toBytes(ObjectMapper mapper) throws JsonProcessingException {
        if (isBlob()) {
            return blob.getBytes(StandardCharsets.UTF_8);
        }
        List<Map<String, Object>> records = mapper.convertValue(fields, new TypeReference<List<Map<String, Object>>>() {
        });
        return mapper.copy().enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS).writeValueAsBytes(records);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExportSchema that = (ExportSchema) o;
        return Objects.equals(blob, that.blob) && Objects.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(blob, fields);
    }

    @Override
    public String toString() {
        return isBlob() ? blob : String.valueOf(fields);
    }
}
