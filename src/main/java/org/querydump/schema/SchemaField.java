package org.querydump.schema;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;
import java.util.TreeMap;

/**
 * One column of the warehouse schema file.
 * <p>
 * Fields read from a user supplied list keep their keys as given: a missing mode stays missing
 * and keys such as "description" are carried through to the schema file.
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder(alphabetic = true)
public class SchemaField {

    private final String name;
    private final WarehouseType type;
    private final FieldMode mode;
    private final Map<String, Object> additionalProperties = new TreeMap<>();

    @JsonCreator
    public SchemaField(@JsonProperty(value = "name", required = true) String name,
                       @JsonProperty(value = "type", required = true) WarehouseType type,
                       @JsonProperty("mode") FieldMode mode) {
        this.name = name;
        this.type = type;
        this.mode = mode;
    }

    @JsonAnyGetter
    public Map<String, Object> getAdditionalProperties() {
        return additionalProperties;
    }

    @JsonAnySetter
    void setAdditionalProperty(String key, Object value) {
        additionalProperties.put(key, value);
    }
}
