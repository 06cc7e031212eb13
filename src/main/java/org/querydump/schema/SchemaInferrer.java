package org.querydump.schema;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.querydump.manager.util.ColumnDescriptor;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the warehouse schema of an export, from an explicit override or from the query metadata.
 */
public class SchemaInferrer {

    private static final Logger LOG = LogManager.getLogger(SchemaInferrer.class.getName());

    /**
     * @param columns        column metadata of the query, in result order
     * @param explicitBlob   pre-serialized schema, written verbatim when present
     * @param explicitFields explicit field list, used as-is when present and no blob is given
     * @param schemaName     object name of the schema file, only used for logging
     */
    public ExportSchema infer(List<ColumnDescriptor> columns, String explicitBlob, List<SchemaField> explicitFields, String schemaName) {
        ExportSchema schema;
        if (explicitBlob != null) {
            schema = ExportSchema.ofBlob(explicitBlob);
        } else if (explicitFields != null) {
            schema = ExportSchema.ofFields(new ArrayList<>(explicitFields));
        } else {
            List<SchemaField> fields = new ArrayList<>(columns.size());
            for (ColumnDescriptor column : columns) {
                fields.add(inferField(column));
            }
            schema = ExportSchema.ofFields(fields);
        }

        LOG.info("Using schema for {}: {}", schemaName, schema);
        return schema;
    }

    SchemaField inferField(ColumnDescriptor column) {
        WarehouseType type = TypeConverter.mapType(column.getJdbcType());
        // Timestamps are always nullable: zero dates like 0000-00-00 come back as null
        // even when the driver reports the column as NOT NULL.
        FieldMode mode = column.isNullable() || type == WarehouseType.TIMESTAMP
                ? FieldMode.NULLABLE
                : FieldMode.REQUIRED;
        return new SchemaField(column.getColumnName(), type, mode);
    }
}
