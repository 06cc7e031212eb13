package org.querydump.schema;

/**
 * Reduced type vocabulary understood by the destination warehouse.
 */
public enum WarehouseType {
    INTEGER,
    FLOAT,
    TIMESTAMP,
    STRING
}
