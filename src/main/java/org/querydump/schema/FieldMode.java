package org.querydump.schema;

public enum FieldMode {
    NULLABLE,
    REQUIRED
}
