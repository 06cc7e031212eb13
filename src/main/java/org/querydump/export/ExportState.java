package org.querydump.export;

public enum ExportState {
    NEW,
    QUERYING,
    WRITING_DATA,
    WRITING_SCHEMA,
    FINALIZED,
    FAILED
}
