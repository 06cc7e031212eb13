package org.querydump.manager.util;

import java.sql.ResultSetMetaData;

/**
 * Data class to store column metadata extracted from ResultSetMetaData.
 * This avoids holding references to ResultSetMetaData after the statement/resultset is closed.
 */
public class ColumnDescriptor {
    private final String columnName;
    private final int jdbcType;
    private final int nullable;

    public ColumnDescriptor(String columnName, int jdbcType, int nullable) {
        this.columnName = columnName;
        this.jdbcType = jdbcType;
        this.nullable = nullable;
    }

    public String getColumnName() {
        return columnName;
    }

    public int getJdbcType() {
        return jdbcType;
    }

    /**
     * @return one of {@link ResultSetMetaData#columnNoNulls}, {@link ResultSetMetaData#columnNullable}
     * or {@link ResultSetMetaData#columnNullableUnknown}
     */
    public int getNullable() {
        return nullable;
    }

    /**
     * Columns with unknown nullability are treated as nullable.
     */
    public boolean isNullable() {
        return nullable != ResultSetMetaData.columnNoNulls;
    }

    @Override
    public String toString() {
        return "ColumnDescriptor{" +
                "columnName='" + columnName + '\'' +
                ", jdbcType=" + jdbcType +
                ", nullable=" + nullable +
                '}';
    }
}
