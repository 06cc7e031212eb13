package org.querydump.schema;

import java.math.BigDecimal;
import java.sql.Types;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Converts source values and JDBC type codes into values and types that are safe for
 * JSON/CSV files loaded into the warehouse.
 */
public final class TypeConverter {

    private TypeConverter() {
    }

    /**
     * Dates and timestamps become epoch seconds, decimals become doubles, everything else passes through.
     * <p>
     * Epoch seconds are computed from the wall-clock fields read as UTC, so they are only as correct
     * as the time zone the source database stores its values in.
     *
     * @param cell           the fetched value
     * @param sourceTypeCode the {@link Types} code of the column; conversion is driven by the value itself
     * @return a {@link Long}, {@link Double}, {@link String} or {@code null}
     */
    public static Object convert(Cell cell, int sourceTypeCode) {
        switch (cell.getKind()) {
            case NULL:
                return null;
            case TIMESTAMP:
                return ((LocalDateTime) cell.getValue()).toEpochSecond(ZoneOffset.UTC);
            case DECIMAL:
                return ((BigDecimal) cell.getValue()).doubleValue();
            default:
                return cell.getValue();
        }
    }

    /**
     * Maps a JDBC type code to the warehouse type. Unknown codes map to STRING.
     */
    public static WarehouseType mapType(int sourceTypeCode) {
        switch (sourceTypeCode) {
            case Types.TINYINT:
            case Types.SMALLINT:
            case Types.INTEGER:
            case Types.BIGINT:
            case Types.BIT:
            case Types.BOOLEAN:
                return WarehouseType.INTEGER;
            case Types.DECIMAL:
            case Types.NUMERIC:
            case Types.DOUBLE:
            case Types.FLOAT:
            case Types.REAL:
                return WarehouseType.FLOAT;
            case Types.DATE:
            case Types.TIMESTAMP:
            case Types.TIMESTAMP_WITH_TIMEZONE:
                return WarehouseType.TIMESTAMP;
            default:
                return WarehouseType.STRING;
        }
    }
}
