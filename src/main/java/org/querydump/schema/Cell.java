package org.querydump.schema;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Base64;
import java.util.Objects;

/**
 * A single value fetched from the source database, tagged with the kind of value it holds.
 * Built by the row cursor from the driver value.
 */
public final class Cell {

    public enum Kind {
        NULL,
        INTEGER,
        FLOAT,
        DECIMAL,
        STRING,
        TIMESTAMP
    }

    private static final Cell NULL_CELL = new Cell(Kind.NULL, null);

    private final Kind kind;
    private final Object value;

    private Cell(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static Cell ofNull() {
        return NULL_CELL;
    }

    public static Cell ofInteger(long value) {
        return new Cell(Kind.INTEGER, value);
    }

    public static Cell ofFloat(double value) {
        return new Cell(Kind.FLOAT, value);
    }

    public static Cell ofDecimal(BigDecimal value) {
        return value == null ? NULL_CELL : new Cell(Kind.DECIMAL, value);
    }

    public static Cell ofString(String value) {
        return value == null ? NULL_CELL : new Cell(Kind.STRING, value);
    }

    /**
     * The wall-clock fields of the timestamp are kept as-is, without any zone.
     */
    public static Cell ofTimestamp(LocalDateTime value) {
        return value == null ? NULL_CELL : new Cell(Kind.TIMESTAMP, value);
    }

    /**
     * Classifies an object as returned by {@code ResultSet.getObject}.
     */
    public static Cell of(Object value) {
        if (value == null) {
            return NULL_CELL;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ofInteger(((Number) value).longValue());
        }
        if (value instanceof Double) {
            return ofFloat((Double) value);
        }
        if (value instanceof Float) {
            // Keeps the decimal digits of the float, 0.1f stays 0.1
            return ofFloat(Double.parseDouble(value.toString()));
        }
        if (value instanceof BigDecimal) {
            return ofDecimal((BigDecimal) value);
        }
        if (value instanceof BigInteger) {
            BigInteger bigInteger = (BigInteger) value;
            // BIGINT UNSIGNED above Long.MAX_VALUE
            return bigInteger.bitLength() < 64 ? ofInteger(bigInteger.longValue()) : ofDecimal(new BigDecimal(bigInteger));
        }
        if (value instanceof Boolean) {
            return ofInteger(((Boolean) value) ? 1L : 0L);
        }
        if (value instanceof java.sql.Timestamp) {
            return ofTimestamp(((java.sql.Timestamp) value).toLocalDateTime());
        }
        if (value instanceof java.sql.Date) {
            return ofTimestamp(((java.sql.Date) value).toLocalDate().atStartOfDay());
        }
        if (value instanceof LocalDateTime) {
            return ofTimestamp((LocalDateTime) value);
        }
        if (value instanceof LocalDate) {
            return ofTimestamp(((LocalDate) value).atStartOfDay());
        }
        if (value instanceof OffsetDateTime) {
            return ofTimestamp(((OffsetDateTime) value).toLocalDateTime());
        }
        if (value instanceof ZonedDateTime) {
            return ofTimestamp(((ZonedDateTime) value).toLocalDateTime());
        }
        if (value instanceof byte[]) {
            return ofString(Base64.getEncoder().encodeToString((byte[]) value));
        }
        return ofString(value.toString());
    }

    public Kind getKind() {
        return kind;
    }

    public Object getValue() {
        return value;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Cell cell = (Cell) o;
        return kind == cell.kind && Objects.equals(value, cell.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return "Cell{" + kind + "=" + value + '}';
    }
}
