package teranet.mapdev.listings.model;

import java.time.LocalDateTime;

/**
 * Logical type of a table column, inferred from the values it holds.
 */
public enum ColumnType {
    EMPTY,
    STRING,
    LONG,
    DOUBLE,
    BOOLEAN,
    DATETIME;

    /**
     * Type of a single non-null value.
     */
    public static ColumnType of(Object value) {
        if (value == null) {
            return EMPTY;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return LONG;
        }
        if (value instanceof Number) {
            return DOUBLE;
        }
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        if (value instanceof LocalDateTime) {
            return DATETIME;
        }
        return STRING;
    }

    /**
     * Infers the column type from all of its values.
     * LONG and DOUBLE widen to DOUBLE; any other mix falls back to STRING.
     * A column holding only nulls is EMPTY.
     */
    public static ColumnType infer(Iterable<?> values) {
        ColumnType result = EMPTY;
        for (Object value : values) {
            ColumnType type = of(value);
            if (type == EMPTY || type == result) {
                continue;
            }
            if (result == EMPTY) {
                result = type;
            } else if (isNumeric(result) && isNumeric(type)) {
                result = DOUBLE;
            } else {
                return STRING;
            }
        }
        return result;
    }

    public boolean isNumeric() {
        return isNumeric(this);
    }

    private static boolean isNumeric(ColumnType type) {
        return type == LONG || type == DOUBLE;
    }
}
