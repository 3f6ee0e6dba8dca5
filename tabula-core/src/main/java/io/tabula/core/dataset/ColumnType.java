package io.tabula.core.dataset;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;

public enum ColumnType {
    INTEGER("INTEGER"),
    REAL("REAL"),
    TEXT("TEXT"),
    BOOLEAN("INTEGER"),
    NULL("");

    private final String sqlType;

    ColumnType(String sqlType) {
        this.sqlType = sqlType;
    }

    /**
     * Declared type used when the column is materialized in SQLite. Booleans are stored as 0/1
     * and all-null columns are left without a declared type.
     */
    public String sqlType() {
        return sqlType;
    }

    public static ColumnType of(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short
            || value instanceof Byte || value instanceof BigInteger) {
            return INTEGER;
        }
        if (value instanceof Number) {
            return REAL;
        }
        return TEXT;
    }

    public static ColumnType infer(Collection<?> values) {
        ColumnType result = NULL;
        for (Object value : values) {
            result = widen(result, of(value));
            if (result == TEXT) {
                return TEXT;
            }
        }
        return result;
    }

    static ColumnType widen(ColumnType current, ColumnType next) {
        if (next == NULL || current == next) {
            return current;
        }
        if (current == NULL) {
            return next;
        }
        if ((current == INTEGER && next == REAL) || (current == REAL && next == INTEGER)) {
            return REAL;
        }
        if ((current == BOOLEAN && next == INTEGER) || (current == INTEGER && next == BOOLEAN)) {
            return INTEGER;
        }
        return TEXT;
    }

    static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.doubleValue();
        }
        if (value instanceof BigInteger integer) {
            return integer.longValue();
        }
        return value;
    }
}
