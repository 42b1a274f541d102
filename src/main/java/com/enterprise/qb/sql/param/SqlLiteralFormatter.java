package com.enterprise.qb.sql.param;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Objects;

/**
 * Converts bound Java values to ANSI SQL literals for debug output.
 * The compiler itself never inlines values; see
 * {@link com.enterprise.qb.sql.compiler.SqlResult#toDebugString()}.
 */
public final class SqlLiteralFormatter {

    private SqlLiteralFormatter() {}

    /**
     * Formats a Java value as an ANSI SQL literal.
     *
     * @throws NullPointerException     if value is null
     * @throws IllegalArgumentException if the type is not supported
     */
    public static String format(Object value) {
        Objects.requireNonNull(value, "literal value must not be null");

        if (value instanceof String s) {
            return quote(s);
        }
        if (value instanceof BigDecimal bd) {
            return bd.toPlainString();
        }
        if (value instanceof Number n) {
            return n.toString();
        }
        if (value instanceof Boolean b) {
            return b ? "TRUE" : "FALSE";
        }
        if (value instanceof LocalDate ld) {
            return "DATE '" + ld + "'";
        }
        if (value instanceof LocalDateTime ldt) {
            return "TIMESTAMP '" + ldt.toString().replace('T', ' ') + "'";
        }
        if (value instanceof LocalTime lt) {
            return "TIME '" + lt + "'";
        }
        if (value instanceof Enum<?> e) {
            return quote(e.name());
        }

        throw new IllegalArgumentException(
                "Unsupported literal type: " + value.getClass().getName());
    }

    /** Like {@link #format} but never fails: null becomes NULL, other types are quoted via toString(). */
    public static String formatForDebug(Object value) {
        if (value == null) {
            return "NULL";
        }
        try {
            return format(value);
        } catch (IllegalArgumentException unsupported) {
            return quote(String.valueOf(value));
        }
    }

    private static String quote(String s) {
        return "'" + s.replace("'", "''") + "'";
    }
}
