package com.enterprise.qb.sql.core;

import java.util.List;
import java.util.Locale;

public final class Dialects {

    private Dialects() {}

    public static final String DEFAULT = "default";
    public static final String POSTGRES = "postgres";
    public static final String MYSQL = "mysql";
    public static final String SQLITE = "sqlite";

    public static final List<String> DRIVERS = List.of(DEFAULT, POSTGRES, MYSQL, SQLITE);

    /**
     * Creates a new dialect instance for the given driver name (case-insensitive).
     * Each call returns a fresh instance with its own placeholder state.
     *
     * @throws IllegalArgumentException if the driver is unknown
     */
    public static Dialect create(String driver) {
        if (driver == null) {
            throw new IllegalArgumentException("Dialect driver cannot be null");
        }
        return switch (driver.trim().toLowerCase(Locale.ROOT)) {
            case DEFAULT -> new DefaultDialect();
            case POSTGRES, "postgresql" -> new PostgresDialect();
            case MYSQL -> new MysqlDialect();
            case SQLITE, "sqlite3" -> new SqliteDialect();
            default -> throw new IllegalArgumentException(
                    "Unknown dialect: " + driver + " (supported: " + DRIVERS + ")");
        };
    }
}
