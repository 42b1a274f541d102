package com.enterprise.qb.spring;

import com.enterprise.qb.sql.core.Dialect;
import com.enterprise.qb.sql.core.Dialects;

/**
 * Creates configured {@link Dialect} instances. Every call returns a new instance,
 * so concurrent compilations never share placeholder counters.
 */
public class DialectFactory {

    private final String driver;
    private final boolean escaping;

    /**
     * @throws IllegalArgumentException if the driver is unknown
     */
    public DialectFactory(String driver, boolean escaping) {
        Dialects.create(driver); // fail fast on unknown drivers
        this.driver = driver;
        this.escaping = escaping;
    }

    public Dialect newDialect() {
        Dialect dialect = Dialects.create(driver);
        dialect.setEscaping(escaping);
        return dialect;
    }

    public String driver() {
        return driver;
    }

    public boolean escaping() {
        return escaping;
    }
}
