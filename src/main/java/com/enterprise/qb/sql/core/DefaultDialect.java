package com.enterprise.qb.sql.core;

/** ANSI dialect: {@code ?} placeholders, double-quote escaping, no upsert. */
public class DefaultDialect extends AbstractDialect {

    public DefaultDialect() {
        super("\"");
    }

    @Override
    public String driver() {
        return Dialects.DEFAULT;
    }
}
