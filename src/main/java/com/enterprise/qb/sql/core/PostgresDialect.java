package com.enterprise.qb.sql.core;

import com.enterprise.qb.sql.compiler.Compiler;

/**
 * Postgres dialect: numbered {@code $N} placeholders and
 * {@code INSERT ... ON CONFLICT} upserts.
 */
public class PostgresDialect extends AbstractDialect {

    private static final Compiler COMPILER = new PostgresCompiler();

    private int bindingIndex;

    public PostgresDialect() {
        super("\"");
    }

    @Override
    public String driver() {
        return Dialects.POSTGRES;
    }

    @Override
    public PlaceholderStyle placeholderStyle() {
        return PlaceholderStyle.NUMBERED;
    }

    @Override
    public String placeholder() {
        bindingIndex++;
        return "$" + bindingIndex;
    }

    @Override
    public void reset() {
        bindingIndex = 0;
    }

    @Override
    public Compiler compiler() {
        return COMPILER;
    }
}
