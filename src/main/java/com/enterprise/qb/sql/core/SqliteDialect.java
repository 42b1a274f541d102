package com.enterprise.qb.sql.core;

import com.enterprise.qb.sql.compiler.Compiler;

/** SQLite dialect: upserts render as {@code REPLACE INTO}. */
public class SqliteDialect extends AbstractDialect {

    private static final Compiler COMPILER = new SqliteCompiler();

    public SqliteDialect() {
        super("\"");
    }

    @Override
    public String driver() {
        return Dialects.SQLITE;
    }

    @Override
    public Compiler compiler() {
        return COMPILER;
    }
}
