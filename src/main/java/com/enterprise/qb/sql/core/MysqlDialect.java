package com.enterprise.qb.sql.core;

import com.enterprise.qb.sql.compiler.Compiler;

/** MySQL dialect: backtick escaping and {@code ON DUPLICATE KEY UPDATE} upserts. */
public class MysqlDialect extends AbstractDialect {

    private static final Compiler COMPILER = new MysqlCompiler();

    public MysqlDialect() {
        super("`");
    }

    @Override
    public String driver() {
        return Dialects.MYSQL;
    }

    @Override
    public Compiler compiler() {
        return COMPILER;
    }
}
