package com.enterprise.qb.sql.core;

import com.enterprise.qb.sql.builder.UpsertStmt;
import com.enterprise.qb.sql.compiler.CompilerContext;
import com.enterprise.qb.sql.compiler.SqlCompiler;

/** SQLite rules: upsert renders as {@code REPLACE INTO}. */
public class SqliteCompiler extends SqlCompiler {

    @Override
    public String visitUpsert(CompilerContext context, UpsertStmt upsert) {
        return inTableScope(context, upsert.table(), () ->
                renderInsert(context, "REPLACE INTO", upsert.table(), upsert.values())
                        + renderReturning(context, upsert.returning()));
    }
}
