package com.enterprise.qb.sql.core;

import com.enterprise.qb.sql.builder.UpsertStmt;
import com.enterprise.qb.sql.compiler.CompilerContext;
import com.enterprise.qb.sql.compiler.SqlCompiler;
import com.enterprise.qb.sql.compiler.UnsupportedClauseException;

import java.util.ArrayList;
import java.util.List;

/**
 * MySQL rules: upsert renders as {@code INSERT ... ON DUPLICATE KEY UPDATE c = VALUES(c)}.
 * MySQL resolves the conflict from the table's unique keys, so
 * {@link UpsertStmt#conflictColumns()} is ignored. RETURNING does not exist in MySQL.
 */
public class MysqlCompiler extends SqlCompiler {

    @Override
    public String visitUpsert(CompilerContext context, UpsertStmt upsert) {
        if (!upsert.returning().isEmpty()) {
            throw new UnsupportedClauseException("UPSERT ... RETURNING", context.dialect().driver());
        }
        return inTableScope(context, upsert.table(), () -> {
            String insert = renderInsert(context, "INSERT INTO", upsert.table(), upsert.values());
            List<String> sets = new ArrayList<>();
            for (String column : upsert.values().keySet()) {
                String label = context.compiler().visitLabel(context, column);
                sets.add(label + " = VALUES(" + label + ")");
            }
            return insert + "\nON DUPLICATE KEY UPDATE " + String.join(", ", sets);
        });
    }
}
