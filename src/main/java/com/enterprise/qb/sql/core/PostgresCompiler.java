package com.enterprise.qb.sql.core;

import com.enterprise.qb.sql.builder.UpsertStmt;
import com.enterprise.qb.sql.clause.ColumnElem;
import com.enterprise.qb.sql.compiler.CompilerContext;
import com.enterprise.qb.sql.compiler.SqlCompiler;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Postgres rules: upsert renders as
 * <pre>
 * INSERT INTO t(a, b)
 * VALUES($1, $2)
 * ON CONFLICT (a)
 * DO UPDATE SET b = EXCLUDED.b
 * </pre>
 * Conflict columns are not overwritten. When nothing else is left to update the
 * statement ends with {@code DO NOTHING}.
 */
public class PostgresCompiler extends SqlCompiler {

    @Override
    public String visitUpsert(CompilerContext context, UpsertStmt upsert) {
        if (upsert.conflictColumns().isEmpty()) {
            throw new IllegalStateException(
                    "Postgres upsert on " + upsert.table().name() + " requires onConflict() columns");
        }
        return inTableScope(context, upsert.table(), () -> {
            StringBuilder sql = new StringBuilder(
                    renderInsert(context, "INSERT INTO", upsert.table(), upsert.values()));
            sql.append("\nON CONFLICT (").append(renderColumns(context, upsert.conflictColumns())).append(")");

            Set<String> keys = new HashSet<>();
            for (ColumnElem c : upsert.conflictColumns()) {
                keys.add(c.name());
            }
            List<String> sets = new ArrayList<>();
            for (String column : upsert.values().keySet()) {
                if (keys.contains(column)) {
                    continue;
                }
                String label = context.compiler().visitLabel(context, column);
                sets.add(label + " = EXCLUDED." + label);
            }
            if (sets.isEmpty()) {
                sql.append("\nDO NOTHING");
            } else {
                sql.append("\nDO UPDATE SET ").append(String.join(", ", sets));
            }
            sql.append(renderReturning(context, upsert.returning()));
            return sql.toString();
        });
    }
}
