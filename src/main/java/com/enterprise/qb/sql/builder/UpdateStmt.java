package com.enterprise.qb.sql.builder;

import com.enterprise.qb.sql.clause.Clause;
import com.enterprise.qb.sql.clause.ColumnElem;
import com.enterprise.qb.sql.clause.TableElem;
import com.enterprise.qb.sql.clause.WhereClause;
import com.enterprise.qb.sql.compiler.CompilerContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;

/**
 * Fluent UPDATE statement.
 *
 * <pre>{@code
 * UpdateStmt.update(users)
 *     .set("status", "ACTIVE")
 *     .where(users.c("id").eq(42))
 *     .build(dialect);
 * // UPDATE users
 * // SET status = ?
 * // WHERE id = ?
 * }</pre>
 *
 * <p>Without {@link #where} the update applies to every row.
 */
public class UpdateStmt implements Clause {

    private final TableElem table;
    private final ValueMap values;
    private WhereClause where;
    private final List<ColumnElem> returning = new ArrayList<>();

    private UpdateStmt(TableElem table) {
        this.table = Objects.requireNonNull(table, "table");
        this.values = new ValueMap(table);
    }

    public static UpdateStmt update(TableElem table) {
        return new UpdateStmt(table);
    }

    public UpdateStmt set(String column, Object value) {
        values.put(column, value);
        return this;
    }

    public UpdateStmt values(Map<String, ?> more) {
        values.putAll(more);
        return this;
    }

    public UpdateStmt where(Clause clause) {
        this.where = new WhereClause(clause);
        return this;
    }

    public UpdateStmt returning(ColumnElem... cols) {
        for (ColumnElem c : cols) {
            returning.add(Objects.requireNonNull(c, "returning column"));
        }
        return this;
    }

    public TableElem table() { return table; }
    public SortedMap<String, Object> values() { return values.view(); }
    public WhereClause where() { return where; }
    public List<ColumnElem> returning() { return Collections.unmodifiableList(returning); }

    @Override
    public String compile(CompilerContext context) {
        return context.compiler().visitUpdate(context, this);
    }
}
