package com.enterprise.qb.sql.builder;

import com.enterprise.qb.sql.clause.Clause;
import com.enterprise.qb.sql.clause.ColumnElem;
import com.enterprise.qb.sql.clause.TableElem;
import com.enterprise.qb.sql.compiler.CompilerContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;

/**
 * Fluent INSERT statement.
 *
 * <pre>{@code
 * SqlResult r = InsertStmt.insert(users)
 *     .value("email", "a@b.c")
 *     .value("status", "NEW")
 *     .returning(users.c("id"))
 *     .build(dialect);
 * // INSERT INTO users(email, status)
 * // VALUES(?, ?)
 * // RETURNING id
 * }</pre>
 *
 * <p>A value that is itself a {@link Clause} is compiled in place instead of
 * being bound. A {@link SelectStmt} value renders in parentheses:
 * {@code VALUES(?, (SELECT id ...))}.
 */
public class InsertStmt implements Clause {

    private final TableElem table;
    private final ValueMap values;
    private final List<ColumnElem> returning = new ArrayList<>();

    private InsertStmt(TableElem table) {
        this.table = Objects.requireNonNull(table, "table");
        this.values = new ValueMap(table);
    }

    public static InsertStmt insert(TableElem table) {
        return new InsertStmt(table);
    }

    public InsertStmt value(String column, Object value) {
        values.put(column, value);
        return this;
    }

    public InsertStmt values(Map<String, ?> more) {
        values.putAll(more);
        return this;
    }

    public InsertStmt returning(ColumnElem... cols) {
        for (ColumnElem c : cols) {
            returning.add(Objects.requireNonNull(c, "returning column"));
        }
        return this;
    }

    public TableElem table() { return table; }
    public SortedMap<String, Object> values() { return values.view(); }
    public List<ColumnElem> returning() { return Collections.unmodifiableList(returning); }

    @Override
    public String compile(CompilerContext context) {
        return context.compiler().visitInsert(context, this);
    }
}
