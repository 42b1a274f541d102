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
 * Insert-or-update statement. There is no ANSI form: the default compiler
 * rejects it and each dialect renders its own syntax (Postgres
 * {@code ON CONFLICT}, MySQL {@code ON DUPLICATE KEY UPDATE}, SQLite
 * {@code REPLACE INTO}).
 *
 * <pre>{@code
 * UpsertStmt.upsert(users)
 *     .value("id", 1).value("email", "a@b.c")
 *     .onConflict(users.c("id"))
 *     .build(Dialects.create("postgres"));
 * }</pre>
 */
public class UpsertStmt implements Clause {

    private final TableElem table;
    private final ValueMap values;
    private final List<ColumnElem> conflictColumns = new ArrayList<>();
    private final List<ColumnElem> returning = new ArrayList<>();

    private UpsertStmt(TableElem table) {
        this.table = Objects.requireNonNull(table, "table");
        this.values = new ValueMap(table);
    }

    public static UpsertStmt upsert(TableElem table) {
        return new UpsertStmt(table);
    }

    public UpsertStmt value(String column, Object value) {
        values.put(column, value);
        return this;
    }

    public UpsertStmt values(Map<String, ?> more) {
        values.putAll(more);
        return this;
    }

    /** Unique key columns that identify an existing row. */
    public UpsertStmt onConflict(ColumnElem... cols) {
        for (ColumnElem c : cols) {
            conflictColumns.add(Objects.requireNonNull(c, "conflict column"));
        }
        return this;
    }

    public UpsertStmt returning(ColumnElem... cols) {
        for (ColumnElem c : cols) {
            returning.add(Objects.requireNonNull(c, "returning column"));
        }
        return this;
    }

    public TableElem table() { return table; }
    public SortedMap<String, Object> values() { return values.view(); }
    public List<ColumnElem> conflictColumns() { return Collections.unmodifiableList(conflictColumns); }
    public List<ColumnElem> returning() { return Collections.unmodifiableList(returning); }

    @Override
    public String compile(CompilerContext context) {
        return context.compiler().visitUpsert(context, this);
    }
}
