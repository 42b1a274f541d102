package com.enterprise.qb.sql.builder;

import com.enterprise.qb.sql.clause.Clause;
import com.enterprise.qb.sql.clause.ColumnElem;
import com.enterprise.qb.sql.clause.TableElem;
import com.enterprise.qb.sql.clause.WhereClause;
import com.enterprise.qb.sql.compiler.CompilerContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Fluent DELETE statement. Without {@link #where} every row is deleted.
 */
public class DeleteStmt implements Clause {

    private final TableElem table;
    private WhereClause where;
    private final List<ColumnElem> returning = new ArrayList<>();

    private DeleteStmt(TableElem table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    public static DeleteStmt delete(TableElem table) {
        return new DeleteStmt(table);
    }

    public DeleteStmt where(Clause clause) {
        this.where = new WhereClause(clause);
        return this;
    }

    public DeleteStmt returning(ColumnElem... cols) {
        for (ColumnElem c : cols) {
            returning.add(Objects.requireNonNull(c, "returning column"));
        }
        return this;
    }

    public TableElem table() { return table; }
    public WhereClause where() { return where; }
    public List<ColumnElem> returning() { return Collections.unmodifiableList(returning); }

    @Override
    public String compile(CompilerContext context) {
        return context.compiler().visitDelete(context, this);
    }
}
