package com.enterprise.qb.sql.compiler;

import com.enterprise.qb.sql.builder.DeleteStmt;
import com.enterprise.qb.sql.builder.InsertStmt;
import com.enterprise.qb.sql.builder.SelectStmt;
import com.enterprise.qb.sql.builder.UpdateStmt;
import com.enterprise.qb.sql.builder.UpsertStmt;
import com.enterprise.qb.sql.clause.AggregateClause;
import com.enterprise.qb.sql.clause.AliasClause;
import com.enterprise.qb.sql.clause.BinaryExpressionClause;
import com.enterprise.qb.sql.clause.BindClause;
import com.enterprise.qb.sql.clause.Clause;
import com.enterprise.qb.sql.clause.ColumnElem;
import com.enterprise.qb.sql.clause.CombinerClause;
import com.enterprise.qb.sql.clause.ExistsClause;
import com.enterprise.qb.sql.clause.HavingClause;
import com.enterprise.qb.sql.clause.JoinClause;
import com.enterprise.qb.sql.clause.ListClause;
import com.enterprise.qb.sql.clause.OrderByClause;
import com.enterprise.qb.sql.clause.TableElem;
import com.enterprise.qb.sql.clause.TextClause;
import com.enterprise.qb.sql.clause.WhereClause;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * ANSI SQL implementation of {@link Compiler}.
 *
 * <p>Statements render one clause per line. Value maps of INSERT/UPDATE render in
 * column-name order, so the output is stable across runs. Upsert has no ANSI form
 * and throws {@link UnsupportedClauseException}; dialects override
 * {@link #visitUpsert} and can reuse the protected helpers below.
 */
public class SqlCompiler implements Compiler {

    @Override
    public String visitAggregate(CompilerContext context, AggregateClause aggregate) {
        return aggregate.fn() + "(" + aggregate.clause().compile(context) + ")";
    }

    @Override
    public String visitAlias(CompilerContext context, AliasClause alias) {
        return alias.selectable().compile(context) + " AS " + context.dialect().escape(alias.name());
    }

    @Override
    public String visitBinary(CompilerContext context, BinaryExpressionClause binary) {
        return binary.left().compile(context) + " " + binary.op() + " " + binary.right().compile(context);
    }

    @Override
    public String visitBind(CompilerContext context, BindClause bind) {
        return context.bind(bind.value());
    }

    /**
     * Prefixes the table unless the column belongs to the statement's default table
     * and we are not inside a sub-query. Inside a sub-query every column is qualified.
     */
    @Override
    public String visitColumn(CompilerContext context, ColumnElem column) {
        String name = context.dialect().escape(column.name());
        if (context.inSubQuery() || !column.table().equals(context.defaultTableName())) {
            return context.dialect().escape(column.table()) + "." + name;
        }
        return name;
    }

    @Override
    public String visitCombiner(CompilerContext context, CombinerClause combiner) {
        List<String> sqls = new ArrayList<>(combiner.clauses().size());
        for (Clause clause : combiner.clauses()) {
            sqls.add(clause.compile(context));
        }
        return "(" + String.join(" " + combiner.operator().name() + " ", sqls) + ")";
    }

    @Override
    public String visitDelete(CompilerContext context, DeleteStmt delete) {
        return inTableScope(context, delete.table(), () -> {
            StringBuilder sql = new StringBuilder("DELETE FROM ").append(delete.table().compile(context));
            if (delete.where() != null) {
                sql.append("\n").append(delete.where().compile(context));
            }
            sql.append(renderReturning(context, delete.returning()));
            return sql.toString();
        });
    }

    @Override
    public String visitExists(CompilerContext context, ExistsClause exists) {
        boolean previous = context.inSubQuery();
        context.setInSubQuery(true);
        try {
            return (exists.not() ? "NOT " : "") + "EXISTS(" + exists.select().compile(context) + ")";
        } finally {
            context.setInSubQuery(previous);
        }
    }

    @Override
    public String visitHaving(CompilerContext context, HavingClause having) {
        String aggregate = having.aggregate().compile(context);
        return "HAVING " + aggregate + " " + having.op() + " " + context.bind(having.value());
    }

    @Override
    public String visitInsert(CompilerContext context, InsertStmt insert) {
        return inTableScope(context, insert.table(), () ->
                renderInsert(context, "INSERT INTO", insert.table(), insert.values())
                        + renderReturning(context, insert.returning()));
    }

    @Override
    public String visitJoin(CompilerContext context, JoinClause join) {
        String sql = join.left().compile(context)
                + "\n" + join.joinType().sql() + " " + join.right().compile(context);
        if (join.onClause() != null) {
            sql += " ON " + join.onClause().compile(context);
        }
        return sql;
    }

    @Override
    public String visitLabel(CompilerContext context, String label) {
        return context.dialect().escape(label);
    }

    @Override
    public String visitList(CompilerContext context, ListClause list) {
        List<String> sqls = new ArrayList<>(list.clauses().size());
        for (Clause clause : list.clauses()) {
            sqls.add(clause.compile(context));
        }
        return "(" + String.join(", ", sqls) + ")";
    }

    @Override
    public String visitOrderBy(CompilerContext context, OrderByClause orderBy) {
        return "ORDER BY " + renderColumns(context, orderBy.columns()) + " " + orderBy.direction().name();
    }

    /**
     * Renders SELECT, FROM, WHERE, GROUP BY, HAVING, ORDER BY and LIMIT/OFFSET lines
     * in that order, skipping unset parts. LIMIT/OFFSET needs both values.
     */
    @Override
    public String visitSelect(CompilerContext context, SelectStmt select) {
        String previousTable = context.defaultTableName();
        if (!context.inSubQuery() && select.from() != null) {
            context.setDefaultTableName(select.from().defaultName());
        }
        try {
            List<String> lines = new ArrayList<>();

            List<String> columns = new ArrayList<>(select.columns().size());
            for (Clause column : select.columns()) {
                columns.add(column.compile(context));
            }
            lines.add("SELECT " + (columns.isEmpty() ? "*" : String.join(", ", columns)));

            if (select.from() != null) {
                lines.add("FROM " + select.from().compile(context));
            }
            if (select.where() != null) {
                lines.add(select.where().compile(context));
            }
            if (!select.groupBy().isEmpty()) {
                lines.add("GROUP BY " + renderColumns(context, select.groupBy()));
            }
            for (HavingClause having : select.having()) {
                lines.add(having.compile(context));
            }
            if (select.orderBy() != null) {
                lines.add(select.orderBy().compile(context));
            }
            if (select.offset() != null && select.count() != null) {
                lines.add("LIMIT " + select.count() + " OFFSET " + select.offset());
            }
            return String.join("\n", lines);
        } finally {
            context.setDefaultTableName(previousTable);
        }
    }

    @Override
    public String visitTable(CompilerContext context, TableElem table) {
        return context.compiler().visitLabel(context, table.name());
    }

    @Override
    public String visitText(CompilerContext context, TextClause text) {
        return text.text();
    }

    @Override
    public String visitUpdate(CompilerContext context, UpdateStmt update) {
        if (update.values().isEmpty()) {
            throw new IllegalStateException("UPDATE " + update.table().name() + " has no values to set");
        }
        return inTableScope(context, update.table(), () -> {
            StringBuilder sql = new StringBuilder("UPDATE ").append(update.table().compile(context));
            List<String> sets = new ArrayList<>(update.values().size());
            for (Map.Entry<String, Object> entry : update.values().entrySet()) {
                sets.add(context.compiler().visitLabel(context, entry.getKey())
                        + " = " + renderValue(context, entry.getValue()));
            }
            sql.append("\nSET ").append(String.join(", ", sets));
            if (update.where() != null) {
                sql.append("\n").append(update.where().compile(context));
            }
            sql.append(renderReturning(context, update.returning()));
            return sql.toString();
        });
    }

    /** No ANSI upsert: always throws. */
    @Override
    public String visitUpsert(CompilerContext context, UpsertStmt upsert) {
        throw new UnsupportedClauseException("UPSERT", context.dialect().driver());
    }

    @Override
    public String visitWhere(CompilerContext context, WhereClause where) {
        return "WHERE " + where.clause().compile(context);
    }

    // ==================== Helpers for dialect compilers ====================

    /**
     * Runs {@code body} with {@code table} as the default table, restoring the
     * previous default table afterwards.
     */
    protected String inTableScope(CompilerContext context, TableElem table, Supplier<String> body) {
        String previous = context.defaultTableName();
        context.setDefaultTableName(table.name());
        try {
            return body.get();
        } finally {
            context.setDefaultTableName(previous);
        }
    }

    /** {@code <verb> table(c1, c2)\nVALUES(v1, v2)}, columns in map order. */
    protected String renderInsert(CompilerContext context, String verb, TableElem table,
                                  Map<String, Object> values) {
        if (values.isEmpty()) {
            throw new IllegalStateException(verb + " " + table.name() + " has no values");
        }
        List<String> columns = new ArrayList<>(values.size());
        List<String> placeholders = new ArrayList<>(values.size());
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            columns.add(context.compiler().visitLabel(context, entry.getKey()));
            placeholders.add(renderValue(context, entry.getValue()));
        }
        return verb + " " + table.compile(context)
                + "(" + String.join(", ", columns) + ")"
                + "\nVALUES(" + String.join(", ", placeholders) + ")";
    }

    /**
     * Clause values are compiled in place, anything else is bound. A sub-select
     * is wrapped in parentheses so it reads as a scalar value.
     */
    protected String renderValue(CompilerContext context, Object value) {
        if (value instanceof SelectStmt select) {
            return "(" + select.compile(context) + ")";
        }
        if (value instanceof Clause clause) {
            return clause.compile(context);
        }
        return context.bind(value);
    }

    /** {@code "\nRETURNING c1, c2"}, or empty when there is nothing to return. */
    protected String renderReturning(CompilerContext context, List<ColumnElem> returning) {
        if (returning.isEmpty()) {
            return "";
        }
        return "\nRETURNING " + renderColumns(context, returning);
    }

    protected String renderColumns(CompilerContext context, List<ColumnElem> columns) {
        List<String> sqls = new ArrayList<>(columns.size());
        for (ColumnElem column : columns) {
            sqls.add(column.compile(context));
        }
        return String.join(", ", sqls);
    }
}
