package com.enterprise.qb.sql.builder;

import com.enterprise.qb.sql.clause.AggregateClause;
import com.enterprise.qb.sql.clause.Clause;
import com.enterprise.qb.sql.clause.ColumnElem;
import com.enterprise.qb.sql.clause.HavingClause;
import com.enterprise.qb.sql.clause.JoinClause;
import com.enterprise.qb.sql.clause.OrderByClause;
import com.enterprise.qb.sql.clause.Selectable;
import com.enterprise.qb.sql.clause.TableElem;
import com.enterprise.qb.sql.clause.WhereClause;
import com.enterprise.qb.sql.compiler.CompilerContext;
import com.enterprise.qb.sql.core.JoinType;
import com.enterprise.qb.sql.core.SortDirection;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Fluent SELECT statement. Itself a {@link Clause}, so it can be nested
 * (e.g. inside {@link com.enterprise.qb.sql.clause.Clauses#exists}).
 *
 * <p>Example:
 * <pre>{@code
 * import static com.enterprise.qb.sql.clause.Clauses.*;
 *
 * SqlResult r = SelectStmt.select(users.c("id"), count(sessions.c("id")))
 *     .from(users)
 *     .leftJoin(sessions, users.c("id").eq(sessions.c("user_id")))
 *     .where(users.c("status").eq("ACTIVE"))
 *     .groupBy(users.c("id"))
 *     .having(count(sessions.c("id")), ">", 2)
 *     .orderBy(users.c("id")).desc()
 *     .limit(0, 50)
 *     .build(Dialects.create("postgres"));
 * }</pre>
 *
 * <p>Instances are mutable while being configured. Do not change a statement
 * while another thread compiles it.
 */
public class SelectStmt implements Clause {

    private final List<Clause> columns = new ArrayList<>();
    private Selectable from;
    private WhereClause where;
    private final List<ColumnElem> groupBy = new ArrayList<>();
    private final List<HavingClause> having = new ArrayList<>();
    private OrderByClause orderBy;
    private Integer offset;
    private Integer count;

    private SelectStmt() {}

    // ==================== Factory ====================

    public static SelectStmt select(Clause... columns) {
        return new SelectStmt().columns(columns);
    }

    /** Replaces the selected columns. No column renders as {@code SELECT *}. */
    public SelectStmt columns(Clause... cols) {
        for (Clause c : cols) {
            Objects.requireNonNull(c, "select column");
        }
        this.columns.clear();
        this.columns.addAll(Arrays.asList(cols));
        return this;
    }

    // ==================== FROM / JOIN ====================

    public SelectStmt from(Selectable source) {
        this.from = Objects.requireNonNull(source, "from");
        return this;
    }

    /**
     * Appends a join to the current FROM source. The left side is the FROM
     * table for the first join and the previous join afterwards.
     *
     * @throws IllegalStateException if {@link #from} was not called first
     */
    public SelectStmt join(JoinType type, TableElem table, Clause on) {
        if (from == null) {
            throw new IllegalStateException("from() must be called before joining " + table.name());
        }
        this.from = new JoinClause(type, from, table, on);
        return this;
    }

    public SelectStmt innerJoin(TableElem table, Clause on) {
        return join(JoinType.INNER, table, on);
    }

    public SelectStmt leftJoin(TableElem table, Clause on) {
        return join(JoinType.LEFT, table, on);
    }

    public SelectStmt rightJoin(TableElem table, Clause on) {
        return join(JoinType.RIGHT, table, on);
    }

    public SelectStmt crossJoin(TableElem table) {
        return join(JoinType.CROSS, table, null);
    }

    // ==================== WHERE ====================

    public SelectStmt where(Clause clause) {
        this.where = new WhereClause(clause);
        return this;
    }

    /** Folds the current WHERE clause and {@code clauses} into one AND group. */
    public SelectStmt and(Clause... clauses) {
        this.where = requireWhere().and(clauses);
        return this;
    }

    /** Folds the current WHERE clause and {@code clauses} into one OR group. */
    public SelectStmt or(Clause... clauses) {
        this.where = requireWhere().or(clauses);
        return this;
    }

    private WhereClause requireWhere() {
        if (where == null) {
            throw new IllegalStateException("where() must be called before and()/or()");
        }
        return where;
    }

    // ==================== GROUP BY / HAVING ====================

    public SelectStmt groupBy(ColumnElem... cols) {
        for (ColumnElem c : cols) {
            groupBy.add(Objects.requireNonNull(c, "group by column"));
        }
        return this;
    }

    public SelectStmt having(AggregateClause aggregate, String op, Object value) {
        having.add(new HavingClause(aggregate, op, value));
        return this;
    }

    // ==================== ORDER BY ====================

    /** Orders by the given columns, ascending until {@link #desc()} is called. */
    public SelectStmt orderBy(ColumnElem... cols) {
        this.orderBy = new OrderByClause(Arrays.asList(cols), SortDirection.ASC);
        return this;
    }

    public SelectStmt asc() {
        this.orderBy = requireOrderBy().withDirection(SortDirection.ASC);
        return this;
    }

    public SelectStmt desc() {
        this.orderBy = requireOrderBy().withDirection(SortDirection.DESC);
        return this;
    }

    private OrderByClause requireOrderBy() {
        if (orderBy == null) {
            throw new IllegalStateException("orderBy() must be called before asc()/desc()");
        }
        return orderBy;
    }

    // ==================== LIMIT / OFFSET ====================

    /** Sets both offset and row count: {@code LIMIT count OFFSET offset}. */
    public SelectStmt limit(int offset, int count) {
        return offset(offset).count(count);
    }

    /** Offset only. No LIMIT line is rendered until {@link #count(int)} is set too. */
    public SelectStmt offset(int offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0: " + offset);
        }
        this.offset = offset;
        return this;
    }

    /** Row count only. No LIMIT line is rendered until {@link #offset(int)} is set too. */
    public SelectStmt count(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0: " + count);
        }
        this.count = count;
        return this;
    }

    // ==================== Accessors ====================

    public List<Clause> columns() { return Collections.unmodifiableList(columns); }
    public Selectable from() { return from; }
    public WhereClause where() { return where; }
    public List<ColumnElem> groupBy() { return Collections.unmodifiableList(groupBy); }
    public List<HavingClause> having() { return Collections.unmodifiableList(having); }
    public OrderByClause orderBy() { return orderBy; }
    public Integer offset() { return offset; }
    public Integer count() { return count; }

    @Override
    public String compile(CompilerContext context) {
        return context.compiler().visitSelect(context, this);
    }
}
