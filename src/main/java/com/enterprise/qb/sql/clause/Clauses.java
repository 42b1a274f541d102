package com.enterprise.qb.sql.clause;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Static factory for {@link Clause} trees. Designed to be imported statically.
 *
 * <p>Right-hand values of comparisons are bound as parameters unless they are
 * already a {@link Clause}, in which case they are embedded as is.
 *
 * <pre>{@code
 * import static com.enterprise.qb.sql.clause.Clauses.*;
 *
 * Clause c1 = eq(users.c("status"), "ACTIVE");           // status = ?
 * Clause c2 = or(
 *     gte(users.c("age"), 18),
 *     and(isNull(users.c("deleted_at")), text("TRUE"))
 * );
 * WhereClause w = where(c1).and(c2);
 * }</pre>
 */
public final class Clauses {

    private Clauses() {}

    // ==================== Leaves ====================

    public static TextClause text(String sql) {
        return new TextClause(sql);
    }

    public static BindClause bind(Object value) {
        return new BindClause(value);
    }

    /** Wraps a plain value into a {@link BindClause}; returns clauses unchanged. */
    public static Clause toClause(Object value) {
        if (value instanceof Clause clause) {
            return clause;
        }
        return new BindClause(value);
    }

    // ==================== Combiners ====================

    /**
     * @throws IllegalArgumentException if no clause is given
     */
    public static CombinerClause and(Clause... clauses) {
        return new CombinerClause(CombinerClause.Operator.AND, Arrays.asList(clauses));
    }

    /**
     * @throws IllegalArgumentException if no clause is given
     */
    public static CombinerClause or(Clause... clauses) {
        return new CombinerClause(CombinerClause.Operator.OR, Arrays.asList(clauses));
    }

    public static WhereClause where(Clause clause) {
        return new WhereClause(clause);
    }

    public static ListClause list(Clause... clauses) {
        return new ListClause(Arrays.asList(clauses));
    }

    public static AliasClause alias(Clause selectable, String name) {
        return new AliasClause(selectable, name);
    }

    // ==================== Sub-queries ====================

    public static ExistsClause exists(Clause select) {
        return new ExistsClause(select, false);
    }

    public static ExistsClause notExists(Clause select) {
        return new ExistsClause(select, true);
    }

    // ==================== Aggregates ====================

    public static AggregateClause aggregate(String fn, Clause clause) {
        return new AggregateClause(fn, clause);
    }

    public static AggregateClause count(Clause clause) { return aggregate("COUNT", clause); }
    public static AggregateClause sum(Clause clause)   { return aggregate("SUM", clause); }
    public static AggregateClause avg(Clause clause)   { return aggregate("AVG", clause); }
    public static AggregateClause min(Clause clause)   { return aggregate("MIN", clause); }
    public static AggregateClause max(Clause clause)   { return aggregate("MAX", clause); }

    // ==================== Binary expressions ====================

    /**
     * {@code left op right}. {@code op} must be a known operator: comparisons,
     * arithmetic and bitwise symbols, {@code ||}, Postgres regex ({@code ~}, {@code ~*},
     * {@code !~}, {@code !~*}), JSON/JSONB ({@code ->}, {@code ->>}, {@code #>},
     * {@code #>>}, {@code #-}, {@code @>}, {@code <@}, {@code ?}, {@code ?|}, {@code ?&}),
     * {@code &&}, {@code @@}, {@code <->}, and the keyword forms {@code [NOT] LIKE},
     * {@code [NOT] ILIKE}, {@code [NOT] IN}, {@code [NOT] SIMILAR TO}, {@code IS [NOT]},
     * {@code IS [NOT] DISTINCT FROM}.
     *
     * @throws IllegalArgumentException for any other operator
     */
    public static BinaryExpressionClause binary(Clause left, String op, Clause right) {
        return new BinaryExpressionClause(left, op, right);
    }

    public static BinaryExpressionClause eq(Clause left, Object right) {
        return binary(left, "=", toClause(right));
    }

    public static BinaryExpressionClause notEq(Clause left, Object right) {
        return binary(left, "!=", toClause(right));
    }

    public static BinaryExpressionClause gt(Clause left, Object right) {
        return binary(left, ">", toClause(right));
    }

    public static BinaryExpressionClause gte(Clause left, Object right) {
        return binary(left, ">=", toClause(right));
    }

    public static BinaryExpressionClause lt(Clause left, Object right) {
        return binary(left, "<", toClause(right));
    }

    public static BinaryExpressionClause lte(Clause left, Object right) {
        return binary(left, "<=", toClause(right));
    }

    public static BinaryExpressionClause like(Clause left, Object pattern) {
        Objects.requireNonNull(pattern, "LIKE pattern");
        return binary(left, "LIKE", toClause(pattern));
    }

    public static BinaryExpressionClause notLike(Clause left, Object pattern) {
        Objects.requireNonNull(pattern, "NOT LIKE pattern");
        return binary(left, "NOT LIKE", toClause(pattern));
    }

    /**
     * {@code left IN (?, ?, ...)}.
     *
     * @throws IllegalArgumentException if no value is given
     */
    public static BinaryExpressionClause in(Clause left, Object... values) {
        return binary(left, "IN", valueList("IN", values));
    }

    /**
     * {@code left NOT IN (?, ?, ...)}.
     *
     * @throws IllegalArgumentException if no value is given
     */
    public static BinaryExpressionClause notIn(Clause left, Object... values) {
        return binary(left, "NOT IN", valueList("NOT IN", values));
    }

    public static BinaryExpressionClause isNull(Clause left) {
        return binary(left, "IS", text("NULL"));
    }

    public static BinaryExpressionClause isNotNull(Clause left) {
        return binary(left, "IS NOT", text("NULL"));
    }

    private static ListClause valueList(String op, Object[] values) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException(op + " list cannot be empty");
        }
        List<Clause> clauses = new ArrayList<>(values.length);
        for (Object value : values) {
            clauses.add(toClause(value));
        }
        return new ListClause(clauses);
    }
}
