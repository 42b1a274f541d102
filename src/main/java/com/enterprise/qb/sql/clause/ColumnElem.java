package com.enterprise.qb.sql.clause;

import com.enterprise.qb.sql.compiler.CompilerContext;

import java.util.Collection;
import java.util.Objects;

/**
 * Column reference identified by (table, name). Whether the table prefix is
 * rendered depends on the compilation scope, see
 * {@link com.enterprise.qb.sql.compiler.SqlCompiler#visitColumn}.
 *
 * <p>Comparison helpers bind plain values and embed {@link Clause} values as is:
 * <pre>{@code
 * users.c("email").eq("a@b.c")          // email = ?
 * users.c("id").eq(sessions.c("user"))  // id = sessions.user
 * }</pre>
 */
public record ColumnElem(String table, String name) implements Clause {

    public ColumnElem {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(name, "name");
    }

    @Override
    public String compile(CompilerContext context) {
        return context.compiler().visitColumn(context, this);
    }

    public AliasClause as(String alias) {
        return Clauses.alias(this, alias);
    }

    public BinaryExpressionClause eq(Object value)    { return Clauses.eq(this, value); }
    public BinaryExpressionClause notEq(Object value) { return Clauses.notEq(this, value); }
    public BinaryExpressionClause gt(Object value)    { return Clauses.gt(this, value); }
    public BinaryExpressionClause gte(Object value)   { return Clauses.gte(this, value); }
    public BinaryExpressionClause lt(Object value)    { return Clauses.lt(this, value); }
    public BinaryExpressionClause lte(Object value)   { return Clauses.lte(this, value); }
    public BinaryExpressionClause like(Object value)  { return Clauses.like(this, value); }
    public BinaryExpressionClause notLike(Object value) { return Clauses.notLike(this, value); }

    public BinaryExpressionClause in(Object... values)         { return Clauses.in(this, values); }
    public BinaryExpressionClause in(Collection<?> values)     { return Clauses.in(this, values.toArray()); }
    public BinaryExpressionClause notIn(Object... values)      { return Clauses.notIn(this, values); }
    public BinaryExpressionClause notIn(Collection<?> values)  { return Clauses.notIn(this, values.toArray()); }

    public BinaryExpressionClause isNull()    { return Clauses.isNull(this); }
    public BinaryExpressionClause isNotNull() { return Clauses.isNotNull(this); }
}
