package com.enterprise.qb.sql.clause;

import com.enterprise.qb.sql.compiler.CompilerContext;
import com.enterprise.qb.sql.validation.ExpressionValidator;

import java.util.Objects;

/** {@code HAVING <aggregate> <op> <placeholder>}, the value is always bound. */
public record HavingClause(AggregateClause aggregate, String op, Object value) implements Clause {

    public HavingClause {
        Objects.requireNonNull(aggregate, "aggregate");
        ExpressionValidator.validateOperator(op);
    }

    @Override
    public String compile(CompilerContext context) {
        return context.compiler().visitHaving(context, this);
    }
}
