package com.enterprise.qb.sql.clause;

import com.enterprise.qb.sql.compiler.CompilerContext;
import com.enterprise.qb.sql.validation.ExpressionValidator;

import java.util.Objects;

/** {@code FN(<clause>)}, e.g. {@code COUNT(id)}. */
public record AggregateClause(String fn, Clause clause) implements Clause {

    public AggregateClause {
        ExpressionValidator.validateIdentifier(fn);
        Objects.requireNonNull(clause, "clause");
    }

    @Override
    public String compile(CompilerContext context) {
        return context.compiler().visitAggregate(context, this);
    }
}
