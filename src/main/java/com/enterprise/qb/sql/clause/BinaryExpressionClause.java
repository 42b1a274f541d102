package com.enterprise.qb.sql.clause;

import com.enterprise.qb.sql.compiler.CompilerContext;
import com.enterprise.qb.sql.validation.ExpressionValidator;

import java.util.Objects;

/** {@code <left> <op> <right>}. */
public record BinaryExpressionClause(Clause left, String op, Clause right) implements Clause {

    public BinaryExpressionClause {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        ExpressionValidator.validateOperator(op);
    }

    @Override
    public String compile(CompilerContext context) {
        return context.compiler().visitBinary(context, this);
    }
}
