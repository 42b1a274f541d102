package com.enterprise.qb.sql.clause;

import com.enterprise.qb.sql.compiler.CompilerContext;

import java.util.List;
import java.util.Objects;

/** Parenthesized comma list, e.g. the right side of {@code IN}. */
public record ListClause(List<Clause> clauses) implements Clause {

    public ListClause {
        Objects.requireNonNull(clauses, "clauses");
        clauses = List.copyOf(clauses);
    }

    @Override
    public String compile(CompilerContext context) {
        return context.compiler().visitList(context, this);
    }
}
