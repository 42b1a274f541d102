package com.enterprise.qb.sql.clause;

import com.enterprise.qb.sql.compiler.CompilerContext;

import java.util.List;
import java.util.Objects;

/**
 * AND/OR group: {@code (c1 AND c2 AND ...)}. One pair of parentheses around
 * the whole group, none around the children.
 * Created via {@link Clauses#and}/{@link Clauses#or}.
 */
public record CombinerClause(Operator operator, List<Clause> clauses) implements Clause {

    public enum Operator { AND, OR }

    public CombinerClause {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(clauses, "clauses");
        if (clauses.isEmpty()) {
            throw new IllegalArgumentException(operator + " requires at least one clause");
        }
        for (Clause clause : clauses) {
            Objects.requireNonNull(clause, operator + " clause");
        }
        clauses = List.copyOf(clauses);
    }

    @Override
    public String compile(CompilerContext context) {
        return context.compiler().visitCombiner(context, this);
    }
}
