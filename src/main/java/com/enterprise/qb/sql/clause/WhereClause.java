package com.enterprise.qb.sql.clause;

import com.enterprise.qb.sql.compiler.CompilerContext;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * {@code WHERE <clause>}.
 *
 * <p>{@link #and}/{@link #or} fold the current clause and the new ones into a
 * single combiner. Chained calls nest rather than flatten:
 * {@code where(x).and(a).or(b)} renders {@code WHERE ((x AND a) OR b)}.
 */
public record WhereClause(Clause clause) implements Clause {

    public WhereClause {
        Objects.requireNonNull(clause, "clause");
    }

    public WhereClause and(Clause... clauses) {
        return new WhereClause(new CombinerClause(CombinerClause.Operator.AND, prepend(clauses)));
    }

    public WhereClause or(Clause... clauses) {
        return new WhereClause(new CombinerClause(CombinerClause.Operator.OR, prepend(clauses)));
    }

    private List<Clause> prepend(Clause[] clauses) {
        List<Clause> combined = new ArrayList<>(clauses.length + 1);
        combined.add(clause);
        combined.addAll(Arrays.asList(clauses));
        return combined;
    }

    @Override
    public String compile(CompilerContext context) {
        return context.compiler().visitWhere(context, this);
    }
}
