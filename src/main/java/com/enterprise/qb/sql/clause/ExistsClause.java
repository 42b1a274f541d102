package com.enterprise.qb.sql.clause;

import com.enterprise.qb.sql.compiler.CompilerContext;

import java.util.Objects;

/** {@code [NOT ]EXISTS(<select>)}. The select is compiled in sub-query scope. */
public record ExistsClause(Clause select, boolean not) implements Clause {

    public ExistsClause {
        Objects.requireNonNull(select, "select");
    }

    @Override
    public String compile(CompilerContext context) {
        return context.compiler().visitExists(context, this);
    }
}
