package com.enterprise.qb.sql.clause;

import com.enterprise.qb.sql.compiler.CompilerContext;

/**
 * A value rendered as a dialect placeholder and appended to the bindings.
 * A {@code null} value is bound as SQL NULL.
 */
public record BindClause(Object value) implements Clause {

    @Override
    public String compile(CompilerContext context) {
        return context.compiler().visitBind(context, this);
    }
}
