package com.enterprise.qb.sql.clause;

import com.enterprise.qb.sql.compiler.CompilerContext;

import java.util.Objects;

/**
 * Raw SQL passed through as is. Never put user input here; use {@link BindClause}.
 *
 * <p>The dialect's placeholder token is reserved in raw text outside quotes:
 * {@code ?} for JDBC-style dialects, {@code $N} for Postgres. Writing one makes
 * {@link com.enterprise.qb.sql.compiler.SqlResult#verify()} count a binding that
 * does not exist. A bare {@code ?} is fine under Postgres (e.g. the JSONB
 * {@code data ? 'key'} operator).
 */
public record TextClause(String text) implements Clause {

    public TextClause {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public String compile(CompilerContext context) {
        return context.compiler().visitText(context, this);
    }
}
