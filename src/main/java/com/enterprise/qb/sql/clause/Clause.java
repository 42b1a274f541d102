package com.enterprise.qb.sql.clause;

import com.enterprise.qb.sql.compiler.Compilation;
import com.enterprise.qb.sql.compiler.CompilerContext;
import com.enterprise.qb.sql.compiler.SqlResult;
import com.enterprise.qb.sql.core.Dialect;

/**
 * A node of the SQL abstract syntax tree.
 *
 * <p>Each variant dispatches to the matching {@code visit*} rule of
 * {@link CompilerContext#compiler()} and returns a complete SQL fragment without
 * a statement terminator. Nodes are never mutated while being compiled; the only
 * side effect of {@link #compile} is on the context (bindings, sub-query flag,
 * default table).
 */
public interface Clause {

    String compile(CompilerContext context);

    /** Shortcut for {@link Compilation#compile(Clause, Dialect)}. */
    default SqlResult build(Dialect dialect) {
        return Compilation.compile(this, dialect);
    }
}
