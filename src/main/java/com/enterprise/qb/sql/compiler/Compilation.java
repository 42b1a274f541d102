package com.enterprise.qb.sql.compiler;

import com.enterprise.qb.sql.clause.Clause;
import com.enterprise.qb.sql.core.Dialect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point turning a {@link Clause} tree into SQL and bindings.
 *
 * <pre>{@code
 * SqlResult r = Compilation.compile(
 *         SelectStmt.select(users.c("id")).from(users).where(users.c("email").eq(email)),
 *         Dialects.create("postgres"));
 * // r.sql()      -> "SELECT id\nFROM users\nWHERE email = $1"
 * // r.bindings() -> [email]
 * }</pre>
 */
public final class Compilation {

    private static final Logger log = LoggerFactory.getLogger(Compilation.class);

    private Compilation() {}

    /**
     * Compiles {@code root} with a fresh {@link CompilerContext}. The dialect is
     * reset before returning, also when compilation fails, so it can be reused.
     *
     * @throws UnsupportedClauseException if the dialect cannot render a clause of the tree
     */
    public static SqlResult compile(Clause root, Dialect dialect) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(dialect, "dialect");
        try {
            CompilerContext context = new CompilerContext(dialect);
            String sql = root.compile(context);
            SqlResult result = new SqlResult(sql, context.binds(), dialect.placeholderStyle());
            if (log.isDebugEnabled()) {
                log.debug("[{}] compiled {} with {} binding(s):\n{}", dialect.driver(),
                        root.getClass().getSimpleName(), result.bindings().size(), sql);
            }
            return result;
        } catch (UnsupportedClauseException e) {
            log.debug("[{}] compilation aborted: {}", dialect.driver(), e.getMessage());
            throw e;
        } finally {
            dialect.reset();
        }
    }
}
