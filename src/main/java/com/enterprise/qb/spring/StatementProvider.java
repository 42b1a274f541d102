package com.enterprise.qb.spring;

import com.enterprise.qb.sql.clause.Clause;

import java.util.Map;

/**
 * Builds a statement from runtime parameters.
 *
 * <p>Each call MUST create a fresh statement. Builders are mutable and must not
 * be shared across calls.
 *
 * <pre>{@code
 * registry.register("activeUsers", params ->
 *     SelectStmt.select(USERS.c("id"), USERS.c("email"))
 *         .from(USERS)
 *         .where(USERS.c("status").eq(params.get("status"))));
 * }</pre>
 */
@FunctionalInterface
public interface StatementProvider {

    Clause buildStatement(Map<String, Object> params);
}
