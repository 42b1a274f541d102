package com.enterprise.qb.sql.clause;

/**
 * A clause usable as the source of a FROM: a table or a chain of joins.
 */
public interface Selectable extends Clause {

    /** Name of the table whose columns render unqualified in the enclosing statement. */
    String defaultName();
}
