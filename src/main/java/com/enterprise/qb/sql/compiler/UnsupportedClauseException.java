package com.enterprise.qb.sql.compiler;

/**
 * Thrown when the active compiler has no rendering rule for a clause kind,
 * e.g. an upsert on the ANSI compiler. Not recoverable by retrying with the
 * same dialect.
 */
public class UnsupportedClauseException extends UnsupportedOperationException {

    private final String clauseKind;
    private final String driver;

    public UnsupportedClauseException(String clauseKind, String driver) {
        super(clauseKind + " is not supported by the " + driver
                + " dialect; use a dialect that overrides this rule");
        this.clauseKind = clauseKind;
        this.driver = driver;
    }

    public String clauseKind() {
        return clauseKind;
    }

    public String driver() {
        return driver;
    }
}
