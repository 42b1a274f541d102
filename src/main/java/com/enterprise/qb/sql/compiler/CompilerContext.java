package com.enterprise.qb.sql.compiler;

import com.enterprise.qb.sql.core.Dialect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Mutable state threaded through one compilation.
 *
 * <p>Bindings are only ever appended, in the order placeholders are emitted, so
 * binding {@code i} always belongs to the {@code i}-th placeholder of the
 * rendered SQL. {@code inSubQuery} and {@code defaultTableName} are scoped:
 * a visitor that changes them restores the previous value before returning.
 *
 * <p>Single use: create one per compilation, never share between threads.
 */
public class CompilerContext {

    private final Dialect dialect;
    private final Compiler compiler;
    private final List<Object> binds = new ArrayList<>();
    private final Map<String, Object> vars = new HashMap<>();
    private String defaultTableName = "";
    private boolean inSubQuery;

    public CompilerContext(Dialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        this.compiler = Objects.requireNonNull(dialect.compiler(),
                "dialect " + dialect.driver() + " returned no compiler");
    }

    public Dialect dialect() {
        return dialect;
    }

    public Compiler compiler() {
        return compiler;
    }

    /**
     * Appends a value to the bindings and returns the dialect placeholder for it.
     * The only way compiler rules emit placeholders, which keeps the two aligned.
     */
    public String bind(Object value) {
        binds.add(value);
        return dialect.placeholder();
    }

    /** Bindings collected so far, in placeholder order. May contain nulls. */
    public List<Object> binds() {
        return Collections.unmodifiableList(binds);
    }

    public String defaultTableName() {
        return defaultTableName;
    }

    public void setDefaultTableName(String defaultTableName) {
        this.defaultTableName = defaultTableName == null ? "" : defaultTableName;
    }

    public boolean inSubQuery() {
        return inSubQuery;
    }

    public void setInSubQuery(boolean inSubQuery) {
        this.inSubQuery = inSubQuery;
    }

    /** Free-form storage for dialect-specific compiler rules. */
    public Map<String, Object> vars() {
        return vars;
    }
}
