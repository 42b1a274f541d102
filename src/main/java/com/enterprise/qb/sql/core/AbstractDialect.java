package com.enterprise.qb.sql.core;

import com.enterprise.qb.sql.compiler.Compiler;
import com.enterprise.qb.sql.compiler.SqlCompiler;

import java.util.Objects;

/**
 * Common dialect base: quote-character escaping and {@code ?} placeholders.
 *
 * <p>Subclasses override {@link #placeholder()} / {@link #reset()} for counter-based
 * placeholders and {@link #compiler()} to replace individual rendering rules.
 */
public abstract class AbstractDialect implements Dialect {

    private static final Compiler ANSI = new SqlCompiler();

    private final String quote;
    private boolean escaping;

    protected AbstractDialect(String quote) {
        this.quote = Objects.requireNonNull(quote, "quote");
    }

    @Override
    public String escape(String identifier) {
        if (!escaping || identifier == null || identifier.isEmpty()) {
            return identifier;
        }
        return quote + identifier.replace(quote, quote + quote) + quote;
    }

    @Override
    public void setEscaping(boolean escaping) {
        this.escaping = escaping;
    }

    @Override
    public boolean isEscaping() {
        return escaping;
    }

    @Override
    public String placeholder() {
        return "?";
    }

    @Override
    public void reset() {
        // stateless placeholders
    }

    @Override
    public Compiler compiler() {
        return ANSI;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + driver() + "]";
    }
}
