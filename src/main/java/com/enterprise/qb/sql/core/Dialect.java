package com.enterprise.qb.sql.core;

import com.enterprise.qb.sql.compiler.Compiler;

import java.util.ArrayList;
import java.util.List;

/**
 * Database-specific rendering rules consumed by the {@link Compiler}.
 *
 * <p>A dialect may keep placeholder counter state (e.g. Postgres {@code $1, $2, ...}),
 * so an instance must never serve two compilations at the same time. Use one
 * instance per thread, or obtain a fresh one from {@link Dialects#create(String)}.
 * {@link #reset()} is invoked by the compilation entry point after every compile.
 */
public interface Dialect {

    /** Driver name this dialect targets, e.g. {@code "postgres"}. */
    String driver();

    /** Escapes an identifier when escaping is enabled, returns it unchanged otherwise. */
    String escape(String identifier);

    default List<String> escapeAll(List<String> identifiers) {
        List<String> escaped = new ArrayList<>(identifiers.size());
        for (String identifier : identifiers) {
            escaped.add(escape(identifier));
        }
        return escaped;
    }

    void setEscaping(boolean escaping);

    boolean isEscaping();

    /** Placeholder syntax produced by {@link #placeholder()}. */
    default PlaceholderStyle placeholderStyle() {
        return PlaceholderStyle.QUESTION_MARK;
    }

    /** Next placeholder token. May advance an internal counter. */
    String placeholder();

    default List<String> placeholders(int count) {
        List<String> tokens = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            tokens.add(placeholder());
        }
        return tokens;
    }

    /** Clears placeholder state so the instance can serve the next compilation. */
    void reset();

    /** Rendering rule set for this dialect. */
    Compiler compiler();
}
