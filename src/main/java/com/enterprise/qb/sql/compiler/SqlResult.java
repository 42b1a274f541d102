package com.enterprise.qb.sql.compiler;

import com.enterprise.qb.sql.core.PlaceholderStyle;
import com.enterprise.qb.sql.param.SqlLiteralFormatter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rendered SQL plus its bindings. Binding {@code i} belongs to the {@code i}-th
 * placeholder in {@link #sql()}. Bindings may contain {@code null} (SQL NULL).
 *
 * <p>Only tokens of the {@link PlaceholderStyle} the SQL was rendered with count
 * as placeholders. Anything inside {@code '...'} literals, {@code "..."} or
 * backtick identifiers is skipped.
 */
public final class SqlResult {

    // quoted literal/identifier, ? or $N
    private static final Pattern TOKEN = Pattern.compile(
            "'(?:[^']|'')*'|\"(?:[^\"]|\"\")*\"|`(?:[^`]|``)*`|\\?|\\$\\d+");

    private final String sql;
    private final List<Object> bindings;
    private final PlaceholderStyle style;

    /** Result with {@code ?} placeholders. */
    public SqlResult(String sql, List<Object> bindings) {
        this(sql, bindings, PlaceholderStyle.QUESTION_MARK);
    }

    public SqlResult(String sql, List<Object> bindings, PlaceholderStyle style) {
        this.sql = Objects.requireNonNull(sql, "sql");
        this.bindings = Collections.unmodifiableList(new ArrayList<>(bindings));
        this.style = Objects.requireNonNull(style, "style");
    }

    public String sql() { return sql; }

    public List<Object> bindings() { return bindings; }

    public PlaceholderStyle style() { return style; }

    /**
     * Rewrites {@code $N} placeholders into JDBC {@code ?}, keeping binding order.
     * With numbered placeholders a bare {@code ?} in the SQL is an operator and is
     * escaped as {@code ??}, the form the Postgres JDBC driver expects.
     */
    public PositionalQuery toPositional() {
        Matcher m = TOKEN.matcher(sql);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String token = m.group();
            String replacement = token;
            if (style == PlaceholderStyle.NUMBERED) {
                if (token.startsWith("$")) {
                    replacement = "?";
                } else if (token.equals("?")) {
                    replacement = "??";
                }
            }
            m.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(out);
        return new PositionalQuery(out.toString(), bindings.toArray());
    }

    /** Returns the SQL with all bindings inlined as literals. For logs only, never execute it. */
    public String toDebugString() {
        Matcher m = TOKEN.matcher(sql);
        StringBuilder out = new StringBuilder();
        int index = 0;
        while (m.find()) {
            String token = m.group();
            String replacement = token;
            if (isPlaceholder(token)) {
                int position = style == PlaceholderStyle.NUMBERED
                        ? Integer.parseInt(token.substring(1)) - 1
                        : index++;
                if (position >= 0 && position < bindings.size()) {
                    replacement = SqlLiteralFormatter.formatForDebug(bindings.get(position));
                }
            }
            m.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(out);
        return out.toString();
    }

    /**
     * Verifies the number of placeholders matches the number of bindings.
     *
     * @throws IllegalStateException on mismatch
     */
    public void verify() {
        Matcher m = TOKEN.matcher(sql);
        int placeholders = 0;
        while (m.find()) {
            if (isPlaceholder(m.group())) {
                placeholders++;
            }
        }
        if (placeholders != bindings.size()) {
            throw new IllegalStateException("SQL has " + placeholders
                    + " placeholders but " + bindings.size() + " bindings");
        }
    }

    private boolean isPlaceholder(String token) {
        return style == PlaceholderStyle.NUMBERED ? token.startsWith("$") : token.equals("?");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SqlResult other)) return false;
        return sql.equals(other.sql) && bindings.equals(other.bindings) && style == other.style;
    }

    @Override
    public int hashCode() {
        return Objects.hash(sql, bindings, style);
    }

    @Override
    public String toString() {
        return sql + " " + bindings;
    }

    public record PositionalQuery(String sql, Object[] values) {}
}
