package com.enterprise.qb.sql.validation;

import java.util.regex.Pattern;

/**
 * SQL injection guard for the raw strings a clause tree carries besides
 * {@code TextClause}: alias names, aggregate function names and binary operators.
 * Values never need this, they are always bound.
 */
public final class ExpressionValidator {

    private ExpressionValidator() {}

    // Letters/underscore start, then alphanumeric/underscore/dot (for qualified refs)
    private static final Pattern IDENTIFIER_PATTERN =
            Pattern.compile("[a-zA-Z_][a-zA-Z0-9_.]*");

    // DML/DDL keywords that should never appear in identifiers
    private static final Pattern DANGEROUS_KEYWORDS = Pattern.compile(
            "(?i)\\b(DROP|DELETE|INSERT|UPDATE|ALTER|CREATE|TRUNCATE|EXEC|EXECUTE|GRANT|REVOKE)\\b");

    // comparison, arithmetic, bitwise, string concat, Postgres regex/JSON/JSONB/array/text-search
    private static final Pattern SYMBOL_OPERATOR = Pattern.compile(
            "=|!=|<>|<=|>=|<|>|\\+|-|\\*|/|%|\\^|&|\\||\\|\\||<<|>>"
                    + "|~|~\\*|!~|!~\\*"
                    + "|->|->>|#>|#>>|#-|@>|<@|\\?|\\?\\||\\?&|&&|@@|<->");

    private static final Pattern KEYWORD_OPERATOR = Pattern.compile(
            "(?i)(NOT\\s+)?(LIKE|ILIKE|IN|SIMILAR\\s+TO)|IS(\\s+NOT)?|IS\\s+(NOT\\s+)?DISTINCT\\s+FROM");

    /** Validates a simple identifier (alias, function name). */
    public static void validateIdentifier(String identifier) {
        if (identifier == null || !IDENTIFIER_PATTERN.matcher(identifier).matches()) {
            throw new IllegalArgumentException("Invalid identifier: " + identifier);
        }
        if (DANGEROUS_KEYWORDS.matcher(identifier).find()) {
            throw new IllegalArgumentException(
                    "Dangerous keyword in identifier: " + identifier);
        }
    }

    /**
     * Validates a binary operator such as {@code =}, {@code >=}, {@code NOT LIKE},
     * {@code IS NOT}, {@code ~*}, {@code ->>} or {@code SIMILAR TO}.
     */
    public static void validateOperator(String op) {
        if (op == null || op.isBlank()) {
            throw new IllegalArgumentException("Operator cannot be null or blank");
        }
        String trimmed = op.trim();
        if (!SYMBOL_OPERATOR.matcher(trimmed).matches()
                && !KEYWORD_OPERATOR.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("Unsupported operator: " + op);
        }
    }
}
