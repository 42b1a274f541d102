package com.enterprise.qb.sql.core;

/** How a dialect writes bind placeholders into SQL text. */
public enum PlaceholderStyle {
    /** JDBC style {@code ?}. */
    QUESTION_MARK,
    /** Numbered {@code $1, $2, ...}. A bare {@code ?} is then an operator, not a placeholder. */
    NUMBERED
}
