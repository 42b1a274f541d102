package com.enterprise.qb.sql.core;

public enum JoinType {
    INNER("INNER JOIN"),
    LEFT("LEFT OUTER JOIN"),
    RIGHT("RIGHT OUTER JOIN"),
    CROSS("CROSS JOIN");

    private final String sql;

    JoinType(String sql) { this.sql = sql; }

    public String sql() { return sql; }
}
