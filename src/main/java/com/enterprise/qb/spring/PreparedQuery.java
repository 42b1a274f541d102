package com.enterprise.qb.spring;

import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;
import org.springframework.jdbc.core.PreparedStatementSetter;

import java.util.Arrays;
import java.util.List;

/**
 * JDBC-ready form of a compiled statement: {@code ?} placeholders plus the
 * bindings in placeholder order.
 */
public record PreparedQuery(String sql, Object[] values) {

    public PreparedQuery {
        values = values.clone();
    }

    /** Spring setter binding {@link #values()} positionally. */
    public PreparedStatementSetter statementSetter() {
        return new ArgumentPreparedStatementSetter(values.clone());
    }

    public List<Object> valueList() {
        return Arrays.asList(values.clone());
    }
}
