package com.enterprise.qb.sql.debug;

import com.enterprise.qb.sql.compiler.SqlResult;

import java.util.List;

/**
 * Debug utility: formats an {@link SqlResult} showing the dialect SQL,
 * the JDBC positional SQL, the values-inlined SQL and the bindings with types.
 */
public final class QueryDebugger {

    private QueryDebugger() {}

    public static String format(SqlResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("=== SQL Query Debug ===\n");

        sb.append("SQL (dialect):\n  ").append(indent(result.sql())).append("\n");

        SqlResult.PositionalQuery pq = result.toPositional();
        sb.append("SQL (positional):\n  ").append(indent(pq.sql())).append("\n");

        sb.append("SQL (values inlined):\n  ").append(indent(result.toDebugString())).append("\n");

        List<Object> bindings = result.bindings();
        sb.append("Bindings (").append(bindings.size()).append("):\n");
        for (int i = 0; i < bindings.size(); i++) {
            Object val = bindings.get(i);
            String typeName = val != null ? val.getClass().getSimpleName() : "null";
            sb.append("  ").append(i + 1).append(" = ").append(val)
                    .append(" (").append(typeName).append(")\n");
        }
        sb.append("======================");
        return sb.toString();
    }

    private static String indent(String sql) {
        return sql.replace("\n", "\n  ");
    }
}
