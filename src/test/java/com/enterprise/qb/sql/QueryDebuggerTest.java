package com.enterprise.qb.sql;

import com.enterprise.qb.sql.builder.SelectStmt;
import com.enterprise.qb.sql.compiler.SqlResult;
import com.enterprise.qb.sql.core.PostgresDialect;
import com.enterprise.qb.sql.debug.QueryDebugger;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static com.enterprise.qb.sql.Tables.USERS;
import static com.enterprise.qb.sql.clause.Clauses.and;
import static org.assertj.core.api.Assertions.*;

class QueryDebuggerTest {

    @Test
    void formatShowsAllRenderings() {
        SqlResult r = SelectStmt.select(USERS.c("id"))
                .from(USERS)
                .where(and(USERS.c("status").eq("ACTIVE"), USERS.c("created_at").gt(LocalDate.of(2024, 1, 1))))
                .build(new PostgresDialect());

        String out = QueryDebugger.format(r);

        assertThat(out)
                .contains("SQL (dialect):\n  SELECT id\n  FROM users\n  WHERE (status = $1 AND created_at > $2)")
                .contains("SQL (positional):\n  SELECT id\n  FROM users\n  WHERE (status = ? AND created_at > ?)")
                .contains("WHERE (status = 'ACTIVE' AND created_at > DATE '2024-01-01')")
                .contains("Bindings (2):")
                .contains("1 = ACTIVE (String)")
                .contains("2 = 2024-01-01 (LocalDate)");
    }
}
