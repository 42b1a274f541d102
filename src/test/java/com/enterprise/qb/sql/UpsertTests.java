package com.enterprise.qb.sql;

import com.enterprise.qb.sql.builder.UpsertStmt;
import com.enterprise.qb.sql.compiler.SqlResult;
import com.enterprise.qb.sql.compiler.UnsupportedClauseException;
import com.enterprise.qb.sql.core.DefaultDialect;
import com.enterprise.qb.sql.core.Dialects;
import com.enterprise.qb.sql.core.MysqlDialect;
import com.enterprise.qb.sql.core.PostgresDialect;
import com.enterprise.qb.sql.core.SqliteDialect;

import org.junit.jupiter.api.Test;

import static com.enterprise.qb.sql.Tables.USERS;
import static org.assertj.core.api.Assertions.*;

class UpsertTests {

    private static UpsertStmt userUpsert() {
        return UpsertStmt.upsert(USERS)
                .value("id", 7)
                .value("email", "a@b.c");
    }

    @Test
    void defaultDialectRejectsUpsert() {
        DefaultDialect dialect = new DefaultDialect();
        UnsupportedClauseException e = catchThrowableOfType(
                () -> userUpsert().build(dialect), UnsupportedClauseException.class);

        assertThat(e).isInstanceOf(UnsupportedOperationException.class)
                .hasMessageContaining("UPSERT is not supported by the default dialect");
        assertThat(e.clauseKind()).isEqualTo("UPSERT");
        assertThat(e.driver()).isEqualTo(Dialects.DEFAULT);
    }

    // ==================== Postgres ====================

    @Test
    void postgresOnConflictDoUpdate() {
        SqlResult r = userUpsert()
                .value("status", "NEW")
                .onConflict(USERS.c("id"))
                .returning(USERS.c("id"))
                .build(new PostgresDialect());

        assertThat(r.sql()).isEqualTo(
                "INSERT INTO users(email, id, status)\n"
                        + "VALUES($1, $2, $3)\n"
                        + "ON CONFLICT (id)\n"
                        + "DO UPDATE SET email = EXCLUDED.email, status = EXCLUDED.status\n"
                        + "RETURNING id");
        assertThat(r.bindings()).containsExactly("a@b.c", 7, "NEW");
    }

    @Test
    void postgresDoNothingWhenOnlyKeysGiven() {
        SqlResult r = UpsertStmt.upsert(USERS)
                .value("id", 7)
                .onConflict(USERS.c("id"))
                .build(new PostgresDialect());

        assertThat(r.sql()).isEqualTo("INSERT INTO users(id)\nVALUES($1)\nON CONFLICT (id)\nDO NOTHING");
    }

    @Test
    void postgresRequiresConflictColumns() {
        assertThatThrownBy(() -> userUpsert().build(new PostgresDialect()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("onConflict");
    }

    @Test
    void postgresEscaped() {
        PostgresDialect dialect = new PostgresDialect();
        dialect.setEscaping(true);
        String sql = userUpsert().onConflict(USERS.c("id")).build(dialect).sql();

        assertThat(sql).isEqualTo(
                "INSERT INTO \"users\"(\"email\", \"id\")\n"
                        + "VALUES($1, $2)\n"
                        + "ON CONFLICT (\"id\")\n"
                        + "DO UPDATE SET \"email\" = EXCLUDED.\"email\"");
    }

    // ==================== MySQL ====================

    @Test
    void mysqlOnDuplicateKeyUpdate() {
        SqlResult r = userUpsert().build(new MysqlDialect());

        assertThat(r.sql()).isEqualTo(
                "INSERT INTO users(email, id)\n"
                        + "VALUES(?, ?)\n"
                        + "ON DUPLICATE KEY UPDATE email = VALUES(email), id = VALUES(id)");
        assertThat(r.bindings()).containsExactly("a@b.c", 7);
    }

    @Test
    void mysqlEscapedWithBackticks() {
        MysqlDialect dialect = new MysqlDialect();
        dialect.setEscaping(true);

        assertThat(userUpsert().build(dialect).sql()).isEqualTo(
                "INSERT INTO `users`(`email`, `id`)\n"
                        + "VALUES(?, ?)\n"
                        + "ON DUPLICATE KEY UPDATE `email` = VALUES(`email`), `id` = VALUES(`id`)");
    }

    @Test
    void mysqlRejectsReturning() {
        assertThatThrownBy(() -> userUpsert().returning(USERS.c("id")).build(new MysqlDialect()))
                .isInstanceOf(UnsupportedClauseException.class)
                .hasMessageContaining("RETURNING")
                .hasMessageContaining("mysql");
    }

    // ==================== SQLite ====================

    @Test
    void sqliteReplaceInto() {
        SqlResult r = userUpsert().build(new SqliteDialect());

        assertThat(r.sql()).isEqualTo("REPLACE INTO users(email, id)\nVALUES(?, ?)");
        assertThat(r.bindings()).containsExactly("a@b.c", 7);
    }
}
