package com.enterprise.qb.sql;

import com.enterprise.qb.sql.builder.DeleteStmt;
import com.enterprise.qb.sql.builder.InsertStmt;
import com.enterprise.qb.sql.builder.SelectStmt;
import com.enterprise.qb.sql.builder.UpdateStmt;
import com.enterprise.qb.sql.compiler.SqlResult;
import com.enterprise.qb.sql.core.DefaultDialect;
import com.enterprise.qb.sql.core.PostgresDialect;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.enterprise.qb.sql.Tables.*;
import static com.enterprise.qb.sql.clause.Clauses.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for INSERT, UPDATE and DELETE statements.
 */
class DmlStmtTests {

    // ==================== INSERT ====================

    @Test
    void insertColumnsSortedByName() {
        SqlResult r = InsertStmt.insert(USERS)
                .value("status", "NEW")
                .value("email", "a@b.c")
                .returning(USERS.c("id"))
                .build(new DefaultDialect());

        assertThat(r.sql()).isEqualTo("INSERT INTO users(email, status)\nVALUES(?, ?)\nRETURNING id");
        assertThat(r.bindings()).containsExactly("a@b.c", "NEW");
    }

    @Test
    void insertFromMap() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("status", "NEW");
        values.put("created_at", "2024-05-01");
        values.put("email", null);

        SqlResult r = InsertStmt.insert(USERS).values(values).build(new PostgresDialect());

        assertThat(r.sql()).isEqualTo("INSERT INTO users(created_at, email, status)\nVALUES($1, $2, $3)");
        assertThat(r.bindings()).containsExactly("2024-05-01", null, "NEW");
    }

    @Test
    void insertSubSelectValueInParentheses() {
        SqlResult r = InsertStmt.insert(SESSIONS)
                .value("user_id", SelectStmt.select(USERS.c("id"))
                        .from(USERS)
                        .where(USERS.c("email").eq("a@b.c")))
                .value("token", "t-1")
                .build(new PostgresDialect());

        assertThat(r.sql()).isEqualTo(
                "INSERT INTO sessions(token, user_id)\n"
                        + "VALUES($1, (SELECT id\nFROM users\nWHERE email = $2))");
        assertThat(r.bindings()).containsExactly("t-1", "a@b.c");
    }

    @Test
    void insertWithoutValuesRejected() {
        InsertStmt insert = InsertStmt.insert(USERS);
        assertThatThrownBy(() -> insert.build(new DefaultDialect()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("no values");
    }

    @Test
    void insertUnknownColumnRejected() {
        assertThatThrownBy(() -> InsertStmt.insert(USERS).value("nickname", "x"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nickname");
    }

    @Test
    void insertIntoTableWithoutDeclaredColumns() {
        SqlResult r = InsertStmt.insert(ROLES).value("name", "admin").build(new DefaultDialect());
        assertThat(r.sql()).isEqualTo("INSERT INTO roles(name)\nVALUES(?)");
    }

    @Test
    void escapedInsert() {
        DefaultDialect dialect = new DefaultDialect();
        dialect.setEscaping(true);
        String sql = InsertStmt.insert(USERS).value("email", "x").build(dialect).sql();
        assertThat(sql).isEqualTo("INSERT INTO \"users\"(\"email\")\nVALUES(?)");
    }

    // ==================== UPDATE ====================

    @Test
    void updateWithWhereAndReturning() {
        SqlResult r = UpdateStmt.update(USERS)
                .set("status", "ACTIVE")
                .set("email", "new@b.c")
                .where(USERS.c("id").eq(42))
                .returning(USERS.c("id"), USERS.c("status"))
                .build(new DefaultDialect());

        assertThat(r.sql()).isEqualTo(
                "UPDATE users\nSET email = ?, status = ?\nWHERE id = ?\nRETURNING id, status");
        assertThat(r.bindings()).containsExactly("new@b.c", "ACTIVE", 42);
    }

    @Test
    void updateWithoutWhereTouchesEveryRow() {
        String sql = UpdateStmt.update(USERS).set("status", "ARCHIVED").build(new DefaultDialect()).sql();
        assertThat(sql).isEqualTo("UPDATE users\nSET status = ?");
    }

    @Test
    void updateSetExpression() {
        SqlResult r = UpdateStmt.update(USERS)
                .set("created_at", text("CURRENT_TIMESTAMP"))
                .where(USERS.c("id").eq(1))
                .build(new DefaultDialect());

        assertThat(r.sql()).isEqualTo("UPDATE users\nSET created_at = CURRENT_TIMESTAMP\nWHERE id = ?");
        assertThat(r.bindings()).containsExactly(1);
    }

    @Test
    void updateSubSelectValueInParentheses() {
        SqlResult r = UpdateStmt.update(SESSIONS)
                .set("user_id", SelectStmt.select(USERS.c("id"))
                        .from(USERS)
                        .where(USERS.c("email").eq("a@b.c")))
                .set("token", null)
                .where(SESSIONS.c("id").eq(5))
                .build(new PostgresDialect());

        assertThat(r.sql()).isEqualTo(
                "UPDATE sessions\n"
                        + "SET token = $1, user_id = (SELECT id\nFROM users\nWHERE email = $2)\n"
                        + "WHERE id = $3");
        assertThat(r.bindings()).containsExactly(null, "a@b.c", 5);
    }

    @Test
    void updateWithoutValuesRejected() {
        UpdateStmt update = UpdateStmt.update(USERS).where(USERS.c("id").eq(1));
        assertThatThrownBy(() -> update.build(new DefaultDialect()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("no values");
    }

    @Test
    void updateQualifiesOtherTables() {
        String sql = UpdateStmt.update(SESSIONS)
                .set("token", null)
                .where(SESSIONS.c("user_id").eq(USERS.c("id")))
                .build(new DefaultDialect()).sql();
        assertThat(sql).isEqualTo("UPDATE sessions\nSET token = ?\nWHERE user_id = users.id");
    }

    // ==================== DELETE ====================

    @Test
    void deleteWithWhereAndReturning() {
        SqlResult r = DeleteStmt.delete(SESSIONS)
                .where(SESSIONS.c("expires_at").lt("2024-01-01"))
                .returning(SESSIONS.c("id"))
                .build(new DefaultDialect());

        assertThat(r.sql()).isEqualTo("DELETE FROM sessions\nWHERE expires_at < ?\nRETURNING id");
        assertThat(r.bindings()).containsExactly("2024-01-01");
    }

    @Test
    void deleteWithoutWhere() {
        assertThat(DeleteStmt.delete(SESSIONS).build(new DefaultDialect()).sql())
                .isEqualTo("DELETE FROM sessions");
    }

    @Test
    void deleteWithInSubSelect() {
        SqlResult r = DeleteStmt.delete(SESSIONS)
                .where(binary(SESSIONS.c("user_id"), "IN",
                        list(SelectStmt.select(USERS.c("id")).from(USERS).where(USERS.c("status").eq("BANNED")))))
                .build(new PostgresDialect());

        // the sub-select sets its own default table, restored afterwards
        assertThat(r.sql()).isEqualTo(
                "DELETE FROM sessions\nWHERE user_id IN (SELECT id\nFROM users\nWHERE status = $1)");
        assertThat(r.bindings()).containsExactly("BANNED");
    }
}
