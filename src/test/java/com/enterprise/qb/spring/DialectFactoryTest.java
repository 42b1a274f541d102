package com.enterprise.qb.spring;

import com.enterprise.qb.sql.builder.SelectStmt;
import com.enterprise.qb.sql.clause.TableElem;
import com.enterprise.qb.sql.core.MysqlDialect;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DialectFactoryTest {

    @Test
    void unknownDriverFailsFast() {
        assertThatThrownBy(() -> new DialectFactory("db2", false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown dialect: db2");
    }

    @Test
    void newDialectAppliesEscaping() {
        DialectFactory factory = new DialectFactory("mysql", true);
        assertThat(factory.newDialect()).isInstanceOf(MysqlDialect.class);
        assertThat(factory.newDialect().escape("t")).isEqualTo("`t`");
    }

    @Test
    void registryRejectsDuplicates() {
        StatementProviderRegistry registry = new StatementProviderRegistry();
        registry.register("all", params -> SelectStmt.select());

        assertThatThrownBy(() -> registry.register("all", params -> SelectStmt.select()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("already registered");
        assertThat(registry.all()).containsOnlyKeys("all");
    }

    @Test
    void statementFactoryWithoutSpring() {
        TableElem users = TableElem.table("users");
        JdbcStatementFactory factory = new JdbcStatementFactory(
                new DialectFactory("postgres", false), new StatementProviderRegistry());

        PreparedQuery q = factory.prepare(SelectStmt.select(users.c("id")).from(users)
                .where(users.c("id").gt(10)));

        assertThat(q.sql()).isEqualTo("SELECT id\nFROM users\nWHERE id > ?");
        assertThat(q.values()).containsExactly(10);
    }
}
