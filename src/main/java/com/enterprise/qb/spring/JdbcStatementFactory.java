package com.enterprise.qb.spring;

import com.enterprise.qb.sql.clause.Clause;
import com.enterprise.qb.sql.compiler.Compilation;
import com.enterprise.qb.sql.compiler.SqlResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Bridges compiled statements to Spring JDBC.
 *
 * <p>Compiles with a fresh dialect from the {@link DialectFactory}, then converts
 * the dialect placeholders to JDBC {@code ?}. Executing the query is left to the
 * caller ({@code JdbcTemplate}, a batch reader, ...).
 *
 * <pre>{@code
 * PreparedQuery q = factory.prepare("activeUsers", Map.of("status", "ACTIVE"));
 * jdbcTemplate.query(q.sql(), q.statementSetter(), rowMapper);
 * }</pre>
 */
public class JdbcStatementFactory {

    private static final Logger log = LoggerFactory.getLogger(JdbcStatementFactory.class);

    private final DialectFactory dialects;
    private final StatementProviderRegistry registry;

    public JdbcStatementFactory(DialectFactory dialects, StatementProviderRegistry registry) {
        this.dialects = Objects.requireNonNull(dialects, "dialects");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Builds the named provider's statement and prepares it.
     *
     * @throws IllegalArgumentException if no provider has that name
     */
    public PreparedQuery prepare(String providerName, Map<String, Object> params) {
        Clause statement = registry.get(providerName).buildStatement(params);
        log.debug("Preparing statement '{}' with params {}", providerName, params.keySet());
        return prepare(statement);
    }

    public PreparedQuery prepare(Clause statement) {
        SqlResult result = compile(statement);
        SqlResult.PositionalQuery pq = result.toPositional();
        return new PreparedQuery(pq.sql(), pq.values());
    }

    /** Compiles with a fresh dialect and verifies placeholder/binding alignment. */
    public SqlResult compile(Clause statement) {
        SqlResult result = Compilation.compile(statement, dialects.newDialect());
        result.verify();
        return result;
    }
}
