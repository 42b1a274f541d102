package com.enterprise.qb.spring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring wiring for the clause compiler.
 *
 * <p>Properties:
 * <ul>
 *   <li>{@code qb.dialect}: {@code default}, {@code postgres}, {@code mysql} or {@code sqlite} (default {@code default})</li>
 *   <li>{@code qb.escaping}: escape identifiers (default {@code false})</li>
 * </ul>
 *
 * <pre>{@code
 * @Import(SqlStatementConfig.class)
 * @Configuration
 * public class MyConfig { ... }
 * }</pre>
 */
@Configuration
public class SqlStatementConfig {

    private static final Logger log = LoggerFactory.getLogger(SqlStatementConfig.class);

    @Bean
    public DialectFactory dialectFactory(@Value("${qb.dialect:default}") String driver,
                                         @Value("${qb.escaping:false}") boolean escaping) {
        DialectFactory factory = new DialectFactory(driver, escaping);
        log.info("SQL dialect: {} (escaping {})", driver, escaping ? "on" : "off");
        return factory;
    }

    @Bean
    public StatementProviderRegistry statementProviderRegistry() {
        return new StatementProviderRegistry();
    }

    @Bean
    public JdbcStatementFactory jdbcStatementFactory(DialectFactory dialectFactory,
                                                     StatementProviderRegistry registry) {
        return new JdbcStatementFactory(dialectFactory, registry);
    }
}
