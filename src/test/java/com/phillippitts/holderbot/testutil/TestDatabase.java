package com.phillippitts.holderbot.testutil;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Fresh in-memory H2 database with the production schema, one per test instance.
 */
public final class TestDatabase implements AutoCloseable {

    private final EmbeddedDatabase database;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public TestDatabase() {
        this.database = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScript("classpath:schema.sql")
                .build();
        this.jdbcTemplate = new JdbcTemplate(database);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(database));
    }

    public JdbcTemplate jdbc() {
        return jdbcTemplate;
    }

    public TransactionTemplate transactions() {
        return transactionTemplate;
    }

    @Override
    public void close() {
        database.shutdown();
    }
}
