package com.jobflow.db;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.logging.Logger;

import com.jobflow.core.DataContext;

/**
 * {@link DataContext} over a pooled H2 {@link Database}.
 */
public class JdbcDataContext implements DataContext {
    private static final Logger logger = Logger.getLogger(JdbcDataContext.class.getName());

    private final Database database;

    public JdbcDataContext(Database database) {
        this.database = database;
    }

    @Override
    public Connection getConnection() throws SQLException {
        return database.getConnection();
    }

    @Override
    public void healthCheck() {
        try {
            database.ping();
        } catch (SQLException e) {
            throw new IllegalStateException("Data store unreachable at " + database.getUrl(), e);
        }
        logger.fine("Data store reachable at " + database.getUrl());
    }

    public Database getDatabase() {
        return database;
    }

    @Override
    public void close() {
        database.close();
    }
}
