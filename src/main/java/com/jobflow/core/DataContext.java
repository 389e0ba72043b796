package com.jobflow.core;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Data-access dependency handed to every job handler through its {@link JobContext}.
 *
 * <p>The worker runtime establishes it once at startup, checks it with {@link #healthCheck()}
 * before consuming any queue and closes it on shutdown. Handlers of one queue run concurrently
 * and each must obtain and close its own connection.</p>
 */
public interface DataContext extends AutoCloseable {

    /**
     * Borrow a connection. Callers close it when done, returning it to the pool.
     */
    Connection getConnection() throws SQLException;

    /**
     * @throws IllegalStateException if the underlying store cannot be reached
     */
    void healthCheck();

    @Override
    void close();
}
