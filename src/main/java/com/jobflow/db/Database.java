package com.jobflow.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.h2.jdbcx.JdbcConnectionPool;

/**
 * Pooled access to an H2 database.
 *
 * <p>Used both by the broker (which loads its schema from the classpath on
 * {@link #initialize(String)}) and by the data context handed to job handlers. Several processes
 * share one broker by pointing at the same database, e.g. with an {@code AUTO_SERVER=TRUE} file URL
 * or a TCP server URL.</p>
 *
 * <p>Connection timeouts apply when borrowing a connection; the command timeout is applied to
 * every statement prepared through {@link #prepare(Connection, String)}.</p>
 */
public class Database implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(Database.class.getName());

    public static final int DEFAULT_POOL_SIZE = 10;

    private final String url;
    private final JdbcConnectionPool pool;
    private final int commandTimeoutSeconds;
    private volatile boolean closed = false;

    public Database(String url, String user, String password) {
        this(url, user, password, DEFAULT_POOL_SIZE, Duration.ofSeconds(30), Duration.ofSeconds(60));
    }

    /**
     * @param url JDBC URL of an H2 database
     * @param poolSize maximum number of pooled connections
     * @param connectTimeout how long to wait for a connection
     * @param commandTimeout maximum duration of one statement
     */
    public Database(String url, String user, String password, int poolSize, Duration connectTimeout,
                    Duration commandTimeout) {
        this.url = url;
        this.pool = JdbcConnectionPool.create(url, user != null ? user : "", password != null ? password : "");
        this.pool.setMaxConnections(poolSize);
        this.pool.setLoginTimeout((int) Math.max(1, connectTimeout.getSeconds()));
        this.commandTimeoutSeconds = (int) Math.max(0, commandTimeout.getSeconds());
    }

    public String getUrl() {
        return url;
    }

    /**
     * Run the SQL script found on the classpath at {@code schemaResource}. Statements are separated
     * by semicolons at the end of a line; lines starting with {@code --} are skipped.
     *
     * @throws SQLException if the script is missing or a statement fails
     */
    public void initialize(String schemaResource) throws SQLException {
        String schema;
        try (InputStream in = Database.class.getClassLoader().getResourceAsStream(schemaResource)) {
            if (in == null) {
                throw new SQLException("Schema resource not found on classpath: " + schemaResource);
            }
            schema = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SQLException("Failed to read schema resource " + schemaResource, e);
        }

        int executed = 0;
        try (Connection conn = getConnection();
             Statement stmt = conn.createStatement()) {
            StringBuilder current = new StringBuilder();
            for (String line : schema.split("\n")) {
                line = line.trim();
                if (line.startsWith("--") || line.isEmpty()) {
                    continue;
                }
                current.append(line).append(' ');
                if (line.endsWith(";")) {
                    String sql = current.toString().trim();
                    stmt.execute(sql.substring(0, sql.length() - 1));
                    executed++;
                    current.setLength(0);
                }
            }
        }
        logger.info("Initialized schema " + schemaResource + " (" + executed + " statements) on " + url);
    }

    public Connection getConnection() throws SQLException {
        if (closed) {
            throw new SQLException("Database has been closed");
        }
        return pool.getConnection();
    }

    /**
     * Prepare a statement with the configured command timeout.
     */
    public PreparedStatement prepare(Connection conn, String sql) throws SQLException {
        PreparedStatement stmt = conn.prepareStatement(sql);
        if (commandTimeoutSeconds > 0) {
            stmt.setQueryTimeout(commandTimeoutSeconds);
        }
        return stmt;
    }

    /**
     * Run {@code work} in one transaction: committed when it returns, rolled back when it throws.
     */
    public <T> T inTransaction(SqlWork<T> work) throws SQLException {
        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try {
                T result = work.run(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                try {
                    conn.rollback();
                } catch (SQLException rollbackEx) {
                    e.addSuppressed(rollbackEx);
                }
                throw e;
            } finally {
                try {
                    conn.setAutoCommit(true);
                } catch (SQLException e) {
                    logger.log(Level.FINE, "Failed to restore auto-commit", e);
                }
            }
        }
    }

    /**
     * Like {@link #inTransaction(SqlWork)}, but runs {@code work} again in a fresh transaction when
     * it lost a race against another connection: a duplicate key, a deadlock or a lock timeout.
     * {@code work} must therefore read the state it depends on inside the transaction.
     *
     * @param attempts total number of runs before the conflict is rethrown
     */
    public <T> T inTransaction(SqlWork<T> work, int attempts) throws SQLException {
        for (int attempt = 1; ; attempt++) {
            try {
                return inTransaction(work);
            } catch (SQLException e) {
                if (attempt >= attempts || !isConflict(e)) {
                    throw e;
                }
                logger.fine("Transaction conflict (" + e.getSQLState() + "), running again, attempt "
                        + (attempt + 1) + " of " + attempts);
            }
        }
    }

    /**
     * True for failures caused by a concurrent transaction rather than by the statement itself.
     */
    static boolean isConflict(SQLException e) {
        String state = e.getSQLState();
        return "23505".equals(state) || "40001".equals(state) || "HYT00".equals(state);
    }

    /**
     * Round trip used as a health check.
     */
    public void ping() throws SQLException {
        try (Connection conn = getConnection();
             Statement stmt = conn.createStatement()) {
            if (commandTimeoutSeconds > 0) {
                stmt.setQueryTimeout(commandTimeoutSeconds);
            }
            stmt.execute("SELECT 1");
        }
    }

    public int getActiveConnections() {
        return pool.getActiveConnections();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        pool.dispose();
        logger.info("Closed database " + url);
    }

    /**
     * Unit of work run inside a transaction.
     */
    @FunctionalInterface
    public interface SqlWork<T> {
        T run(Connection conn) throws SQLException;
    }
}
