package io.continuum.core.sqlite;

import io.continuum.core.error.ConcurrencyConflictException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteErrorCode;

/**
 * One SQLite file shared by any number of stores. Every unit of work gets its own connection and runs in an
 * IMMEDIATE transaction, so a read-then-write sequence holds the write lock from its first statement.
 */
public final class SqliteDatabase {
    private static final Logger LOG = LoggerFactory.getLogger(SqliteDatabase.class);
    private static final int BUSY_TIMEOUT_MS = 5_000;
    private static final int MAX_ATTEMPTS = 3;

    private final Path path;
    private final String jdbcUrl;
    private final int busyTimeoutMs;

    public SqliteDatabase(Path dbPath) throws IOException {
        this(dbPath, BUSY_TIMEOUT_MS);
    }

    SqliteDatabase(Path dbPath, int busyTimeoutMs) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        if (busyTimeoutMs < 0) {
            throw new IllegalArgumentException("busyTimeoutMs must not be negative");
        }
        this.path = dbPath.toAbsolutePath();
        Files.createDirectories(path.getParent());
        this.jdbcUrl = "jdbc:sqlite:" + path;
        this.busyTimeoutMs = busyTimeoutMs;
    }

    public Path path() {
        return path;
    }

    /**
     * Runs each DDL statement once; statements are expected to be idempotent.
     */
    public void migrate(String description, List<String> ddl) throws IOException {
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            for (String sql : ddl) {
                statement.execute(sql);
            }
        } catch (SQLException e) {
            throw new IOException("Failed to initialize " + description + " at " + path, e);
        }
        LOG.debug("Schema ready for {} at {}", description, path);
    }

    public <T> T read(String operation, Work<T> work) throws IOException {
        try (Connection connection = openConnection()) {
            return work.run(connection);
        } catch (SQLException e) {
            throw new IOException("Failed to " + operation, e);
        }
    }

    /**
     * Runs the work in a transaction. Lock contention and unique-key collisions are retried a few times
     * before surfacing as {@link ConcurrencyConflictException}; any other SQL failure is an I/O error.
     */
    public <T> T write(String operation, Work<T> work) throws IOException {
        SQLException last = null;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try (Connection connection = openConnection()) {
                connection.setAutoCommit(false);
                try {
                    T result = work.run(connection);
                    connection.commit();
                    return result;
                } catch (SQLException | RuntimeException e) {
                    rollbackQuietly(connection, operation);
                    throw e;
                }
            } catch (SQLException e) {
                if (!isConflict(e)) {
                    throw new IOException("Failed to " + operation, e);
                }
                last = e;
                LOG.debug("Conflict on attempt {} to {}: {}", attempt, operation, e.getMessage());
                backoff(attempt);
            }
        }
        throw new ConcurrencyConflictException("Gave up trying to " + operation + " after " + MAX_ATTEMPTS + " attempts", last);
    }

    private Connection openConnection() throws SQLException {
        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        config.setBusyTimeout(busyTimeoutMs);
        config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        return DriverManager.getConnection(jdbcUrl, config.toProperties());
    }

    private boolean isConflict(SQLException e) {
        int code = e.getErrorCode();
        return code == SQLiteErrorCode.SQLITE_BUSY.code
            || code == SQLiteErrorCode.SQLITE_LOCKED.code
            || code == SQLiteErrorCode.SQLITE_CONSTRAINT.code;
    }

    private void rollbackQuietly(Connection connection, String operation) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            LOG.warn("Rollback failed while trying to {}", operation, e);
        }
    }

    private void backoff(int attempt) {
        try {
            Thread.sleep(25L * attempt);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    @FunctionalInterface
    public interface Work<T> {
        T run(Connection connection) throws SQLException;
    }
}
