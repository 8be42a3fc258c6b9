package io.continuum.core.sqlite;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.continuum.core.error.ConcurrencyConflictException;
import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sqlite.SQLiteErrorCode;

class SqliteDatabaseTest {

    @TempDir
    Path tempDir;

    private SqliteDatabase database;

    @BeforeEach
    void setUp() throws IOException {
        database = new SqliteDatabase(tempDir.resolve("contention.db"), 50);
        database.migrate("notes", List.of("CREATE TABLE IF NOT EXISTS notes (body TEXT NOT NULL)"));
    }

    @Test
    void shouldGiveUpWithConflictWhileAnotherWriterHoldsTheLock() throws Exception {
        AtomicInteger attempts = new AtomicInteger();

        try (Connection holder = DriverManager.getConnection("jdbc:sqlite:" + database.path())) {
            try (Statement statement = holder.createStatement()) {
                statement.execute("BEGIN IMMEDIATE");
                statement.execute("INSERT INTO notes (body) VALUES ('held')");
            }

            assertThatThrownBy(() -> database.write("insert note", connection -> {
                attempts.incrementAndGet();
                return insert(connection, "blocked");
            }))
                .isInstanceOf(ConcurrencyConflictException.class)
                .hasMessageContaining("insert note")
                .hasMessageContaining("3 attempts")
                .cause()
                .isInstanceOf(SQLException.class)
                .satisfies(cause -> assertThat(((SQLException) cause).getErrorCode())
                    .isEqualTo(SQLiteErrorCode.SQLITE_BUSY.code));

            try (Statement statement = holder.createStatement()) {
                statement.execute("ROLLBACK");
            }
        }

        assertThat(attempts.get()).isLessThanOrEqualTo(3);
        assertThat(database.<Integer>write("insert note", connection -> insert(connection, "after"))).isEqualTo(1);
        assertThat(bodies()).containsExactly("after");
    }

    @Test
    void shouldReportOtherFailuresAsIoErrorsWithoutRetrying() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> database.write("query missing table", connection -> {
            attempts.incrementAndGet();
            try (Statement statement = connection.createStatement()) {
                return statement.executeUpdate("DELETE FROM missing");
            }
        }))
            .isInstanceOf(IOException.class)
            .hasMessage("Failed to query missing table");
        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    void shouldRollBackWorkThatThrows() throws Exception {
        assertThatThrownBy(() -> database.write("insert then fail", connection -> {
            insert(connection, "discarded");
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(bodies()).isEmpty();
    }

    private static int insert(Connection connection, String body) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("INSERT INTO notes (body) VALUES (?)")) {
            statement.setString(1, body);
            return statement.executeUpdate();
        }
    }

    private List<String> bodies() throws IOException {
        return database.read("list notes", connection -> {
            try (Statement statement = connection.createStatement();
                 ResultSet rs = statement.executeQuery("SELECT body FROM notes ORDER BY rowid")) {
                List<String> bodies = new ArrayList<>();
                while (rs.next()) {
                    bodies.add(rs.getString(1));
                }
                return bodies;
            }
        });
    }
}
