package io.continuum.core.session;

import static org.assertj.core.api.Assertions.assertThat;

import io.continuum.core.sqlite.SqliteDatabase;
import io.continuum.core.time.MutableClock;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteSessionStoreTest extends AbstractSessionStoreTest {

    @TempDir
    Path tempDir;

    @Override
    protected SessionStore newStore(MutableClock clock) throws IOException {
        return new SqliteSessionStore(new SqliteDatabase(tempDir.resolve("data/sessions.db")), clock);
    }

    @Test
    void shouldCreateDatabaseFileUnderMissingDirectory() {
        assertThat(Files.exists(tempDir.resolve("data/sessions.db"))).isTrue();
    }

    @Test
    void shouldSurviveReopening() throws Exception {
        Session session = store.createSession("u1", "planner", Map.of("k", "v"));
        store.appendTurn(session.sessionId(), TurnRole.USER, "hello", Map.of());

        SessionStore reopened = newStore(clock);
        reopened.appendTurn(session.sessionId(), TurnRole.ASSISTANT, "hi", Map.of());

        assertThat(reopened.getSession(session.sessionId()).metadata()).containsEntry("k", "v");
        assertThat(reopened.getHistory(session.sessionId(), 10))
            .extracting(ConversationTurn::turnNumber)
            .containsExactly(2, 1);
    }
}
