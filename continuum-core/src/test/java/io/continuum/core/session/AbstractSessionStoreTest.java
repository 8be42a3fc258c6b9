package io.continuum.core.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.continuum.core.error.InvalidTransitionException;
import io.continuum.core.error.NotFoundException;
import io.continuum.core.error.ValidationException;
import io.continuum.core.time.MutableClock;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Behaviour every {@link SessionStore} backend must share.
 */
abstract class AbstractSessionStoreTest {

    protected final MutableClock clock = MutableClock.at("2026-03-01T09:00:00Z");
    protected SessionStore store;

    protected abstract SessionStore newStore(MutableClock clock) throws IOException;

    @BeforeEach
    void setUpStore() throws IOException {
        store = newStore(clock);
    }

    @Test
    void shouldRoundTripTurnsInOrder() throws Exception {
        Session session = store.createSession("u1", "planner", Map.of());

        store.appendTurn(session.sessionId(), TurnRole.USER, "hello", Map.of());
        store.appendTurn(session.sessionId(), TurnRole.ASSISTANT, "hi", Map.of());

        List<ConversationTurn> history = store.getHistory(session.sessionId(), 10);
        assertThat(history).hasSize(2);
        assertThat(history.get(0).turnNumber()).isEqualTo(2);
        assertThat(history.get(0).role()).isEqualTo(TurnRole.ASSISTANT);
        assertThat(history.get(0).content()).isEqualTo("hi");
        assertThat(history.get(1).turnNumber()).isEqualTo(1);
        assertThat(history.get(1).role()).isEqualTo(TurnRole.USER);
        assertThat(history.get(1).content()).isEqualTo("hello");
    }

    @Test
    void shouldCreateActiveSessionWithFreshId() throws Exception {
        Session first = store.createSession("u1", "planner", Map.of("channel", "cli"));
        Session second = store.createSession("u1", "planner", Map.of());

        assertThat(first.sessionId()).isNotEqualTo(second.sessionId());
        Session loaded = store.getSession(first.sessionId());
        assertThat(loaded.status()).isEqualTo(SessionStatus.ACTIVE);
        assertThat(loaded.agentName()).isEqualTo("planner");
        assertThat(loaded.userId()).isEqualTo("u1");
        assertThat(loaded.metadata()).containsEntry("channel", "cli");
        assertThat(loaded.createdAt()).isEqualTo(clock.instant());
    }

    @Test
    void shouldRejectBlankAgentName() {
        assertThatThrownBy(() -> store.createSession("u1", "  ", Map.of()))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldAllowAnonymousSessions() throws Exception {
        Session session = store.createSession(null, "planner", Map.of());

        assertThat(store.getSession(session.sessionId()).userId()).isNull();
    }

    @Test
    void shouldFailForUnknownSession() {
        assertThatThrownBy(() -> store.getSession("missing"))
            .isInstanceOf(NotFoundException.class)
            .hasMessageContaining("missing");
        assertThatThrownBy(() -> store.appendTurn("missing", TurnRole.USER, "hello", Map.of()))
            .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> store.getHistory("missing", 10))
            .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> store.setStatus("missing", SessionStatus.COMPLETED))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void shouldAssignGaplessTurnNumbersUnderConcurrentAppends() throws Exception {
        Session session = store.createSession("u1", "planner", Map.of());
        int writers = 4;
        int appendsPerWriter = 10;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                int writer = w;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < appendsPerWriter; i++) {
                        store.appendTurn(session.sessionId(), TurnRole.USER, "w" + writer + "-" + i, Map.of());
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        List<ConversationTurn> history = store.getHistory(session.sessionId(), 1000);
        List<Integer> numbers = history.stream().map(ConversationTurn::turnNumber).sorted().toList();
        List<Integer> expected = new ArrayList<>();
        for (int i = 1; i <= writers * appendsPerWriter; i++) {
            expected.add(i);
        }
        assertThat(numbers).isEqualTo(expected);
    }

    @Test
    void shouldBumpUpdatedAtOnAppend() throws Exception {
        Session session = store.createSession("u1", "planner", Map.of());
        clock.advance(Duration.ofMinutes(5));

        ConversationTurn turn = store.appendTurn(session.sessionId(), TurnRole.USER, "hello", Map.of());

        Session loaded = store.getSession(session.sessionId());
        assertThat(turn.timestamp()).isEqualTo(clock.instant());
        assertThat(loaded.updatedAt()).isEqualTo(clock.instant());
        assertThat(loaded.updatedAt()).isAfterOrEqualTo(loaded.createdAt());
    }

    @Test
    void shouldKeepTurnMetadata() throws Exception {
        Session session = store.createSession("u1", "planner", Map.of());

        store.appendTurn(session.sessionId(), TurnRole.USER, "hello", Map.of("source", "web"));

        assertThat(store.getHistory(session.sessionId(), 1).get(0).metadata()).containsEntry("source", "web");
    }

    @Test
    void shouldTruncateHistoryToNewestTurns() throws Exception {
        Session session = store.createSession("u1", "planner", Map.of());
        for (int i = 1; i <= 5; i++) {
            store.appendTurn(session.sessionId(), TurnRole.USER, "m" + i, Map.of());
        }

        List<ConversationTurn> latest = store.getHistory(session.sessionId(), 2);
        List<ConversationTurn> earlier = store.getHistoryBefore(session.sessionId(), 4, 2);

        assertThat(latest).extracting(ConversationTurn::content).containsExactly("m5", "m4");
        assertThat(earlier).extracting(ConversationTurn::turnNumber).containsExactly(3, 2);
    }

    @Test
    void shouldRejectNonPositiveHistoryLimit() throws Exception {
        Session session = store.createSession("u1", "planner", Map.of());

        assertThatThrownBy(() -> store.getHistory(session.sessionId(), 0))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldRejectTransitionBackToActive() throws Exception {
        Session session = store.createSession("u1", "planner", Map.of());
        store.setStatus(session.sessionId(), SessionStatus.ARCHIVED);

        assertThatThrownBy(() -> store.setStatus(session.sessionId(), SessionStatus.ACTIVE))
            .isInstanceOf(InvalidTransitionException.class)
            .satisfies(error -> {
                InvalidTransitionException transition = (InvalidTransitionException) error;
                assertThat(transition.from()).isEqualTo(SessionStatus.ARCHIVED);
                assertThat(transition.to()).isEqualTo(SessionStatus.ACTIVE);
            });
        assertThat(store.getSession(session.sessionId()).status()).isEqualTo(SessionStatus.ARCHIVED);
    }

    @Test
    void shouldMoveForwardThroughLifecycle() throws Exception {
        Session session = store.createSession("u1", "planner", Map.of());

        Session completed = store.setStatus(session.sessionId(), SessionStatus.COMPLETED);
        Session archived = store.setStatus(session.sessionId(), SessionStatus.ARCHIVED);
        Session again = store.setStatus(session.sessionId(), SessionStatus.ARCHIVED);

        assertThat(completed.status()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(archived.status()).isEqualTo(SessionStatus.ARCHIVED);
        assertThat(again.status()).isEqualTo(SessionStatus.ARCHIVED);
        assertThatThrownBy(() -> store.setStatus(session.sessionId(), SessionStatus.COMPLETED))
            .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void shouldCreateUserOnFirstSession() throws Exception {
        assertThat(store.getUser("u7")).isEmpty();

        store.createSession("u7", "planner", Map.of());
        clock.advance(Duration.ofHours(1));
        store.createSession("u7", "planner", Map.of());

        assertThat(store.getUser("u7")).hasValueSatisfying(user -> {
            assertThat(user.userId()).isEqualTo("u7");
            assertThat(user.createdAt()).isEqualTo(clock.instant().minus(Duration.ofHours(1)));
        });
    }

    @Test
    void shouldListSessionsForUserNewestFirst() throws Exception {
        Session older = store.createSession("u1", "planner", Map.of());
        clock.advance(Duration.ofMinutes(1));
        Session newer = store.createSession("u1", "planner", Map.of());
        store.createSession("u2", "planner", Map.of());
        store.setStatus(older.sessionId(), SessionStatus.COMPLETED);

        assertThat(store.listSessionsForUser("u1"))
            .extracting(Session::sessionId)
            .containsExactly(newer.sessionId(), older.sessionId());
        assertThat(store.listSessionsForUser("u1", SessionStatus.COMPLETED, 0))
            .extracting(Session::sessionId)
            .containsExactly(older.sessionId());
        assertThat(store.listSessionsForUser("u1", null, 1))
            .extracting(Session::sessionId)
            .containsExactly(newer.sessionId());
        assertThat(store.listSessionsForUser("nobody")).isEmpty();
    }

    @Test
    void shouldReplaceMetadataAndBumpUpdatedAt() throws Exception {
        Session session = store.createSession("u1", "planner", Map.of("a", 1));
        clock.advance(Duration.ofSeconds(30));

        Session updated = store.updateMetadata(session.sessionId(), Map.of("topic", "travel"));

        assertThat(updated.metadata()).containsExactly(Map.entry("topic", "travel"));
        assertThat(updated.updatedAt()).isEqualTo(clock.instant());
        assertThat(store.getSession(session.sessionId()).metadata()).containsEntry("topic", "travel");
    }

    @Test
    void shouldAppendTurnPairWithConsecutiveNumbers() throws Exception {
        Session session = store.createSession("u1", "planner", Map.of());
        store.appendTurn(session.sessionId(), TurnRole.USER, "earlier", Map.of());

        TurnPair pair = store.appendTurnPair(session.sessionId(), "hello", Map.of("context", Map.of()), "hi", Map.of());

        assertThat(pair.user().turnNumber()).isEqualTo(2);
        assertThat(pair.user().role()).isEqualTo(TurnRole.USER);
        assertThat(pair.assistant().turnNumber()).isEqualTo(3);
        assertThat(pair.assistant().role()).isEqualTo(TurnRole.ASSISTANT);
        assertThat(store.getHistory(session.sessionId(), 10))
            .extracting(ConversationTurn::content)
            .containsExactly("hi", "hello", "earlier");
    }

    @Test
    void shouldKeepTurnPairsAdjacentUnderConcurrentWriters() throws Exception {
        Session session = store.createSession("u1", "planner", Map.of());
        int writers = 4;
        int pairsPerWriter = 10;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                int writer = w;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < pairsPerWriter; i++) {
                        String tag = "w" + writer + "-" + i;
                        store.appendTurnPair(session.sessionId(), "q " + tag, Map.of(), "a " + tag, Map.of());
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        List<ConversationTurn> oldestFirst = new ArrayList<>(store.getHistory(session.sessionId(), 1000));
        Collections.reverse(oldestFirst);
        assertThat(oldestFirst).hasSize(writers * pairsPerWriter * 2);
        for (int i = 0; i < oldestFirst.size(); i += 2) {
            ConversationTurn question = oldestFirst.get(i);
            ConversationTurn answer = oldestFirst.get(i + 1);
            assertThat(question.turnNumber()).isEqualTo(i + 1);
            assertThat(question.role()).isEqualTo(TurnRole.USER);
            assertThat(answer.role()).isEqualTo(TurnRole.ASSISTANT);
            assertThat(answer.content()).isEqualTo("a " + question.content().substring(2));
        }
    }

    @Test
    void shouldNotMoveUpdatedAtBackwardsWhenClockSteppedBack() throws Exception {
        Session session = store.createSession("u1", "planner", Map.of());
        clock.advance(Duration.ofMinutes(5));
        store.appendTurn(session.sessionId(), TurnRole.USER, "hello", Map.of());
        Instant latest = clock.instant();
        clock.advance(Duration.ofMinutes(-3));

        Session updated = store.updateMetadata(session.sessionId(), Map.of("topic", "travel"));
        Session completed = store.setStatus(session.sessionId(), SessionStatus.COMPLETED);

        assertThat(updated.updatedAt()).isEqualTo(latest);
        assertThat(completed.updatedAt()).isEqualTo(latest);
        assertThat(store.getSession(session.sessionId()).updatedAt()).isEqualTo(latest);
    }
}
