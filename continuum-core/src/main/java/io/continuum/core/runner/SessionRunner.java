package io.continuum.core.runner;

import io.continuum.core.codec.PayloadCodec;
import io.continuum.core.error.Checks;
import io.continuum.core.error.InvalidTransitionException;
import io.continuum.core.error.ModelInvocationException;
import io.continuum.core.memory.LongTermMemory;
import io.continuum.core.memory.MemoryStore;
import io.continuum.core.memory.ShortTermMemory;
import io.continuum.core.memory.ShortTermMemoryType;
import io.continuum.core.provider.ModelInvoker;
import io.continuum.core.session.ConversationTurn;
import io.continuum.core.session.Session;
import io.continuum.core.session.SessionStatus;
import io.continuum.core.session.SessionStore;
import io.continuum.core.session.TurnPair;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one request through {@link RunStage}: resolve the session, gather history and memories, build the
 * prompt, call the model, then write the turn pair and an interaction snapshot back.
 *
 * <p>Nothing is written unless the model call returned. The runner keeps no state of its own between runs
 * and may be shared by concurrent callers.</p>
 */
public final class SessionRunner implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(SessionRunner.class);

    public static final int HISTORY_TURNS = 10;
    public static final int SHORT_TERM_MEMORIES = 3;
    public static final int LONG_TERM_MEMORIES = 5;

    private static final AtomicInteger THREAD_IDS = new AtomicInteger();

    private final SessionStore sessionStore;
    private final MemoryStore memoryStore;
    private final ModelInvoker modelInvoker;
    private final RunnerSettings settings;
    private final PayloadCodec codec;
    private final PromptAssembler promptAssembler;
    private final ExecutorService executor;

    public SessionRunner(SessionStore sessionStore, MemoryStore memoryStore, ModelInvoker modelInvoker, RunnerSettings settings) {
        this.sessionStore = sessionStore;
        this.memoryStore = memoryStore;
        this.modelInvoker = modelInvoker;
        this.settings = settings == null ? RunnerSettings.defaults() : settings;
        this.codec = new PayloadCodec();
        this.promptAssembler = new PromptAssembler(codec);
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "continuum-runner-" + THREAD_IDS.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public RunResponse run(RunRequest request) throws IOException {
        RunStage stage = RunStage.RESOLVE_SESSION;
        try {
            Session session = resolveSession(request);
            String userId = session != null && session.userId() != null ? session.userId() : request.userId();

            stage = RunStage.GATHER_CONTEXT;
            ContextSnapshot context = session == null ? ContextSnapshot.empty() : gatherContext(session.sessionId(), userId);

            stage = RunStage.BUILD_PROMPT;
            String prompt = promptAssembler.build(context, request.additionalContext(), request.prompt());

            stage = RunStage.INVOKE;
            String responseText = invoke(prompt);

            stage = RunStage.PERSIST;
            RunResponse response = session == null
                ? RunResponse.stateless(responseText)
                : persist(session.sessionId(), request, responseText, context);

            stage = RunStage.DONE;
            LOG.debug("Run complete: session_id={}, stage={}", session == null ? null : session.sessionId(), stage);
            return response;
        } catch (IOException | RuntimeException e) {
            LOG.warn("Run failed during {} ({} -> {}): {}", stage, stage, RunStage.FAILED, e.getMessage());
            throw e;
        }
    }

    /**
     * Completes the session, then drops its short-term memories that were meant to live only as long as it.
     */
    public Session closeSession(String sessionId) throws IOException {
        String id = Checks.requireText(sessionId, "sessionId");
        Session closed = sessionStore.setStatus(id, SessionStatus.COMPLETED);
        int expired = memoryStore.expireSessionScopedMemories(id);
        LOG.info("Session closed: session_id={}, expired_memories={}", id, expired);
        return closed;
    }

    private Session resolveSession(RunRequest request) throws IOException {
        if (request.sessionId() != null) {
            Session session = sessionStore.getSession(request.sessionId());
            if (session.status() != SessionStatus.ACTIVE) {
                throw new InvalidTransitionException(session.sessionId(), session.status(), SessionStatus.ACTIVE);
            }
            return session;
        }
        if (request.userId() != null) {
            return sessionStore.createSession(request.userId(), settings.agentName(), Map.of());
        }
        LOG.debug("No session or user on request, running stateless");
        return null;
    }

    private ContextSnapshot gatherContext(String sessionId, String userId) throws IOException {
        CompletableFuture<List<ConversationTurn>> history =
            async(() -> sessionStore.getHistory(sessionId, HISTORY_TURNS));
        CompletableFuture<List<ShortTermMemory>> shortTerm =
            async(() -> memoryStore.retrieveShortTermMemories(sessionId, SHORT_TERM_MEMORIES));
        CompletableFuture<List<LongTermMemory>> longTerm = userId == null
            ? CompletableFuture.completedFuture(List.of())
            : async(() -> memoryStore.retrieveLongTermMemories(userId, LONG_TERM_MEMORIES));

        try {
            CompletableFuture.allOf(history, shortTerm, longTerm).join();
        } catch (CompletionException e) {
            throw unwrap(e);
        }

        List<ConversationTurn> oldestFirst = new ArrayList<>(history.join());
        Collections.reverse(oldestFirst);
        return new ContextSnapshot(oldestFirst, longTerm.join(), shortTerm.join());
    }

    private String invoke(String prompt) {
        Future<String> future = executor.submit(() -> modelInvoker.invoke(prompt));
        long timeoutMs = settings.invokeTimeout().toMillis();
        try {
            String text = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            return text == null ? "" : text;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ModelInvocationException("Model " + modelInvoker.name() + " timed out after " + timeoutMs + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ModelInvocationException("Interrupted while waiting for model " + modelInvoker.name(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ModelInvocationException invocationError) {
                throw invocationError;
            }
            throw new ModelInvocationException("Model " + modelInvoker.name() + " failed: " + cause.getMessage(), cause);
        }
    }

    private RunResponse persist(String sessionId, RunRequest request, String responseText, ContextSnapshot context)
        throws IOException {
        Map<String, Object> userMetadata = new LinkedHashMap<>();
        userMetadata.put("context", request.additionalContext());
        TurnPair turns = sessionStore.appendTurnPair(sessionId, request.prompt(), userMetadata, responseText, Map.of());

        storeInteraction(sessionId, turns.user().turnNumber(), request.prompt(), responseText);

        LOG.info("Run persisted: session_id={}, turn={}", sessionId, turns.assistant().turnNumber());
        return new RunResponse(
            responseText,
            new SessionMetadata(sessionId, turns.assistant().turnNumber()),
            context.shortTerm().size(),
            context.longTerm().size()
        );
    }

    private void storeInteraction(String sessionId, int turnNumber, String prompt, String responseText) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("user_prompt", prompt);
        snapshot.put("assistant_response", responseText);
        snapshot.put("turn_number", turnNumber);
        try {
            memoryStore.storeShortTermMemory(
                sessionId,
                "turn_" + turnNumber,
                codec.encode(snapshot),
                ShortTermMemoryType.EVENT,
                settings.interactionTtlHours()
            );
        } catch (IOException | RuntimeException e) {
            LOG.warn("Interaction snapshot not stored for session_id={}, turn={}: {}", sessionId, turnNumber, e.getMessage());
        }
    }

    private <T> CompletableFuture<T> async(Callable<T> task) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return task.call();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    private static IOException unwrap(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof UncheckedIOException unchecked) {
            return unchecked.getCause();
        }
        if (cause instanceof RuntimeException runtime) {
            throw runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IOException("Failed to gather context", cause);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
