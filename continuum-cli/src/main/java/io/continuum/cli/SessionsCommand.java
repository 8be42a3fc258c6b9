package io.continuum.cli;

import io.continuum.core.session.Session;
import io.continuum.core.session.SessionStatus;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "sessions", description = "List a user's sessions, newest first")
public final class SessionsCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "User id")
    String userId;

    @Option(names = "--status", description = "Only sessions in this status: active, completed or archived")
    String status;

    @Option(names = {"-n", "--limit"}, defaultValue = "0", description = "Maximum sessions to list, 0 for all")
    int limit;

    public SessionsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            SessionStatus filter = status == null ? null : SessionStatus.fromValue(status);
            List<Session> sessions = context.sessionStore().listSessionsForUser(userId, filter, limit);
            if (sessions.isEmpty()) {
                System.out.println("No sessions for user " + userId);
                return 0;
            }
            for (Session session : sessions) {
                System.out.println(session.sessionId() + "  " + session.status().value() + "  " + session.agentName()
                    + "  created " + session.createdAt() + "  updated " + session.updatedAt());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Sessions command failed: " + e.getMessage());
            return 1;
        }
    }
}
