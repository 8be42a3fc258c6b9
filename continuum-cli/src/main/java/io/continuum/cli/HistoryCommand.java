package io.continuum.cli;

import io.continuum.core.session.ConversationTurn;
import io.continuum.core.session.Session;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "history", description = "Print the latest turns of a session, oldest first")
public final class HistoryCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Session id")
    String sessionId;

    @Option(names = {"-n", "--limit"}, defaultValue = "20", description = "Number of turns (default: ${DEFAULT-VALUE})")
    int limit;

    public HistoryCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Session session = context.sessionStore().getSession(sessionId);
            List<ConversationTurn> turns = new ArrayList<>(context.sessionStore().getHistory(sessionId, limit));
            Collections.reverse(turns);
            System.out.println("Session " + session.sessionId() + " (" + session.status().value() + ", agent "
                + session.agentName() + ")");
            for (ConversationTurn turn : turns) {
                System.out.println("#" + turn.turnNumber() + " " + turn.role().label() + ": " + turn.content());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("History command failed: " + e.getMessage());
            return 1;
        }
    }
}
