package io.continuum.cli;

import io.continuum.core.session.Session;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "close", description = "Mark a session completed and drop its session-scoped memories")
public final class CloseCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Session id")
    String sessionId;

    public CloseCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Session session = context.runner().closeSession(sessionId);
            System.out.println("Session " + session.sessionId() + " is " + session.status().value());
            return 0;
        } catch (Exception e) {
            System.err.println("Close command failed: " + e.getMessage());
            return 1;
        }
    }
}
