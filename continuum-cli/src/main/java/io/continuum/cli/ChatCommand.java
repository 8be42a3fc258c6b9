package io.continuum.cli;

import io.continuum.core.runner.RunRequest;
import io.continuum.core.runner.RunResponse;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "chat", description = "Send a prompt, continuing a session or starting one for a user")
public final class ChatCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Prompt to send")
    String prompt;

    @Option(names = {"-s", "--session"}, description = "Session to continue")
    String sessionId;

    @Option(names = {"-u", "--user"}, description = "User to start a new session for")
    String userId;

    @Option(names = {"-c", "--context"}, description = "Additional context as key=value, repeatable")
    Map<String, String> additionalContext = new LinkedHashMap<>();

    public ChatCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            RunResponse response = context.runner().run(
                new RunRequest(prompt, sessionId, userId, new LinkedHashMap<>(additionalContext))
            );
            System.out.println(response.responseText());
            response.session().ifPresent(session -> System.out.println(
                "[session " + session.sessionId() + ", turn " + session.turnNumber()
                    + ", memories " + response.longTermMemoriesUsed() + " long-term / "
                    + response.shortTermMemoriesUsed() + " short-term]"
            ));
            return 0;
        } catch (Exception e) {
            System.err.println("Chat command failed: " + e.getMessage());
            return 1;
        }
    }
}
