package io.continuum.cli;

import io.continuum.core.memory.LongTermMemoryType;
import io.continuum.core.time.Ttl;
import java.time.Duration;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "remember", description = "Store a long-term memory for a user")
public final class RememberCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "User id")
    String userId;

    @Parameters(index = "1", description = "Memory key")
    String key;

    @Parameters(index = "2", description = "Memory value")
    String value;

    @Option(names = {"-t", "--type"}, defaultValue = "fact", description = "fact, preference, skill or other")
    String type;

    @Option(names = {"-i", "--importance"}, defaultValue = "0.5", description = "Importance in [0, 1]")
    double importance;

    @Option(names = "--ttl-hours", description = "Hide the memory after this many hours")
    Double ttlHours;

    @Option(names = {"-s", "--session"}, description = "Session the memory came from")
    String sessionId;

    public RememberCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Duration ttl = ttlHours == null ? null : Ttl.ofHours(ttlHours);
            String memoryId = context.memoryStore().storeLongTermMemory(
                userId, sessionId, key, value, LongTermMemoryType.fromValue(type), importance, ttl
            );
            System.out.println("Stored memory " + memoryId);
            return 0;
        } catch (Exception e) {
            System.err.println("Remember command failed: " + e.getMessage());
            return 1;
        }
    }
}
