package io.continuum.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "purge", description = "Delete expired short-term memories now")
public final class PurgeCommand implements Callable<Integer> {
    private final CliContext context;

    public PurgeCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            int removed = context.memoryStore().purgeExpiredShortTermMemories();
            System.out.println("Purged " + removed + " expired short-term memories");
            return 0;
        } catch (Exception e) {
            System.err.println("Purge command failed: " + e.getMessage());
            return 1;
        }
    }
}
