package io.continuum.cli;

import io.continuum.core.config.ConfigPaths;
import io.continuum.core.config.model.ContinuumConfig;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show storage and configuration status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ContinuumConfig config = context.configService().load(context.configPath());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Storage backend: " + config.storage().backend());
            if (!config.storage().inMemory()) {
                System.out.println("Sessions database: " + ConfigPaths.sessionsDb(config.storage().sessionsDb()));
                System.out.println("Memory database: " + ConfigPaths.memoryDb(config.storage().memoryDb()));
            }
            System.out.println("Agent name: " + config.runner().agentName());
            System.out.println("Model: " + config.model().provider() + " / " + config.model().model());
            System.out.println("Model configured: " + config.model().configured());
            System.out.println("Interaction TTL hours: " + config.memory().interactionTtlHours());
            System.out.println("Purge interval minutes: " + config.memory().purgeIntervalMinutes());
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
