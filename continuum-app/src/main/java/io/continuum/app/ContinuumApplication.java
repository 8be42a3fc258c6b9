package io.continuum.app;

import io.continuum.cli.ChatCommand;
import io.continuum.cli.CliContext;
import io.continuum.cli.CloseCommand;
import io.continuum.cli.ContinuumCliCommand;
import io.continuum.cli.HistoryCommand;
import io.continuum.cli.OnboardCommand;
import io.continuum.cli.PurgeCommand;
import io.continuum.cli.RememberCommand;
import io.continuum.cli.SessionsCommand;
import io.continuum.cli.StatusCommand;
import io.continuum.core.config.ConfigPaths;
import io.continuum.core.config.ConfigService;
import io.continuum.core.config.model.ContinuumConfig;
import io.continuum.core.config.model.ModelConfig;
import io.continuum.core.memory.InMemoryMemoryStore;
import io.continuum.core.memory.MemoryJanitor;
import io.continuum.core.memory.MemoryStore;
import io.continuum.core.memory.SqliteMemoryStore;
import io.continuum.core.provider.DisabledModelInvoker;
import io.continuum.core.provider.EchoModelInvoker;
import io.continuum.core.provider.ModelInvoker;
import io.continuum.core.provider.OpenAiCompatModelInvoker;
import io.continuum.core.runner.RunnerSettings;
import io.continuum.core.runner.SessionRunner;
import io.continuum.core.session.InMemorySessionStore;
import io.continuum.core.session.SessionStore;
import io.continuum.core.session.SqliteSessionStore;
import io.continuum.core.sqlite.SqliteDatabase;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class ContinuumApplication {
    private static final Logger LOG = LoggerFactory.getLogger(ContinuumApplication.class);

    private ContinuumApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        ContinuumConfig config = loadConfig(configService, configPath);
        Clock clock = Clock.systemUTC();

        SessionStore sessionStore = buildSessionStore(config, clock);
        MemoryStore memoryStore = buildMemoryStore(config, clock);
        ModelInvoker modelInvoker = buildModelInvoker(config.model());

        int exitCode;
        try (SessionRunner runner = new SessionRunner(sessionStore, memoryStore, modelInvoker, RunnerSettings.from(config));
             MemoryJanitor janitor = startJanitor(memoryStore, config)) {
            CliContext context = new CliContext(runner, sessionStore, memoryStore, configService, configPath);

            CommandLine commandLine = new CommandLine(new ContinuumCliCommand());
            commandLine.addSubcommand("chat", new ChatCommand(context));
            commandLine.addSubcommand("history", new HistoryCommand(context));
            commandLine.addSubcommand("sessions", new SessionsCommand(context));
            commandLine.addSubcommand("close", new CloseCommand(context));
            commandLine.addSubcommand("remember", new RememberCommand(context));
            commandLine.addSubcommand("purge", new PurgeCommand(context));
            commandLine.addSubcommand("onboard", new OnboardCommand(context));
            commandLine.addSubcommand("status", new StatusCommand(context));

            exitCode = commandLine.execute(args);
        }
        System.exit(exitCode);
    }

    private static ContinuumConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (Exception e) {
            LOG.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
            return ContinuumConfig.defaults();
        }
    }

    private static SessionStore buildSessionStore(ContinuumConfig config, Clock clock) {
        if (config.storage().inMemory()) {
            return new InMemorySessionStore(clock);
        }
        Path path = ConfigPaths.sessionsDb(config.storage().sessionsDb());
        try {
            return new SqliteSessionStore(new SqliteDatabase(path), clock);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to initialize SQLite session store at " + path, e);
        }
    }

    private static MemoryStore buildMemoryStore(ContinuumConfig config, Clock clock) {
        if (config.storage().inMemory()) {
            return new InMemoryMemoryStore(clock);
        }
        Path path = ConfigPaths.memoryDb(config.storage().memoryDb());
        try {
            return new SqliteMemoryStore(new SqliteDatabase(path), clock);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to initialize SQLite memory store at " + path, e);
        }
    }

    private static ModelInvoker buildModelInvoker(ModelConfig model) {
        if (model.echo()) {
            return new EchoModelInvoker("echo");
        }
        if (!model.configured()) {
            return new DisabledModelInvoker(model.provider(), "missing API key");
        }
        return new OpenAiCompatModelInvoker(
            model.provider(),
            model.apiKey(),
            model.apiBase(),
            model.model(),
            model.systemPrompt(),
            model.maxAttempts(),
            Duration.ofSeconds(Math.max(1, model.timeoutSeconds()))
        );
    }

    private static MemoryJanitor startJanitor(MemoryStore memoryStore, ContinuumConfig config) {
        int minutes = config.memory().purgeIntervalMinutes();
        if (minutes <= 0) {
            return null;
        }
        MemoryJanitor janitor = new MemoryJanitor(memoryStore, Duration.ofMinutes(minutes));
        janitor.start();
        return janitor;
    }
}
