package io.continuum.cli;

import io.continuum.core.config.ConfigService;
import io.continuum.core.memory.MemoryStore;
import io.continuum.core.runner.SessionRunner;
import io.continuum.core.session.SessionStore;
import java.nio.file.Path;

public record CliContext(
    SessionRunner runner,
    SessionStore sessionStore,
    MemoryStore memoryStore,
    ConfigService configService,
    Path configPath
) {
}
