package io.continuum.core.config;

import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path homeDir() {
        return Path.of(System.getProperty("user.home"), ".continuum");
    }

    public static Path defaultConfigPath() {
        return homeDir().resolve("config.json");
    }

    public static Path resolve(String rawPath, Path fallback) {
        if (rawPath == null || rawPath.isBlank()) {
            return fallback;
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }

    public static Path sessionsDb(String rawPath) {
        return resolve(rawPath, homeDir().resolve("data").resolve("sessions.db"));
    }

    public static Path memoryDb(String rawPath) {
        return resolve(rawPath, homeDir().resolve("data").resolve("memory.db"));
    }
}
