package io.mirrorboard.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Where the board keeps its files. Everything lives under one data root.
 */
public final class BoardConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final int DEFAULT_LIST_LIMIT = 100;
    public static final int DEFAULT_SERVER_PORT = 8000;
    public static final long DEFAULT_FETCH_TIMEOUT_MS = 10_000L;
    public static final int DEFAULT_THREAD_POOL_SIZE = 4;
    public static final int DEFAULT_QUEUE_CAPACITY = 100;
    public static final long DEFAULT_BUSY_TIMEOUT_MS = 5_000L;

    private final Path rootDir;

    public BoardConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static BoardConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new BoardConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("board.db");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path settingsFile() {
        return rootDir.resolve("board-settings.json");
    }
}
