package io.mirrorboard.runtime;

import io.mirrorboard.config.BoardConfig;
import io.mirrorboard.config.BoardSettings;
import io.mirrorboard.config.RepositoryConfig;
import io.mirrorboard.mirror.ContentsApiMirrorClient;
import io.mirrorboard.mirror.MirrorClientFactory;
import io.mirrorboard.mirror.MirrorRegistry;
import io.mirrorboard.observability.AuditLogger;
import io.mirrorboard.storage.Database;
import io.mirrorboard.storage.MessageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the board together for one data root and owns the long-lived I/O pool every request
 * submits its fan-out work into. Close it on shutdown.
 */
public final class BoardRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BoardRuntime.class);
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);
    // CallerRunsPolicy silently drops tasks once the pool is shut down, leaving their futures unfinished.
    private static final RejectedExecutionHandler CALLER_RUNS_UNTIL_CLOSED = (task, pool) -> {
        if (pool.isShutdown()) {
            throw new RejectedExecutionException("Board runtime is closed");
        }
        task.run();
    };

    private final BoardConfig config;
    private final BoardSettings settings;
    private final Database database;
    private final MessageStore store;
    private final ThreadPoolExecutor executor;
    private final MirrorRegistry registry;
    private final AuditLogger auditLogger;
    private final MessageService messageService;

    public BoardRuntime(BoardConfig config, BoardSettings settings) {
        this(config, settings, Clock.systemUTC(), null);
    }

    /**
     * @param mirrorFactory builds the client for each configured repository; {@code null} selects the contents API client
     */
    public BoardRuntime(BoardConfig config, BoardSettings settings, Clock clock, MirrorClientFactory mirrorFactory) {
        this.config = config;
        this.settings = settings;
        this.database = new Database(config);
        this.store = new MessageStore(database, clock);
        this.executor = new ThreadPoolExecutor(
                settings.threads(),
                settings.threads(),
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(BoardConfig.DEFAULT_QUEUE_CAPACITY),
                daemonThreads("mirrorboard-io-"),
                CALLER_RUNS_UNTIL_CLOSED
        );
        MirrorClientFactory factory = mirrorFactory != null
                ? mirrorFactory
                : ContentsApiMirrorClient.factory(settings, HttpClient.newBuilder()
                        .connectTimeout(Duration.ofSeconds(10))
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build(), clock);
        this.registry = new MirrorRegistry(factory, executor, settings.fetchTimeout());
        for (RepositoryConfig repo : settings.repositories()) {
            registry.add(repo);
        }
        this.auditLogger = new AuditLogger(config.auditFile());
        this.messageService = new MessageService(store, registry, auditLogger, settings.dedupeMirrored());
    }

    public void init() {
        store.init();
        if (registry.isEmpty()) {
            log.info("No mirror repositories configured, messages stay local");
        } else if (!settings.hasToken()) {
            log.warn("No {} set; mirror writes to {} will likely be rejected", BoardSettings.ENV_TOKEN, registry.repositories());
        }
    }

    public BoardConfig config() {
        return config;
    }

    public BoardSettings settings() {
        return settings;
    }

    public MessageStore store() {
        return store;
    }

    public MirrorRegistry registry() {
        return registry;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public MessageService messages() {
        return messageService;
    }

    public StatsOutcome stats() {
        List<String> repos = registry.repositories().stream().map(RepositoryConfig::toString).toList();
        return new StatsOutcome(
                config.rootDir().toString(),
                config.dbFile().toString(),
                store.count(),
                store.countMirrored(),
                repos,
                registry.defaultTarget().map(RepositoryConfig::fullName).orElse(null),
                database.listSchemaMigrations().size()
        );
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public record StatsOutcome(
            String root,
            String dbFile,
            long messages,
            long mirroredMessages,
            List<String> repositories,
            String defaultRepository,
            int schemaMigrations
    ) {
    }
}
