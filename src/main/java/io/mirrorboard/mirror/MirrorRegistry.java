package io.mirrorboard.mirror;

import io.mirrorboard.config.RepositoryConfig;
import io.mirrorboard.error.MirrorException;
import io.mirrorboard.error.ValidationException;
import io.mirrorboard.model.Message;
import io.mirrorboard.model.MessageOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Ordered set of mirrors. Registration order picks the default write target (the first one) and
 * the concatenation order of a merged read; it does not affect the final timestamp order.
 *
 * <p>Reads fan out one task per mirror on the shared executor and join all of them. Each shard's
 * deadline runs from the moment its task starts, so time spent queued behind other work does not
 * count. A shard that fails or misses its deadline contributes nothing; a late one is cancelled
 * with an interrupt so it stops occupying a pool thread.
 */
public final class MirrorRegistry {
    private static final Logger log = LoggerFactory.getLogger(MirrorRegistry.class);
    private static final long QUEUED_POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(25);

    private final MirrorClientFactory factory;
    private final ExecutorService executor;
    private final Duration shardTimeout;
    private final List<MirrorClient> clients = new CopyOnWriteArrayList<>();

    public MirrorRegistry(MirrorClientFactory factory, ExecutorService executor, Duration shardTimeout) {
        this.factory = factory;
        this.executor = executor;
        this.shardTimeout = shardTimeout;
    }

    public MirrorClient add(RepositoryConfig config) {
        return add(factory.create(config));
    }

    public MirrorClient add(MirrorClient client) {
        clients.add(client);
        return client;
    }

    public boolean isEmpty() {
        return clients.isEmpty();
    }

    public List<RepositoryConfig> repositories() {
        List<RepositoryConfig> out = new ArrayList<>();
        for (MirrorClient client : clients) {
            out.add(client.config());
        }
        return out;
    }

    public Optional<RepositoryConfig> defaultTarget() {
        return clients.isEmpty() ? Optional.empty() : Optional.of(clients.get(0).config());
    }

    /**
     * Picks the mirror for a write: an explicit {@code owner/name}, or the default when blank.
     */
    public MirrorClient resolve(String target) {
        if (clients.isEmpty()) {
            throw new ValidationException(target == null || target.isBlank()
                    ? "No mirror repositories configured"
                    : "Unknown repository: " + target);
        }
        if (target == null || target.isBlank()) {
            return clients.get(0);
        }
        for (MirrorClient client : clients) {
            if (client.config().matches(target)) {
                return client;
            }
        }
        throw new ValidationException("Unknown repository: " + target);
    }

    /**
     * Commit log of the resolved mirror, for mirrors whose backend exposes one.
     */
    public CommitHistory commitHistory(String target) {
        MirrorClient client = resolve(target);
        if (client instanceof CommitHistory history) {
            return history;
        }
        throw new ValidationException("Mirror " + client.source() + " does not expose a commit log");
    }

    public WriteOutcome write(String content, String author, String target) throws MirrorException {
        MirrorClient client = resolve(target);
        String reference = client.store(content, author);
        if (reference == null || reference.isBlank()) {
            throw new MirrorException("Mirror " + client.source() + " returned no reference for the written message");
        }
        return new WriteOutcome(reference, client.config());
    }

    public List<Message> fetchAll(int limit) {
        return fetchAllDetailed(limit).messages();
    }

    public FetchOutcome fetchAllDetailed(int limit) {
        return startFetch(limit).join();
    }

    /**
     * Submits one fetch per mirror and returns without waiting, so the caller can do its own work
     * before {@link PendingFetch#join() joining}.
     */
    public PendingFetch startFetch(int limit) {
        if (limit <= 0) {
            throw new ValidationException("limit must be a positive integer, got " + limit);
        }
        List<Shard> shards = new ArrayList<>();
        try {
            for (MirrorClient client : List.copyOf(clients)) {
                Shard shard = new Shard(client, limit);
                shards.add(shard);
                shard.future = executor.submit(shard);
            }
        } catch (RuntimeException e) {
            for (Shard shard : shards) {
                shard.cancel();
            }
            throw e;
        }
        return new PendingFetch(shards, limit);
    }

    /**
     * Bootstraps every mirror and reports each result; one failure does not stop the others.
     */
    public List<ShardReport> ensureAllReady() {
        List<ShardReport> out = new ArrayList<>();
        for (MirrorClient client : clients) {
            try {
                client.ensureReady();
                out.add(ShardReport.ok(client.source(), 0));
            } catch (MirrorException e) {
                log.warn("Mirror {} is not ready: {}", client.source(), e.getMessage());
                out.add(ShardReport.failed(client.source(), e.getMessage()));
            }
        }
        return out;
    }

    /**
     * Fetches submitted by {@link #startFetch(int)}, in registration order.
     */
    public final class PendingFetch {
        private final List<Shard> shards;
        private final int limit;

        private PendingFetch(List<Shard> shards, int limit) {
            this.shards = shards;
            this.limit = limit;
        }

        public FetchOutcome join() {
            List<Message> merged = new ArrayList<>();
            List<ShardReport> reports = new ArrayList<>(shards.size());
            boolean interrupted = false;
            for (Shard shard : shards) {
                String source = shard.client.source();
                if (interrupted) {
                    shard.cancel();
                    reports.add(ShardReport.failed(source, "interrupted"));
                    continue;
                }
                try {
                    List<Message> result = await(shard);
                    merged.addAll(result);
                    reports.add(ShardReport.ok(source, result.size()));
                } catch (TimeoutException e) {
                    shard.cancel();
                    log.warn("Mirror {} did not answer within {} ms, dropping its shard",
                            source, shardTimeout.toMillis());
                    reports.add(ShardReport.failed(source, "timeout"));
                } catch (CancellationException e) {
                    log.warn("Mirror {} fetch was cancelled, dropping its shard", source);
                    reports.add(ShardReport.failed(source, "cancelled"));
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    log.warn("Mirror {} failed, dropping its shard: {}", source, cause.getMessage());
                    reports.add(ShardReport.failed(source, String.valueOf(cause.getMessage())));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    interrupted = true;
                    shard.cancel();
                    reports.add(ShardReport.failed(source, "interrupted"));
                }
            }
            return new FetchOutcome(MessageOrder.newestFirst(merged, limit), reports);
        }

        /**
         * Abandons every shard that has not finished yet.
         */
        public void cancel() {
            for (Shard shard : shards) {
                shard.cancel();
            }
        }
    }

    // A queued shard is only waited on while the pool is alive; its deadline starts once it runs.
    private List<Message> await(Shard shard) throws ExecutionException, InterruptedException, TimeoutException {
        long timeoutNanos = shardTimeout.toNanos();
        while (true) {
            boolean started = shard.started;
            long wait;
            if (started) {
                wait = Math.max(0L, shard.startedAt + timeoutNanos - System.nanoTime());
            } else if (executor.isShutdown()) {
                shard.cancel();
                throw new CancellationException("executor shut down");
            } else {
                wait = QUEUED_POLL_NANOS;
            }
            try {
                return shard.future.get(wait, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                if (started) {
                    throw e;
                }
            }
        }
    }

    private static final class Shard implements Callable<List<Message>> {
        private final MirrorClient client;
        private final int limit;
        private volatile Future<List<Message>> future;
        private volatile long startedAt;
        private volatile boolean started;

        private Shard(MirrorClient client, int limit) {
            this.client = client;
            this.limit = limit;
        }

        @Override
        public List<Message> call() throws MirrorException {
            startedAt = System.nanoTime();
            started = true;
            return client.fetch(limit);
        }

        private void cancel() {
            Future<List<Message>> f = future;
            if (f != null) {
                f.cancel(true);
            }
        }
    }

    public record WriteOutcome(String reference, RepositoryConfig repository) {
    }

    public record FetchOutcome(List<Message> messages, List<ShardReport> shards) {
    }

    public record ShardReport(String source, boolean ok, int messages, String error) {
        static ShardReport ok(String source, int messages) {
            return new ShardReport(source, true, messages, null);
        }

        static ShardReport failed(String source, String error) {
            return new ShardReport(source, false, 0, error);
        }
    }
}
