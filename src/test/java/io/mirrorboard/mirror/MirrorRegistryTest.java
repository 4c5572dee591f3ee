package io.mirrorboard.mirror;

import io.mirrorboard.config.RepositoryConfig;
import io.mirrorboard.error.MirrorException;
import io.mirrorboard.error.ValidationException;
import io.mirrorboard.model.Message;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

final class MirrorRegistryTest {
    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    @Test
    void firstRegisteredRepositoryIsTheDefaultTarget() {
        MirrorRegistry registry = registry(Duration.ofSeconds(5));
        Assertions.assertTrue(registry.defaultTarget().isEmpty());

        registry.add(RepositoryConfig.parse("octo/first"));
        registry.add(RepositoryConfig.parse("octo/second@dev:board"));

        Assertions.assertEquals("octo/first", registry.defaultTarget().orElseThrow().fullName());
        Assertions.assertEquals("octo/first", registry.resolve(null).source());
        Assertions.assertEquals("octo/first", registry.resolve(" ").source());
        Assertions.assertEquals("octo/second", registry.resolve("OCTO/Second").source());
        Assertions.assertEquals(List.of("octo/first", "octo/second"),
                registry.repositories().stream().map(RepositoryConfig::fullName).toList());
    }

    @Test
    void resolveRejectsUnknownTargetsAndEmptyRegistry() {
        MirrorRegistry registry = registry(Duration.ofSeconds(5));
        Assertions.assertThrows(ValidationException.class, () -> registry.resolve(null));
        Assertions.assertThrows(ValidationException.class, () -> registry.write("x", "y", null));

        registry.add(new StubMirrorClient("octo/board"));
        Assertions.assertThrows(ValidationException.class, () -> registry.resolve("octo/other"));
    }

    @Test
    void writeGoesToTheResolvedMirrorOnly() throws Exception {
        MirrorRegistry registry = registry(Duration.ofSeconds(5));
        StubMirrorClient first = new StubMirrorClient("octo/first");
        StubMirrorClient second = new StubMirrorClient("octo/second");
        registry.add(first);
        registry.add(second);

        MirrorRegistry.WriteOutcome outcome = registry.write("hello", "alice", "octo/second");

        Assertions.assertEquals(StubMirrorClient.referenceFor("octo/second", 1), outcome.reference());
        Assertions.assertEquals("octo/second", outcome.repository().fullName());
        Assertions.assertEquals(0, first.writes());
        Assertions.assertEquals(1, second.writes());
    }

    @Test
    void writeFailureIsPropagatedWithoutFallback() {
        MirrorRegistry registry = registry(Duration.ofSeconds(5));
        StubMirrorClient broken = new StubMirrorClient("octo/broken").failWith(new MirrorException("down", 503));
        StubMirrorClient healthy = new StubMirrorClient("octo/healthy");
        registry.add(broken);
        registry.add(healthy);

        MirrorException error = Assertions.assertThrows(MirrorException.class, () -> registry.write("x", "y", null));
        Assertions.assertEquals(503, error.status());
        Assertions.assertEquals(0, healthy.writes());
    }

    @Test
    void fetchAllMergesShardsNewestFirstAndTruncates() {
        MirrorRegistry registry = registry(Duration.ofSeconds(5));
        registry.add(new StubMirrorClient("octo/a")
                .seed("a1", "x", "2026-10-19T10:00:00.000000Z", null)
                .seed("a2", "x", "2026-10-19T12:00:00.000000Z", null));
        registry.add(new StubMirrorClient("octo/b")
                .seed("b1", "x", "2026-10-19T11:00:00.000000Z", null)
                .seed("b2", "x", "2026-10-19T13:00:00+00:00", null));

        List<Message> all = registry.fetchAll(10);
        Assertions.assertEquals(List.of("b2", "a2", "b1", "a1"), all.stream().map(Message::content).toList());
        Assertions.assertEquals(List.of("b2", "a2"), registry.fetchAll(2).stream().map(Message::content).toList());
        Assertions.assertThrows(ValidationException.class, () -> registry.fetchAll(0));
    }

    @Test
    void equalTimestampsKeepRegistrationOrder() {
        MirrorRegistry registry = registry(Duration.ofSeconds(5));
        registry.add(new StubMirrorClient("octo/a").seed("from a", "x", "2026-10-19T10:00:00.000000Z", null));
        registry.add(new StubMirrorClient("octo/b").seed("from b", "x", "2026-10-19T10:00:00.000000Z", null));

        Assertions.assertEquals(List.of("from a", "from b"),
                registry.fetchAll(10).stream().map(Message::content).toList());
    }

    @Test
    void failingShardIsOmittedAndReported() {
        MirrorRegistry registry = registry(Duration.ofSeconds(5));
        registry.add(new StubMirrorClient("octo/broken").failWith(new MirrorException("boom", 500)));
        registry.add(new StubMirrorClient("octo/ok").seed("kept", "x", "2026-10-19T10:00:00.000000Z", null));

        MirrorRegistry.FetchOutcome outcome = registry.fetchAllDetailed(10);

        Assertions.assertEquals(List.of("kept"), outcome.messages().stream().map(Message::content).toList());
        Assertions.assertEquals(2, outcome.shards().size());
        Assertions.assertFalse(outcome.shards().get(0).ok());
        Assertions.assertEquals("boom", outcome.shards().get(0).error());
        Assertions.assertTrue(outcome.shards().get(1).ok());
        Assertions.assertEquals(1, outcome.shards().get(1).messages());
    }

    @Test
    void slowShardTimesOutWithoutHoldingBackTheOthers() {
        MirrorRegistry registry = registry(Duration.ofMillis(200));
        registry.add(new StubMirrorClient("octo/slow")
                .fetchDelay(3_000)
                .seed("late", "x", "2026-10-19T23:00:00.000000Z", null));
        registry.add(new StubMirrorClient("octo/fast").seed("fast", "x", "2026-10-19T10:00:00.000000Z", null));

        long started = System.nanoTime();
        MirrorRegistry.FetchOutcome outcome = registry.fetchAllDetailed(10);
        long elapsedMs = (System.nanoTime() - started) / 1_000_000L;

        Assertions.assertEquals(List.of("fast"), outcome.messages().stream().map(Message::content).toList());
        Assertions.assertEquals("timeout", outcome.shards().get(0).error());
        Assertions.assertTrue(elapsedMs < 2_000, "merged read waited " + elapsedMs + " ms");
    }

    @Test
    void timedOutShardIsInterruptedAndFreesItsThread() throws Exception {
        MirrorRegistry registry = registry(Duration.ofMillis(150));
        StubMirrorClient slow = new StubMirrorClient("octo/slow").fetchDelay(5_000);
        registry.add(slow);

        Assertions.assertEquals("timeout", registry.fetchAllDetailed(10).shards().get(0).error());

        long deadline = System.currentTimeMillis() + 2_000;
        while (slow.interruptedFetches() == 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        Assertions.assertEquals(1, slow.interruptedFetches());
    }

    @Test
    void queuedShardGetsItsFullDeadlineOnceItRuns() {
        ExecutorService single = Executors.newSingleThreadExecutor();
        try {
            MirrorRegistry registry = new MirrorRegistry(
                    config -> new StubMirrorClient(config.fullName()), single, Duration.ofMillis(600));
            registry.add(new StubMirrorClient("octo/first").fetchDelay(400)
                    .seed("first", "x", "2026-10-19T10:00:00.000000Z", null));
            registry.add(new StubMirrorClient("octo/second").fetchDelay(400)
                    .seed("second", "x", "2026-10-19T11:00:00.000000Z", null));

            MirrorRegistry.FetchOutcome outcome = registry.fetchAllDetailed(10);

            Assertions.assertTrue(outcome.shards().get(0).ok());
            Assertions.assertTrue(outcome.shards().get(1).ok(), "queued shard: " + outcome.shards().get(1).error());
            Assertions.assertEquals(List.of("second", "first"),
                    outcome.messages().stream().map(Message::content).toList());
        } finally {
            single.shutdownNow();
        }
    }

    @Test
    void pendingFetchCanBeCancelled() throws Exception {
        MirrorRegistry registry = registry(Duration.ofSeconds(5));
        StubMirrorClient slow = new StubMirrorClient("octo/slow").fetchDelay(5_000);
        registry.add(slow);

        MirrorRegistry.PendingFetch pending = registry.startFetch(10);
        Thread.sleep(100);
        pending.cancel();

        MirrorRegistry.FetchOutcome outcome = pending.join();
        Assertions.assertFalse(outcome.shards().get(0).ok());
        Assertions.assertTrue(outcome.messages().isEmpty());
    }

    @Test
    void ensureAllReadyReportsEachMirror() {
        MirrorRegistry registry = registry(Duration.ofSeconds(5));
        registry.add(new StubMirrorClient("octo/ok"));
        registry.add(new StubMirrorClient("octo/broken").failWith(new MirrorException("missing", 404)));

        List<MirrorRegistry.ShardReport> reports = registry.ensureAllReady();

        Assertions.assertTrue(reports.get(0).ok());
        Assertions.assertFalse(reports.get(1).ok());
        Assertions.assertEquals("octo/broken", reports.get(1).source());
    }

    @Test
    void addBuildsClientsThroughTheFactory() {
        MirrorRegistry registry = new MirrorRegistry(
                config -> new StubMirrorClient(config.fullName()), executor, Duration.ofSeconds(5));

        MirrorClient client = registry.add(RepositoryConfig.parse("octo/board@dev:notes"));

        Assertions.assertInstanceOf(StubMirrorClient.class, client);
        Assertions.assertFalse(registry.isEmpty());
    }

    private MirrorRegistry registry(Duration shardTimeout) {
        return new MirrorRegistry(config -> new StubMirrorClient(config.fullName()), executor, shardTimeout);
    }
}
