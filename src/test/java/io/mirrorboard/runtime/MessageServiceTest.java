package io.mirrorboard.runtime;

import io.mirrorboard.config.BoardConfig;
import io.mirrorboard.error.MirrorException;
import io.mirrorboard.error.ValidationException;
import io.mirrorboard.mirror.MirrorRegistry;
import io.mirrorboard.mirror.StubMirrorClient;
import io.mirrorboard.model.Message;
import io.mirrorboard.observability.AuditLogger;
import io.mirrorboard.storage.Database;
import io.mirrorboard.storage.MessageStore;
import io.mirrorboard.util.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static io.mirrorboard.util.TestFiles.deleteRecursively;

final class MessageServiceTest {
    private static final Instant T0 = Instant.parse("2026-10-19T12:00:00Z");

    private Path root;
    private ExecutorService executor;
    private MutableClock clock;
    private MessageStore store;
    private MirrorRegistry registry;
    private AuditLogger auditLogger;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("mirrorboard-test-service-");
        BoardConfig config = BoardConfig.fromRoot(root.toString());
        executor = Executors.newFixedThreadPool(4);
        clock = new MutableClock(T0);
        store = new MessageStore(new Database(config), clock);
        store.init();
        registry = new MirrorRegistry(c -> new StubMirrorClient(c.fullName()), executor, Duration.ofSeconds(5));
        auditLogger = new AuditLogger(config.auditFile());
    }

    @AfterEach
    void tearDown() throws Exception {
        executor.shutdownNow();
        deleteRecursively(root);
    }

    @Test
    void postWithoutMirrorsStaysLocal() {
        MessageService service = service(true);

        MessageService.PostOutcome outcome = service.post("hello", "Bob", null);

        Assertions.assertEquals(1L, outcome.message().id());
        Assertions.assertNull(outcome.mirroredTo());
        Assertions.assertNull(outcome.mirrorError());
        Assertions.assertFalse(outcome.mirrored());
        Assertions.assertEquals(List.of("hello"), service.read(10).stream().map(Message::content).toList());
    }

    @Test
    void mirrorFailureLeavesTheLocalRowWithoutReference() throws Exception {
        registry.add(new StubMirrorClient("octo/board").failWith(new MirrorException("Bad credentials", 401)));
        MessageService service = service(true);

        MessageService.PostOutcome outcome = service.post("x", "A", null);

        Assertions.assertEquals("octo/board", outcome.mirroredTo());
        Assertions.assertEquals("Bad credentials", outcome.mirrorError());
        Message local = store.list(10).get(0);
        Assertions.assertEquals("x", local.content());
        Assertions.assertNull(local.remoteReference());
        String audit = Files.readString(root.resolve("audit").resolve("audit.log"), StandardCharsets.UTF_8);
        Assertions.assertTrue(audit.contains("\"mirror.write\""));
        Assertions.assertTrue(audit.contains("\"failed\""));
        Assertions.assertTrue(auditLogger.verify().valid());
    }

    @Test
    void successfulMirrorRecordsTheReferenceOnTheRow() {
        StubMirrorClient mirror = new StubMirrorClient("octo/board");
        registry.add(mirror);
        MessageService service = service(true);

        MessageService.PostOutcome outcome = service.post("mirrored", "alice", null);

        String expected = StubMirrorClient.referenceFor("octo/board", 1);
        Assertions.assertTrue(outcome.mirrored());
        Assertions.assertEquals("octo/board", outcome.mirroredTo());
        Assertions.assertEquals(expected, outcome.message().remoteReference());
        Assertions.assertEquals(expected, store.get(outcome.message().id()).orElseThrow().remoteReference());
        Assertions.assertEquals(1, mirror.writes());
    }

    @Test
    void unknownRepositoryIsRejectedBeforeAnyWrite() {
        registry.add(new StubMirrorClient("octo/board"));
        MessageService service = service(true);

        Assertions.assertThrows(ValidationException.class, () -> service.post("x", "A", "octo/missing"));
        Assertions.assertEquals(0L, store.count());
    }

    @Test
    void explicitRepositoryWithoutMirrorsIsRejected() {
        MessageService service = service(true);

        Assertions.assertThrows(ValidationException.class, () -> service.post("x", "A", "octo/board"));
        Assertions.assertEquals(0L, store.count());
    }

    @Test
    void blankContentIsRejected() {
        registry.add(new StubMirrorClient("octo/board"));
        MessageService service = service(true);

        Assertions.assertThrows(ValidationException.class, () -> service.post("  ", "A", null));
        Assertions.assertEquals(0L, store.count());
    }

    @Test
    void failingMirrorIsOmittedFromMergedRead() {
        registry.add(new StubMirrorClient("octo/a").failWith(new MirrorException("down", 502)));
        registry.add(new StubMirrorClient("octo/b")
                .seed("older", "x", "2026-10-18T09:00:00.000000Z", null)
                .seed("newer", "y", "2026-10-19T09:00:00.000000Z", null));
        MessageService service = service(true);

        MessageService.FeedOutcome feed = service.readDetailed(10);

        Assertions.assertEquals(List.of("newer", "older"), feed.messages().stream().map(Message::content).toList());
        Assertions.assertTrue(feed.messages().stream().allMatch(m -> "octo/b".equals(m.source())));
        Assertions.assertEquals(0, feed.localCount());
        Assertions.assertFalse(feed.shards().get(0).ok());
    }

    @Test
    void mergedReadInterleavesSourcesByTimestampAndTruncates() {
        registry.add(new StubMirrorClient("octo/board")
                .seed("remote-early", "r", "2026-10-19T11:00:00.000000Z", null)
                .seed("remote-late", "r", "2026-10-19T13:00:00.000000Z", null));
        MessageService service = service(true);
        clock.set(Instant.parse("2026-10-19T12:00:00Z"));
        store.store("local-mid", "l");

        List<Message> all = service.read(10);
        Assertions.assertEquals(List.of("remote-late", "local-mid", "remote-early"),
                all.stream().map(Message::content).toList());
        Assertions.assertEquals(List.of("remote-late", "local-mid"),
                service.read(2).stream().map(Message::content).toList());
        Assertions.assertThrows(ValidationException.class, () -> service.read(0));
    }

    @Test
    void mirroredCopyOfALocalRowIsDroppedWhenDedupeIsOn() {
        StubMirrorClient mirror = new StubMirrorClient("octo/board").stampWrites("2026-10-19T12:00:00.000001Z");
        registry.add(mirror);
        MessageService service = service(true);
        service.post("posted once", "alice", null);

        MessageService.FeedOutcome feed = service.readDetailed(10);

        Assertions.assertEquals(1, feed.messages().size());
        Assertions.assertEquals(Message.LOCAL_SOURCE, feed.messages().get(0).source());
        Assertions.assertEquals(1, feed.duplicatesDropped());
    }

    @Test
    void mirroredCopyIsKeptWhenDedupeIsOff() {
        StubMirrorClient mirror = new StubMirrorClient("octo/board").stampWrites("2026-10-19T12:00:00.000001Z");
        registry.add(mirror);
        MessageService service = service(false);
        service.post("posted once", "alice", null);

        List<Message> feed = service.read(10);

        Assertions.assertEquals(List.of("octo/board", Message.LOCAL_SOURCE), feed.stream().map(Message::source).toList());
        Assertions.assertEquals(feed.get(0).remoteReference(), feed.get(1).remoteReference());
    }

    @Test
    void parseLimitDefaultsAndValidates() {
        Assertions.assertEquals(BoardConfig.DEFAULT_LIST_LIMIT, MessageService.parseLimit(null));
        Assertions.assertEquals(BoardConfig.DEFAULT_LIST_LIMIT, MessageService.parseLimit(""));
        Assertions.assertEquals(5, MessageService.parseLimit(" 5 "));
        Assertions.assertThrows(ValidationException.class, () -> MessageService.parseLimit("abc"));
        Assertions.assertThrows(ValidationException.class, () -> MessageService.parseLimit("0"));
        Assertions.assertThrows(ValidationException.class, () -> MessageService.parseLimit("-3"));
    }

    private MessageService service(boolean dedupe) {
        return new MessageService(store, registry, auditLogger, dedupe);
    }
}
