package io.mirrorboard.cli;

import com.sun.net.httpserver.HttpServer;
import io.mirrorboard.config.BoardConfig;
import io.mirrorboard.config.BoardSettings;
import io.mirrorboard.config.SettingsStore;
import io.mirrorboard.error.ValidationException;
import io.mirrorboard.mirror.CommitHistory;
import io.mirrorboard.mirror.CommitInfo;
import io.mirrorboard.model.Message;
import io.mirrorboard.observability.AuditLogger;
import io.mirrorboard.observability.SecretMasker;
import io.mirrorboard.runtime.BoardRuntime;
import io.mirrorboard.runtime.MessageService;
import io.mirrorboard.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "mirrorboard",
        mixinStandardHelpOptions = true,
        description = "Message board with a local store and GitHub-mirrored copies",
        subcommands = {
                BoardCommand.InitCommand.class,
                BoardCommand.PostCommand.class,
                BoardCommand.ListCommand.class,
                BoardCommand.ServeCommand.class,
                BoardCommand.MirrorCheckCommand.class,
                BoardCommand.CommitsCommand.class,
                BoardCommand.StatsCommand.class,
                BoardCommand.SettingsCommand.class,
                BoardCommand.AuditVerifyCommand.class
        }
)
public final class BoardCommand implements Runnable {
    static final int EXIT_VALIDATION = 2;

    @Option(names = {"--root"}, description = "Board data root directory", defaultValue = BoardConfig.DEFAULT_ROOT)
    String root;

    Map<String, String> env = System.getenv();

    /**
     * Command line with the board's exit codes: validation failures exit with 2, anything else with 1.
     */
    public static CommandLine newCommandLine() {
        return newCommandLine(new BoardCommand());
    }

    static CommandLine newCommandLine(BoardCommand command) {
        CommandLine cli = new CommandLine(command);
        cli.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            Map<String, Object> error = new LinkedHashMap<>();
            if (ex instanceof ValidationException) {
                error.put("error", "validation_failed");
                error.put("detail", ex.getMessage());
                commandLine.getErr().println(Jsons.toJson(error));
                return EXIT_VALIDATION;
            }
            error.put("error", ex.getClass().getSimpleName());
            error.put("detail", String.valueOf(ex.getMessage()));
            commandLine.getErr().println(Jsons.toJson(error));
            return 1;
        });
        return cli;
    }

    @Override
    public void run() {
        System.out.println("Use subcommands: init | post | list | serve | mirror-check | commits | stats | settings | audit-verify");
    }

    BoardConfig config() {
        return BoardConfig.fromRoot(root);
    }

    SettingsStore settingsStore() {
        return new SettingsStore(config().settingsFile());
    }

    BoardRuntime runtime() {
        BoardConfig config = config();
        BoardSettings settings = BoardSettings.from(settingsStore().list(), env);
        BoardRuntime runtime = new BoardRuntime(config, settings);
        runtime.init();
        return runtime;
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        BoardCommand parent;

        @Override
        public Integer call() {
            try (BoardRuntime runtime = parent.runtime()) {
                System.out.println("Initialized MirrorBoard at: " + runtime.config().rootDir());
            }
            return 0;
        }
    }

    @Command(name = "post", description = "Store a message locally and mirror it")
    static final class PostCommand implements Callable<Integer> {
        @ParentCommand
        BoardCommand parent;

        @Parameters(index = "0", description = "Message text")
        String message;

        @Option(names = {"--author"}, description = "Author name (default Anonymous)")
        String author;

        @Option(names = {"--repository"}, description = "Mirror target owner/name (default: first configured)")
        String repository;

        @Override
        public Integer call() {
            try (BoardRuntime runtime = parent.runtime()) {
                MessageService.PostOutcome outcome = runtime.messages().post(message, author, repository);
                System.out.println(Jsons.toJson(outcome));
            }
            return 0;
        }
    }

    @Command(name = "list", description = "Print the merged feed, newest first")
    static final class ListCommand implements Callable<Integer> {
        @ParentCommand
        BoardCommand parent;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Maximum number of messages")
        String limit;

        @Override
        public Integer call() {
            int parsed = MessageService.parseLimit(limit);
            try (BoardRuntime runtime = parent.runtime()) {
                MessageService.FeedOutcome feed = runtime.messages().readDetailed(parsed);
                List<Map<String, Object>> rendered = new ArrayList<>();
                for (Message m : feed.messages()) {
                    rendered.add(BoardHttpApi.render(m));
                }
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("messages", rendered);
                out.put("local_count", feed.localCount());
                out.put("shards", feed.shards());
                out.put("duplicates_dropped", feed.duplicatesDropped());
                System.out.println(Jsons.toJson(out));
            }
            return 0;
        }
    }

    @Command(name = "serve", description = "Serve the /messages JSON API")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        BoardCommand parent;

        @Option(names = {"--port"}, description = "Bind port (default server.port or SERVER_PORT, else 8000)")
        Integer port;

        @Override
        public Integer call() throws Exception {
            BoardRuntime runtime = parent.runtime();
            int bindPort = port != null ? port : runtime.settings().serverPort();
            HttpServer server = HttpServer.create(new InetSocketAddress(bindPort), 0);
            new BoardHttpApi(runtime.messages()).register(server);
            server.setExecutor(null);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                server.stop(0);
                runtime.close();
            }, "mirrorboard-shutdown"));
            server.start();
            System.out.println("Serving /messages on port " + server.getAddress().getPort()
                    + " (mirrors: " + runtime.registry().repositories() + ")");
            Thread.currentThread().join();
            return 0;
        }
    }

    @Command(name = "mirror-check", description = "Bootstrap every configured mirror and report its status")
    static final class MirrorCheckCommand implements Callable<Integer> {
        @ParentCommand
        BoardCommand parent;

        @Override
        public Integer call() {
            try (BoardRuntime runtime = parent.runtime()) {
                var reports = runtime.registry().ensureAllReady();
                System.out.println(Jsons.toJson(Map.of("mirrors", reports)));
                return reports.stream().allMatch(r -> r.ok()) ? 0 : 1;
            }
        }
    }

    @Command(name = "commits", description = "List recent commits of a mirror repository, or show one")
    static final class CommitsCommand implements Callable<Integer> {
        @ParentCommand
        BoardCommand parent;

        @Option(names = {"--repository"}, description = "Mirror owner/name (default: first configured)")
        String repository;

        @Option(names = {"--per-page"}, defaultValue = "30", description = "Commits per page, 1 to 100")
        int perPage;

        @Option(names = {"--page"}, defaultValue = "1", description = "1-based page number")
        int page;

        @Option(names = {"--sha"}, description = "Show this commit only")
        String sha;

        @Override
        public Integer call() throws Exception {
            if (sha == null) {
                CommitHistory.checkPage(perPage, page);
            }
            try (BoardRuntime runtime = parent.runtime()) {
                CommitHistory history = runtime.registry().commitHistory(repository);
                if (sha != null) {
                    System.out.println(Jsons.toJson(history.commit(sha).toView()));
                    return 0;
                }
                List<Map<String, Object>> rendered = new ArrayList<>();
                for (CommitInfo commit : history.commits(perPage, page)) {
                    rendered.add(commit.toView());
                }
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("commits", rendered);
                out.put("page", page);
                out.put("per_page", perPage);
                System.out.println(Jsons.toJson(out));
            }
            return 0;
        }
    }

    @Command(name = "stats", description = "Show store and mirror counters")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        BoardCommand parent;

        @Override
        public Integer call() {
            try (BoardRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.stats()));
            }
            return 0;
        }
    }

    @Command(
            name = "settings",
            description = "Edit board-settings.json",
            subcommands = {
                    SettingsCommand.ListSettings.class,
                    SettingsCommand.GetSetting.class,
                    SettingsCommand.SetSetting.class,
                    SettingsCommand.UnsetSetting.class
            }
    )
    static final class SettingsCommand implements Runnable {
        @ParentCommand
        BoardCommand parent;

        @Override
        public void run() {
            System.out.println("Use subcommands: list | get KEY | set KEY VALUE | unset KEY");
        }

        @Command(name = "list", description = "Print all stored settings, secrets masked")
        static final class ListSettings implements Callable<Integer> {
            @ParentCommand
            SettingsCommand settings;

            @Override
            public Integer call() {
                Map<String, Object> masked = SecretMasker.maskDetails(settings.parent.settingsStore().list());
                System.out.println(Jsons.toJson(masked));
                return 0;
            }
        }

        @Command(name = "get", description = "Print one setting, secrets masked")
        static final class GetSetting implements Callable<Integer> {
            @ParentCommand
            SettingsCommand settings;

            @Parameters(index = "0")
            String key;

            @Override
            public Integer call() {
                var value = settings.parent.settingsStore().get(key);
                if (value.isEmpty()) {
                    System.out.println(Jsons.toJson(Map.of("key", key, "found", false)));
                    return 1;
                }
                String shown = SecretMasker.isSensitiveKey(key) ? SecretMasker.MASK : value.get();
                System.out.println(Jsons.toJson(Map.of("key", key, "found", true, "value", shown)));
                return 0;
            }
        }

        @Command(name = "set", description = "Store one setting")
        static final class SetSetting implements Callable<Integer> {
            @ParentCommand
            SettingsCommand settings;

            @Parameters(index = "0")
            String key;

            @Parameters(index = "1")
            String value;

            @Override
            public Integer call() {
                SettingsStore store = settings.parent.settingsStore();
                Map<String, String> candidate = new LinkedHashMap<>(store.list());
                candidate.put(key.trim().toLowerCase(Locale.ROOT), value);
                // Reject values the runtime could not start with.
                BoardSettings.from(candidate, Map.of());
                store.set(key, value);
                System.out.println(Jsons.toJson(Map.of("key", key, "updated", true)));
                return 0;
            }
        }

        @Command(name = "unset", description = "Remove one setting")
        static final class UnsetSetting implements Callable<Integer> {
            @ParentCommand
            SettingsCommand settings;

            @Parameters(index = "0")
            String key;

            @Override
            public Integer call() {
                boolean removed = settings.parent.settingsStore().unset(key);
                System.out.println(Jsons.toJson(Map.of("key", key, "removed", removed)));
                return 0;
            }
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        BoardCommand parent;

        @Override
        public Integer call() {
            AuditLogger.VerifyOutcome out = new AuditLogger(parent.config().auditFile()).verify();
            System.out.println(Jsons.toJson(out));
            return out.valid() ? 0 : 1;
        }
    }
}
