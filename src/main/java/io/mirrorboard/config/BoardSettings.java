package io.mirrorboard.config;

import io.mirrorboard.error.ValidationException;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parsed process settings. Built once at startup and handed to the runtime; nothing reads the
 * settings file or the environment after that.
 */
public record BoardSettings(
        String githubToken,
        URI apiBaseUrl,
        List<RepositoryConfig> repositories,
        boolean autoCreate,
        Duration fetchTimeout,
        int serverPort,
        int threads,
        boolean dedupeMirrored
) {
    public static final String KEY_TOKEN = "github.token";
    public static final String KEY_API_URL = "github.api_url";
    public static final String KEY_REPOSITORIES = "repositories";
    public static final String KEY_AUTO_CREATE = "mirror.auto_create";
    public static final String KEY_FETCH_TIMEOUT_MS = "mirror.fetch_timeout_ms";
    public static final String KEY_SERVER_PORT = "server.port";
    public static final String KEY_THREADS = "runtime.threads";
    public static final String KEY_DEDUPE_MIRRORED = "feed.dedupe_mirrored";
    public static final String ENV_TOKEN = "GITHUB_TOKEN";
    public static final String ENV_SERVER_PORT = "SERVER_PORT";
    public static final String DEFAULT_API_URL = "https://api.github.com";

    public BoardSettings {
        repositories = List.copyOf(repositories);
    }

    public static BoardSettings defaults() {
        return from(Map.of(), Map.of());
    }

    public static BoardSettings from(Map<String, String> values, Map<String, String> env) {
        String token = firstNonBlank(env.get(ENV_TOKEN), values.get(KEY_TOKEN));
        URI api = parseUri(firstNonBlank(values.get(KEY_API_URL), DEFAULT_API_URL));
        List<RepositoryConfig> repos = parseRepositories(values.get(KEY_REPOSITORIES));
        boolean autoCreate = parseBoolean(KEY_AUTO_CREATE, values.get(KEY_AUTO_CREATE), true);
        long timeoutMs = parseLong(KEY_FETCH_TIMEOUT_MS, values.get(KEY_FETCH_TIMEOUT_MS), BoardConfig.DEFAULT_FETCH_TIMEOUT_MS);
        int port = (int) parseLong(KEY_SERVER_PORT,
                firstNonBlank(env.get(ENV_SERVER_PORT), values.get(KEY_SERVER_PORT)), BoardConfig.DEFAULT_SERVER_PORT);
        int threads = (int) parseLong(KEY_THREADS, values.get(KEY_THREADS), BoardConfig.DEFAULT_THREAD_POOL_SIZE);
        boolean dedupe = parseBoolean(KEY_DEDUPE_MIRRORED, values.get(KEY_DEDUPE_MIRRORED), true);
        if (timeoutMs <= 0) {
            throw new ValidationException(KEY_FETCH_TIMEOUT_MS + " must be positive");
        }
        if (port < 0 || port > 65_535) {
            throw new ValidationException(KEY_SERVER_PORT + " out of range: " + port);
        }
        if (threads <= 0) {
            throw new ValidationException(KEY_THREADS + " must be positive");
        }
        return new BoardSettings(token, api, repos, autoCreate, Duration.ofMillis(timeoutMs), port, threads, dedupe);
    }

    public boolean hasToken() {
        return githubToken != null && !githubToken.isBlank();
    }

    static List<RepositoryConfig> parseRepositories(String raw) {
        List<RepositoryConfig> out = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return out;
        }
        for (String part : raw.split(",")) {
            if (!part.isBlank()) {
                out.add(RepositoryConfig.parse(part));
            }
        }
        return out;
    }

    private static URI parseUri(String raw) {
        String value = raw.trim();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        URI uri;
        try {
            uri = URI.create(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(KEY_API_URL + " is not a valid URL: " + raw);
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new ValidationException(KEY_API_URL + " must be an absolute URL: " + raw);
        }
        return uri;
    }

    private static boolean parseBoolean(String key, String raw, boolean fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "1", "on" -> true;
            case "false", "no", "0", "off" -> false;
            default -> throw new ValidationException(key + " must be true or false: " + raw);
        };
    }

    private static long parseLong(String key, String raw, long fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException(key + " must be a number: " + raw);
        }
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first.trim();
        }
        return second == null || second.isBlank() ? null : second.trim();
    }

    @Override
    public String toString() {
        return "BoardSettings[token=" + (hasToken() ? "***" : "<none>")
                + ", apiBaseUrl=" + apiBaseUrl
                + ", repositories=" + repositories
                + ", autoCreate=" + autoCreate
                + ", fetchTimeout=" + fetchTimeout
                + ", serverPort=" + serverPort
                + ", threads=" + threads
                + ", dedupeMirrored=" + dedupeMirrored + "]";
    }
}
