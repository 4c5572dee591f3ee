package io.mirrorboard.mirror;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mirrorboard.config.BoardSettings;
import io.mirrorboard.config.RepositoryConfig;
import io.mirrorboard.error.MirrorException;
import io.mirrorboard.error.ValidationException;
import io.mirrorboard.model.Message;
import io.mirrorboard.model.MessageOrder;
import io.mirrorboard.util.Jsons;
import io.mirrorboard.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Mirror over a GitHub-style repository contents API ({@code /repos/{owner}/{name}/contents/{path}}).
 * The same endpoint family also serves the branch's commit log.
 *
 * <p>With {@code autoCreate} the message directory is bootstrapped with a {@code .gitkeep}
 * placeholder the first time it is found missing; without it a missing directory is an error
 * on write. Two writes stamped with the same microsecond map to the same file name; the backend
 * rejects the second create and it surfaces as a {@link MirrorException}.
 */
public final class ContentsApiMirrorClient implements MirrorClient, CommitHistory {
    private static final Logger log = LoggerFactory.getLogger(ContentsApiMirrorClient.class);
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(20);
    private static final int STATUS_NOT_FOUND = 404;
    private static final int STATUS_UNPROCESSABLE = 422;

    private final RepositoryConfig config;
    private final HttpClient http;
    private final URI apiBaseUrl;
    private final String token;
    private final boolean autoCreate;
    private final Clock clock;
    private final Duration requestTimeout;
    private volatile boolean ready;

    public ContentsApiMirrorClient(RepositoryConfig config, HttpClient http, URI apiBaseUrl, String token,
                                   boolean autoCreate, Clock clock) {
        this(config, http, apiBaseUrl, token, autoCreate, clock, DEFAULT_REQUEST_TIMEOUT);
    }

    public ContentsApiMirrorClient(RepositoryConfig config, HttpClient http, URI apiBaseUrl, String token,
                                   boolean autoCreate, Clock clock, Duration requestTimeout) {
        this.config = config;
        this.http = http;
        this.apiBaseUrl = apiBaseUrl;
        this.token = token == null || token.isBlank() ? null : token.trim();
        this.autoCreate = autoCreate;
        this.clock = clock;
        this.requestTimeout = requestTimeout;
    }

    public static MirrorClientFactory factory(BoardSettings settings, HttpClient http, Clock clock) {
        return repo -> new ContentsApiMirrorClient(
                repo,
                http,
                settings.apiBaseUrl(),
                settings.githubToken(),
                settings.autoCreate(),
                clock,
                settings.fetchTimeout()
        );
    }

    @Override
    public RepositoryConfig config() {
        return config;
    }

    @Override
    public synchronized void ensureReady() throws MirrorException {
        if (ready) {
            return;
        }
        HttpResponse<String> probe = send(request(directoryUri()).GET().build());
        int status = probe.statusCode();
        if (status / 100 == 2) {
            ready = true;
            return;
        }
        if (status != STATUS_NOT_FOUND) {
            throw failure("probe of " + config.messagePath(), probe);
        }
        if (!autoCreate) {
            throw new MirrorException(
                    "Message directory " + config.messagePath() + " missing in " + config.fullName(), status);
        }
        HttpResponse<String> created = send(put(
                fileUri(MirrorRecords.PLACEHOLDER_NAME),
                "Initialize message directory",
                new byte[0]
        ));
        int createdStatus = created.statusCode();
        if (createdStatus / 100 == 2) {
            log.info("Created message directory {} in {}", config.messagePath(), config.fullName());
        } else if (createdStatus == STATUS_UNPROCESSABLE) {
            // Someone else created the placeholder between the probe and the write.
            log.debug("Placeholder already present in {}", config.fullName());
        } else {
            throw failure("bootstrap of " + config.messagePath(), created);
        }
        ready = true;
    }

    @Override
    public String store(String content, String author) throws MirrorException {
        if (content == null || content.isBlank()) {
            throw new ValidationException("Message content must not be empty");
        }
        String resolvedAuthor = Message.authorOrDefault(author);
        String timestamp = Timestamps.now(clock);
        String body = MirrorRecords.encode(content, resolvedAuthor, timestamp);
        String fileName = MirrorRecords.fileName(timestamp);
        ensureReady();
        HttpResponse<String> response = send(put(
                fileUri(fileName),
                "Add message from " + resolvedAuthor,
                body.getBytes(StandardCharsets.UTF_8)
        ));
        if (response.statusCode() / 100 != 2) {
            throw failure("write of " + fileName, response);
        }
        return referenceFrom(response.body(), fileName);
    }

    @Override
    public List<Message> fetch(int limit) throws MirrorException {
        if (limit <= 0) {
            throw new ValidationException("limit must be a positive integer, got " + limit);
        }
        HttpResponse<String> listing = send(request(directoryUri()).GET().build());
        if (listing.statusCode() == STATUS_NOT_FOUND) {
            return List.of();
        }
        if (listing.statusCode() / 100 != 2) {
            throw failure("listing of " + config.messagePath(), listing);
        }
        JsonNode entries = readJson(listing.body(), "listing of " + config.messagePath());
        if (!entries.isArray()) {
            throw new MirrorException("Listing of " + config.messagePath() + " in " + config.fullName()
                    + " is not a directory");
        }
        List<Message> messages = new ArrayList<>();
        for (JsonNode entry : entries) {
            String name = Jsons.text(entry, "name");
            String type = Jsons.text(entry, "type");
            if ((type != null && !"file".equals(type)) || !MirrorRecords.isMessageFile(name)) {
                continue;
            }
            byte[] raw = readEntry(entry, name);
            if (raw == null) {
                continue;
            }
            try {
                messages.add(MirrorRecords.decode(raw, source(), Jsons.text(entry, "html_url")));
            } catch (MessageParseException e) {
                log.warn("Skipping {} in {}: {}", name, config.fullName(), e.getMessage());
            }
        }
        return MessageOrder.newestFirst(messages, limit);
    }

    @Override
    public List<CommitInfo> commits(int perPage, int page) throws MirrorException {
        CommitHistory.checkPage(perPage, page);
        URI uri = URI.create(repoBase() + "/commits?sha=" + URLEncoder.encode(config.branch(), StandardCharsets.UTF_8)
                + "&per_page=" + perPage + "&page=" + page);
        HttpResponse<String> response = send(request(uri).GET().build());
        if (response.statusCode() / 100 != 2) {
            throw failure("commit listing", response);
        }
        JsonNode entries = readJson(response.body(), "commit listing");
        if (!entries.isArray()) {
            throw new MirrorException("Commit listing of " + config.fullName() + " is not an array");
        }
        List<CommitInfo> out = new ArrayList<>(entries.size());
        for (JsonNode entry : entries) {
            out.add(CommitInfo.fromJson(entry, config.fullName()));
        }
        return out;
    }

    @Override
    public CommitInfo commit(String sha) throws MirrorException {
        if (sha == null || sha.isBlank()) {
            throw new ValidationException("Commit sha must not be empty");
        }
        HttpResponse<String> response = send(request(URI.create(repoBase() + "/commits/" + encodeSegment(sha.trim())))
                .GET()
                .build());
        if (response.statusCode() / 100 != 2) {
            throw failure("commit " + sha.trim(), response);
        }
        return CommitInfo.fromJson(readJson(response.body(), "commit " + sha.trim()), config.fullName());
    }

    private byte[] readEntry(JsonNode entry, String name) throws MirrorException {
        String inline = Jsons.text(entry, "content");
        if (inline != null && !inline.isEmpty()) {
            return decodeBase64(inline, name);
        }
        String downloadUrl = Jsons.text(entry, "download_url");
        if (downloadUrl != null && !downloadUrl.isBlank()) {
            HttpResponse<String> raw = send(request(URI.create(downloadUrl)).GET().build());
            if (raw.statusCode() / 100 != 2) {
                log.warn("Skipping {} in {}: download answered {}", name, config.fullName(), raw.statusCode());
                return null;
            }
            return raw.body().getBytes(StandardCharsets.UTF_8);
        }
        String apiUrl = Jsons.text(entry, "url");
        if (apiUrl == null || apiUrl.isBlank()) {
            log.warn("Skipping {} in {}: entry has neither content nor a download link", name, config.fullName());
            return null;
        }
        HttpResponse<String> file = send(request(URI.create(apiUrl)).GET().build());
        if (file.statusCode() / 100 != 2) {
            log.warn("Skipping {} in {}: read answered {}", name, config.fullName(), file.statusCode());
            return null;
        }
        String encoded = Jsons.text(readJson(file.body(), "read of " + name), "content");
        if (encoded == null) {
            log.warn("Skipping {} in {}: no content in file response", name, config.fullName());
            return null;
        }
        return decodeBase64(encoded, name);
    }

    private byte[] decodeBase64(String encoded, String name) {
        try {
            // The contents API wraps base64 at 60 columns.
            return Base64.getMimeDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            log.warn("Skipping {} in {}: content is not base64", name, config.fullName());
            return null;
        }
    }

    private String referenceFrom(String body, String fileName) throws MirrorException {
        JsonNode node = readJson(body, "write of " + fileName);
        String url = Jsons.text(node.path("content"), "html_url");
        if (url == null) {
            url = Jsons.text(node.path("commit"), "html_url");
        }
        return url != null ? url : fileUri(fileName).toString();
    }

    private JsonNode readJson(String body, String what) throws MirrorException {
        try {
            JsonNode node = Jsons.mapper().readTree(body == null ? "" : body);
            if (node == null || node.isMissingNode()) {
                throw new MirrorException("Empty response for " + what + " in " + config.fullName());
            }
            return node;
        } catch (IOException e) {
            throw new MirrorException("Unreadable response for " + what + " in " + config.fullName(), e);
        }
    }

    private HttpRequest put(URI uri, String commitMessage, byte[] content) {
        ObjectNode body = Jsons.mapper().createObjectNode();
        body.put("message", commitMessage);
        body.put("content", Base64.getEncoder().encodeToString(content));
        body.put("branch", config.branch());
        return request(uri)
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofString(Jsons.toCompactJson(body), StandardCharsets.UTF_8))
                .build();
    }

    private HttpRequest.Builder request(URI uri) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .header("Accept", "application/vnd.github.v3+json")
                .header("User-Agent", "mirrorboard");
        if (token != null) {
            builder.header("Authorization", "token " + token);
        }
        return builder;
    }

    private HttpResponse<String> send(HttpRequest request) throws MirrorException {
        try {
            return http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new MirrorException(request.method() + " " + request.uri().getPath() + " failed for "
                    + config.fullName() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MirrorException("Interrupted while calling " + config.fullName(), e);
        }
    }

    private MirrorException failure(String what, HttpResponse<String> response) {
        String detail = "";
        try {
            String message = Jsons.text(Jsons.mapper().readTree(response.body()), "message");
            if (message != null) {
                detail = ": " + message;
            }
        } catch (IOException | RuntimeException ignored) {
            // Error bodies are best effort; the status carries the failure.
        }
        return new MirrorException(
                "Unexpected status " + response.statusCode() + " for " + what + " in " + config.fullName() + detail,
                response.statusCode()
        );
    }

    private URI directoryUri() {
        return URI.create(repoBase() + "/contents/" + encodePath(config.messagePath())
                + "?ref=" + URLEncoder.encode(config.branch(), StandardCharsets.UTF_8));
    }

    private URI fileUri(String fileName) {
        return URI.create(repoBase() + "/contents/" + encodePath(config.messagePath()) + "/" + encodeSegment(fileName));
    }

    private String repoBase() {
        return apiBaseUrl + "/repos/" + encodeSegment(config.owner()) + "/" + encodeSegment(config.name());
    }

    private static String encodePath(String path) {
        StringBuilder sb = new StringBuilder();
        for (String segment : path.split("/")) {
            if (segment.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append('/');
            }
            sb.append(encodeSegment(segment));
        }
        return sb.toString();
    }

    private static String encodeSegment(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
