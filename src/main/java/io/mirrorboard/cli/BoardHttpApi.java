package io.mirrorboard.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.mirrorboard.error.StorageException;
import io.mirrorboard.error.ValidationException;
import io.mirrorboard.model.Message;
import io.mirrorboard.runtime.MessageService;
import io.mirrorboard.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON surface for {@code /messages}: {@code GET} reads the merged feed, {@code POST} dual-writes one message.
 */
public final class BoardHttpApi {
    private static final Logger log = LoggerFactory.getLogger(BoardHttpApi.class);
    static final String MESSAGES_PATH = "/messages";

    private final MessageService messages;

    public BoardHttpApi(MessageService messages) {
        this.messages = messages;
    }

    public void register(HttpServer server) {
        server.createContext(MESSAGES_PATH, exchange -> {
            try {
                String path = exchange.getRequestURI().getPath();
                if (!MESSAGES_PATH.equals(path) && !(MESSAGES_PATH + "/").equals(path)) {
                    writeJson(exchange, Map.of("error", "not_found"), 404);
                    return;
                }
                if (!allowMethods(exchange, "GET", "POST")) return;
                if ("GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                    handleList(exchange);
                } else {
                    handlePost(exchange);
                }
            } catch (RuntimeException e) {
                log.error("Request {} {} failed", exchange.getRequestMethod(), exchange.getRequestURI(), e);
                writeJson(exchange, Map.of("error", "internal_error"), 500);
            } finally {
                exchange.close();
            }
        });
    }

    private void handleList(HttpExchange exchange) throws IOException {
        int limit;
        try {
            limit = MessageService.parseLimit(parseQuery(exchange.getRequestURI()).get("limit"));
        } catch (ValidationException e) {
            writeJson(exchange, Map.of("error", "invalid_limit", "detail", e.getMessage()), 400);
            return;
        }
        List<Map<String, Object>> rendered;
        try {
            rendered = new ArrayList<>();
            for (Message message : messages.read(limit)) {
                rendered.add(render(message));
            }
        } catch (StorageException e) {
            log.error("Reading the feed failed", e);
            writeJson(exchange, Map.of("error", "storage_failure"), 500);
            return;
        }
        writeJson(exchange, Map.of("messages", rendered), 200);
    }

    private void handlePost(HttpExchange exchange) throws IOException {
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        JsonNode node;
        try {
            node = Jsons.mapper().readTree(body);
        } catch (JsonProcessingException e) {
            writeJson(exchange, Map.of("error", "invalid_json"), 400);
            return;
        }
        if (node == null || !node.isObject()) {
            writeJson(exchange, Map.of("error", "invalid_json"), 400);
            return;
        }
        String content = Jsons.text(node, "message");
        if (content == null || content.isBlank()) {
            writeJson(exchange, Map.of("error", "missing_message"), 400);
            return;
        }
        MessageService.PostOutcome outcome;
        try {
            outcome = messages.post(content, Jsons.text(node, "author"), Jsons.text(node, "repository"));
        } catch (ValidationException e) {
            writeJson(exchange, Map.of("error", "invalid_request", "detail", e.getMessage()), 400);
            return;
        } catch (StorageException e) {
            log.error("Storing a posted message failed", e);
            writeJson(exchange, Map.of("error", "storage_failure"), 500);
            return;
        }
        Message stored = outcome.message();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("id", stored.id());
        data.put("content", stored.content());
        data.put("author", stored.author());
        data.put("timestamp", stored.timestamp());
        if (stored.remoteReference() != null) {
            data.put("github_url", stored.remoteReference());
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("data", data);
        writeJson(exchange, response, 200);
    }

    static Map<String, Object> render(Message message) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (message.id() != null) {
            out.put("id", message.id());
        }
        out.put("content", message.content());
        out.put("author", message.author());
        out.put("timestamp", message.timestamp());
        out.put("source", message.source());
        if (message.remoteReference() != null) {
            out.put("github_url", message.remoteReference());
        }
        return out;
    }

    private static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static boolean allowMethods(HttpExchange exchange, String... methods) throws IOException {
        String method = exchange.getRequestMethod();
        for (String allowed : methods) {
            if (allowed.equalsIgnoreCase(method)) {
                return true;
            }
        }
        exchange.getResponseHeaders().set("Allow", String.join(",", methods));
        writeJson(exchange, Map.of("error", "method_not_allowed", "method", String.valueOf(method)), 405);
        return false;
    }

    private static Map<String, String> parseQuery(URI uri) {
        Map<String, String> out = new LinkedHashMap<>();
        String query = uri.getRawQuery();
        if (query == null || query.isBlank()) {
            return out;
        }
        for (String pair : query.split("&")) {
            if (pair.isBlank()) {
                continue;
            }
            int idx = pair.indexOf('=');
            if (idx < 0) {
                out.put(URLDecoder.decode(pair, StandardCharsets.UTF_8), "");
            } else {
                out.put(URLDecoder.decode(pair.substring(0, idx), StandardCharsets.UTF_8),
                        URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8));
            }
        }
        return out;
    }
}
