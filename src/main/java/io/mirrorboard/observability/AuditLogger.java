package io.mirrorboard.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mirrorboard.util.Hashing;
import io.mirrorboard.util.Jsons;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON lines trail of board writes and mirror outcomes. Each row carries the hash of
 * the previous row, so edits or deletions in the middle of the file are detectable with {@link #verify()}.
 */
public final class AuditLogger {
    private final Path auditFile;
    private String previousHash;

    public AuditLogger(Path auditFile) {
        this.auditFile = auditFile;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", SecretMasker.maskDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    /**
     * Recomputes every row hash and checks the chain links. Stops at the first broken row.
     */
    public synchronized VerifyOutcome verify() {
        List<String> lines;
        try {
            lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read audit log", e);
        }
        String expectedPrev = "";
        int rows = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line == null || line.isBlank()) {
                continue;
            }
            rows++;
            try {
                JsonNode node = Jsons.mapper().readTree(line);
                if (!(node instanceof ObjectNode object)) {
                    return VerifyOutcome.broken(rows, i + 1, "row is not a JSON object");
                }
                String recorded = object.path("hash").asText("");
                if (!expectedPrev.equals(object.path("prev_hash").asText(""))) {
                    return VerifyOutcome.broken(rows, i + 1, "prev_hash does not link to the previous row");
                }
                object.remove("hash");
                String actual = Hashing.sha256Hex(Jsons.toCompactJson(object));
                if (!actual.equals(recorded)) {
                    return VerifyOutcome.broken(rows, i + 1, "hash mismatch");
                }
                expectedPrev = recorded;
            } catch (IOException e) {
                return VerifyOutcome.broken(rows, i + 1, "unreadable row: " + e.getMessage());
            }
        }
        return new VerifyOutcome(true, rows, -1, null);
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            return Jsons.mapper().readTree(last).path("hash").asText("");
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read audit log tail: " + auditFile, e);
        }
    }

    public record AuditEvent(String action, String actor, String resource, String result, Map<String, Object> details) {
        public static AuditEvent of(String action, String actor, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(action, actor, resource, result, details == null ? Map.of() : details);
        }
    }

    public record VerifyOutcome(boolean valid, int rows, int brokenLine, String reason) {
        static VerifyOutcome broken(int rows, int line, String reason) {
            return new VerifyOutcome(false, rows, line, reason);
        }
    }
}
