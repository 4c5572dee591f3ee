package io.mirrorboard.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mirrorboard.error.ValidationException;
import io.mirrorboard.util.Jsons;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Flat key/value settings file ({@code board-settings.json}) edited by the {@code settings} command.
 */
public final class SettingsStore {
    private static final int MAX_KEY_LENGTH = 64;

    private final Path file;

    public SettingsStore(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    static String normalizeKey(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if (value.length() > MAX_KEY_LENGTH) {
            return "";
        }
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            if (!ok) {
                return "";
            }
        }
        return value;
    }

    public synchronized Map<String, String> list() {
        LinkedHashMap<String, String> out = new LinkedHashMap<>();
        if (!Files.exists(file)) {
            return out;
        }
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(file.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read settings file: " + file, e);
        }
        if (root == null || !root.isObject()) {
            return out;
        }
        root.fields().forEachRemaining(entry -> {
            String key = normalizeKey(entry.getKey());
            JsonNode value = entry.getValue();
            if (!key.isEmpty() && value != null && value.isValueNode() && !value.isNull()) {
                out.put(key, value.asText());
            }
        });
        return out;
    }

    public synchronized Optional<String> get(String key) {
        return Optional.ofNullable(list().get(requireKey(key)));
    }

    public synchronized void set(String key, String value) {
        String normalized = requireKey(key);
        Map<String, String> values = list();
        values.put(normalized, value == null ? "" : value);
        write(values);
    }

    public synchronized boolean unset(String key) {
        String normalized = requireKey(key);
        Map<String, String> values = list();
        if (values.remove(normalized) == null) {
            return false;
        }
        write(values);
        return true;
    }

    private String requireKey(String raw) {
        String key = normalizeKey(raw);
        if (key.isEmpty()) {
            throw new ValidationException("Invalid settings key: " + raw);
        }
        return key;
    }

    private void write(Map<String, String> values) {
        ObjectNode root = Jsons.mapper().createObjectNode();
        new TreeMap<>(values).forEach(root::put);
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            Jsons.mapper().writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), root);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write settings file: " + file, e);
        }
    }
}
