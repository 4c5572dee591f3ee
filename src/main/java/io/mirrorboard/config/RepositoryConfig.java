package io.mirrorboard.config;

import io.mirrorboard.error.ValidationException;

import java.util.Locale;

/**
 * One remote repository that mirrors board messages.
 *
 * <p>Textual form: {@code owner/name[@branch][:path]}, for example
 * {@code octo/board@main:messages}.
 */
public record RepositoryConfig(String owner, String name, String branch, String messagePath) {
    public static final String DEFAULT_BRANCH = "main";
    public static final String DEFAULT_MESSAGE_PATH = "messages";

    public RepositoryConfig {
        if (owner == null || owner.isBlank() || name == null || name.isBlank()) {
            throw new ValidationException("Repository owner and name are required");
        }
        owner = owner.trim();
        name = name.trim();
        branch = branch == null || branch.isBlank() ? DEFAULT_BRANCH : branch.trim();
        messagePath = normalizePath(messagePath);
    }

    public static RepositoryConfig of(String owner, String name) {
        return new RepositoryConfig(owner, name, null, null);
    }

    public static RepositoryConfig parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("Repository must not be blank");
        }
        String value = raw.trim();
        String path = null;
        int colon = value.indexOf(':');
        if (colon >= 0) {
            path = value.substring(colon + 1);
            value = value.substring(0, colon);
        }
        String branch = null;
        int at = value.indexOf('@');
        if (at >= 0) {
            branch = value.substring(at + 1);
            value = value.substring(0, at);
        }
        int slash = value.indexOf('/');
        if (slash <= 0 || slash != value.lastIndexOf('/') || slash == value.length() - 1) {
            throw new ValidationException("Repository must look like owner/name[@branch][:path]: " + raw);
        }
        return new RepositoryConfig(value.substring(0, slash), value.substring(slash + 1), branch, path);
    }

    public String fullName() {
        return owner + "/" + name;
    }

    public boolean matches(String target) {
        return target != null && fullName().toLowerCase(Locale.ROOT).equals(target.trim().toLowerCase(Locale.ROOT));
    }

    private static String normalizePath(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT_MESSAGE_PATH;
        }
        String value = raw.trim();
        while (value.startsWith("/")) {
            value = value.substring(1);
        }
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        if (value.isEmpty() || value.contains("..")) {
            throw new ValidationException("Invalid message path: " + raw);
        }
        return value;
    }

    @Override
    public String toString() {
        return fullName() + "@" + branch + ":" + messagePath;
    }
}
