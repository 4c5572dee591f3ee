package io.mirrorboard.observability;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keeps tokens out of the audit trail and out of {@code settings list} output.
 */
public final class SecretMasker {
    public static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of("token", "secret", "password", "authorization", "credential");
    private static final Pattern GITHUB_TOKEN = Pattern.compile("\\b(gh[pousr]_[A-Za-z0-9]{20,}|github_pat_[A-Za-z0-9_]{20,})\\b");

    private SecretMasker() {
    }

    public static boolean isSensitiveKey(String key) {
        if (key == null) {
            return false;
        }
        String lower = key.toLowerCase(Locale.ROOT);
        for (String hint : SENSITIVE_HINTS) {
            if (lower.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    public static Map<String, Object> maskDetails(Map<String, ?> details) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (details == null) {
            return out;
        }
        details.forEach((key, value) -> {
            if (isSensitiveKey(key)) {
                out.put(key, MASK);
            } else if (value instanceof String s) {
                out.put(key, maskText(s));
            } else {
                out.put(key, value);
            }
        });
        return out;
    }

    /**
     * Replaces anything shaped like a GitHub token inside free text, such as an error message echoing a header.
     */
    public static String maskText(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        return GITHUB_TOKEN.matcher(text).replaceAll(MASK);
    }
}
