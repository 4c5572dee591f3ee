package io.mirrorboard.util;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.Optional;

/**
 * Timestamp helpers shared by the local store and the mirrors.
 *
 * <p>Timestamps written by this project are fixed-width UTC with microsecond precision, so their
 * lexical order is their chronological order. Timestamps read back from mirrors may come from
 * other writers and are parsed leniently before comparing.
 */
public final class Timestamps {
    private static final DateTimeFormatter CANONICAL =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSS'Z'").withZone(ZoneOffset.UTC);

    /**
     * Newest first. Unparseable values sort after every parseable one, then lexically.
     */
    public static final Comparator<String> NEWEST_FIRST = (a, b) -> {
        Optional<Instant> left = parse(a);
        Optional<Instant> right = parse(b);
        if (left.isPresent() && right.isPresent()) {
            return right.get().compareTo(left.get());
        }
        if (left.isPresent()) {
            return -1;
        }
        if (right.isPresent()) {
            return 1;
        }
        String l = a == null ? "" : a;
        String r = b == null ? "" : b;
        return r.compareTo(l);
    };

    private Timestamps() {
    }

    public static String now(Clock clock) {
        return format(clock.instant());
    }

    public static String format(Instant instant) {
        return CANONICAL.format(instant.truncatedTo(ChronoUnit.MICROS));
    }

    public static Optional<Instant> parse(String raw) {
        return parse(raw, ZoneOffset.UTC);
    }

    /**
     * Like {@link #parse(String)}, reading values without an offset as wall-clock time in {@code zone}.
     */
    public static Optional<Instant> parse(String raw, ZoneId zone) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim();
        try {
            return Optional.of(Instant.parse(value));
        } catch (DateTimeParseException ignored) {
            // not an instant, try the offset and local forms
        }
        try {
            return Optional.of(OffsetDateTime.parse(value).toInstant());
        } catch (DateTimeParseException ignored) {
            // fall through
        }
        try {
            return Optional.of(LocalDateTime.parse(value).atZone(zone).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * File-name key for a timestamp: colons are not legal in every path segment, so they become dashes.
     * The key keeps the timestamp's lexical order.
     */
    public static String fileKey(String timestamp) {
        return timestamp.replace(':', '-');
    }
}
