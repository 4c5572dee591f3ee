package io.mirrorboard.model;

import io.mirrorboard.util.Timestamps;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * The one ordering used across sources: timestamp, newest first. The sort is stable, so equal
 * timestamps keep the order in which the sources were concatenated.
 */
public final class MessageOrder {
    public static final Comparator<Message> NEWEST_FIRST =
            Comparator.comparing(Message::timestamp, Timestamps.NEWEST_FIRST);

    private MessageOrder() {
    }

    public static List<Message> newestFirst(List<Message> messages, int limit) {
        List<Message> sorted = new ArrayList<>(messages);
        sorted.sort(NEWEST_FIRST);
        if (sorted.size() > limit) {
            return new ArrayList<>(sorted.subList(0, limit));
        }
        return sorted;
    }
}
