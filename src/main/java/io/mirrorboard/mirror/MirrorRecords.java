package io.mirrorboard.mirror;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mirrorboard.model.Message;
import io.mirrorboard.util.Jsons;
import io.mirrorboard.util.Timestamps;

import java.io.IOException;
import java.util.Locale;

/**
 * JSON blob format of a mirrored message: {@code {"content", "author", "timestamp"}}.
 */
final class MirrorRecords {
    static final String PLACEHOLDER_NAME = ".gitkeep";
    static final String FILE_SUFFIX = ".json";

    private MirrorRecords() {
    }

    static String encode(String content, String author, String timestamp) {
        ObjectNode node = Jsons.mapper().createObjectNode();
        node.put("content", content);
        node.put("author", author);
        node.put("timestamp", timestamp);
        return Jsons.toJson(node);
    }

    static String fileName(String timestamp) {
        return Timestamps.fileKey(timestamp) + FILE_SUFFIX;
    }

    static boolean isMessageFile(String name) {
        return name != null
                && !name.startsWith(".")
                && name.toLowerCase(Locale.ROOT).endsWith(FILE_SUFFIX);
    }

    /**
     * Parses one blob. Older writers used {@code message} instead of {@code content}; both are read.
     */
    static Message decode(byte[] raw, String source, String reference) throws MessageParseException {
        JsonNode node;
        try {
            node = Jsons.mapper().readTree(raw);
        } catch (IOException e) {
            throw new MessageParseException("not valid JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new MessageParseException("not a JSON object");
        }
        String content = Jsons.text(node, "content");
        if (content == null) {
            content = Jsons.text(node, "message");
        }
        if (content == null || content.isBlank()) {
            throw new MessageParseException("missing content");
        }
        String timestamp = Jsons.text(node, "timestamp");
        if (timestamp == null || Timestamps.parse(timestamp).isEmpty()) {
            throw new MessageParseException("missing or invalid timestamp");
        }
        String author = Message.authorOrDefault(Jsons.text(node, "author"));
        return new Message(null, content, author, timestamp, source, reference);
    }
}
