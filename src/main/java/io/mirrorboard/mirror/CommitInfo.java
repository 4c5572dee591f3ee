package io.mirrorboard.mirror;

import com.fasterxml.jackson.databind.JsonNode;
import io.mirrorboard.error.MirrorException;
import io.mirrorboard.util.Jsons;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One commit of a mirror repository, as listed by {@code /repos/{owner}/{name}/commits}.
 *
 * @param timestamp author date exactly as the API reports it, offset included
 */
public record CommitInfo(
        String sha,
        String message,
        String authorName,
        String authorEmail,
        String timestamp,
        String url
) {
    static CommitInfo fromJson(JsonNode node, String repository) throws MirrorException {
        JsonNode commit = node == null ? null : node.get("commit");
        JsonNode author = commit == null ? null : commit.get("author");
        String sha = Jsons.text(node, "sha");
        String message = Jsons.text(commit, "message");
        String name = Jsons.text(author, "name");
        String email = Jsons.text(author, "email");
        String date = Jsons.text(author, "date");
        String url = Jsons.text(node, "html_url");
        if (sha == null || message == null || name == null || email == null || date == null || url == null) {
            throw new MirrorException("Invalid commit entry in " + repository + ": " + Jsons.toCompactJson(node));
        }
        return new CommitInfo(sha, message, name, email, date, url);
    }

    /**
     * Output shape: {@code {sha, message, author:{name,email}, timestamp, url}}.
     */
    public Map<String, Object> toView() {
        Map<String, Object> author = new LinkedHashMap<>();
        author.put("name", authorName);
        author.put("email", authorEmail);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("sha", sha);
        out.put("message", message);
        out.put("author", author);
        out.put("timestamp", timestamp);
        out.put("url", url);
        return out;
    }
}
