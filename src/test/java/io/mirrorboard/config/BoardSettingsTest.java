package io.mirrorboard.config;

import io.mirrorboard.error.ValidationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

final class BoardSettingsTest {

    @Test
    void defaultsMatchTheDocumentedValues() {
        BoardSettings settings = BoardSettings.defaults();
        Assertions.assertNull(settings.githubToken());
        Assertions.assertFalse(settings.hasToken());
        Assertions.assertEquals("https://api.github.com", settings.apiBaseUrl().toString());
        Assertions.assertEquals(List.of(), settings.repositories());
        Assertions.assertTrue(settings.autoCreate());
        Assertions.assertEquals(Duration.ofSeconds(10), settings.fetchTimeout());
        Assertions.assertEquals(8000, settings.serverPort());
        Assertions.assertEquals(4, settings.threads());
        Assertions.assertTrue(settings.dedupeMirrored());
    }

    @Test
    void environmentOverridesTokenAndPort() {
        BoardSettings settings = BoardSettings.from(
                Map.of(BoardSettings.KEY_TOKEN, "from-file", BoardSettings.KEY_SERVER_PORT, "9000"),
                Map.of(BoardSettings.ENV_TOKEN, "from-env", BoardSettings.ENV_SERVER_PORT, "9100")
        );
        Assertions.assertEquals("from-env", settings.githubToken());
        Assertions.assertEquals(9100, settings.serverPort());
        Assertions.assertFalse(settings.toString().contains("from-env"));
    }

    @Test
    void parsesRepositoryListAndFlags() {
        BoardSettings settings = BoardSettings.from(Map.of(
                BoardSettings.KEY_REPOSITORIES, "octo/first, octo/second@dev:board ,",
                BoardSettings.KEY_API_URL, "http://localhost:9999/api/",
                BoardSettings.KEY_AUTO_CREATE, "no",
                BoardSettings.KEY_FETCH_TIMEOUT_MS, "250",
                BoardSettings.KEY_THREADS, "2",
                BoardSettings.KEY_DEDUPE_MIRRORED, "false"
        ), Map.of());

        Assertions.assertEquals(List.of("octo/first", "octo/second"),
                settings.repositories().stream().map(RepositoryConfig::fullName).toList());
        Assertions.assertEquals("board", settings.repositories().get(1).messagePath());
        Assertions.assertEquals("http://localhost:9999/api", settings.apiBaseUrl().toString());
        Assertions.assertFalse(settings.autoCreate());
        Assertions.assertEquals(Duration.ofMillis(250), settings.fetchTimeout());
        Assertions.assertEquals(2, settings.threads());
        Assertions.assertFalse(settings.dedupeMirrored());
    }

    @Test
    void rejectsBadValues() {
        List<Map<String, String>> bad = List.of(
                Map.of(BoardSettings.KEY_FETCH_TIMEOUT_MS, "0"),
                Map.of(BoardSettings.KEY_FETCH_TIMEOUT_MS, "fast"),
                Map.of(BoardSettings.KEY_SERVER_PORT, "70000"),
                Map.of(BoardSettings.KEY_THREADS, "0"),
                Map.of(BoardSettings.KEY_AUTO_CREATE, "maybe"),
                Map.of(BoardSettings.KEY_API_URL, "not a url"),
                Map.of(BoardSettings.KEY_REPOSITORIES, "just-a-name")
        );
        for (Map<String, String> values : bad) {
            Assertions.assertThrows(ValidationException.class, () -> BoardSettings.from(values, Map.of()), values.toString());
        }
    }
}
