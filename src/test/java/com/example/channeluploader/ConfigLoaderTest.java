package com.example.channeluploader;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    private static final String TOKEN = "123456789:" + "A".repeat(35);

    @Test
    void appliesDefaults() throws Exception {
        Path file = write("{\"botToken\":\"" + TOKEN + "\",\"channelId\":\"@example_channel\",\"folder\":\"/data\","
                + "\"someFutureSetting\":true}");

        UploaderConfig config = new ConfigLoader(Map.of()).load(file);

        assertEquals(TOKEN, config.botToken());
        assertEquals(Path.of("/data"), config.folder());
        assertFalse(config.updateMode());
        assertEquals("http://localhost:3000", config.indexServerUrl().toString());
        assertEquals("https://api.telegram.org", config.transferApiUrl().toString());
        assertEquals(ConfigLoader.DEFAULT_MAX_OBJECT_SIZE, config.maxObjectSize());
        assertEquals(ConfigLoader.DEFAULT_MAX_PAYLOAD_BYTES, config.maxPayloadBytes());
        assertEquals(5, config.maxAttempts());
        assertEquals(Duration.ofSeconds(1), config.baseDelay());
        assertEquals(Duration.ofMinutes(5), config.maxDelay());
        assertEquals(3, config.fileRetryAttempts());
        assertTrue(config.excludeFilePatterns().contains(".DS_Store"));
        assertTrue(config.excludeDirectoryPatterns().contains("$RECYCLE.BIN"));
        assertTrue(config.reportFile().isEmpty());
    }

    @Test
    void mergesUserPatternsAndOverrides() throws Exception {
        Path file = write("{\"botToken\":\"" + TOKEN + "\",\"channelId\":\"-1001234567890\",\"folder\":\"/data\","
                + "\"updateMode\":true,\"maxAttempts\":2,\"fileRetryAttempts\":4,\"reportFile\":\"out/report.json\","
                + "\"excludeFilePatterns\":[\"*.tmp\",\"Thumbs.db\"],\"excludeDirectoryPatterns\":[\"node_modules\"]}");

        UploaderConfig config = new ConfigLoader(Map.of()).load(file);

        assertTrue(config.updateMode());
        assertEquals(2, config.maxAttempts());
        assertEquals(4, config.fileRetryAttempts());
        assertEquals(Path.of("out/report.json"), config.reportFile().orElseThrow());
        assertEquals(1, config.excludeFilePatterns().stream().filter("Thumbs.db"::equals).count());
        assertTrue(config.excludeFilePatterns().contains("*.tmp"));
        assertTrue(config.excludeDirectoryPatterns().contains("node_modules"));
    }

    @Test
    void fallsBackToEnvironmentToken() throws Exception {
        Path file = write("{\"channelId\":\"@example_channel\",\"folder\":\"/data\"}");

        UploaderConfig config = new ConfigLoader(Map.of(ConfigLoader.TOKEN_ENV, TOKEN)).load(file);

        assertEquals(TOKEN, config.botToken());
    }

    @Test
    void rejectsMalformedTokenAndChannel() throws Exception {
        Path badToken = write("{\"botToken\":\"not-a-token\",\"channelId\":\"@example_channel\",\"folder\":\"/data\"}");
        Path badChannel = write("{\"botToken\":\"" + TOKEN + "\",\"channelId\":\"example\",\"folder\":\"/data\"}");
        Path noFolder = write("{\"botToken\":\"" + TOKEN + "\",\"channelId\":\"@example_channel\"}");
        ConfigLoader loader = new ConfigLoader(Map.of());

        IllegalArgumentException tokenError = assertThrows(IllegalArgumentException.class, () -> loader.load(badToken));
        assertFalse(tokenError.getMessage().contains("not-a-token"));
        assertThrows(IllegalArgumentException.class, () -> loader.load(badChannel));
        assertThrows(IllegalArgumentException.class, () -> loader.load(noFolder));
    }

    @Test
    void rejectsNonHttpServerUrl() throws Exception {
        Path file = write("{\"botToken\":\"" + TOKEN + "\",\"channelId\":\"@example_channel\",\"folder\":\"/data\","
                + "\"indexServerUrl\":\"ftp://example.org\"}");

        assertThrows(IllegalArgumentException.class, () -> new ConfigLoader(Map.of()).load(file));
    }

    private static Path write(String json) throws Exception {
        Path file = Files.createTempFile("uploader-config", ".json");
        Files.writeString(file, json);
        return file;
    }
}
