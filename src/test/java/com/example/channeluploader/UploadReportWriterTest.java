package com.example.channeluploader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UploadReportWriterTest {
    @Test
    void writesResultWithFailureHistory() throws Exception {
        Path output = Files.createTempDirectory("report-output").resolve("nested").resolve("report.json");
        UploaderConfig config = new UploaderConfig(
                "123456789:" + "A".repeat(35),
                "@example_channel",
                Path.of("/data"),
                true,
                URI.create("http://localhost:3000"),
                URI.create("https://api.telegram.org"),
                1024,
                1024,
                3,
                Duration.ZERO,
                Duration.ZERO,
                3,
                false,
                List.of(),
                List.of(),
                Optional.of(output)
        );
        Instant at = Instant.parse("2024-05-01T10:15:30Z");
        FailedFileRecord failure = new FailedFileRecord("sub/b.txt", 6, 3, 3, at, "Request timed out",
                List.of(new RetryAttempt(1, at, "TRANSIENT", "Request timed out")));
        UploadResult result = new UploadResult(UploadStage.DONE, true, "bot_1", "active", "Metadata updated",
                1, 4, 1, 0, 20.0, List.of("Failed to upload sub/b.txt: Request timed out"), List.of(), List.of(failure));

        new UploadReportWriter(output).write(config, result);

        JsonNode report = new ObjectMapper().readTree(output.toFile());
        assertEquals("@example_channel", report.get("channelId").asText());
        assertTrue(report.get("updateMode").asBoolean());
        assertEquals("DONE", report.get("result").get("stage").asText());
        assertEquals(1, report.get("result").get("uploaded").asInt());
        JsonNode failed = report.get("result").get("failedFiles").get(0);
        assertEquals("sub/b.txt", failed.get("relativePath").asText());
        assertEquals("2024-05-01T10:15:30Z", failed.get("lastAttemptTime").asText());
        assertEquals("TRANSIENT", failed.get("retryAttempts").get(0).get("outcome").asText());
        assertTrue(report.get("generatedAt").isTextual());
        assertFalse(Files.readString(output).contains("A".repeat(35)));
    }
}
