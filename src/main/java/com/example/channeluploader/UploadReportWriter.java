package com.example.channeluploader;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Writes the outcome of a run to a JSON file.
 */
public final class UploadReportWriter {
    private final ObjectMapper mapper;
    private final Path reportPath;

    public UploadReportWriter(Path reportPath) {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.reportPath = reportPath;
    }

    /**
     * Writes the report, creating the parent directories if needed. Replaces any previous report.
     */
    public void write(UploaderConfig config, UploadResult result) throws IOException {
        Path parent = reportPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        UploadReport report = new UploadReport(
                Instant.now(),
                config.channelId(),
                config.folder().toString(),
                config.updateMode(),
                result);
        mapper.writerWithDefaultPrettyPrinter().writeValue(reportPath.toFile(), report);
    }

    public Path path() {
        return reportPath;
    }

    record UploadReport(Instant generatedAt, String channelId, String folder, boolean updateMode, UploadResult result) {
    }
}
