package com.example.channeluploader;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Immutable runtime settings for the uploader.
 */
public record UploaderConfig(
        String botToken,
        String channelId,
        Path folder,
        boolean updateMode,
        URI indexServerUrl,
        URI transferApiUrl,
        long maxObjectSize,
        long maxPayloadBytes,
        int maxAttempts,
        Duration baseDelay,
        Duration maxDelay,
        int fileRetryAttempts,
        boolean followLinks,
        List<String> excludeFilePatterns,
        List<String> excludeDirectoryPatterns,
        Optional<Path> reportFile
) {
    @Override
    public String toString() {
        return "UploaderConfig{channelId=" + channelId
                + ", folder=" + folder
                + ", updateMode=" + updateMode
                + ", indexServerUrl=" + indexServerUrl
                + ", transferApiUrl=" + transferApiUrl
                + ", maxAttempts=" + maxAttempts
                + ", fileRetryAttempts=" + fileRetryAttempts + "}";
    }
}
