package com.example.channeluploader;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

public class ConfigLoader {
    static final String TOKEN_ENV = "UPLOADER_BOT_TOKEN";
    static final long DEFAULT_MAX_OBJECT_SIZE = 2L * 1024 * 1024 * 1024;
    static final long DEFAULT_MAX_PAYLOAD_BYTES = 10L * 1024 * 1024;
    private static final String DEFAULT_INDEX_SERVER = "http://localhost:3000";
    private static final String DEFAULT_TRANSFER_API = "https://api.telegram.org";
    private static final int DEFAULT_MAX_ATTEMPTS = 5;
    private static final long DEFAULT_BASE_DELAY_MILLIS = 1000;
    private static final long DEFAULT_MAX_DELAY_MILLIS = 300_000;
    private static final int DEFAULT_FILE_RETRY_ATTEMPTS = 3;
    private static final Pattern TOKEN_FORMAT = Pattern.compile("^\\d{8,10}:[A-Za-z0-9_-]{35}$");
    private static final Pattern CHANNEL_FORMAT = Pattern.compile("^(@\\w{5,32}|-100\\d{10,})$");
    private static final List<String> DEFAULT_EXCLUDE_FILES = List.of(
            "Thumbs.db",
            "desktop.ini",
            "ehthumbs.db",
            ".DS_Store",
            "pagefile.sys",
            "hiberfil.sys",
            "swapfile.sys"
    );
    private static final List<String> DEFAULT_EXCLUDE_DIRECTORIES = List.of(
            "$RECYCLE.BIN",
            "System Volume Information"
    );

    private final ObjectMapper mapper;
    private final Map<String, String> environment;

    public ConfigLoader() {
        this(System.getenv());
    }

    ConfigLoader(Map<String, String> environment) {
        this.environment = environment;
        mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public UploaderConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);

        String botToken = optionalString(raw.botToken, environment.get(TOKEN_ENV));
        if (botToken == null) {
            throw new IllegalArgumentException("Config must include botToken (or set " + TOKEN_ENV + ").");
        }
        botToken = botToken.trim();
        if (!TOKEN_FORMAT.matcher(botToken).matches()) {
            throw new IllegalArgumentException("Invalid bot token format. Expected '<digits>:<35 characters>'.");
        }

        String channelId = optionalString(raw.channelId, null);
        if (channelId == null) {
            throw new IllegalArgumentException("Config must include channelId.");
        }
        channelId = channelId.trim();
        if (!CHANNEL_FORMAT.matcher(channelId).matches()) {
            throw new IllegalArgumentException("Invalid channel ID '" + channelId
                    + "'. Use @channelname or -100 followed by the numeric ID.");
        }

        String folder = optionalString(raw.folder, null);
        if (folder == null) {
            throw new IllegalArgumentException("Config must include folder.");
        }

        boolean updateMode = raw.updateMode != null && raw.updateMode;
        URI indexServerUrl = httpUri("indexServerUrl", optionalString(raw.indexServerUrl, DEFAULT_INDEX_SERVER));
        URI transferApiUrl = httpUri("transferApiUrl", optionalString(raw.transferApiUrl, DEFAULT_TRANSFER_API));
        long maxObjectSize = raw.maxObjectSize != null && raw.maxObjectSize > 0
                ? raw.maxObjectSize
                : DEFAULT_MAX_OBJECT_SIZE;
        long maxPayloadBytes = raw.maxPayloadBytes != null && raw.maxPayloadBytes > 0
                ? raw.maxPayloadBytes
                : DEFAULT_MAX_PAYLOAD_BYTES;
        int maxAttempts = raw.maxAttempts != null && raw.maxAttempts > 0
                ? raw.maxAttempts
                : DEFAULT_MAX_ATTEMPTS;
        long baseDelayMillis = raw.baseDelayMillis != null && raw.baseDelayMillis >= 0
                ? raw.baseDelayMillis
                : DEFAULT_BASE_DELAY_MILLIS;
        long maxDelayMillis = raw.maxDelayMillis != null && raw.maxDelayMillis >= 0
                ? raw.maxDelayMillis
                : DEFAULT_MAX_DELAY_MILLIS;
        if (maxDelayMillis < baseDelayMillis) {
            throw new IllegalArgumentException("maxDelayMillis must not be smaller than baseDelayMillis.");
        }
        int fileRetryAttempts = raw.fileRetryAttempts != null && raw.fileRetryAttempts > 0
                ? raw.fileRetryAttempts
                : DEFAULT_FILE_RETRY_ATTEMPTS;
        boolean followLinks = raw.followLinks != null && raw.followLinks;

        List<String> excludeFilePatterns = mergePatterns(DEFAULT_EXCLUDE_FILES, raw.excludeFilePatterns);
        List<String> excludeDirectoryPatterns = mergePatterns(DEFAULT_EXCLUDE_DIRECTORIES, raw.excludeDirectoryPatterns);
        Optional<Path> reportFile = Optional.ofNullable(optionalString(raw.reportFile, null)).map(Path::of);

        return new UploaderConfig(
                botToken,
                channelId,
                Path.of(folder),
                updateMode,
                indexServerUrl,
                transferApiUrl,
                maxObjectSize,
                maxPayloadBytes,
                maxAttempts,
                Duration.ofMillis(baseDelayMillis),
                Duration.ofMillis(maxDelayMillis),
                fileRetryAttempts,
                followLinks,
                excludeFilePatterns,
                excludeDirectoryPatterns,
                reportFile
        );
    }

    private URI httpUri(String key, String value) {
        URI uri;
        try {
            uri = URI.create(value.trim());
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(key + " is not a valid URL: " + value, ex);
        }
        if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())) {
            throw new IllegalArgumentException(key + " must be an http or https URL: " + value);
        }
        return uri;
    }

    private List<String> mergePatterns(List<String> defaults, List<String> overrides) {
        List<String> merged = new ArrayList<>(defaults);
        if (overrides != null) {
            for (String pattern : overrides) {
                if (pattern == null || pattern.isBlank() || merged.contains(pattern)) {
                    continue;
                }
                merged.add(pattern);
            }
        }
        return List.copyOf(merged);
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback == null || fallback.isBlank() ? null : fallback;
        }
        return value;
    }

    private static class RawConfig {
        public String botToken;
        public String channelId;
        public String folder;
        public Boolean updateMode;
        public String indexServerUrl;
        public String transferApiUrl;
        public Long maxObjectSize;
        public Long maxPayloadBytes;
        public Integer maxAttempts;
        public Long baseDelayMillis;
        public Long maxDelayMillis;
        public Integer fileRetryAttempts;
        public Boolean followLinks;
        public List<String> excludeFilePatterns;
        public List<String> excludeDirectoryPatterns;
        public String reportFile;
    }
}
