package com.example.channeluploader.remote;

import com.example.channeluploader.tree.TreeCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * {@link TransferClient} over a Telegram-style bot HTTP API: files are posted to a
 * channel as documents and addressed afterwards by file id and message id.
 */
public final class BotApiTransferClient implements TransferClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(BotApiTransferClient.class);

    static final Duration API_TIMEOUT = Duration.ofSeconds(30);
    static final Duration MIN_TRANSFER_TIMEOUT = Duration.ofSeconds(60);
    static final Duration MAX_TRANSFER_TIMEOUT = Duration.ofMinutes(30);
    static final Duration DEFAULT_RATE_LIMIT_WAIT = Duration.ofSeconds(30);
    private static final long ASSUMED_BYTES_PER_SECOND = 256L * 1024;
    private static final String[] MEDIA_FIELDS = {"document", "video", "audio", "animation", "voice", "photo"};

    private static final Map<String, String> FRIENDLY_ERRORS = new LinkedHashMap<>();

    static {
        FRIENDLY_ERRORS.put("chat not found", "Channel not found. Check the channel ID is correct.");
        FRIENDLY_ERRORS.put("have no rights", "Bot lacks permissions. Add the bot as admin with posting rights.");
        FRIENDLY_ERRORS.put("TOKEN_INVALID", "Bot token is invalid or revoked.");
        FRIENDLY_ERRORS.put("Unauthorized", "Bot token is invalid or revoked.");
        FRIENDLY_ERRORS.put("message is too long", "File name is too long. Rename the file.");
        FRIENDLY_ERRORS.put("Too Many Requests", "Too many requests. Please wait and try again.");
        FRIENDLY_ERRORS.put("bot was blocked by the user", "Bot was blocked by user.");
        FRIENDLY_ERRORS.put("CHAT_WRITE_FORBIDDEN", "Bot cannot write to this channel. Add the bot as admin.");
        FRIENDLY_ERRORS.put("Request Entity Too Large", "File is too large for the transfer API.");
        FRIENDLY_ERRORS.put("file is too big", "File is too large for the transfer API.");
    }

    private final URI apiBase;
    private final String token;
    private final long maxObjectSize;
    private final RetryPolicy retryPolicy;
    private final MediaTypes mediaTypes;
    private final Redactor redactor;
    private final ObjectMapper mapper = new ObjectMapper();
    private final ExecutorService executor;
    private final HttpClient client;
    private volatile BotIdentity identity;
    private volatile boolean closed;

    public BotApiTransferClient(URI apiBase, String token, long maxObjectSize, RetryPolicy retryPolicy) {
        this(apiBase, token, maxObjectSize, retryPolicy, new MediaTypes());
    }

    public BotApiTransferClient(URI apiBase, String token, long maxObjectSize, RetryPolicy retryPolicy, MediaTypes mediaTypes) {
        this.apiBase = apiBase;
        this.token = token;
        this.maxObjectSize = maxObjectSize;
        this.retryPolicy = retryPolicy;
        this.mediaTypes = mediaTypes;
        this.redactor = new Redactor(token);
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "transfer-http");
            thread.setDaemon(true);
            return thread;
        });
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .executor(executor)
                .build();
    }

    @Override
    public RemoteResult<BotIdentity> validateCredential() {
        RemoteResult<JsonNode> result = retryPolicy.execute("getMe", () -> invoke("getMe", get("getMe", Map.of())));
        if (!result.isSuccess()) {
            return result.propagate();
        }
        JsonNode me = result.value();
        if (!me.path("id").canConvertToLong() || !me.path("username").isTextual()) {
            return RemoteResult.rejected("Incomplete identity returned by the transfer API");
        }
        BotIdentity validated = new BotIdentity(me.get("id").asLong(), me.get("username").asText());
        identity = validated;
        return RemoteResult.success(validated);
    }

    @Override
    public RemoteResult<DestinationAccess> checkDestinationPermission(String destinationId) {
        BotIdentity self = identity;
        if (self == null) {
            RemoteResult<BotIdentity> validated = validateCredential();
            if (!validated.isSuccess()) {
                return validated.propagate();
            }
            self = validated.value();
        }

        RemoteResult<JsonNode> chat = retryPolicy.execute("getChat",
                () -> invoke("getChat", get("getChat", Map.of("chat_id", destinationId))));
        if (!chat.isSuccess()) {
            return chat.propagate();
        }

        String userId = Long.toString(self.id());
        RemoteResult<JsonNode> member = retryPolicy.execute("getChatMember",
                () -> invoke("getChatMember", get("getChatMember", Map.of("chat_id", destinationId, "user_id", userId))));
        if (!member.isSuccess()) {
            return member.propagate();
        }

        String role = member.value().path("status").asText("unknown");
        String title = chat.value().path("title").asText(destinationId);
        String type = chat.value().path("type").asText("unknown");
        if ("creator".equals(role)) {
            return RemoteResult.success(new DestinationAccess(title, type, role));
        }
        if ("administrator".equals(role)) {
            if (!member.value().path("can_post_messages").asBoolean(false)) {
                return RemoteResult.rejected("Bot is admin but lacks permission to post messages. "
                        + "Enable \"Post Messages\" in the bot's admin rights.");
            }
            return RemoteResult.success(new DestinationAccess(title, type, role));
        }
        return RemoteResult.rejected("Bot must be administrator in the channel. Current status: " + role);
    }

    @Override
    public RemoteResult<TransferReceipt> transferObject(String destinationId, Path localPath) {
        String fileName = localPath.getFileName().toString();
        if (!Files.isRegularFile(localPath)) {
            return RemoteResult.rejected("File not found: " + fileName);
        }
        long size;
        try {
            size = Files.size(localPath);
        } catch (IOException ex) {
            return RemoteResult.rejected("Cannot read file: " + fileName);
        }
        if (size == 0) {
            return RemoteResult.rejected("File is empty: " + fileName);
        }
        if (size > maxObjectSize) {
            return RemoteResult.rejected("File too large: " + fileName + " (" + size + " bytes, limit " + maxObjectSize + ")");
        }
        String mediaType = mediaTypes.detect(localPath);
        return retryPolicy.execute("sendDocument " + fileName,
                () -> sendDocument(destinationId, localPath, fileName, size, mediaType));
    }

    @Override
    public boolean deleteObject(String destinationId, long messageId) {
        String form = "chat_id=" + encode(destinationId) + "&message_id=" + messageId;
        HttpRequest request = HttpRequest.newBuilder(methodUri("deleteMessage", Map.of()))
                .timeout(API_TIMEOUT)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(form, StandardCharsets.UTF_8))
                .build();
        RemoteResult<JsonNode> result = invoke("deleteMessage", request);
        if (!result.isSuccess()) {
            LOGGER.warn("Failed to delete message {} in {}: {}", messageId, destinationId, result.message());
            return false;
        }
        return true;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        executor.shutdownNow();
    }

    /**
     * Request timeout for a payload of {@code size} bytes: proportional to the size, kept
     * within {@link #MIN_TRANSFER_TIMEOUT} and {@link #MAX_TRANSFER_TIMEOUT}.
     */
    static Duration transferTimeout(long size) {
        Duration scaled = MIN_TRANSFER_TIMEOUT.plusSeconds(size / ASSUMED_BYTES_PER_SECOND);
        return scaled.compareTo(MAX_TRANSFER_TIMEOUT) > 0 ? MAX_TRANSFER_TIMEOUT : scaled;
    }

    static String translateError(String description) {
        for (Map.Entry<String, String> entry : FRIENDLY_ERRORS.entrySet()) {
            if (description.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return description;
    }

    private RemoteResult<TransferReceipt> sendDocument(String destinationId, Path file, String fileName, long size, String mediaType) {
        MultipartBody body = new MultipartBody().addFormField("chat_id", destinationId);
        try {
            body.addFilePart("document", file, fileName, mediaType);
        } catch (FileNotFoundException ex) {
            return RemoteResult.rejected("File not found: " + fileName);
        }
        HttpRequest request = HttpRequest.newBuilder(methodUri("sendDocument", Map.of()))
                .timeout(transferTimeout(size))
                .header("Content-Type", body.contentType())
                .POST(body.build())
                .build();
        RemoteResult<JsonNode> result = invoke("sendDocument", request);
        if (!result.isSuccess()) {
            return result.propagate();
        }
        JsonNode message = result.value();
        String objectId = extractFileId(message);
        long messageId = message.path("message_id").asLong(0);
        if (!TreeCodec.isValidObjectId(objectId) || !TreeCodec.isValidMessageId(messageId)) {
            LOGGER.warn("Transfer of {} returned an incomplete message: file id present={}, message id={}",
                    fileName, objectId != null, messageId);
            return RemoteResult.rejected("Incomplete response from transfer API for " + fileName
                    + ": missing or malformed file reference");
        }
        return RemoteResult.success(new TransferReceipt(objectId, messageId, fileName));
    }

    private static String extractFileId(JsonNode message) {
        for (String field : MEDIA_FIELDS) {
            JsonNode media = message.get(field);
            if (media == null || media.isNull()) {
                continue;
            }
            if (media.isArray()) {
                // Photos come as several sizes; the last one is the largest.
                JsonNode largest = media.size() == 0 ? null : media.get(media.size() - 1);
                return largest == null ? null : largest.path("file_id").asText(null);
            }
            return media.path("file_id").asText(null);
        }
        return null;
    }

    private RemoteResult<JsonNode> invoke(String method, HttpRequest request) {
        if (closed) {
            return RemoteResult.rejected("Transfer client is closed");
        }
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException ex) {
            LOGGER.debug("{} timed out", method);
            return RemoteResult.transientFailure("Request timed out (" + method + ")");
        } catch (IOException ex) {
            String detail = redactor.redact(String.valueOf(ex.getMessage()));
            LOGGER.debug("{} transport failure: {}", method, detail);
            return RemoteResult.transientFailure("Network error (" + method + "): " + detail);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return RemoteResult.cancelled();
        }

        int status = response.statusCode();
        if (!JsonResponses.isJson(response)) {
            LOGGER.debug("{} answered HTTP {} with content type '{}'", method, status, JsonResponses.contentType(response));
            if (status == 429) {
                return RemoteResult.rateLimited("Rate limited (" + method + ")",
                        JsonResponses.retryAfterHeader(response).orElse(DEFAULT_RATE_LIMIT_WAIT));
            }
            if (status == 413) {
                return RemoteResult.rejected("File is too large for the transfer API.");
            }
            return RemoteResult.transientFailure("Unexpected response from transfer API (HTTP " + status + ")");
        }

        JsonNode body;
        try {
            body = mapper.readTree(response.body());
        } catch (JsonProcessingException ex) {
            return RemoteResult.transientFailure("Malformed response from transfer API (HTTP " + status + ")");
        }
        if (body.path("ok").asBoolean(false)) {
            return RemoteResult.success(body.path("result"));
        }
        return classify(method, status, body, response);
    }

    private RemoteResult<JsonNode> classify(String method, int status, JsonNode body, HttpResponse<String> response) {
        String description = redactor.redact(body.path("description").asText("Request failed (HTTP " + status + ")"));
        int errorCode = body.path("error_code").asInt(status);
        LOGGER.debug("{} failed with {}: {}", method, errorCode, description);

        if (errorCode == 429 || description.contains("Too Many Requests")) {
            Duration wait = JsonResponses.retryAfterField(body.path("parameters").get("retry_after"))
                    .or(() -> JsonResponses.retryAfterHeader(response))
                    .orElse(DEFAULT_RATE_LIMIT_WAIT);
            return RemoteResult.rateLimited("Rate limited. Retry after " + wait.toSeconds() + "s", wait);
        }
        if (errorCode == 500 || errorCode == 502 || errorCode == 503 || errorCode == 504) {
            return RemoteResult.transientFailure(description);
        }
        return RemoteResult.rejected(translateError(description));
    }

    private HttpRequest get(String method, Map<String, String> query) {
        return HttpRequest.newBuilder(methodUri(method, query))
                .timeout(API_TIMEOUT)
                .GET()
                .build();
    }

    private URI methodUri(String method, Map<String, String> query) {
        StringBuilder uri = new StringBuilder(apiBase.toString().replaceAll("/+$", ""))
                .append("/bot").append(token).append('/').append(method);
        String separator = "?";
        for (Map.Entry<String, String> entry : new TreeMap<>(query).entrySet()) {
            uri.append(separator).append(encode(entry.getKey())).append('=').append(encode(entry.getValue()));
            separator = "&";
        }
        return URI.create(uri.toString());
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
