package com.example.channeluploader.remote;

import com.example.channeluploader.tree.TreeCodec;
import com.example.channeluploader.tree.TreeFormatException;
import com.example.channeluploader.tree.TreeNode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

/**
 * {@link IndexClient} for the metadata index server's JSON API.
 */
public final class HttpIndexClient implements IndexClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpIndexClient.class);

    static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);
    static final Duration DEFAULT_RATE_LIMIT_WAIT = Duration.ofSeconds(60);

    private final URI baseUrl;
    private final long maxPayloadBytes;
    private final RetryPolicy retryPolicy;
    private final ObjectMapper mapper;
    private final TreeCodec codec;
    private final Redactor redactor = new Redactor(null);
    private final ExecutorService executor;
    private final HttpClient client;
    private volatile boolean closed;

    public HttpIndexClient(URI baseUrl, long maxPayloadBytes, RetryPolicy retryPolicy) {
        this.baseUrl = baseUrl;
        this.maxPayloadBytes = maxPayloadBytes;
        this.retryPolicy = retryPolicy;
        this.mapper = new ObjectMapper();
        this.codec = new TreeCodec(mapper);
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "index-http");
            thread.setDaemon(true);
            return thread;
        });
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .executor(executor)
                .build();
    }

    @Override
    public RemoteResult<Boolean> probeConnectivity() {
        HttpRequest request = HttpRequest.newBuilder(resolve("/health"))
                .timeout(REQUEST_TIMEOUT)
                .GET()
                .build();
        return retryPolicy.execute("GET /health", () -> {
            RemoteResult<HttpResponse<String>> response = send("GET /health", request);
            if (!response.isSuccess()) {
                return response.propagate();
            }
            int status = response.value().statusCode();
            if (status / 100 != 2) {
                return RemoteResult.transientFailure("Index server health check failed (HTTP " + status + ")");
            }
            return RemoteResult.success(Boolean.TRUE);
        });
    }

    @Override
    public RemoteResult<BotStatus> fetchStatus(String identityToken) {
        return retryPolicy.execute("GET /api/bot-status", () -> this.<BotStatus>getJson(
                "GET /api/bot-status/{token}",
                "/api/bot-status/" + encode(identityToken),
                "No bot registered for this token",
                body -> RemoteResult.success(new BotStatus(
                        body.path("status").asText(null),
                        body.path("botId").isNull() ? null : body.path("botId").asText(null),
                        body.path("botUsername").asText(null),
                        body.path("ownerRegistered").asBoolean(false)))));
    }

    @Override
    public RemoteResult<TreeNode> fetchTree(String identityToken) {
        return retryPolicy.execute("GET /api/bot-metadata", () -> this.<TreeNode>getJson(
                "GET /api/bot-metadata/{token}",
                "/api/bot-metadata/" + encode(identityToken),
                "No existing metadata found",
                body -> {
                    JsonNode metadata = body.get("metadata");
                    if (metadata == null || metadata.isNull()) {
                        return RemoteResult.notFound("No existing metadata found");
                    }
                    try {
                        return RemoteResult.success(codec.deserialize(metadata));
                    } catch (TreeFormatException ex) {
                        LOGGER.warn("Index server returned a malformed tree: {}", ex.getMessage());
                        return RemoteResult.rejected("Stored metadata is malformed: " + ex.getMessage());
                    }
                }));
    }

    @Override
    public RemoteResult<PersistReceipt> persistTree(String identityToken, String destinationId, String identity, TreeNode tree) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("botToken", identityToken);
        payload.put("channelId", destinationId);
        payload.put("botUsername", identity);
        try {
            payload.set("metadata", codec.serialize(tree));
        } catch (TreeFormatException ex) {
            return RemoteResult.rejected("Cannot send metadata: " + ex.getMessage());
        }

        byte[] body;
        try {
            body = mapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException ex) {
            return RemoteResult.rejected("Cannot encode metadata: " + ex.getOriginalMessage());
        }
        if (body.length > maxPayloadBytes) {
            return RemoteResult.payloadTooLarge(String.format(Locale.ROOT,
                    "Metadata too large (%.2f MB). Maximum is %.2f MB.",
                    body.length / 1024.0 / 1024.0, maxPayloadBytes / 1024.0 / 1024.0));
        }

        HttpRequest request = HttpRequest.newBuilder(resolve("/api/upload"))
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();
        return retryPolicy.execute("POST /api/upload", () -> {
            RemoteResult<JsonNode> response = exchange("POST /api/upload", request, null);
            if (!response.isSuccess()) {
                return response.propagate();
            }
            JsonNode json = response.value();
            JsonNode percentage = json.get("changePercentage");
            return RemoteResult.success(new PersistReceipt(
                    json.path("botId").isNull() ? null : json.path("botId").asText(null),
                    json.path("status").asText(null),
                    json.path("message").asText(null),
                    json.path("isUpdate").asBoolean(false),
                    percentage == null || !percentage.isNumber() ? null : percentage.asDouble()));
        });
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        executor.shutdownNow();
    }

    private <T> RemoteResult<T> getJson(String label, String path, String notFoundMessage, Function<JsonNode, RemoteResult<T>> reader) {
        HttpRequest request = HttpRequest.newBuilder(resolve(path))
                .timeout(REQUEST_TIMEOUT)
                .GET()
                .build();
        RemoteResult<JsonNode> response = exchange(label, request, notFoundMessage);
        if (!response.isSuccess()) {
            return response.propagate();
        }
        return reader.apply(response.value());
    }

    /**
     * Sends a request and maps the reply onto a result kind. A null {@code notFoundMessage}
     * means a 404 is treated like any other rejection.
     */
    private RemoteResult<JsonNode> exchange(String label, HttpRequest request, String notFoundMessage) {
        RemoteResult<HttpResponse<String>> sent = send(label, request);
        if (!sent.isSuccess()) {
            return sent.propagate();
        }
        HttpResponse<String> response = sent.value();
        int status = response.statusCode();
        LOGGER.debug("{} -> HTTP {}", label, status);

        if (status == 404 && notFoundMessage != null) {
            return RemoteResult.notFound(notFoundMessage);
        }
        if (status == 413) {
            return RemoteResult.payloadTooLarge("Metadata too large for the index server");
        }
        if (status == 502 || status == 503 || status == 504) {
            return RemoteResult.transientFailure("Index server unavailable (HTTP " + status + ")");
        }
        if (!JsonResponses.isJson(response)) {
            if (status == 429) {
                return RemoteResult.rateLimited("Rate limited by index server",
                        JsonResponses.retryAfterHeader(response).orElse(DEFAULT_RATE_LIMIT_WAIT));
            }
            LOGGER.warn("{} answered HTTP {} with content type '{}'", label, status, JsonResponses.contentType(response));
            return RemoteResult.transientFailure("Unexpected response from index server (HTTP " + status + ")");
        }

        JsonNode body;
        try {
            body = mapper.readTree(response.body());
        } catch (JsonProcessingException ex) {
            return RemoteResult.rejected("Index server sent malformed JSON (HTTP " + status + ")");
        }
        if (body == null || !body.isObject()) {
            return RemoteResult.rejected("Index server sent an unexpected body (HTTP " + status + ")");
        }

        if (status == 429) {
            Duration wait = JsonResponses.retryAfterHeader(response)
                    .or(() -> JsonResponses.retryAfterField(body.get("retryAfter")))
                    .orElse(DEFAULT_RATE_LIMIT_WAIT);
            return RemoteResult.rateLimited("Rate limited. Retry after " + wait.toSeconds() + "s", wait);
        }
        if (status / 100 != 2 || !body.path("success").asBoolean(false)) {
            String error = body.path("error").asText("Index server rejected the request (HTTP " + status + ")");
            return RemoteResult.rejected(error, JsonResponses.details(body));
        }
        return RemoteResult.success(body);
    }

    private RemoteResult<HttpResponse<String>> send(String label, HttpRequest request) {
        if (closed) {
            return RemoteResult.rejected("Index client is closed");
        }
        try {
            return RemoteResult.success(client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8)));
        } catch (HttpTimeoutException ex) {
            LOGGER.debug("{} timed out", label);
            return RemoteResult.transientFailure("Index server request timed out");
        } catch (IOException ex) {
            LOGGER.debug("{} transport failure: {}", label, redactor.redact(ex.toString()));
            return RemoteResult.transientFailure("Cannot reach index server: " + ex.getClass().getSimpleName());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return RemoteResult.cancelled();
        }
    }

    private URI resolve(String path) {
        return URI.create(baseUrl.toString().replaceAll("/+$", "") + path);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
