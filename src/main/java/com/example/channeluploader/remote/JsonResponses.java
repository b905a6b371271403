package com.example.channeluploader.remote;

import com.fasterxml.jackson.databind.JsonNode;

import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

final class JsonResponses {

    private JsonResponses() {
    }

    static String contentType(HttpResponse<?> response) {
        return response.headers().firstValue("Content-Type").orElse("");
    }

    /**
     * True when the response declares a JSON body. Anything else (typically an HTML error
     * page from a proxy) must not be parsed.
     */
    static boolean isJson(HttpResponse<?> response) {
        String type = contentType(response).toLowerCase(Locale.ROOT);
        return type.startsWith("application/json") || type.startsWith("application/problem+json");
    }

    static Optional<Duration> retryAfterHeader(HttpResponse<?> response) {
        return response.headers().firstValue("Retry-After").flatMap(JsonResponses::parseSeconds);
    }

    static Optional<Duration> retryAfterField(JsonNode node) {
        if (node != null && node.canConvertToLong() && node.asLong() >= 0) {
            return Optional.of(Duration.ofSeconds(node.asLong()));
        }
        return Optional.empty();
    }

    /**
     * Reads a {@code details} array whose items are plain strings or {@code {"msg": ...}}.
     */
    static List<String> details(JsonNode body) {
        List<String> details = new ArrayList<>();
        JsonNode array = body.path("details");
        if (array.isArray()) {
            for (JsonNode item : array) {
                if (item.isTextual()) {
                    details.add(item.asText());
                } else if (item.has("msg")) {
                    details.add(item.get("msg").asText());
                } else {
                    details.add(item.toString());
                }
            }
        }
        return details;
    }

    private static Optional<Duration> parseSeconds(String value) {
        try {
            long seconds = Long.parseLong(value.trim());
            return seconds < 0 ? Optional.empty() : Optional.of(Duration.ofSeconds(seconds));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }
}
