package com.example.channeluploader.remote;

import java.io.FileNotFoundException;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * multipart/form-data request body whose file parts stream from disk.
 */
final class MultipartBody {
    private static final String LINE_FEED = "\r\n";
    private static final Random RANDOM = new SecureRandom();

    private final String boundary = createBoundary();
    private final List<HttpRequest.BodyPublisher> parts = new ArrayList<>();

    static String createBoundary() {
        String allowed = "0123456789abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";
        StringBuilder b = new StringBuilder();
        for (int i = 0; i < 32; i++) {
            b.append(allowed.charAt(RANDOM.nextInt(allowed.length())));
        }
        return b.toString();
    }

    String contentType() {
        return "multipart/form-data; boundary=" + boundary;
    }

    MultipartBody addFormField(String name, String value) {
        String part = "--" + boundary + LINE_FEED
                + "Content-Disposition: form-data; name=\"" + name + "\"" + LINE_FEED
                + "Content-Type: text/plain; charset=UTF-8" + LINE_FEED
                + LINE_FEED
                + value + LINE_FEED;
        parts.add(HttpRequest.BodyPublishers.ofString(part, StandardCharsets.UTF_8));
        return this;
    }

    MultipartBody addFilePart(String name, Path file, String fileName, String mediaType) throws FileNotFoundException {
        String header = "--" + boundary + LINE_FEED
                + "Content-Disposition: form-data; name=\"" + name + "\"; filename=\"" + escape(fileName) + "\"" + LINE_FEED
                + "Content-Type: " + mediaType + LINE_FEED
                + LINE_FEED;
        parts.add(HttpRequest.BodyPublishers.ofString(header, StandardCharsets.UTF_8));
        parts.add(HttpRequest.BodyPublishers.ofFile(file));
        parts.add(HttpRequest.BodyPublishers.ofString(LINE_FEED, StandardCharsets.UTF_8));
        return this;
    }

    HttpRequest.BodyPublisher build() {
        List<HttpRequest.BodyPublisher> all = new ArrayList<>(parts);
        all.add(HttpRequest.BodyPublishers.ofString("--" + boundary + "--" + LINE_FEED, StandardCharsets.UTF_8));
        return HttpRequest.BodyPublishers.concat(all.toArray(new HttpRequest.BodyPublisher[0]));
    }

    private static String escape(String fileName) {
        return fileName.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
