package com.example.channeluploader.remote;

import java.util.regex.Pattern;

/**
 * Masks bot credentials in text that may reach a log or the user.
 */
public final class Redactor {
    static final String MASK = "***";
    private static final Pattern TOKEN_SHAPE = Pattern.compile("\\d{8,10}:[A-Za-z0-9_-]{35}");

    private final String secret;

    public Redactor(String secret) {
        this.secret = secret;
    }

    public String redact(String text) {
        if (text == null) {
            return null;
        }
        String masked = text;
        if (secret != null && !secret.isBlank()) {
            masked = masked.replace(secret, MASK);
        }
        return TOKEN_SHAPE.matcher(masked).replaceAll(MASK);
    }
}
