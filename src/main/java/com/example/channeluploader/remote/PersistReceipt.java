package com.example.channeluploader.remote;

/**
 * Index server's answer to an accepted tree upload. {@code changePercentage} is only
 * reported for updates.
 */
public record PersistReceipt(
        String botId,
        String status,
        String message,
        boolean update,
        Double changePercentage
) {
}
