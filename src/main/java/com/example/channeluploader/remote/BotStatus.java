package com.example.channeluploader.remote;

public record BotStatus(
        String status,
        String botId,
        String botUsername,
        boolean ownerRegistered
) {
}
