package com.example.channeluploader.remote;

/**
 * The bot behind the credential, as reported by the transfer API.
 */
public record BotIdentity(
        long id,
        String username
) {
    /**
     * Username in {@code @name} form, as the index server expects it.
     */
    public String handle() {
        return username.startsWith("@") ? username : "@" + username;
    }
}
