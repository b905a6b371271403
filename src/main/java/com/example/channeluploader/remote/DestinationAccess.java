package com.example.channeluploader.remote;

public record DestinationAccess(
        String title,
        String type,
        String role
) {
}
