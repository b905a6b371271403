package com.example.channeluploader.remote;

/**
 * Identifiers of an object stored by a successful transfer.
 */
public record TransferReceipt(
        String objectId,
        long messageId,
        String fileName
) {
}
