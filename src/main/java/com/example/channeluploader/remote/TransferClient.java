package com.example.channeluploader.remote;

import java.nio.file.Path;

/**
 * Remote object store reached through a bot account. Methods report failures through
 * {@link RemoteResult} and do not throw.
 */
public interface TransferClient extends AutoCloseable {

    RemoteResult<BotIdentity> validateCredential();

    /**
     * Succeeds only when the bot may post to {@code destinationId}.
     */
    RemoteResult<DestinationAccess> checkDestinationPermission(String destinationId);

    RemoteResult<TransferReceipt> transferObject(String destinationId, Path localPath);

    /**
     * Best-effort removal of a previously transferred object.
     */
    boolean deleteObject(String destinationId, long messageId);

    @Override
    void close();
}
