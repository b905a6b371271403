package com.example.channeluploader.tree;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One uploadable file inside a {@link TreeNode}.
 * <p>
 * The remote object id and message id are always assigned together; an entry either
 * carries both or neither.
 */
public final class FileEntry {
    private final String name;
    private final long size;
    private final Path localPath;
    private String remoteObjectId;
    private Long remoteMessageId;
    private boolean skipTransfer;

    public FileEntry(String name, long size, Path localPath) {
        this.name = Objects.requireNonNull(name, "name");
        this.size = size;
        this.localPath = localPath;
    }

    /**
     * Creates an entry as it arrives from the index server, without a local path.
     */
    public static FileEntry remote(String name, long size, String remoteObjectId, Long remoteMessageId) {
        FileEntry entry = new FileEntry(name, size, null);
        if (remoteObjectId != null || remoteMessageId != null) {
            if (remoteObjectId == null || remoteMessageId == null) {
                throw new TreeFormatException("File '" + name + "' carries only one of fileId/messageId");
            }
            entry.assignRemote(remoteObjectId, remoteMessageId);
        }
        return entry;
    }

    public String name() {
        return name;
    }

    public long size() {
        return size;
    }

    public Path localPath() {
        return localPath;
    }

    public String remoteObjectId() {
        return remoteObjectId;
    }

    public Long remoteMessageId() {
        return remoteMessageId;
    }

    public boolean hasRemote() {
        return remoteObjectId != null;
    }

    public boolean skipTransfer() {
        return skipTransfer;
    }

    /**
     * Records the identifiers returned by a successful transfer (or carried forward from a
     * previous tree).
     */
    public void assignRemote(String objectId, long messageId) {
        this.remoteObjectId = Objects.requireNonNull(objectId, "objectId");
        this.remoteMessageId = messageId;
    }

    void markSkipTransfer() {
        this.skipTransfer = true;
    }

    @Override
    public String toString() {
        return "FileEntry{" + name + ", " + size + " bytes"
                + (hasRemote() ? ", fileId=" + remoteObjectId + ", messageId=" + remoteMessageId : "")
                + (skipTransfer ? ", skip" : "") + "}";
    }
}
