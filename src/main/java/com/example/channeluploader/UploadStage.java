package com.example.channeluploader;

/**
 * Orchestrator states, in the order a run passes through them. {@link #DIFFING} is only
 * entered in update mode. The last three are terminal.
 */
public enum UploadStage {
    VALIDATING,
    SCANNING,
    DIFFING,
    DELETING,
    TRANSFERRING,
    PERSISTING,
    DONE,
    CANCELLED,
    FAILED
}
