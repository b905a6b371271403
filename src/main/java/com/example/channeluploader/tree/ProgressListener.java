package com.example.channeluploader.tree;

@FunctionalInterface
public interface ProgressListener {
    /**
     * Reports {@code processed} of {@code total} units done. Must not block.
     */
    void onProgress(long processed, long total, String label);

    ProgressListener NONE = (processed, total, label) -> {
    };
}
