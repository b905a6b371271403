package com.example.channeluploader;

import com.example.channeluploader.tree.ProgressListener;

/**
 * Observer for a run. Callbacks arrive on the upload worker thread and must not block.
 */
public interface UploadListener extends ProgressListener {

    void onLog(LogLevel level, String message);

    default void onStage(UploadStage stage) {
    }

    static UploadListener noop() {
        return new UploadListener() {
            @Override
            public void onProgress(long processed, long total, String label) {
            }

            @Override
            public void onLog(LogLevel level, String message) {
            }
        };
    }
}
