package com.example.channeluploader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes run events to the application log. Progress is logged at most once per
 * {@link #PROGRESS_STEP} percent.
 */
public class LoggingUploadListener implements UploadListener {
    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingUploadListener.class);
    static final int PROGRESS_STEP = 10;

    private long lastTotal = -1;
    private long lastBucket = -1;

    @Override
    public void onProgress(long processed, long total, String label) {
        if (total <= 0) {
            return;
        }
        if (total != lastTotal) {
            lastTotal = total;
            lastBucket = -1;
        }
        long bucket = processed * 100 / total / PROGRESS_STEP;
        if (bucket != lastBucket) {
            lastBucket = bucket;
            LOGGER.info("[{}/{}] {}", processed, total, label);
        }
    }

    @Override
    public void onLog(LogLevel level, String message) {
        if (level == LogLevel.ERROR) {
            LOGGER.error(message);
        } else if (level == LogLevel.WARNING) {
            LOGGER.warn(message);
        } else {
            LOGGER.info(message);
        }
    }

    @Override
    public void onStage(UploadStage stage) {
        LOGGER.debug("Stage: {}", stage);
    }
}
