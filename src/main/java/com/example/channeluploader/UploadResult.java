package com.example.channeluploader;

import java.util.List;

/**
 * Terminal outcome of one run. {@code stage} is {@link UploadStage#DONE},
 * {@link UploadStage#CANCELLED} or {@link UploadStage#FAILED}.
 */
public record UploadResult(
        UploadStage stage,
        boolean success,
        String botId,
        String status,
        String message,
        int uploaded,
        int skipped,
        int failed,
        int deleted,
        Double changePercentage,
        List<String> errors,
        List<String> warnings,
        List<FailedFileRecord> failedFiles
) {
    public UploadResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        failedFiles = List.copyOf(failedFiles);
    }

    public boolean cancelled() {
        return stage == UploadStage.CANCELLED;
    }
}
