package com.example.channeluploader.tree;

import java.util.List;

/**
 * Totals and diagnostics from the last {@link TreeScanner#scan} call.
 */
public record ScanSummary(
        long totalFiles,
        long totalFolders,
        long totalBytes,
        long skippedFiles,
        List<String> errors,
        List<String> warnings
) {
    public ScanSummary {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public double totalMegabytes() {
        return Math.round(totalBytes / 1024.0 / 1024.0 * 100.0) / 100.0;
    }
}
