package com.example.channeluploader;

import com.example.channeluploader.remote.BotIdentity;
import com.example.channeluploader.remote.DestinationAccess;
import com.example.channeluploader.remote.IndexClient;
import com.example.channeluploader.remote.PersistReceipt;
import com.example.channeluploader.remote.RemoteResult;
import com.example.channeluploader.remote.Sleeper;
import com.example.channeluploader.remote.TransferClient;
import com.example.channeluploader.remote.TransferReceipt;
import com.example.channeluploader.tree.ChangeSet;
import com.example.channeluploader.tree.FileEntry;
import com.example.channeluploader.tree.ScanSummary;
import com.example.channeluploader.tree.TreeDiffer;
import com.example.channeluploader.tree.TreeNode;
import com.example.channeluploader.tree.TreeScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Drives one incremental upload: validate, scan, diff against the stored tree (update
 * mode only), delete stale objects, transfer pending files, then persist the merged
 * tree on the index server.
 * <p>
 * Runs sequentially on one thread. Cancellation is polled between stages and between
 * files; work already done remotely is not rolled back.
 */
public class UploadOrchestrator {
    private static final Logger LOGGER = LoggerFactory.getLogger(UploadOrchestrator.class);
    static final Duration FILE_RETRY_STEP = Duration.ofSeconds(5);
    static final String CANCELLED_MESSAGE = "Upload cancelled";

    private final UploaderConfig config;
    private final TransferClient transferClient;
    private final IndexClient indexClient;
    private final TreeScanner scanner;
    private final UploadListener listener;
    private final CancellationToken cancellation;
    private final Sleeper sleeper;
    private volatile Thread worker;

    public UploadOrchestrator(UploaderConfig config,
                              TransferClient transferClient,
                              IndexClient indexClient,
                              UploadListener listener,
                              CancellationToken cancellation) {
        this(config, transferClient, indexClient, listener, cancellation, cancellation.sleeper());
    }

    public UploadOrchestrator(UploaderConfig config,
                              TransferClient transferClient,
                              IndexClient indexClient,
                              UploadListener listener,
                              CancellationToken cancellation,
                              Sleeper sleeper) {
        this.config = config;
        this.transferClient = transferClient;
        this.indexClient = indexClient;
        this.listener = listener == null ? UploadListener.noop() : listener;
        this.cancellation = cancellation;
        this.sleeper = sleeper;
        this.scanner = new TreeScanner(
                config.maxObjectSize(),
                config.followLinks(),
                config.excludeFilePatterns(),
                config.excludeDirectoryPatterns(),
                this.listener);
    }

    /**
     * Runs {@link #run()} on a dedicated worker thread.
     */
    public CompletableFuture<UploadResult> start() {
        CompletableFuture<UploadResult> future = new CompletableFuture<>();
        Thread thread = new Thread(() -> {
            try {
                future.complete(run());
            } catch (Throwable ex) {
                future.completeExceptionally(ex);
            }
        }, "upload-worker");
        worker = thread;
        thread.start();
        return future;
    }

    /**
     * Requests cancellation. A worker started by {@link #start()} is also interrupted so a
     * request blocked on the network returns.
     */
    public void cancel() {
        cancellation.cancel();
        Thread thread = worker;
        if (thread != null) {
            thread.interrupt();
        }
    }

    public UploadResult run() {
        Run run = new Run();
        try {
            return execute(run);
        } catch (RuntimeException ex) {
            LOGGER.error("Upload failed unexpectedly", ex);
            return run.fail("Unexpected error: " + ex.getMessage());
        }
    }

    private UploadResult execute(Run run) {
        // Validating
        stage(UploadStage.VALIDATING);
        log(LogLevel.INFO, "Validating bot token...");
        RemoteResult<BotIdentity> identity = transferClient.validateCredential();
        if (!identity.isSuccess()) {
            return run.failRemote(identity, "Invalid bot token: ");
        }
        log(LogLevel.SUCCESS, "Bot validated: " + identity.value().handle());

        log(LogLevel.INFO, "Checking channel access...");
        RemoteResult<DestinationAccess> access = transferClient.checkDestinationPermission(config.channelId());
        if (!access.isSuccess()) {
            return run.failRemote(access, "Channel error: ");
        }
        log(LogLevel.SUCCESS, "Channel access confirmed: " + access.value().title());

        log(LogLevel.INFO, "Checking server connection...");
        RemoteResult<Boolean> connected = indexClient.probeConnectivity();
        if (!connected.isSuccess()) {
            return run.failRemote(connected, "Server error: ");
        }
        log(LogLevel.SUCCESS, "Server connection OK");
        if (cancellation.isCancelled()) {
            return run.cancel();
        }

        // Scanning
        stage(UploadStage.SCANNING);
        log(LogLevel.INFO, "Scanning directory...");
        Optional<TreeNode> scanned = scanner.scan(config.folder());
        ScanSummary summary = scanner.summary();
        for (String error : summary.errors()) {
            log(LogLevel.WARNING, error);
            run.errors.add(error);
        }
        for (String warning : summary.warnings()) {
            log(LogLevel.WARNING, warning);
            run.warnings.add(warning);
        }
        if (scanned.isEmpty()) {
            return run.fail("Failed to scan directory");
        }
        log(LogLevel.SUCCESS, String.format(Locale.ROOT, "Found %d files in %d folders (%.2f MB)",
                summary.totalFiles(), summary.totalFolders(), summary.totalMegabytes()));
        if (cancellation.isCancelled()) {
            return run.cancel();
        }

        // Diffing
        TreeNode merged = scanned.get();
        Map<String, FileEntry> toDelete = Map.of();
        if (config.updateMode()) {
            stage(UploadStage.DIFFING);
            log(LogLevel.INFO, "Update mode: Fetching existing metadata...");
            RemoteResult<TreeNode> previous = indexClient.fetchTree(config.botToken());
            if (previous.kind() == RemoteResult.Kind.NOT_FOUND) {
                log(LogLevel.WARNING, "No existing metadata found, treating as new upload");
                run.warnings.add("No existing metadata found, treating as new upload");
            } else if (!previous.isSuccess()) {
                return run.failRemote(previous, "Failed to fetch existing metadata: ");
            } else {
                log(LogLevel.SUCCESS, "Existing metadata retrieved");
                ChangeSet changes = TreeDiffer.diff(previous.value(), merged);
                run.changePercentage = TreeDiffer.changePercentage(changes);
                log(LogLevel.INFO, String.format(Locale.ROOT,
                        "Changes detected: %d added, %d removed, %d modified, %d unchanged (%.1f%% change)",
                        changes.addedCount(), changes.removedCount(), changes.modifiedCount(),
                        changes.unchangedCount(), run.changePercentage));
                merged = TreeDiffer.mergeWithPrevious(previous.value(), changes, merged);
                toDelete = TreeDiffer.filesPendingDeletion(changes);
            }
        }
        Map<String, FileEntry> toTransfer = TreeDiffer.filesPendingTransfer(merged);
        run.skipped = (int) (summary.totalFiles() - toTransfer.size());
        if (cancellation.isCancelled()) {
            return run.cancel();
        }

        // Deleting
        if (!toDelete.isEmpty()) {
            stage(UploadStage.DELETING);
            log(LogLevel.INFO, "Removing " + toDelete.size() + " old files from channel...");
            for (Map.Entry<String, FileEntry> entry : toDelete.entrySet()) {
                if (cancellation.isCancelled()) {
                    return run.cancel();
                }
                Long messageId = entry.getValue().remoteMessageId();
                if (messageId == null) {
                    continue;
                }
                if (transferClient.deleteObject(config.channelId(), messageId)) {
                    run.deleted++;
                } else {
                    run.warnings.add("Could not remove old copy of " + entry.getKey() + " from channel");
                }
            }
            log(LogLevel.SUCCESS, "Removed " + run.deleted + " old files");
        }

        // Transferring
        stage(UploadStage.TRANSFERRING);
        int total = toTransfer.size();
        if (total == 0) {
            log(LogLevel.INFO, "No new files to upload");
        } else {
            log(LogLevel.INFO, "Uploading " + total + " files...");
            int index = 0;
            for (Map.Entry<String, FileEntry> entry : toTransfer.entrySet()) {
                if (cancellation.isCancelled()) {
                    return run.cancel();
                }
                index++;
                String path = entry.getKey();
                FileEntry file = entry.getValue();
                listener.onProgress(index, total, "Uploading: " + file.name());
                log(LogLevel.INFO, "[" + index + "/" + total + "] Uploading: " + path);

                RemoteResult<TransferReceipt> receipt = transferWithRetry(run, path, file);
                if (receipt.isSuccess()) {
                    TreeDiffer.writeBack(merged, path, receipt.value().objectId(), receipt.value().messageId());
                    run.uploaded++;
                } else if (receipt.kind() == RemoteResult.Kind.CANCELLED) {
                    return run.cancel();
                } else {
                    String error = "Failed to upload " + path + ": " + receipt.message();
                    log(LogLevel.ERROR, error);
                    run.errors.add(error);
                }
            }
            log(LogLevel.SUCCESS, "Uploaded " + run.uploaded + " files");
        }
        if (cancellation.isCancelled()) {
            return run.cancel();
        }

        // Persisting
        stage(UploadStage.PERSISTING);
        for (String path : TreeDiffer.pruneUntransferred(merged)) {
            run.warnings.add("Not recorded in index (not uploaded): " + path);
        }
        log(LogLevel.INFO, "Sending metadata to server...");
        RemoteResult<PersistReceipt> persisted = indexClient.persistTree(
                config.botToken(), config.channelId(), identity.value().handle(), merged);
        if (!persisted.isSuccess()) {
            for (String detail : persisted.details()) {
                log(LogLevel.ERROR, "  - " + detail);
                run.errors.add(detail);
            }
            return run.failRemote(persisted, "Server error: ");
        }
        return run.succeed(persisted.value());
    }

    private RemoteResult<TransferReceipt> transferWithRetry(Run run, String path, FileEntry file) {
        int maxAttempts = config.fileRetryAttempts();
        List<RetryAttempt> attempts = new ArrayList<>();
        RemoteResult<TransferReceipt> result = RemoteResult.cancelled();
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            if (cancellation.isCancelled()) {
                return RemoteResult.cancelled();
            }
            result = transferClient.transferObject(config.channelId(), file.localPath());
            if (result.isSuccess() || result.kind() == RemoteResult.Kind.CANCELLED) {
                return result;
            }
            attempts.add(new RetryAttempt(attempt + 1, Instant.now(), result.kind().name(), result.message()));
            if (!result.kind().isRetryable() || attempt == maxAttempts - 1) {
                break;
            }
            Duration wait = result.kind() == RemoteResult.Kind.RATE_LIMITED
                    ? result.retryAfter().orElse(FILE_RETRY_STEP)
                    : FILE_RETRY_STEP.multipliedBy(attempt + 1L);
            log(LogLevel.WARNING, (result.kind() == RemoteResult.Kind.RATE_LIMITED ? "Rate limited" : "Upload failed")
                    + ", retrying " + file.name() + " in " + wait.toSeconds() + "s...");
            try {
                sleeper.sleep(wait);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return RemoteResult.cancelled();
            }
        }
        run.failedFiles.add(new FailedFileRecord(
                path,
                file.size(),
                attempts.size(),
                maxAttempts,
                attempts.isEmpty() ? Instant.now() : attempts.get(attempts.size() - 1).getTimestamp(),
                result.message(),
                attempts));
        return result;
    }

    private void stage(UploadStage stage) {
        LOGGER.debug("Entering {}", stage);
        listener.onStage(stage);
    }

    private void log(LogLevel level, String message) {
        listener.onLog(level, message);
    }

    /**
     * Mutable totals of a single run.
     */
    private final class Run {
        private final List<String> errors = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private final List<FailedFileRecord> failedFiles = new ArrayList<>();
        private int uploaded;
        private int skipped;
        private int deleted;
        private Double changePercentage;

        private UploadResult succeed(PersistReceipt receipt) {
            String message = receipt.message() == null ? "Upload completed successfully!" : receipt.message();
            Double percentage = receipt.changePercentage() != null ? receipt.changePercentage() : changePercentage;
            log(LogLevel.SUCCESS, message);
            log(LogLevel.INFO, "Bot ID: " + receipt.botId());
            log(LogLevel.INFO, "Status: " + receipt.status());
            if (receipt.update() && percentage != null) {
                log(LogLevel.INFO, String.format(Locale.ROOT, "Change percentage: %.1f%%", percentage));
            }
            stage(UploadStage.DONE);
            return result(UploadStage.DONE, true, receipt.botId(), receipt.status(), message, percentage);
        }

        private UploadResult failRemote(RemoteResult<?> outcome, String prefix) {
            if (outcome.kind() == RemoteResult.Kind.CANCELLED) {
                return cancel();
            }
            return fail(prefix + outcome.message());
        }

        private UploadResult fail(String message) {
            errors.add(message);
            log(LogLevel.ERROR, message);
            stage(UploadStage.FAILED);
            return result(UploadStage.FAILED, false, null, null, message, changePercentage);
        }

        private UploadResult cancel() {
            log(LogLevel.WARNING, CANCELLED_MESSAGE);
            stage(UploadStage.CANCELLED);
            return result(UploadStage.CANCELLED, false, null, null, CANCELLED_MESSAGE, changePercentage);
        }

        private UploadResult result(UploadStage stage, boolean success, String botId, String status, String message, Double percentage) {
            return new UploadResult(
                    stage,
                    success,
                    botId,
                    status,
                    message,
                    uploaded,
                    skipped,
                    failedFiles.size(),
                    deleted,
                    percentage,
                    errors,
                    warnings,
                    failedFiles
            );
        }
    }
}
