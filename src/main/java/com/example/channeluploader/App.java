package com.example.channeluploader;

import com.example.channeluploader.remote.BotApiTransferClient;
import com.example.channeluploader.remote.HttpIndexClient;
import com.example.channeluploader.remote.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.IntConsumer;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);
    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_CANCELLED = 2;
    static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private App() {
    }

    public static void main(String[] args) throws Exception {
        if (args.length < 1) {
            LOGGER.error("Usage: java -jar channel-uploader.jar <config.json>");
            System.exit(EXIT_FAILURE);
        }
        UploaderConfig config;
        try {
            config = new ConfigLoader().load(Path.of(args[0]));
        } catch (IllegalArgumentException | IOException ex) {
            LOGGER.error("Invalid configuration {}: {}", args[0], ex.getMessage());
            System.exit(EXIT_FAILURE);
            return;
        }
        System.exit(run(config));
    }

    static int run(UploaderConfig config) throws InterruptedException {
        LOGGER.info("Starting upload of {} to {}{}", config.folder(), config.channelId(),
                config.updateMode() ? " (update mode)" : "");
        CancellationToken cancellation = new CancellationToken();
        RetryPolicy retryPolicy = new RetryPolicy(
                config.maxAttempts(),
                config.baseDelay(),
                config.maxDelay(),
                cancellation.sleeper(),
                cancellation);

        CompletableFuture<Integer> exitCode = new CompletableFuture<>();
        int code = EXIT_FAILURE;
        try (BotApiTransferClient transferClient = new BotApiTransferClient(
                config.transferApiUrl(), config.botToken(), config.maxObjectSize(), retryPolicy);
             HttpIndexClient indexClient = new HttpIndexClient(
                     config.indexServerUrl(), config.maxPayloadBytes(), retryPolicy)) {
            UploadOrchestrator orchestrator = new UploadOrchestrator(
                    config, transferClient, indexClient, new LoggingUploadListener(), cancellation);
            Thread hook = new Thread(
                    () -> awaitShutdown(orchestrator::cancel, exitCode, SHUTDOWN_GRACE, Runtime.getRuntime()::halt),
                    "upload-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);
            try {
                code = finish(config, orchestrator.start().get());
            } catch (ExecutionException ex) {
                LOGGER.error("Upload worker failed", ex.getCause());
            } finally {
                exitCode.complete(code);
                removeHook(hook);
            }
        }
        return code;
    }

    private static int finish(UploaderConfig config, UploadResult result) {
        if (config.reportFile().isPresent()) {
            UploadReportWriter writer = new UploadReportWriter(config.reportFile().get());
            try {
                writer.write(config, result);
                LOGGER.info("Report written to {}", writer.path());
            } catch (IOException ex) {
                LOGGER.warn("Failed to write report {}", writer.path(), ex);
            }
        }

        LOGGER.info("Uploaded {}, skipped {}, failed {}, deleted {}",
                result.uploaded(), result.skipped(), result.failed(), result.deleted());
        if (result.success()) {
            return EXIT_SUCCESS;
        }
        return result.cancelled() ? EXIT_CANCELLED : EXIT_FAILURE;
    }

    /**
     * Runs on the shutdown hook. The JVM exits once hooks return, so the hook cancels the
     * upload, waits for the main thread to settle its exit code, then halts with that code.
     */
    static void awaitShutdown(Runnable cancel, Future<Integer> exitCode, Duration grace, IntConsumer halt) {
        LOGGER.warn("Shutdown requested, cancelling upload");
        cancel.run();
        try {
            halt.accept(exitCode.get(grace.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException ex) {
            LOGGER.error("Upload did not stop within {}s", grace.toSeconds());
        } catch (ExecutionException ex) {
            LOGGER.error("Upload ended with an error during shutdown", ex.getCause());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException ex) {
            // Already shutting down.
            LOGGER.debug("Shutdown in progress, keeping cancellation hook");
        }
    }
}
