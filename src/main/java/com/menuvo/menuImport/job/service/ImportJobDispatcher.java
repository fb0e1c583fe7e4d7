package com.menuvo.menuImport.job.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs import jobs in the background with an overall deadline.
 *
 * A job still running at the deadline is marked FAILED. The worker itself is not interrupted;
 * its late result is dropped by the processor's compare-and-set.
 */
@Slf4j
@Component
public class ImportJobDispatcher {

    private final ImportJobProcessor importJobProcessor;
    private final Executor executor;
    private final Duration timeout;

    public ImportJobDispatcher(ImportJobProcessor importJobProcessor,
                               @Qualifier("importJobExecutor") Executor executor,
                               @Value("${menu-import.job.timeout:5m}") Duration timeout) {
        this.importJobProcessor = importJobProcessor;
        this.executor = executor;
        this.timeout = timeout;
    }

    /**
     * Starts processing of a job.
     *
     * @return Completes when the job finished, failed or timed out; never completes exceptionally
     */
    public CompletableFuture<Void> dispatch(String jobId) {
        log.debug("Dispatching import job - jobId: {}, timeout: {}", jobId, timeout);

        return CompletableFuture.runAsync(() -> importJobProcessor.processImportJob(jobId), executor)
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(throwable -> {
                    Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null
                            ? throwable.getCause()
                            : throwable;
                    if (cause instanceof TimeoutException) {
                        log.error("Import job timed out - jobId: {}, timeout: {}", jobId, timeout);
                        importJobProcessor.markFailed(jobId, "Import timed out after " + timeout.toSeconds() + " seconds");
                    } else {
                        log.error("Background processing failed - jobId: {}", jobId, cause);
                        importJobProcessor.markFailed(jobId, cause.getMessage());
                    }
                    return null;
                });
    }
}
