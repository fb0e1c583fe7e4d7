package com.menuvo.menuImport.job.repository;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.menuvo.menuImport.job.model.ImportJob;
import com.menuvo.menuImport.job.model.ImportJobStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Import job store backed by a Caffeine cache.
 *
 * Jobs expire 24 hours after their last write. Transitions run inside
 * {@code asMap().computeIfPresent}, so one status check and one write happen atomically per job.
 */
@Slf4j
@Repository
public class InMemoryImportJobRepository implements ImportJobRepository {

    /**
     * Retention of a job after its last update.
     */
    private static final Duration JOB_RETENTION = Duration.ofHours(24);

    private final Cache<String, ImportJob> jobCache = Caffeine.newBuilder()
            .expireAfterWrite(JOB_RETENTION)
            .maximumSize(10_000)
            .removalListener((key, value, cause) -> {
                if (value != null && cause.wasEvicted()) {
                    log.debug("Import job evicted - jobId: {}, cause: {}", key, cause);
                }
            })
            .build();

    @Override
    public ImportJob create(ImportJob job) {
        ImportJob stored = job.toBuilder().build();
        ImportJob previous = jobCache.asMap().putIfAbsent(stored.getId(), stored);
        if (previous != null) {
            throw new IllegalStateException("Import job already exists: " + job.getId());
        }
        log.debug("Import job created - jobId: {}, status: {}", stored.getId(), stored.getStatus());
        return stored.toBuilder().build();
    }

    @Override
    public Optional<ImportJob> findById(String jobId) {
        if (jobId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(jobCache.getIfPresent(jobId)).map(job -> job.toBuilder().build());
    }

    @Override
    public Optional<ImportJob> transition(String jobId, ImportJobStatus expectedStatus, UnaryOperator<ImportJob> update) {
        AtomicReference<ImportJob> updated = new AtomicReference<>();

        jobCache.asMap().computeIfPresent(jobId, (id, current) -> {
            if (current.getStatus() != expectedStatus) {
                return current;
            }
            ImportJob next = update.apply(current.toBuilder().build());
            if (!expectedStatus.canTransitionTo(next.getStatus())) {
                throw new IllegalStateException("Illegal import job transition " + expectedStatus
                        + " -> " + next.getStatus() + " for job " + jobId);
            }
            next.setUpdatedAt(Instant.now());
            updated.set(next);
            return next;
        });

        return Optional.ofNullable(updated.get()).map(job -> job.toBuilder().build());
    }
}
