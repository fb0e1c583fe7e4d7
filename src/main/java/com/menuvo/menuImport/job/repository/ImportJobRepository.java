package com.menuvo.menuImport.job.repository;

import com.menuvo.menuImport.job.model.ImportJob;
import com.menuvo.menuImport.job.model.ImportJobStatus;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Store of import jobs keyed by job id.
 */
public interface ImportJobRepository {

    /**
     * Stores a new job.
     *
     * @throws IllegalStateException if a job with the same id exists
     */
    ImportJob create(ImportJob job);

    Optional<ImportJob> findById(String jobId);

    /**
     * Atomically updates a job if, and only if, its current status is {@code expectedStatus}.
     * No other transition of the same job runs while {@code update} runs. If {@code update}
     * throws, the job is left unchanged and the exception propagates.
     *
     * @param jobId Job id
     * @param expectedStatus Status the job must currently have
     * @param update Produces the new job state from a copy of the current one
     * @return The updated job, or empty if the job does not exist or its status differs
     * @throws IllegalStateException if the update produces a status not reachable from {@code expectedStatus}
     */
    Optional<ImportJob> transition(String jobId, ImportJobStatus expectedStatus, UnaryOperator<ImportJob> update);
}
