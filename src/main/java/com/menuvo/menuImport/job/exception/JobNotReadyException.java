package com.menuvo.menuImport.job.exception;

import com.menuvo.menuImport.MenuImportException;
import com.menuvo.menuImport.job.model.ImportJobStatus;

/**
 * Exception thrown when changes are applied to a job that is not waiting for review.
 */
public class JobNotReadyException extends MenuImportException {

    public JobNotReadyException(String jobId, ImportJobStatus status) {
        super("Import job " + jobId + " is not ready for application. Current status: " + status);
    }
}
