package com.menuvo.menuImport.job.exception;

import com.menuvo.menuImport.MenuImportException;

/**
 * Exception thrown when an import job id is unknown.
 */
public class JobNotFoundException extends MenuImportException {

    public JobNotFoundException(String jobId) {
        super("Import job not found: " + jobId);
    }
}
