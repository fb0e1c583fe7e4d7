package com.menuvo.menuImport.job.model;

import java.util.Set;

/**
 * Lifecycle of an import job.
 *
 * PROCESSING goes to READY or FAILED; READY goes to COMPLETED. FAILED and COMPLETED are final.
 */
public enum ImportJobStatus {

    PROCESSING,
    READY,
    FAILED,
    COMPLETED;

    public boolean canTransitionTo(ImportJobStatus next) {
        return switch (this) {
            case PROCESSING -> Set.of(READY, FAILED).contains(next);
            case READY -> next == COMPLETED;
            case FAILED, COMPLETED -> false;
        };
    }

    public boolean isTerminal() {
        return this == FAILED || this == COMPLETED;
    }
}
