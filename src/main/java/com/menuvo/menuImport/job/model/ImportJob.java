package com.menuvo.menuImport.job.model;

import com.menuvo.menuImport.comparison.model.MenuComparisonData;
import com.menuvo.menuImport.extraction.model.MenuFileType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A menu import job, from file upload to applied changes.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ImportJob {

    private String id;

    private String storeId;

    private String originalFilename;

    private MenuFileType fileType;

    /**
     * Storage key of the uploaded bytes.
     */
    private String fileKey;

    private ImportJobStatus status;

    /**
     * Set when the job becomes READY.
     */
    private MenuComparisonData comparisonData;

    /**
     * Set when the job becomes FAILED.
     */
    private String errorMessage;

    private Instant createdAt;

    private Instant updatedAt;
}
