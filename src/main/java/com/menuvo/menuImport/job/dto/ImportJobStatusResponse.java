package com.menuvo.menuImport.job.dto;

import com.menuvo.menuImport.comparison.model.MenuComparisonData;
import com.menuvo.menuImport.extraction.model.MenuFileType;
import com.menuvo.menuImport.job.model.ImportJobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response DTO for import job status queries.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ImportJobStatusResponse {

    private String id;
    private String storeId;
    private String originalFilename;
    private MenuFileType fileType;
    private ImportJobStatus status;

    /**
     * Short, non-technical description of the status for display.
     */
    private String statusMessage;

    private String errorMessage;
    private MenuComparisonData comparisonData;
    private Instant createdAt;
}
