package com.menuvo.menuImport.job.dto;

import com.menuvo.menuImport.job.model.ImportJobStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UploadImportFileResult {

    private String jobId;

    private ImportJobStatus status;
}
