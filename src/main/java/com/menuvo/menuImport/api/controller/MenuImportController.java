package com.menuvo.menuImport.api.controller;

import com.menuvo.menuImport.job.dto.ApplyChangesRequest;
import com.menuvo.menuImport.job.dto.ApplyChangesResult;
import com.menuvo.menuImport.job.dto.ImportJobStatusResponse;
import com.menuvo.menuImport.job.dto.UploadImportFileResult;
import com.menuvo.menuImport.job.service.MenuImportService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * Menu import REST controller - thin HTTP layer over {@link MenuImportService}.
 */
@RestController
@RequestMapping("/api/v1/menu-imports")
@RequiredArgsConstructor
public class MenuImportController {

    private final MenuImportService menuImportService;

    /**
     * Uploads a menu file and starts its import.
     *
     * @param file Menu file (xlsx, csv, json, md or txt)
     * @param storeId Store the menu belongs to
     * @return 202 with the job id
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<UploadImportFileResult> upload(@RequestParam("file") MultipartFile file,
                                                         @RequestParam("storeId") String storeId) throws IOException {
        UploadImportFileResult result = menuImportService.uploadFile(
                storeId, file.getOriginalFilename(), file.getContentType(), file.getBytes());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(result);
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<ImportJobStatusResponse> getStatus(@PathVariable String jobId) {
        return ResponseEntity.ok(menuImportService.getJobStatus(jobId));
    }

    /**
     * Applies the selected entities of a reviewed import to the live menu.
     */
    @PostMapping("/{jobId}/apply")
    public ResponseEntity<ApplyChangesResult> apply(@PathVariable String jobId,
                                                    @Valid @RequestBody ApplyChangesRequest request) {
        return ResponseEntity.ok(menuImportService.applyChanges(jobId, request.getSelections()));
    }
}
