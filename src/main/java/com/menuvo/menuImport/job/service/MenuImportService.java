package com.menuvo.menuImport.job.service;

import com.menuvo.menuImport.comparison.model.MenuChangeSet;
import com.menuvo.menuImport.extraction.model.MenuFileType;
import com.menuvo.menuImport.job.dto.ApplyChangesResult;
import com.menuvo.menuImport.job.dto.ImportJobStatusResponse;
import com.menuvo.menuImport.job.dto.ImportSelection;
import com.menuvo.menuImport.job.dto.UploadImportFileResult;
import com.menuvo.menuImport.job.exception.JobNotFoundException;
import com.menuvo.menuImport.job.exception.JobNotReadyException;
import com.menuvo.menuImport.job.model.ImportJob;
import com.menuvo.menuImport.job.model.ImportJobStatus;
import com.menuvo.menuImport.job.repository.ImportJobRepository;
import com.menuvo.menuImport.menu.repository.LiveMenuWriter;
import com.menuvo.menuImport.storage.FileStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Menu import service - facade for uploading files, querying jobs and applying reviewed changes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MenuImportService {

    private final FileStorage fileStorage;
    private final ImportJobRepository jobRepository;
    private final ImportJobDispatcher jobDispatcher;
    private final LiveMenuWriter liveMenuWriter;

    /**
     * Stores an uploaded menu file, creates a PROCESSING job and starts processing in the background.
     *
     * @param storeId Store the menu belongs to
     * @param filename Original file name
     * @param mimeType Declared content type, may be null
     * @param content File bytes
     * @return Job id and initial status
     * @throws com.menuvo.menuImport.extraction.exception.UnsupportedFormatException if neither the
     *         content type nor the file extension is supported
     */
    public UploadImportFileResult uploadFile(String storeId, String filename, String mimeType, byte[] content) {
        MenuFileType fileType = MenuFileType.resolve(mimeType, filename);

        String fileKey = "imports/" + storeId + "/" + UUID.randomUUID() + "." + fileType.getExtension();
        fileStorage.putFile(fileKey, content);

        Instant now = Instant.now();
        ImportJob job = jobRepository.create(ImportJob.builder()
                .id(UUID.randomUUID().toString())
                .storeId(storeId)
                .originalFilename(filename)
                .fileType(fileType)
                .fileKey(fileKey)
                .status(ImportJobStatus.PROCESSING)
                .createdAt(now)
                .updatedAt(now)
                .build());

        log.info("Menu import file accepted - jobId: {}, storeId: {}, fileType: {}, size: {}",
                job.getId(), storeId, fileType, content.length);

        jobDispatcher.dispatch(job.getId());

        return new UploadImportFileResult(job.getId(), job.getStatus());
    }

    /**
     * @throws JobNotFoundException if the job does not exist
     */
    public ImportJobStatusResponse getJobStatus(String jobId) {
        ImportJob job = jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));

        return ImportJobStatusResponse.builder()
                .id(job.getId())
                .storeId(job.getStoreId())
                .originalFilename(job.getOriginalFilename())
                .fileType(job.getFileType())
                .status(job.getStatus())
                .statusMessage(statusMessage(job.getStatus()))
                .errorMessage(job.getErrorMessage())
                .comparisonData(job.getComparisonData())
                .createdAt(job.getCreatedAt())
                .build();
    }

    /**
     * Writes the selected create and update entities of a READY job to the live menu and
     * completes the job. An empty selection completes the job without writing.
     *
     * The write runs inside the READY to COMPLETED transition, so concurrent calls for one job
     * write at most once. A failed write leaves the job READY.
     *
     * @throws JobNotFoundException if the job does not exist
     * @throws JobNotReadyException if the job is not READY
     */
    public ApplyChangesResult applyChanges(String jobId, List<ImportSelection> selections) {
        ImportJob job = jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (job.getStatus() != ImportJobStatus.READY) {
            throw new JobNotReadyException(jobId, job.getStatus());
        }

        AtomicReference<MenuChangeSet> applied = new AtomicReference<>();
        jobRepository.transition(jobId, ImportJobStatus.READY, current -> {
                    MenuChangeSet changeSet = MenuChangeSetFactory.fromSelections(
                            current.getStoreId(), current.getComparisonData(),
                            selections != null ? selections : List.of());
                    if (!changeSet.isEmpty()) {
                        liveMenuWriter.apply(changeSet);
                    }
                    applied.set(changeSet);
                    return current.toBuilder()
                            .status(ImportJobStatus.COMPLETED)
                            .build();
                })
                .orElseThrow(() -> new JobNotReadyException(jobId,
                        jobRepository.findById(jobId).map(ImportJob::getStatus).orElse(null)));

        MenuChangeSet changeSet = applied.get();
        log.info("Menu import applied - jobId: {}, categories: {}, items: {}, optionGroups: {}",
                jobId, changeSet.getCategories().size(), changeSet.getItems().size(),
                changeSet.getOptionGroups().size());

        return ApplyChangesResult.builder()
                .success(true)
                .applied(new ApplyChangesResult.AppliedCounts(
                        changeSet.getCategories().size(),
                        changeSet.getItems().size(),
                        changeSet.getOptionGroups().size()))
                .build();
    }

    static String statusMessage(ImportJobStatus status) {
        return switch (status) {
            case PROCESSING -> "Your menu is being analyzed. This can take a minute.";
            case READY -> "Your menu has been analyzed. Review the changes before applying them.";
            case FAILED -> "We could not read this menu file. Please check the file and try again.";
            case COMPLETED -> "The selected changes have been applied to your menu.";
        };
    }
}
