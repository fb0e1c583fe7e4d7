package com.menuvo.menuImport.job.service;

import com.menuvo.menuImport.comparison.model.MenuComparisonData;
import com.menuvo.menuImport.comparison.service.MenuComparisonService;
import com.menuvo.menuImport.extraction.model.TextExtractionResult;
import com.menuvo.menuImport.extraction.service.TextExtractionService;
import com.menuvo.menuImport.job.exception.JobNotFoundException;
import com.menuvo.menuImport.job.model.ImportJob;
import com.menuvo.menuImport.job.model.ImportJobStatus;
import com.menuvo.menuImport.job.repository.ImportJobRepository;
import com.menuvo.menuImport.menu.model.ExistingMenuSnapshot;
import com.menuvo.menuImport.menu.model.ExtractedMenuData;
import com.menuvo.menuImport.menu.model.MenuExtractionOptions;
import com.menuvo.menuImport.menu.model.ModelConfig;
import com.menuvo.menuImport.menu.repository.ExistingMenuProvider;
import com.menuvo.menuImport.menu.service.MenuExtractionService;
import com.menuvo.menuImport.storage.FileStorage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Import job processor - runs the pipeline for one job.
 *
 * Steps: FETCH_FILE -> TEXT_EXTRACT -> LOAD_MENU -> MENU_EXTRACT -> COMPARE -> READY.
 * Any failure moves the job to FAILED; a job is never left in PROCESSING by this class.
 * Status writes are compare-and-set on PROCESSING, so duplicate or late runs cannot
 * overwrite a terminal state.
 */
@Slf4j
@Service
public class ImportJobProcessor {

    public static final int MAX_ERROR_MESSAGE_LENGTH = 1000;

    private final ImportJobRepository jobRepository;
    private final FileStorage fileStorage;
    private final TextExtractionService textExtractionService;
    private final ExistingMenuProvider existingMenuProvider;
    private final MenuExtractionService menuExtractionService;
    private final MenuComparisonService menuComparisonService;
    private final ModelConfig extractionModel;

    public ImportJobProcessor(ImportJobRepository jobRepository,
                              FileStorage fileStorage,
                              TextExtractionService textExtractionService,
                              ExistingMenuProvider existingMenuProvider,
                              MenuExtractionService menuExtractionService,
                              MenuComparisonService menuComparisonService,
                              @Value("${menu-import.extraction.model:llama-3.3-70b-versatile}") String modelId,
                              @Value("${menu-import.extraction.supports-structured-output:true}") boolean supportsStructuredOutput) {
        this.jobRepository = jobRepository;
        this.fileStorage = fileStorage;
        this.textExtractionService = textExtractionService;
        this.existingMenuProvider = existingMenuProvider;
        this.menuExtractionService = menuExtractionService;
        this.menuComparisonService = menuComparisonService;
        this.extractionModel = new ModelConfig(modelId, supportsStructuredOutput);
    }

    /**
     * Processes an import job. Does nothing if the job is not in PROCESSING.
     *
     * @param jobId Job id
     * @throws JobNotFoundException if the job does not exist
     */
    public void processImportJob(String jobId) {
        ImportJob job = jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));

        if (job.getStatus() != ImportJobStatus.PROCESSING) {
            log.debug("Job already processed - jobId: {}, status: {}", jobId, job.getStatus());
            return;
        }

        log.info("Processing menu import job - jobId: {}, storeId: {}, fileType: {}",
                jobId, job.getStoreId(), job.getFileType());

        try {
            log.debug("Step FETCH_FILE - jobId: {}, fileKey: {}", jobId, job.getFileKey());
            byte[] content = fileStorage.getFile(job.getFileKey());

            log.debug("Step TEXT_EXTRACT - jobId: {}, size: {}", jobId, content.length);
            TextExtractionResult extraction = textExtractionService.extract(content, job.getFileType());
            log.debug("Text extracted - jobId: {}, charCount: {}, truncated: {}",
                    jobId, extraction.getText().length(), extraction.isTruncated());

            log.debug("Step LOAD_MENU - jobId: {}, storeId: {}", jobId, job.getStoreId());
            ExistingMenuSnapshot existingMenu = existingMenuProvider.getExistingMenu(job.getStoreId());
            log.debug("Existing menu loaded - jobId: {}, categories: {}, optionGroups: {}",
                    jobId, existingMenu.getCategories().size(), existingMenu.getOptionGroups().size());

            ExtractedMenuData extractedMenu = menuExtractionService.extractMenu(extraction.getText(),
                    MenuExtractionOptions.builder()
                            .model(extractionModel)
                            .existingCategoryNames(existingMenu.categoryNames())
                            .existingItemNames(existingMenu.itemNames())
                            .correlationId(jobId)
                            .build());

            log.debug("Step COMPARE - jobId: {}", jobId);
            MenuComparisonData comparisonData = menuComparisonService.compare(extractedMenu, existingMenu);
            log.info("Comparison generated - jobId: {}, newCategories: {}, updatedCategories: {}, newItems: {}, "
                            + "updatedItems: {}, newOptionGroups: {}, updatedOptionGroups: {}",
                    jobId,
                    comparisonData.getSummary().getNewCategories(),
                    comparisonData.getSummary().getUpdatedCategories(),
                    comparisonData.getSummary().getNewItems(),
                    comparisonData.getSummary().getUpdatedItems(),
                    comparisonData.getSummary().getNewOptionGroups(),
                    comparisonData.getSummary().getUpdatedOptionGroups());

            boolean ready = jobRepository.transition(jobId, ImportJobStatus.PROCESSING, current -> current.toBuilder()
                            .status(ImportJobStatus.READY)
                            .comparisonData(comparisonData)
                            .build())
                    .isPresent();

            if (ready) {
                log.info("Job completed successfully - jobId: {}", jobId);
            } else {
                log.warn("Job left PROCESSING while running, result discarded - jobId: {}", jobId);
            }

        } catch (Exception e) {
            log.error("Job failed - jobId: {}", jobId, e);
            markFailed(jobId, describe(e));
        }
    }

    /**
     * Moves a PROCESSING job to FAILED with the given message (truncated to
     * {@value #MAX_ERROR_MESSAGE_LENGTH} characters).
     *
     * @return true if this call failed the job, false if it was no longer PROCESSING
     */
    public boolean markFailed(String jobId, String errorMessage) {
        String message = truncate(errorMessage);
        boolean failed = jobRepository.transition(jobId, ImportJobStatus.PROCESSING, current -> current.toBuilder()
                        .status(ImportJobStatus.FAILED)
                        .errorMessage(message)
                        .build())
                .isPresent();
        if (!failed) {
            log.warn("Could not mark job as failed, it is no longer PROCESSING - jobId: {}", jobId);
        }
        return failed;
    }

    private static String describe(Exception e) {
        return e.getMessage() != null && !e.getMessage().isBlank() ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static String truncate(String message) {
        if (message == null) {
            return "Unknown error";
        }
        return message.length() <= MAX_ERROR_MESSAGE_LENGTH ? message : message.substring(0, MAX_ERROR_MESSAGE_LENGTH);
    }
}
