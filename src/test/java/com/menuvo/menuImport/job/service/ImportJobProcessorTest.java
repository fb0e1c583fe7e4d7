package com.menuvo.menuImport.job.service;

import com.menuvo.menuImport.ai.exception.AiServiceException;
import com.menuvo.menuImport.comparison.model.ComparisonSummary;
import com.menuvo.menuImport.comparison.model.MenuComparisonData;
import com.menuvo.menuImport.comparison.service.MenuComparisonService;
import com.menuvo.menuImport.extraction.exception.TextExtractionException;
import com.menuvo.menuImport.extraction.model.ExtractionMetadata;
import com.menuvo.menuImport.extraction.model.MenuFileType;
import com.menuvo.menuImport.extraction.model.TextExtractionResult;
import com.menuvo.menuImport.extraction.service.TextExtractionService;
import com.menuvo.menuImport.job.exception.JobNotFoundException;
import com.menuvo.menuImport.job.model.ImportJob;
import com.menuvo.menuImport.job.model.ImportJobStatus;
import com.menuvo.menuImport.job.repository.InMemoryImportJobRepository;
import com.menuvo.menuImport.menu.model.ExistingMenuSnapshot;
import com.menuvo.menuImport.menu.model.ExistingMenuSnapshot.ExistingCategory;
import com.menuvo.menuImport.menu.model.ExistingMenuSnapshot.ExistingItem;
import com.menuvo.menuImport.menu.model.ExtractedMenuData;
import com.menuvo.menuImport.menu.model.MenuExtractionOptions;
import com.menuvo.menuImport.menu.repository.ExistingMenuProvider;
import com.menuvo.menuImport.menu.service.MenuExtractionService;
import com.menuvo.menuImport.storage.FileStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ImportJobProcessorTest {

    private static final String JOB_ID = "job-1";
    private static final String FILE_KEY = "imports/store-1/abc.csv";
    private static final byte[] CONTENT = "name,price\nMargherita,12.00".getBytes(StandardCharsets.UTF_8);
    private static final String TEXT = "name | price\n---\nMargherita | 12.00";

    @Mock
    private FileStorage fileStorage;

    @Mock
    private TextExtractionService textExtractionService;

    @Mock
    private ExistingMenuProvider existingMenuProvider;

    @Mock
    private MenuExtractionService menuExtractionService;

    @Mock
    private MenuComparisonService menuComparisonService;

    private InMemoryImportJobRepository jobRepository;

    private ImportJobProcessor processor;

    @BeforeEach
    void setUp() {
        jobRepository = new InMemoryImportJobRepository();
        processor = new ImportJobProcessor(jobRepository, fileStorage, textExtractionService, existingMenuProvider,
                menuExtractionService, menuComparisonService, "test-model", true);
    }

    @Test
    void successfulRunMakesJobReady() {
        createJob(ImportJobStatus.PROCESSING);
        ExistingMenuSnapshot liveMenu = liveMenu();
        ExtractedMenuData extracted = ExtractedMenuData.builder().confidence(0.9).build();
        MenuComparisonData comparison = MenuComparisonData.builder()
                .extractedMenu(extracted)
                .summary(ComparisonSummary.builder().build())
                .build();
        when(fileStorage.getFile(FILE_KEY)).thenReturn(CONTENT);
        when(textExtractionService.extract(CONTENT, MenuFileType.CSV)).thenReturn(textResult());
        when(existingMenuProvider.getExistingMenu("store-1")).thenReturn(liveMenu);
        when(menuExtractionService.extractMenu(eq(TEXT), any())).thenReturn(extracted);
        when(menuComparisonService.compare(extracted, liveMenu)).thenReturn(comparison);

        processor.processImportJob(JOB_ID);

        ImportJob job = jobRepository.findById(JOB_ID).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(ImportJobStatus.READY);
        assertThat(job.getComparisonData()).isEqualTo(comparison);
        assertThat(job.getErrorMessage()).isNull();

        ArgumentCaptor<MenuExtractionOptions> options = ArgumentCaptor.forClass(MenuExtractionOptions.class);
        verify(menuExtractionService).extractMenu(eq(TEXT), options.capture());
        assertThat(options.getValue().getCorrelationId()).isEqualTo(JOB_ID);
        assertThat(options.getValue().getModel().id()).isEqualTo("test-model");
        assertThat(options.getValue().getModel().supportsStructuredOutput()).isTrue();
        assertThat(options.getValue().getExistingCategoryNames()).containsExactly("Pizza");
        assertThat(options.getValue().getExistingItemNames()).containsExactly("Margherita Pizza");
    }

    @Test
    void failingStepMakesJobFailed() {
        createJob(ImportJobStatus.PROCESSING);
        when(fileStorage.getFile(FILE_KEY)).thenReturn(CONTENT);
        when(textExtractionService.extract(CONTENT, MenuFileType.CSV))
                .thenThrow(new TextExtractionException("Failed to read delimited text: bad quote", null));

        processor.processImportJob(JOB_ID);

        ImportJob job = jobRepository.findById(JOB_ID).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(ImportJobStatus.FAILED);
        assertThat(job.getErrorMessage()).isEqualTo("Failed to read delimited text: bad quote");
        verifyNoInteractions(menuExtractionService, menuComparisonService);
    }

    @Test
    void longErrorMessageIsTruncated() {
        createJob(ImportJobStatus.PROCESSING);
        when(fileStorage.getFile(FILE_KEY)).thenReturn(CONTENT);
        when(textExtractionService.extract(CONTENT, MenuFileType.CSV)).thenReturn(textResult());
        when(existingMenuProvider.getExistingMenu("store-1")).thenReturn(ExistingMenuSnapshot.empty());
        when(menuExtractionService.extractMenu(eq(TEXT), any()))
                .thenThrow(new AiServiceException("x".repeat(5000)));

        processor.processImportJob(JOB_ID);

        ImportJob job = jobRepository.findById(JOB_ID).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(ImportJobStatus.FAILED);
        assertThat(job.getErrorMessage()).hasSize(ImportJobProcessor.MAX_ERROR_MESSAGE_LENGTH);
    }

    @Test
    void exceptionWithoutMessageIsDescribedByType() {
        createJob(ImportJobStatus.PROCESSING);
        when(fileStorage.getFile(FILE_KEY)).thenThrow(new IllegalStateException());

        processor.processImportJob(JOB_ID);

        assertThat(jobRepository.findById(JOB_ID).orElseThrow().getErrorMessage())
                .isEqualTo("IllegalStateException");
    }

    @Test
    void jobNotInProcessingIsLeftAlone() {
        createJob(ImportJobStatus.READY);

        processor.processImportJob(JOB_ID);

        assertThat(jobRepository.findById(JOB_ID).orElseThrow().getStatus()).isEqualTo(ImportJobStatus.READY);
        verifyNoInteractions(fileStorage, textExtractionService, menuExtractionService);
    }

    @Test
    void unknownJobIsReported() {
        assertThatThrownBy(() -> processor.processImportJob("missing"))
                .isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void lateResultDoesNotOverwriteFailedJob() {
        createJob(ImportJobStatus.PROCESSING);
        ExtractedMenuData extracted = ExtractedMenuData.builder().build();
        when(fileStorage.getFile(FILE_KEY)).thenReturn(CONTENT);
        when(textExtractionService.extract(CONTENT, MenuFileType.CSV)).thenReturn(textResult());
        when(existingMenuProvider.getExistingMenu("store-1")).thenReturn(ExistingMenuSnapshot.empty());
        when(menuExtractionService.extractMenu(eq(TEXT), any())).thenAnswer(invocation -> {
            processor.markFailed(JOB_ID, "Import timed out after 300 seconds");
            return extracted;
        });
        when(menuComparisonService.compare(eq(extracted), any())).thenReturn(MenuComparisonData.builder()
                .summary(ComparisonSummary.builder().build())
                .build());

        processor.processImportJob(JOB_ID);

        ImportJob job = jobRepository.findById(JOB_ID).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(ImportJobStatus.FAILED);
        assertThat(job.getErrorMessage()).isEqualTo("Import timed out after 300 seconds");
        assertThat(job.getComparisonData()).isNull();
    }

    @Test
    void markFailedOnlyActsOnProcessingJobs() {
        createJob(ImportJobStatus.COMPLETED);

        assertThat(processor.markFailed(JOB_ID, "too late")).isFalse();
        assertThat(jobRepository.findById(JOB_ID).orElseThrow().getStatus()).isEqualTo(ImportJobStatus.COMPLETED);
    }

    @Test
    void missingFailureMessageIsReplaced() {
        createJob(ImportJobStatus.PROCESSING);

        assertThat(processor.markFailed(JOB_ID, null)).isTrue();
        assertThat(jobRepository.findById(JOB_ID).orElseThrow().getErrorMessage()).isEqualTo("Unknown error");
    }

    private void createJob(ImportJobStatus status) {
        jobRepository.create(ImportJob.builder()
                .id(JOB_ID)
                .storeId("store-1")
                .originalFilename("menu.csv")
                .fileType(MenuFileType.CSV)
                .fileKey(FILE_KEY)
                .status(status)
                .createdAt(Instant.now())
                .updatedAt(Instant.now())
                .build());
    }

    private static TextExtractionResult textResult() {
        return TextExtractionResult.builder()
                .text(TEXT)
                .metadata(ExtractionMetadata.builder().rowCount(1).build())
                .build();
    }

    private static ExistingMenuSnapshot liveMenu() {
        return ExistingMenuSnapshot.builder()
                .categories(List.of(ExistingCategory.builder()
                        .id("cat-pizza")
                        .name("Pizza")
                        .items(List.of(ExistingItem.builder()
                                .id("item-margherita")
                                .name("Margherita Pizza")
                                .price(1200)
                                .build()))
                        .build()))
                .build();
    }
}
