package com.menuvo.menuImport.job.repository;

import com.menuvo.menuImport.extraction.model.MenuFileType;
import com.menuvo.menuImport.job.model.ImportJob;
import com.menuvo.menuImport.job.model.ImportJobStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryImportJobRepositoryTest {

    private static final Instant CREATED_AT = Instant.parse("2026-01-01T10:00:00Z");

    private final InMemoryImportJobRepository repository = new InMemoryImportJobRepository();

    @Test
    void createdJobCanBeFound() {
        repository.create(job("job-1", ImportJobStatus.PROCESSING));

        assertThat(repository.findById("job-1"))
                .get()
                .satisfies(job -> {
                    assertThat(job.getStoreId()).isEqualTo("store-1");
                    assertThat(job.getStatus()).isEqualTo(ImportJobStatus.PROCESSING);
                });
        assertThat(repository.findById("job-2")).isEmpty();
        assertThat(repository.findById(null)).isEmpty();
    }

    @Test
    void duplicateIdIsRejected() {
        repository.create(job("job-1", ImportJobStatus.PROCESSING));

        assertThatThrownBy(() -> repository.create(job("job-1", ImportJobStatus.PROCESSING)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void returnedJobsAreCopies() {
        repository.create(job("job-1", ImportJobStatus.PROCESSING));

        repository.findById("job-1").orElseThrow().setStatus(ImportJobStatus.COMPLETED);

        assertThat(repository.findById("job-1").orElseThrow().getStatus()).isEqualTo(ImportJobStatus.PROCESSING);
    }

    @Test
    void transitionAppliesWhenStatusMatches() {
        repository.create(job("job-1", ImportJobStatus.PROCESSING));

        Optional<ImportJob> updated = repository.transition("job-1", ImportJobStatus.PROCESSING,
                job -> job.toBuilder().status(ImportJobStatus.FAILED).errorMessage("boom").build());

        assertThat(updated).isPresent();
        ImportJob stored = repository.findById("job-1").orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(ImportJobStatus.FAILED);
        assertThat(stored.getErrorMessage()).isEqualTo("boom");
        assertThat(stored.getUpdatedAt()).isAfter(CREATED_AT);
    }

    @Test
    void transitionIsSkippedWhenStatusDiffers() {
        repository.create(job("job-1", ImportJobStatus.FAILED));

        Optional<ImportJob> updated = repository.transition("job-1", ImportJobStatus.PROCESSING,
                job -> job.toBuilder().status(ImportJobStatus.READY).build());

        assertThat(updated).isEmpty();
        assertThat(repository.findById("job-1").orElseThrow().getStatus()).isEqualTo(ImportJobStatus.FAILED);
    }

    @Test
    void transitionOfUnknownJobIsSkipped() {
        assertThat(repository.transition("missing", ImportJobStatus.PROCESSING,
                job -> job.toBuilder().status(ImportJobStatus.READY).build())).isEmpty();
    }

    @Test
    void illegalTransitionIsRejected() {
        repository.create(job("job-1", ImportJobStatus.PROCESSING));

        assertThatThrownBy(() -> repository.transition("job-1", ImportJobStatus.PROCESSING,
                job -> job.toBuilder().status(ImportJobStatus.COMPLETED).build()))
                .isInstanceOf(IllegalStateException.class);
        assertThat(repository.findById("job-1").orElseThrow().getStatus()).isEqualTo(ImportJobStatus.PROCESSING);
    }

    @Test
    void failingUpdateLeavesJobUnchanged() {
        repository.create(job("job-1", ImportJobStatus.READY));

        assertThatThrownBy(() -> repository.transition("job-1", ImportJobStatus.READY, job -> {
            throw new IllegalArgumentException("write failed");
        })).isInstanceOf(IllegalArgumentException.class);

        assertThat(repository.findById("job-1").orElseThrow().getStatus()).isEqualTo(ImportJobStatus.READY);
    }

    @Test
    void onlyOneConcurrentTransitionWins() throws Exception {
        repository.create(job("job-1", ImportJobStatus.PROCESSING));
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();

        try {
            for (int i = 0; i < threads; i++) {
                ImportJobStatus target = i % 2 == 0 ? ImportJobStatus.READY : ImportJobStatus.FAILED;
                results.add(executor.submit(() -> {
                    start.await();
                    return repository.transition("job-1", ImportJobStatus.PROCESSING,
                            job -> job.toBuilder().status(target).build()).isPresent();
                }));
            }
            start.countDown();

            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertThat(winners).isEqualTo(1);
            assertThat(repository.findById("job-1").orElseThrow().getStatus())
                    .isIn(ImportJobStatus.READY, ImportJobStatus.FAILED);
        } finally {
            executor.shutdownNow();
        }
    }

    private static ImportJob job(String id, ImportJobStatus status) {
        return ImportJob.builder()
                .id(id)
                .storeId("store-1")
                .originalFilename("menu.csv")
                .fileType(MenuFileType.CSV)
                .fileKey("imports/store-1/" + id + ".csv")
                .status(status)
                .createdAt(CREATED_AT)
                .updatedAt(CREATED_AT)
                .build();
    }
}
