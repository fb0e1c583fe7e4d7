package com.menuvo.menuImport.job.service;

import com.menuvo.menuImport.job.exception.JobNotFoundException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ImportJobDispatcherTest {

    @Mock
    private ImportJobProcessor processor;

    @Test
    void dispatchRunsProcessor() throws Exception {
        ImportJobDispatcher dispatcher = new ImportJobDispatcher(processor, Runnable::run, Duration.ofMinutes(5));

        dispatcher.dispatch("job-1").get(5, TimeUnit.SECONDS);

        verify(processor).processImportJob("job-1");
        verify(processor, never()).markFailed(anyString(), anyString());
    }

    @Test
    void processorErrorFailsTheJob() throws Exception {
        doThrow(new JobNotFoundException("job-1")).when(processor).processImportJob("job-1");
        ImportJobDispatcher dispatcher = new ImportJobDispatcher(processor, Runnable::run, Duration.ofMinutes(5));

        Void result = dispatcher.dispatch("job-1").get(5, TimeUnit.SECONDS);

        assertThat(result).isNull();
        verify(processor).markFailed("job-1", "Import job not found: job-1");
    }

    @Test
    void jobRunningPastDeadlineIsFailed() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(invocation -> {
            release.await(10, TimeUnit.SECONDS);
            return null;
        }).when(processor).processImportJob("job-1");
        ExecutorService executor = Executors.newSingleThreadExecutor();

        try {
            ImportJobDispatcher dispatcher = new ImportJobDispatcher(processor, executor, Duration.ofSeconds(1));

            dispatcher.dispatch("job-1").get(5, TimeUnit.SECONDS);

            verify(processor).markFailed("job-1", "Import timed out after 1 seconds");
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }
}
