package com.menuvo.menuImport.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pool for background import jobs.
 */
@Slf4j
@Configuration
public class ImportJobExecutorConfig {

    @Bean(name = "importJobExecutor", destroyMethod = "shutdown")
    public ExecutorService importJobExecutor(@Value("${menu-import.job.worker-threads:2}") int workerThreads) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "menu-import-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        log.info("Import job worker pool created - threads: {}", workerThreads);
        return Executors.newFixedThreadPool(workerThreads, threadFactory);
    }
}
