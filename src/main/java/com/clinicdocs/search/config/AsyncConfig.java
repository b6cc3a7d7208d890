package com.clinicdocs.search.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Slf4j
@Configuration
public class AsyncConfig {

    /**
     * Fixed-size pool shared by every batch, so concurrent OCR and storage calls never exceed
     * {@code app.ingestion.max-workers} regardless of batch size or the number of batches in flight.
     */
    @Bean(name = "ingestionTaskExecutor")
    public AsyncTaskExecutor ingestionTaskExecutor(IngestionProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.maxWorkers());
        executor.setMaxPoolSize(properties.maxWorkers());
        executor.setThreadNamePrefix("ingest-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        log.info("Ingestion worker pool initialized with {} workers", properties.maxWorkers());
        return executor;
    }
}
