package com.eyelevel.docsummarizer.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configures the managed thread pool that runs asynchronous pipeline executions. Pool sizing is
 * configurable via application.yaml under {@code app.processing.executor}.
 */
@Slf4j
@Configuration
public class TaskExecutorConfig {

    /**
     * Creates the worker pool used by the job scheduler. A full queue rejects new runs instead of
     * blocking the submitting thread.
     *
     * @param properties The bound processing properties.
     * @return A configured AsyncTaskExecutor bean.
     */
    @Bean("jobTaskExecutor")
    public AsyncTaskExecutor jobTaskExecutor(final SummarizerProperties properties) {
        final SummarizerProperties.Executor pool = properties.getExecutor();
        log.info("Initializing job worker pool (core: {}, max: {}, queue: {}).", pool.getCorePoolSize(),
                 pool.getMaxPoolSize(), pool.getQueueCapacity());

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(pool.getCorePoolSize());
        executor.setMaxPoolSize(pool.getMaxPoolSize());
        executor.setQueueCapacity(pool.getQueueCapacity());
        executor.setThreadNamePrefix(pool.getThreadNamePrefix());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
