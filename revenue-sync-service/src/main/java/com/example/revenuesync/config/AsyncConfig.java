package com.example.revenuesync.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Bounded executor for the extraction side of the pipeline.
 *
 * One run uses one producer task (extract, map, batch) while the calling thread
 * dispatches. The pool is small and its queue bounded; a rejected submission means a
 * second run was started in the same process, which the run lock should already prevent.
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Bean(name = "syncTaskExecutor")
    public ThreadPoolTaskExecutor syncTaskExecutor(
            @Value("${sync.async.core-pool-size:1}") int corePoolSize,
            @Value("${sync.async.max-pool-size:2}") int maxPoolSize,
            @Value("${sync.async.queue-capacity:0}") int queueCapacity,
            @Value("${sync.async.thread-name-prefix:sync-producer-}") String threadNamePrefix) {

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(threadNamePrefix);

        // AbortPolicy: never run the producer on the dispatching thread, that would deadlock on the batch queue
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);

        executor.setTaskDecorator(new MdcTaskDecorator());

        executor.initialize();

        log.info("Initialized syncTaskExecutor - core={}, max={}, queue={}, prefix='{}'",
                corePoolSize, maxPoolSize, queueCapacity, threadNamePrefix);

        return executor;
    }
}
