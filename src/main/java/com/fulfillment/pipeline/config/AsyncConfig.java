package com.fulfillment.pipeline.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executors for fulfillment runs and for the individual downstream calls they make. With
 * {@code fulfillment.executor.inline=true} runs execute on the dispatching thread.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Bean(name = "fulfillmentExecutor")
    public TaskExecutor fulfillmentExecutor(
            @Value("${fulfillment.executor.inline:false}") boolean inline,
            @Value("${fulfillment.executor.core-pool-size:4}") int corePoolSize,
            @Value("${fulfillment.executor.max-pool-size:16}") int maxPoolSize,
            @Value("${fulfillment.executor.queue-capacity:500}") int queueCapacity) {
        if (inline) {
            log.info("Fulfillment runs execute inline on the dispatching thread");
            return new SyncTaskExecutor();
        }
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("fulfillment-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        log.info("Fulfillment executor: core={}, max={}, queue={}", corePoolSize, maxPoolSize, queueCapacity);
        return executor;
    }

    /**
     * Runs each downstream attempt so the time limiter can interrupt it on timeout. A full queue
     * rejects the attempt, which counts as a failed try.
     */
    @Bean(name = "downstreamCallExecutor", destroyMethod = "shutdownNow")
    public ExecutorService downstreamCallExecutor(
            @Value("${fulfillment.executor.downstream-pool-size:32}") int poolSize,
            @Value("${fulfillment.executor.downstream-queue-capacity:200}") int queueCapacity) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "downstream-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        ThreadPoolExecutor executor = new ThreadPoolExecutor(poolSize, poolSize, 60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queueCapacity), threadFactory, new ThreadPoolExecutor.AbortPolicy());
        executor.allowCoreThreadTimeOut(true);
        log.info("Downstream call executor: threads={}, queue={}", poolSize, queueCapacity);
        return executor;
    }
}
