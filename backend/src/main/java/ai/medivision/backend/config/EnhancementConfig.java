package ai.medivision.backend.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools of the enhancement pipeline.
 *
 * - providerCallExecutor: cached pool running bounded provider calls; timed-out calls are cancelled
 * - enhancementExecutor: fixed pool for concurrently dispatched enhancement requests
 */
@Slf4j
@Configuration
public class EnhancementConfig {

    @Bean(name = "providerCallExecutor", destroyMethod = "shutdownNow")
    public ExecutorService providerCallExecutor() {
        return Executors.newCachedThreadPool(namedThreads("analysis-provider-"));
    }

    @Bean(name = "enhancementExecutor", destroyMethod = "shutdown")
    public ExecutorService enhancementExecutor(
            @Value("${image.enhancement.worker-threads:4}") int workerThreads) {
        int threads = Math.max(1, workerThreads);
        log.info("Creating enhancement worker pool with {} threads", threads);
        return Executors.newFixedThreadPool(threads, namedThreads("image-enhancement-"));
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger(1);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
