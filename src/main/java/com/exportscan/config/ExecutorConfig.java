package com.exportscan.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executor used to split large strategy passes into concurrently evaluated chunks.
 */
@Configuration
@Slf4j
public class ExecutorConfig {

    @Value("${app.executor.matching-threads:4}")
    private int matchingThreads;

    @Bean(name = "matchingExecutor", destroyMethod = "shutdown")
    public ExecutorService matchingExecutor() {
        int threads = Math.max(1, matchingThreads);
        log.info("Creating matching executor with {} threads and MDC propagation", threads);
        AtomicInteger sequence = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "matching-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return new MdcAwareExecutorService(Executors.newFixedThreadPool(threads, factory));
    }
}
