package com.example.styleverify.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared infrastructure beans for the comparison pipeline.
 */
@Configuration
public class ComparisonConfig {

    /**
     * Fixed worker pool on which matched context pairs are compared in parallel.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService comparisonExecutor(StyleVerifyProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "style-compare-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(properties.comparison().effectiveParallelism(), threadFactory);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
