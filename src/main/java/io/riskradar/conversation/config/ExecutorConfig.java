package io.riskradar.conversation.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ExecutorConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService scoringExecutor(RiskDetectionConfig config) {
        int threads = config.processing().parallelism();
        AtomicInteger counter = new AtomicInteger();

        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "risk-scoring-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };

        return new ThreadPoolExecutor(
                threads,
                threads,
                60L, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(threads * 16),
                threadFactory,
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
    }
}
