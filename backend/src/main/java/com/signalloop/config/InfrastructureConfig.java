package com.signalloop.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Clock and worker pools shared by the ingestion and scoring paths.
 */
@Configuration
public class InfrastructureConfig {

    private static final Logger log = LoggerFactory.getLogger(InfrastructureConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService scoringExecutor(SignalLoopProperties properties) {
        int threads = Math.max(1, properties.getScoring().getWorkerThreads());
        log.info("Initializing candidate scoring pool with {} worker(s)", threads);
        return Executors.newFixedThreadPool(threads, namedDaemonThreads("signalloop-scoring"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService ingestionExecutor(SignalLoopProperties properties) {
        int threads = Math.max(1, properties.getIngestion().getConcurrency());
        log.info("Initializing metrics ingestion pool with {} worker(s)", threads);
        return Executors.newFixedThreadPool(threads, namedDaemonThreads("signalloop-ingestion"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService scrapeAttemptExecutor() {
        return Executors.newCachedThreadPool(namedDaemonThreads("signalloop-scrape-attempt"));
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
