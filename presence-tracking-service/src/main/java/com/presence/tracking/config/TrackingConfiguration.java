package com.presence.tracking.config;

import java.time.Clock;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Infrastructure beans for the tracking engine: the clock that stamps ticks and the worker pool
 * that processes the devices of one tick in parallel.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class TrackingConfiguration {

    private final TrackingProperties trackingProperties;

    // Keep reference to executor for graceful shutdown
    private ThreadPoolTaskExecutor trackingExecutor;

    @Bean
    public Clock trackingClock() {
        return Clock.systemUTC();
    }

    /**
     * Bounded worker pool for per-device processing. When the queue is full the scheduler thread
     * runs the device itself, so a tick is never dropped.
     */
    @Bean(name = "trackingExecutor")
    public ThreadPoolTaskExecutor trackingExecutor() {
        TrackingProperties.Scheduler scheduler = trackingProperties.getScheduler();

        trackingExecutor = new ThreadPoolTaskExecutor();
        trackingExecutor.setCorePoolSize(scheduler.getWorkers());
        trackingExecutor.setMaxPoolSize(scheduler.getWorkers());
        trackingExecutor.setQueueCapacity(scheduler.getQueueCapacity());
        trackingExecutor.setThreadNamePrefix("tracking-worker-");
        trackingExecutor.setKeepAliveSeconds(60);
        trackingExecutor.setAllowCoreThreadTimeOut(true);
        trackingExecutor.setRejectedExecutionHandler(new CallerRunsWithWarningHandler());
        trackingExecutor.setWaitForTasksToCompleteOnShutdown(true);
        trackingExecutor.setAwaitTerminationSeconds(10);
        trackingExecutor.initialize();

        log.info("Initialized tracking executor - workers: {}, queueCapacity: {}, parallelDevices: {}",
            scheduler.getWorkers(), scheduler.getQueueCapacity(), scheduler.isParallelDevices());

        return trackingExecutor;
    }

    @PreDestroy
    public void shutdown() {
        if (trackingExecutor == null) {
            return;
        }
        ThreadPoolExecutor executor = trackingExecutor.getThreadPoolExecutor();
        log.info("Shutting down tracking executor - Queue size: {}, Active threads: {}",
            executor.getQueue().size(), executor.getActiveCount());
        try {
            trackingExecutor.shutdown();
            if (!executor.awaitTermination(15, TimeUnit.SECONDS)) {
                log.warn("Tracking workers did not finish within 15 seconds, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.warn("Shutdown interrupted, forcing immediate termination");
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Runs the rejected device task on the submitting thread and logs the overflow. After shutdown
     * the task is rejected so the caller can run it itself.
     */
    private static class CallerRunsWithWarningHandler implements RejectedExecutionHandler {

        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            if (executor.isShutdown()) {
                throw new RejectedExecutionException("Tracking executor is shut down");
            }
            log.warn("Tracking worker queue is full - running device on caller thread. " +
                    "Active threads: {}, Queue size: {}", executor.getActiveCount(), executor.getQueue().size());
            r.run();
        }
    }
}
