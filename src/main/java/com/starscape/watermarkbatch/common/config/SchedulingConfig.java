package com.starscape.watermarkbatch.common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Enables @Scheduled housekeeping and provides the thread pools behind batch monitoring.
 * 
 * - batchMonitorScheduler runs one recurring tick per active batch session
 * - batchFetchExecutor runs the batch and item reads of a tick in parallel
 */
@Configuration
@EnableScheduling
public class SchedulingConfig {
    
    @Bean("batchMonitorScheduler")
    public TaskScheduler batchMonitorScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("batch-monitor-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }
    
    @Bean("batchFetchExecutor")
    public AsyncTaskExecutor batchFetchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(32);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("batch-fetch-");
        executor.initialize();
        return executor;
    }
}
