package com.sashkomusic.coverartagent.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Pool for ffmpeg runs and sidecar writes, kept off the listener thread.
 */
@Configuration
public class PendingQueueExecutorConfig {

    @Bean(name = "pendingQueueExecutor")
    public ThreadPoolTaskExecutor pendingQueueExecutor(CoverArtProperties properties) {
        int poolSize = Math.max(1, properties.getPendingExecutor().getPoolSize());

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setThreadNamePrefix("pending-cover-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
