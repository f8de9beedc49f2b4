package com.example.framegen_backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool behind {@link com.example.framegen_backend.service.HtmlFrameGenerator#generateFrameAsync}.
 * Size it to the number of browser processes the host can run side by side.
 */
@Configuration
public class FrameExecutorConfig {

    @Bean(name = "frameTaskExecutor")
    public ThreadPoolTaskExecutor frameTaskExecutor(FrameProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(1, properties.getExecutor().getThreads());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(properties.getExecutor().getQueueCapacity());
        executor.setThreadNamePrefix("frame-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
