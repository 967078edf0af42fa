package com.screenstreamer.screenstreamer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Threads that serve MJPEG viewers. Each open /stream response holds one
 * thread for its whole lifetime, so the queue is direct hand-off.
 */
@Configuration
public class StreamingConfig {

    @Bean(name = "mjpegStreamExecutor")
    public ThreadPoolTaskExecutor mjpegStreamExecutor(ScreenStreamerProperties properties) {
        int maxConnections = properties.getStream().getMaxConnections();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.min(4, maxConnections));
        executor.setMaxPoolSize(maxConnections);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("mjpeg-");
        executor.setDaemon(true);
        executor.initialize();
        return executor;
    }
}
