package com.framescan.framescan.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for session work. Coordinators get a thread each for the lifetime
 * of their session; on-demand frame requests share a small pool so the WebSocket
 * receive path never blocks on decoding.
 */
@Configuration
public class ExecutorConfig {

    @Bean(name = "coordinatorExecutor")
    public ThreadPoolTaskExecutor coordinatorExecutor(ScanProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.min(4, properties.getScan().getMaxSessions()));
        executor.setMaxPoolSize(properties.getScan().getMaxSessions());
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("coordinator-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean(name = "frameRequestExecutor")
    public ThreadPoolTaskExecutor frameRequestExecutor(ScanProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(1, properties.getScan().getFrameRequestThreads());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(256);
        executor.setThreadNamePrefix("frame-req-");
        executor.initialize();
        return executor;
    }
}
