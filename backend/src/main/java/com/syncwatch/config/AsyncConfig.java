package com.syncwatch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools for refresh waits and the probe calls they make. Each async wait holds a thread for
 * the job's lifetime, so the pools are sized for concurrent jobs, not CPU.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String REFRESH_EXECUTOR = "refresh-executor";
    public static final String REFRESH_PROBE_EXECUTOR = "refresh-probe-executor";

    @Bean(name = REFRESH_EXECUTOR)
    public Executor refreshExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(8);
        e.setQueueCapacity(100);
        e.setThreadNamePrefix("refresh-");
        e.initialize();
        return e;
    }

    /**
     * Runs status probe calls so a wait can abandon one at its deadline or on cancel.
     * No queue: an abandoned call that ignores interruption must not delay the next one.
     */
    @Bean(name = REFRESH_PROBE_EXECUTOR)
    public Executor refreshProbeExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(32);
        e.setQueueCapacity(0);
        e.setThreadNamePrefix("refresh-probe-");
        e.initialize();
        return e;
    }
}
