package com.evermark.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pool for asynchronous reconciles (pushed batches, backfill submissions). Same-account work is still
 * serialized by the reconciler's account lock.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String RECONCILE_EXECUTOR = "reconcile-executor";

    @Bean(name = RECONCILE_EXECUTOR)
    public Executor reconcileExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(8);
        e.setQueueCapacity(1_000);
        e.setThreadNamePrefix("reconcile-");
        e.initialize();
        return e;
    }
}
