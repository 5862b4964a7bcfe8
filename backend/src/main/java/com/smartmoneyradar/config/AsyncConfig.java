package com.smartmoneyradar.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pool for the push path: webhook deliveries are acknowledged on the Netty thread and
 * processed on webhook-executor, so the blocking snapshot lookups never run on the event loop.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String WEBHOOK_EXECUTOR = "webhook-executor";

    @Bean(name = WEBHOOK_EXECUTOR)
    public Executor webhookExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(2);
        e.setMaxPoolSize(4);
        e.setQueueCapacity(500);
        e.setThreadNamePrefix("webhook-");
        e.initialize();
        return e;
    }
}
