package com.smartmoneyradar.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Scheduler pool for @Scheduled jobs: WalletPollingJob, ValuationCheckJob, CheckpointFlushJob, RetentionCleanupJob.
 * Polling runs long (rate-limited), so valuation ticks get their own thread.
 */
@Configuration
@EnableScheduling
public class SchedulerConfig {

    public static final String SCHEDULER_POOL = "scheduler-pool";

    @Bean(name = SCHEDULER_POOL)
    public ThreadPoolTaskScheduler schedulerPool() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(4);
        s.setThreadNamePrefix("scheduler-");
        s.initialize();
        return s;
    }

    /** Wall clock shared by the engine, the valuation scheduler and the jobs. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
