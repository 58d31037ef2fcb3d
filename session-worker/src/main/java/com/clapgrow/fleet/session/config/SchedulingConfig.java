package com.clapgrow.fleet.session.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Scheduler for delayed session work (pairing-code requests, reconnect backoff,
 * startup connect-all) and the clock used for session timestamps.
 */
@Configuration
public class SchedulingConfig {

    @Value("${fleet.scheduler.pool-size:4}")
    private int poolSize;

    @Bean
    public ThreadPoolTaskScheduler sessionTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("session-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
