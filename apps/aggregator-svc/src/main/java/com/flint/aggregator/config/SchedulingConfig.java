package com.flint.aggregator.config;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class SchedulingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs {@code @Scheduled} jobs. Declared explicitly so the snapshot job never lands on the quote
     * ticker below.
     */
    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("flint-job-");
        return scheduler;
    }

    /**
     * Ticker for the quote polling loop. A tick blocks until its fan-out has settled.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService pricingScheduler() {
        return Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("quote-poll-"));
    }
}
