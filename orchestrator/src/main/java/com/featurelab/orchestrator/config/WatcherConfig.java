package com.featurelab.orchestrator.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Infrastructure beans for the completion watcher.
 *
 * Watcher callbacks touch the database and the notification channel, so
 * they get their own small pool instead of running on a worker thread.
 */
@Configuration
public class WatcherConfig {

    @Bean(name = "watcherExecutor")
    public ThreadPoolTaskExecutor watcherExecutor(@Value("${featurelab.watcher.threads:2}") int threads) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("featureset-watcher-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
