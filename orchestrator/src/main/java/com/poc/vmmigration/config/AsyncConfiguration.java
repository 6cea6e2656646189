package com.poc.vmmigration.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for migrations started in asynchronous mode.
 */
@Configuration
@RequiredArgsConstructor
public class AsyncConfiguration {

    public static final String MIGRATION_EXECUTOR = "migrationTaskExecutor";

    private final MigrationProperties properties;

    @Bean(name = MIGRATION_EXECUTOR)
    public TaskExecutor migrationTaskExecutor() {
        MigrationProperties.ExecutorConfig config = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getCorePoolSize());
        executor.setMaxPoolSize(config.getMaxPoolSize());
        executor.setQueueCapacity(config.getQueueCapacity());
        executor.setThreadNamePrefix("migration-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
