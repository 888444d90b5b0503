package com.eyelevel.labmigrator.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool that imports project groups. Its size bounds the number of groups talking to eLabFTW at
 * the same time.
 */
@Configuration
public class TaskExecutorConfig {

    @Bean("importTaskExecutor")
    public AsyncTaskExecutor importTaskExecutor(MigrationConfig migrationConfig) {
        int poolSize = Math.max(1, migrationConfig.getImport().getMaxConcurrentGroups());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setThreadNamePrefix("import-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
