package com.example.mosaicgen.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Пул потоков для фоновой генерации мозаик.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "mosaic.executor")
public class AsyncConfig {

    private int corePoolSize = 2;
    private int maxPoolSize = 4;
    private int queueCapacity = 20;

    @Bean(name = "mosaicExecutor")
    public TaskExecutor mosaicExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("mosaic-gen-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
