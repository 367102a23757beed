package com.smartroom.booking.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Executor for multi-room availability queries. Each room is computed independently.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "availabilityExecutor")
    public Executor availabilityExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("availability-");
        executor.initialize();
        return executor;
    }
}
