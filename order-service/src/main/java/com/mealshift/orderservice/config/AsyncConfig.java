package com.mealshift.orderservice.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor for event fan-out. Delivery is best effort: when the queue is full the
 * event is dropped and logged instead of blocking the publishing request.
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Bean(name = "fanoutExecutor")
    public ThreadPoolTaskExecutor fanoutExecutor(MealshiftProperties properties) {
        MealshiftProperties.FanoutSettings fanout = properties.getFanout();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(fanout.getCorePoolSize());
        executor.setMaxPoolSize(fanout.getMaxPoolSize());
        executor.setQueueCapacity(fanout.getQueueCapacity());
        executor.setThreadNamePrefix("fanout-");
        executor.setRejectedExecutionHandler((task, pool) ->
                log.warn("Fan-out queue full, dropping event delivery: queued={}", pool.getQueue().size()));
        executor.initialize();
        return executor;
    }
}
