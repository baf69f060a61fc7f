package com.fitcycle.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableAsync
public class AsyncSchedulingConfig {

    // 單執行緒：同一時間只會有一輪 autoprog 在跑
    @Bean("autoprogExecutor")
    public TaskExecutor autoprogExecutor() {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(1);
        ex.setMaxPoolSize(1);
        ex.setQueueCapacity(4);
        ex.setThreadNamePrefix("autoprog-");
        ex.initialize();
        return ex;
    }
}
