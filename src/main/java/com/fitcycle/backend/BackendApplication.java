package com.fitcycle.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
public class BackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(BackendApplication.class, args);
    }

    /**
     * 測試環境不啟動排程，autoprog 由測試直接呼叫 engine
     */
    @Configuration
    @Profile("!test")
    @EnableScheduling
    static class SchedulingEnabledConfig {
    }
}
