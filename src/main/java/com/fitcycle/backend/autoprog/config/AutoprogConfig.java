package com.fitcycle.backend.autoprog.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(AutoprogProperties.class)
public class AutoprogConfig {}
