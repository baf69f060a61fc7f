package com.fitcycle.backend.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.telegram")
public class TelegramProperties {

    private String botToken;

    /** auth_date 最多可以多舊；0 = 不檢查 */
    private Duration initDataMaxAge = Duration.ofDays(1);

    public String getBotToken() { return botToken; }
    public void setBotToken(String botToken) { this.botToken = botToken; }

    public Duration getInitDataMaxAge() { return initDataMaxAge; }
    public void setInitDataMaxAge(Duration initDataMaxAge) { this.initDataMaxAge = initDataMaxAge; }
}
