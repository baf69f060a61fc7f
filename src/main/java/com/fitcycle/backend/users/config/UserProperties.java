package com.fitcycle.backend.users.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.user")
public class UserProperties {

    /** 使用者沒設定時區時使用 */
    private String defaultTimezone = "Europe/Moscow";

    public String getDefaultTimezone() { return defaultTimezone; }
    public void setDefaultTimezone(String defaultTimezone) { this.defaultTimezone = defaultTimezone; }
}
