package com.fitcycle.backend.autoprog.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.autoprog")
public class AutoprogProperties {

    /** 排程開關（test profile 本來就不開排程） */
    private boolean enabled = true;

    /** 每天 06:00 跑一次 */
    private String cron = "0 0 6 * * *";

    /** cron 本身的時區；每位使用者的 today 仍依自己的時區計算 */
    private String zone = "Europe/Moscow";

    /** 建規則時沒給 interval 的預設天數 */
    private int defaultIntervalDays = 7;

    /** 每頁掃幾個使用者 */
    private int pageSize = 500;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getCron() { return cron; }
    public void setCron(String cron) { this.cron = cron; }

    public String getZone() { return zone; }
    public void setZone(String zone) { this.zone = zone; }

    public int getDefaultIntervalDays() { return defaultIntervalDays; }
    public void setDefaultIntervalDays(int defaultIntervalDays) { this.defaultIntervalDays = defaultIntervalDays; }

    public int getPageSize() { return pageSize; }
    public void setPageSize(int pageSize) { this.pageSize = pageSize; }
}
