package com.fitcycle.backend.plan.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.plan")
public class PlanProperties {

    /** DB 沒有任何 snapshot 時用的預設計畫（classpath） */
    private String seedResource = "plan/default-plan.json";

    private Sheet sheet = new Sheet();

    public String getSeedResource() { return seedResource; }
    public void setSeedResource(String seedResource) { this.seedResource = seedResource; }

    public Sheet getSheet() { return sheet; }
    public void setSheet(Sheet sheet) { this.sheet = sheet; }

    public static class Sheet {

        /** 可以填 sheet id，也可以直接貼整條網址 */
        private String id;

        private String gidPlan = "0";
        private String gidMacros;
        private String gidCycle;

        private String baseUrl = "https://docs.google.com";
        private Duration connectTimeout = Duration.ofSeconds(3);
        private Duration readTimeout = Duration.ofSeconds(10);

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getGidPlan() { return gidPlan; }
        public void setGidPlan(String gidPlan) { this.gidPlan = gidPlan; }

        public String getGidMacros() { return gidMacros; }
        public void setGidMacros(String gidMacros) { this.gidMacros = gidMacros; }

        public String getGidCycle() { return gidCycle; }
        public void setGidCycle(String gidCycle) { this.gidCycle = gidCycle; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

        public Duration getReadTimeout() { return readTimeout; }
        public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }
    }
}
