package com.fitcycle.backend.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "app.admin")
public class AdminProperties {

    /** 可以呼叫 /admin/** 的 Telegram id */
    private List<Long> tgIds = new ArrayList<>();

    public List<Long> getTgIds() { return tgIds; }
    public void setTgIds(List<Long> tgIds) { this.tgIds = tgIds; }

    public boolean isAdmin(Long tgId) {
        return tgId != null && tgIds != null && tgIds.contains(tgId);
    }
}
