package com.fitcycle.backend.plan.web;

/**
 * 計畫本身不可用（空 cycle、缺 macros、尚未載入、沒有起始日）。
 * 對 assemble 是致命錯誤，API 一律回 503 PLAN_UNAVAILABLE，不做任何猜測預設值。
 */
public class PlanConfigurationException extends RuntimeException {

    private final String code;

    public PlanConfigurationException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String code() { return code; }
}
