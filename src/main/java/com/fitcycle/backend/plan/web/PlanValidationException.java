package com.fitcycle.backend.plan.web;

/**
 * sync 列格式錯誤或規則缺欄位。整批拒絕，不做部分套用（422）。
 */
public class PlanValidationException extends RuntimeException {

    private final String code;

    public PlanValidationException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String code() { return code; }
}
