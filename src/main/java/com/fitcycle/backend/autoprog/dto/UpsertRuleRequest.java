package com.fitcycle.backend.autoprog.dto;

/** 欄位驗證在 AutoprogRuleService，不合法整筆回 422 */
public record UpsertRuleRequest(
        String workoutKey,
        String exerciseName,
        String deltaText,
        Integer intervalDays
) {}
