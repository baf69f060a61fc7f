package com.fitcycle.backend.plan.model;

import java.util.List;
import java.util.Map;

/**
 * 尚未驗證的計畫內容（sheet 解析結果或上傳的 JSON）。
 * 交給 PlanStore.load 驗證通過後才會變成 PlanSnapshot。
 */
public record PlanDefinition(
        List<String> cycleOrder,
        Map<String, DayContent> workouts,
        Map<DayType, MacroTarget> macros
) {}
