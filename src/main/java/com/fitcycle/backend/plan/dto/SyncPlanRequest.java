package com.fitcycle.backend.plan.dto;

/** 全部可省略，省略的用 app.plan.sheet.* 的設定值 */
public record SyncPlanRequest(
        String sheet,
        String gidPlan,
        String gidMacros,
        String gidCycle
) {}
