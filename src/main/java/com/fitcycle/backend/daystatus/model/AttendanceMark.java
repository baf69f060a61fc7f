package com.fitcycle.backend.daystatus.model;

import com.fitcycle.backend.plan.model.DayType;

/** 出勤表上顯示的狀態：還在 PLANNED 的休息日顯示成 REST */
public enum AttendanceMark {
    PLANNED,
    DONE,
    SKIPPED,
    REST;

    public static AttendanceMark of(DayType dayType, DayStatus status) {
        if (status == DayStatus.PLANNED && dayType == DayType.REST) return REST;
        return valueOf(status.name());
    }
}
