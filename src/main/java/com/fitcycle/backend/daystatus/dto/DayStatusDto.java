package com.fitcycle.backend.daystatus.dto;

import com.fitcycle.backend.daystatus.entity.CalendarDay;
import com.fitcycle.backend.daystatus.model.AttendanceMark;
import com.fitcycle.backend.daystatus.model.DayStatus;
import com.fitcycle.backend.plan.model.DayType;
import com.fitcycle.backend.plan.model.MacroTarget;

import java.time.LocalDate;

public record DayStatusDto(
        LocalDate date,
        DayType dayType,
        String workoutKey,
        DayStatus status,
        AttendanceMark mark,
        MacroTarget macros,
        String note
) {
    public static DayStatusDto of(CalendarDay d) {
        return new DayStatusDto(
                d.getDayDate(),
                d.getDayType(),
                d.getWorkoutKey(),
                d.getStatus(),
                AttendanceMark.of(d.getDayType(), d.getStatus()),
                new MacroTarget(d.getDayType(), d.getKcal(), d.getProtein(), d.getFat(), d.getCarbs()),
                d.getNote()
        );
    }
}
