package com.fitcycle.backend.today.dto;

import com.fitcycle.backend.plan.model.DayType;
import com.fitcycle.backend.plan.model.MacroTarget;

import java.time.LocalDate;

public record DayPlanView(
        LocalDate date,
        int position,
        String workoutKey,
        DayType dayType,
        MacroTarget macros,
        WorkoutView workout, // rest 日為 null
        String warning,      // 例如 WORKOUT_CONTENT_MISSING
        long planVersion
) {}
