package com.fitcycle.backend.plan.model;

public record MacroTarget(
        DayType dayType,
        int kcal,
        int protein,
        int fat,
        int carbs
) {}
