package com.fitcycle.backend.cycle;

import com.fitcycle.backend.plan.model.DayType;

public record CyclePosition(
        int position,
        String workoutKey,
        DayType dayType
) {}
