package com.fitcycle.backend.plan.dto;

import com.fitcycle.backend.plan.model.DayType;
import com.fitcycle.backend.plan.model.MacroTarget;
import com.fitcycle.backend.plan.model.PlanSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

public record PlanSummaryDto(
        long version,
        List<String> cycleOrder,
        List<String> workoutKeys,
        Map<DayType, MacroTarget> macros,
        Instant loadedAt
) {
    public static PlanSummaryDto of(PlanSnapshot s) {
        return new PlanSummaryDto(
                s.version(),
                s.cycleOrder(),
                List.copyOf(new TreeSet<>(s.workouts().keySet())),
                s.macros(),
                s.loadedAt()
        );
    }
}
