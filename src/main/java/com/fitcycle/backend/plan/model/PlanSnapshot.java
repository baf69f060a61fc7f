package com.fitcycle.backend.plan.model;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 已驗證、不可變的計畫版本。每次 sync 產生新的一份，舊的沒人引用就自然被 GC。
 */
public record PlanSnapshot(
        long version,
        List<String> cycleOrder,
        Map<String, DayContent> workouts,
        Map<DayType, MacroTarget> macros,
        Instant loadedAt
) {
    /** cycle 裡代表休息日的保留 key（大小寫不敏感） */
    public static final String REST_KEY = "rest";

    public PlanSnapshot {
        cycleOrder = List.copyOf(cycleOrder);
        workouts = Map.copyOf(workouts);
        macros = Map.copyOf(macros);
    }

    public int cycleLength() {
        return cycleOrder.size();
    }

    public Optional<DayContent> dayContent(String workoutKey) {
        if (workoutKey == null) return Optional.empty();
        return Optional.ofNullable(workouts.get(workoutKey));
    }

    public Optional<MacroTarget> macrosFor(DayType dayType) {
        return Optional.ofNullable(macros.get(dayType));
    }

    public static boolean isReservedRestKey(String workoutKey) {
        return workoutKey != null && REST_KEY.equals(workoutKey.trim().toLowerCase(Locale.ROOT));
    }
}
