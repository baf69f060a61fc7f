package com.fitcycle.backend.plan.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record DayContent(
        String title,
        Map<Level, List<ExerciseEntry>> levels
) {
    public DayContent {
        Map<Level, List<ExerciseEntry>> copy = new EnumMap<>(Level.class);
        for (Level l : Level.values()) {
            List<ExerciseEntry> src = (levels == null) ? null : levels.get(l);
            // null 項目保留，由 PlanStore 驗證回 EXERCISE_NAME_BLANK
            copy.put(l, src == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(src)));
        }
        levels = Map.copyOf(copy);
    }

    public List<ExerciseEntry> exercises(Level level) {
        return levels.getOrDefault(level, List.of());
    }
}
