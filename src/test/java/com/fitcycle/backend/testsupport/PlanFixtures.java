package com.fitcycle.backend.testsupport;

import com.fitcycle.backend.plan.model.DayContent;
import com.fitcycle.backend.plan.model.DayType;
import com.fitcycle.backend.plan.model.ExerciseEntry;
import com.fitcycle.backend.plan.model.Level;
import com.fitcycle.backend.plan.model.MacroTarget;
import com.fitcycle.backend.plan.model.PlanDefinition;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class PlanFixtures {

    private PlanFixtures() {}

    public static final MacroTarget TRAIN_MACROS = new MacroTarget(DayType.TRAIN, 2400, 160, 70, 280);
    public static final MacroTarget REST_MACROS = new MacroTarget(DayType.REST, 2000, 150, 70, 190);

    public static Map<DayType, MacroTarget> macros() {
        return Map.of(DayType.TRAIN, TRAIN_MACROS, DayType.REST, REST_MACROS);
    }

    public static DayContent day(String title, String... exerciseNames) {
        List<ExerciseEntry> medium = java.util.Arrays.stream(exerciseNames)
                .map(n -> new ExerciseEntry(n, 3, "10", null))
                .toList();
        return new DayContent(title, Map.of(Level.MEDIUM, medium));
    }

    /** cycle = [A, rest, B]，A 有 Squat / Bench，B 有 Deadlift */
    public static PlanDefinition abPlan() {
        Map<String, DayContent> workouts = new LinkedHashMap<>();
        workouts.put("A", day("Day A", "Squat", "Bench"));
        workouts.put("B", day("Day B", "Deadlift"));
        return new PlanDefinition(List.of("A", "rest", "B"), workouts, macros());
    }
}
