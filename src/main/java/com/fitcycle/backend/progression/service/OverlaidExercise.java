package com.fitcycle.backend.progression.service;

import com.fitcycle.backend.plan.model.ExerciseEntry;

public record OverlaidExercise(
        ExerciseEntry entry,
        String override // nullable：沒有 progression
) {}
